package cal.prim.storage;

import cal.dedup.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A directory held in memory.  Thread-safe.
 */
public class InMemoryDirectory implements ObjectDirectory {

  private final Map<String, byte[]> entries = new HashMap<>();

  @Override
  public synchronized Stream<String> list() {
    return new ArrayList<>(entries.keySet()).stream();
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    byte[] data = Util.read(stream);
    synchronized (this) {
      entries.put(name, data);
    }
  }

  @Override
  public InputStream open(String name) throws NoSuchFileException {
    byte[] data;
    synchronized (this) {
      data = entries.get(name);
    }
    if (data == null) {
      throw new NoSuchFileException(name);
    }
    return new ByteArrayInputStream(data);
  }

  @Override
  public synchronized void delete(String name) throws NoSuchFileException {
    if (entries.remove(name) == null) {
      throw new NoSuchFileException(name);
    }
  }

  /**
   * Replace the stored bytes of an entry without going through a stream.
   * Tests use this to simulate damage to stored objects.
   *
   * @param name the entry
   * @param data its new contents
   */
  public synchronized void overwrite(String name, byte[] data) {
    entries.put(name, data.clone());
  }

  public synchronized int size() {
    return entries.size();
  }

  @Override
  public synchronized String toString() {
    return entries.keySet().toString();
  }

}
