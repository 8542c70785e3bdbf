package cal.prim.storage;

import cal.dedup.Util;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * A directory on the local filesystem.  Each entry is one file.
 *
 * <p>Writes go to a temporary file in the same folder, which is renamed over
 * the target once it is complete, so other processes never observe half-written
 * entries.  The temporary file is flushed to disk before the rename and the
 * folder after it, so an entry that {@link #createOrReplace} returned for
 * survives a power loss.  Leftover temporary files from crashed writers are
 * ignored by {@link #list()}.
 */
public class LocalDirectory implements ObjectDirectory {

  private static final String TEMP_PREFIX = ".tmp-";

  private final Path dir;

  public LocalDirectory(Path dir) throws IOException {
    Files.createDirectories(dir);
    this.dir = dir;
  }

  @Override
  public Stream<String> list() throws IOException {
    List<String> result;
    try (Stream<Path> entries = Files.list(dir)) {
      result = entries
              .map(p -> p.getFileName().toString())
              .filter(name -> !name.startsWith(TEMP_PREFIX))
              .toList();
    }
    return result.stream();
  }

  @Override
  public void createOrReplace(String name, InputStream data) throws IOException {
    Path target = resolve(name);
    Path tmp = Files.createTempFile(dir, TEMP_PREFIX, null);
    try {
      try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
        OutputStream out = new BufferedOutputStream(Channels.newOutputStream(ch), Util.SUGGESTED_BUFFER_SIZE);
        Util.copyStream(data, out);
        out.flush();
        ch.force(true);
      }
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      syncDirectory(dir);
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException onDelete) {
        e.addSuppressed(onDelete);
      }
      throw e;
    }
  }

  /**
   * Flush a folder's own metadata, such as a rename into it, to disk.
   */
  static void syncDirectory(Path dir) throws IOException {
    try (FileChannel ch = FileChannel.open(dir, StandardOpenOption.READ)) {
      ch.force(true);
    }
  }

  @Override
  public InputStream open(String name) throws IOException {
    return Files.newInputStream(resolve(name));
  }

  @Override
  public void delete(String name) throws IOException {
    Files.delete(resolve(name));
  }

  private Path resolve(String name) {
    if (name.isEmpty() || name.startsWith(TEMP_PREFIX) || name.contains("/") || name.contains("\\") || name.equals("..") || name.equals(".")) {
      throw new IllegalArgumentException("illegal entry name '" + name + '\'');
    }
    return dir.resolve(name);
  }

  @Override
  public String toString() {
    return dir.toString();
  }

}
