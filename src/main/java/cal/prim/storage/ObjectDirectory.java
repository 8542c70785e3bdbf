package cal.prim.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.stream.Stream;

/**
 * A flat object store that associates short string names with byte arrays.
 * To avoid confusion with the Java term "Object", implementations are called
 * "directories".
 *
 * <p>Unlike cloud object stores with eventual consistency, a directory must offer
 * read-your-writes: once {@link #createOrReplace(String, InputStream)} or
 * {@link #delete(String)} returns, {@link #list()} and {@link #open(String)} reflect
 * the change.  Writes are all-or-nothing: a reader never sees part of an object.
 *
 * <p>For testing, {@link InMemoryDirectory} keeps everything on the heap.
 */
public interface ObjectDirectory {

  /**
   * List the entries in the directory, in no particular order.  The list will
   * never contain duplicates.
   *
   * @return a stream of entry names
   * @throws IOException if the external storage could not be reached
   */
  Stream<String> list() throws IOException;

  /**
   * Create or overwrite an entry.  If this method throws, the entry either
   * keeps its old contents or has the complete new contents.
   *
   * @param name the name of the entry
   * @param stream the data to write
   * @throws IOException if the data could not be stored, or if <code>stream</code>
   *   throws an <code>IOException</code> while reading
   */
  void createOrReplace(String name, InputStream stream) throws IOException;

  /**
   * Open an entry for reading.
   *
   * @param name the entry to read
   * @return an unbuffered stream to read from
   * @throws IOException if the stream cannot be opened
   * @throws NoSuchFileException if the entry does not exist
   */
  InputStream open(String name) throws IOException;

  /**
   * Delete an entry.
   *
   * @param name the name of the entry to delete
   * @throws IOException if the entry could not be deleted
   * @throws NoSuchFileException if the entry does not exist
   */
  void delete(String name) throws IOException;

}
