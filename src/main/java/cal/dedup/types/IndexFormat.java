package cal.dedup.types;

import cal.prim.MalformedDataException;

import java.io.IOException;
import java.io.InputStream;

/**
 * An <code>IndexFormat</code> implements serialization and deserialization
 * for {@link IndexSnapshot index snapshots}.  Implementations do no I/O
 * beyond the streams they are handed.
 *
 * @see #load(InputStream)
 * @see #serialize(IndexSnapshot)
 */
public interface IndexFormat {

  /**
   * Load a snapshot from an input stream.  This method does not close the
   * stream; the caller is responsible instead.
   *
   * <p>Performance note: implementations assume that the input stream
   * offers good performance for small reads.  Callers should generally
   * wrap their input in {@link java.io.BufferedInputStream} before
   * calling this method.
   *
   * @param data a stream of bytes
   * @return a deserialized snapshot
   * @throws IOException if a problem occurs while reading from the stream
   * @throws MalformedDataException if the stream contains malformed data
   */
  IndexSnapshot load(InputStream data) throws IOException, MalformedDataException;

  /**
   * Serialize a snapshot.  The returned input stream can be used to read the
   * serialized bytes.  If serialization fails, the failure is reported as an
   * {@link IOException} when the returned stream is closed.
   *
   * @param snapshot a snapshot
   * @return a stream of bytes
   */
  InputStream serialize(IndexSnapshot snapshot);

}
