package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.IndexSnapshot;
import cal.prim.MalformedDataException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.io.SequenceInputStream;

/**
 * A <code>VersionedIndexFormat</code> allows migration from one index format
 * to another.  It stores a version number in the serialized snapshot and
 * uses that to determine how to deserialize it.  Serialized snapshots
 * that do not have a version number are deserialized using the oldest format.
 * This class always serializes snapshots using the newest format.
 *
 * <p>As long as all snapshots are written through the oldest format or
 * through this class, it is possible to add new index formats without
 * worrying about backwards compatibility:
 * <pre>
 *   IndexFormat format = new VersionedIndexFormat(
 *       // Some snapshot may have been written using one of these old formats.
 *       // Therefore:
 *       //   - Never change the implementations of the old formats.
 *       //   - Do not remove or reorder the old formats.
 *       new JsonIndexFormatV01(),
 *       ...
 *       // Add new formats here, at the end of the list
 *       );
 * </pre>
 *
 * <p>This class assumes that the oldest format never produces a serialized
 * snapshot that starts with the byte <code>0xFF</code>.  {@link JsonIndexFormatV01}
 * writes JSON text, which satisfies this constraint.
 *
 * @see #VersionedIndexFormat(IndexFormat...)
 * @see #standard()
 */
public class VersionedIndexFormat implements IndexFormat {

  // INTERNAL DETAILS
  //
  // This format consists of a five-byte version header, followed by the
  // actual snapshot data.  The version header has a single prefix byte (0xFF)
  // followed by a 4-byte big-endian version number.
  //
  // During deserialization, if the first byte is not 0xFF, then the first
  // format is used, on the assumption that the snapshot was written before
  // this versioned format was in use.

  private static final byte PREFIX = (byte)0xFF;

  private final IndexFormat[] formats;

  /**
   * Construct a versioned format using the given formats, ordered from oldest
   * to newest.
   *
   * @param formats the known formats
   */
  public VersionedIndexFormat(IndexFormat... formats) {
    if (formats.length == 0) {
      throw new IllegalArgumentException("VersionedIndexFormat requires at least one format");
    }
    this.formats = formats.clone();
  }

  /**
   * The format that every repository should use.
   *
   * @return a format reading all known snapshot versions and writing the newest
   */
  public static VersionedIndexFormat standard() {
    return new VersionedIndexFormat(
            new JsonIndexFormatV01(),
            new JsonIndexFormatV02());
  }

  private IndexFormat oldestFormat() {
    return formats[0];
  }

  private int numberOfNewestFormat() {
    return formats.length - 1;
  }

  private IndexFormat newestFormat() {
    return formats[numberOfNewestFormat()];
  }

  private static byte[] createHeader(int version) {
    byte[] header = new byte[5];
    header[0] = PREFIX;
    Util.serializeBigEndianInt(version, header, 1);
    return header;
  }

  @Override
  public IndexSnapshot load(InputStream data) throws IOException, MalformedDataException {
    // NOTE: do not close the pushback stream; that would close the caller's stream.
    PushbackInputStream in = new PushbackInputStream(data, 1);
    int firstByte = in.read();
    if (firstByte < 0) {
      // No prefix byte?  Must have been an older format.  Let it decide what
      // to do with an empty input stream.
      return oldestFormat().load(in);
    }

    if ((byte)firstByte == PREFIX) {
      int version = Util.readBigEndianInt(in);
      if (version < 0 || version >= formats.length) {
        throw new MalformedDataException("Unknown index format version " + Integer.toUnsignedString(version));
      }
      return formats[version].load(in);
    } else {
      // The very first index format did not support versioning.  Put back the
      // byte we read and send the whole stream to the oldest version.
      in.unread(firstByte);
      return oldestFormat().load(in);
    }
  }

  @Override
  public InputStream serialize(IndexSnapshot snapshot) {
    ByteArrayInputStream headerStream = new ByteArrayInputStream(createHeader(numberOfNewestFormat()));
    InputStream indexStream = newestFormat().serialize(snapshot);
    return new SequenceInputStream(headerStream, indexStream);
  }

}
