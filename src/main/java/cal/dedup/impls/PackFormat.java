package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.BlobId;
import cal.dedup.types.BlobKind;
import cal.dedup.types.Entry;
import cal.dedup.types.Sha256;
import cal.prim.MalformedDataException;
import com.google.common.collect.ImmutableList;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes packs.  A pack is a sequence of blobs followed by a
 * trailer describing them, so that the list of blobs can be recovered from
 * the end of the pack alone:
 *
 * <pre>
 *   blob 0 | blob 1 | ... | blob n-1 | header record 0 | ... | header record n-1 | header length
 * </pre>
 *
 * <p>Each header record is {@value #HEADER_RECORD_SIZE} bytes: a kind code
 * (see {@link BlobKind#code()}), the blob length as a 4-byte big-endian
 * unsigned integer, and the 32-byte blob id.  The header length is a 4-byte
 * big-endian unsigned integer counting the header records only.  Blob offsets
 * are not stored: blob <i>i</i> starts where blob <i>i-1</i> ends, and blob 0
 * starts at offset 0.
 *
 * <p>Blob bytes are stored as given; encryption, if any, is applied by
 * whoever hands the blobs to a {@link Builder}.
 */
public abstract class PackFormat {

  public static final int HEADER_RECORD_SIZE = 1 + 4 + Sha256.LENGTH;
  static final int HEADER_LENGTH_SIZE = 4;
  static final long MAX_BLOB_LENGTH = 0xFFFFFFFFL;

  private PackFormat() {
  }

  /**
   * Accumulates blobs for a new pack.  Not thread-safe.
   */
  public static class Builder {

    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final List<Entry> entries = new ArrayList<>();

    /**
     * Append a blob.  Its id is the checksum of <code>plaintext</code>.
     *
     * @param kind what the blob holds
     * @param plaintext the blob contents
     * @return the entry the blob will have in the finished pack
     */
    public Entry add(BlobKind kind, byte[] plaintext) {
      return add(BlobId.forContent(plaintext), kind, plaintext);
    }

    /**
     * Append a blob whose stored bytes differ from the bytes it was
     * identified by.
     *
     * @param id the blob id
     * @param kind what the blob holds
     * @param stored the bytes to store
     * @return the entry the blob will have in the finished pack
     */
    public Entry add(BlobId id, BlobKind kind, byte[] stored) {
      if (stored.length > MAX_BLOB_LENGTH) {
        throw new IllegalArgumentException("blob " + id.str() + " is too large for a pack");
      }
      Entry e = new Entry(id, kind, body.size(), stored.length);
      body.writeBytes(stored);
      entries.add(e);
      return e;
    }

    public List<Entry> entries() {
      return ImmutableList.copyOf(entries);
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }

    /**
     * @return the complete pack, blobs followed by the trailer
     */
    public byte[] finish() {
      ByteArrayOutputStream out = new ByteArrayOutputStream(body.size() + entries.size() * HEADER_RECORD_SIZE + HEADER_LENGTH_SIZE);
      out.writeBytes(body.toByteArray());
      byte[] record = new byte[HEADER_RECORD_SIZE];
      for (Entry e : entries) {
        record[0] = e.kind().code();
        Util.serializeBigEndianInt((int)e.length(), record, 1);
        System.arraycopy(e.id().hash().bytes(), 0, record, 5, Sha256.LENGTH);
        out.writeBytes(record);
      }
      byte[] headerLength = new byte[HEADER_LENGTH_SIZE];
      Util.serializeBigEndianInt(entries.size() * HEADER_RECORD_SIZE, headerLength, 0);
      out.writeBytes(headerLength);
      return out.toByteArray();
    }

  }

  /**
   * Recover the list of blobs from a complete pack.
   *
   * @param pack the bytes of a pack
   * @return the entries, in the order the blobs appear in the pack
   * @throws MalformedDataException if the trailer is damaged or does not describe the pack
   */
  public static List<Entry> readHeader(byte[] pack) throws MalformedDataException {
    if (pack.length < HEADER_LENGTH_SIZE) {
      throw new MalformedDataException("Pack is too short (" + pack.length + " bytes) to have a header");
    }
    long headerLength = Util.readBigEndianUnsignedInt(pack, pack.length - HEADER_LENGTH_SIZE);
    long bodyLength = pack.length - HEADER_LENGTH_SIZE - headerLength;
    if (bodyLength < 0) {
      throw new MalformedDataException("Pack header claims " + headerLength + " bytes but the pack has only " + pack.length);
    }
    if (headerLength % HEADER_RECORD_SIZE != 0) {
      throw new MalformedDataException("Pack header length " + headerLength + " is not a multiple of " + HEADER_RECORD_SIZE);
    }

    int count = (int)(headerLength / HEADER_RECORD_SIZE);
    List<Entry> entries = new ArrayList<>(count);
    long offset = 0;
    for (int i = 0; i < count; ++i) {
      int start = (int)bodyLength + i * HEADER_RECORD_SIZE;
      BlobKind kind = BlobKind.fromCode(pack[start]);
      long length = Util.readBigEndianUnsignedInt(pack, start + 1);
      BlobId id = new BlobId(new Sha256(Arrays.copyOfRange(pack, start + 5, start + HEADER_RECORD_SIZE)));
      if (offset + length > bodyLength) {
        throw new MalformedDataException("Blob " + id.str() + " extends past the end of the pack body");
      }
      entries.add(new Entry(id, kind, offset, length));
      offset += length;
    }
    return entries;
  }

}
