package cal.dedup.types;

import java.util.Objects;

/**
 * The location of one blob inside a pack: bytes
 * <code>[offset, offset + length)</code> of the pack hold the blob.
 * The index trusts whoever produced the entry that the range lies inside the pack.
 */
public record Entry(BlobId id, BlobKind kind, long offset, long length) {

  public Entry {
    Objects.requireNonNull(id);
    Objects.requireNonNull(kind);
    if (offset < 0) {
      throw new IllegalArgumentException("negative offset " + offset + " for blob " + id.str());
    }
    if (length < 0) {
      throw new IllegalArgumentException("negative length " + length + " for blob " + id.str());
    }
  }

  public BlobHandle handle() {
    return new BlobHandle(id, kind);
  }

  @Override
  public String toString() {
    return "<" + kind.wireName() + "/" + id.str() + ", offset " + offset + ", length " + length + ">";
  }

}
