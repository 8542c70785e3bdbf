package cal.dedup.types;

import java.util.Comparator;
import java.util.Objects;

/**
 * A blob checksum together with its kind.  This pair, not the checksum alone,
 * is what identifies a logical blob.
 */
public record BlobHandle(BlobId id, BlobKind kind) implements Comparable<BlobHandle> {

  private static final Comparator<BlobHandle> ORDER =
          Comparator.comparing(BlobHandle::id).thenComparing(BlobHandle::kind);

  public BlobHandle {
    Objects.requireNonNull(id);
    Objects.requireNonNull(kind);
  }

  @Override
  public int compareTo(BlobHandle o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return kind.wireName() + ':' + id.str();
  }

}
