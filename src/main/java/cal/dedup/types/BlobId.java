package cal.dedup.types;

import java.util.Objects;

/**
 * The identity of a blob: the checksum of its plaintext.
 */
public record BlobId(Sha256 hash) implements Comparable<BlobId> {

  public BlobId {
    Objects.requireNonNull(hash);
  }

  public static BlobId forContent(byte[] plaintext) {
    return new BlobId(Sha256.of(plaintext));
  }

  public static BlobId parse(String hex) {
    return new BlobId(Sha256.parse(hex));
  }

  public String str() {
    return hash.str();
  }

  @Override
  public int compareTo(BlobId o) {
    return hash.compareTo(o.hash);
  }

  @Override
  public String toString() {
    return hash.toString();
  }

}
