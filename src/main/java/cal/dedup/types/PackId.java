package cal.dedup.types;

import java.util.Objects;

/**
 * The identity of a pack: the checksum of the bytes stored in the backend.
 * The index never looks inside it.
 */
public record PackId(Sha256 hash) implements Comparable<PackId> {

  public PackId {
    Objects.requireNonNull(hash);
  }

  public static PackId parse(String hex) {
    return new PackId(Sha256.parse(hex));
  }

  public String str() {
    return hash.str();
  }

  @Override
  public int compareTo(PackId o) {
    return hash.compareTo(o.hash);
  }

  @Override
  public String toString() {
    return hash.toString();
  }

}
