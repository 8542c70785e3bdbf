package cal.dedup.types;

import java.util.Objects;

/**
 * The identity of a persisted index snapshot.
 */
public record SnapshotId(Sha256 hash) implements Comparable<SnapshotId> {

  public SnapshotId {
    Objects.requireNonNull(hash);
  }

  public static SnapshotId parse(String hex) {
    return new SnapshotId(Sha256.parse(hex));
  }

  public String str() {
    return hash.str();
  }

  @Override
  public int compareTo(SnapshotId o) {
    return hash.compareTo(o.hash);
  }

  @Override
  public String toString() {
    return hash.toString();
  }

}
