package cal.dedup.types;

import cal.dedup.Util;

import java.util.Arrays;
import java.util.Objects;

/**
 * A SHA-256 checksum.  Every identifier in a repository is one of these: the
 * checksum of a blob's plaintext, of a pack's bytes, or of a serialized
 * index snapshot.
 *
 * <p>Checksums are compared as unsigned byte strings, which is also the order of
 * their hex representations.
 */
public record Sha256(byte[] bytes) implements Comparable<Sha256> {

  public static final int LENGTH = 32;

  public Sha256 {
    Objects.requireNonNull(bytes);
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("array is the wrong length to be a sha256 checksum");
    }
    bytes = bytes.clone();
  }

  public static Sha256 of(byte[] data) {
    return new Sha256(Util.sha256(data));
  }

  /**
   * Inverse of {@link #toString()}.
   *
   * @param hex 64 lower-case hex digits
   * @return the checksum
   * @throws IllegalArgumentException if <code>hex</code> is not a well-formed checksum
   */
  public static Sha256 parse(String hex) {
    return new Sha256(Util.stringToSha256(hex));
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * A shortened form for human-readable messages.
   *
   * @return the first 8 hex digits
   */
  public String str() {
    return toString().substring(0, 8);
  }

  // NOTE: Arrays use reference equality, so we need our own equals() and hashCode()

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Sha256 other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public int compareTo(Sha256 o) {
    return Arrays.compareUnsigned(bytes, o.bytes);
  }

  @Override
  public String toString() {
    return Util.sha256toString(bytes);
  }

}
