package cal.dedup.types;

import cal.prim.MalformedDataException;

/**
 * What a blob holds.  The same checksum stored once as {@link #DATA} and once as
 * {@link #TREE} is two different blobs.
 */
public enum BlobKind {

  DATA("data", (byte)0),
  TREE("tree", (byte)1);

  private final String wireName;
  private final byte code;

  BlobKind(String wireName, byte code) {
    this.wireName = wireName;
    this.code = code;
  }

  /**
   * @return the name used in serialized indexes
   */
  public String wireName() {
    return wireName;
  }

  /**
   * @return the byte used in pack trailers
   */
  public byte code() {
    return code;
  }

  public static BlobKind fromWireName(String name) throws MalformedDataException {
    for (BlobKind kind : values()) {
      if (kind.wireName.equals(name)) {
        return kind;
      }
    }
    throw new MalformedDataException("Unknown blob type '" + name + '\'');
  }

  public static BlobKind fromCode(byte code) throws MalformedDataException {
    for (BlobKind kind : values()) {
      if (kind.code == code) {
        return kind;
      }
    }
    throw new MalformedDataException("Unknown blob type code " + Byte.toUnsignedInt(code));
  }

}
