package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.Entry;
import cal.dedup.types.Location;
import cal.dedup.types.PackId;
import cal.dedup.types.Repository;
import cal.dedup.types.Sha256;
import cal.dedup.types.SnapshotId;
import cal.prim.MalformedDataException;
import cal.prim.storage.ObjectDirectory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A {@link Repository} stored in two {@link ObjectDirectory directories}: one
 * holding packs and one holding index snapshots.  Every object is named by the
 * hex SHA-256 of its bytes, so the name doubles as an integrity check.
 *
 * <p>Entries whose names are not checksums are not part of the repository and
 * are skipped when listing.
 */
public class DirectoryRepository implements Repository {

  private static final Pattern NAME_PATTERN = Pattern.compile("[0-9a-f]{64}");

  private final ObjectDirectory packs;
  private final ObjectDirectory index;

  public DirectoryRepository(ObjectDirectory packs, ObjectDirectory index) {
    this.packs = packs;
    this.index = index;
  }

  private static Stream<String> listNames(ObjectDirectory dir) throws IOException {
    return dir.list().filter(name -> NAME_PATTERN.matcher(name).matches());
  }

  @Override
  public Stream<PackId> listPacks() throws IOException {
    return listNames(packs).map(PackId::parse);
  }

  @Override
  public Stream<SnapshotId> listIndexSnapshots() throws IOException {
    return listNames(index).map(SnapshotId::parse);
  }

  private static byte[] readVerified(ObjectDirectory dir, Sha256 id) throws IOException, MalformedDataException {
    byte[] data;
    try (InputStream in = dir.open(id.toString())) {
      data = Util.read(in);
    }
    Sha256 actual = Sha256.of(data);
    if (!actual.equals(id)) {
      throw new MalformedDataException("Object " + id + " has checksum " + actual);
    }
    return data;
  }

  // TODO: read only the tail of the pack once ObjectDirectory supports ranged reads
  @Override
  public List<Entry> readPackHeader(PackId pack) throws IOException, MalformedDataException {
    return PackFormat.readHeader(readVerified(packs, pack.hash()));
  }

  @Override
  public InputStream readIndexSnapshot(SnapshotId snapshot) throws IOException, MalformedDataException {
    return new ByteArrayInputStream(readVerified(index, snapshot.hash()));
  }

  @Override
  public SnapshotId writeIndexSnapshot(InputStream data) throws IOException {
    return new SnapshotId(store(index, Util.read(data)));
  }

  @Override
  public void deleteIndexSnapshot(SnapshotId snapshot) throws IOException {
    index.delete(snapshot.toString());
  }

  private static Sha256 store(ObjectDirectory dir, byte[] data) throws IOException {
    Sha256 id = Sha256.of(data);
    dir.createOrReplace(id.toString(), new ByteArrayInputStream(data));
    return id;
  }

  /**
   * Store a finished pack.
   *
   * @param pack a pack produced by {@link PackFormat.Builder#finish()}
   * @return the identifier of the pack
   * @throws IOException if the pack could not be written
   */
  public PackId writePack(byte[] pack) throws IOException {
    return new PackId(store(packs, pack));
  }

  public void deletePack(PackId pack) throws IOException {
    packs.delete(pack.toString());
  }

  /**
   * Read the stored bytes of one blob.
   *
   * @param location where the blob lives, e.g. from {@link Index#findBlob(cal.dedup.types.BlobHandle)}
   * @return the bytes of the blob as stored in the pack
   * @throws IOException if the pack could not be read
   * @throws MalformedDataException if the pack is damaged or too short for the entry
   */
  public byte[] readBlob(Location location) throws IOException, MalformedDataException {
    byte[] pack = readVerified(packs, location.pack().hash());
    Entry e = location.entry();
    if (e.offset() > pack.length - e.length()) {
      throw new MalformedDataException("Blob " + e.id().str() + " lies outside pack " + location.pack().str());
    }
    return Arrays.copyOfRange(pack, (int)e.offset(), (int)(e.offset() + e.length()));
  }

}
