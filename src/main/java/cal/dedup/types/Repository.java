package cal.dedup.types;

import cal.prim.MalformedDataException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Stream;

/**
 * The part of a backup repository that the index needs: enumerating packs and
 * index snapshots, reading pack trailers, and reading, writing, and removing
 * index snapshots.
 *
 * <p>Implementations do not retry failed operations.  Every
 * {@link IOException} thrown here is a fault of the underlying storage.
 */
public interface Repository {

  /**
   * List the packs in the repository, in no particular order and without duplicates.
   *
   * @return a stream of pack identifiers
   * @throws IOException if the listing could not be obtained
   */
  Stream<PackId> listPacks() throws IOException;

  /**
   * List the stored index snapshots, in no particular order and without duplicates.
   *
   * @return a stream of snapshot identifiers
   * @throws IOException if the listing could not be obtained
   */
  Stream<SnapshotId> listIndexSnapshots() throws IOException;

  /**
   * Read the trailer of a pack.
   *
   * @param pack the pack to inspect
   * @return the entries of the pack, in trailer order
   * @throws IOException if the pack could not be read
   * @throws MalformedDataException if the trailer is damaged
   */
  List<Entry> readPackHeader(PackId pack) throws IOException, MalformedDataException;

  /**
   * Open a stored index snapshot.
   *
   * @param snapshot the snapshot to read
   * @return the raw serialized bytes
   * @throws IOException if the snapshot could not be read
   * @throws java.nio.file.NoSuchFileException if the snapshot does not exist
   * @throws MalformedDataException if the stored bytes do not match the identifier
   */
  InputStream readIndexSnapshot(SnapshotId snapshot) throws IOException, MalformedDataException;

  /**
   * Store a new index snapshot.  Either the complete snapshot becomes
   * visible under the returned identifier or nothing does.
   *
   * @param data the serialized snapshot
   * @return the identifier of the new snapshot
   * @throws IOException if the snapshot could not be written
   */
  SnapshotId writeIndexSnapshot(InputStream data) throws IOException;

  /**
   * Remove a stored index snapshot.
   *
   * @param snapshot the snapshot to remove
   * @throws IOException if the snapshot could not be removed
   */
  void deleteIndexSnapshot(SnapshotId snapshot) throws IOException;

}
