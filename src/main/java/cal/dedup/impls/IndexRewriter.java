package cal.dedup.impls;

import cal.dedup.types.Entry;
import cal.dedup.types.IndexConfig;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.Pack;
import cal.dedup.types.PackId;
import cal.dedup.types.Repository;
import cal.dedup.types.SnapshotId;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Replaces the index snapshots of a repository with new ones.  Every method
 * first writes the replacement snapshot and only then deletes the snapshots
 * it supersedes.  If the process dies in between, the repository holds both,
 * and {@link Index#load} still produces the right answer.
 *
 * <p>Packs quarantined by {@link IndexConfig.InconsistentPackPolicy#QUARANTINE}
 * are left out of the replacement snapshot.  Each conflicting description of
 * such a pack is written to a small snapshot of its own before anything is
 * deleted, so the pack stays quarantined instead of disappearing.
 * {@link #rebuild()} resolves the disagreement by reading the packs themselves.
 */
public class IndexRewriter {

  private final Repository repo;
  private final IndexFormat format;
  private final IndexConfig config;

  public IndexRewriter(Repository repo, IndexFormat format, IndexConfig config) {
    this.repo = repo;
    this.format = format;
    this.config = config;
  }

  /**
   * Merge all snapshots into one.  Quarantined packs keep one snapshot per
   * conflicting description.
   *
   * @return the new snapshot, the existing one if there was only one, or null if
   *   there was nothing to merge
   */
  public @Nullable SnapshotId consolidate() throws IOException, Index.MalformedSnapshot, Index.InconsistentPack {
    Index index = Index.load(repo, format, config);
    warnAboutQuarantine(index);
    if (index.indexIds().isEmpty()) {
      System.out.println("No index snapshots to consolidate");
      return null;
    }
    if (index.indexIds().size() == 1) {
      System.out.println("Index is already a single snapshot");
      return index.indexIds().first();
    }
    Set<SnapshotId> kept = saveQuarantined(index, Set.of());
    List<SnapshotId> superseded = supersedable(index, kept);
    if (superseded.isEmpty()) {
      System.out.println("Every index snapshot records a quarantined pack; nothing to consolidate");
      return null;
    }
    System.out.println("Consolidating " + superseded.size() + " index snapshots (" + index.packs().size() + " packs)...");
    SnapshotId result = Index.save(repo, format, entriesOf(index, Set.of()), superseded);
    kept.add(result);
    deleteSuperseded(superseded, kept);
    return result;
  }

  /**
   * Discard all snapshots and write a fresh one by reading every pack.  Use this
   * when snapshots have been lost or damaged.
   *
   * @return the new snapshot
   */
  public SnapshotId rebuild() throws IOException, Index.UnreadablePack {
    List<SnapshotId> old;
    try (Stream<SnapshotId> listing = repo.listIndexSnapshots()) {
      old = listing.toList();
    }
    System.out.println("Reading all pack headers...");
    Index index = Index.rebuild(repo, config);
    System.out.println("Found " + index.packs().size() + " packs; writing new index snapshot...");
    SnapshotId result = Index.save(repo, format, entriesOf(index, Set.of()), old);
    deleteSuperseded(old, Set.of(result));
    return result;
  }

  /**
   * Remove packs from the index, for instance because they were deleted after
   * their live blobs were repacked elsewhere.
   *
   * @param packs the packs to forget; packs the index does not know are ignored
   * @return the new snapshot
   */
  public SnapshotId forgetPacks(Set<PackId> packs) throws IOException, Index.MalformedSnapshot, Index.InconsistentPack {
    Index index = Index.load(repo, format, config);
    warnAboutQuarantine(index);
    Map<PackId, List<Entry>> remaining = entriesOf(index, packs);
    Set<SnapshotId> kept = saveQuarantined(index, packs);
    List<SnapshotId> superseded = supersedable(index, kept);
    System.out.println("Forgetting " + (index.packs().size() - remaining.size()) + " packs...");
    SnapshotId result = Index.save(repo, format, remaining, superseded);
    kept.add(result);
    deleteSuperseded(superseded, kept);
    return result;
  }

  /**
   * Write one snapshot for each conflicting description of each quarantined
   * pack that is not being forgotten.  Saving is deterministic, so a record
   * written by an earlier rewrite comes back with the same id.
   *
   * @return the ids of the records
   */
  private Set<SnapshotId> saveQuarantined(Index index, Set<PackId> forgotten) throws IOException {
    Set<SnapshotId> result = new HashSet<>();
    for (Map.Entry<PackId, Pack> e : index.quarantinedDescriptions().entries()) {
      if (!forgotten.contains(e.getKey())) {
        result.add(Index.save(repo, format, Map.of(e.getKey(), e.getValue().entries()), List.of()));
      }
    }
    return result;
  }

  private static List<SnapshotId> supersedable(Index index, Set<SnapshotId> kept) {
    List<SnapshotId> result = new ArrayList<>();
    for (SnapshotId id : index.indexIds()) {
      if (!kept.contains(id)) {
        result.add(id);
      }
    }
    return result;
  }

  private static Map<PackId, List<Entry>> entriesOf(Index index, Set<PackId> excluded) {
    Map<PackId, List<Entry>> result = new TreeMap<>();
    index.packs().forEach((id, pack) -> {
      if (!excluded.contains(id)) {
        result.put(id, pack.entries());
      }
    });
    return result;
  }

  private static void warnAboutQuarantine(Index index) {
    for (PackId id : index.quarantinedPacks()) {
      System.err.println("WARNING: snapshots disagree about pack " + id + "; keeping every description of it (run a rebuild to resolve)");
    }
  }

  private void deleteSuperseded(Collection<SnapshotId> superseded, Set<SnapshotId> replacements) throws IOException {
    for (SnapshotId id : superseded) {
      // never delete the snapshots that replace them
      if (replacements.contains(id)) {
        continue;
      }
      System.out.println("Deleting superseded index snapshot " + id.str() + "...");
      try {
        repo.deleteIndexSnapshot(id);
      } catch (NoSuchFileException e) {
        System.out.println(" --> already gone");
      }
    }
  }

}
