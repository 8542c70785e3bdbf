package cal.dedup.types;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The contents of one persisted index object: a set of packs and the
 * identifiers of the older index objects it replaces.  Pack order is
 * preserved as given.
 *
 * @param packs the packs described by this snapshot
 * @param supersedes the snapshots that this one makes redundant; they may be
 *                   deleted once this snapshot has been written
 */
public record IndexSnapshot(Map<PackId, Pack> packs, List<SnapshotId> supersedes) {

  public IndexSnapshot {
    packs = ImmutableMap.copyOf(packs);
    supersedes = ImmutableList.copyOf(supersedes);
  }

}
