package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.BlobHandle;
import cal.dedup.types.Entry;
import cal.dedup.types.IndexConfig;
import cal.dedup.types.IndexConfig.InconsistentPackPolicy;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.IndexSnapshot;
import cal.dedup.types.Location;
import cal.dedup.types.Pack;
import cal.dedup.types.PackId;
import cal.dedup.types.Repository;
import cal.dedup.types.SnapshotId;
import cal.prim.MalformedDataException;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import com.google.common.collect.SetMultimap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * An <code>Index</code> records which blobs every pack in a repository holds,
 * and at what byte range.  It answers "is this blob already stored?" and
 * "which pack do I read to get this blob?" without opening any pack.
 *
 * <p>There are two ways to get an index:
 * <ul>
 *   <li>{@link #rebuild(Repository, IndexConfig)} reads the trailer of every
 *       pack in the repository.  Slow, but needs nothing except the packs.</li>
 *   <li>{@link #load(Repository, IndexFormat, IndexConfig)} merges the index
 *       snapshots previously written by {@link #save(Repository, IndexFormat, Map, Collection)}.
 *       This is the normal way to start up.</li>
 * </ul>
 *
 * <p>Both re-list the repository every time they are called.  Neither ever returns a
 * partial index: if any pack or snapshot cannot be read, the whole operation fails.
 *
 * <p>Instances of this class are immutable, and therefore thread-safe.  To see
 * changes made to the repository since an index was built, build a new one.
 *
 * <p>This class never deletes anything.  Snapshots are replaced with a two-step
 * protocol: {@link #save(Repository, IndexFormat, Map, Collection) save} a new snapshot
 * naming the snapshots it supersedes, then delete those with
 * {@link Repository#deleteIndexSnapshot(SnapshotId)}.  A crash between the two
 * steps leaves both the old and the new snapshots in place, which {@link #load}
 * tolerates.  {@link IndexRewriter} implements the protocol.
 */
public final class Index {

  /**
   * The trailer of a pack could not be read, so the index cannot know what
   * the pack holds.
   */
  public static class UnreadablePack extends Exception {
    private final PackId pack;

    public UnreadablePack(PackId pack, Throwable cause) {
      super("unable to read header of pack " + pack + ": " + cause.getMessage(), cause);
      this.pack = pack;
    }

    public PackId getPack() {
      return pack;
    }
  }

  /**
   * A stored index snapshot could not be decoded.
   */
  public static class MalformedSnapshot extends Exception {
    private final SnapshotId snapshot;

    public MalformedSnapshot(SnapshotId snapshot, MalformedDataException cause) {
      super("index snapshot " + snapshot + " is malformed: " + cause.getMessage(), cause);
      this.snapshot = snapshot;
    }

    public SnapshotId getSnapshot() {
      return snapshot;
    }
  }

  /**
   * Two index snapshots describe the same pack differently.  Since a pack is
   * named by the checksum of its contents, this indicates a damaged repository
   * or a bug in whatever wrote the snapshots, not a transport problem.
   */
  public static class InconsistentPack extends Exception {
    private final PackId pack;
    private final SnapshotId first;
    private final SnapshotId second;

    public InconsistentPack(PackId pack, SnapshotId first, SnapshotId second) {
      super("index snapshots " + first + " and " + second + " disagree about the contents of pack " + pack);
      this.pack = pack;
      this.first = first;
      this.second = second;
    }

    public PackId getPack() {
      return pack;
    }

    public SnapshotId getFirst() {
      return first;
    }

    public SnapshotId getSecond() {
      return second;
    }
  }

  private final ImmutableSortedMap<PackId, Pack> packs;
  private final ImmutableSetMultimap<BlobHandle, PackId> blobs;
  private final ImmutableSortedSet<SnapshotId> indexIds;
  private final ImmutableSetMultimap<PackId, Pack> quarantined;

  private Index(
          ImmutableSortedMap<PackId, Pack> packs,
          ImmutableSetMultimap<BlobHandle, PackId> blobs,
          ImmutableSortedSet<SnapshotId> indexIds,
          ImmutableSetMultimap<PackId, Pack> quarantined) {
    this.packs = packs;
    this.blobs = blobs;
    this.indexIds = indexIds;
    this.quarantined = quarantined;
  }

  /**
   * Accumulates packs while an index is being built.  Worker threads call into
   * it concurrently; each call adds or removes a pack together with its rows
   * in the reverse map, under one lock.
   */
  private static final class Builder {

    private final InconsistentPackPolicy policy;
    private final Map<PackId, Pack> packs = new HashMap<>();
    private final SetMultimap<BlobHandle, PackId> blobs = HashMultimap.create();
    private final Set<SnapshotId> indexIds = new HashSet<>();
    /** every distinct description seen of each quarantined pack */
    private final SetMultimap<PackId, Pack> quarantined = HashMultimap.create();

    /** the snapshot each pack was first seen in (only during {@link #load}) */
    private final Map<PackId, SnapshotId> origins = new HashMap<>();

    Builder(InconsistentPackPolicy policy) {
      this.policy = policy;
    }

    synchronized void addPack(PackId id, Pack pack) {
      Pack previous = packs.putIfAbsent(id, pack);
      if (previous != null) {
        throw new IllegalArgumentException("the pack " + id + " is already known");
      }
      for (Entry e : pack.entries()) {
        blobs.put(e.handle(), id);
      }
    }

    private void removePack(PackId id) {
      Pack pack = packs.remove(id);
      if (pack != null) {
        for (Entry e : pack.entries()) {
          blobs.remove(e.handle(), id);
        }
      }
      origins.remove(id);
    }

    synchronized void addSnapshot(SnapshotId snapshot, IndexSnapshot contents) throws InconsistentPack {
      indexIds.add(snapshot);
      for (Map.Entry<PackId, Pack> entry : contents.packs().entrySet()) {
        PackId id = entry.getKey();
        Pack pack = entry.getValue();
        if (quarantined.containsKey(id)) {
          quarantined.put(id, pack);
          continue;
        }
        Pack known = packs.get(id);
        if (known == null) {
          addPack(id, pack);
          origins.put(id, snapshot);
        } else if (!known.equals(pack)) {
          if (policy == InconsistentPackPolicy.FAIL) {
            throw new InconsistentPack(id, origins.get(id), snapshot);
          }
          removePack(id);
          quarantined.put(id, known);
          quarantined.put(id, pack);
        }
      }
    }

    synchronized Index build() {
      ImmutableSetMultimap.Builder<BlobHandle, PackId> reverse = ImmutableSetMultimap.<BlobHandle, PackId>builder()
              .orderKeysBy(Ordering.natural())
              .orderValuesBy(Ordering.natural());
      reverse.putAll(blobs);
      ImmutableSetMultimap.Builder<PackId, Pack> descriptions = ImmutableSetMultimap.<PackId, Pack>builder()
              .orderKeysBy(Ordering.natural());
      descriptions.putAll(quarantined);
      return new Index(
              ImmutableSortedMap.copyOf(packs),
              reverse.build(),
              ImmutableSortedSet.copyOf(indexIds),
              descriptions.build());
    }

  }

  /**
   * Build an index from scratch by reading the trailer of every pack in the
   * repository.  The result cites no snapshots: {@link #indexIds()} is empty.
   *
   * @param repo the repository
   * @param config how many trailers to read in parallel
   * @return an index covering every pack the repository listed
   * @throws IOException if the packs could not be listed
   * @throws UnreadablePack if any pack trailer could not be read or decoded
   */
  public static Index rebuild(Repository repo, IndexConfig config) throws IOException, UnreadablePack {
    List<PackId> ids;
    try (Stream<PackId> listing = repo.listPacks()) {
      ids = listing.distinct().toList();
    }

    Builder builder = new Builder(config.getOnInconsistentPack());
    try {
      forEachInParallel(config, "index-rebuild-%d", ids, id -> builder.addPack(id, readPack(repo, id)));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof UnreadablePack u) {
        throw u;
      }
      throw unexpected(cause);
    }
    return builder.build();
  }

  private static Pack readPack(Repository repo, PackId id) throws UnreadablePack {
    try {
      return new Pack(repo.readPackHeader(id));
    } catch (IOException | MalformedDataException e) {
      throw new UnreadablePack(id, e);
    }
  }

  /**
   * Build an index by merging every index snapshot stored in the repository.
   * Packs are not opened.  A pack that appears in several snapshots must be
   * described identically by all of them; what happens otherwise depends on
   * {@link IndexConfig#getOnInconsistentPack()}.
   *
   * @param repo the repository
   * @param format the format the snapshots are stored in
   * @param config how many snapshots to read in parallel, and what to do about inconsistent packs
   * @return an index whose {@link #indexIds()} are all the snapshots that were merged
   * @throws IOException if a snapshot could not be listed or read
   * @throws MalformedSnapshot if a snapshot could not be decoded
   * @throws InconsistentPack if two snapshots disagree about a pack and the policy is
   *   {@link InconsistentPackPolicy#FAIL}
   */
  public static Index load(Repository repo, IndexFormat format, IndexConfig config) throws IOException, MalformedSnapshot, InconsistentPack {
    List<SnapshotId> ids;
    try (Stream<SnapshotId> listing = repo.listIndexSnapshots()) {
      ids = listing.distinct().toList();
    }

    Builder builder = new Builder(config.getOnInconsistentPack());
    try {
      forEachInParallel(config, "index-load-%d", ids, id -> builder.addSnapshot(id, readSnapshot(repo, format, id)));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof MalformedSnapshot m) {
        throw m;
      }
      if (cause instanceof InconsistentPack i) {
        throw i;
      }
      throw unexpected(cause);
    }
    return builder.build();
  }

  private static IndexSnapshot readSnapshot(Repository repo, IndexFormat format, SnapshotId id) throws IOException, MalformedSnapshot {
    try (InputStream in = Util.buffered(repo.readIndexSnapshot(id))) {
      return format.load(in);
    } catch (MalformedDataException e) {
      throw new MalformedSnapshot(id, e);
    }
  }

  @FunctionalInterface
  private interface Job<T> {
    void run(T item) throws Exception;
  }

  /**
   * Run a job on every item using a pool of {@link IndexConfig#getWorkers()} threads.
   * Returns once every job has finished, or as soon as any job fails; in the latter
   * case the remaining jobs are cancelled.
   *
   * @throws ExecutionException wrapping the first failure
   * @throws InterruptedIOException if the calling thread is interrupted while waiting
   */
  private static <T> void forEachInParallel(IndexConfig config, String threadNameFormat, Collection<T> items, Job<T> job) throws ExecutionException, InterruptedIOException {
    if (items.isEmpty()) {
      return;
    }
    int nthreads = Math.min(config.getWorkers(), items.size());
    ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(
            nthreads,
            new ThreadFactoryBuilder().setNameFormat(threadNameFormat).setDaemon(true).build()));
    try {
      List<ListenableFuture<@Nullable Void>> futures = new ArrayList<>(items.size());
      for (T item : items) {
        futures.add(executor.submit(() -> {
          job.run(item);
          return null;
        }));
      }
      for (ListenableFuture<@Nullable Void> f : Futures.inCompletionOrder(futures)) {
        f.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while building index");
    } finally {
      executor.shutdownNow();
    }
  }

  private static IllegalStateException unexpected(@Nullable Throwable cause) throws IOException {
    if (cause instanceof IOException io) {
      throw io;
    }
    if (cause instanceof RuntimeException r) {
      throw r;
    }
    if (cause instanceof Error err) {
      throw err;
    }
    return new IllegalStateException("unexpected failure while building index", cause);
  }

  /**
   * Write a new index snapshot describing the given packs.  This method writes
   * exactly one object and never deletes anything: it is up to the caller to
   * delete the snapshots named in <code>supersedes</code> after this method returns.
   * Snapshots are fully encoded before anything is written, so a failure leaves
   * nothing behind.
   *
   * @param repo the repository to write to
   * @param format the format to write
   * @param packs the packs to describe, which need not be every pack in the repository
   * @param supersedes snapshots made redundant by the new one
   * @return the identifier of the new snapshot
   * @throws IOException if the snapshot could not be encoded or written
   */
  public static SnapshotId save(
          Repository repo,
          IndexFormat format,
          Map<PackId, ? extends List<Entry>> packs,
          Collection<SnapshotId> supersedes) throws IOException {
    // Sorted, so that saving the same packs twice writes the same object.
    Map<PackId, Pack> contents = new TreeMap<>();
    packs.forEach((id, entries) -> contents.put(id, new Pack(entries)));
    IndexSnapshot snapshot = new IndexSnapshot(contents, ImmutableSortedSet.copyOf(supersedes).asList());

    byte[] bytes;
    try (InputStream in = format.serialize(snapshot)) {
      bytes = Util.read(in);
    }
    return repo.writeIndexSnapshot(new ByteArrayInputStream(bytes));
  }

  /**
   * Write every pack of this index to a single new snapshot superseding all the
   * snapshots this index was loaded from.
   *
   * @param repo the repository to write to
   * @param format the format to write
   * @return the identifier of the new snapshot
   * @throws IOException if the snapshot could not be encoded or written
   * @see #save(Repository, IndexFormat, Map, Collection)
   */
  public SnapshotId save(Repository repo, IndexFormat format) throws IOException {
    Map<PackId, List<Entry>> contents = new TreeMap<>();
    packs.forEach((id, pack) -> contents.put(id, pack.entries()));
    return save(repo, format, contents, indexIds);
  }

  /**
   * @return every pack, keyed by identifier
   */
  public ImmutableSortedMap<PackId, Pack> packs() {
    return packs;
  }

  public @Nullable Pack pack(PackId id) {
    return packs.get(id);
  }

  /**
   * @return for every blob, the packs that contain it
   */
  public ImmutableSetMultimap<BlobHandle, PackId> blobs() {
    return blobs;
  }

  /**
   * @return the snapshots that were merged to build this index (empty after {@link #rebuild})
   */
  public ImmutableSortedSet<SnapshotId> indexIds() {
    return indexIds;
  }

  /**
   * @return packs that were left out because snapshots disagreed about them
   * @see InconsistentPackPolicy#QUARANTINE
   */
  public ImmutableSortedSet<PackId> quarantinedPacks() {
    return ImmutableSortedSet.copyOf(quarantined.keySet());
  }

  /**
   * The conflicting descriptions of quarantined packs.  A rewrite that leaves
   * these packs out of its snapshot must keep each description somewhere, or
   * the repository loses track of the packs.
   *
   * @return for every quarantined pack, each distinct entry list a snapshot gave it
   */
  public ImmutableSetMultimap<PackId, Pack> quarantinedDescriptions() {
    return quarantined;
  }

  public boolean contains(BlobHandle blob) {
    return blobs.containsKey(blob);
  }

  /**
   * Find every stored copy of a blob.
   *
   * @param blob the blob to look for
   * @return its locations, ordered by pack; empty if the blob is not stored
   */
  public List<Location> findBlob(BlobHandle blob) {
    ImmutableList.Builder<Location> result = ImmutableList.builder();
    for (PackId id : blobs.get(blob)) {
      for (Entry e : packs.get(id).entries()) {
        if (e.handle().equals(blob)) {
          result.add(new Location(id, e));
        }
      }
    }
    return result.build();
  }

  /**
   * Find blobs that are stored in more than one pack.  This happens when
   * concurrent writers independently store the same content.
   *
   * @return every blob contained in two or more packs
   */
  public ImmutableSortedSet<BlobHandle> duplicateBlobs() {
    ImmutableSortedSet.Builder<BlobHandle> result = ImmutableSortedSet.naturalOrder();
    blobs.asMap().forEach((blob, containers) -> {
      if (containers.size() > 1) {
        result.add(blob);
      }
    });
    return result.build();
  }

  /**
   * Find the packs holding any of the given blobs.
   *
   * @param wanted the blobs to look for
   * @return every pack that contains at least one of them
   */
  public ImmutableSortedSet<PackId> packsForBlobs(Collection<BlobHandle> wanted) {
    ImmutableSortedSet.Builder<PackId> result = ImmutableSortedSet.naturalOrder();
    for (BlobHandle blob : wanted) {
      result.addAll(blobs.get(blob));
    }
    return result.build();
  }

  @Override
  public String toString() {
    return "Index{" + packs.size() + " packs, " + blobs.keySet().size() + " blobs, " + indexIds.size() + " snapshots}";
  }

}
