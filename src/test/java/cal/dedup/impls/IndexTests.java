package cal.dedup.impls;

import cal.dedup.types.BlobHandle;
import cal.dedup.types.BlobId;
import cal.dedup.types.BlobKind;
import cal.dedup.types.Entry;
import cal.dedup.types.IndexConfig;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.Location;
import cal.dedup.types.Pack;
import cal.dedup.types.PackId;
import cal.dedup.types.Sha256;
import cal.dedup.types.SnapshotId;
import com.google.common.collect.ImmutableSet;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

@Test
public class IndexTests {

  private static final IndexFormat FORMAT = VersionedIndexFormat.standard();
  private static final IndexConfig CONFIG = IndexConfig.defaults().withWorkers(4);
  private static final IndexConfig QUARANTINE = CONFIG.withOnInconsistentPack(IndexConfig.InconsistentPackPolicy.QUARANTINE);

  private static Map<PackId, Pack> asPacks(Map<PackId, List<Entry>> contents) {
    Map<PackId, Pack> result = new TreeMap<>();
    contents.forEach((id, entries) -> result.put(id, new Pack(entries)));
    return result;
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  private static BlobHandle data(String s) {
    return new BlobHandle(BlobId.forContent(bytes(s)), BlobKind.DATA);
  }

  @Test
  public void testRebuildFindsEveryBlob() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(1, 50, 0.0);
    Index index = Index.rebuild(repo.repo, CONFIG);

    Assert.assertEquals(index.packs(), asPacks(repo.contents));
    Assert.assertTrue(index.indexIds().isEmpty());
    Assert.assertTrue(index.quarantinedPacks().isEmpty());
    for (Map.Entry<PackId, List<Entry>> pack : repo.contents.entrySet()) {
      for (Entry e : pack.getValue()) {
        Assert.assertTrue(index.contains(e.handle()));
        Assert.assertTrue(index.findBlob(e.handle()).contains(new Location(pack.getKey(), e)));
      }
    }
  }

  @Test
  public void testFoundBlobsCanBeRead() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    PackId pack = TestRepositories.writePack(repo, BlobKind.DATA, bytes("hello"), bytes("world"));
    Index index = Index.rebuild(repo.repo, CONFIG);

    List<Location> locations = index.findBlob(data("world"));
    Assert.assertEquals(locations.size(), 1);
    Assert.assertEquals(locations.get(0).pack(), pack);
    Assert.assertEquals(repo.repo.readBlob(locations.get(0)), bytes("world"));
  }

  @Test
  public void testEmptyRepository() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    Assert.assertTrue(Index.rebuild(repo.repo, CONFIG).packs().isEmpty());
    Index loaded = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertTrue(loaded.packs().isEmpty());
    Assert.assertTrue(loaded.blobs().isEmpty());
    Assert.assertTrue(loaded.indexIds().isEmpty());
  }

  @Test
  public void testUnknownBlob() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(2, 5, 0.0);
    Index index = Index.rebuild(repo.repo, CONFIG);
    BlobHandle missing = data("not stored anywhere");
    Assert.assertFalse(index.contains(missing));
    Assert.assertTrue(index.findBlob(missing).isEmpty());
    Assert.assertTrue(index.packsForBlobs(List.of(missing)).isEmpty());
  }

  @Test
  public void testLoadMatchesRebuild() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(3, 60, 0.1);
    Index rebuilt = Index.rebuild(repo.repo, CONFIG);

    // Spread the packs over several snapshots, with some packs in more than one.
    Random random = new Random(3);
    List<PackId> ids = new ArrayList<>(repo.contents.keySet());
    List<SnapshotId> written = new ArrayList<>();
    for (int chunk = 0; chunk < 4; ++chunk) {
      Map<PackId, List<Entry>> part = new TreeMap<>();
      for (int i = chunk; i < ids.size(); i += 4) {
        part.put(ids.get(i), repo.contents.get(ids.get(i)));
      }
      PackId extra = ids.get(random.nextInt(ids.size()));
      part.put(extra, repo.contents.get(extra));
      written.add(Index.save(repo.repo, FORMAT, part, List.of()));
    }

    Index loaded = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertEquals(loaded.packs(), rebuilt.packs());
    Assert.assertEquals(loaded.blobs(), rebuilt.blobs());
    Assert.assertEquals(loaded.duplicateBlobs(), rebuilt.duplicateBlobs());
    Assert.assertEquals(loaded.indexIds(), ImmutableSet.copyOf(written));
  }

  @Test
  public void testSaveSubsetAndDeleteOld() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(4, 40, 0.0);
    Index.save(repo.repo, FORMAT, repo.contents, List.of());
    Index full = Index.load(repo.repo, FORMAT, CONFIG);

    Random random = new Random(4);
    Map<PackId, List<Entry>> subset = new TreeMap<>();
    for (PackId id : full.packs().keySet()) {
      if (random.nextBoolean()) {
        subset.put(id, full.packs().get(id).entries());
      }
    }

    SnapshotId saved = Index.save(repo.repo, FORMAT, subset, full.indexIds());
    for (SnapshotId old : full.indexIds()) {
      repo.repo.deleteIndexSnapshot(old);
    }

    Index reloaded = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertEquals(reloaded.packs(), asPacks(subset));
    Assert.assertEquals(reloaded.indexIds(), Set.of(saved));
  }

  @Test
  public void testSaveDoesNotDelete() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(5, 10, 0.0);
    SnapshotId first = Index.save(repo.repo, FORMAT, repo.contents, List.of());
    SnapshotId second = Index.load(repo.repo, FORMAT, CONFIG).save(repo.repo, FORMAT);
    Assert.assertNotEquals(second, first);
    Assert.assertEquals(repo.indexDir.size(), 2);

    // Until the superseded snapshot is deleted, both are merged.
    Index loaded = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertEquals(loaded.indexIds(), Set.of(first, second));
    Assert.assertEquals(loaded.packs(), asPacks(repo.contents));
  }

  @Test
  public void testSaveZeroLengthBlobAndEmptyPack() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    PackId withEmptyBlob = PackId.parse("73d04e6125f4e7a4f6ed4cbd5b2ec5c5f6a4a71a0f7e3ed24a5b2f3e8a1a6c90");
    PackId emptyPack = PackId.parse("ed54c9ad3bc3e6e4a1b0a4ae3e11c1f3f46b5bd2bba3aa2b3e0f6d3a9f5a7e21");
    Map<PackId, List<Entry>> contents = new TreeMap<>();
    contents.put(withEmptyBlob, List.of(new Entry(BlobId.forContent(new byte[0]), BlobKind.DATA, 0, 0)));
    contents.put(emptyPack, List.of());

    SnapshotId id = Index.save(repo.repo, FORMAT, contents, List.of());
    Index index = Index.load(repo.repo, FORMAT, CONFIG);

    Assert.assertEquals(index.indexIds(), Set.of(id));
    Assert.assertEquals(index.packs(), asPacks(contents));
    Assert.assertTrue(index.contains(new BlobHandle(BlobId.forContent(new byte[0]), BlobKind.DATA)));
  }

  @Test
  public void testSaveIsDeterministic() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(6, 10, 0.0);
    List<SnapshotId> supersedes = List.of(SnapshotId.parse("ed54000000000000000000000000000000000000000000000000000000000000"));
    SnapshotId first = Index.save(repo.repo, FORMAT, repo.contents, supersedes);
    SnapshotId second = Index.save(repo.repo, FORMAT, new TreeMap<>(repo.contents).descendingMap(), supersedes);
    Assert.assertEquals(second, first);
    Assert.assertEquals(repo.indexDir.size(), 1);
  }

  @Test
  public void testSavedSnapshotRecordsSupersedes() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(7, 3, 0.0);
    SnapshotId old = Index.save(repo.repo, FORMAT, repo.contents, List.of());
    SnapshotId replacement = Index.load(repo.repo, FORMAT, CONFIG).save(repo.repo, FORMAT);
    var snapshot = FORMAT.load(repo.repo.readIndexSnapshot(replacement));
    Assert.assertEquals(snapshot.supersedes(), List.of(old));
    Assert.assertEquals(snapshot.packs(), asPacks(repo.contents));
  }

  @Test
  public void testDuplicateBlobs() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    PackId p1 = TestRepositories.writePack(repo, BlobKind.DATA, bytes("A"), bytes("B"));
    PackId p2 = TestRepositories.writePack(repo, BlobKind.DATA, bytes("B"), bytes("C"));
    PackId p3 = TestRepositories.writePack(repo, BlobKind.DATA, bytes("C"));
    Index index = Index.rebuild(repo.repo, CONFIG);

    Assert.assertEquals(index.duplicateBlobs(), Set.of(data("B"), data("C")));
    Assert.assertEquals(index.packsForBlobs(List.of(data("A"))), Set.of(p1));
    Assert.assertEquals(index.packsForBlobs(List.of(data("B"), data("C"))), Set.of(p1, p2, p3));
    Assert.assertEquals(index.findBlob(data("B")).size(), 2);
  }

  @Test
  public void testSameContentOfDifferentKindIsNotDuplicate() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    TestRepositories.writePack(repo, BlobKind.DATA, bytes("same"));
    PackId trees = TestRepositories.writePack(repo, BlobKind.TREE, bytes("same"));
    Index index = Index.rebuild(repo.repo, CONFIG);

    Assert.assertTrue(index.duplicateBlobs().isEmpty());
    BlobHandle tree = new BlobHandle(BlobId.forContent(bytes("same")), BlobKind.TREE);
    Assert.assertEquals(index.packsForBlobs(List.of(tree)), Set.of(trees));
  }

  private static byte[] filled(int length, int value) {
    byte[] result = new byte[length];
    Arrays.fill(result, (byte) value);
    return result;
  }

  @Test
  public void testThreePackScenario() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    byte[] b1 = filled(100, 1);
    byte[] b2 = filled(50, 2);
    byte[] b3 = filled(50, 3);
    BlobHandle h1 = new BlobHandle(BlobId.forContent(b1), BlobKind.DATA);

    PackFormat.Builder a = new PackFormat.Builder();
    a.add(BlobKind.DATA, b1);
    PackFormat.Builder b = new PackFormat.Builder();
    b.add(BlobKind.DATA, b1);
    b.add(BlobKind.TREE, b2);
    PackFormat.Builder c = new PackFormat.Builder();
    c.add(BlobKind.DATA, b3);
    PackId packA = repo.repo.writePack(a.finish());
    PackId packB = repo.repo.writePack(b.finish());
    PackId packC = repo.repo.writePack(c.finish());

    Index index = Index.rebuild(repo.repo, CONFIG);

    Assert.assertEquals(index.packs().size(), 3);
    Assert.assertEquals(index.pack(packA).entries(), List.of(
            new Entry(BlobId.forContent(b1), BlobKind.DATA, 0, 100)));
    Assert.assertEquals(index.pack(packB).entries(), List.of(
            new Entry(BlobId.forContent(b1), BlobKind.DATA, 0, 100),
            new Entry(BlobId.forContent(b2), BlobKind.TREE, 100, 50)));
    Assert.assertEquals(index.pack(packC).entries(), List.of(
            new Entry(BlobId.forContent(b3), BlobKind.DATA, 0, 50)));
    Assert.assertEquals(index.duplicateBlobs(), Set.of(h1));
    Assert.assertEquals(index.packsForBlobs(List.of(h1)), Set.of(packA, packB));
  }

  @Test
  public void testDuplicatesInRandomRepository() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(8, 100, 0.01);
    Index index = Index.rebuild(repo.repo, CONFIG);
    for (BlobHandle blob : index.duplicateBlobs()) {
      Assert.assertTrue(index.packsForBlobs(List.of(blob)).size() > 1, blob.toString());
    }
    for (Map.Entry<BlobHandle, Collection<PackId>> e : index.blobs().asMap().entrySet()) {
      Assert.assertEquals(index.duplicateBlobs().contains(e.getKey()), e.getValue().size() > 1);
    }
  }

  @Test
  public void testUnreadablePack() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(9, 10, 0.0);
    PackId damaged = repo.contents.keySet().iterator().next();
    repo.packDir.overwrite(damaged.toString(), bytes("garbage"));
    try {
      Index.rebuild(repo.repo, CONFIG);
      Assert.fail("rebuild should have failed");
    } catch (Index.UnreadablePack e) {
      Assert.assertEquals(e.getPack(), damaged);
    }
  }

  @Test
  public void testMalformedSnapshot() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(10, 5, 0.0);
    Index.save(repo.repo, FORMAT, repo.contents, List.of());
    SnapshotId bad = repo.repo.writeIndexSnapshot(new ByteArrayInputStream(bytes("this is not an index")));
    try {
      Index.load(repo.repo, FORMAT, CONFIG);
      Assert.fail("load should have failed");
    } catch (Index.MalformedSnapshot e) {
      Assert.assertEquals(e.getSnapshot(), bad);
    }
  }

  @Test
  public void testSnapshotInImpossibleEncoding() throws Exception {
    TestRepositories.Filled repo = TestRepositories.empty();
    byte[] data = {0, 0, 0, '[', 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
    SnapshotId bad = repo.repo.writeIndexSnapshot(new ByteArrayInputStream(data));
    try {
      Index.load(repo.repo, FORMAT, CONFIG);
      Assert.fail("load should have failed");
    } catch (Index.MalformedSnapshot e) {
      Assert.assertEquals(e.getSnapshot(), bad);
    }
  }

  @Test
  public void testDamagedSnapshot() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(11, 5, 0.0);
    SnapshotId id = Index.save(repo.repo, FORMAT, repo.contents, List.of());
    repo.indexDir.overwrite(id.toString(), bytes("[]"));
    try {
      Index.load(repo.repo, FORMAT, CONFIG);
      Assert.fail("load should have failed");
    } catch (Index.MalformedSnapshot e) {
      Assert.assertEquals(e.getSnapshot(), id);
    }
  }

  private static Map<PackId, List<Entry>> disagreement(PackId pack, String blob, long length) {
    BlobId id = BlobId.forContent(bytes(blob));
    return Map.of(pack, List.of(new Entry(id, BlobKind.DATA, 0, length)));
  }

  @Test
  public void testInconsistentPackFails() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(12, 5, 0.0);
    Index.save(repo.repo, FORMAT, repo.contents, List.of());
    PackId pack = PackId.parse("73d0000000000000000000000000000000000000000000000000000000000000");
    SnapshotId s1 = Index.save(repo.repo, FORMAT, disagreement(pack, "x", 10), List.of());
    SnapshotId s2 = Index.save(repo.repo, FORMAT, disagreement(pack, "x", 11), List.of());
    try {
      Index.load(repo.repo, FORMAT, CONFIG);
      Assert.fail("load should have failed");
    } catch (Index.InconsistentPack e) {
      Assert.assertEquals(e.getPack(), pack);
      Assert.assertEquals(Set.of(e.getFirst(), e.getSecond()), Set.of(s1, s2));
    }
  }

  @Test
  public void testInconsistentPackQuarantined() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(13, 5, 0.0);
    Index.save(repo.repo, FORMAT, repo.contents, List.of());
    PackId pack = PackId.parse("73d0000000000000000000000000000000000000000000000000000000000000");
    Index.save(repo.repo, FORMAT, disagreement(pack, "x", 10), List.of());
    Index.save(repo.repo, FORMAT, disagreement(pack, "x", 11), List.of());
    Index.save(repo.repo, FORMAT, disagreement(pack, "x", 10), List.of(SnapshotId.parse("0000000000000000000000000000000000000000000000000000000000000001")));

    Index index = Index.load(repo.repo, FORMAT, QUARANTINE);
    Assert.assertEquals(index.quarantinedPacks(), Set.of(pack));
    Assert.assertNull(index.pack(pack));
    Assert.assertFalse(index.contains(data("x")));
    Assert.assertEquals(index.packs(), asPacks(repo.contents));
    Assert.assertEquals(index.indexIds().size(), 4);
  }

  @Test
  public void testQuarantineDoesNotDependOnOrder() throws Exception {
    PackId pack = PackId.parse("73d0000000000000000000000000000000000000000000000000000000000000");
    List<Map<PackId, List<Entry>>> snapshots = new ArrayList<>();
    snapshots.add(disagreement(pack, "x", 10));
    snapshots.add(disagreement(pack, "x", 10));
    snapshots.add(disagreement(pack, "x", 12));
    for (int seed = 0; seed < 10; ++seed) {
      TestRepositories.Filled repo = TestRepositories.empty();
      List<Map<PackId, List<Entry>>> order = TestRepositories.shuffled(new Random(seed), snapshots);
      for (int i = 0; i < order.size(); ++i) {
        // distinct supersedes lists keep identical contents from colliding
        SnapshotId marker = new SnapshotId(Sha256.of(new byte[] { (byte)i }));
        Index.save(repo.repo, FORMAT, order.get(i), List.of(marker));
      }
      Index index = Index.load(repo.repo, FORMAT, QUARANTINE);
      Assert.assertEquals(index.quarantinedPacks(), Set.of(pack));
      Assert.assertTrue(index.packs().isEmpty());
      Assert.assertTrue(index.blobs().isEmpty());
    }
  }

  @Test
  public void testOverlappingSnapshotsAgree() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(14, 8, 0.0);
    Index.save(repo.repo, FORMAT, repo.contents, List.of());
    Index.save(repo.repo, FORMAT, repo.contents, List.of(SnapshotId.parse("0000000000000000000000000000000000000000000000000000000000000002")));
    Index index = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertEquals(index.indexIds().size(), 2);
    Assert.assertEquals(index.packs(), asPacks(repo.contents));
    Assert.assertTrue(index.duplicateBlobs().isEmpty());
  }

  @Test
  public void testLegacySnapshotsAreMerged() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(15, 6, 0.0);
    List<PackId> ids = new ArrayList<>(repo.contents.keySet());
    Collections.sort(ids);
    Map<PackId, List<Entry>> legacy = new TreeMap<>();
    Map<PackId, List<Entry>> current = new TreeMap<>();
    for (int i = 0; i < ids.size(); ++i) {
      (i % 2 == 0 ? legacy : current).put(ids.get(i), repo.contents.get(ids.get(i)));
    }
    Index.save(repo.repo, new JsonIndexFormatV01(), legacy, List.of());
    Index.save(repo.repo, FORMAT, current, List.of());

    Index index = Index.load(repo.repo, FORMAT, CONFIG);
    Assert.assertEquals(index.packs(), asPacks(repo.contents));
  }

  @Test
  public void testSingleWorker() throws Exception {
    TestRepositories.Filled repo = TestRepositories.createFilledRepo(16, 20, 0.05);
    Index index = Index.rebuild(repo.repo, CONFIG.withWorkers(1));
    Assert.assertEquals(index.packs(), asPacks(repo.contents));
  }

}
