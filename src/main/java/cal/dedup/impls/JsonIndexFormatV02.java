package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.BlobId;
import cal.dedup.types.BlobKind;
import cal.dedup.types.Entry;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.IndexSnapshot;
import cal.dedup.types.Pack;
import cal.dedup.types.PackId;
import cal.dedup.types.SnapshotId;
import cal.prim.MalformedDataException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index format with a list of superseded snapshots.
 *
 * <pre>
 *   {
 *     "supersedes": ["ed54...", ...],
 *     "packs": [ {"id": "73d0...", "blobs": [ {"id": "3ec7...", "type": "tree", "offset": 0, "length": 38}, ... ]}, ... ]
 *   }
 * </pre>
 */
public class JsonIndexFormatV02 implements IndexFormat {

  private static class JsonBlob {
    public @Nullable String id;
    public @Nullable String type;
    public @Nullable Long offset;
    public @Nullable Long length;

    public Entry toEntry(String packId) throws MalformedDataException {
      String id = this.id;
      String type = this.type;
      Long offset = this.offset;
      Long length = this.length;
      if (id == null) {
        throw new MalformedDataException("A blob in pack " + packId + " has no id");
      }
      if (type == null) {
        throw new MalformedDataException("Blob " + id + " in pack " + packId + " has no type");
      }
      if (offset == null) {
        throw new MalformedDataException("Blob " + id + " in pack " + packId + " has no offset");
      }
      if (length == null) {
        throw new MalformedDataException("Blob " + id + " in pack " + packId + " has no length");
      }
      try {
        return new Entry(BlobId.parse(id), BlobKind.fromWireName(type), offset, length);
      } catch (IllegalArgumentException e) {
        throw new MalformedDataException("Blob " + id + " in pack " + packId + " is malformed", e);
      }
    }
  }

  private static class JsonPack {
    public @Nullable String id;
    public @Nullable List<@Nullable JsonBlob> blobs;

    public String getId() throws MalformedDataException {
      String id = this.id;
      if (id == null) {
        throw new MalformedDataException("Pack has no id");
      }
      return id;
    }

    public List<@Nullable JsonBlob> getBlobs() throws MalformedDataException {
      List<@Nullable JsonBlob> blobs = this.blobs;
      if (blobs == null) {
        throw new MalformedDataException("Pack " + id + " has no blobs");
      }
      return blobs;
    }
  }

  private static class JsonIndex {
    public @Nullable List<@Nullable String> supersedes;
    public @Nullable List<@Nullable JsonPack> packs;
  }

  private final ObjectMapper mapper;

  public JsonIndexFormatV02() {
    mapper = new ObjectMapper();
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
  }

  @Override
  public IndexSnapshot load(InputStream data) throws IOException, MalformedDataException {
    final JsonIndex f;
    try {
      f = mapper.readValue(data, JsonIndex.class);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Index is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Index JSON is not well-formed", e);
    } catch (CharConversionException e) {
      // the detected encoding (e.g. UTF-32) holds an impossible character
      throw new MalformedDataException("Index is not legal text", e);
    }
    if (f == null) {
      throw new MalformedDataException("Index is null");
    }
    List<@Nullable String> jsonSupersedes = f.supersedes;
    List<@Nullable JsonPack> jsonPacks = f.packs;
    if (jsonSupersedes == null) {
      throw new MalformedDataException("Index has no \"supersedes\" list");
    }
    if (jsonPacks == null) {
      throw new MalformedDataException("Index has no \"packs\" list");
    }

    List<SnapshotId> supersedes = new ArrayList<>(jsonSupersedes.size());
    for (String s : jsonSupersedes) {
      if (s == null) {
        throw new MalformedDataException("Superseded index id is null");
      }
      try {
        supersedes.add(SnapshotId.parse(s));
      } catch (IllegalArgumentException e) {
        throw new MalformedDataException("Malformed superseded index id '" + s + '\'', e);
      }
    }

    Map<PackId, Pack> packs = new LinkedHashMap<>();
    for (JsonPack p : jsonPacks) {
      if (p == null) {
        throw new MalformedDataException("Pack is null");
      }
      String packId = p.getId();
      final PackId id;
      try {
        id = PackId.parse(packId);
      } catch (IllegalArgumentException e) {
        throw new MalformedDataException("Malformed pack id '" + packId + '\'', e);
      }
      List<Entry> entries = new ArrayList<>();
      for (JsonBlob b : p.getBlobs()) {
        if (b == null) {
          throw new MalformedDataException("Pack " + packId + " has a null blob");
        }
        entries.add(b.toEntry(packId));
      }
      if (packs.put(id, new Pack(entries)) != null) {
        throw new MalformedDataException("Pack " + packId + " is listed twice");
      }
    }

    return new IndexSnapshot(packs, supersedes);
  }

  private JsonIndex convertToJSONSerializableObject(IndexSnapshot snapshot) {
    JsonIndex result = new JsonIndex();

    List<@Nullable String> supersedes = new ArrayList<>(snapshot.supersedes().size());
    for (SnapshotId s : snapshot.supersedes()) {
      supersedes.add(s.toString());
    }
    result.supersedes = supersedes;

    List<@Nullable JsonPack> packs = new ArrayList<>(snapshot.packs().size());
    snapshot.packs().forEach((id, pack) -> {
      JsonPack p = new JsonPack();
      p.id = id.toString();
      List<@Nullable JsonBlob> blobs = new ArrayList<>(pack.entries().size());
      for (Entry e : pack.entries()) {
        blobs.add(toJsonBlob(e));
      }
      p.blobs = blobs;
      packs.add(p);
    });
    result.packs = packs;

    return result;
  }

  private static JsonBlob toJsonBlob(Entry e) {
    JsonBlob res = new JsonBlob();
    res.id = e.id().toString();
    res.type = e.kind().wireName();
    res.offset = e.offset();
    res.length = e.length();
    return res;
  }

  @Override
  public InputStream serialize(IndexSnapshot snapshot) {
    JsonIndex json = convertToJSONSerializableObject(snapshot);
    return Util.createInputStream(out -> mapper.writeValue(out, json));
  }

}
