package cal.dedup.impls;

import cal.dedup.Util;
import cal.dedup.types.BlobId;
import cal.dedup.types.BlobKind;
import cal.dedup.types.Entry;
import cal.dedup.types.IndexFormat;
import cal.dedup.types.IndexSnapshot;
import cal.dedup.types.Pack;
import cal.dedup.types.PackId;
import cal.prim.MalformedDataException;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The oldest index format: a bare JSON array of packs.  It has no room for a
 * list of superseded snapshots.
 *
 * <pre>
 *   [ {"id": "73d0...", "blobs": [ {"id": "3ec7...", "type": "data", "offset": 0, "length": 38}, ... ]}, ... ]
 * </pre>
 */
public class JsonIndexFormatV01 implements IndexFormat {

  private static class JsonBlob {
    public @Nullable String id;
    public @Nullable String type;
    public @Nullable Long offset;
    public @Nullable Long length;
  }

  private static class JsonPack {
    public @Nullable String id;
    public @Nullable List<JsonBlob> blobs;
  }

  private final ObjectMapper mapper;

  public JsonIndexFormatV01() {
    mapper = new ObjectMapper();
    mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
  }

  @Override
  public IndexSnapshot load(InputStream data) throws IOException, MalformedDataException {
    final JsonPack[] f;
    try {
      f = mapper.readValue(data, JsonPack[].class);
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

    Map<PackId, Pack> packs = new LinkedHashMap<>();
    for (JsonPack p : f) {
      if (p == null || p.id == null) {
        throw new MalformedDataException("Pack has no id");
      }
      PackId id = parsePackId(p.id);
      if (p.blobs == null) {
        throw new MalformedDataException("Pack " + p.id + " has no blobs");
      }
      List<Entry> entries = new ArrayList<>(p.blobs.size());
      for (JsonBlob b : p.blobs) {
        entries.add(toEntry(p.id, b));
      }
      if (packs.put(id, new Pack(entries)) != null) {
        throw new MalformedDataException("Pack " + p.id + " is listed twice");
      }
    }
    return new IndexSnapshot(packs, Collections.emptyList());
  }

  private static PackId parsePackId(String hex) throws MalformedDataException {
    try {
      return PackId.parse(hex);
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("Malformed pack id '" + hex + '\'', e);
    }
  }

  private static Entry toEntry(String packId, @Nullable JsonBlob b) throws MalformedDataException {
    if (b == null || b.id == null || b.type == null || b.offset == null || b.length == null) {
      throw new MalformedDataException("Pack " + packId + " has an incomplete blob");
    }
    try {
      return new Entry(BlobId.parse(b.id), BlobKind.fromWireName(b.type), b.offset, b.length);
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("Pack " + packId + " has a malformed blob: " + e.getMessage(), e);
    }
  }

  private List<JsonPack> convertToJSONSerializableObject(IndexSnapshot snapshot) {
    if (!snapshot.supersedes().isEmpty()) {
      throw new IllegalArgumentException("This format cannot record superseded snapshots");
    }
    List<JsonPack> result = new ArrayList<>(snapshot.packs().size());
    snapshot.packs().forEach((id, pack) -> {
      JsonPack p = new JsonPack();
      p.id = id.toString();
      p.blobs = new ArrayList<>(pack.entries().size());
      for (Entry e : pack.entries()) {
        JsonBlob b = new JsonBlob();
        b.id = e.id().toString();
        b.type = e.kind().wireName();
        b.offset = e.offset();
        b.length = e.length();
        p.blobs.add(b);
      }
      result.add(p);
    });
    return result;
  }

  @Override
  public InputStream serialize(IndexSnapshot snapshot) {
    List<JsonPack> json = convertToJSONSerializableObject(snapshot);
    return Util.createInputStream(out -> mapper.writeValue(out, json));
  }

}
