package cal.dedup.types;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.With;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Tuning knobs for building an index.
 *
 * <p>A config can be read from a JSON file (comments allowed):
 * <pre>
 *   {
 *     // threads used to read pack trailers and index snapshots
 *     "workers": 8,
 *     // "fail" or "quarantine"
 *     "onInconsistentPack": "fail"
 *   }
 * </pre>
 * Missing keys take their {@link #defaults() default} values.
 */
@Value
@With
public class IndexConfig {

  /**
   * What to do when two index snapshots describe the same pack differently.
   */
  public enum InconsistentPackPolicy {
    /** refuse to build the index */
    FAIL,
    /** leave the pack out of the index and report it in {@link cal.dedup.impls.Index#quarantinedPacks()} */
    QUARANTINE
  }

  int workers;
  InconsistentPackPolicy onInconsistentPack;

  public IndexConfig(int workers, InconsistentPackPolicy onInconsistentPack) {
    if (workers < 1) {
      throw new IllegalArgumentException("need at least one worker, got " + workers);
    }
    if (onInconsistentPack == null) {
      throw new IllegalArgumentException("no policy for inconsistent packs");
    }
    this.workers = workers;
    this.onInconsistentPack = onInconsistentPack;
  }

  public static IndexConfig defaults() {
    return new IndexConfig(Runtime.getRuntime().availableProcessors(), InconsistentPackPolicy.FAIL);
  }

  private static class RawConfig {
    public @Nullable Integer workers;
    public @Nullable String onInconsistentPack;
  }

  public static IndexConfig load(Path target) throws IOException {
    try (InputStream in = Files.newInputStream(target)) {
      return load(in);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Config at " + target + " is invalid: " + e.getMessage(), e);
    }
  }

  public static IndexConfig load(InputStream in) throws IOException {
    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f);

    RawConfig r = mapper.readValue(in, RawConfig.class);

    IndexConfig result = defaults();
    if (r.workers != null) {
      result = result.withWorkers(r.workers);
    }
    if (r.onInconsistentPack != null) {
      final InconsistentPackPolicy policy;
      try {
        policy = InconsistentPackPolicy.valueOf(r.onInconsistentPack.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Cannot process onInconsistentPack '" + r.onInconsistentPack + '\'', e);
      }
      result = result.withOnInconsistentPack(policy);
    }
    return result;
  }

}
