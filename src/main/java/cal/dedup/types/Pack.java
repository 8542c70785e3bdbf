package cal.dedup.types;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The blobs stored in one pack, in the order they appear in its trailer.
 * Two packs are equal only if they list the same entries in the same order.
 */
public record Pack(List<Entry> entries) {

  public Pack {
    entries = ImmutableList.copyOf(entries);
  }

}
