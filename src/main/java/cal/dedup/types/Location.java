package cal.dedup.types;

/**
 * Where to find a blob: which pack to read, and which bytes of it.
 */
public record Location(PackId pack, Entry entry) {
}
