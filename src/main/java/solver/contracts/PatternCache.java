package solver.contracts;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Write-through memo of {@link FeedbackEncoder} results keyed by (secret, guess).
 *
 * <p>Entries are only ever added. Reads are safe from any thread; concurrent lazy
 * fills may compute the same entry twice but always store the same value.</p>
 *
 * <p>The index API ({@link #secretIndex}, {@link #guessIndex},
 * {@link #lookupOrCompute(int, int)}) lets hot loops resolve words once and then
 * address the table directly. An index of {@code -1} means the word is not part of
 * the indexed vocabulary; use the {@code String} overload for those.</p>
 *
 * <p>Persistence is write-back: a miss marks the cache dirty, and the owning driver
 * decides when to {@link #flush(Path)}.</p>
 */
public interface PatternCache {

    /* ─────────── Lookup ─────────── */

    /** Cached pattern, or compute, store and mark dirty. */
    int lookupOrCompute(String secret, String guess);

    int secretIndex(String secret);

    int guessIndex(String guess);

    /**
     * @param secretIndex value returned by {@link #secretIndex}, must be {@code >= 0}
     * @param guessIndex  value returned by {@link #guessIndex}, must be {@code >= 0}
     */
    int lookupOrCompute(int secretIndex, int guessIndex);

    /** Eagerly fills the cross product of the two word collections. */
    void bulkPrecompute(Collection<String> secrets, Collection<String> guesses);

    /* ─────────── Persistence ─────────── */

    /**
     * Merges a persisted snapshot into this cache.
     *
     * @return {@code false} when the file is missing or unreadable; the cache is then unchanged
     */
    boolean load(Path path);

    /**
     * Writes the whole cache.
     *
     * @return {@code false} when writing failed; the failure is logged, never thrown
     */
    boolean save(Path path);

    boolean isDirty();

    /** Saves only if dirty. Returns {@code true} when nothing needed saving or the save worked. */
    default boolean flush(Path path) {
        return !isDirty() || save(path);
    }

    /* ─────────── Life-cycle ─────────── */

    /** Number of computed entries. */
    long size();

    void clear();
}
