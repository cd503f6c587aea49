package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.FeedbackEncoder;
import solver.contracts.PatternCache;
import solver.contracts.TaskPool;
import solver.errors.CacheUnavailableException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import static solver.constants.SolverConstants.*;

/**
 * Pattern cache backed by one flat {@code byte[]}.
 *
 * <p>Slot {@code secretIndex * stride + guessIndex} holds the pattern (0..242) or
 * {@link solver.constants.SolverConstants#NO_PATTERN}. Byte writes are atomic, and every
 * thread that fills a slot writes the same value, so lazy fills need no lock.
 * A thread may miss another thread's fill and recompute it; that only costs time.</p>
 *
 * <p>Secrets are indexed over the Answer Set, guesses over the Guess Set plus the
 * answers. Pairs outside those lists are computed on every call and never stored.</p>
 */
public final class PatternCacheImpl implements PatternCache {

    private static final Logger log = LoggerFactory.getLogger(PatternCacheImpl.class);

    static final String SCHEMA = "pattern-cache-v1";

    /**
     * Persisted form: the two word lists and the row-major pattern table
     * (base64 in JSON).
     */
    record Snapshot(String schema, List<String> secrets, List<String> guesses, byte[] patterns) {}

    private final FeedbackEncoder encoder;
    private final ArtifactIO io;
    private final TaskPool taskPool;

    private final List<String> secrets;
    private final List<String> guesses;
    private final Map<String, Integer> secretIndex;
    private final Map<String, Integer> guessIndex;
    private final int stride;
    private final byte[] table;

    private volatile boolean dirty;

    public PatternCacheImpl(FeedbackEncoder encoder, Vocabulary vocabulary) {
        this(encoder, vocabulary.answers(), vocabulary.allWords(), new ArtifactIO(), null);
    }

    public PatternCacheImpl(FeedbackEncoder encoder, Vocabulary vocabulary, TaskPool taskPool) {
        this(encoder, vocabulary.answers(), vocabulary.allWords(), new ArtifactIO(), taskPool);
    }

    /**
     * @param taskPool optional; when present {@link #bulkPrecompute} fills rows in parallel
     */
    public PatternCacheImpl(FeedbackEncoder encoder,
                            List<String> secrets,
                            List<String> guesses,
                            ArtifactIO io,
                            TaskPool taskPool) {
        this.encoder  = encoder;
        this.io       = io;
        this.taskPool = taskPool;
        this.secrets  = List.copyOf(secrets);
        this.guesses  = List.copyOf(guesses);
        this.secretIndex = indexOf(this.secrets);
        this.guessIndex  = indexOf(this.guesses);
        this.stride = this.guesses.size();

        long slots = (long) this.secrets.size() * stride;
        if (slots > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Vocabulary too large for pattern cache: " + slots + " slots");
        }
        this.table = new byte[(int) slots];
        Arrays.fill(table, NO_PATTERN);
    }

    private static Map<String, Integer> indexOf(List<String> words) {
        Map<String, Integer> idx = new HashMap<>(words.size() * 2);
        for (int i = 0; i < words.size(); i++) idx.putIfAbsent(words.get(i), i);
        return idx;
    }

    /* ── lookup ──────────────────────────────────────────────── */

    @Override
    public int secretIndex(String secret) {
        Integer i = secretIndex.get(secret);
        return i == null ? -1 : i;
    }

    @Override
    public int guessIndex(String guess) {
        Integer i = guessIndex.get(guess);
        return i == null ? -1 : i;
    }

    @Override
    public int lookupOrCompute(String secret, String guess) {
        int s = secretIndex(secret);
        int g = guessIndex(guess);
        if (s < 0 || g < 0) return encoder.encode(guess, secret);
        return lookupOrCompute(s, g);
    }

    @Override
    public int lookupOrCompute(int s, int g) {
        int slot = s * stride + g;
        byte cached = table[slot];
        if (cached != NO_PATTERN) return cached & 0xFF;

        int pattern = encoder.encode(guesses.get(g), secrets.get(s));
        table[slot] = (byte) pattern;
        if (!dirty) dirty = true;
        return pattern;
    }

    @Override
    public void bulkPrecompute(Collection<String> secretWords, Collection<String> guessWords) {
        int[] rows = resolve(secretWords, true);
        int[] cols = resolve(guessWords, false);
        long t0 = System.nanoTime();
        log.info("Precomputing {} x {} feedback patterns...", rows.length, cols.length);

        if (taskPool == null || taskPool.getParallelism() <= 1) {
            for (int r = 0; r < rows.length; r++) {
                fillRow(rows[r], cols);
                if ((r + 1) % PROGRESS_INTERVAL == 0) {
                    log.info("Progress: {}/{} secrets", r + 1, rows.length);
                }
            }
        } else {
            List<Future<?>> futures = new ArrayList<>(rows.length);
            for (int row : rows) {
                futures.add(taskPool.submit(() -> { fillRow(row, cols); return null; }));
            }
            awaitAll(futures);
        }
        log.info("Precompute finished in {} ms", (System.nanoTime() - t0) / 1_000_000);
    }

    private void fillRow(int row, int[] cols) {
        for (int col : cols) lookupOrCompute(row, col);
    }

    private int[] resolve(Collection<String> words, boolean asSecret) {
        int[] out = new int[words.size()];
        int n = 0;
        int skipped = 0;
        for (String w : words) {
            int i = asSecret ? secretIndex(w) : guessIndex(w);
            if (i < 0) { skipped++; continue; }
            out[n++] = i;
        }
        if (skipped > 0) {
            log.warn("Skipped {} {} outside the indexed vocabulary", skipped, asSecret ? "secrets" : "guesses");
        }
        return Arrays.copyOf(out, n);
    }

    private static void awaitAll(List<Future<?>> futures) {
        try {
            for (Future<?> f : futures) f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Precompute interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Precompute failed", e.getCause());
        }
    }

    /* ── persistence ─────────────────────────────────────────── */

    @Override
    public boolean load(Path path) {
        if (!Files.exists(path)) {
            log.info("No cache file found at {}. Some operations may be slower.", path);
            return false;
        }
        try {
            Snapshot snap = io.read(path, Snapshot.class);
            validate(snap, path);
            int merged = merge(snap);
            log.info("Loaded {} precomputed feedback patterns from {}", merged, path);
            return true;
        } catch (CacheUnavailableException e) {
            log.warn("Cache file {} unusable, continuing with an empty cache: {}", e.getPath(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean save(Path path) {
        // cleared first so fills racing with the copy re-mark the cache
        dirty = false;
        Snapshot snap = new Snapshot(SCHEMA, secrets, guesses, table.clone());
        try {
            io.write(path, snap);
            log.info("Saved feedback patterns cache to {}", path);
            return true;
        } catch (CacheUnavailableException e) {
            dirty = true;
            log.warn("Failed to write feedback patterns cache {}: {}", e.getPath(), e.getMessage());
            return false;
        }
    }

    private static void validate(Snapshot snap, Path path) throws CacheUnavailableException {
        if (!SCHEMA.equals(snap.schema())
                || snap.secrets() == null || snap.guesses() == null || snap.patterns() == null) {
            throw new CacheUnavailableException(path, "Unknown cache schema", null);
        }
        long expected = (long) snap.secrets().size() * snap.guesses().size();
        if (snap.patterns().length != expected) {
            throw new CacheUnavailableException(path,
                    "Pattern table has " + snap.patterns().length + " slots, expected " + expected, null);
        }
        for (byte b : snap.patterns()) {
            if (b != NO_PATTERN && (b & 0xFF) >= PATTERN_COUNT) {
                throw new CacheUnavailableException(path, "Pattern out of range: " + (b & 0xFF), null);
            }
        }
    }

    /** Copies every computed slot whose words this cache indexes. Returns slots copied. */
    private int merge(Snapshot snap) {
        byte[] src = snap.patterns();
        int merged = 0;

        if (snap.secrets().equals(secrets) && snap.guesses().equals(guesses)) {
            for (int i = 0; i < src.length; i++) {
                if (src[i] != NO_PATTERN) { table[i] = src[i]; merged++; }
            }
            return merged;
        }

        // different vocabularies: re-key by word
        int[] rowMap = new int[snap.secrets().size()];
        for (int i = 0; i < rowMap.length; i++) rowMap[i] = secretIndex(snap.secrets().get(i));
        int[] colMap = new int[snap.guesses().size()];
        for (int i = 0; i < colMap.length; i++) colMap[i] = guessIndex(snap.guesses().get(i));

        int srcStride = colMap.length;
        for (int r = 0; r < rowMap.length; r++) {
            if (rowMap[r] < 0) continue;
            int base = rowMap[r] * stride;
            for (int c = 0; c < srcStride; c++) {
                byte b = src[r * srcStride + c];
                if (b == NO_PATTERN || colMap[c] < 0) continue;
                table[base + colMap[c]] = b;
                merged++;
            }
        }
        return merged;
    }

    @Override
    public boolean isDirty() {
        return dirty;
    }

    /* ── life-cycle ──────────────────────────────────────────── */

    @Override
    public long size() {
        long n = 0;
        for (byte b : table) if (b != NO_PATTERN) n++;
        return n;
    }

    @Override
    public void clear() {
        Arrays.fill(table, NO_PATTERN);
        dirty = false;
    }
}
