package bench;

import org.openjdk.jmh.annotations.*;
import solver.contracts.PatternCache;
import solver.impl.ArtifactIO;
import solver.impl.FeedbackEncoderImpl;
import solver.impl.PatternCacheImpl;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/** Micro-benchmark: direct encoding vs. a warm pattern-cache lookup */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class FeedbackBench {

    /** Random but *stable* words so both methods see identical inputs. */
    @State(Scope.Thread)
    public static class TestData {
        final FeedbackEncoderImpl encoder = new FeedbackEncoderImpl();
        List<String> words;
        PatternCache cache;

        @Setup(Level.Trial)
        public void init() {
            SplittableRandom rng = new SplittableRandom(42);
            words = new ArrayList<>(256);
            for (int i = 0; i < 256; i++) {
                // few distinct letters so repeated-letter paths get exercised
                char[] w = new char[5];
                for (int k = 0; k < 5; k++) w[k] = (char) ('a' + rng.nextInt(8));
                words.add(new String(w));
            }
            cache = new PatternCacheImpl(encoder, words, words, new ArtifactIO(), null);
            cache.bulkPrecompute(words, words);
        }
    }

    @Benchmark
    public long encode(TestData td) {
        long sum = 0;
        List<String> w = td.words;
        for (int i = 0; i < w.size(); i++) {
            sum += td.encoder.encode(w.get(i), w.get((i * 31 + 7) & 255));
        }
        return sum;
    }

    @Benchmark
    public long cached(TestData td) {
        long sum = 0;
        for (int i = 0; i < 256; i++) {
            sum += td.cache.lookupOrCompute((i * 31 + 7) & 255, i);
        }
        return sum;
    }
}
