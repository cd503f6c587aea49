package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.GuessSelector;
import solver.contracts.PatternCache;
import solver.contracts.SolverOptions;
import solver.contracts.TaskPool;
import solver.records.SolverConfig;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import static solver.constants.SolverConstants.*;

/**
 * Implements the SolverOptions contract to manage settings of the interactive loop.
 */
public class SolverOptionsImpl implements SolverOptions {

    private static final Logger log = LoggerFactory.getLogger(SolverOptionsImpl.class);

    private final Map<String, GuessSelector> selectors;
    private final PatternCache cache;
    private final Path cacheFile;
    private final TaskPool taskPool;
    private final PrintStream out;

    private record SolverOption(String type, String defaultValue, String min, String max, Consumer<String> onSet) {
        void print(PrintStream out, String name, String current) {
            StringBuilder sb = new StringBuilder("option name ").append(name).append(" type ").append(type);
            if (defaultValue != null) sb.append(" default ").append(defaultValue);
            if (min != null) sb.append(" min ").append(min);
            if (max != null) sb.append(" max ").append(max);
            if (current != null) sb.append(" value ").append(current);
            out.println(sb);
        }
    }

    private final Map<String, SolverOption> options = new LinkedHashMap<>();
    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * @param selectors one selector per strategy key
     *                  ({@code minimax_entropy}, {@code letter_freq})
     */
    public SolverOptionsImpl(SolverConfig config,
                             Map<String, GuessSelector> selectors,
                             PatternCache cache,
                             TaskPool taskPool,
                             PrintStream out) {
        this.selectors = Map.copyOf(selectors);
        this.cache     = cache;
        this.cacheFile = config.cacheFile();
        this.taskPool  = taskPool;
        this.out       = out;
        if (!this.selectors.containsKey(config.strategy())) {
            throw new IllegalArgumentException("No selector for strategy " + config.strategy());
        }
        initializeOptions(config);
    }

    private void initializeOptions(SolverConfig config) {
        options.put("Hard Mode", new SolverOption("check", Boolean.toString(config.hardMode()), null, null,
                v -> values.put("Hard Mode", Boolean.toString(parseCheck(v)))));
        options.put("Strategy", new SolverOption("combo", config.strategy(), null, null,
                v -> {
                    String key = v.toLowerCase(Locale.ROOT);
                    if (!selectors.containsKey(key)) throw new IllegalArgumentException("unknown strategy " + v);
                    values.put("Strategy", key);
                }));
        options.put("Threads", new SolverOption("spin", Integer.toString(config.threads()), "1", "128",
                v -> {
                    int n = parseSpin(v, 1, 128);
                    taskPool.setParallelism(n);
                    values.put("Threads", Integer.toString(n));
                }));
        options.put("Show", new SolverOption("spin", Integer.toString(SHOW_ALL_LIMIT), "0", "10000",
                v -> values.put("Show", Integer.toString(parseSpin(v, 0, 10000)))));
        options.put("Clear Cache", new SolverOption("button", null, null, null,
                v -> cache.clear()));
        options.put("Save Cache", new SolverOption("button", null, null, null,
                v -> {
                    if (!cache.save(cacheFile)) throw new IllegalStateException("cache not saved");
                }));

        values.put("Hard Mode", Boolean.toString(config.hardMode()));
        values.put("Strategy", config.strategy());
        values.put("Threads", Integer.toString(taskPool.getParallelism()));
        values.put("Show", Integer.toString(SHOW_ALL_LIMIT));
    }

    private static boolean parseCheck(String v) {
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new IllegalArgumentException("expected true or false");
    }

    private static int parseSpin(String v, int min, int max) {
        int n = Integer.parseInt(v);
        if (n < min || n > max) throw new IllegalArgumentException("out of range " + min + ".." + max);
        return n;
    }

    @Override
    public String getOptionValue(String name) {
        SolverOption o = options.get(name);
        if (o == null) return null;
        String current = values.get(name);
        return current != null ? current : o.defaultValue;
    }

    @Override
    public boolean setOption(String line) {
        String[] parts = line.split(" value ", 2);
        String namePart = parts[0].replaceFirst("^setoption\\s+name\\s+", "").trim();
        String valuePart = parts.length > 1 ? parts[1].trim() : "";

        SolverOption option = options.get(namePart);
        if (option == null) {
            out.println("Unknown option: " + namePart);
            return false;
        }
        try {
            option.onSet.accept(valuePart);
            log.debug("Option '{}' set to '{}'", namePart, getOptionValue(namePart));
            return true;
        } catch (RuntimeException e) {
            out.println("Error setting option " + namePart + ": " + e.getMessage());
            return false;
        }
    }

    @Override
    public void printOptions() {
        for (Map.Entry<String, SolverOption> entry : options.entrySet()) {
            entry.getValue().print(out, entry.getKey(), values.get(entry.getKey()));
        }
    }

    @Override
    public boolean hardMode() {
        return Boolean.parseBoolean(values.get("Hard Mode"));
    }

    @Override
    public int showLimit() {
        return Integer.parseInt(values.get("Show"));
    }

    @Override
    public GuessSelector selector() {
        return selectors.get(values.get("Strategy"));
    }
}
