package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static solver.constants.SolverConstants.WORD_LENGTH;

/**
 * The two static word lists: the Answer Set (possible secrets) and the Guess Set
 * (everything a player may submit). Loaded once and never modified.
 *
 * <p>File order is kept; it is the order in which guesses are scored and therefore
 * the tie-break order.</p>
 */
public final class Vocabulary {

    private static final Logger log = LoggerFactory.getLogger(Vocabulary.class);

    private final List<String> guesses;
    private final List<String> answers;
    private final List<String> allWords;
    private final Set<String> guessSet;
    private final Set<String> answerSet;

    private Vocabulary(List<String> guesses, List<String> answers) {
        if (answers.isEmpty()) throw new IllegalArgumentException("Answer list is empty");
        this.guesses = Collections.unmodifiableList(guesses);
        this.answers = Collections.unmodifiableList(answers);
        this.guessSet = Collections.unmodifiableSet(new LinkedHashSet<>(guesses));
        this.answerSet = Collections.unmodifiableSet(new LinkedHashSet<>(answers));

        LinkedHashSet<String> all = new LinkedHashSet<>(guesses);
        all.addAll(answers);
        this.allWords = List.copyOf(all);
    }

    public static Vocabulary load(Path guessFile, Path answerFile) throws IOException {
        List<String> g = readWordList(guessFile);
        List<String> a = readWordList(answerFile);
        log.info("Loaded {} allowed guesses and {} possible answers.", g.size(), a.size());
        return new Vocabulary(g, a);
    }

    public static Vocabulary of(List<String> guesses, List<String> answers) {
        return new Vocabulary(normalize(guesses, "guesses"), normalize(answers, "answers"));
    }

    /**
     * One word per non-blank line, trimmed and lower-cased. Duplicates are dropped.
     *
     * @throws IllegalArgumentException for a line that is not a five-letter word
     */
    public static List<String> readWordList(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        return normalize(lines, file.toString());
    }

    private static List<String> normalize(List<String> raw, String source) {
        LinkedHashSet<String> words = new LinkedHashSet<>();
        int lineNo = 0;
        int duplicates = 0;
        for (String line : raw) {
            lineNo++;
            String w = line.trim().toLowerCase(Locale.ROOT);
            if (w.isEmpty()) continue;
            if (!isWord(w)) {
                throw new IllegalArgumentException(
                        source + " line " + lineNo + ": not a " + WORD_LENGTH + "-letter word: '" + line + "'");
            }
            if (!words.add(w)) duplicates++;
        }
        if (duplicates > 0) {
            log.warn("{}: dropped {} duplicate word(s)", source, duplicates);
        }
        return new ArrayList<>(words);
    }

    public static boolean isWord(String w) {
        if (w == null || w.length() != WORD_LENGTH) return false;
        for (int i = 0; i < WORD_LENGTH; i++) {
            char c = w.charAt(i);
            if (c < 'a' || c > 'z') return false;
        }
        return true;
    }

    /** Guess Set in file order. */
    public List<String> guesses() { return guesses; }

    /** Answer Set in file order. */
    public List<String> answers() { return answers; }

    /** Guess Set followed by the answers it does not already contain. */
    public List<String> allWords() { return allWords; }

    public Set<String> answerSet() { return answerSet; }

    public boolean isAnswer(String word) { return answerSet.contains(word); }

    /** Valid guesses are words of either list. */
    public boolean isValidGuess(String word) {
        return guessSet.contains(word) || answerSet.contains(word);
    }
}
