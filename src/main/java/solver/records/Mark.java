package solver.records;

/**
 * Per-position classification of a guess letter against a secret.
 * The ordinal is the base-3 digit used in packed patterns.
 */
public enum Mark {
    ABSENT('0'),
    MISPLACED('1'),
    EXACT('2');

    private final char symbol;

    Mark(char symbol) {
        this.symbol = symbol;
    }

    /** External notation: '0', '1' or '2'. */
    public char symbol() {
        return symbol;
    }

    public static Mark fromDigit(int digit) {
        return switch (digit) {
            case 0 -> ABSENT;
            case 1 -> MISPLACED;
            case 2 -> EXACT;
            default -> throw new IllegalArgumentException("Not a mark digit: " + digit);
        };
    }
}
