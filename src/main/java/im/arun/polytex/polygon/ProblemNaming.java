package im.arun.polytex.polygon;

/**
 * Names of uploaded problems: {@code <prefix>-a}, {@code <prefix>-b}, ..., {@code -z}, {@code -aa}, ...
 */
public final class ProblemNaming {

    private ProblemNaming() {}

    /**
     * Zero-based index to a spreadsheet-style letter suffix: 0 is "a", 25 is "z", 26 is "aa".
     */
    public static String suffixFromIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
        StringBuilder suffix = new StringBuilder();
        int current = index;
        while (current >= 0) {
            suffix.insert(0, (char) ('a' + current % 26));
            current = current / 26 - 1;
        }
        return suffix.toString();
    }

    public static String problemName(String prefix, int index) {
        return prefix + "-" + suffixFromIndex(index);
    }
}
