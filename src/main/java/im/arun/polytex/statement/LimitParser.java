package im.arun.polytex.statement;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the human-readable limits printed in a statement header,
 * e.g. "time limit per test 2 seconds" or "memory limit per test 256 megabytes".
 */
public final class LimitParser {
    private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");

    private LimitParser() {}

    /**
     * @return the limit in milliseconds, or null when no number with a known unit is present
     */
    public static Integer parseTimeLimitMillis(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Double value = null;
        for (String token : lower.split("\\s+")) {
            String cleaned = token.replace(',', '.');
            if (NUMBER.matcher(cleaned).matches()) {
                value = Double.parseDouble(cleaned);
                break;
            }
        }
        if (value == null) {
            return null;
        }
        if (lower.contains("millisecond")) {
            return (int) Math.round(value);
        }
        if (lower.contains("second")) {
            return (int) Math.round(value * 1000);
        }
        return null;
    }

    /**
     * @return the limit in megabytes, or null when no number followed by a megabyte/gigabyte unit is present
     */
    public static Integer parseMemoryLimitMegabytes(String text) {
        if (text == null) {
            return null;
        }
        String[] parts = text.toLowerCase(Locale.ROOT).trim().split("\\s+");
        for (int i = 0; i < parts.length; i++) {
            Matcher matcher = NUMBER.matcher(parts[i]);
            if (!matcher.matches()) {
                continue;
            }
            double value = Double.parseDouble(parts[i]);
            String unit = i + 1 < parts.length ? parts[i + 1] : "";
            if (unit.startsWith("m")) {
                return (int) value;
            }
            if (unit.startsWith("g")) {
                return (int) (value * 1024);
            }
        }
        return null;
    }
}
