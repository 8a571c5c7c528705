package im.arun.polytex.tex;

import java.util.Map;

/**
 * Character-level LaTeX escaping and the Unicode math glyph rewrite applied to rendered sections.
 */
public final class TexEscaper {

    private static final Map<Character, String> LATEX_SPECIALS = Map.of(
        '\\', "\\textbackslash{}",
        '{', "\\{",
        '}', "\\}",
        '#', "\\#",
        '$', "\\$",
        '%', "\\%",
        '&', "\\&",
        '_', "\\_",
        '^', "\\textasciicircum{}",
        '~', "\\textasciitilde{}"
    );

    private static final Map<Character, String> MATH_GLYPHS = Map.of(
        '≤', "\\leq{}",
        '≥', "\\geq{}",
        '≠', "\\neq{}",
        '±', "\\pm{}",
        '×', "\\times{}",
        '÷', "\\div{}",
        '·', "\\cdot{}",
        '⋅', "\\cdot{}"
    );

    private TexEscaper() {}

    /**
     * Escape every LaTeX control character in {@code text}; all other characters pass through.
     */
    public static String escape(String text) {
        return substitute(text, LATEX_SPECIALS);
    }

    /**
     * Replace the math glyphs commonly pasted into statements with their LaTeX commands.
     * Each command ends with {@code {}} so it cannot run into a following letter.
     */
    public static String normalizeMath(String text) {
        return substitute(text, MATH_GLYPHS);
    }

    private static String substitute(String text, Map<Character, String> table) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            String replacement = table.get(ch);
            if (replacement != null) {
                out.append(replacement);
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }
}
