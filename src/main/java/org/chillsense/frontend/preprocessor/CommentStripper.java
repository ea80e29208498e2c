package org.chillsense.frontend.preprocessor;

/**
 * Removes CHILL comments from source text before declaration scanning.
 *
 * <p>Two forms share one set of rules. {@link #strip} is the plain cleanup: comments are cut
 * out and the text closes up, which keeps line numbers but shifts columns after an inline block
 * comment. {@link #mask} blanks comments instead and is what {@link
 * org.chillsense.frontend.scanner.DeclarationScanner} runs, since name columns must point into
 * the editor's text. Use {@code strip} only where comment-free text is wanted and columns do
 * not matter.</p>
 *
 * <p>Block comments ({@code /* ... *}{@code /}) may span lines; every line break inside one is
 * kept so that line numbers of the cleaned text match the original. Line comments run from
 * {@code --} to the end of the line. An unterminated block comment extends to the end of the
 * text.</p>
 */
public final class CommentStripper {

    private CommentStripper() {}

    /**
     * Strips all comments from the given source. Columns after an inline block comment move
     * left; see {@link #mask} for the position-preserving form.
     * @param source The raw source text.
     * @return The text without comments, with exactly as many lines as the input.
     */
    public static String strip(String source) {
        return clean(source, false);
    }

    /**
     * Replaces every comment character except line breaks with a space.
     * The result has the same length as the input, so line and column positions are unchanged.
     * @param source The raw source text.
     * @return The masked text.
     */
    public static String mask(String source) {
        return clean(source, true);
    }

    private static String clean(String source, boolean keepColumns) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                int close = source.indexOf("*/", i + 2);
                int end = close < 0 ? n : close + 2;
                for (int k = i; k < end; k++) {
                    if (source.charAt(k) == '\n') {
                        out.append('\n');
                    } else if (keepColumns) {
                        out.append(' ');
                    }
                }
                i = end;
            } else if (c == '-' && i + 1 < n && source.charAt(i + 1) == '-') {
                int eol = source.indexOf('\n', i);
                int end = eol < 0 ? n : eol;
                if (keepColumns) {
                    out.append(" ".repeat(end - i));
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
