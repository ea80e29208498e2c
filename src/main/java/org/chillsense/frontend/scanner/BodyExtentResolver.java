package org.chillsense.frontend.scanner;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Finds the {@code END} that closes a module, procedure or process by counting nesting depth.
 *
 * <p>Depth starts at 1 on the line after the header. Nested named headers
 * ({@code name: PROC|PROCESS|MODULE|REGION}) and lines starting with {@code BEGIN} open a level;
 * lines starting with {@code END} close one.</p>
 */
public final class BodyExtentResolver {

    private static final Pattern NESTED_HEADER =
            Pattern.compile("^[A-Z_][A-Z0-9_]*\\s*:\\s*(?:SPEC\\s+)?(?:PROC|PROCESS|MODULE|REGION)\\b");
    private static final Pattern BEGIN = Pattern.compile("^BEGIN\\b");
    private static final Pattern END = Pattern.compile("^END\\b");

    private BodyExtentResolver() {}

    /**
     * @param lines       The comment-free document lines.
     * @param headerIndex The 0-based index of the header line.
     * @return The 1-based line of the closing {@code END}, or empty if the construct is unterminated.
     */
    public static OptionalInt resolve(List<String> lines, int headerIndex) {
        int depth = 1;
        for (int i = headerIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i).trim().toUpperCase(Locale.ROOT);
            if (NESTED_HEADER.matcher(line).find() || BEGIN.matcher(line).find()) {
                depth++;
            } else if (END.matcher(line).find()) {
                depth--;
                if (depth == 0) {
                    return OptionalInt.of(i + 1);
                }
            }
        }
        return OptionalInt.empty();
    }
}
