package org.chillsense.frontend.scanner;

import org.chillsense.frontend.model.ChillMode;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies mode text into a {@link ChillMode} without evaluating it.
 *
 * <p>The leading identifier of the text is compared as a whole token against the mode
 * constructor keywords, then against the built-in mode names. Since at most one keyword can
 * equal a token, the keywords carry no order: {@code SETTINGS} or {@code REFCOUNT} are
 * user-defined mode names, not {@code SET} or {@code REF} constructors.</p>
 */
public final class ModeInference {

    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^[A-Z_][A-Z0-9_]*");

    private static final Set<ChillMode> CONSTRUCTOR_KEYWORDS = EnumSet.of(
            ChillMode.SET, ChillMode.RANGE, ChillMode.STRUCT, ChillMode.ARRAY, ChillMode.REF,
            ChillMode.POWERSET, ChillMode.CHARS, ChillMode.BOOLS, ChillMode.PROC,
            ChillMode.BUFFER, ChillMode.EVENT, ChillMode.SIGNAL);

    private static final Map<String, ChillMode> BUILTIN_TOKENS = new LinkedHashMap<>();

    private static final Set<String> BUILTIN_MODE_NAMES = Set.of(
            "INT", "BOOL", "CHAR", "CHARS", "BOOLS", "BYTE", "UBYTE", "UINT", "LONG",
            "ULONG", "REAL", "LONG_REAL", "DURATION", "TIME", "ASSOCIATION", "INSTANCE");

    static {
        for (ChillMode mode : ChillMode.values()) {
            if (mode != ChillMode.USER_DEFINED && mode != ChillMode.UNKNOWN) {
                BUILTIN_TOKENS.put(mode.name(), mode);
            }
        }
        // implementation-defined numeric modes
        for (String alias : List.of("BYTE", "UBYTE", "UINT", "LONG", "ULONG", "REAL", "LONG_REAL")) {
            BUILTIN_TOKENS.put(alias, ChillMode.INT);
        }
    }

    private ModeInference() {}

    /**
     * Infers the category of the right-hand side of a mode definition.
     * Mode constructors are recognized by their leading keyword, anything else by its first token.
     * @param modeText The mode text, e.g. {@code RANGE(0:10)} or {@code my_mode}.
     * @return The inferred category.
     */
    public static ChillMode infer(String modeText) {
        String token = leadingToken(modeText);
        for (ChillMode constructor : CONSTRUCTOR_KEYWORDS) {
            if (constructor.name().equals(token)) {
                return constructor;
            }
        }
        return fromToken(token);
    }

    /**
     * Maps the first token of a mode text to a category.
     * @param modeText The mode text.
     * @return The built-in category, {@link ChillMode#USER_DEFINED} for any other name, or
     *         {@link ChillMode#UNKNOWN} for blank text.
     */
    public static ChillMode fromToken(String modeText) {
        String token = leadingToken(modeText);
        if (token.isEmpty()) {
            return ChillMode.UNKNOWN;
        }
        return BUILTIN_TOKENS.getOrDefault(token, ChillMode.USER_DEFINED);
    }

    /**
     * @param modeText The mode text.
     * @return {@code true} if the text starts with a built-in (non user-defined) mode name.
     */
    public static boolean isBuiltin(String modeText) {
        return BUILTIN_MODE_NAMES.contains(leadingToken(modeText));
    }

    private static String leadingToken(String modeText) {
        if (modeText == null) {
            return "";
        }
        Matcher m = LEADING_IDENTIFIER.matcher(modeText.trim().toUpperCase(Locale.ROOT));
        return m.find() ? m.group() : "";
    }
}
