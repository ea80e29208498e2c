package org.chillsense.frontend.semantics;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Fixed vocabulary of CHILL: reserved words (Z.200 Appendix III), predefined names
 * (Appendix III.2 plus common implementation extensions) and short keyword descriptions
 * used by hover.
 */
public final class ChillLanguage {

    private static final Set<String> RESERVED_WORDS = sortedSet(
            "ABSTRACT", "ACCESS", "AFTER", "ALL", "AND", "ANDIF", "ANY",
            "ARRAY", "ASSERT", "AT", "BASED_ON", "BEGIN", "BIN", "BODY",
            "BOOLS", "BUFFER", "BY", "CASE", "CAUSE", "CHARS", "CONTEXT",
            "CONTINUE", "CYCLE", "DCL", "DELAY", "DO", "DOWN", "DYNAMIC",
            "ELSE", "ELSIF", "END", "ESAC", "EVENT", "EVER", "EXCEPTIONS",
            "EXIT", "FI", "FINAL", "FOR", "FORBID", "GENERAL", "GENERIC",
            "GOTO", "GRANT", "IF", "IMPLEMENTS", "IN", "INCOMPLETE", "INIT",
            "INLINE", "INOUT", "INTERFACE", "INVARIANT", "LOC", "MOD",
            "MODE", "MODULE", "NEW", "NEWMODE", "NONREF", "NOPACK", "NOT",
            "OD", "OF", "ON", "OR", "ORIF", "OUT", "PACK", "POS", "POST",
            "POWERSET", "PRE", "PREFIXED", "PRIORITY", "PROC", "PROCESS",
            "RANGE", "READ", "RECEIVE", "REF", "REGION", "REM", "REMOTE",
            "RESULT", "RETURN", "RETURNS", "ROW", "SEIZE", "SELF", "SEND",
            "SET", "SIGNAL", "SIMPLE", "SPEC", "START", "STATIC", "STEP",
            "STOP", "STRUCT", "SYN", "SYNMODE", "TASK", "TEXT", "THEN",
            "THIS", "TIMEOUT", "TO", "UP", "VARYING", "WCHARS", "WHILE",
            "WITH", "WTEXT", "XOR", "NOT_ASSIGNABLE", "ANY_ASSIGN",
            "ANY_DISCRETE", "ANY_INT", "ANY_REAL", "ASSIGNABLE", "CONSTR",
            "DESTR", "REIMPLEMENT");

    private static final Set<String> PREDEFINED_NAMES = sortedSet(
            // built-in routines
            "ABS", "ABSTIME", "ALLOCATE", "ARCCOS", "ARCSIN", "ARCTAN",
            "ASSOCIATE", "CARD", "CONNECT", "COS", "CREATE", "DELETE",
            "DISCONNECT", "DISSOCIATE", "EOLN", "EXISTING", "EXP", "EXPIRED",
            "FIRST", "FLOAT", "GETASSOCIATION", "GETSTACK", "GETTEXTACCESS",
            "GETTEXTINDEX", "GETTEXTRECORD", "GETUSAGE", "INDEXABLE",
            "INTTIME", "ISASSOCIATED", "LAST", "LENGTH", "LN", "LOG", "LOWER",
            "MAX", "MIN", "MODIFY", "NUM", "OUTOFFILE", "PRED", "PTR",
            "READABLE", "READONLY", "READRECORD", "READTEXT", "READWRITE",
            "SAME", "SEQUENCIBLE", "SETTEXTACCESS", "SETTEXTINDEX",
            "SETTEXTRECORD", "SIN", "SIZE", "SQRT", "SUCC", "TAN", "TERMINATE",
            "UPPER", "USAGE", "VARIABLE", "WAIT", "WCHAR", "WHERE",
            "WRITEABLE", "WRITEONLY", "WRITERECORD", "WRITETEXT",
            // built-in modes
            "INT", "BOOL", "CHAR", "DURATION", "TIME", "ASSOCIATION", "INSTANCE",
            // implementation-defined modes (EWSD, GNU CHILL)
            "BYTE", "UBYTE", "UINT", "LONG", "ULONG", "REAL", "LONG_REAL",
            // constants
            "TRUE", "FALSE", "NULL",
            // time units
            "DAYS", "HOURS", "MILLISECS", "MINUTES", "SECS",
            "SECONDS", "MICROSECS");

    private static final Map<String, String> KEYWORD_DOCS = new TreeMap<>();

    static {
        doc("MODULE", "Defines a module - the basic unit of CHILL program structure");
        doc("DCL", "Declares a variable with a specified mode (type)");
        doc("NEWMODE", "Defines a new mode (type) derived from existing modes");
        doc("SYNMODE", "Defines a synonym mode (type alias)");
        doc("SYN", "Defines a synonym (named constant)");
        doc("PROC", "Defines a procedure");
        doc("PROCESS", "Defines a concurrent process");
        doc("SIGNAL", "Defines a signal for inter-process communication");
        doc("BUFFER", "Declares a buffer for inter-process message passing");
        doc("EVENT", "Declares an event for process synchronization");
        doc("REGION", "Defines a protected region for mutual exclusion");
        doc("IF", "Conditional statement");
        doc("THEN", "Introduces the consequent of IF");
        doc("ELSE", "Introduces the alternative of IF");
        doc("ELSIF", "Introduces an alternative condition");
        doc("FI", "Terminates IF statement");
        doc("CASE", "Case selection statement");
        doc("ESAC", "Terminates CASE statement");
        doc("DO", "Begins a loop construct");
        doc("OD", "Terminates a DO loop");
        doc("WHILE", "Loop while condition is true");
        doc("FOR", "Counted loop");
        doc("EXIT", "Exit from a loop");
        doc("RETURN", "Return from procedure with optional value");
        doc("GOTO", "Unconditional jump (discouraged)");
        doc("SEND", "Send a signal to a process");
        doc("RECEIVE", "Receive a signal from a process");
        doc("DELAY", "Delay process execution for a duration");
        doc("START", "Start a new process instance");
        doc("STOP", "Stop the current process");
        doc("BEGIN", "Begin a block");
        doc("END", "End a block or construct");
        doc("GRANT", "Make names visible outside module");
        doc("SEIZE", "Access names from another module");
        doc("INT", "Integer mode");
        doc("BOOL", "Boolean mode (TRUE/FALSE)");
        doc("CHAR", "Character mode");
        doc("CHARS", "Character string mode");
        doc("BOOLS", "Bit string mode");
        doc("SET", "Enumeration mode");
        doc("RANGE", "Integer subrange mode");
        doc("POWERSET", "Set of discrete values mode");
        doc("REF", "Reference (pointer) mode");
        doc("STRUCT", "Structure mode (record)");
        doc("ARRAY", "Array mode");
        doc("STATIC", "Static storage duration");
        doc("INIT", "Initialize with value");
        doc("LOC", "Local (stack) storage");
        doc("READ", "Read-only attribute");
        doc("AND", "Logical AND operator");
        doc("OR", "Logical OR operator");
        doc("NOT", "Logical NOT operator");
        doc("XOR", "Logical exclusive OR operator");
        doc("ANDIF", "Short-circuit AND (evaluates right only if left is TRUE)");
        doc("ORIF", "Short-circuit OR (evaluates right only if left is FALSE)");
        doc("MOD", "Modulo operator");
        doc("REM", "Remainder operator");
        doc("TRUE", "Boolean true value");
        doc("FALSE", "Boolean false value");
        doc("NULL", "Null reference value");
    }

    private ChillLanguage() {}

    public static boolean isReservedWord(String word) {
        return RESERVED_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isPredefined(String word) {
        return PREDEFINED_NAMES.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * @return All reserved words, upper case, alphabetically.
     */
    public static Set<String> reservedWords() {
        return RESERVED_WORDS;
    }

    /**
     * @return All predefined names, upper case, alphabetically.
     */
    public static Set<String> predefinedNames() {
        return PREDEFINED_NAMES;
    }

    /**
     * Looks up the one-line description of a keyword or predefined name.
     * @param word The word, any case.
     * @return The description, or empty if none is documented.
     */
    public static Optional<String> documentation(String word) {
        return Optional.ofNullable(KEYWORD_DOCS.get(word.toUpperCase(Locale.ROOT)));
    }

    private static void doc(String word, String text) {
        KEYWORD_DOCS.put(word, text);
    }

    private static Set<String> sortedSet(String... words) {
        return Collections.unmodifiableSet(new TreeSet<>(java.util.Arrays.asList(words)));
    }
}
