package org.chillsense.frontend.model;

/**
 * Closed set of things a name can denote. Completion candidates, hover lookups and
 * outline entries are all tagged with one of these kinds; protocol adapters map them
 * with an exhaustive switch.
 */
public enum SymbolKind {
    /** A reserved word of the language. */
    KEYWORD,
    /** A predefined name (built-in routine, mode, constant or time unit). */
    PREDEFINED,
    /** A {@code DCL} declaration. */
    DCL,
    /** A {@code NEWMODE} or {@code SYNMODE} definition. */
    MODE,
    /** A {@code SYN} constant. */
    SYNONYM,
    PROC,
    PROCESS,
    MODULE,
    SIGNAL
}
