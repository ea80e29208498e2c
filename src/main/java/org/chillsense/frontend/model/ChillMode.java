package org.chillsense.frontend.model;

/**
 * Categories of CHILL data modes (types) as far as the symbol scanner can tell them apart.
 * The scanner never evaluates a mode; it only classifies the leading keyword of its text.
 */
public enum ChillMode {
    INT("INT"),
    BOOL("BOOL"),
    CHAR("CHAR"),
    /** Character string. */
    CHARS("CHARS"),
    /** Bit string. */
    BOOLS("BOOLS"),
    /** Enumeration. */
    SET("SET"),
    /** Integer subrange. */
    RANGE("RANGE"),
    POWERSET("POWERSET"),
    REF("REF"),
    STRUCT("STRUCT"),
    ARRAY("ARRAY"),
    PROC("PROC"),
    PROCESS("PROCESS"),
    BUFFER("BUFFER"),
    EVENT("EVENT"),
    SIGNAL("SIGNAL"),
    ASSOCIATION("ASSOCIATION"),
    ACCESS("ACCESS"),
    TEXT("TEXT"),
    DURATION("DURATION"),
    TIME("TIME"),
    USER_DEFINED("USER"),
    UNKNOWN("UNKNOWN");

    private final String label;

    ChillMode(String label) {
        this.label = label;
    }

    /**
     * Returns the label shown in hover texts, completion details and outlines.
     * @return The display label, e.g. {@code USER} for {@link #USER_DEFINED}.
     */
    public String label() {
        return label;
    }
}
