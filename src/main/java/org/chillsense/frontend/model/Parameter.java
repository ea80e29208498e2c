package org.chillsense.frontend.model;

/**
 * A formal parameter of a procedure or process.
 *
 * @param name      The parameter name.
 * @param mode      The mode text, or {@code UNKNOWN} when the entry held a single token.
 * @param direction The passing direction.
 */
public record Parameter(String name, String mode, Direction direction) {

    /**
     * Parameter passing direction. {@link #IN} is the default when no keyword is present.
     */
    public enum Direction {
        IN,
        OUT,
        INOUT
    }
}
