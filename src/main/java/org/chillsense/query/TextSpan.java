package org.chillsense.query;

/**
 * A range within a single line. All values are 0-based; {@code endColumn} is exclusive.
 */
public record TextSpan(int line, int startColumn, int endColumn) {}
