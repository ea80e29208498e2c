package org.chillsense.frontend.scanner;

/**
 * Thrown by a line classifier when a line has the right leading keyword but the rest
 * cannot be read. The scanner skips such lines.
 */
public class MalformedLineException extends Exception {

    private final int line;

    public MalformedLineException(int line, String message) {
        super(message);
        this.line = line;
    }

    public MalformedLineException(int line, String message, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * @return The 1-based line that could not be read.
     */
    public int getLine() {
        return line;
    }
}
