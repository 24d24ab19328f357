package com.labsweep.sequence;

/**
 * Malformed sequence text: the first node is not at level 0, a line skips a level,
 * a field holds a character the format cannot represent, or a line is deeper than the store allows.
 */
public final class SequenceFormatException extends RuntimeException {

    private final int lineNumber;
    private final String line;

    public SequenceFormatException(String message, int lineNumber, String line) {
        super("Invalid sequence format at line " + lineNumber + ": " + message + " [" + line + "]");
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 1-based line number in the source text. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
