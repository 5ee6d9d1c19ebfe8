package com.ctlchecker.loader;

/**
 * Raised when a structure document cannot be read or written: malformed JSON, a label of the
 * wrong shape, an unknown field, or an underlying I/O failure.
 *
 * <p>Invariant violations inside a well-formed document surface as
 * {@link com.ctlchecker.core.exception.KripkeStructureException} instead.
 */
public class StructureIoException extends RuntimeException {
    private final String source;

    public StructureIoException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public StructureIoException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
