package com.ctlchecker.core.exception;

/**
 * Raised when a Kripke structure is built or queried in a way that breaks one of its
 * invariants. Always thrown synchronously at the offending call; never retried.
 */
public class KripkeStructureException extends RuntimeException {
    private final ErrorKind kind;

    public KripkeStructureException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Classification of structure errors. Callers switch on this rather than on messages.
     */
    public enum ErrorKind {
        /** An atom name that was never registered. */
        UNKNOWN_ATOM,
        /** A start, transition or label operation names an undeclared state. */
        UNKNOWN_STATE,
        /** A state name is already in use. */
        DUPLICATE_STATE,
        /** Atoms cannot be registered once any state exists. */
        ATOMS_FROZEN,
        /** A label sets a bit at or beyond the number of declared atoms. */
        LABEL_OUT_OF_RANGE,
        /** The same atom name appears twice in one atom list. */
        DUPLICATE_ATOM,
        /** More atoms than fit into a {@code long} label. */
        TOO_MANY_ATOMS,
        /** An edge removal names an edge that does not exist. */
        UNKNOWN_TRANSITION
    }
}
