package org.dxworks.rapidframe.model;

public enum CallKind {
    /** Procedure call statement or function call inside an expression. */
    STATIC,
    /** CallByVar: the callee name is a prefix completed at runtime. */
    DYNAMIC,
    /**
     * Bare mention of a name on a routine line, such as the statement after a
     * compact IF or the trap in CONNECT ... WITH. Only links to known procedures.
     */
    REFERENCE
}
