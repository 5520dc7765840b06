package org.dxworks.rapidframe.model;

public enum DiagnosticKind {
    MALFORMED_NESTING,
    UNTERMINATED_PROCEDURE,
    DUPLICATE_PROCEDURE,
    ENTRY_MISSING,
    AMBIGUOUS_NAME,
    DANGLING_CALL,
    ORACLE_UNAVAILABLE,
    FILE_FAILED
}
