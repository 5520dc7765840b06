package org.dxworks.rapidframe.model;

public enum RoutineKind {
    PROC,
    FUNC,
    TRAP
}
