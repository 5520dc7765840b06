package org.dxworks.rapidframe.model;

public enum LineKind {
    CODE,
    COMMENT,
    BLANK
}
