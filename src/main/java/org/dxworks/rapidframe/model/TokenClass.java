package org.dxworks.rapidframe.model;

public enum TokenClass {
    VALID,
    SHORT,
    UNKNOWN
}
