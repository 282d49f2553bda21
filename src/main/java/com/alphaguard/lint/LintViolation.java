package com.alphaguard.lint;

import lombok.Value;

/**
 * One isolation-gate finding, located by file and line. Line 0 means the whole file.
 */
@Value
public class LintViolation {

    public enum Kind {
        IMPORT,
        REFERENCE,
        PARSE_ERROR,
        ACTION_FIELD,
        FAILURE_RULE
    }

    Kind kind;
    String path;
    int line;
    String symbol;
    String message;

    public String location() {
        return line > 0 ? path + ":" + line : path;
    }

    @Override
    public String toString() {
        return location() + ": " + message;
    }
}
