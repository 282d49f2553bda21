package com.alphaguard.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Malformed or incomplete governance configuration.
 *
 * <p>Always names the offending file and field so a failed startup or CI run
 * points straight at the line to fix. Never partially applied: the loader
 * throws before any registry snapshot is published.
 */
@Getter
public class ValidationException extends BaseException {

    private final String file;
    private final String field;

    public ValidationException(String file, String field, String reason) {
        this(file, field, reason, null);
    }

    public ValidationException(String file, String field, String reason, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, format(file, field, reason), details(file, field, reason), cause);
        this.file = file;
        this.field = field;
    }

    private static String format(String file, String field, String reason) {
        return String.format("%s: field '%s': %s", file, field, reason);
    }

    private static Map<String, Object> details(String file, String field, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("file", file);
        details.put("field", field);
        details.put("reason", reason);
        return details;
    }
}
