package com.chainscope.adapter.indexed;

import com.chainscope.common.error.ResponseParseException;

/**
 * Required-field checks shared by the row schemas.
 */
final class Rows {

    private Rows() {
    }

    static void require(String action, String field, String value) {
        if (value == null) {
            throw new ResponseParseException(action + " row without " + field);
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    static int intOrDefault(String value, int fallback) {
        if (!hasText(value)) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ResponseParseException("Invalid integer field: " + value, e);
        }
    }
}
