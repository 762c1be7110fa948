package com.models_api.util;

import com.models_api.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Validates and quotes table/column names before they are concatenated into SQL.
 */
public final class SqlIdentifiers {

    private static final Pattern SAFE_IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{0,62}$");

    private SqlIdentifiers() {
    }

    public static String quoteTable(String tableName) {
        return quote("table", tableName);
    }

    public static String quoteColumn(String columnName) {
        return quote("column", columnName);
    }

    public static boolean isValid(String identifier) {
        return identifier != null && SAFE_IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    private static String quote(String kind, String identifier) {
        if (!isValid(identifier)) {
            throw new ValidationException("Invalid " + kind + " name: " + identifier);
        }
        return "\"" + identifier + "\"";
    }
}
