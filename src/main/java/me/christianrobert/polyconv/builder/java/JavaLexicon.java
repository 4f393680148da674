package me.christianrobert.polyconv.builder.java;

import java.util.Map;
import java.util.Set;

/**
 * Fixed name tables for the Java target.
 */
final class JavaLexicon {

    /**
     * Java reserved words. A query-API method or variable colliding with one gets a trailing underscore.
     */
    static final Set<String> RESERVED_WORDS = Set.of(
        "abstract", "continue", "for", "new", "switch", "assert",
        "default", "goto", "package", "synchronized", "boolean", "do",
        "if", "private", "this", "break", "double", "implements",
        "protected", "throw", "byte", "else", "import", "public",
        "throws", "case", "enum", "instanceof", "return", "transient",
        "catch", "extends", "int", "short", "try", "char", "final",
        "interface", "static", "void", "class", "finally", "long",
        "strictfp", "volatile", "const", "float", "native", "super",
        "while"
    );

    /**
     * Methods of {@code Object} the driver must not override.
     */
    static final Set<String> OBJECT_METHODS = Set.of(
        "clone", "equals", "finalize", "hashCode", "getClass",
        "notify", "notifyAll", "wait", "toString"
    );

    /**
     * Renamed query-API methods, keyed by their lead-lower name.
     */
    static final Map<String, String> METHOD_ALIASES = Map.of(
        "getField", "g"
    );

    /**
     * Query-API constants that are methods in the Java driver.
     */
    static final Set<String> TOPLEVEL_CONSTANTS = Set.of(
        "monday", "tuesday", "wednesday", "thursday", "friday",
        "saturday", "sunday", "january", "february", "march", "april",
        "may", "june", "july", "august", "september", "october",
        "november", "december", "minval", "maxval", "error"
    );

    /**
     * The source language needs a trailing underscore on these; Java does not.
     */
    static final Map<String, String> SOURCE_KEYWORD_ESCAPES = Map.of(
        "or_", "or",
        "and_", "and",
        "not_", "not"
    );

    static final Map<String, String> NAME_CONSTANTS = Map.of(
        "True", "true",
        "False", "false",
        "None", "null",
        "nil", "null"
    );

    static final Map<String, String> CHARSETS = Map.of(
        "ascii", "US_ASCII",
        "utf-16", "UTF_16",
        "utf-8", "UTF_8"
    );

    /**
     * Static type every query expression shares; used to disambiguate null arguments.
     */
    static final String QUERY_EXPR_TYPE = "ReqlExpr";

    private JavaLexicon() {
    }

    static boolean collides(String name) {
        return RESERVED_WORDS.contains(name) || OBJECT_METHODS.contains(name);
    }
}
