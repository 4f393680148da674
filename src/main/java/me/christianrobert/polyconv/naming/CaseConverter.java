package me.christianrobert.polyconv.naming;

import java.util.regex.Pattern;

/**
 * Identifier case conversions between the source language's snake_case and the
 * camel-case conventions of the target drivers.
 *
 * <p>An identifier counts as snake_case when it is entirely upper case or entirely lower case
 * (digits and underscores allowed after the first letter). Mixed-case identifiers are assumed to
 * be camel-cased already and only get their first character adjusted.</p>
 *
 * <p>Repeated application is not guaranteed to be stable.</p>
 */
public final class CaseConverter {

    private static final Pattern SNAKE_CASE = Pattern.compile("[A-Z][A-Z0-9_]*|[a-z][a-z0-9_]*");

    private CaseConverter() {
    }

    /**
     * {@code foo_bar} → {@code FooBar}, {@code foo_bar_} → {@code FooBar_}, {@code fooBar} → {@code FooBar}.
     */
    public static String titleJoin(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        if (!isSnakeCase(identifier)) {
            return Character.toUpperCase(identifier.charAt(0)) + identifier.substring(1);
        }
        StringBuilder sb = new StringBuilder();
        for (String chunk : identifier.split("_", -1)) {
            sb.append(titleCase(chunk));
        }
        return appendTrailingUnderscore(sb, identifier);
    }

    /**
     * {@code foo_bar} → {@code fooBar}, {@code GET_FIELD} → {@code getField}, {@code FooBar} → {@code fooBar}.
     */
    public static String leadLower(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        if (!isSnakeCase(identifier)) {
            return Character.toLowerCase(identifier.charAt(0)) + identifier.substring(1);
        }
        String[] chunks = identifier.split("_", -1);
        StringBuilder sb = new StringBuilder(chunks[0].toLowerCase());
        for (int i = 1; i < chunks.length; i++) {
            sb.append(titleCase(chunks[i]));
        }
        return appendTrailingUnderscore(sb, identifier);
    }

    public static boolean isSnakeCase(String identifier) {
        return identifier != null && SNAKE_CASE.matcher(identifier).matches();
    }

    private static String appendTrailingUnderscore(StringBuilder sb, String original) {
        if (original.endsWith("_")) {
            sb.append('_');
        }
        return sb.toString();
    }

    /**
     * Upper-cases every letter that follows a non-letter (including digits) and lower-cases the rest.
     */
    static String titleCase(String chunk) {
        StringBuilder sb = new StringBuilder(chunk.length());
        boolean previousCased = false;
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousCased ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousCased = true;
            } else {
                sb.append(c);
                previousCased = false;
            }
        }
        return sb.toString();
    }
}
