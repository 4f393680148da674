package me.christianrobert.polyconv.builder;

import me.christianrobert.polyconv.ast.BytesLiteral;

/**
 * String and byte literal escaping for the target languages.
 *
 * <p>All three targets keep printable characters verbatim. They differ in how a non-printable
 * character is spelled: Java only knows four-hex-digit unicode escapes, JavaScript and Ruby accept
 * the short {@code \xNN} form for code points below 256.</p>
 */
public final class LiteralEscaper {

    private LiteralEscaper() {
    }

    /**
     * Java double-quoted literal. Every non-printable code point becomes {@code \\uXXXX};
     * supplementary characters are spelled as two escaped surrogates.
     */
    public static String javaString(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else {
                        for (char unit : Character.toChars(cp)) {
                            sb.append(String.format("\\u%04x", (int) unit));
                        }
                    }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * JavaScript literal. Single quotes unless the value contains a single quote and no double quote.
     */
    public static String javaScriptString(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(quote);
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == quote || cp == '\\') {
                sb.append('\\').append((char) cp);
            } else if (!appendCommonEscape(sb, cp)) {
                if (isPrintable(cp)) {
                    sb.appendCodePoint(cp);
                } else if (cp < 0x100) {
                    sb.append(String.format("\\x%02x", cp));
                } else if (cp < 0x10000) {
                    sb.append(String.format("\\u%04x", cp));
                } else {
                    sb.append(String.format("\\u{%x}", cp));
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Ruby literal. Single-quoted when every character is printable (only backslash and quote
     * need escaping there); otherwise double-quoted, where {@code #} is escaped to prevent
     * interpolation.
     */
    public static String rubyString(String value) {
        boolean needsEscapes = value.codePoints().anyMatch(cp -> !isPrintable(cp));
        if (!needsEscapes) {
            return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '"' || cp == '\\' || cp == '#') {
                sb.append('\\').append((char) cp);
            } else if (!appendCommonEscape(sb, cp)) {
                if (isPrintable(cp)) {
                    sb.appendCodePoint(cp);
                } else if (cp < 0x100) {
                    sb.append(String.format("\\x%02X", cp));
                } else if (cp < 0x10000) {
                    sb.append(String.format("\\u%04X", cp));
                } else {
                    sb.append(String.format("\\u{%X}", cp));
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Byte string body for JavaScript ({@code '...'}) and Ruby ({@code "..."}): printable ASCII
     * verbatim, everything else as {@code \xNN}.
     *
     * @param quote Quote character to use and escape
     * @param escapeHash Whether {@code #} must be escaped (Ruby double quotes)
     */
    public static String byteString(BytesLiteral bytes, char quote, boolean escapeHash) {
        StringBuilder sb = new StringBuilder().append(quote);
        for (int i = 0; i < bytes.size(); i++) {
            int b = bytes.get(i);
            if (b == quote || b == '\\' || (escapeHash && b == '#')) {
                sb.append('\\').append((char) b);
            } else if (appendCommonEscape(sb, b)) {
                continue;
            } else if (b >= 0x20 && b < 0x7f) {
                sb.append((char) b);
            } else {
                sb.append(String.format("\\x%02x", b));
            }
        }
        return sb.append(quote).toString();
    }

    private static boolean appendCommonEscape(StringBuilder sb, int cp) {
        switch (cp) {
            case '\n': sb.append("\\n"); return true;
            case '\r': sb.append("\\r"); return true;
            case '\t': sb.append("\\t"); return true;
            default: return false;
        }
    }

    /**
     * Printable in the source language's sense: everything except control, format, surrogate,
     * private-use and unassigned code points, and separators other than the plain space.
     */
    public static boolean isPrintable(int codePoint) {
        if (codePoint == ' ') {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }
}
