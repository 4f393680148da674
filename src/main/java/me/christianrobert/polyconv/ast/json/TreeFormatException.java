package me.christianrobert.polyconv.ast.json;

/**
 * Thrown when a serialized expression tree is not well-formed: invalid JSON, an unknown node kind,
 * or a missing or mistyped field.
 */
public class TreeFormatException extends RuntimeException {

    private final String path;

    public TreeFormatException(String message, String path) {
        super(message + " at " + path);
        this.path = path;
    }

    public TreeFormatException(String message, String path, Throwable cause) {
        super(message + " at " + path, cause);
        this.path = path;
    }

    /**
     * JSON-pointer-like location of the offending element ({@code $.args[0].callee}).
     */
    public String getPath() {
        return path;
    }
}
