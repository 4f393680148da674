package me.christianrobert.polyconv.context;

import me.christianrobert.polyconv.ast.ExpressionNode;
import me.christianrobert.polyconv.util.NodeDumper;

/**
 * Exception thrown while converting a snippet to a target language.
 * Captures a textual dump of the offending node so batch callers can log and move on.
 *
 * <p>Subclasses form the error taxonomy:</p>
 * <ul>
 *   <li>{@link UnmodeledConstructException} - no rule for an observed shape</li>
 *   <li>{@link IntentionallyUnsupportedException} - a skip rule matched (expected omission)</li>
 *   <li>{@link AmbiguousSourceException} - source construct the target cannot express unambiguously</li>
 *   <li>{@link TypeMappingGapException} - no declared-type mapping for a value kind</li>
 * </ul>
 */
public abstract class ConversionException extends RuntimeException {

    private final String nodeDump;

    protected ConversionException(String message, ExpressionNode node) {
        super(message);
        this.nodeDump = node != null ? NodeDumper.dump(node) : null;
    }

    protected ConversionException(String message, ExpressionNode node, Throwable cause) {
        super(message, cause);
        this.nodeDump = node != null ? NodeDumper.dump(node) : null;
    }

    /**
     * Category reported in {@link ConversionResult}.
     */
    public abstract ErrorCategory getCategory();

    public String getNodeDump() {
        return nodeDump;
    }

    /**
     * Gets a detailed error message including the node dump.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (nodeDump != null) {
            sb.append("\nNode: ").append(nodeDump);
        }
        return sb.toString();
    }
}
