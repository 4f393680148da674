package me.christianrobert.polyconv.context;

/**
 * Result of converting one snippet to one target language.
 * Contains either the rendered target code, or the reason it was skipped or failed.
 */
public class ConversionResult {

    private final Status status;
    private final TargetLanguage language;
    private final String output;
    private final ErrorCategory errorCategory;
    private final String errorMessage;
    private final String taggedTree;

    private ConversionResult(Status status, TargetLanguage language, String output,
                             ErrorCategory errorCategory, String errorMessage, String taggedTree) {
        this.status = status;
        this.language = language;
        this.output = output;
        this.errorCategory = errorCategory;
        this.errorMessage = errorMessage;
        this.taggedTree = taggedTree;
    }

    /**
     * Creates a successful conversion result.
     */
    public static ConversionResult success(TargetLanguage language, String output) {
        return new ConversionResult(Status.SUCCESS, language, output, null, null, null);
    }

    /**
     * Creates a successful conversion result with the tagged tree attached (for debugging).
     */
    public static ConversionResult successWithTree(TargetLanguage language, String output, String taggedTree) {
        return new ConversionResult(Status.SUCCESS, language, output, null, null, taggedTree);
    }

    /**
     * Creates a result from a conversion exception.
     * Intentionally unsupported snippets are reported as skipped, everything else as failed.
     */
    public static ConversionResult fromException(TargetLanguage language, ConversionException exception) {
        Status status = exception instanceof IntentionallyUnsupportedException ? Status.SKIPPED : Status.FAILED;
        return new ConversionResult(status, language, null, exception.getCategory(),
                exception.getDetailedMessage(), null);
    }

    /**
     * Creates a failed result for errors outside the taxonomy (bad input, internal bugs).
     */
    public static ConversionResult failure(TargetLanguage language, String errorMessage) {
        return new ConversionResult(Status.FAILED, language, null, ErrorCategory.UNEXPECTED, errorMessage, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }

    public TargetLanguage getLanguage() {
        return language;
    }

    public String getOutput() {
        return output;
    }

    public ErrorCategory getErrorCategory() {
        return errorCategory;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getTaggedTree() {
        return taggedTree;
    }

    public boolean hasTaggedTree() {
        return taggedTree != null;
    }

    @Override
    public String toString() {
        if (status == Status.SUCCESS) {
            return "ConversionResult{language=" + language + ", output='" + output + "'}";
        }
        return "ConversionResult{language=" + language + ", status=" + status +
                ", category=" + errorCategory + ", error='" + errorMessage + "'}";
    }

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }
}
