package me.christianrobert.polyconv.context;

public enum ErrorCategory {
    UNMODELED_CONSTRUCT,
    INTENTIONALLY_UNSUPPORTED,
    AMBIGUOUS_SOURCE,
    TYPE_MAPPING_GAP,
    UNEXPECTED
}
