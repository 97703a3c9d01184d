package models;

/**
 * Reasons a readability formula refuses to produce a score.
 */
public enum ReadabilityError {
    /** The text has zero length. */
    EMPTY_INPUT("Empty string."),
    /** No words were parsed, the per-word ratios would divide by zero. */
    NO_WORDS("No words were parsed."),
    /** No sentences were found where the formula divides by the sentence count. */
    NO_SENTENCES("No sentences were found.");

    private final String message;

    ReadabilityError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
