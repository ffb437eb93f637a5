package com.napipe.exception;

/**
 * Exception thrown when an imputation request cannot be composed into a pipeline.
 *
 * <p>Configuration errors are always fatal to the composition and are never
 * corrected silently. Each carries the reason and, where one applies, the
 * offending column name.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ComposedPipeline pipeline = composer.compose(requests, defaults, input);
 *   } catch (ConfigurationException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 *
 * @see com.napipe.plan.PipelineComposer
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Why a request was rejected.
     */
    public enum Reason {
        EMPTY_REQUEST,
        DUPLICATE_OUTPUT_NAME,
        UNKNOWN_SOURCE_COLUMN,
        INCOMPATIBLE_INDICATOR_TYPE,
        INVALID_SLOT_IMPUTATION,
        INVALID_REQUEST
    }

    private final Reason reason;
    private final String columnName;

    /**
     * Creates a configuration exception.
     *
     * @param reason why the request was rejected
     * @param columnName the offending column, or null if none applies
     * @param message the error message
     */
    public ConfigurationException(Reason reason, String columnName, String message) {
        super(message);
        this.reason = reason;
        this.columnName = columnName;
    }

    /**
     * Creates a configuration exception with a cause.
     *
     * @param reason why the request was rejected
     * @param columnName the offending column, or null if none applies
     * @param message the error message
     * @param cause the underlying cause
     */
    public ConfigurationException(Reason reason, String columnName, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.columnName = columnName;
    }

    /**
     * Returns why the request was rejected.
     *
     * @return the reason
     */
    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the offending column name.
     *
     * @return the column name, or null if the error is not about one column
     */
    public String getColumnName() {
        return columnName;
    }

    /**
     * Returns a user-friendly error message with guidance on how to fix the request.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String hint = switch (reason) {
            case EMPTY_REQUEST -> "Specify at least one column to handle.";
            case DUPLICATE_OUTPUT_NAME -> "Give every requested column a distinct output name.";
            case UNKNOWN_SOURCE_COLUMN -> "Check the source column name against the input schema.";
            case INCOMPATIBLE_INDICATOR_TYPE ->
                "Disable the indicator for this column, or convert the column to a numeric type first.";
            case INVALID_SLOT_IMPUTATION ->
                "Leave slot imputation unset or disable it for variable-length vector columns.";
            case INVALID_REQUEST -> "Check the column definition syntax.";
        };
        return getMessage() + ". " + hint;
    }
}
