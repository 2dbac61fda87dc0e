package in.co.bhava.pojos;

import java.util.Objects;

/**
 * Outcome of a facade call: either a value, or an error kind with a message. Never both.
 */
public final class AnalysisResult<T> {

    private final T value;
    private final AnalysisErrorKind errorKind;
    private final String errorMessage;

    private AnalysisResult(T value, AnalysisErrorKind errorKind, String errorMessage) {
        this.value = value;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static <T> AnalysisResult<T> success(T value) {
        return new AnalysisResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> AnalysisResult<T> failure(AnalysisErrorKind errorKind, String errorMessage) {
        return new AnalysisResult<>(null, Objects.requireNonNull(errorKind, "errorKind"), errorMessage);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * @throws IllegalStateException on a failed result
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + errorKind + " " + errorMessage);
        }
        return value;
    }

    /** Null on success. */
    public AnalysisErrorKind getErrorKind() {
        return errorKind;
    }

    /** Null on success. */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AnalysisResult{success=true, value=" + value + "}"
                : "AnalysisResult{success=false, errorKind=" + errorKind + ", errorMessage=" + errorMessage + "}";
    }
}
