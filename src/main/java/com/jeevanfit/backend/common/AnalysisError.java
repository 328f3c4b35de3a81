package com.jeevanfit.backend.common;

/**
 * kind + message + recoverySuggestion 三件套，所有錯誤路徑都必須帶齊。
 */
public record AnalysisError(
        ErrorKind kind,
        String message,
        String recoverySuggestion
) {
    public AnalysisError {
        if (kind == null) throw new IllegalArgumentException("ERROR_KIND_REQUIRED");
        message = (message == null || message.isBlank()) ? kind.name() : message;
        recoverySuggestion = (recoverySuggestion == null || recoverySuggestion.isBlank())
                ? "Please try again later."
                : recoverySuggestion;
    }

    public static AnalysisError processing(String message, String recoverySuggestion) {
        return new AnalysisError(ErrorKind.PROCESSING, message, recoverySuggestion);
    }
}
