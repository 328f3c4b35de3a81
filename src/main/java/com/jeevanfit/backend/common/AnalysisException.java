package com.jeevanfit.backend.common;

public abstract class AnalysisException extends RuntimeException {
    private final ErrorKind kind;
    private final String recoverySuggestion;

    protected AnalysisException(ErrorKind kind, String message, String recoverySuggestion, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.recoverySuggestion = recoverySuggestion;
    }

    public ErrorKind kind() { return kind; }
    public String recoverySuggestion() { return recoverySuggestion; }

    public AnalysisError toError() {
        return new AnalysisError(kind, getMessage(), recoverySuggestion);
    }
}
