package com.jeevanfit.backend.common;

/**
 * 分析器收到不完整輸入：直接丟出，訊息帶欄位名稱（不產生部分結果）。
 */
public class AnalysisValidationException extends AnalysisException {
    private final String field;

    public AnalysisValidationException(String field, String recoverySuggestion) {
        super(ErrorKind.VALIDATION, "MISSING_FIELD: " + field, recoverySuggestion, null);
        this.field = field;
    }

    public String field() { return field; }
}
