package com.jeevanfit.backend.common;

/**
 * 分析器本身非預期失敗（bug、執行緒池滿、逾時）。
 * message 固定為通用字串；真正的 cause 只進 log。
 */
public class AnalysisFailedException extends AnalysisException {
    public static final String USER_MESSAGE = "We couldn't finish analyzing today's record.";

    private final String errorCode;

    public AnalysisFailedException(String errorCode, Throwable cause) {
        super(ErrorKind.SYSTEM, USER_MESSAGE, "Please try again in a moment.", cause);
        this.errorCode = errorCode;
    }

    public String errorCode() { return errorCode; }
}
