package com.jeevanfit.backend.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class PipelineTelemetry {

    public void ok(String userId, int insights, int notices, long latencyMs) {
        log.info("pipeline_run status=OK userId={} insights={} notices={} latencyMs={}",
                safe(userId), insights, notices, latencyMs);
    }

    public void fail(String userId, String errorKind, String errorCode, long latencyMs) {
        log.warn("pipeline_run status=FAIL userId={} errorKind={} errorCode={} latencyMs={}",
                safe(userId), safe(errorKind), safe(errorCode), latencyMs);
    }

    // ✅ 完整例外只留在 log，不外流給使用者
    public void historyFail(String userId, String errorCode, long latencyMs, Throwable cause) {
        log.warn("history_fetch status=FAIL userId={} errorCode={} latencyMs={}",
                safe(userId), safe(errorCode), latencyMs, cause);
    }

    public void historyOk(String userId, int records, long latencyMs) {
        log.debug("history_fetch status=OK userId={} records={} latencyMs={}",
                safe(userId), records, latencyMs);
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
