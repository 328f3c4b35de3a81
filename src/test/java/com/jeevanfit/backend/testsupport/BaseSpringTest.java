package com.jeevanfit.backend.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * ✅ 給所有 Spring 測試共用的基底類別
 * - 強制使用 test profile（較短的 history timeout、較小的執行緒池）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
