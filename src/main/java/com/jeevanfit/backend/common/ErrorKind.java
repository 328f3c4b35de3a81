package com.jeevanfit.backend.common;

/**
 * - VALIDATION：輸入形狀不對（例如 sleep.quality 缺值），fail fast
 * - PROCESSING：資料不足 / 分類模糊，回降級結果 + 說明
 * - SYSTEM：外部協作者（history repository）不可用
 */
public enum ErrorKind {
    VALIDATION,
    PROCESSING,
    SYSTEM
}
