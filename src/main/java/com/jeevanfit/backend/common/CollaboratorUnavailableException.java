package com.jeevanfit.backend.common;

/**
 * 外部協作者（history repository）逾時或失敗。
 * message 固定為對使用者安全的通用字串；內部細節只留在 cause 與 log。
 */
public class CollaboratorUnavailableException extends AnalysisException {
    public static final String USER_MESSAGE = "Your history is temporarily unavailable.";

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, Throwable cause) {
        super(ErrorKind.SYSTEM, USER_MESSAGE,
                "Today's insights are still available. Trends will return on your next check-in.",
                cause);
        this.collaborator = collaborator;
    }

    public String collaborator() { return collaborator; }
}
