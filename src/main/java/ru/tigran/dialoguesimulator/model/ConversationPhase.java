package ru.tigran.dialoguesimulator.model;

/**
 * Conversation stage derived purely from the number of turns so far.
 * Selects the phase guidance injected into prompts and the canned fallback lines.
 *
 * Bounds are half-open: ACTIVE covers [0, 16), PRE_CLOSURE [16, 18) and so on;
 * FINAL covers everything from 22 turns on.
 */
public enum ConversationPhase {
    ACTIVE("active", 0,
            "Continue the conversation normally. Focus on understanding their position.",
            "אני מבין את העמדה שלך. זה באמת מצב מורכב.",
            "זה מסובך. קשה לי עם כל המצב."),
    PRE_CLOSURE("pre_closure", 16,
            "Start summarizing key points naturally. Don't end abruptly.",
            "נראה שאנחנו נוגעים בנקודות חשובות פה.",
            "כן, יש הרבה מה לחשוב עליו."),
    SOFT_CLOSURE("soft_closure", 18,
            "Begin wrapping up by highlighting areas of agreement.",
            "למרות הבדלי הדעות, אני מעריך את הפתיחות שלך.",
            "אני מבין מאיפה אתה בא."),
    CLOSURE("closure", 20,
            "Provide a thoughtful closing that acknowledges both perspectives.",
            "תודה על השיחה הכנה. זה חשוב שאנחנו מדברים.",
            "תודה על השיחה."),
    FINAL("final", 22,
            "End gracefully with appreciation for the dialogue.",
            "היה חשוב לשמוע את הזווית שלך. תודה.",
            "היה מעניין.");

    private final String value;
    private final int fromTurn;
    private final String agentInstruction;
    private final String agentFallback;
    private final String subjectFallback;

    ConversationPhase(String value, int fromTurn, String agentInstruction,
                      String agentFallback, String subjectFallback) {
        this.value = value;
        this.fromTurn = fromTurn;
        this.agentInstruction = agentInstruction;
        this.agentFallback = agentFallback;
        this.subjectFallback = subjectFallback;
    }

    public static ConversationPhase forTurnCount(int turnCount) {
        ConversationPhase current = ACTIVE;
        for (ConversationPhase phase : values()) {
            if (turnCount >= phase.fromTurn) {
                current = phase;
            }
        }
        return current;
    }

    public String getValue() {
        return value;
    }

    public String getAgentInstruction() {
        return agentInstruction;
    }

    public String fallbackFor(Role role) {
        return role == Role.AGENT ? agentFallback : subjectFallback;
    }

    /**
     * Phases in which the subject may acknowledge that the conversation is winding down.
     */
    public boolean isWindingDown() {
        return this == SOFT_CLOSURE || this == CLOSURE;
    }
}
