package ru.tigran.dialoguesimulator.model;

/**
 * Coarse reading of a subject's position, used to tell the agent which side to argue.
 */
public record StanceSummary(
        boolean isRight,
        boolean isLeft,
        boolean isCenter,
        boolean prioritizesHostages,
        boolean prioritizesSecurity,
        boolean wantsDeal,
        boolean wantsMilitary
) {
    public static final String PRIORITY_HOSTAGES = "החזרת החטופים";
    public static final String PRIORITY_SECURITY = "מיטוט חמאס";
    public static final String ACTION_DEAL = "עסקה לשחרור חטופים";
    public static final String ACTION_MILITARY = "מבצע צבאי לכיבוש עזה";

    public static StanceSummary of(SubjectProfile profile) {
        int stance = profile.politicalStance();
        return new StanceSummary(
                stance >= 4,
                stance <= 2,
                stance == 3,
                PRIORITY_HOSTAGES.equals(profile.warPriority()),
                PRIORITY_SECURITY.equals(profile.warPriority()),
                ACTION_DEAL.equals(profile.israelAction()),
                ACTION_MILITARY.equals(profile.israelAction())
        );
    }

    public String politicalLabel() {
        if (isRight) {
            return "RIGHT";
        }
        return isLeft ? "LEFT" : "CENTER";
    }

    public String priorityLabel() {
        if (prioritizesHostages) {
            return "Hostages";
        }
        return prioritizesSecurity ? "Security/Hamas elimination" : "Unclear";
    }

    public String preferenceLabel() {
        if (wantsDeal) {
            return "Negotiation/Deal";
        }
        return wantsMilitary ? "Military action" : "Unclear";
    }
}
