package ru.tigran.dialoguesimulator.dto;

/**
 * Per-intervention means over analyzed conversations.
 *
 * effectivenessScore = (2 * agreement + 3 * empathy - disagreement) / totalMessages, all means.
 * A transparent heuristic for comparing interventions, not a causal estimate.
 */
public record InterventionSummary(
        String intervention,
        int conversations,
        double avgTotalMessages,
        double avgAgreementSignals,
        double avgDisagreementSignals,
        double avgEmpathyExpressions,
        double avgSharedIdentityRefs,
        double avgEmotionLevel,
        double avgTopicConsistency,
        double naturalEndingShare,
        double effectivenessScore
) {
}
