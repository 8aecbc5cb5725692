package ru.tigran.dialoguesimulator.dto;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Output of one analyzer run.
 *
 * @param rows one feature vector per conversation
 * @param byIntervention aggregates keyed by intervention id
 * @param byPoliticalStance conversation counts keyed by stance label (Left .. Right)
 * @param csvFile written CSV report, null when no file was requested
 */
public record AnalysisReport(
        List<ConversationMetrics> rows,
        Map<String, InterventionSummary> byIntervention,
        Map<String, Long> byPoliticalStance,
        Path csvFile
) {
}
