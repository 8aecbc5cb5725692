package ru.tigran.dialoguesimulator.service;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.dto.AnalysisReport;
import ru.tigran.dialoguesimulator.dto.ConversationMetrics;
import ru.tigran.dialoguesimulator.dto.InterventionSummary;
import ru.tigran.dialoguesimulator.model.Conversation;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Role;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.repository.ConversationRepository;
import ru.tigran.dialoguesimulator.repository.MetricsReportWriter;
import ru.tigran.dialoguesimulator.util.TextMatchUtils;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Turns stored transcripts into per-conversation feature vectors and per-intervention aggregates.
 *
 * All features are pure functions of the transcript. Lexicon counts are exact-substring and
 * per turn: each phrase contained in a turn adds one, so a phrase repeated across two turns adds two.
 */
@Slf4j
public class MetricsAnalyzer {

    static final List<String> AGREEMENT_PHRASES = List.of(
            "אתה צודק", "את צודקת", "אני מסכים", "אני מסכימה",
            "נכון", "יש בזה משהו", "לא חשבתי על זה",
            "זה נכון", "אתה לא טועה", "יש לך נקודה"
    );

    static final List<String> DISAGREEMENT_PHRASES = List.of(
            "לא מסכים", "לא נכון", "אתה טועה", "את טועה",
            "זה לא מדויק", "אני לא מקבל", "אבל", "לעומת זאת",
            "בניגוד למה ש", "זה שטויות"
    );

    static final List<String> EMPATHY_PHRASES = List.of(
            "אני מבין", "אני מבינה", "אני יכול להבין",
            "זה מובן", "אני מרגיש", "אני מרגישה",
            "קשה לי עם", "אני מזדהה", "אני שומע אותך"
    );

    static final List<String> SHARED_IDENTITY_PHRASES = List.of(
            "כולנו", "אנחנו כעם", "החברה שלנו",
            "המדינה שלנו", "הילדים שלנו", "העתיד שלנו",
            "ביחד", "כישראלים", "המשפחה הישראלית"
    );

    static final List<String> EMOTION_MARKERS = List.of(
            "!", "!!", "!!!", "...", "????",
            "מאוד", "ממש", "נורא", "איום", "נפלא",
            "כואב", "קשה", "מפחיד", "מדהים", "מזעזע"
    );

    static final List<String> TOPIC_KEYWORDS = List.of(
            "עזה", "מלחמה", "חטופים", "חמאס",
            "צבא", "לחימה", "הפסקת אש", "עסקה",
            "ביטחון", "חיילים", "אוקטובר"
    );

    private static final String[] STANCE_LABELS = {"", "Left", "Center-Left", "Center", "Center-Right", "Right"};

    private final ConversationRepository conversationRepository;
    private final MetricsReportWriter reportWriter;

    public MetricsAnalyzer(ConversationRepository conversationRepository, MetricsReportWriter reportWriter) {
        this.conversationRepository = conversationRepository;
        this.reportWriter = reportWriter;
    }

    public ConversationMetrics analyzeConversation(Conversation conversation) {
        List<Turn> turns = conversation.turns();
        SubjectProfile profile = conversation.profile();
        EndingReason ending = conversation.metadata() == null ? null : conversation.metadata().endingReason();

        return new ConversationMetrics(
                conversation.profileId(),
                conversation.intervention().getId(),
                profile == null ? 0 : profile.politicalStance(),
                profile == null ? 0 : profile.age(),
                profile == null ? "" : profile.gender(),
                profile == null ? "" : profile.militaryServiceRecent(),
                profile == null ? "" : profile.warPriority(),
                profile == null ? "" : profile.israelAction(),
                turns.size(),
                (int) conversation.countByRole(Role.SUBJECT),
                (int) conversation.countByRole(Role.AGENT),
                ending == null ? "unknown" : ending.getValue(),
                countPhrases(turns, AGREEMENT_PHRASES),
                countPhrases(turns, DISAGREEMENT_PHRASES),
                countPhrases(turns, EMPATHY_PHRASES),
                countPhrases(turns, SHARED_IDENTITY_PHRASES),
                emotionLevel(turns),
                averageLength(turns),
                backAndForthRatio(turns),
                topicConsistency(turns)
        );
    }

    public List<ConversationMetrics> analyzeAllConversations() {
        List<ConversationMetrics> rows = conversationRepository.findAll().stream()
                .map(this::analyzeConversation)
                .toList();
        log.info("Analyzed {} conversations from {}", rows.size(), conversationRepository.getConversationsDir());
        return rows;
    }

    /**
     * Means per intervention, keyed and ordered by intervention id.
     */
    public Map<String, InterventionSummary> summarizeByIntervention(List<ConversationMetrics> rows) {
        Map<String, List<ConversationMetrics>> groups = rows.stream()
                .collect(Collectors.groupingBy(ConversationMetrics::intervention, TreeMap::new, Collectors.toList()));

        Map<String, InterventionSummary> summaries = new LinkedHashMap<>();
        groups.forEach((intervention, group) -> {
            double avgMessages = mean(group, ConversationMetrics::totalMessages);
            double avgAgreement = mean(group, ConversationMetrics::agreementSignals);
            double avgDisagreement = mean(group, ConversationMetrics::disagreementSignals);
            double avgEmpathy = mean(group, ConversationMetrics::empathyExpressions);
            double effectiveness = avgMessages == 0
                    ? 0.0
                    : (avgAgreement * 2 + avgEmpathy * 3 - avgDisagreement) / avgMessages;
            double naturalShare = mean(group,
                    row -> EndingReason.HARD_LIMIT.getValue().equals(row.endingReason()) ? 0.0 : 1.0);

            summaries.put(intervention, new InterventionSummary(
                    intervention,
                    group.size(),
                    avgMessages,
                    avgAgreement,
                    avgDisagreement,
                    avgEmpathy,
                    mean(group, ConversationMetrics::sharedIdentityRefs),
                    mean(group, ConversationMetrics::emotionLevel),
                    mean(group, ConversationMetrics::topicConsistency),
                    naturalShare,
                    effectiveness
            ));
        });
        return summaries;
    }

    /**
     * Conversation counts per stance label, in scale order (Left .. Right).
     */
    public Map<String, Long> countByPoliticalStance(List<ConversationMetrics> rows) {
        Map<Integer, Long> byStance = rows.stream()
                .collect(Collectors.groupingBy(ConversationMetrics::politicalStance, TreeMap::new, Collectors.counting()));
        Map<String, Long> labelled = new LinkedHashMap<>();
        byStance.forEach((stance, count) -> labelled.merge(stanceLabel(stance), count, Long::sum));
        return labelled;
    }

    /**
     * Analyzes every stored conversation, logs the summaries and optionally writes the CSV.
     *
     * @param csvFile report destination, null to skip the file
     */
    public AnalysisReport generateReport(Path csvFile) {
        List<ConversationMetrics> rows = analyzeAllConversations();
        if (rows.isEmpty()) {
            log.warn("No conversations found to analyze");
            return new AnalysisReport(List.of(), Map.of(), Map.of(), null);
        }

        Path written = csvFile == null ? null : reportWriter.write(rows, csvFile);
        Map<String, InterventionSummary> byIntervention = summarizeByIntervention(rows);
        Map<String, Long> byStance = countByPoliticalStance(rows);

        log.info("Total conversations analyzed: {}", rows.size());
        byStance.forEach((label, count) -> log.info("  {}: {} conversations", label, count));
        byIntervention.values().forEach(summary -> log.info(
                "{}: conversations={}, avg messages={}, agreement={}, empathy={}, emotion={}, "
                        + "effectiveness={}, topic consistency={}, natural endings={}",
                summary.intervention(),
                summary.conversations(),
                format(summary.avgTotalMessages(), 1),
                format(summary.avgAgreementSignals(), 2),
                format(summary.avgEmpathyExpressions(), 2),
                format(summary.avgEmotionLevel(), 3),
                format(summary.effectivenessScore(), 3),
                percent(summary.avgTopicConsistency()),
                percent(summary.naturalEndingShare())));

        return new AnalysisReport(rows, byIntervention, byStance, written);
    }

    static String stanceLabel(int stance) {
        return stance >= 1 && stance < STANCE_LABELS.length ? STANCE_LABELS[stance] : "Unknown";
    }

    private static int countPhrases(List<Turn> turns, Collection<String> phrases) {
        int count = 0;
        for (Turn turn : turns) {
            count += TextMatchUtils.countContainedPhrases(turn.text(), phrases);
        }
        return count;
    }

    /**
     * Marker occurrences per message, halved and capped at 1.
     */
    private static double emotionLevel(List<Turn> turns) {
        int markers = 0;
        for (Turn turn : turns) {
            for (String marker : EMOTION_MARKERS) {
                markers += TextMatchUtils.countOccurrences(turn.text(), marker);
            }
        }
        return Math.min(1.0, (double) markers / Math.max(turns.size(), 1) / 2);
    }

    private static double averageLength(List<Turn> turns) {
        if (turns.isEmpty()) {
            return 0.0;
        }
        return turns.stream().mapToInt(turn -> turn.text().length()).average().orElse(0.0);
    }

    private static double backAndForthRatio(List<Turn> turns) {
        if (turns.size() < 2) {
            return 0.0;
        }
        int transitions = 0;
        for (int i = 1; i < turns.size(); i++) {
            if (turns.get(i).role() != turns.get(i - 1).role()) {
                transitions++;
            }
        }
        return (double) transitions / (turns.size() - 1);
    }

    private static double topicConsistency(List<Turn> turns) {
        long onTopic = turns.stream()
                .filter(turn -> TextMatchUtils.containsAny(turn.text(), TOPIC_KEYWORDS))
                .count();
        return (double) onTopic / Math.max(turns.size(), 1);
    }

    private static double mean(List<ConversationMetrics> rows, ToDoubleFunction<ConversationMetrics> field) {
        return rows.stream().mapToDouble(field).average().orElse(0.0);
    }

    private static String format(double value, int decimals) {
        return String.format("%." + decimals + "f", value);
    }

    private static String percent(double share) {
        return String.format("%.2f%%", share * 100);
    }
}
