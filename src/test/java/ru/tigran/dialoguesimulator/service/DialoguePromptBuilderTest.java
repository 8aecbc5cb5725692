package ru.tigran.dialoguesimulator.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.dialoguesimulator.model.ConversationPhase;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.Role;
import ru.tigran.dialoguesimulator.model.StanceSummary;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.support.TestProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DialoguePromptBuilder unit тесты")
class DialoguePromptBuilderTest {

    private static final List<Turn> HISTORY = List.of(
            new Turn(Role.AGENT, "שלום, מה שלומך?", Instant.EPOCH),
            new Turn(Role.SUBJECT, "ביטחון קודם לכל", Instant.EPOCH));

    @Test
    @DisplayName("buildAgentPrompt - шаблон интервенции, фаза, история и позиция собеседника")
    void agentPromptSections() {
        SubjectProfile profile = TestProfiles.profile("right_1", 5, List.of());

        String prompt = DialoguePromptBuilder.buildAgentPrompt(Intervention.MISPERCEPTION_CORRECTION,
                ConversationPhase.CLOSURE, HISTORY, StanceSummary.of(profile), "תודה על השיחה הפתוחה");

        assertTrue(prompt.startsWith(Intervention.MISPERCEPTION_CORRECTION.getTemplate().strip()));
        assertTrue(prompt.contains("Current conversation phase: closure"));
        assertTrue(prompt.contains("\"תודה על השיחה הפתוחה\""));
        assertTrue(prompt.contains("Agent: שלום, מה שלומך?\nUser: ביטחון קודם לכל"));
        assertTrue(prompt.contains("- Political stance: RIGHT"));
        assertTrue(prompt.contains("- Prioritizes: Security/Hamas elimination"));
        assertTrue(prompt.contains("- Prefers: Military action"));
    }

    @Test
    @DisplayName("buildSubjectPrompt - атрибуты профиля и разрешение завершить разговор в фазе закрытия")
    void subjectPromptWindingDown() {
        SubjectProfile profile = TestProfiles.profile("right_1", 5, List.of("אין עם מי לדבר"));

        String active = DialoguePromptBuilder.buildSubjectPrompt(profile, HISTORY, ConversationPhase.ACTIVE);
        String closing = DialoguePromptBuilder.buildSubjectPrompt(profile, HISTORY, ConversationPhase.SOFT_CLOSURE);

        assertTrue(active.contains("- Age: 40"));
        assertTrue(active.contains("- Political stance: 5 (1=left, 5=right)"));
        assertTrue(active.contains("[\"אין עם מי לדבר\"]"));
        assertFalse(active.contains("winding down"));
        assertTrue(closing.contains("winding down"));
    }

    @Test
    @DisplayName("buildSubjectPrompt - профиль без типичных фраз")
    void subjectPromptWithoutPhrases() {
        SubjectProfile profile = TestProfiles.profile("center_1", 3, List.of());

        String prompt = DialoguePromptBuilder.buildSubjectPrompt(profile, List.of(), ConversationPhase.ACTIVE);

        assertTrue(prompt.contains("Your typical phrases: (none)"));
    }
}
