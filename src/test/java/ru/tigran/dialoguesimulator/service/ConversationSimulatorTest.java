package ru.tigran.dialoguesimulator.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.dialoguesimulator.config.ConversationSettings;
import ru.tigran.dialoguesimulator.config.RateLimitSettings;
import ru.tigran.dialoguesimulator.dto.GenerationRequest;
import ru.tigran.dialoguesimulator.exception.DailyQuotaExceededException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.ProviderException;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;
import ru.tigran.dialoguesimulator.model.Conversation;
import ru.tigran.dialoguesimulator.model.ConversationPhase;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.Role;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.support.MutableClock;
import ru.tigran.dialoguesimulator.support.RecordingSleeper;
import ru.tigran.dialoguesimulator.support.ScriptedCompletionProvider;
import ru.tigran.dialoguesimulator.support.TestProfiles;
import ru.tigran.dialoguesimulator.support.TestSettings;
import ru.tigran.dialoguesimulator.util.Sleeper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit-тесты для ConversationSimulator.
 * Провайдер заменен скриптом, время и паузы виртуальные.
 */
@DisplayName("ConversationSimulator unit тесты")
class ConversationSimulatorTest {

    private static final String QUOTA_PAYLOAD = """
            {"error": {"code": 429, "status": "RESOURCE_EXHAUSTED",
              "details": [{"@type": "type.googleapis.com/google.rpc.RetryInfo", "retryDelay": "7s"}]}}
            """;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private MeterRegistry meterRegistry;
    private SubjectProfile profile;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-11-05T10:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        meterRegistry = new SimpleMeterRegistry();
        profile = TestProfiles.profile("right_1", 5, List.of("אין עם מי לדבר", "ביטחון קודם לכל"));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private ConversationSimulator simulator(CompletionProvider provider, ConversationSettings settings,
                                            RateLimitSettings limits, Sleeper sleeper) {
        QuotaRateLimiter limiter = new QuotaRateLimiter(limits, clock, sleeper);
        return new ConversationSimulator(provider, limiter, new RegexRetryDelayExtractor(), settings,
                sleeper, clock, new Random(42), meterRegistry);
    }

    private ConversationSimulator simulator(CompletionProvider provider, ConversationSettings settings) {
        return simulator(provider, settings, TestSettings.GEMINI_FREE_TIER, sleeper);
    }

    private static void assertAlternatesUntil(List<Turn> turns, int untilExclusive) {
        for (int i = 0; i < untilExclusive; i++) {
            assertEquals(i % 2 == 0 ? Role.AGENT : Role.SUBJECT, turns.get(i).role(), "turn " + i);
        }
    }

    // ===== ЗАВЕРШЕНИЕ РАЗГОВОРА =====

    @Test
    @DisplayName("simulate - фраза завершения на 18-й реплике дает 19 реплик и natural_ending")
    void naturalEndingAddsAcknowledgment() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("טוב, תודה על השיחה");

        Conversation conversation = simulator(provider, TestSettings.conversationWithSoftEndingProbability(0.0))
                .simulate(profile, Intervention.CONTROL);

        assertEquals(19, conversation.turnCount());
        assertEquals(EndingReason.NATURAL_ENDING, conversation.metadata().endingReason());
        assertEquals(19, conversation.metadata().totalMessages());
        assertAlternatesUntil(conversation.turns(), 18);
        Turn last = conversation.turns().get(18);
        assertEquals(Role.SUBJECT, last.role());
        assertTrue(DialogueLexicon.SUBJECT_CLOSINGS.contains(last.text()));
        assertEquals(16, provider.getCalls());
    }

    @Test
    @DisplayName("simulate - жесткий лимит 4 дает ровно 4 чередующиеся реплики")
    void hardLimitStopsExactly() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("תודה על השיחה");

        Conversation conversation = simulator(provider, TestSettings.conversationWithHardLimit(4))
                .simulate(profile, Intervention.SHARED_IDENTITY);

        assertEquals(4, conversation.turnCount());
        assertEquals(EndingReason.HARD_LIMIT, conversation.metadata().endingReason());
        assertAlternatesUntil(conversation.turns(), 4);
        assertTrue(DialogueLexicon.AGENT_OPENINGS.contains(conversation.turns().get(0).text()));
        assertEquals(profile.openingResponse(), conversation.turns().get(1).text());
        assertEquals(2, provider.getCalls());
    }

    @Test
    @DisplayName("simulate - мягкое завершение на 20-й реплике при вероятности 1")
    void softEndingWithCertainProbability() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("אני עדיין חושב אחרת");

        Conversation conversation = simulator(provider, TestSettings.conversationWithSoftEndingProbability(1.0))
                .simulate(profile, Intervention.MISPERCEPTION_CORRECTION);

        assertEquals(21, conversation.turnCount());
        assertEquals(EndingReason.SOFT_ENDING, conversation.metadata().endingReason());
    }

    @Test
    @DisplayName("simulate - без фраз завершения разговор доходит до жесткого лимита 24")
    void runsToDefaultHardLimit() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("אני עדיין חושב אחרת");

        Conversation conversation = simulator(provider, TestSettings.conversationWithSoftEndingProbability(0.0))
                .simulate(profile, Intervention.CONTROL);

        assertEquals(24, conversation.turnCount());
        assertEquals(EndingReason.HARD_LIMIT, conversation.metadata().endingReason());
        assertAlternatesUntil(conversation.turns(), 24);
    }

    // ===== ЗАПРОСЫ К ПРОВАЙДЕРУ =====

    @Test
    @DisplayName("simulate - реплики агента и субъекта используют свои параметры генерации")
    void requestsCarryRoleParameters() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("  תשובה  ");

        Conversation conversation = simulator(provider, TestSettings.conversationWithHardLimit(4))
                .simulate(profile, Intervention.CONTROL);

        List<GenerationRequest> requests = provider.getRequests();
        assertEquals(DialoguePromptBuilder.AGENT_PARAMS, requests.get(0).params());
        assertEquals(DialoguePromptBuilder.SUBJECT_PARAMS, requests.get(1).params());
        assertEquals(TestSettings.CONVERSATION.model(), requests.get(0).model());
        assertEquals("תשובה", conversation.turns().get(2).text());
    }

    @Test
    @DisplayName("simulate - каждый вызов провайдера проходит через лимитер и считается в метрике")
    void everyAttemptCounted() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("תשובה");

        simulator(provider, TestSettings.conversationWithHardLimit(6)).simulate(profile, Intervention.CONTROL);

        assertEquals(4.0, meterRegistry.get("conversation.generation.calls").counter().count());
    }

    // ===== ОШИБКИ И ПОВТОРЫ =====

    @Test
    @DisplayName("simulate - после исчерпания попыток реплики заменяются запасным текстом")
    void fallbackAfterExhaustedRetries() {
        CompletionProvider failing = request -> {
            throw new ProviderException("boom", ErrorCode.AI_SERVICE_ERROR, true);
        };

        Conversation conversation = simulator(failing, TestSettings.conversationWithHardLimit(4))
                .simulate(profile, Intervention.CONTROL);

        assertEquals(4, conversation.turnCount());
        assertEquals(ConversationPhase.ACTIVE.fallbackFor(Role.AGENT), conversation.turns().get(2).text());
        assertTrue(profile.typicalPhrases().contains(conversation.turns().get(3).text()));
        assertEquals(2.0, meterRegistry.get("conversation.turns.fallback").counter().count());
        assertEquals(6.0, meterRegistry.get("conversation.generation.calls").counter().count());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("simulate - неповторяемая ошибка провайдера повторяется так же, как и остальные")
    void nonRetriableErrorStillRetried() {
        CompletionProvider rejecting = request -> {
            throw new ProviderException("bad request", ErrorCode.AI_SERVICE_ERROR, false);
        };

        Conversation conversation = simulator(rejecting, TestSettings.conversationWithHardLimit(3))
                .simulate(profile, Intervention.CONTROL);

        assertEquals(3, conversation.turnCount());
        assertEquals(ConversationPhase.ACTIVE.fallbackFor(Role.AGENT), conversation.turns().get(2).text());
        assertEquals(3.0, meterRegistry.get("conversation.generation.calls").counter().count());
        assertEquals(1.0, meterRegistry.get("conversation.turns.fallback").counter().count());
    }

    @Test
    @DisplayName("simulate - пустой ответ провайдера считается ошибкой")
    void blankCompletionTreatedAsFailure() {
        SubjectProfile silent = TestProfiles.profile("center_1", 3, List.of());

        Conversation conversation = simulator(ScriptedCompletionProvider.constant("   "),
                TestSettings.conversationWithHardLimit(4)).simulate(silent, Intervention.CONTROL);

        assertEquals(ConversationPhase.ACTIVE.fallbackFor(Role.SUBJECT), conversation.turns().get(3).text());
    }

    @Test
    @DisplayName("simulate - исчерпание квоты: пауза равна retryDelay из ответа плюс 2 секунды")
    void quotaBackoffUsesAdvisedDelay() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider(call -> {
            if (call == 1) {
                throw new QuotaExhaustedException("429", QUOTA_PAYLOAD);
            }
            return "תשובה";
        });

        Conversation conversation = simulator(provider, TestSettings.conversationWithHardLimit(4))
                .simulate(profile, Intervention.CONTROL);

        assertEquals(List.of(Duration.ofSeconds(9)), sleeper.getSleeps());
        assertEquals("תשובה", conversation.turns().get(2).text());
        assertEquals(3, provider.getCalls());
    }

    @Test
    @DisplayName("simulate - после последней неудачной попытки пауза не делается")
    void noBackoffAfterLastAttempt() {
        CompletionProvider exhausted = request -> {
            throw new QuotaExhaustedException("429", QUOTA_PAYLOAD);
        };

        simulator(exhausted, TestSettings.conversationWithHardLimit(3)).simulate(profile, Intervention.CONTROL);

        // one generated turn, three attempts, two backoffs
        assertEquals(List.of(Duration.ofSeconds(9), Duration.ofSeconds(9)), sleeper.getSleeps());
    }

    @Test
    @DisplayName("simulate - исчерпание дневной квоты прерывает разговор")
    void dailyQuotaPropagates() {
        ScriptedCompletionProvider provider = ScriptedCompletionProvider.constant("תשובה");
        RateLimitSettings tinyDaily = new RateLimitSettings(10, 4_000_000L, 3, Duration.ofSeconds(1));

        ConversationSimulator simulator = simulator(provider, TestSettings.CONVERSATION, tinyDaily, sleeper);

        assertThrows(DailyQuotaExceededException.class, () -> simulator.simulate(profile, Intervention.CONTROL));
        assertEquals(3, provider.getCalls());
    }

    @Test
    @DisplayName("simulate - прерывание во время паузы превращается в ProviderException INTERRUPTED")
    void interruptDuringBackoff() {
        CompletionProvider exhausted = request -> {
            throw new QuotaExhaustedException("429", QUOTA_PAYLOAD);
        };
        Sleeper interrupting = duration -> {
            throw new InterruptedException("stop");
        };

        ConversationSimulator simulator = simulator(exhausted, TestSettings.CONVERSATION,
                TestSettings.GEMINI_FREE_TIER, interrupting);

        ProviderException error = assertThrows(ProviderException.class,
                () -> simulator.simulate(profile, Intervention.CONTROL));
        assertEquals(ErrorCode.INTERRUPTED.getCode(), error.getErrorCode());
        assertTrue(Thread.currentThread().isInterrupted());
    }
}
