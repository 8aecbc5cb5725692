package ru.tigran.dialoguesimulator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.dialoguesimulator.dto.BalanceReport;
import ru.tigran.dialoguesimulator.dto.Combination;
import ru.tigran.dialoguesimulator.dto.ExperimentResult;
import ru.tigran.dialoguesimulator.dto.SuccessfulCombination;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;
import ru.tigran.dialoguesimulator.exception.DailyQuotaExceededException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;
import ru.tigran.dialoguesimulator.model.Conversation;
import ru.tigran.dialoguesimulator.model.ConversationMetadata;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.Role;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.repository.ConversationRepository;
import ru.tigran.dialoguesimulator.repository.ExperimentLogRepository;
import ru.tigran.dialoguesimulator.support.MutableClock;
import ru.tigran.dialoguesimulator.support.RecordingSleeper;
import ru.tigran.dialoguesimulator.support.ScriptedCompletionProvider;
import ru.tigran.dialoguesimulator.support.TestProfiles;
import ru.tigran.dialoguesimulator.support.TestSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для ExperimentController.
 * Профили и артефакты пишутся во временную директорию, паузы виртуальные.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ExperimentController unit тесты")
class ExperimentControllerTest {

    @TempDir
    Path workDir;

    @Mock
    private ConversationSimulator mockSimulator;

    @Mock
    private ExperimentLogRepository mockLogRepository;

    private Path profilesDir;
    private Path outputDir;
    private MutableClock clock;
    private RecordingSleeper sleeper;
    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private QuotaRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        profilesDir = workDir.resolve("profiles");
        outputDir = workDir.resolve("results");
        clock = new MutableClock(Instant.parse("2024-11-05T10:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = TestProfiles.objectMapper();
        rateLimiter = new QuotaRateLimiter(TestSettings.GEMINI_FREE_TIER, clock, sleeper);
    }

    private void writeProfiles(String... ids) throws IOException {
        for (String id : ids) {
            TestProfiles.writeProfile(profilesDir, id, TestProfiles.LEFT_PROFILE);
        }
    }

    private ExperimentController controller(ConversationSimulator simulator, ExperimentLogRepository logRepository) {
        return new ExperimentController(
                new ProfileLoader(profilesDir),
                simulator,
                rateLimiter,
                new ConversationRepository(outputDir, objectMapper, clock),
                logRepository,
                TestSettings.EXPERIMENT,
                sleeper,
                clock,
                new Random(3),
                meterRegistry
        );
    }

    private ExperimentController controllerWithMocks() {
        return controller(mockSimulator, mockLogRepository);
    }

    private void simulatorReturnsShortConversations() {
        when(mockSimulator.simulate(any(), any())).thenAnswer(invocation -> {
            SubjectProfile profile = invocation.getArgument(0);
            Intervention intervention = invocation.getArgument(1);
            return shortConversation(profile, intervention);
        });
    }

    private Conversation shortConversation(SubjectProfile profile, Intervention intervention) {
        Instant now = clock.instant();
        List<Turn> turns = List.of(new Turn(Role.AGENT, "שלום", now), new Turn(Role.SUBJECT, "היי", now));
        return new Conversation(profile.profileId(), intervention, turns,
                new ConversationMetadata(now, now, 2, EndingReason.HARD_LIMIT), profile);
    }

    private long countFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }

    // ===== ПОЛНЫЙ ЗАПУСК =====

    @Test
    @DisplayName("runExperiment - 3 профиля x 3 интервенции, квота на каждом втором вызове: все 9 успешны")
    void fullRunSurvivesIntermittentQuota() throws IOException {
        writeProfiles("left_1", "center_1", "right_1");
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider(call -> {
            if (call % 2 == 0) {
                throw new QuotaExhaustedException("429 RESOURCE_EXHAUSTED", "{\"retryDelay\": \"1s\"}");
            }
            return "אני מבין אותך";
        });
        ConversationSimulator simulator = new ConversationSimulator(provider, rateLimiter,
                new RegexRetryDelayExtractor(), TestSettings.conversationWithHardLimit(4), sleeper, clock,
                new Random(5), meterRegistry);
        ExperimentLogRepository logRepository = new ExperimentLogRepository(outputDir, objectMapper, clock);

        ExperimentController controller = controller(simulator, logRepository);
        ExperimentResult result = controller.runExperiment(false, null);

        assertEquals(9, result.getTotalPlanned());
        assertEquals(9, result.getTotalSuccessful());
        assertEquals(0, result.getTotalFailed());
        assertTrue(result.isCompleted());
        assertEquals(9, countFiles(outputDir.resolve(ConversationRepository.CONVERSATIONS_DIR)));
        assertTrue(countFiles(outputDir.resolve(ExperimentLogRepository.LOGS_DIR)) >= 1);

        BalanceReport balance = controller.validateBalance(result);
        assertTrue(balance.balanced());
        assertEquals(9, balance.counts().size());
        assertTrue(balance.counts().values().stream().allMatch(count -> count == 1));
        assertEquals(9.0, meterRegistry.get("experiment.conversations.completed").counter().count());
    }

    @Test
    @DisplayName("runExperiment - каждая комбинация профиль x интервенция запланирована ровно один раз")
    void plansFullFactorial() throws IOException {
        writeProfiles("left_1", "right_1");
        simulatorReturnsShortConversations();

        ExperimentResult result = controllerWithMocks().runExperiment(false, List.of());

        assertEquals(6, result.getPlanned().size());
        assertEquals(6, result.getPlanned().stream().distinct().count());
        for (String id : List.of("left_1", "right_1")) {
            for (Intervention intervention : Intervention.values()) {
                assertTrue(result.getPlanned().contains(new Combination(id, intervention)));
            }
        }
    }

    @Test
    @DisplayName("runExperiment - паузы: 5 секунд между разговорами и 60 секунд после каждого пятого")
    void pacingBetweenConversations() throws IOException {
        writeProfiles("left_1", "right_1");
        simulatorReturnsShortConversations();

        controllerWithMocks().runExperiment(false, null);

        assertEquals(List.of(
                Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5),
                Duration.ofSeconds(60)
        ), sleeper.getSleeps());
    }

    // ===== ОШИБКИ =====

    @Test
    @DisplayName("runExperiment - ошибка одной комбинации не останавливает остальные")
    void failuresAreIsolated() throws IOException {
        writeProfiles("left_1", "center_1", "right_1");
        when(mockSimulator.simulate(any(), any())).thenAnswer(invocation -> {
            SubjectProfile profile = invocation.getArgument(0);
            if (profile.profileId().equals("center_1")) {
                throw new IllegalStateException("provider exploded");
            }
            return shortConversation(profile, invocation.getArgument(1));
        });

        ExperimentResult result = controllerWithMocks().runExperiment(false, null);

        assertEquals(6, result.getTotalSuccessful());
        assertEquals(3, result.getTotalFailed());
        assertTrue(result.getFailed().stream()
                .allMatch(failure -> failure.profileId().equals("center_1")
                        && failure.error().equals("provider exploded")));
        // checkpoint on the third failure plus the final log
        verify(mockLogRepository, times(2)).save(any(ExperimentResult.class));
    }

    @Test
    @DisplayName("runExperiment - непарсящийся профиль считается ошибкой комбинации")
    void profileParseErrorIsCombinationFailure() throws IOException {
        writeProfiles("left_1");
        TestProfiles.writeProfile(profilesDir, "broken_1", "mystery_section:\nfoo: bar\n");
        simulatorReturnsShortConversations();

        ExperimentResult result = controllerWithMocks().runExperiment(false, null);

        assertEquals(3, result.getTotalSuccessful());
        assertEquals(3, result.getTotalFailed());
        assertTrue(result.getFailed().stream().allMatch(failure -> failure.profileId().equals("broken_1")));
    }

    @Test
    @DisplayName("runExperiment - сигнал rate limit включает паузу 300 секунд")
    void rateLimitFailureCoolsDown() throws IOException {
        writeProfiles("left_1");
        when(mockSimulator.simulate(any(), any())).thenThrow(new IllegalStateException("Rate limit exceeded"));

        ExperimentResult result = controllerWithMocks().runExperiment(false, null);

        assertEquals(3, result.getTotalFailed());
        assertEquals(3, sleeper.getSleeps().stream().filter(Duration.ofSeconds(300)::equals).count());
    }

    @Test
    @DisplayName("runExperiment - дневная квота останавливает пакет и сохраняет лог")
    void dailyQuotaStopsBatch() throws IOException {
        writeProfiles("left_1", "right_1");
        when(mockSimulator.simulate(any(), any())).thenThrow(new DailyQuotaExceededException("Daily limit reached"));

        ExperimentResult result = controllerWithMocks().runExperiment(false, null);

        assertEquals(6, result.getTotalPlanned());
        assertEquals(1, result.getTotalFailed());
        assertEquals(0, result.getTotalSuccessful());
        verify(mockSimulator, times(1)).simulate(any(), any());
        verify(mockLogRepository).save(result);
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    // ===== ВЫБОР ПРОФИЛЕЙ =====

    @Test
    @DisplayName("runExperiment - тестовый режим берет по профилю на позицию и не больше 3 комбинаций")
    void testModeSelection() throws IOException {
        writeProfiles("left_1", "left_2", "center_left_1", "center_1", "center_right_1", "right_1");
        simulatorReturnsShortConversations();

        ExperimentResult result = controllerWithMocks().runExperiment(true, null);

        assertTrue(result.isTestMode());
        assertEquals(3, result.getTotalPlanned());
        assertTrue(result.getPlanned().stream()
                .allMatch(combination -> List.of("left_1", "center_left_1", "center_1")
                        .contains(combination.profileId())));
    }

    @Test
    @DisplayName("runExperiment - явный список профилей, неизвестные id пропускаются")
    void specificProfiles() throws IOException {
        writeProfiles("left_1", "right_1");
        simulatorReturnsShortConversations();

        ExperimentResult result = controllerWithMocks().runExperiment(false, List.of("right_1", "ghost_9"));

        assertEquals(3, result.getTotalPlanned());
        assertTrue(result.getPlanned().stream().allMatch(c -> c.profileId().equals("right_1")));
    }

    @Test
    @DisplayName("runExperiment - ни один запрошенный профиль не найден: PROFILE_NOT_FOUND")
    void noRequestedProfileExists() throws IOException {
        writeProfiles("left_1");
        ExperimentController controller = controllerWithMocks();

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> controller.runExperiment(false, List.of("ghost_1")));

        assertEquals(ErrorCode.PROFILE_NOT_FOUND.getCode(), error.getErrorCode());
        verifyNoInteractions(mockSimulator, mockLogRepository);
    }

    @Test
    @DisplayName("runExperiment - пустая директория профилей: NO_PROFILES_FOUND")
    void emptyProfilesDirectory() throws IOException {
        Files.createDirectories(profilesDir);
        ExperimentController controller = controllerWithMocks();

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> controller.runExperiment(false, null));

        assertEquals(ErrorCode.NO_PROFILES_FOUND.getCode(), error.getErrorCode());
    }

    // ===== БАЛАНС =====

    @Test
    @DisplayName("validateBalance - ячейка без успехов считается нулем и ломает баланс")
    void unbalancedWhenCellsDiverge() {
        List<Combination> planned = List.of(
                new Combination("left_1", Intervention.CONTROL),
                new Combination("right_1", Intervention.CONTROL));
        ExperimentResult result = new ExperimentResult(false, clock.instant(), planned);
        for (int i = 0; i < 10; i++) {
            result.recordSuccess(new SuccessfulCombination("left_" + i, Intervention.CONTROL, 20,
                    EndingReason.NATURAL_ENDING, "f" + i));
        }

        BalanceReport report = controllerWithMocks().validateBalance(result);

        assertFalse(report.balanced());
        assertEquals(Map.of("left_control", 10, "right_control", 0), report.counts());
    }

    @Test
    @DisplayName("validateBalance - разница в одну беседу допустима")
    void balancedWithinTolerance() {
        List<Combination> planned = List.of(
                new Combination("left_1", Intervention.CONTROL),
                new Combination("left_2", Intervention.CONTROL),
                new Combination("right_1", Intervention.CONTROL));
        ExperimentResult result = new ExperimentResult(false, clock.instant(), planned);
        result.recordSuccess(new SuccessfulCombination("left_1", Intervention.CONTROL, 20,
                EndingReason.NATURAL_ENDING, "a"));
        result.recordSuccess(new SuccessfulCombination("left_2", Intervention.CONTROL, 20,
                EndingReason.NATURAL_ENDING, "b"));
        result.recordSuccess(new SuccessfulCombination("right_1", Intervention.CONTROL, 24,
                EndingReason.HARD_LIMIT, "c"));

        BalanceReport report = controllerWithMocks().validateBalance(result);

        assertTrue(report.balanced());
        assertEquals(Map.of("left_control", 2, "right_control", 1), report.counts());
    }

    @Test
    @DisplayName("validateBalance - полный факторный план по поставляемым профилям сбалансирован")
    void shippedProfilesFullFactorialIsBalanced() {
        List<String> profileIds = new ProfileLoader(Path.of("simulation/profiles")).listProfileIds();
        List<Combination> planned = profileIds.stream()
                .flatMap(id -> Stream.of(Intervention.values()).map(intervention -> new Combination(id, intervention)))
                .toList();
        ExperimentResult result = new ExperimentResult(false, clock.instant(), planned);
        planned.forEach(combination -> result.recordSuccess(new SuccessfulCombination(
                combination.profileId(), combination.intervention(), 20, EndingReason.NATURAL_ENDING, "f")));

        BalanceReport report = controllerWithMocks().validateBalance(result);

        assertEquals(5, profileIds.size());
        assertTrue(report.balanced());
        assertEquals(5 * Intervention.values().length, report.counts().size());
        assertEquals(1, report.counts().get("center_" + Intervention.CONTROL.getId()));
        assertEquals(1, report.counts().get("center_left_" + Intervention.CONTROL.getId()));
        assertEquals(1, report.counts().get("center_right_" + Intervention.CONTROL.getId()));
    }
}
