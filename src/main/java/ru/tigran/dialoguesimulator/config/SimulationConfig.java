package ru.tigran.dialoguesimulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.dialoguesimulator.service.CompletionProvider;
import ru.tigran.dialoguesimulator.service.ConversationSimulator;
import ru.tigran.dialoguesimulator.service.ExperimentController;
import ru.tigran.dialoguesimulator.service.MetricsAnalyzer;
import ru.tigran.dialoguesimulator.service.ProfileLoader;
import ru.tigran.dialoguesimulator.service.QuotaRateLimiter;
import ru.tigran.dialoguesimulator.service.RegexRetryDelayExtractor;
import ru.tigran.dialoguesimulator.service.RetryDelayExtractor;
import ru.tigran.dialoguesimulator.repository.ConversationRepository;
import ru.tigran.dialoguesimulator.repository.ExperimentLogRepository;
import ru.tigran.dialoguesimulator.repository.MetricsReportWriter;
import ru.tigran.dialoguesimulator.util.Sleeper;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Сборка компонентов симуляции: лимитер, симулятор, контроллер эксперимента, анализатор.
 * Все компоненты создаются один раз и передаются через конструкторы.
 */
@Slf4j
@Configuration
public class SimulationConfig {

    @Bean
    public RateLimitSettings rateLimitSettings(
            @Value("${app.rate-limit.requests-per-minute:10}") int requestsPerMinute,
            @Value("${app.rate-limit.tokens-per-minute:4000000}") long tokensPerMinute,
            @Value("${app.rate-limit.requests-per-day:1500}") int requestsPerDay,
            @Value("${app.rate-limit.safety-margin:1s}") Duration safetyMargin
    ) {
        return new RateLimitSettings(requestsPerMinute, tokensPerMinute, requestsPerDay, safetyMargin);
    }

    @Bean
    public ConversationSettings conversationSettings(
            @Value("${app.gemini.model:gemini-2.0-flash-exp}") String model,
            @Value("${app.conversation.hard-limit:24}") int hardLimit,
            @Value("${app.conversation.min-ending-turns:18}") int minEndingTurns,
            @Value("${app.conversation.soft-ending-turns:20}") int softEndingTurns,
            @Value("${app.conversation.soft-ending-probability:0.3}") double softEndingProbability,
            @Value("${app.conversation.max-retries:3}") int maxRetries,
            @Value("${app.conversation.retry-buffer:2s}") Duration retryBuffer,
            @Value("${app.conversation.agent-history-turns:10}") int agentHistoryTurns,
            @Value("${app.conversation.subject-history-turns:4}") int subjectHistoryTurns,
            @Value("${app.conversation.estimated-tokens-per-call:500}") int estimatedTokensPerCall,
            RateLimitSettings rateLimitSettings
    ) {
        validateEstimate("app.conversation.estimated-tokens-per-call", estimatedTokensPerCall, rateLimitSettings);
        return new ConversationSettings(model, hardLimit, minEndingTurns, softEndingTurns, softEndingProbability,
                maxRetries, retryBuffer, agentHistoryTurns, subjectHistoryTurns, estimatedTokensPerCall);
    }

    @Bean
    public ExperimentSettings experimentSettings(
            @Value("${app.experiment.conversation-delay:5s}") Duration conversationDelay,
            @Value("${app.experiment.long-pause:60s}") Duration longPause,
            @Value("${app.experiment.long-pause-every:5}") int longPauseEvery,
            @Value("${app.experiment.rate-limit-cooldown:300s}") Duration rateLimitCooldown,
            @Value("${app.experiment.checkpoint-after-failures:3}") int checkpointAfterFailures,
            @Value("${app.experiment.estimated-tokens-per-conversation:2000}") int estimatedTokensPerConversation,
            @Value("${app.experiment.test-mode-combinations:3}") int testModeCombinations,
            @Value("${app.experiment.test-mode-stances:left,center_left,center}") List<String> testModeStances,
            @Value("${app.experiment.balance-tolerance:1}") int balanceTolerance,
            RateLimitSettings rateLimitSettings
    ) {
        validateEstimate("app.experiment.estimated-tokens-per-conversation",
                estimatedTokensPerConversation, rateLimitSettings);
        return new ExperimentSettings(conversationDelay, longPause, longPauseEvery, rateLimitCooldown,
                checkpointAfterFailures, estimatedTokensPerConversation, testModeCombinations, testModeStances,
                balanceTolerance);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /**
     * Источник случайности для перемешивания комбинаций и выбора фраз.
     * Фиксированный seed делает порядок запуска воспроизводимым.
     */
    @Bean
    public Random random(@Value("${app.experiment.random-seed:#{null}}") Long seed) {
        if (seed != null) {
            log.info("Using fixed random seed {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public QuotaRateLimiter quotaRateLimiter(RateLimitSettings rateLimitSettings, Clock clock, Sleeper sleeper) {
        return new QuotaRateLimiter(rateLimitSettings, clock, sleeper);
    }

    @Bean
    public RetryDelayExtractor retryDelayExtractor(
            @Value("${app.conversation.fallback-retry-delay:60s}") Duration fallbackRetryDelay) {
        return new RegexRetryDelayExtractor(fallbackRetryDelay);
    }

    @Bean
    public ConversationSimulator conversationSimulator(
            CompletionProvider completionProvider,
            QuotaRateLimiter quotaRateLimiter,
            RetryDelayExtractor retryDelayExtractor,
            ConversationSettings conversationSettings,
            Sleeper sleeper,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        return new ConversationSimulator(completionProvider, quotaRateLimiter, retryDelayExtractor,
                conversationSettings, sleeper, clock, random, meterRegistry);
    }

    @Bean
    public ProfileLoader profileLoader(@Value("${app.experiment.profiles-dir}") String profilesDir) {
        return new ProfileLoader(Path.of(profilesDir));
    }

    @Bean
    public ConversationRepository conversationRepository(
            @Value("${app.experiment.output-dir}") String outputDir, ObjectMapper objectMapper, Clock clock) {
        return new ConversationRepository(Path.of(outputDir), objectMapper, clock);
    }

    @Bean
    public ExperimentLogRepository experimentLogRepository(
            @Value("${app.experiment.output-dir}") String outputDir, ObjectMapper objectMapper, Clock clock) {
        return new ExperimentLogRepository(Path.of(outputDir), objectMapper, clock);
    }

    @Bean
    public MetricsReportWriter metricsReportWriter() {
        return new MetricsReportWriter();
    }

    @Bean
    public ExperimentController experimentController(
            ProfileLoader profileLoader,
            ConversationSimulator conversationSimulator,
            QuotaRateLimiter quotaRateLimiter,
            ConversationRepository conversationRepository,
            ExperimentLogRepository experimentLogRepository,
            ExperimentSettings experimentSettings,
            Sleeper sleeper,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        return new ExperimentController(profileLoader, conversationSimulator, quotaRateLimiter,
                conversationRepository, experimentLogRepository, experimentSettings, sleeper, clock, random,
                meterRegistry);
    }

    @Bean
    public MetricsAnalyzer metricsAnalyzer(ConversationRepository conversationRepository,
                                           MetricsReportWriter metricsReportWriter) {
        return new MetricsAnalyzer(conversationRepository, metricsReportWriter);
    }

    private static void validateEstimate(String property, int estimate, RateLimitSettings limits) {
        if (estimate <= 0 || estimate > limits.tokensPerMinute()) {
            throw new IllegalStateException(String.format(
                    "%s=%d must be positive and within the tokens-per-minute ceiling %d",
                    property, estimate, limits.tokensPerMinute()));
        }
    }
}
