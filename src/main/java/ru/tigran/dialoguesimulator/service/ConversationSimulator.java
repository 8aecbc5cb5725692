package ru.tigran.dialoguesimulator.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.config.ConversationSettings;
import ru.tigran.dialoguesimulator.dto.GenerationParams;
import ru.tigran.dialoguesimulator.dto.GenerationRequest;
import ru.tigran.dialoguesimulator.exception.DailyQuotaExceededException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.ProviderException;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;
import ru.tigran.dialoguesimulator.model.Conversation;
import ru.tigran.dialoguesimulator.model.ConversationMetadata;
import ru.tigran.dialoguesimulator.model.ConversationPhase;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.Role;
import ru.tigran.dialoguesimulator.model.StanceSummary;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Drives one agent/subject dialogue to a natural or forced ending.
 *
 * Flow: random agent opening, the profile's opening response, then alternating generated agent and
 * subject turns. {@link ConversationEndingPolicy} is consulted after every appended turn; a
 * non-hard-limit ending appends one subject acknowledgment.
 *
 * Every generation attempt is admitted by the rate limiter first. A failed turn is retried up to
 * {@code maxRetries} times and then replaced by canned text, so provider failures never abort a
 * conversation. Only {@link DailyQuotaExceededException} and interrupts escape.
 */
@Slf4j
public class ConversationSimulator {

    private final CompletionProvider completionProvider;
    private final QuotaRateLimiter rateLimiter;
    private final RetryDelayExtractor retryDelayExtractor;
    private final ConversationSettings settings;
    private final ConversationEndingPolicy endingPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Random random;
    private final Counter generationCounter;
    private final Counter fallbackCounter;

    public ConversationSimulator(
            CompletionProvider completionProvider,
            QuotaRateLimiter rateLimiter,
            RetryDelayExtractor retryDelayExtractor,
            ConversationSettings settings,
            Sleeper sleeper,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        this.completionProvider = completionProvider;
        this.rateLimiter = rateLimiter;
        this.retryDelayExtractor = retryDelayExtractor;
        this.settings = settings;
        this.endingPolicy = new ConversationEndingPolicy(settings, random);
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
        this.generationCounter = Counter.builder("conversation.generation.calls")
                .description("Completion provider calls attempted")
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("conversation.turns.fallback")
                .description("Turns replaced by canned fallback text")
                .register(meterRegistry);
    }

    /**
     * Simulates one conversation.
     *
     * @param profile subject persona
     * @param intervention strategy carried by the agent
     * @return finished conversation, never longer than the hard limit
     * @throws DailyQuotaExceededException when the daily request ceiling is reached mid-conversation
     * @throws ProviderException with {@link ErrorCode#INTERRUPTED} when the thread is interrupted while waiting
     */
    public Conversation simulate(SubjectProfile profile, Intervention intervention) {
        log.info("Simulating conversation: profile={}, intervention={}", profile.profileId(), intervention.getId());
        Instant startTime = clock.instant();
        StanceSummary stance = StanceSummary.of(profile);
        List<Turn> turns = new ArrayList<>();

        append(turns, Role.AGENT, DialogueLexicon.pick(DialogueLexicon.AGENT_OPENINGS, random));
        Optional<EndingReason> ending = endingPolicy.evaluate(turns);

        if (ending.isEmpty()) {
            append(turns, Role.SUBJECT, profile.openingResponse());
            ending = endingPolicy.evaluate(turns);
        }

        while (ending.isEmpty()) {
            ConversationPhase phase = ConversationPhase.forTurnCount(turns.size());
            Role next = turns.get(turns.size() - 1).role().opposite();
            String text = next == Role.AGENT
                    ? generateAgentTurn(intervention, phase, turns, stance)
                    : generateSubjectTurn(profile, phase, turns);
            append(turns, next, text);
            ending = endingPolicy.evaluate(turns);
        }

        EndingReason reason = ending.get();
        if (reason.isNatural()) {
            append(turns, Role.SUBJECT, DialogueLexicon.pick(DialogueLexicon.SUBJECT_CLOSINGS, random));
        }

        ConversationMetadata metadata = new ConversationMetadata(startTime, clock.instant(), turns.size(), reason);
        log.info("Conversation finished: profile={}, intervention={}, messages={}, ending={}",
                profile.profileId(), intervention.getId(), turns.size(), reason.getValue());
        return new Conversation(profile.profileId(), intervention, turns, metadata, profile);
    }

    private String generateAgentTurn(Intervention intervention, ConversationPhase phase,
                                     List<Turn> turns, StanceSummary stance) {
        List<String> examples = DialogueLexicon.ENDING_PROGRESSIONS.get(phase);
        String example = examples == null ? null : DialogueLexicon.pick(examples, random);
        String prompt = DialoguePromptBuilder.buildAgentPrompt(
                intervention, phase, recent(turns, settings.agentHistoryTurns()), stance, example);
        return generateWithRetry(prompt, DialoguePromptBuilder.AGENT_PARAMS, Role.AGENT,
                () -> phase.fallbackFor(Role.AGENT));
    }

    private String generateSubjectTurn(SubjectProfile profile, ConversationPhase phase, List<Turn> turns) {
        String prompt = DialoguePromptBuilder.buildSubjectPrompt(
                profile, recent(turns, settings.subjectHistoryTurns()), phase);
        return generateWithRetry(prompt, DialoguePromptBuilder.SUBJECT_PARAMS, Role.SUBJECT, () -> {
            List<String> phrases = profile.typicalPhrases();
            return phrases.isEmpty() ? phase.fallbackFor(Role.SUBJECT) : DialogueLexicon.pick(phrases, random);
        });
    }

    /**
     * Calls the provider with bounded retries.
     * Quota exhaustion sleeps for the advised delay plus the retry buffer (not after the last attempt);
     * other failures retry immediately. Exhausted attempts yield the fallback text.
     */
    private String generateWithRetry(String prompt, GenerationParams params, Role role, Supplier<String> fallback) {
        GenerationRequest request = new GenerationRequest(settings.model(), prompt, params);
        int maxRetries = settings.maxRetries();

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Duration backoff = Duration.ZERO;
            try {
                rateLimiter.waitIfNeeded(settings.estimatedTokensPerCall());
                rateLimiter.recordRequest(settings.estimatedTokensPerCall());
                generationCounter.increment();

                String text = completionProvider.generate(request);
                if (text == null || text.isBlank()) {
                    throw new ProviderException("Blank completion", ErrorCode.INVALID_AI_RESPONSE);
                }
                return text.strip();
            } catch (DailyQuotaExceededException e) {
                throw e;
            } catch (InterruptedException e) {
                throw interrupted(e);
            } catch (QuotaExhaustedException e) {
                Duration delay = retryDelayExtractor.retryDelay(e.getPayload());
                log.warn("{} attempt {}/{} hit provider quota, advised delay {}s",
                        role.getValue(), attempt, maxRetries, delay.toSeconds());
                if (attempt < maxRetries) {
                    backoff = delay.plus(settings.retryBuffer());
                }
            } catch (RuntimeException e) {
                log.warn("{} attempt {}/{} failed: {}", role.getValue(), attempt, maxRetries, e.getMessage());
            }

            if (!backoff.isZero()) {
                log.info("Rate limited by provider. Waiting {}s before retry", backoff.toSeconds());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    throw interrupted(e);
                }
            }
        }

        fallbackCounter.increment();
        String text = fallback.get();
        log.warn("{} turn degraded to fallback after {} attempts", role.getValue(), maxRetries);
        return text;
    }

    private ProviderException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new ProviderException("Interrupted while waiting for the provider", ErrorCode.INTERRUPTED, false, e);
    }

    private void append(List<Turn> turns, Role role, String text) {
        turns.add(new Turn(role, text, clock.instant()));
    }

    private static List<Turn> recent(List<Turn> turns, int window) {
        return List.copyOf(turns.subList(Math.max(0, turns.size() - window), turns.size()));
    }
}
