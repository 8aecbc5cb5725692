package ru.tigran.dialoguesimulator.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.config.ExperimentSettings;
import ru.tigran.dialoguesimulator.dto.BalanceReport;
import ru.tigran.dialoguesimulator.dto.Combination;
import ru.tigran.dialoguesimulator.dto.ExperimentResult;
import ru.tigran.dialoguesimulator.dto.FailedCombination;
import ru.tigran.dialoguesimulator.dto.SuccessfulCombination;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;
import ru.tigran.dialoguesimulator.exception.DailyQuotaExceededException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.PersistenceException;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;
import ru.tigran.dialoguesimulator.model.Conversation;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.repository.ConversationRepository;
import ru.tigran.dialoguesimulator.repository.ExperimentLogRepository;
import ru.tigran.dialoguesimulator.util.Sleeper;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs the profile × intervention factorial (or a small test subset) sequentially.
 *
 * Combinations are shuffled before the run. A failing combination is recorded and skipped; the batch
 * only stops early on the daily quota or an interrupt. Pacing delays are layered on top of the rate
 * limiter. The final log is always written; a checkpoint log is written after every failure once
 * failures accumulate.
 *
 * Resumption after a crash is manual: re-run with an explicit profile selection.
 */
@Slf4j
public class ExperimentController {

    private final ProfileLoader profileLoader;
    private final ConversationSimulator simulator;
    private final QuotaRateLimiter rateLimiter;
    private final ConversationRepository conversationRepository;
    private final ExperimentLogRepository logRepository;
    private final ExperimentSettings settings;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Random random;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Timer conversationTimer;

    public ExperimentController(
            ProfileLoader profileLoader,
            ConversationSimulator simulator,
            QuotaRateLimiter rateLimiter,
            ConversationRepository conversationRepository,
            ExperimentLogRepository logRepository,
            ExperimentSettings settings,
            Sleeper sleeper,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        this.profileLoader = profileLoader;
        this.simulator = simulator;
        this.rateLimiter = rateLimiter;
        this.conversationRepository = conversationRepository;
        this.logRepository = logRepository;
        this.settings = settings;
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
        this.completedCounter = Counter.builder("experiment.conversations.completed")
                .description("Conversations simulated and persisted")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("experiment.conversations.failed")
                .description("Combinations recorded as failed")
                .register(meterRegistry);
        this.conversationTimer = Timer.builder("experiment.conversation.time")
                .description("Time to simulate and persist one conversation")
                .register(meterRegistry);
    }

    /**
     * Runs the experiment.
     *
     * @param testMode one profile per configured stance, truncated to a few combinations
     * @param specificProfiles explicit profile ids, empty or null for all profiles
     * @return run record, completed and logged
     * @throws ConfigurationException when no profiles exist or none of the requested ids match
     */
    public ExperimentResult runExperiment(boolean testMode, List<String> specificProfiles) {
        log.info("Starting experiment (testMode={})", testMode);

        List<String> profileIds = selectProfiles(testMode, specificProfiles);
        List<Combination> combinations = buildCombinations(profileIds);
        if (testMode && combinations.size() > settings.testModeCombinations()) {
            combinations = new ArrayList<>(combinations.subList(0, settings.testModeCombinations()));
        }
        log.info("Selected {} profiles, will run {} conversations", profileIds.size(), combinations.size());

        ExperimentResult result = new ExperimentResult(testMode, clock.instant(), combinations);
        int total = combinations.size();

        for (int i = 1; i <= total; i++) {
            Combination combination = combinations.get(i - 1);
            log.info("[{}/{}] Running: {} x {}", i, total, combination.profileId(), combination.intervention().getId());

            Duration pause;
            try {
                runCombination(combination, result);
                pause = i < total ? pacingAfter(i) : Duration.ZERO;
            } catch (DailyQuotaExceededException e) {
                recordFailure(result, combination, e);
                log.error("Daily quota reached, stopping the batch after {} of {} combinations", i, total);
                break;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                recordFailure(result, combination, e);
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Interrupted, stopping the batch after {} of {} combinations", i, total);
                    break;
                }
                pause = isRateLimitSignal(e) ? settings.rateLimitCooldown() : Duration.ZERO;
                if (!pause.isZero()) {
                    log.warn("Rate limit hit. Cooling down for {}s", pause.toSeconds());
                }
            }

            if (!pause.isZero() && !pauseFor(pause)) {
                log.warn("Interrupted during pacing, stopping the batch after {} of {} combinations", i, total);
                break;
            }
        }

        result.complete(clock.instant());
        saveLog(result);
        logSummary(result);
        return result;
    }

    /**
     * Checks that completed counts per (profile group × intervention) cell differ by at most the tolerance.
     * Every planned cell is counted, so a planned cell without any success counts as 0.
     */
    public BalanceReport validateBalance(ExperimentResult result) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Combination planned : result.getPlanned()) {
            counts.putIfAbsent(cellKey(planned.profileId(), planned.intervention()), 0);
        }
        for (SuccessfulCombination success : result.getSuccessful()) {
            counts.merge(cellKey(success.profileId(), success.intervention()), 1, Integer::sum);
        }

        boolean balanced = true;
        if (!counts.isEmpty()) {
            int max = Collections.max(counts.values());
            int min = Collections.min(counts.values());
            balanced = max - min <= settings.balanceTolerance();
        }
        return new BalanceReport(balanced, counts);
    }

    private void runCombination(Combination combination, ExperimentResult result) throws InterruptedException {
        rateLimiter.waitIfNeeded(settings.estimatedTokensPerConversation());
        rateLimiter.recordRequest(settings.estimatedTokensPerConversation());

        long started = System.nanoTime();
        SubjectProfile profile = profileLoader.loadProfile(combination.profileId());
        Conversation conversation = simulator.simulate(profile, combination.intervention());
        Path file = conversationRepository.save(conversation);
        conversationTimer.record(Duration.ofNanos(System.nanoTime() - started));

        result.recordSuccess(new SuccessfulCombination(
                combination.profileId(),
                combination.intervention(),
                conversation.turnCount(),
                conversation.metadata().endingReason(),
                file.toString()
        ));
        completedCounter.increment();
        log.info("Success: {} messages, ending={}", conversation.turnCount(),
                conversation.metadata().endingReason().getValue());
    }

    private void recordFailure(ExperimentResult result, Combination combination, Exception e) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Failed: {} x {}: {}", combination.profileId(), combination.intervention().getId(), error);
        result.recordFailure(new FailedCombination(combination.profileId(), combination.intervention(), error));
        failedCounter.increment();

        if (result.getTotalFailed() >= settings.checkpointAfterFailures()) {
            log.warn("Multiple failures detected ({}). Saving partial results", result.getTotalFailed());
            saveLog(result);
        }
    }

    private List<String> selectProfiles(boolean testMode, List<String> specificProfiles) {
        List<String> available = profileLoader.listProfileIds();
        if (available.isEmpty()) {
            throw new ConfigurationException(
                    "No profiles found in " + profileLoader.getProfilesDir(), ErrorCode.NO_PROFILES_FOUND);
        }

        if (specificProfiles != null && !specificProfiles.isEmpty()) {
            List<String> selected = available.stream().filter(specificProfiles::contains).toList();
            specificProfiles.stream()
                    .filter(id -> !available.contains(id))
                    .forEach(id -> log.warn("Requested profile '{}' not found", id));
            if (selected.isEmpty()) {
                throw new ConfigurationException(
                        "None of the requested profiles exist: " + specificProfiles, ErrorCode.PROFILE_NOT_FOUND);
            }
            return selected;
        }

        if (testMode) {
            Set<String> selected = new LinkedHashSet<>();
            for (String stance : settings.testModeStances()) {
                pickForStance(available, stance, selected).ifPresent(selected::add);
            }
            if (selected.isEmpty()) {
                throw new ConfigurationException(
                        "No profiles match the test-mode stances " + settings.testModeStances(),
                        ErrorCode.NO_PROFILES_FOUND);
            }
            return List.copyOf(selected);
        }

        return available;
    }

    /**
     * First id whose stance prefix equals the fragment ("center" picks center_1, not center_left_1);
     * otherwise the first not yet chosen id containing it.
     */
    private static Optional<String> pickForStance(List<String> ids, String stance, Set<String> chosen) {
        String fragment = stance.toLowerCase(Locale.ROOT);
        return ids.stream()
                .filter(id -> SubjectProfile.groupOf(id).equals(fragment))
                .findFirst()
                .or(() -> ids.stream()
                        .filter(id -> id.toLowerCase(Locale.ROOT).contains(fragment) && !chosen.contains(id))
                        .findFirst());
    }

    private List<Combination> buildCombinations(List<String> profileIds) {
        List<Combination> combinations = new ArrayList<>();
        for (String profileId : profileIds) {
            for (Intervention intervention : Intervention.values()) {
                combinations.add(new Combination(profileId, intervention));
            }
        }
        Collections.shuffle(combinations, random);
        return combinations;
    }

    private Duration pacingAfter(int completed) {
        return completed % settings.longPauseEvery() == 0 ? settings.longPause() : settings.conversationDelay();
    }

    private boolean pauseFor(Duration pause) {
        try {
            sleeper.sleep(pause);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isRateLimitSignal(Exception e) {
        if (e instanceof QuotaExhaustedException) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("rate limit");
    }

    private void saveLog(ExperimentResult result) {
        try {
            logRepository.save(result);
        } catch (PersistenceException e) {
            log.error("Could not write experiment log: {}", e.getMessage());
        }
    }

    private void logSummary(ExperimentResult result) {
        log.info("Experiment summary: planned={}, successful={}, failed={}",
                result.getTotalPlanned(), result.getTotalSuccessful(), result.getTotalFailed());
        if (result.getSuccessful().isEmpty()) {
            return;
        }
        double avgMessages = result.getSuccessful().stream()
                .mapToInt(SuccessfulCombination::messageCount)
                .average()
                .orElse(0.0);
        log.info("Average message count: {}", String.format("%.1f", avgMessages));
        for (Intervention intervention : Intervention.values()) {
            long count = result.getSuccessful().stream()
                    .filter(success -> success.intervention() == intervention)
                    .count();
            log.info("  {}: {}", intervention.getId(), count);
        }
    }

    private static String cellKey(String profileId, Intervention intervention) {
        return SubjectProfile.groupOf(profileId) + "_" + intervention.getId();
    }
}
