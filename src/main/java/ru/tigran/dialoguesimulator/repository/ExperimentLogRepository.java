package ru.tigran.dialoguesimulator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.dto.ExperimentResult;
import ru.tigran.dialoguesimulator.exception.PersistenceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes experiment logs to {@code <outputDir>/logs/experiment_log_<yyyyMMdd_HHmmss>.json}.
 * Checkpoints and the final log of a run share one file name pattern; a later write in the same
 * second replaces the earlier one, which always holds a subset of its records.
 */
@Slf4j
public class ExperimentLogRepository {

    public static final String LOGS_DIR = "logs";
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path logsDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExperimentLogRepository(Path outputDir, ObjectMapper objectMapper, Clock clock) {
        this.logsDir = outputDir.resolve(LOGS_DIR);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return path of the written log
     * @throws PersistenceException if the log cannot be written
     */
    public Path save(ExperimentResult result) {
        Path file = logsDir.resolve("experiment_log_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json");
        try {
            Files.createDirectories(logsDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
            log.info("Experiment log saved to {}", file);
            return file;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write experiment log " + file + ": " + e.getMessage(), e);
        }
    }
}
