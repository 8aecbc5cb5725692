package ru.tigran.dialoguesimulator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.exception.PersistenceException;
import ru.tigran.dialoguesimulator.model.Conversation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores finished conversations as pretty-printed JSON documents under
 * {@code <outputDir>/conversations/<yyyyMMdd_HHmmss>_<profile>_<intervention>.json}.
 * A name collision within the same second gets a numeric suffix; existing files are never overwritten.
 */
@Slf4j
public class ConversationRepository {

    public static final String CONVERSATIONS_DIR = "conversations";
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path conversationsDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConversationRepository(Path outputDir, ObjectMapper objectMapper, Clock clock) {
        this.conversationsDir = outputDir.resolve(CONVERSATIONS_DIR);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path getConversationsDir() {
        return conversationsDir;
    }

    /**
     * Persists a conversation exactly once.
     *
     * @return path of the written file
     * @throws PersistenceException if the file cannot be written
     */
    public Path save(Conversation conversation) {
        String baseName = String.format("%s_%s_%s",
                LocalDateTime.now(clock).format(FILE_TIMESTAMP),
                conversation.profileId(),
                conversation.intervention().getId());
        try {
            Files.createDirectories(conversationsDir);
            Path file = conversationsDir.resolve(baseName + ".json");
            for (int suffix = 2; Files.exists(file); suffix++) {
                file = conversationsDir.resolve(baseName + "_" + suffix + ".json");
            }
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(conversation);
            Files.write(file, json, StandardOpenOption.CREATE_NEW);
            log.info("Saved conversation to {}", file);
            return file;
        } catch (IOException e) {
            throw new PersistenceException("Failed to save conversation " + baseName + ": " + e.getMessage(), e);
        }
    }

    public Conversation load(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Conversation.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read conversation " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads every stored conversation, ordered by file name. Unreadable files are logged and skipped.
     * Returns an empty list when nothing has been stored yet.
     */
    public List<Conversation> findAll() {
        if (!Files.isDirectory(conversationsDir)) {
            log.warn("Conversations directory {} does not exist", conversationsDir);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(conversationsDir)) {
            files = listing
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("Failed to list " + conversationsDir + ": " + e.getMessage(), e);
        }

        List<Conversation> conversations = new ArrayList<>();
        for (Path file : files) {
            try {
                conversations.add(load(file));
            } catch (PersistenceException e) {
                log.error("Skipping unreadable conversation {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return conversations;
    }
}
