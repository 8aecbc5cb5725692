package ru.tigran.dialoguesimulator.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ApiKeyValidator unit тесты")
class ApiKeyValidatorTest {

    @Test
    @DisplayName("validate - пустой ключ отклоняется")
    void blankKeyRejected() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> new ApiKeyValidator("  ").validate());

        assertTrue(error.getMessage().contains("GEMINI_API_KEY"));
    }

    @Test
    @DisplayName("validate - ключ-заглушка отклоняется")
    void placeholderRejected() {
        assertThrows(ConfigurationException.class, () -> new ApiKeyValidator("YOUR_API_KEY_HERE").validate());
    }

    @Test
    @DisplayName("validate - настоящий ключ проходит")
    void realKeyAccepted() {
        assertDoesNotThrow(() -> new ApiKeyValidator("AIzaSyExampleKey123").validate());
    }
}
