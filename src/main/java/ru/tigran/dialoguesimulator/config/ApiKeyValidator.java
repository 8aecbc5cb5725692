package ru.tigran.dialoguesimulator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;
import ru.tigran.dialoguesimulator.exception.ErrorCode;

/**
 * Checks the provider API key before a simulation run. Analysis runs never call the provider
 * and skip the check.
 */
@Slf4j
@Component
public class ApiKeyValidator {

    private static final String ENV_VAR_NAME = "GEMINI_API_KEY";

    private final String apiKey;

    public ApiKeyValidator(@Value("${app.gemini.api-key:}") String apiKey) {
        this.apiKey = apiKey;
    }

    /**
     * @throws ConfigurationException if the key is missing or still a placeholder
     */
    public void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(
                    String.format("%s environment variable is not set! Example: export %s=your-api-key",
                            ENV_VAR_NAME, ENV_VAR_NAME),
                    ErrorCode.CONFIGURATION_ERROR
            );
        }

        if (apiKey.contains("YOUR_") || apiKey.contains("PLACEHOLDER")) {
            throw new ConfigurationException(
                    String.format("%s contains a placeholder value! Set a real API key.", ENV_VAR_NAME),
                    ErrorCode.CONFIGURATION_ERROR
            );
        }

        log.debug("API key validation passed for {}", ENV_VAR_NAME);
    }
}
