package ru.tigran.dialoguesimulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import ru.tigran.dialoguesimulator.cli.ExperimentCommandLineRunner;
import ru.tigran.dialoguesimulator.config.ConversationSettings;
import ru.tigran.dialoguesimulator.config.ExperimentSettings;
import ru.tigran.dialoguesimulator.config.RateLimitSettings;
import ru.tigran.dialoguesimulator.service.CompletionProvider;
import ru.tigran.dialoguesimulator.service.GeminiGatewayService;
import ru.tigran.dialoguesimulator.support.TestSettings;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Поднимает контекст в режиме анализа: проверяет сборку бинов и значения по умолчанию из application.yml.
 */
@SpringBootTest(
        args = "--analyze",
        properties = {
                "app.experiment.output-dir=target/context-test-results",
                "app.gemini.api-key=test-key"
        }
)
@DisplayName("Контекст приложения")
class DialogueSimulatorApplicationTest {

    @Autowired
    private CompletionProvider completionProvider;

    @Autowired
    private RateLimitSettings rateLimitSettings;

    @Autowired
    private ConversationSettings conversationSettings;

    @Autowired
    private ExperimentSettings experimentSettings;

    @Autowired
    private ExperimentCommandLineRunner runner;

    @Test
    @DisplayName("контекст собирается с настройками бесплатного тарифа Gemini")
    void contextLoads() {
        assertInstanceOf(GeminiGatewayService.class, completionProvider);
        assertEquals(TestSettings.GEMINI_FREE_TIER, rateLimitSettings);
        assertEquals(TestSettings.CONVERSATION, conversationSettings);
        assertEquals(TestSettings.EXPERIMENT, experimentSettings);
        // nothing stored under the test output dir yet
        assertEquals(1, runner.getExitCode());
    }
}
