package ru.tigran.dialoguesimulator.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import ru.tigran.dialoguesimulator.config.ApiKeyValidator;
import ru.tigran.dialoguesimulator.dto.AnalysisReport;
import ru.tigran.dialoguesimulator.dto.BalanceReport;
import ru.tigran.dialoguesimulator.dto.ExperimentResult;
import ru.tigran.dialoguesimulator.exception.ApplicationException;
import ru.tigran.dialoguesimulator.exception.ConfigurationException;
import ru.tigran.dialoguesimulator.service.ExperimentController;
import ru.tigran.dialoguesimulator.service.MetricsAnalyzer;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * --test                    small fixed subset (one profile per test stance, three conversations)
 * --profiles=a,b            explicit profile ids
 * --output-dir=dir          results directory (conversations/, logs/)
 * --analyze [--report=f]    analyze stored conversations instead of running; CSV defaults to
 *                           &lt;output-dir&gt;/analysis_results.csv
 * </pre>
 * Exit code 0 when at least one conversation completed (or the analysis found conversations), 1 otherwise.
 */
@Slf4j
@Component
public class ExperimentCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String DEFAULT_REPORT_FILE = "analysis_results.csv";

    private final ExperimentController experimentController;
    private final MetricsAnalyzer metricsAnalyzer;
    private final ApiKeyValidator apiKeyValidator;
    private final String outputDir;
    private int exitCode;

    public ExperimentCommandLineRunner(
            ExperimentController experimentController,
            MetricsAnalyzer metricsAnalyzer,
            ApiKeyValidator apiKeyValidator,
            @Value("${app.experiment.output-dir}") String outputDir
    ) {
        this.experimentController = experimentController;
        this.metricsAnalyzer = metricsAnalyzer;
        this.apiKeyValidator = apiKeyValidator;
        this.outputDir = outputDir;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("analyze")) {
            exitCode = runAnalysis(args);
        } else {
            exitCode = runExperiment(args);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int runExperiment(ApplicationArguments args) {
        boolean testMode = args.containsOption("test");
        List<String> profiles = profileIds(args);
        log.info("POLITICAL CONVERSATION SIMULATION EXPERIMENT: testMode={}, profiles={}, outputDir={}",
                testMode, profiles.isEmpty() ? "all" : profiles, outputDir);

        try {
            apiKeyValidator.validate();
            ExperimentResult result = experimentController.runExperiment(testMode, profiles);

            if (result.getTotalSuccessful() == 0) {
                log.error("No successful conversations completed");
                return 1;
            }
            BalanceReport balance = experimentController.validateBalance(result);
            log.info("Experiment completed: {} successful, {} failed. Balance check: {} {}",
                    result.getTotalSuccessful(), result.getTotalFailed(),
                    balance.balanced() ? "balanced" : "unbalanced", balance.counts());
            return 0;
        } catch (ConfigurationException e) {
            log.error("Configuration error [{}]: {}", e.getErrorCode(), e.getMessage());
            return 1;
        } catch (ApplicationException e) {
            log.error("Experiment failed [{}]: {}", e.getErrorCode(), e.getMessage(), e);
            return 1;
        }
    }

    private int runAnalysis(ApplicationArguments args) {
        Path report = reportFile(args);
        try {
            AnalysisReport analysis = metricsAnalyzer.generateReport(report);
            return analysis.rows().isEmpty() ? 1 : 0;
        } catch (ApplicationException e) {
            log.error("Analysis failed [{}]: {}", e.getErrorCode(), e.getMessage(), e);
            return 1;
        }
    }

    private Path reportFile(ApplicationArguments args) {
        List<String> values = args.getOptionValues("report");
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0));
        }
        return Path.of(outputDir).resolve(DEFAULT_REPORT_FILE);
    }

    /**
     * Accepts both {@code --profiles=a,b} and repeated {@code --profiles=a --profiles=b}.
     */
    static List<String> profileIds(ApplicationArguments args) {
        List<String> values = args.getOptionValues("profiles");
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::strip)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }
}
