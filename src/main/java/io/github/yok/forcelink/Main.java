package io.github.yok.forcelink;

import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.config.CsvConfig;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.config.EnrichmentConfig;
import io.github.yok.forcelink.config.SalesforceConfig;
import io.github.yok.forcelink.core.BatchDispatcher;
import io.github.yok.forcelink.core.EnrichmentPipeline;
import io.github.yok.forcelink.core.QueryExporter;
import io.github.yok.forcelink.core.RunCancellation;
import io.github.yok.forcelink.core.SyncService;
import io.github.yok.forcelink.enrich.WebCompanyScraper;
import io.github.yok.forcelink.mapping.ConsoleDecisionProvider;
import io.github.yok.forcelink.mapping.DecisionProvider;
import io.github.yok.forcelink.mapping.PresetDecisionProvider;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SyncSummary;
import io.github.yok.forcelink.store.ObjectStoreFactory;
import io.github.yok.forcelink.store.RemoteObjectStore;
import io.github.yok.forcelink.store.SessionProvider;
import io.github.yok.forcelink.util.ErrorHandler;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --sync <csv> <object>} or {@code -s <csv> <object>} uploads a CSV file. Options:
 * {@code --operation/-o insert|update|upsert|delete} (default {@code insert}),
 * {@code --external-id/-x <field>} (required for upsert), {@code --batch-size/-b <n>}.</li>
 * <li>{@code --query <soql> <output>} or {@code -q <soql> <output>} exports a query result to
 * CSV.</li>
 * <li>{@code --enrich <recordId> <objectType>} or {@code -e <recordId> <objectType>} enriches one
 * record. Option: {@code --fields/-f a,b,c} overrides the configured allow-list.</li>
 * <li>{@code --yes} or {@code -y} answers every prompt automatically: columns keep their names
 * and enrichment diffs are accepted.</li>
 * </ul>
 *
 * <p>
 * Spring Boot loads {@link ApiConfig}, {@link CsvConfig}, {@link EnrichmentConfig} and
 * {@link SalesforceConfig}; they are turned into immutable settings before any component is
 * built. A fatal error is reported through {@link ErrorHandler} and ends the process with exit
 * status 1. A user interrupt stops the run at the next chunk boundary.
 * </p>
 *
 * @see ObjectStoreFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ApiConfig.class, CsvConfig.class, EnrichmentConfig.class,
        SalesforceConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private static final String USAGE = "Usage: --sync <csv> <object> [--operation op]"
            + " [--external-id field] [--batch-size n] [--yes] | --query <soql> <output.csv>"
            + " | --enrich <recordId> <objectType> [--fields a,b,c] [--yes]";

    private final ApiConfig apiConfig;
    private final CsvConfig csvConfig;
    private final EnrichmentConfig enrichmentConfig;
    private final ObjectStoreFactory storeFactory;

    private final RunCancellation cancellation = new RunCancellation();

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String first = null;
        String second = null;
        String operation = "insert";
        String externalId = null;
        Integer batchSize = null;
        Set<String> fields = new LinkedHashSet<>();
        boolean assumeYes = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--sync":
                case "-s":
                case "--query":
                case "-q":
                case "--enrich":
                case "-e":
                    mode = modeOf(args[i]);
                    first = (i + 1 < args.length ? args[++i] : null);
                    second = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--operation":
                case "-o":
                    operation = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--external-id":
                case "-x":
                    externalId = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--batch-size":
                case "-b":
                    String value = (i + 1 < args.length ? args[++i] : "");
                    try {
                        batchSize = Integer.valueOf(value.trim());
                    } catch (NumberFormatException e) {
                        exitCode = ErrorHandler.errorAndExit("Invalid batch size: " + value);
                        return;
                    }
                    break;
                case "--fields":
                case "-f":
                    if (i + 1 < args.length) {
                        fields = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(field -> !field.isEmpty())
                                .collect(Collectors.toCollection(LinkedHashSet::new));
                    }
                    break;
                case "--yes":
                case "-y":
                    assumeYes = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null || first == null || second == null) {
            exitCode = ErrorHandler.errorAndExit(USAGE);
            return;
        }
        log.info("Mode: {}, Arguments: [{}] [{}]", mode, first, second);

        Thread hook = new Thread(() -> cancellation.cancelAndAwait(SHUTDOWN_GRACE),
                "forcelink-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            apiConfig.validate();
            CsvSettings csvSettings = csvConfig.toSettings();
            SessionProvider sessionProvider = storeFactory.createSessionProvider();
            RemoteObjectStore store = storeFactory.createObjectStore();
            BatchDispatcher dispatcher = new BatchDispatcher(store, sessionProvider,
                    apiConfig.toRetryPolicy(), cancellation);
            DecisionProvider decisions = assumeYes ? PresetDecisionProvider.acceptAll()
                    : ConsoleDecisionProvider.system();

            switch (mode) {
                case "sync":
                    SyncSummary summary = new SyncService(dispatcher, store, sessionProvider,
                            apiConfig, csvSettings).sync(Paths.get(first), second,
                                    Operation.fromLabel(operation), decisions, batchSize,
                                    externalId);
                    System.out.printf("Total: %d, Succeeded: %d, Failed: %d, Skipped: %d%n",
                            summary.getTotal(), summary.getSucceeded(), summary.getFailed(),
                            summary.getSkipped());
                    summary.getErrorFileIfAny()
                            .ifPresent(path -> System.out.println("Failed records: " + path));
                    break;

                case "query":
                    int rows = new QueryExporter(store, sessionProvider, csvSettings)
                            .export(first, Paths.get(second));
                    System.out.printf("Exported %d row(s) to %s%n", rows, second);
                    break;

                default:
                    Set<String> allowed =
                            fields.isEmpty() ? enrichmentConfig.allowedFieldsFor(second) : fields;
                    boolean applied = new EnrichmentPipeline(store, sessionProvider,
                            new WebCompanyScraper(enrichmentConfig), dispatcher, decisions,
                            csvSettings).enrich(first, second, allowed);
                    System.out.println(applied ? "Record updated." : "Record not updated.");
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        } finally {
            removeShutdownHook(hook);
        }
    }

    private static String modeOf(String flag) {
        switch (flag) {
            case "--sync":
            case "-s":
                return "sync";
            case "--query":
            case "-q":
                return "query";
            default:
                return "enrich";
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress: {}", e.getMessage());
        }
    }
}
