package de.bsommerfeld.mindshare.pipeline;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import de.bsommerfeld.mindshare.core.config.ApplicationMode;
import de.bsommerfeld.mindshare.core.config.ConfigLoader;
import de.bsommerfeld.mindshare.core.config.ConfigurationException;
import de.bsommerfeld.mindshare.core.config.GlobalConfig;
import de.bsommerfeld.mindshare.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Command-line entry point. Loads configuration, builds the injector, runs the
 * pipeline once and exits with a status code describing the outcome.
 *
 * <table>
 * <caption>Exit codes</caption>
 * <tr><td>0</td><td>success</td></tr>
 * <tr><td>1</td><td>configuration missing or invalid</td></tr>
 * <tr><td>2</td><td>store connection failed</td></tr>
 * <tr><td>3</td><td>query or aggregation failed</td></tr>
 * <tr><td>4</td><td>snapshot table write failed</td></tr>
 * <tr><td>5</td><td>CSV export failed</td></tr>
 * <tr><td>6</td><td>unexpected failure outside a known stage</td></tr>
 * </table>
 */
public final class PipelineMain {

    static {
        // Logback reads LOG_DIR when the first logger is created
        Path logDir = StorageUtils.logsDir();
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PipelineMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_UNEXPECTED = 6;

    private PipelineMain() {
    }

    public static void main(String[] args) {
        System.exit(run(ApplicationMode.get(), ConfigLoader.resolvePath()));
    }

    static int run(ApplicationMode mode, Path configPath) {
        LOG.info("Loading configuration from: {}", configPath);
        GlobalConfig config;
        try {
            config = ConfigLoader.load(configPath, mode);
        } catch (ConfigurationException e) {
            LOG.error("Error loading configuration: {}", e.getMessage());
            LOG.error("Example config.toml:\n{}", ConfigLoader.exampleConfig());
            return EXIT_CONFIG;
        }

        Module module = new PipelineModule(config, mode);
        return execute(() -> Guice.createInjector(module));
    }

    /**
     * Builds the injector, runs the pipeline and maps the outcome to an exit
     * code. Unchecked failures are logged and reported as
     * {@link #EXIT_UNEXPECTED}.
     */
    static int execute(Supplier<Injector> injectorFactory) {
        try {
            injectorFactory.get().getInstance(AggregationPipeline.class).run();
            return EXIT_OK;
        } catch (PipelineException e) {
            LOG.error("Error during execution ({}): {}", e.getStage(), e.getMessage(), e);
            return e.getStage().exitCode();
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during execution: {}", e.getMessage(), e);
            return EXIT_UNEXPECTED;
        }
    }
}
