package de.bsommerfeld.mindshare.pipeline;

import com.google.inject.AbstractModule;
import de.bsommerfeld.mindshare.core.config.ApplicationMode;
import de.bsommerfeld.mindshare.core.config.DatabaseConfig;
import de.bsommerfeld.mindshare.core.config.ExportConfig;
import de.bsommerfeld.mindshare.core.config.GlobalConfig;
import de.bsommerfeld.mindshare.core.config.RankingConfig;
import de.bsommerfeld.mindshare.db.DatabaseService;
import de.bsommerfeld.mindshare.db.SqlDatabaseService;
import de.bsommerfeld.mindshare.db.TestDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice module wiring one run. Configuration is loaded before the injector is
 * built, so this module only binds instances and picks the store
 * implementation for the {@link ApplicationMode}.
 */
public class PipelineModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;
    private final Clock clock;

    public PipelineModule(GlobalConfig config, ApplicationMode mode) {
        this(config, mode, Clock.systemDefaultZone());
    }

    public PipelineModule(GlobalConfig config, ApplicationMode mode, Clock clock) {
        this.config = config;
        this.mode = mode;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(ExportConfig.class).toInstance(config.getExport());
        bind(RankingConfig.class).toInstance(config.getRanking());

        bind(Clock.class).toInstance(clock);

        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }
    }
}
