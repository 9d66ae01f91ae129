package com.cape.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the label store.
 *
 * <p>Creates one Flyway instance over the application's {@link DataSource} and migrates it while
 * the context starts, so the schema is current before the first request.
 *
 * <h2>Excluding Spring Boot Auto-Configuration</h2>
 *
 * <p>Services importing this configuration should exclude {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "cape.flyway", name = "enabled", havingValue = "true")
public class LabelStoreFlywayConfig {

    /** Bean name of the label store Flyway instance. */
    public static final String LABEL_STORE_FLYWAY_BEAN = "labelStoreFlyway";

    private static final Logger log = LoggerFactory.getLogger(LabelStoreFlywayConfig.class);

    /**
     * Creates the label store Flyway instance and runs pending migrations.
     *
     * @param dataSource the label store datasource
     * @param properties externalized Flyway configuration
     * @return the migrated Flyway instance
     */
    @Bean(name = LABEL_STORE_FLYWAY_BEAN)
    public Flyway labelStoreFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        Flyway flyway = createFlyway(dataSource, properties);
        MigrateResult result = flyway.migrate();
        log.info(
                "Label store schema at version {} ({} migration(s) applied)",
                result.targetSchemaVersion,
                result.migrationsExecuted);
        return flyway;
    }

    /** Builds, without running, a Flyway instance for {@code dataSource}. */
    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
