package com.cape.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the label store.
 *
 * <p>The datasource itself comes from {@code spring.datasource.*}; these properties only steer the
 * migration run.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * cape:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/labels
 *     baseline-on-migrate: true
 * }</pre>
 *
 * @param enabled whether to migrate the label store on startup
 * @param locations Flyway migration locations
 * @param baselineOnMigrate whether to baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "cape.flyway")
public record FlywayConfigProperties(
        boolean enabled, @NotBlank String locations, boolean baselineOnMigrate) {

    /** Location of the label store scripts shipped with this module. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/labels";

    /** Applies the default location before Bean Validation runs. */
    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
