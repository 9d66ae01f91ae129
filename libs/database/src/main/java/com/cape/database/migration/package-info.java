/**
 * Flyway migration configuration.
 *
 * <ul>
 *   <li>{@link com.cape.database.migration.FlywayConfigProperties}: externalized {@code
 *       cape.flyway.*} settings
 *   <li>{@link com.cape.database.migration.LabelStoreFlywayConfig}: Spring {@code @Configuration}
 *       that migrates the label store on startup
 * </ul>
 */
package com.cape.database.migration;
