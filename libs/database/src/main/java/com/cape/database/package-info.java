/**
 * Database support for the label store.
 *
 * <p>Flyway owns the schema. Versioned scripts live under {@code db/migration/labels} on the
 * classpath and follow the {@code V{n}__{description}.sql} naming:
 *
 * <ul>
 *   <li>{@code V1__label_schema.sql}: tokens, token-sets, groups, levels, objects and the two
 *       junction tables, with unique keys on every canonical signature
 * </ul>
 *
 * @see com.cape.database.migration.LabelStoreFlywayConfig
 */
package com.cape.database;
