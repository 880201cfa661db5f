package com.strata.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/**
 * Private in-memory H2 metadata store initialised from the production schema.
 */
public final class TestDatabase implements AutoCloseable {

    private final EmbeddedDatabase database;
    private final JdbcTemplate jdbcTemplate;

    private TestDatabase(EmbeddedDatabase database) {
        this.database = database;
        this.jdbcTemplate = new JdbcTemplate(database);
    }

    public static TestDatabase create() {
        return new TestDatabase(new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("classpath:schema.sql")
            .build());
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
