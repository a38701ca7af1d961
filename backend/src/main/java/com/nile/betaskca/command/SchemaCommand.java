package com.nile.betaskca.command;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Creates the database schema and exits. Flyway has already applied the
 * migrations by the time this runs; this reports the result and shuts down.
 *
 * Run with:  --spring.profiles.active=schema  or  SPRING_PROFILES_ACTIVE=schema
 */
@Component
@Profile("schema")
public class SchemaCommand implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaCommand.class);

    private final Flyway flyway;
    private final ConfigurableApplicationContext context;

    public SchemaCommand(Flyway flyway, ConfigurableApplicationContext context) {
        this.flyway = flyway;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        // No-op when the schema is already current
        var result = flyway.migrate();
        MigrationInfo current = flyway.info().current();
        log.info("SchemaCommand: applied {} migration(s), schema now at version {}",
                result.migrationsExecuted,
                current != null ? current.getVersion() : "<none>");
        SpringApplication.exit(context, () -> 0);
    }
}
