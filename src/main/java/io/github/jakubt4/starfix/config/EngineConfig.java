package io.github.jakubt4.starfix.config;

import io.github.jakubt4.starfix.engine.SolverEngine;
import io.github.jakubt4.starfix.engine.SolverEngineFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ServiceLoader;

/**
 * Creates the process-wide {@link SolverEngine} from the configured pattern database.
 *
 * <p>The engine implementation is discovered with {@link ServiceLoader}. Startup fails if the
 * database file is unreadable or no implementation is on the classpath; there is no reload.
 */
@Slf4j
@Configuration
public class EngineConfig {

    /**
     * @throws IllegalStateException if the database or an engine implementation is missing
     */
    @Bean
    SolverEngine solverEngine(@Value("${starfix.solver.database-path}") final String databasePath) {
        return openEngine(Path.of(databasePath), ServiceLoader.load(SolverEngineFactory.class));
    }

    static SolverEngine openEngine(final Path databasePath, final Iterable<SolverEngineFactory> factories) {
        if (!Files.isReadable(databasePath)) {
            throw new IllegalStateException("Pattern database not readable: " + databasePath.toAbsolutePath());
        }
        final var iterator = factories.iterator();
        if (!iterator.hasNext()) {
            throw new IllegalStateException("No " + SolverEngineFactory.class.getSimpleName()
                    + " implementation found on classpath");
        }
        final var factory = iterator.next();
        final var engine = factory.open(databasePath);
        log.info("[ENGINE] Pattern database loaded from {} by {}", databasePath, factory.getClass().getSimpleName());
        return engine;
    }
}
