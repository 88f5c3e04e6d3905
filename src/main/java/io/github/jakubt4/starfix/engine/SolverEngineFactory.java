package io.github.jakubt4.starfix.engine;

import java.nio.file.Path;

/**
 * Creates {@link SolverEngine} instances. Implementations are discovered with
 * {@link java.util.ServiceLoader}.
 */
public interface SolverEngineFactory {

    /**
     * Loads the pattern database and returns a ready engine.
     *
     * @throws java.io.UncheckedIOException if the database cannot be read
     */
    SolverEngine open(Path databasePath);
}
