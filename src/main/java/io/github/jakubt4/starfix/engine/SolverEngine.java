package io.github.jakubt4.starfix.engine;

import java.util.List;

/**
 * Handle to a loaded plate-solving engine. Implementations own their reference database and are
 * not required to be reentrant: callers must not invoke {@link #solve} concurrently.
 */
public interface SolverEngine {

    /**
     * Matches the centroids against the reference database.
     *
     * @param centroids star positions, brightest first
     * @param imageSize image dimensions
     * @param options   resolved solve options
     * @param budget    soft deadline and cancellation flag, to be polled during the search
     * @return the outcome; an outcome without orientation means no solution was found
     * @throws RuntimeException on internal engine failure
     */
    EngineOutcome solve(List<PixelPosition> centroids, ImageSize imageSize, SolveOptions options,
                        SolveBudget budget);

    /**
     * Asks the currently running solve, if any, to stop. Asynchronous, best-effort and idempotent.
     */
    void cancel();
}
