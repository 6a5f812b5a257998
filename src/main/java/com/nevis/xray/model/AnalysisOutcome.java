package com.nevis.xray.model;

import java.util.Optional;

/**
 * Terminal result of an analysis session. Every variant carries enough to build a
 * user message without looking at engine internals.
 */
public sealed interface AnalysisOutcome
    permits AnalysisOutcome.Completed, AnalysisOutcome.Aborted, AnalysisOutcome.Failed {

    AnalysisState state();

    Optional<Snapshot> snapshot();

    /**
     * @param warning set when a chunk failed after earlier progress and the session
     *                fell back to the last good snapshot
     */
    record Completed(Snapshot result, AnalysisError warning) implements AnalysisOutcome {
        public Completed(Snapshot result) {
            this(result, null);
        }

        public boolean degraded() {
            return warning != null;
        }

        @Override
        public AnalysisState state() {
            return AnalysisState.COMPLETED;
        }

        @Override
        public Optional<Snapshot> snapshot() {
            return Optional.of(result);
        }
    }

    record Aborted(Snapshot result) implements AnalysisOutcome {
        @Override
        public AnalysisState state() {
            return AnalysisState.ABORTED;
        }

        @Override
        public Optional<Snapshot> snapshot() {
            return Optional.ofNullable(result);
        }
    }

    record Failed(AnalysisError error) implements AnalysisOutcome {
        @Override
        public AnalysisState state() {
            return AnalysisState.FAILED;
        }

        @Override
        public Optional<Snapshot> snapshot() {
            return Optional.empty();
        }
    }
}
