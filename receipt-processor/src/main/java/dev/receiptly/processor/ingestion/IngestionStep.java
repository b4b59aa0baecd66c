package dev.receiptly.processor.ingestion;

import java.util.Objects;
import java.util.Optional;

/**
 * Named pipeline step. A step may finish the pipeline early by returning a result; its
 * compensation runs when a later step fails.
 */
record IngestionStep(String name, Action action, Compensation compensation) {

    IngestionStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
    }

    static IngestionStep of(String name, Action action) {
        return new IngestionStep(name, action, null);
    }

    static IngestionStep compensated(String name, Action action, Compensation compensation) {
        return new IngestionStep(name, action, Objects.requireNonNull(compensation, "compensation"));
    }

    @FunctionalInterface
    interface Action {

        Optional<IngestionResult> run(IngestionContext context);
    }

    @FunctionalInterface
    interface Compensation {

        void compensate(IngestionContext context, String reason);
    }
}
