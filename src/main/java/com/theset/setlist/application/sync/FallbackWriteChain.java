package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.WriteOutcome;
import com.theset.setlist.domain.port.out.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered list of write strategies. Each step runs only if its guard accepts the
 * outcome of the previous step; the first WRITTEN outcome wins. When no step
 * writes, the prepared in-memory record is returned.
 */
public class FallbackWriteChain<T> {

    private static final Logger logger = LoggerFactory.getLogger(FallbackWriteChain.class);

    private final String label;
    private final List<Step<T>> steps;

    private FallbackWriteChain(String label, List<Step<T>> steps) {
        this.label = label;
        this.steps = List.copyOf(steps);
    }

    /**
     * Upsert first; a single insert-only attempt only when the upsert was denied.
     */
    public static <T> FallbackWriteChain<T> upsertThenInsertOnly(String label, EntityStore<T> store) {
        return FallbackWriteChain.<T>builder(label)
                .first("upsert", store::upsert)
                .then("insert-only", WriteOutcome::isPermissionDenied, store::insert)
                .build();
    }

    public static <T> Builder<T> builder(String label) {
        return new Builder<>(label);
    }

    public WriteResult<T> write(T prepared) {
        WriteOutcome<T> previous = null;
        for (Step<T> step : steps) {
            if (previous != null && !step.guard().test(previous)) {
                break;
            }
            WriteOutcome<T> outcome = attempt(step, prepared);
            if (outcome.isWritten()) {
                T row = outcome.row() != null ? outcome.row() : prepared;
                logger.debug("{} written by {}", label, step.name());
                return new WriteResult<>(row, step.name());
            }
            logger.warn("{} {} failed: {}", label, step.name(), outcome.describeFailure());
            previous = outcome;
        }
        logger.error("All writes failed for {}, serving in-memory record", label);
        return new WriteResult<>(prepared, null);
    }

    private WriteOutcome<T> attempt(Step<T> step, T prepared) {
        try {
            WriteOutcome<T> outcome = step.strategy().write(prepared);
            return outcome != null ? outcome : WriteOutcome.failed(null);
        } catch (RuntimeException e) {
            return WriteOutcome.failed(e);
        }
    }

    private record Step<T>(String name, Predicate<WriteOutcome<T>> guard, WriteStrategy<T> strategy) {}

    /**
     * @param writtenBy name of the step that persisted the record, null when served from memory
     */
    public record WriteResult<T>(T record, String writtenBy) {

        public boolean persisted() {
            return writtenBy != null;
        }

        public boolean writtenBy(String stepName) {
            return stepName.equals(writtenBy);
        }
    }

    public static final class Builder<T> {

        private final String label;
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder(String label) {
            this.label = label;
        }

        public Builder<T> first(String name, WriteStrategy<T> strategy) {
            steps.add(new Step<>(name, outcome -> true, strategy));
            return this;
        }

        public Builder<T> then(String name, Predicate<WriteOutcome<T>> guard, WriteStrategy<T> strategy) {
            steps.add(new Step<>(name, guard, strategy));
            return this;
        }

        public FallbackWriteChain<T> build() {
            return new FallbackWriteChain<>(label, steps);
        }
    }
}
