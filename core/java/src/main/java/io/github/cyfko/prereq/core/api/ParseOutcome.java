package io.github.cyfko.prereq.core.api;

import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PrerequisiteCompiler#tryParse(String)}: either the compiled value or the failure
 * that prevented it.
 *
 * <pre>{@code
 * ParseOutcome outcome = compiler.tryParse(rawText);
 * if (outcome instanceof ParseOutcome.Parsed parsed) {
 *     store(parsed.value());
 * } else {
 *     markUnknown(((ParseOutcome.Failed) outcome).error().getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Failed {

    boolean ok();

    /**
     * @return the compiled prerequisites, empty on failure
     */
    Optional<Prerequisites> value();

    /**
     * @return the failure, empty on success
     */
    Optional<PrerequisiteException> error();

    static ParseOutcome parsed(Prerequisites value) {
        return new Parsed(value);
    }

    static ParseOutcome failed(PrerequisiteException error) {
        return new Failed(error);
    }

    record Parsed(Prerequisites prerequisites) implements ParseOutcome {
        public Parsed {
            Objects.requireNonNull(prerequisites, "prerequisites are required");
        }

        @Override
        public boolean ok() {
            return true;
        }

        @Override
        public Optional<Prerequisites> value() {
            return Optional.of(prerequisites);
        }

        @Override
        public Optional<PrerequisiteException> error() {
            return Optional.empty();
        }
    }

    record Failed(PrerequisiteException exception) implements ParseOutcome {
        public Failed {
            Objects.requireNonNull(exception, "exception is required");
        }

        @Override
        public boolean ok() {
            return false;
        }

        @Override
        public Optional<Prerequisites> value() {
            return Optional.empty();
        }

        @Override
        public Optional<PrerequisiteException> error() {
            return Optional.of(exception);
        }
    }
}
