package com.vidnyan.dokita.domain.check;

import com.vidnyan.dokita.domain.finding.Finding;

import java.util.List;
import java.util.function.Function;

/**
 * Outcome of a call into a collaborator that may degrade.
 * The failure side always carries a {@link Finding}, so nothing but findings ever
 * crosses back into the pipeline.
 */
public sealed interface CheckResult<T> {

    static <T> CheckResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CheckResult<T> degraded(Finding finding) {
        return new Degraded<>(finding);
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * Collapse into findings: the mapper's findings on success, the degradation finding otherwise.
     */
    default List<Finding> toFindings(Function<T, List<Finding>> onSuccess) {
        if (this instanceof Success<T> success) {
            return onSuccess.apply(success.value());
        }
        return List.of(((Degraded<T>) this).finding());
    }

    record Success<T>(T value) implements CheckResult<T> {
    }

    record Degraded<T>(Finding finding) implements CheckResult<T> {
    }
}
