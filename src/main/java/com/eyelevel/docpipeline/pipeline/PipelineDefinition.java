package com.eyelevel.docpipeline.pipeline;

import com.eyelevel.docpipeline.exception.PipelineDefinitionException;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * The immutable, ordered list of stages every execution walks through, shared by all executions.
 */
public final class PipelineDefinition {

    private final List<StageSpec> stages;
    private final Duration maxBackoff;

    /**
     * @param stages     The stages in execution order. Names must be unique.
     * @param maxBackoff Upper bound applied to the exponential retry backoff of every stage.
     * @throws PipelineDefinitionException if the stage list is empty, contains duplicate names,
     *                                     or the backoff cap is negative.
     */
    public PipelineDefinition(final List<StageSpec> stages, final Duration maxBackoff) {
        if (stages == null || stages.isEmpty()) {
            throw new PipelineDefinitionException("A pipeline needs at least one stage");
        }
        if (maxBackoff == null || maxBackoff.isNegative()) {
            throw new PipelineDefinitionException("maxBackoff must be >= 0 but was " + maxBackoff);
        }
        final Set<String> names = new HashSet<>();
        for (final StageSpec stage : stages) {
            if (!names.add(stage.name())) {
                throw new PipelineDefinitionException("Duplicate stage name '" + stage.name() + "'");
            }
        }
        this.stages = List.copyOf(stages);
        this.maxBackoff = maxBackoff;
    }

    public int size() {
        return stages.size();
    }

    public List<StageSpec> stages() {
        return stages;
    }

    public StageSpec stage(final int index) {
        if (index < 0 || index >= stages.size()) {
            throw new IndexOutOfBoundsException("Stage index " + index + " outside pipeline of " + stages.size() + " stages");
        }
        return stages.get(index);
    }

    public Optional<StageSpec> stage(final String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public OptionalInt indexOf(final String name) {
        return IntStream.range(0, stages.size()).filter(i -> stages.get(i).name().equals(name)).findFirst();
    }

    /**
     * Name of the stage at {@code index}, or {@code null} when the index is past the last stage.
     */
    public String stageNameAt(final int index) {
        return index >= 0 && index < stages.size() ? stages.get(index).name() : null;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    /**
     * The wait after failed attempt number {@code attempt} (1-based) of a stage:
     * {@code backoffBase * 2^(attempt-1)}, capped at {@link #maxBackoff()}.
     */
    public Duration backoffAfter(final StageSpec stage, final int attempt) {
        if (stage.backoffBase().isZero() || attempt < 1) {
            return Duration.ZERO;
        }
        final int exponent = attempt - 1;
        if (exponent >= 62) {
            return maxBackoff;
        }
        try {
            final Duration backoff = stage.backoffBase().multipliedBy(1L << exponent);
            return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
        } catch (ArithmeticException e) {
            return maxBackoff;
        }
    }

    @Override
    public String toString() {
        return "PipelineDefinition" + stages.stream().map(StageSpec::name).toList();
    }
}
