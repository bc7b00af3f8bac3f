package work.lcod.automation.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable macro loaded from a document: metadata, declared parameters and the ordered steps.
 */
public record MacroDefinition(
    String name,
    String description,
    int timeoutSeconds,
    List<ParameterSpec> parameters,
    List<Step> steps
) {
    public MacroDefinition {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    }

    /** Declared timeout, empty when the document leaves it at 0. */
    public Optional<Duration> timeout() {
        return timeoutSeconds > 0 ? Optional.of(Duration.ofSeconds(timeoutSeconds)) : Optional.empty();
    }

    public boolean hasIncludes() {
        return steps.stream().anyMatch(step -> step.action() == StepAction.INCLUDE);
    }

    public MacroDefinition withSteps(List<Step> newSteps) {
        return new MacroDefinition(name, description, timeoutSeconds, parameters, newSteps);
    }
}
