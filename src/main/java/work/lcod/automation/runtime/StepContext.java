package work.lcod.automation.runtime;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;
import work.lcod.automation.model.StepTiming;
import work.lcod.automation.session.AutomationSession;
import work.lcod.automation.shared.DurationParser;
import work.lcod.automation.shared.Placeholders;

/**
 * State a single step runs against: the invocation's parameters and aliases, the session, the log
 * sink and the two deadlines (the macro's and the step's own).
 */
final class StepContext {
    private final MacroExecutor executor;
    private final int stepNumber;
    private final AutomationSession session;
    private final Map<String, String> parameters;
    private final AliasTable aliases;
    private final Consumer<String> sink;
    private final CancellationToken token;
    private final Deadline macroDeadline;
    private final Deadline stepDeadline;
    private final Duration stepBudget;

    StepContext(
        MacroExecutor executor,
        int stepNumber,
        AutomationSession session,
        Map<String, String> parameters,
        AliasTable aliases,
        Consumer<String> sink,
        CancellationToken token,
        Deadline macroDeadline,
        Deadline stepDeadline,
        Duration stepBudget
    ) {
        this.executor = executor;
        this.stepNumber = stepNumber;
        this.session = session;
        this.parameters = parameters;
        this.aliases = aliases;
        this.sink = sink;
        this.token = token;
        this.macroDeadline = macroDeadline;
        this.stepDeadline = stepDeadline;
        this.stepBudget = stepBudget;
    }

    MacroExecutor executor() {
        return executor;
    }

    int stepNumber() {
        return stepNumber;
    }

    AutomationSession session() {
        return session;
    }

    Map<String, String> parameters() {
        return parameters;
    }

    AliasTable aliases() {
        return aliases;
    }

    Consumer<String> sink() {
        return sink;
    }

    CancellationToken token() {
        return token;
    }

    Deadline macroDeadline() {
        return macroDeadline;
    }

    ExecutionLimits limits() {
        return executor.limits();
    }

    /** Budget of this step; for nested macro calls the remaining macro time. */
    Duration stepBudget() {
        return stepBudget != null ? stepBudget : macroDeadline.remaining();
    }

    String budgetText() {
        return DurationParser.formatSeconds(stepBudget());
    }

    String sub(String template) {
        return Placeholders.substitute(template, parameters);
    }

    /** Substituted reference, resolved through the alias table. */
    String ref(String raw) {
        return aliases.resolve(sub(raw));
    }

    Duration retryInterval(StepTiming timing) {
        return timing.retryInterval().orElse(limits().retryInterval());
    }

    /**
     * Whether the step's own deadline has passed. Expiry of the macro deadline is not a step
     * outcome and is raised instead.
     */
    boolean stepExpired() {
        if (macroDeadline.isExpired()) {
            throw new DeadlineExceededException("Macro timeout exceeded");
        }
        token.throwIfCancelled();
        return stepDeadline.isExpired();
    }

    /** Sleeps between attempts, never past the step deadline. */
    void pause(Duration interval) {
        var remaining = stepDeadline.remaining();
        sleep(interval.compareTo(remaining) < 0 ? interval : remaining);
    }

    void sleep(Duration duration) {
        try {
            if (token.await(duration)) {
                throw new ExecutionCancelledException("Execution cancelled");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted while waiting");
        }
    }
}
