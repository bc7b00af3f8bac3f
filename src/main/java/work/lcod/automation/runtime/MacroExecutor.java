package work.lcod.automation.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.loader.MacroCatalog;
import work.lcod.automation.loader.MacroDocumentParser;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.MacroResult;
import work.lcod.automation.model.MacroValidationException;
import work.lcod.automation.model.Step;
import work.lcod.automation.model.StepAction;
import work.lcod.automation.session.AutomationSession;
import work.lcod.automation.shared.DurationParser;

/**
 * Runs macros step by step against an {@link AutomationSession}.
 *
 * <p>Each step runs on a worker thread and is bounded by its own deadline and by the macro's.
 * Every outcome, including timeouts, cancellation and unexpected exceptions, is reported as a
 * {@link MacroResult}; nothing is thrown to the caller. Per-step progress goes to the caller's
 * log sink as {@code [Macro] Step i/N: ...} lines.
 *
 * <p>A step that outlives its deadline is interrupted and the executor waits for it to return
 * before reporting the timeout, so at most one step of an invocation is ever inside the session.
 */
public final class MacroExecutor {
    private static final Logger log = LogManager.getLogger(MacroExecutor.class);

    /** Extra time granted to a step task past its deadline so it can report its own failure. */
    static final Duration GRACE = Duration.ofMillis(200);

    private static final String TAG = "[Macro] ";
    private static final Consumer<String> NO_LOG = line -> {};

    private final MacroCatalog catalog;
    private final ExecutionLimits limits;
    private final ExecutorService workers;

    public MacroExecutor(MacroCatalog catalog) {
        this(catalog, ExecutionLimits.DEFAULTS, WorkerPools.shared());
    }

    public MacroExecutor(MacroCatalog catalog, ExecutionLimits limits) {
        this(catalog, limits, WorkerPools.shared());
    }

    public MacroExecutor(MacroCatalog catalog, ExecutionLimits limits, ExecutorService workers) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    public ExecutionLimits limits() {
        return limits;
    }

    public MacroResult execute(String name, Map<String, String> parameters, AutomationSession session) {
        return execute(name, parameters, session, NO_LOG, new CancellationToken());
    }

    public MacroResult execute(
        String name,
        Map<String, String> parameters,
        AutomationSession session,
        Consumer<String> sink,
        CancellationToken cancellation
    ) {
        var definition = catalog.find(name);
        if (definition.isEmpty()) {
            return MacroResult.rejected(0, "Macro '" + name + "' not found");
        }
        return executeDefinition(definition.get(), name, parameters, session, sink, cancellation);
    }

    /** Runs a definition that is not (necessarily) part of the catalog, e.g. one received inline. */
    public MacroResult executeDefinition(
        MacroDefinition definition,
        String displayName,
        Map<String, String> parameters,
        AutomationSession session,
        Consumer<String> sink,
        CancellationToken cancellation
    ) {
        var budget = definition.timeout().orElse(limits.macroTimeout());
        return run(new Invocation(
            definition,
            displayName,
            parameters,
            Objects.requireNonNull(session, "session"),
            sink == null ? NO_LOG : sink,
            cancellation == null ? new CancellationToken() : cancellation,
            Deadline.never(),
            budget
        ));
    }

    /** Parses a macro document and runs it without registering it. */
    public MacroResult executeYaml(
        String yaml,
        Map<String, String> parameters,
        AutomationSession session,
        Consumer<String> sink,
        CancellationToken cancellation
    ) {
        MacroDefinition definition;
        try {
            var parsed = MacroDocumentParser.parse(yaml);
            if (parsed.isEmpty()) {
                return MacroResult.rejected(0, "Document is empty");
            }
            definition = parsed.get();
        } catch (IOException ex) {
            return MacroResult.rejected(0, "Invalid YAML: " + ex.getMessage());
        } catch (MacroValidationException ex) {
            return MacroResult.rejected(0, "Invalid macro: " + ex.getMessage());
        }
        if (definition.steps().isEmpty()) {
            return MacroResult.rejected(0, "Macro has no steps defined");
        }
        var name = definition.name().isEmpty() ? "inline" : definition.name();
        return executeDefinition(definition, name, parameters, session, sink, cancellation);
    }

    MacroResult runNested(Step.CallMacro step, StepContext parent) {
        var name = parent.sub(step.macroName());
        if (name == null || name.isEmpty()) {
            return MacroResult.rejected(0, "macro action requires macro_name");
        }
        var target = catalog.find(name);
        if (target.isEmpty()) {
            return MacroResult.rejected(0, "Macro '" + name + "' not found");
        }
        var budget = step.timing().timeout()
            .or(() -> target.get().timeout())
            .orElse(limits.macroTimeout());
        var prefix = TAG + "Step " + parent.stepNumber() + " > ";
        Consumer<String> parentSink = parent.sink();
        Consumer<String> nestedSink = line -> parentSink.accept(line.startsWith(TAG) ? prefix + line.substring(TAG.length()) : line);
        return run(new Invocation(
            target.get(),
            name,
            StepInterpreter.nestedParameters(step.params(), parent),
            parent.session(),
            nestedSink,
            parent.token(),
            parent.macroDeadline(),
            budget
        ));
    }

    private MacroResult run(Invocation invocation) {
        var definition = invocation.definition();
        var name = invocation.displayName();
        var steps = definition.steps();
        var total = steps.size();

        var parameters = invocation.parameters() == null
            ? new LinkedHashMap<String, String>()
            : new LinkedHashMap<>(invocation.parameters());
        var missing = new ArrayList<String>();
        for (var spec : definition.parameters()) {
            if (spec.mustBeSupplied() && !parameters.containsKey(spec.name())) {
                missing.add(spec.name());
            }
        }
        if (!missing.isEmpty()) {
            return MacroResult.rejected(total, "Missing required parameters: " + String.join(", ", missing));
        }
        for (var spec : definition.parameters()) {
            if (!parameters.containsKey(spec.name()) && spec.defaultValue() != null) {
                parameters.put(spec.name(), spec.defaultValue());
            }
        }

        var macroDeadline = Deadline.after(invocation.budget()).earliest(invocation.bound());
        var budgetText = DurationParser.formatSeconds(invocation.budget());
        var sink = invocation.sink();
        var session = invocation.session();
        var aliases = new AliasTable();
        var macroToken = invocation.cancellation().child();
        log.debug("Running macro '{}' ({} steps, timeout {}s)", name, total, budgetText);

        try {
            for (int i = 0; i < total; i++) {
                var step = steps.get(i);
                int number = i + 1;
                var action = step.action();
                var where = " at step " + number + " (" + action + ")";

                if (macroToken.isCancelled()) {
                    return MacroResult.failedAt(number, total, action, "Macro '" + name + "' cancelled" + where, "Cancelled");
                }
                if (macroDeadline.isExpired()) {
                    return macroTimeout(name, budgetText, where, number, total, action);
                }
                if (!action.attachmentIndependent()) {
                    boolean attached;
                    try {
                        attached = session.isAttached();
                    } catch (RuntimeException ex) {
                        var message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                        log.warn("Attachment check before step {} of macro '{}' failed", number, name, ex);
                        return MacroResult.failedAt(number, total, action, "Step " + number + " (" + action + ") failed: " + message, message);
                    }
                    if (!attached) {
                        return MacroResult.failedAt(number, total, action,
                            "Target process exited during execution" + where, "Process is no longer attached");
                    }
                }

                var prefix = TAG + "Step " + number + "/" + total + ": ";
                sink.accept(prefix + StepSummaryFormatter.summarize(step, parameters));

                var stepBudget = stepBudget(step);
                var stepDeadline = stepBudget == null ? macroDeadline : Deadline.after(stepBudget).earliest(macroDeadline);
                var stepToken = macroToken.child();
                var context = new StepContext(this, number, session, parameters, aliases, sink, stepToken,
                    macroDeadline, stepDeadline, stepBudget);
                var task = new StepTask(() -> step.accept(new StepInterpreter(context)));
                Future<StepOutcome> future = workers.submit(task);
                StepOutcome outcome;
                try {
                    outcome = await(future, stepDeadline);
                } catch (TimeoutException ex) {
                    stepToken.cancel();
                    abandon(task, future, name, number, action);
                    sink.accept(prefix + "TIMEOUT");
                    if (macroDeadline.isExpired()) {
                        return macroTimeout(name, budgetText, where, number, total, action);
                    }
                    return MacroResult.failedAt(number, total, action, "Macro '" + name + "' timed out" + where, "Timeout");
                } catch (ExecutionException ex) {
                    var cause = ex.getCause() == null ? ex : ex.getCause();
                    if (cause instanceof DeadlineExceededException) {
                        sink.accept(prefix + "TIMEOUT");
                        return macroTimeout(name, budgetText, where, number, total, action);
                    }
                    if (cause instanceof ExecutionCancelledException) {
                        sink.accept(prefix + "CANCELLED");
                        return MacroResult.failedAt(number, total, action, "Macro '" + name + "' cancelled" + where, "Cancelled");
                    }
                    var message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                    log.warn("Step {} ({}) of macro '{}' raised an exception", number, action, name, cause);
                    sink.accept(prefix + "ERROR — " + message);
                    return MacroResult.failedAt(number, total, action, "Step " + number + " (" + action + ") failed: " + message, message);
                } catch (InterruptedException ex) {
                    stepToken.cancel();
                    abandon(task, future, name, number, action);
                    Thread.currentThread().interrupt();
                    return MacroResult.failedAt(number, total, action, "Macro '" + name + "' cancelled" + where, "Interrupted");
                } finally {
                    stepToken.release();
                }

                if (!outcome.success()) {
                    sink.accept(prefix + "FAILED — " + outcome.failureText());
                    return MacroResult.failedAt(number, total, action, outcome.message(), outcome.failureText());
                }
                sink.accept(prefix + "OK — " + outcome.message());
            }
        } finally {
            macroToken.release();
        }

        var message = "Macro '" + name + "' completed (" + total + " steps)";
        sink.accept(TAG + "'" + name + "' completed (" + total + " steps)");
        log.debug(message);
        return MacroResult.completed(total, message);
    }

    /** Per-step budget; null for nested macro calls, which are bounded by their own timeout. */
    private Duration stepBudget(Step step) {
        if (step.action() == StepAction.MACRO) {
            return null;
        }
        var override = step.timing().timeout();
        if (override.isPresent()) {
            return override.get();
        }
        return switch (step.action()) {
            case LAUNCH, WAIT_FOR_WINDOW -> limits.launchTimeout();
            default -> limits.stepTimeout();
        };
    }

    private static void abandon(StepTask task, Future<StepOutcome> future, String name, int number, StepAction action) {
        var overrun = task.settle(future);
        if (overrun.compareTo(GRACE) > 0) {
            log.warn("Step {} ({}) of macro '{}' kept the session busy {}s after it was interrupted",
                number, action, name, DurationParser.formatSeconds(overrun));
        }
    }

    private static StepOutcome await(Future<StepOutcome> future, Deadline deadline)
        throws InterruptedException, ExecutionException, TimeoutException {
        if (!deadline.isBounded()) {
            return future.get();
        }
        return future.get(deadline.remaining().plus(GRACE).toNanos(), TimeUnit.NANOSECONDS);
    }

    private static MacroResult macroTimeout(String name, String budgetText, String where, int number, int total, StepAction action) {
        return MacroResult.failedAt(number, total, action,
            "Macro '" + name + "' timed out after " + budgetText + "s" + where, "Macro timeout exceeded");
    }

    private record Invocation(
        MacroDefinition definition,
        String displayName,
        Map<String, String> parameters,
        AutomationSession session,
        Consumer<String> sink,
        CancellationToken cancellation,
        Deadline bound,
        Duration budget
    ) {}
}
