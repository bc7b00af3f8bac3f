package work.lcod.automation.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import work.lcod.automation.model.Step;
import work.lcod.automation.session.ElementRef;
import work.lcod.automation.session.LaunchRequest;
import work.lcod.automation.session.SessionResult;
import work.lcod.automation.session.WindowCriteria;
import work.lcod.automation.shared.DurationParser;

/**
 * Executes one step against the session. Runs on a worker thread; the executor bounds it with the
 * step deadline.
 */
final class StepInterpreter implements Step.Visitor<StepOutcome> {
    private final StepContext ctx;

    StepInterpreter(StepContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public StepOutcome visitFocus(Step.Focus step) {
        return outcome(ctx.session().focus());
    }

    @Override
    public StepOutcome visitAttach(Step.Attach step) {
        if (step.pid() != null) {
            return outcome(ctx.session().attachByPid(step.pid()));
        }
        var processName = ctx.sub(step.processName());
        return outcome(ctx.session().attach(processName == null ? "" : processName));
    }

    @Override
    public StepOutcome visitSnapshot(Step.Snapshot step) {
        var depth = step.maxDepth() != null ? step.maxDepth() : ctx.limits().snapshotDepth();
        var result = ctx.session().snapshot(depth);
        if (!result.success()) {
            return StepOutcome.failed(result.message());
        }
        return StepOutcome.ok(result.value() != null ? result.value() : result.message());
    }

    @Override
    public StepOutcome visitFind(Step.Find step) {
        var criteria = step.criteria().map(ctx::sub);
        var interval = ctx.retryInterval(step.timing());
        while (true) {
            var result = ctx.session().find(criteria);
            if (result.success() && result.value() != null) {
                return found(result, step.saveAs());
            }
            if (ctx.stepExpired()) {
                return StepOutcome.failed("Element not found after " + ctx.budgetText() + "s", "find: " + criteria.describe());
            }
            ctx.pause(interval);
        }
    }

    @Override
    public StepOutcome visitFindByPath(Step.FindByPath step) {
        var path = new ArrayList<String>();
        for (var segment : step.path() == null ? List.<String>of() : step.path()) {
            path.add(ctx.sub(segment));
        }
        var interval = ctx.retryInterval(step.timing());
        while (true) {
            var result = ctx.session().findByPath(path);
            if (result.success() && result.value() != null) {
                return found(result, step.saveAs());
            }
            if (ctx.stepExpired()) {
                return StepOutcome.failed("Element not found after " + ctx.budgetText() + "s", "find_by_path: " + String.join(" > ", path));
            }
            ctx.pause(interval);
        }
    }

    @Override
    public StepOutcome visitClick(Step.Click step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("click requires a ref");
        }
        return outcome(ctx.session().click(ref));
    }

    @Override
    public StepOutcome visitRightClick(Step.RightClick step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("right_click requires a ref");
        }
        return outcome(ctx.session().rightClick(ref));
    }

    @Override
    public StepOutcome visitType(Step.TypeText step) {
        var text = ctx.sub(step.text());
        if (text == null) {
            return StepOutcome.failed("type requires text");
        }
        return outcome(ctx.session().typeText(text));
    }

    @Override
    public StepOutcome visitSetValue(Step.SetValue step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("set_value requires a ref");
        }
        var value = ctx.sub(step.value());
        if (value == null) {
            return StepOutcome.failed("set_value requires a value");
        }
        return outcome(ctx.session().setValue(ref, value));
    }

    @Override
    public StepOutcome visitGetValue(Step.GetValue step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("get_value requires a ref");
        }
        return outcome(ctx.session().getValue(ref));
    }

    @Override
    public StepOutcome visitSendKeys(Step.SendKeys step) {
        var keys = ctx.sub(step.keys());
        if (keys == null) {
            return StepOutcome.failed("send_keys requires keys");
        }
        return outcome(ctx.session().sendKeys(keys));
    }

    @Override
    public StepOutcome visitWait(Step.Wait step) {
        ctx.sleep(DurationParser.ofSeconds(step.seconds()));
        return StepOutcome.ok("Waited " + step.seconds() + "s");
    }

    @Override
    public StepOutcome visitWaitForEnabled(Step.WaitForEnabled step) {
        var target = step.targetEnabled();
        var interval = ctx.retryInterval(step.timing());
        var ref = ctx.ref(step.ref());
        if (ref != null) {
            while (true) {
                var result = ctx.session().isEnabled(ref);
                if (!result.success()) {
                    return StepOutcome.failed(result.message());
                }
                boolean enabled = Boolean.TRUE.equals(result.value());
                if (enabled == target) {
                    return StepOutcome.ok("Element [" + ref + "] IsEnabled=" + enabled + " (target=" + target + ")");
                }
                if (ctx.stepExpired()) {
                    return StepOutcome.failed(
                        "Element [" + ref + "] IsEnabled=" + enabled + " after " + ctx.budgetText() + "s (target=" + target + ")",
                        "wait_for_enabled: ref=" + ref + ", target=" + target);
                }
                ctx.pause(interval);
            }
        }

        var criteria = step.criteria().map(ctx::sub);
        while (true) {
            var found = ctx.session().find(criteria);
            if (found.success() && found.value() != null) {
                var refKey = found.value().refKey();
                var enabled = ctx.session().isEnabled(refKey);
                if (enabled.success() && Boolean.TRUE.equals(enabled.value()) == target) {
                    ctx.aliases().put(step.saveAs(), refKey);
                    return StepOutcome.ok("Element [" + refKey + "] IsEnabled=" + target + " (target=" + target + ")");
                }
            }
            if (ctx.stepExpired()) {
                return StepOutcome.failed(
                    "Element not enabled=" + target + " after " + ctx.budgetText() + "s",
                    "wait_for_enabled: " + criteria.describe() + ", target=" + target);
            }
            ctx.pause(interval);
        }
    }

    @Override
    public StepOutcome visitMacro(Step.CallMacro step) {
        var result = ctx.executor().runNested(step, ctx);
        return new StepOutcome(result.success(), result.message(), result.success() ? null : result.error());
    }

    @Override
    public StepOutcome visitInclude(Step.Include step) {
        return StepOutcome.failed("include step was not expanded at load time (macro_name=" + step.macroName()
            + "). Include steps only work in macros loaded from the macros directory.");
    }

    @Override
    public StepOutcome visitLaunch(Step.Launch step) {
        var exePath = ctx.sub(step.exePath());
        if (exePath == null || exePath.isEmpty()) {
            return StepOutcome.failed("launch requires exe_path");
        }
        var request = new LaunchRequest(
            exePath,
            ctx.sub(step.arguments()),
            ctx.sub(step.workingDirectory()),
            step.ifNotRunning() == null || step.ifNotRunning(),
            ctx.stepBudget()
        );
        return outcome(ctx.session().launch(request));
    }

    @Override
    public StepOutcome visitWaitForWindow(Step.WaitForWindow step) {
        var criteria = new WindowCriteria(ctx.sub(step.titleContains()), step.criteria().map(ctx::sub));
        var poll = step.timing().retryInterval().orElse(ctx.limits().windowPoll());
        return outcome(ctx.session().waitForWindow(criteria, ctx.stepBudget(), poll));
    }

    @Override
    public StepOutcome visitScreenshot(Step.Screenshot step) {
        var result = ctx.session().screenshot();
        return result.success() ? StepOutcome.ok(result.message()) : StepOutcome.failed(result.message());
    }

    @Override
    public StepOutcome visitProperties(Step.Properties step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("properties requires a ref");
        }
        var result = ctx.session().properties(ref);
        if (!result.success()) {
            return StepOutcome.failed(result.message());
        }
        var properties = result.value() == null ? Map.<String, String>of() : result.value();
        return StepOutcome.ok("Properties: " + properties.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ")));
    }

    @Override
    public StepOutcome visitChildren(Step.Children step) {
        var result = ctx.session().children(ctx.ref(step.ref()));
        if (!result.success()) {
            return StepOutcome.failed(result.message());
        }
        var children = result.value() == null ? List.<ElementRef>of() : result.value();
        if (!children.isEmpty()) {
            ctx.aliases().put(step.saveAs(), children.get(0).refKey());
        }
        return StepOutcome.ok("Found " + children.size() + " children");
    }

    @Override
    public StepOutcome visitFileDialog(Step.FileDialog step) {
        var filePath = ctx.sub(step.text());
        if (filePath == null || filePath.isEmpty()) {
            return StepOutcome.failed("file_dialog requires text (the file path)");
        }
        return outcome(ctx.session().fileDialog(filePath));
    }

    @Override
    public StepOutcome visitVerify(Step.Verify step) {
        var ref = ctx.ref(step.ref());
        if (ref == null) {
            return StepOutcome.failed("verify requires a ref");
        }
        var property = ctx.sub(step.property());
        if (property == null || property.isEmpty()) {
            return StepOutcome.failed("verify requires a property");
        }
        var expected = ctx.sub(step.expected());
        if (expected == null) {
            return StepOutcome.failed("verify requires an expected value");
        }
        var modeName = ctx.sub(step.matchMode());
        var mode = MatchMode.fromName(modeName).orElse(null);
        if (mode == null) {
            return StepOutcome.failed("Unknown match_mode '" + modeName + "'. Valid: " + MatchMode.validNames());
        }
        var read = ctx.session().readProperty(ref, property);
        if (!read.success()) {
            return StepOutcome.failed(read.message());
        }
        var actual = read.value() == null ? "" : read.value();
        boolean matched;
        try {
            matched = mode.matches(actual, expected);
        } catch (PatternSyntaxException ex) {
            return StepOutcome.failed("Invalid regex '" + expected + "': " + ex.getDescription());
        }
        if (matched) {
            return StepOutcome.ok("Verify passed (" + mode.wireName() + "): " + property + " = \"" + actual + "\"");
        }
        if (step.message() != null) {
            return StepOutcome.failed(ctx.sub(step.message()));
        }
        return StepOutcome.failed("Verify failed (" + mode.wireName() + "): expected " + property + " "
            + mode.description() + " \"" + expected + "\" but got \"" + actual + "\"");
    }

    private StepOutcome found(SessionResult<ElementRef> result, String saveAs) {
        var refKey = result.value().refKey();
        ctx.aliases().put(saveAs, refKey);
        return StepOutcome.ok("Found [" + refKey + "]: " + result.message());
    }

    private static StepOutcome outcome(SessionResult<?> result) {
        return result.success() ? StepOutcome.ok(result.message()) : StepOutcome.failed(result.message());
    }

    static Map<String, String> nestedParameters(Map<String, String> declared, StepContext ctx) {
        var nested = new LinkedHashMap<String, String>();
        if (declared != null) {
            declared.forEach((key, value) -> nested.put(key, value == null ? null : ctx.sub(value)));
        }
        return nested;
    }
}
