package work.lcod.automation.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.model.Step;
import work.lcod.automation.shared.Placeholders;

/**
 * One-line description of a step for the execution log, e.g. {@code find (automation_id=okButton, save_as=ok)}.
 */
final class StepSummaryFormatter implements Step.Visitor<List<String>> {
    private final Map<String, String> parameters;

    private StepSummaryFormatter(Map<String, String> parameters) {
        this.parameters = parameters;
    }

    static String summarize(Step step, Map<String, String> parameters) {
        var parts = step.accept(new StepSummaryFormatter(parameters));
        var action = step.action().wireName();
        return parts.isEmpty() ? action : action + " (" + String.join(", ", parts) + ")";
    }

    @Override
    public List<String> visitFocus(Step.Focus step) {
        return List.of();
    }

    @Override
    public List<String> visitAttach(Step.Attach step) {
        var parts = new ArrayList<String>();
        add(parts, "process", sub(step.processName()));
        if (step.pid() != null) parts.add("pid=" + step.pid());
        return parts;
    }

    @Override
    public List<String> visitSnapshot(Step.Snapshot step) {
        return step.maxDepth() == null ? List.of() : List.of("depth=" + step.maxDepth());
    }

    @Override
    public List<String> visitFind(Step.Find step) {
        var parts = criteria(step.criteria());
        add(parts, "save_as", step.saveAs());
        return parts;
    }

    @Override
    public List<String> visitFindByPath(Step.FindByPath step) {
        var parts = new ArrayList<String>();
        if (step.path() != null) parts.add("path=[" + step.path().size() + " segments]");
        add(parts, "save_as", step.saveAs());
        return parts;
    }

    @Override
    public List<String> visitClick(Step.Click step) {
        return ref(step.ref());
    }

    @Override
    public List<String> visitRightClick(Step.RightClick step) {
        return ref(step.ref());
    }

    @Override
    public List<String> visitType(Step.TypeText step) {
        var parts = new ArrayList<String>();
        add(parts, "text", sub(step.text()));
        return parts;
    }

    @Override
    public List<String> visitSetValue(Step.SetValue step) {
        var parts = ref(step.ref());
        add(parts, "value", sub(step.value()));
        return parts;
    }

    @Override
    public List<String> visitGetValue(Step.GetValue step) {
        return ref(step.ref());
    }

    @Override
    public List<String> visitSendKeys(Step.SendKeys step) {
        var parts = new ArrayList<String>();
        add(parts, "keys", sub(step.keys()));
        return parts;
    }

    @Override
    public List<String> visitWait(Step.Wait step) {
        return List.of("seconds=" + step.seconds());
    }

    @Override
    public List<String> visitWaitForEnabled(Step.WaitForEnabled step) {
        var parts = ref(step.ref());
        add(parts, "automation_id", sub(step.criteria().automationId()));
        return parts;
    }

    @Override
    public List<String> visitMacro(Step.CallMacro step) {
        var parts = new ArrayList<String>();
        add(parts, "macro", step.macroName());
        return parts;
    }

    @Override
    public List<String> visitInclude(Step.Include step) {
        var parts = new ArrayList<String>();
        add(parts, "macro", step.macroName());
        return parts;
    }

    @Override
    public List<String> visitLaunch(Step.Launch step) {
        var parts = new ArrayList<String>();
        add(parts, "exe", sub(step.exePath()));
        if (Boolean.TRUE.equals(step.ifNotRunning())) parts.add("if_not_running");
        return parts;
    }

    @Override
    public List<String> visitWaitForWindow(Step.WaitForWindow step) {
        var parts = new ArrayList<String>();
        add(parts, "title_contains", sub(step.titleContains()));
        return parts;
    }

    @Override
    public List<String> visitScreenshot(Step.Screenshot step) {
        return List.of();
    }

    @Override
    public List<String> visitProperties(Step.Properties step) {
        return ref(step.ref());
    }

    @Override
    public List<String> visitChildren(Step.Children step) {
        return ref(step.ref());
    }

    @Override
    public List<String> visitFileDialog(Step.FileDialog step) {
        var parts = new ArrayList<String>();
        add(parts, "path", sub(step.text()));
        return parts;
    }

    @Override
    public List<String> visitVerify(Step.Verify step) {
        var parts = ref(step.ref());
        add(parts, "property", step.property());
        add(parts, "expected", sub(step.expected()));
        add(parts, "match_mode", step.matchMode());
        return parts;
    }

    private List<String> criteria(ElementCriteria criteria) {
        var parts = new ArrayList<String>();
        add(parts, "automation_id", sub(criteria.automationId()));
        add(parts, "name", sub(criteria.name()));
        add(parts, "class_name", sub(criteria.className()));
        add(parts, "control_type", sub(criteria.controlType()));
        return parts;
    }

    private static List<String> ref(String ref) {
        var parts = new ArrayList<String>();
        add(parts, "ref", ref);
        return parts;
    }

    private String sub(String value) {
        return Placeholders.substitute(value, parameters);
    }

    private static void add(List<String> parts, String key, String value) {
        if (value != null) {
            parts.add(key + "=" + value);
        }
    }
}
