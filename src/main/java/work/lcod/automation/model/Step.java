package work.lcod.automation.model;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * One action of a macro. The set of implementations is closed: each record carries only the
 * fields its action consumes, and {@link Visitor} forces every consumer to handle all of them.
 */
public interface Step {
    StepAction action();

    StepTiming timing();

    <R> R accept(Visitor<R> visitor);

    /** Copy of this step with every string field rewritten by {@code fn}. */
    Step mapStrings(UnaryOperator<String> fn);

    interface Visitor<R> {
        R visitFocus(Focus step);

        R visitAttach(Attach step);

        R visitSnapshot(Snapshot step);

        R visitFind(Find step);

        R visitFindByPath(FindByPath step);

        R visitClick(Click step);

        R visitRightClick(RightClick step);

        R visitType(TypeText step);

        R visitSetValue(SetValue step);

        R visitGetValue(GetValue step);

        R visitSendKeys(SendKeys step);

        R visitWait(Wait step);

        R visitWaitForEnabled(WaitForEnabled step);

        R visitMacro(CallMacro step);

        R visitInclude(Include step);

        R visitLaunch(Launch step);

        R visitWaitForWindow(WaitForWindow step);

        R visitScreenshot(Screenshot step);

        R visitProperties(Properties step);

        R visitChildren(Children step);

        R visitFileDialog(FileDialog step);

        R visitVerify(Verify step);
    }

    record Focus(StepTiming timing) implements Step {
        public StepAction action() { return StepAction.FOCUS; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitFocus(this); }

        public Step mapStrings(UnaryOperator<String> fn) { return this; }
    }

    record Attach(String processName, Integer pid, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.ATTACH; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitAttach(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Attach(Strings.map(processName, fn), pid, timing);
        }
    }

    record Snapshot(Integer maxDepth, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.SNAPSHOT; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitSnapshot(this); }

        public Step mapStrings(UnaryOperator<String> fn) { return this; }
    }

    record Find(ElementCriteria criteria, String saveAs, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.FIND; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitFind(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Find(criteria.map(fn), Strings.map(saveAs, fn), timing);
        }
    }

    record FindByPath(List<String> path, String saveAs, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.FIND_BY_PATH; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitFindByPath(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new FindByPath(Strings.map(path, fn), Strings.map(saveAs, fn), timing);
        }
    }

    record Click(String ref, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.CLICK; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitClick(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Click(Strings.map(ref, fn), timing);
        }
    }

    record RightClick(String ref, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.RIGHT_CLICK; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitRightClick(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new RightClick(Strings.map(ref, fn), timing);
        }
    }

    record TypeText(String text, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.TYPE; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitType(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new TypeText(Strings.map(text, fn), timing);
        }
    }

    record SetValue(String ref, String value, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.SET_VALUE; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitSetValue(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new SetValue(Strings.map(ref, fn), Strings.map(value, fn), timing);
        }
    }

    record GetValue(String ref, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.GET_VALUE; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitGetValue(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new GetValue(Strings.map(ref, fn), timing);
        }
    }

    record SendKeys(String keys, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.SEND_KEYS; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitSendKeys(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new SendKeys(Strings.map(keys, fn), timing);
        }
    }

    record Wait(double seconds, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.WAIT; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitWait(this); }

        public Step mapStrings(UnaryOperator<String> fn) { return this; }
    }

    record WaitForEnabled(ElementCriteria criteria, String ref, Boolean enabled, String saveAs, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.WAIT_FOR_ENABLED; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitWaitForEnabled(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new WaitForEnabled(criteria.map(fn), Strings.map(ref, fn), enabled, Strings.map(saveAs, fn), timing);
        }

        public boolean targetEnabled() {
            return enabled == null || enabled;
        }
    }

    record CallMacro(String macroName, Map<String, String> params, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.MACRO; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitMacro(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new CallMacro(Strings.map(macroName, fn), Strings.mapValues(params, fn), timing);
        }
    }

    record Include(String macroName, Map<String, String> params, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.INCLUDE; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitInclude(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Include(Strings.map(macroName, fn), Strings.mapValues(params, fn), timing);
        }
    }

    record Launch(String exePath, String arguments, String workingDirectory, Boolean ifNotRunning, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.LAUNCH; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitLaunch(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Launch(Strings.map(exePath, fn), Strings.map(arguments, fn), Strings.map(workingDirectory, fn), ifNotRunning, timing);
        }
    }

    record WaitForWindow(String titleContains, ElementCriteria criteria, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.WAIT_FOR_WINDOW; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitWaitForWindow(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new WaitForWindow(Strings.map(titleContains, fn), criteria.map(fn), timing);
        }
    }

    record Screenshot(StepTiming timing) implements Step {
        public StepAction action() { return StepAction.SCREENSHOT; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitScreenshot(this); }

        public Step mapStrings(UnaryOperator<String> fn) { return this; }
    }

    record Properties(String ref, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.PROPERTIES; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitProperties(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Properties(Strings.map(ref, fn), timing);
        }
    }

    record Children(String ref, String saveAs, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.CHILDREN; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitChildren(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Children(Strings.map(ref, fn), Strings.map(saveAs, fn), timing);
        }
    }

    record FileDialog(String text, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.FILE_DIALOG; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitFileDialog(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new FileDialog(Strings.map(text, fn), timing);
        }
    }

    record Verify(String ref, String property, String expected, String matchMode, String message, StepTiming timing) implements Step {
        public StepAction action() { return StepAction.VERIFY; }

        public <R> R accept(Visitor<R> visitor) { return visitor.visitVerify(this); }

        public Step mapStrings(UnaryOperator<String> fn) {
            return new Verify(
                Strings.map(ref, fn),
                Strings.map(property, fn),
                Strings.map(expected, fn),
                Strings.map(matchMode, fn),
                Strings.map(message, fn),
                timing
            );
        }
    }
}
