package work.lcod.automation.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import work.lcod.automation.loader.MacroDocumentParser;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.MacroResult;
import work.lcod.automation.session.CachedSession;
import work.lcod.automation.support.FakeDriver;

class MacroExecutorTest {
    private static final ExecutionLimits FAST = new ExecutionLimits(
        Duration.ofSeconds(10),
        Duration.ofMillis(300),
        Duration.ofMillis(20),
        Duration.ofSeconds(1),
        Duration.ofMillis(20),
        3
    );

    private static final String FIND_TITLE = "  - action: find\n    automation_id: title\n    save_as: title\n";

    private final Map<String, MacroDefinition> macros = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final MacroExecutor executor = new MacroExecutor(name -> Optional.ofNullable(macros.get(name)), FAST);
    private final FakeDriver driver = new FakeDriver().element("okButton").element("title", "Value", "Untitled - Notepad");
    private final CachedSession<String> session = new CachedSession<>(driver);
    private final List<String> log = new CopyOnWriteArrayList<>();

    @Test
    void runsStepsInOrderAndResolvesAliases() throws IOException {
        define("confirm", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n  - action: click\n    ref: ok\n");

        var result = run("confirm", Map.of());

        assertTrue(result.success(), result.message());
        assertEquals("Macro 'confirm' completed (2 steps)", result.message());
        assertEquals(2, result.stepsExecuted());
        assertNull(result.failedStepIndex());
        assertEquals("[Macro] Step 1/2: find (automation_id=okButton, save_as=ok)", log.get(0));
        assertTrue(log.get(1).startsWith("[Macro] Step 1/2: OK — Found [e1]"), log.get(1));
        assertEquals("[Macro] Step 2/2: click (ref=ok)", log.get(2));
        assertEquals("[Macro] 'confirm' completed (2 steps)", log.get(log.size() - 1));
        assertTrue(driver.calls().contains("click okButton"));
    }

    @Test
    void unknownMacroIsRejected() {
        var result = run("nope", Map.of());
        assertFalse(result.success());
        assertEquals("Macro 'nope' not found", result.message());
        assertEquals(0, result.stepsExecuted());
    }

    @Test
    void missingRequiredParametersAreRejectedBeforeAnyStep() throws IOException {
        define("login", "parameters:\n  - name: user\n    required: true\n  - name: host\n    required: true\n    default: local\n"
            + "steps:\n  - action: type\n    text: '{{user}}@{{host}}'\n");

        var rejected = run("login", Map.of());
        assertEquals("Missing required parameters: user", rejected.message());
        assertTrue(driver.calls().isEmpty());

        var accepted = run("login", Map.of("user", "ada"));
        assertTrue(accepted.success(), accepted.message());
        assertTrue(driver.calls().contains("type ada@local"));
    }

    @Test
    void requiredParameterWithDefaultIsFilledEverywhere() throws IOException {
        define("tune", "parameters:\n  - name: mode\n    required: true\n    default: fast\n"
            + "steps:\n  - action: type\n    text: 'mode={{mode}}'\n  - action: send_keys\n    keys: '{{mode}}{{mode}}'\n");

        var result = run("tune", Map.of());

        assertTrue(result.success(), result.message());
        assertTrue(driver.calls().contains("type mode=fast"));
        assertTrue(driver.calls().contains("sendKeys fastfast"));
    }

    @Test
    void stopsAtFirstFailingStep() throws IOException {
        define("broken", "steps:\n  - action: focus\n  - action: click\n    ref: ghost\n  - action: screenshot\n");

        var result = run("broken", Map.of());

        assertFalse(result.success());
        assertEquals(1, result.stepsExecuted());
        assertEquals(3, result.totalSteps());
        assertEquals(2, result.failedStepIndex());
        assertEquals("click", result.failedAction());
        assertEquals("Unknown ref 'ghost'", result.message());
        assertFalse(driver.calls().contains("screenshot"));
        assertEquals("[Macro] Step 2/3: FAILED — Unknown ref 'ghost'", log.get(log.size() - 1));
    }

    @Test
    void failsWhenTargetIsNotAttached() throws IOException {
        define("detached", "steps:\n  - action: wait\n    seconds: 0.01\n  - action: click\n    ref: okButton\n");
        driver.attached(false);

        var result = run("detached", Map.of());

        assertEquals("Target process exited during execution at step 2 (click)", result.message());
        assertEquals("Process is no longer attached", result.error());
        assertEquals(1, result.stepsExecuted());
    }

    @Test
    void findRetriesUntilElementAppears() throws IOException {
        define("retry", "steps:\n  - action: find\n    automation_id: okButton\n");
        driver.missFirst("okButton", 3);

        var result = run("retry", Map.of());

        assertTrue(result.success(), result.message());
        assertEquals(4, driver.calls().stream().filter(call -> call.startsWith("find ")).count());
    }

    @Test
    void findGivesUpAfterStepTimeout() throws IOException {
        define("missing", "steps:\n  - action: find\n    automation_id: cancelButton\n");

        var result = run("missing", Map.of());

        assertFalse(result.success());
        assertEquals("Element not found after 0.3s", result.message());
        assertEquals("find: automation_id=cancelButton", result.error());
    }

    @Test
    void verifyHonoursMatchModes() throws IOException {
        define("check", "steps:\n" + FIND_TITLE
            + "  - action: verify\n    ref: title\n    property: Value\n    expected: notepad\n    match_mode: contains\n"
            + "  - action: verify\n    ref: title\n    property: Value\n    expected: '^untitled'\n    match_mode: regex\n"
            + "  - action: verify\n    ref: title\n    property: Value\n    expected: Saved\n");

        var result = run("check", Map.of());

        assertFalse(result.success());
        assertEquals(4, result.failedStepIndex());
        assertEquals("Verify failed (equals): expected Value = \"Saved\" but got \"Untitled - Notepad\"", result.message());
    }

    @Test
    void verifyUsesCustomMessageAndRejectsUnknownMode() throws IOException {
        define("custom", "steps:\n" + FIND_TITLE + "  - action: verify\n    ref: title\n    property: Value\n    expected: x\n    message: 'Title is {{title}}'\n");
        define("mode", "steps:\n" + FIND_TITLE + "  - action: verify\n    ref: title\n    property: Value\n    expected: x\n    match_mode: fuzzy\n");

        assertEquals("Title is wrong", run("custom", Map.of("title", "wrong")).message());
        assertEquals("Unknown match_mode 'fuzzy'. Valid: equals, contains, not_equals, regex, starts_with",
            run("mode", Map.of()).message());
    }

    @Test
    void nestedMacroLinesArePrefixedWithParentStep() throws IOException {
        define("inner", "steps:\n  - action: type\n    text: '{{word}}'\n");
        define("outer", "steps:\n  - action: focus\n  - action: macro\n    macro_name: inner\n    params:\n      word: '{{greeting}}!'\n");

        var result = run("outer", Map.of("greeting", "hi"));

        assertTrue(result.success(), result.message());
        assertTrue(log.contains("[Macro] Step 2 > Step 1/1: type (text=hi!)"), log.toString());
        assertTrue(log.contains("[Macro] Step 2 > 'inner' completed (1 steps)"), log.toString());
        assertTrue(driver.calls().contains("type hi!"));
    }

    @Test
    void nestedFailureFailsTheParentStep() throws IOException {
        define("inner", "steps:\n  - action: click\n    ref: ghost\n");
        define("outer", "steps:\n  - action: macro\n    macro_name: inner\n  - action: focus\n");

        var result = run("outer", Map.of());

        assertEquals(1, result.failedStepIndex());
        assertEquals("macro", result.failedAction());
        assertEquals("Unknown ref 'ghost'", result.message());
    }

    @Test
    void waitIsBoundedByTheStepTimeout() throws IOException {
        define("nap", "steps:\n  - action: wait\n    seconds: 5\n");

        var started = System.nanoTime();
        var result = run("nap", Map.of());
        var elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertEquals("Macro 'nap' timed out at step 1 (wait)", result.message());
        assertEquals("Timeout", result.error());
        assertTrue(elapsed.compareTo(Duration.ofSeconds(2)) < 0, elapsed.toString());
    }

    @Test
    void timedOutStepLeavesTheSessionBeforeTheNextCall() throws IOException {
        define("press", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n  - action: click\n    ref: ok\n");
        define("after", "steps:\n  - action: focus\n");
        driver.stubbornClick(Duration.ofSeconds(1));

        var first = run("press", Map.of());

        assertEquals("Macro 'press' timed out at step 2 (click)", first.message());
        assertEquals("Timeout", first.error());
        assertEquals(0, driver.callsInProgress());

        var second = run("after", Map.of());

        assertTrue(second.success(), second.message());
        assertEquals(1, driver.maxConcurrentCalls());
    }

    @Test
    void waitForEnabledChecksReferencedElement() throws IOException {
        define("ready", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n"
            + "  - action: wait_for_enabled\n    ref: ok\n");
        define("idle", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n"
            + "  - action: wait_for_enabled\n    ref: ok\n    enabled: false\n");

        var ready = run("ready", Map.of());
        assertTrue(ready.success(), ready.message());
        assertTrue(log.contains("[Macro] Step 2/2: OK — Element [e1] IsEnabled=true (target=true)"), log.toString());

        driver.property("okButton", "IsEnabled", "False");
        var idle = run("idle", Map.of());
        assertTrue(idle.success(), idle.message());
    }

    @Test
    void waitForEnabledRetriesUntilStateMatches() throws IOException, InterruptedException {
        define("ready", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n"
            + "  - action: wait_for_enabled\n    ref: ok\n    timeout: 3\n");
        driver.property("okButton", "IsEnabled", "False");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> driver.property("okButton", "IsEnabled", "True"), 150, TimeUnit.MILLISECONDS);

            var result = run("ready", Map.of());

            assertTrue(result.success(), result.message());
        } finally {
            scheduler.shutdownNow();
            scheduler.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void waitForEnabledReportsStateAfterTimeout() throws IOException {
        define("stuck", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: ok\n"
            + "  - action: wait_for_enabled\n    ref: ok\n");
        driver.property("okButton", "IsEnabled", "False");

        var result = run("stuck", Map.of());

        assertFalse(result.success());
        assertEquals(2, result.failedStepIndex());
        assertEquals("Element [e1] IsEnabled=false after 0.3s (target=true)", result.message());
        assertEquals("wait_for_enabled: ref=e1, target=true", result.error());
    }

    @Test
    void waitForEnabledByCriteriaSavesTheElement() throws IOException {
        define("byId", "steps:\n  - action: wait_for_enabled\n    automation_id: okButton\n    save_as: ok\n"
            + "  - action: click\n    ref: ok\n");
        define("ghost", "steps:\n  - action: wait_for_enabled\n    automation_id: ghost\n");

        var found = run("byId", Map.of());
        assertTrue(found.success(), found.message());
        assertTrue(driver.calls().contains("click okButton"), driver.calls().toString());

        var missing = run("ghost", Map.of());
        assertEquals("Element not enabled=true after 0.3s", missing.message());
        assertEquals("wait_for_enabled: automation_id=ghost, target=true", missing.error());
    }

    @Test
    void findByPathRetriesAndSavesAlias() throws IOException {
        define("path", "steps:\n  - action: find_by_path\n    path: [Window, okButton]\n    save_as: ok\n"
            + "  - action: click\n    ref: ok\n");
        driver.missFirst("okButton", 2);

        var result = run("path", Map.of());

        assertTrue(result.success(), result.message());
        assertEquals(3, driver.calls().stream().filter(call -> call.startsWith("findByPath ")).count());
        assertTrue(driver.calls().contains("findByPath Window/okButton"));
        assertTrue(driver.calls().contains("click okButton"));
    }

    @Test
    void childrenSavesTheFirstChild() throws IOException {
        driver.element("rowB", "Parent", "okButton").element("rowA", "Parent", "okButton");
        define("rows", "steps:\n  - action: find\n    automation_id: okButton\n    save_as: list\n"
            + "  - action: children\n    ref: list\n    save_as: first\n  - action: click\n    ref: first\n");

        var result = run("rows", Map.of());

        assertTrue(result.success(), result.message());
        assertTrue(log.contains("[Macro] Step 2/3: OK — Found 2 children"), log.toString());
        assertTrue(driver.calls().contains("click rowA"), driver.calls().toString());
    }

    @Test
    void macroTimeoutInterruptsLongStep() throws IOException {
        define("slow", "timeout: 1\nsteps:\n  - action: wait\n    seconds: 5\n    timeout: 5\n");

        var started = System.nanoTime();
        var result = run("slow", Map.of());
        var elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertFalse(result.success());
        assertEquals("Macro 'slow' timed out after 1s at step 1 (wait)", result.message());
        assertEquals("Macro timeout exceeded", result.error());
        assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, elapsed.toString());
    }

    @Test
    void cancellationStopsRunningMacro() throws IOException, InterruptedException {
        define("long", "steps:\n  - action: wait\n    seconds: 5\n    timeout: 5\n  - action: focus\n");
        var token = new CancellationToken();
        var scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 200, TimeUnit.MILLISECONDS);
            var result = executor.execute("long", Map.of(), session, log::add, token);

            assertFalse(result.success());
            assertEquals("Macro 'long' cancelled at step 1 (wait)", result.message());
            assertEquals("Cancelled", result.error());
            assertFalse(driver.calls().contains("focus"));
        } finally {
            scheduler.shutdownNow();
            scheduler.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void executesAdHocYaml() {
        var result = executor.executeYaml("name: adhoc\nsteps:\n  - action: screenshot\n", Map.of(), session, log::add,
            new CancellationToken());
        assertTrue(result.success(), result.message());
        assertEquals("Macro 'adhoc' completed (1 steps)", result.message());
    }

    @Test
    void adHocYamlRejectsInvalidDocumentsAndIncludes() {
        var invalid = executor.executeYaml("steps:\n  - action: click\n  - action: type\n", Map.of(), session, null, null);
        assertEquals("Invalid macro: Step 2 (type): requires 'text' field", invalid.message());

        var empty = executor.executeYaml("name: x\n", Map.of(), session, null, null);
        assertEquals("Macro has no steps defined", empty.message());

        var include = executor.executeYaml("steps:\n  - action: include\n    macro_name: other\n", Map.of(), session, null, null);
        assertFalse(include.success());
        assertTrue(include.message().startsWith("include step was not expanded at load time (macro_name=other)"),
            include.message());
    }

    private void define(String name, String yaml) throws IOException {
        macros.put(name, MacroDocumentParser.parse(yaml).orElseThrow());
    }

    private MacroResult run(String name, Map<String, String> parameters) {
        return executor.execute(name, parameters, session, log::add, new CancellationToken());
    }
}
