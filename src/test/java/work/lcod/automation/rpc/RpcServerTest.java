package work.lcod.automation.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.automation.loader.MacroLibrary;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.session.SessionResult;
import work.lcod.automation.runtime.CancellationToken;
import work.lcod.automation.runtime.MacroExecutor;
import work.lcod.automation.session.CachedSession;
import work.lcod.automation.support.FakeDriver;

class RpcServerTest {
    private static final Duration CONNECT = Duration.ofSeconds(2);
    private static final Duration CALL = Duration.ofSeconds(5);

    @TempDir
    Path macros;

    private final FakeDriver driver = new FakeDriver().element("okButton").element("status", "Value", "Ready");
    private MacroLibrary library;
    private RpcServer server;

    @BeforeEach
    void startServer() throws IOException {
        Files.writeString(macros.resolve("confirm.yaml"), String.join("\n",
            "name: Confirm",
            "parameters:",
            "  - name: button",
            "    default: okButton",
            "steps:",
            "  - action: find",
            "    automation_id: '{{button}}'",
            "    save_as: btn",
            "  - action: click",
            "    ref: btn",
            ""), StandardCharsets.UTF_8);
        Files.writeString(macros.resolve("broken.yaml"), "steps: nope\n", StandardCharsets.UTF_8);
        library = MacroLibrary.open(macros);
        var commands = new SessionCommands(new CachedSession<>(driver), library, new MacroExecutor(library));
        server = new RpcServer(commands.registry(), 2, Optional.empty());
        server.start("127.0.0.1", 0);
    }

    @AfterEach
    void stopServer() throws IOException {
        server.close();
    }

    @Test
    void remoteSessionDrivesServerBackend() throws IOException {
        try (var client = connect()) {
            var remote = new RemoteSession(client, CALL);

            assertTrue(remote.isAttached());
            var found = remote.find(new ElementCriteria("status", null, null, null));
            assertTrue(found.success(), found.message());
            assertEquals("Button [status]", found.value().description());

            var ref = found.value().refKey();
            assertEquals("Ready", remote.getValue(ref).message());
            assertEquals("Ready", remote.properties(ref).value().get("Value"));
            assertEquals(Boolean.TRUE, remote.isEnabled(ref).value());
            assertTrue(remote.click(ref).success());
            assertEquals("Unknown ref 'e99'", remote.click("e99").message());
            assertEquals("iVBORw0KGgo=", remote.screenshot().value());
            assertEquals(2, remote.children(null).value().size());
        }
        assertTrue(driver.calls().contains("click status"));
    }

    @Test
    void localExecutorCanRunAgainstRemoteSession() throws IOException {
        try (var client = connect()) {
            var remote = new RemoteSession(client, CALL);
            var local = new MacroExecutor(library);

            var result = local.execute("confirm", Map.of(), remote, null, new CancellationToken());

            assertTrue(result.success(), result.message());
        }
        assertTrue(driver.calls().contains("click okButton"));
    }

    @Test
    void commandsFromSeveralConnectionsNeverOverlapInTheBackend() throws Exception {
        driver.clickDelay(Duration.ofMillis(200));
        var pool = Executors.newFixedThreadPool(2);
        try (var first = connect(); var second = connect()) {
            var ready = new CountDownLatch(2);
            List<Callable<List<SessionResult<String>>>> clicks = new ArrayList<>();
            for (var client : List.of(first, second)) {
                clicks.add(() -> {
                    var remote = new RemoteSession(client, CALL);
                    var ref = remote.find(new ElementCriteria("okButton", null, null, null)).value().refKey();
                    ready.countDown();
                    ready.await(2, TimeUnit.SECONDS);
                    return List.of(remote.click(ref), remote.click(ref));
                });
            }

            var results = new ArrayList<SessionResult<String>>();
            for (var future : pool.invokeAll(clicks, 10, TimeUnit.SECONDS)) {
                results.addAll(future.get());
            }

            assertEquals(4, results.size());
            assertTrue(results.stream().allMatch(SessionResult::success), results.toString());
            assertEquals(4, driver.calls().stream().filter(call -> call.equals("click okButton")).count());
            assertEquals(1, driver.maxConcurrentCalls());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void lostConnectionIsAStepErrorNotADetachedTarget() throws IOException {
        var client = connect();
        var remote = new RemoteSession(client, CALL);
        client.close();

        var ex = assertThrows(UncheckedIOException.class, remote::isAttached);
        assertEquals("Call 'status' failed: Not connected", ex.getMessage());

        var result = new MacroExecutor(library).execute("confirm", Map.of(), remote, null, new CancellationToken());

        assertFalse(result.success());
        assertEquals(1, result.failedStepIndex());
        assertEquals("Step 1 (find) failed: Call 'status' failed: Not connected", result.message());
    }

    @Test
    void serverRunsMacrosAndStreamsLog() throws IOException {
        try (var client = connect()) {
            var remote = new RemoteSession(client, CALL);
            var lines = new ArrayList<String>();

            var result = remote.runMacro("confirm", Map.of(), lines::add);

            assertTrue(result.success(), result.message());
            assertEquals(2, result.totalSteps());
            assertEquals("[Macro] Step 1/2: find (automation_id=okButton, save_as=btn)", lines.get(0));

            var failed = remote.runMacroYaml("steps:\n  - action: focus\n  - action: click\n    ref: ghost\n", Map.of(), null);
            assertFalse(failed.success());
            assertEquals(2, failed.failedStepIndex());
            assertEquals("Unknown ref 'ghost'", failed.error());

            var unknown = remote.runMacro("ghost", Map.of(), null);
            assertEquals("Macro 'ghost' not found", unknown.message());

            var adHoc = remote.runMacroYaml("steps:\n  - action: type\n    text: '{{word}}'\n", Map.of("word", "hey"), null);
            assertTrue(adHoc.success(), adHoc.message());
        }
        assertTrue(driver.calls().contains("type hey"));
    }

    @Test
    void listsMacrosWithLoadErrors() throws IOException {
        try (var client = connect()) {
            var listing = new RemoteSession(client, CALL).listMacros();

            assertEquals(1, listing.macros().size());
            var info = listing.macros().get(0);
            assertEquals("confirm", info.name());
            assertEquals("Confirm", info.displayName());
            assertEquals("okButton", info.parameters().get(0).defaultValue());
            assertEquals(1, listing.loadErrors().size());
            assertEquals("broken.yaml", listing.loadErrors().get(0).filePath());
            assertEquals("'steps' must be a list", listing.loadErrors().get(0).message());
        }
    }

    @Test
    void saveMacroWritesAndReloads() throws IOException {
        try (var client = connect()) {
            var args = RpcClient.args().put("name", "quick").put("steps", "[{\"action\":\"focus\"}]");
            var response = client.call("saveMacro", args, CALL);

            assertTrue(response.ok(), response.message());
            assertEquals("quick", response.field("macroName").asText());
            assertTrue(Files.isRegularFile(Path.of(response.field("filePath").asText())));
            assertEquals(30, library.find("quick").orElseThrow().timeoutSeconds());

            var again = client.call("saveMacro", args, CALL);
            assertFalse(again.ok());
            assertTrue(again.message().contains("already exists"), again.message());

            var noSteps = client.call("saveMacro", RpcClient.args().put("name", "x"), CALL);
            assertEquals("Steps JSON is required", noSteps.message());
        }
    }

    @Test
    void reportsProtocolErrors() throws IOException {
        try (var client = connect()) {
            assertEquals("Unknown method: dance", client.call("dance", RpcClient.args(), CALL).message());
            assertEquals("'refKey' is required", client.call("click", RpcClient.args(), CALL).message());
            assertEquals("Invalid parameters JSON: expected an object",
                client.call("macro", RpcClient.args().put("name", "confirm").put("parameters", 5), CALL).message());
            assertTrue(client.call("macro", RpcClient.args().put("name", "confirm").put("parameters", "{oops"), CALL)
                .message().startsWith("Invalid parameters JSON: "));
        }
        assertTrue(server.handle("not json").path("error").asText().startsWith("Malformed request: "));
        assertEquals("Malformed request: expected {\"method\": ..., \"args\": {...}}",
            server.handle("{\"args\":{}}").path("error").asText());
    }

    @Test
    void statusReportsAttachment() throws IOException {
        driver.attached(false);
        try (var client = connect()) {
            var status = client.call("status", RpcClient.args(), CALL);
            assertTrue(status.ok());
            assertFalse(status.field("attached").asBoolean(true));
            assertFalse(new RemoteSession(client, CALL).isAttached());

            assertTrue(client.call("attach", RpcClient.args().put("processName", "notepad"), CALL).ok());
            assertTrue(client.call("status", RpcClient.args(), CALL).field("attached").asBoolean());
        }
    }

    @Test
    void rejectsConnectionsBeyondLimit() throws Exception {
        try (var first = connect(); var second = connect()) {
            assertTrue(first.call("status", RpcClient.args(), CALL).ok());
            assertTrue(second.call("status", RpcClient.args(), CALL).ok());
            assertEquals(2, server.activeConnections());

            try (var third = new Socket("127.0.0.1", server.port());
                 var reader = new BufferedReader(new InputStreamReader(third.getInputStream(), StandardCharsets.UTF_8))) {
                var line = reader.readLine();
                assertNotNull(line);
                assertEquals("Too many connections (max 2)", Wire.JSON.readTree(line).path("error").asText());
            }
        }
    }

    @Test
    void idleServerShutsItselfDown() throws Exception {
        var registry = new CommandRegistry().register("ping", args -> Wire.ok("pong"));
        try (var idle = new RpcServer(registry, 1, Optional.of(Duration.ofMillis(300)))) {
            idle.start("127.0.0.1", 0);
            assertTrue(idle.awaitShutdown(Duration.ofSeconds(5)));
            assertTrue(idle.isClosed());
        }
    }

    private RpcClient connect() throws IOException {
        return RpcClient.connect("127.0.0.1", server.port(), CONNECT);
    }
}
