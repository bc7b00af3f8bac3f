package work.lcod.automation.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.runtime.WorkerPools;
import work.lcod.automation.shared.DurationParser;

/**
 * Serves a {@link CommandRegistry} over TCP, one JSON document per line.
 *
 * <p>Each connection gets its own read, dispatch, write loop, so requests on one connection are
 * answered in order. Commands from all connections pass through one fair gate because the backend
 * is not reentrant. The gate is taken right before a command runs and released right after it
 * returns or fails.
 */
public final class RpcServer implements Closeable {
    private static final Logger log = LogManager.getLogger(RpcServer.class);

    private final CommandRegistry commands;
    private final int maxConnections;
    private final Optional<Duration> idleTimeout;
    private final Semaphore commandGate = new Semaphore(1, true);
    private final ExecutorService pool = WorkerPools.newCachedPool("lcod-rpc-server");
    private final Set<Socket> connections = new HashSet<>();
    private final AtomicInteger clientIds = new AtomicInteger();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile ServerSocket serverSocket;
    private volatile long idleSince = System.nanoTime();

    public RpcServer(CommandRegistry commands, int maxConnections, Optional<Duration> idleTimeout) {
        this.commands = Objects.requireNonNull(commands, "commands");
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
    }

    /** Binds and starts accepting in the background. Port 0 picks a free port, see {@link #port()}. */
    public void start(String host, int port) throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        var socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(host, port));
        if (idleTimeout.isPresent()) {
            socket.setSoTimeout(pollMillis(idleTimeout.get()));
        }
        serverSocket = socket;
        idleSince = System.nanoTime();
        log.info("Listening on {}:{} (max {} connections{})", host, socket.getLocalPort(), maxConnections,
            idleTimeout.map(idle -> ", idle shutdown after " + DurationParser.formatSeconds(idle) + "s").orElse(""));
        pool.execute(this::acceptLoop);
    }

    public int port() {
        var socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public int activeConnections() {
        synchronized (connections) {
            return connections.size();
        }
    }

    public boolean isClosed() {
        return stopped.getCount() == 0;
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void close() throws IOException {
        if (isClosed()) {
            return;
        }
        stopped.countDown();
        var socket = serverSocket;
        if (socket != null) {
            socket.close();
        }
        ArrayList<Socket> open;
        synchronized (connections) {
            open = new ArrayList<>(connections);
        }
        for (var client : open) {
            try {
                client.close();
            } catch (IOException ex) {
                log.debug("Failed to close client socket", ex);
            }
        }
        pool.shutdownNow();
        log.info("Server stopped");
    }

    /** Decodes one request line, runs the command under the gate and returns the response. */
    ObjectNode handle(String line) {
        JsonNode request;
        try {
            request = Wire.JSON.readTree(line);
        } catch (JsonProcessingException ex) {
            return Wire.error("Malformed request: " + ex.getOriginalMessage());
        }
        if (request == null || !request.isObject() || !request.path("method").isTextual()) {
            return Wire.error("Malformed request: expected {\"method\": ..., \"args\": {...}}");
        }
        var method = request.get("method").textValue();
        var command = commands.get(method);
        if (command.isEmpty()) {
            return Wire.error("Unknown method: " + method);
        }
        JsonNode args = request.path("args");
        if (!args.isObject()) {
            args = Wire.JSON.createObjectNode();
        }
        try {
            commandGate.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Wire.error("Server is shutting down");
        }
        try {
            var reply = command.get().invoke(args);
            return reply != null ? reply : Wire.error("Method '" + method + "' produced no response");
        } catch (Exception ex) {
            log.debug("Method '{}' failed", method, ex);
            var message = ex.getMessage();
            return Wire.error(message == null || message.isBlank() ? ex.getClass().getSimpleName() : message);
        } finally {
            commandGate.release();
        }
    }

    private void acceptLoop() {
        var socket = serverSocket;
        try {
            while (!socket.isClosed()) {
                Socket client;
                try {
                    client = socket.accept();
                } catch (SocketTimeoutException ex) {
                    if (idleExpired()) {
                        log.info("No client connected for {}s, shutting down",
                            DurationParser.formatSeconds(idleTimeout.orElseThrow()));
                        break;
                    }
                    continue;
                }
                admit(client);
            }
        } catch (IOException ex) {
            if (!isClosed()) {
                log.error("Accept loop failed", ex);
            }
        } finally {
            try {
                close();
            } catch (IOException ex) {
                log.warn("Failed to stop server cleanly", ex);
            }
        }
    }

    private void admit(Socket client) {
        int id = clientIds.incrementAndGet();
        boolean accepted;
        synchronized (connections) {
            accepted = connections.size() < maxConnections;
            if (accepted) {
                connections.add(client);
            }
        }
        if (!accepted) {
            log.warn("Rejecting client #{}: {} connections already open", id, maxConnections);
            reject(client);
            return;
        }
        pool.execute(() -> serve(client, id));
    }

    private void reject(Socket client) {
        try (client; var writer = writer(client)) {
            writeLine(writer, Wire.error("Too many connections (max " + maxConnections + ")"));
        } catch (IOException ex) {
            log.debug("Failed to notify rejected client", ex);
        }
    }

    private void serve(Socket client, int id) {
        log.info("Client #{} connected from {}", id, client.getRemoteSocketAddress());
        try (client;
             var reader = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8));
             var writer = writer(client)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                writeLine(writer, handle(line));
            }
        } catch (IOException ex) {
            if (!isClosed()) {
                log.warn("Client #{} error: {}", id, ex.getMessage());
            }
        } finally {
            synchronized (connections) {
                connections.remove(client);
                if (connections.isEmpty()) {
                    idleSince = System.nanoTime();
                }
            }
            log.info("Client #{} disconnected", id);
        }
    }

    private boolean idleExpired() {
        if (idleTimeout.isEmpty()) {
            return false;
        }
        synchronized (connections) {
            if (!connections.isEmpty()) {
                return false;
            }
        }
        return System.nanoTime() - idleSince >= idleTimeout.get().toNanos();
    }

    private static Writer writer(Socket client) throws IOException {
        return new BufferedWriter(new OutputStreamWriter(client.getOutputStream(), StandardCharsets.UTF_8));
    }

    private static void writeLine(Writer writer, JsonNode reply) throws IOException {
        writer.write(Wire.encode(reply));
        writer.write('\n');
        writer.flush();
    }

    private static int pollMillis(Duration idle) {
        return (int) Math.max(50L, Math.min(idle.toMillis(), 1000L));
    }
}
