package work.lcod.automation.rpc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.runtime.WorkerPools;
import work.lcod.automation.shared.DurationParser;

/**
 * Client side of a JSON-lines connection. At most one call is in flight: a fair single-permit gate
 * is held from writing the request until its response has been read.
 *
 * <p>A timeout bounds both the wait for the gate and the wait for the response. A call without a
 * timeout holds the gate until the peer answers, however long that takes; later calls on the same
 * connection queue behind it and their own timeouts bound only their own wait.
 *
 * <p>Responses are read on a single reader thread in request order. When a call gives up on its
 * response, its queued read still consumes that response, so later calls stay paired with their
 * own replies.
 */
public final class RpcClient implements Closeable {
    private static final Logger log = LogManager.getLogger(RpcClient.class);

    private final Socket socket;
    private final BufferedReader reader;
    private final Writer writer;
    private final Semaphore gate = new Semaphore(1, true);
    private final ExecutorService readerThread = Executors.newSingleThreadExecutor(WorkerPools.daemonFactory("lcod-rpc-reader"));
    private volatile boolean closed;

    public RpcClient(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public static RpcClient connect(String host, int port, Duration timeout) throws IOException {
        var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), Math.toIntExact(timeout.toMillis()));
        } catch (IOException ex) {
            socket.close();
            throw new TransportException("Cannot connect to " + host + ":" + port + ": " + ex.getMessage(), ex);
        }
        log.debug("Connected to {}:{}", host, port);
        return new RpcClient(socket);
    }

    public boolean isConnected() {
        return !closed && !socket.isClosed();
    }

    public RpcResponse call(String method, ObjectNode args) throws IOException {
        return call(method, args, null);
    }

    /**
     * Sends one request and waits for its response.
     *
     * @param timeout null to wait as long as the peer needs
     * @throws CallCancelledException when the timeout elapses or the caller is interrupted
     * @throws TransportException     when the connection is unusable or the reply is malformed
     */
    public RpcResponse call(String method, ObjectNode args, Duration timeout) throws IOException {
        if (!isConnected()) {
            throw new TransportException("Not connected");
        }
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        acquireGate(method, timeout, deadline);
        try {
            if (!isConnected()) {
                throw new TransportException("Not connected");
            }
            send(Wire.encode(Wire.request(method, args)));
            Future<String> pending = readerThread.submit(reader::readLine);
            var line = awaitLine(method, pending, timeout, deadline);
            if (line == null) {
                closed = true;
                throw new TransportException("Connection closed");
            }
            return RpcResponse.decode(line);
        } finally {
            gate.release();
        }
    }

    public static ObjectNode args() {
        return Wire.JSON.createObjectNode();
    }

    @Override
    public void close() throws IOException {
        closed = true;
        readerThread.shutdownNow();
        socket.close();
    }

    private void acquireGate(String method, Duration timeout, long deadline) throws CallCancelledException {
        try {
            if (timeout == null) {
                gate.acquire();
                return;
            }
            if (!gate.tryAcquire(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                throw new CallCancelledException("Call '" + method + "' cancelled after "
                    + DurationParser.formatSeconds(timeout) + "s waiting for a previous call on this connection");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Call '" + method + "' interrupted");
        }
    }

    private void send(String line) throws TransportException {
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException ex) {
            closed = true;
            throw new TransportException("Connection closed", ex);
        }
    }

    private String awaitLine(String method, Future<String> pending, Duration timeout, long deadline) throws IOException {
        try {
            if (timeout == null) {
                return pending.get();
            }
            return pending.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            log.debug("Abandoning the response to '{}' after {}s", method, DurationParser.formatSeconds(timeout));
            throw new CallCancelledException("Call '" + method + "' cancelled after "
                + DurationParser.formatSeconds(timeout) + "s waiting for a response");
        } catch (ExecutionException ex) {
            closed = true;
            throw new TransportException("Connection closed", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Call '" + method + "' interrupted");
        }
    }
}
