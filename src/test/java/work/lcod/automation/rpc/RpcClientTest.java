package work.lcod.automation.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RpcClientTest {
    private static final Duration CONNECT = Duration.ofSeconds(2);

    private ServerSocket peer;
    private Thread peerThread;

    @AfterEach
    void stopPeer() throws Exception {
        if (peer != null) {
            peer.close();
        }
        if (peerThread != null) {
            peerThread.join(2000);
        }
    }

    @Test
    void pairsResponsesWithCallsInOrder() throws Exception {
        startPeer(method -> "{\"ok\":true,\"result\":\"" + method + "\",\"extra\":1}");
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            for (var method : new String[] {"focus", "status", "screenshot"}) {
                var response = client.call(method, RpcClient.args());
                assertTrue(response.ok());
                assertEquals(method, response.message());
                assertEquals(1, response.field("extra").asInt());
            }
        }
    }

    @Test
    void errorRepliesAreNotExceptions() throws Exception {
        startPeer(method -> "{\"ok\":false,\"error\":\"Unknown method: " + method + "\"}");
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            var response = client.call("dance", RpcClient.args());
            assertFalse(response.ok());
            assertEquals("Unknown method: dance", response.message());
        }
    }

    @Test
    void boundedCallBehindSlowCallIsCancelled() throws Exception {
        startPeer(method -> {
            if (method.equals("slow")) {
                pause(600);
            }
            return "{\"ok\":true,\"result\":\"" + method + "\"}";
        });
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            var slow = CompletableFuture.supplyAsync(() -> callQuietly(client, "slow"));
            pause(100);

            var ex = assertThrows(CallCancelledException.class,
                () -> client.call("fast", RpcClient.args(), Duration.ofMillis(100)));
            assertEquals("Call 'fast' cancelled after 0.1s waiting for a previous call on this connection", ex.getMessage());

            assertEquals("slow", slow.get(5, TimeUnit.SECONDS));
            assertEquals("after", client.call("after", RpcClient.args()).message());
        }
    }

    @Test
    void abandonedResponseIsNotHandedToTheNextCall() throws Exception {
        startPeer(method -> {
            if (method.equals("slow")) {
                pause(400);
            }
            return "{\"ok\":true,\"result\":\"" + method + "\"}";
        });
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            var ex = assertThrows(CallCancelledException.class,
                () -> client.call("slow", RpcClient.args(), Duration.ofMillis(100)));
            assertEquals("Call 'slow' cancelled after 0.1s waiting for a response", ex.getMessage());

            assertEquals("next", client.call("next", RpcClient.args()).message());
            assertTrue(client.isConnected());
        }
    }

    @Test
    void peerHangingUpClosesTheClient() throws Exception {
        startPeer(method -> null);
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            var ex = assertThrows(TransportException.class, () -> client.call("focus", RpcClient.args()));
            assertEquals("Connection closed", ex.getMessage());
            assertFalse(client.isConnected());
            assertEquals("Not connected", assertThrows(TransportException.class,
                () -> client.call("focus", RpcClient.args())).getMessage());
        }
    }

    @Test
    void malformedResponseIsATransportError() throws Exception {
        startPeer(method -> "[1, 2, 3]");
        try (var client = RpcClient.connect("127.0.0.1", peer.getLocalPort(), CONNECT)) {
            var ex = assertThrows(TransportException.class, () -> client.call("focus", RpcClient.args()));
            assertEquals("Malformed response: [1, 2, 3]", ex.getMessage());
        }
    }

    @Test
    void connectFailureNamesTheEndpoint() throws Exception {
        int port;
        try (var probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        var ex = assertThrows(TransportException.class, () -> RpcClient.connect("127.0.0.1", port, CONNECT));
        assertTrue(ex.getMessage().startsWith("Cannot connect to 127.0.0.1:" + port), ex.getMessage());
    }

    /** Serves one connection; a null reply closes it. */
    private void startPeer(Function<String, String> replies) throws IOException {
        peer = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        peerThread = new Thread(() -> {
            try (var socket = peer.accept();
                 var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                 Writer writer = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    var method = Wire.JSON.readTree(line).path("method").asText();
                    var reply = replies.apply(method);
                    if (reply == null) {
                        return;
                    }
                    writer.write(reply + "\n");
                    writer.flush();
                }
            } catch (IOException ex) {
                // peer closed by the test
            }
        }, "rpc-test-peer");
        peerThread.setDaemon(true);
        peerThread.start();
    }

    private static String callQuietly(RpcClient client, String method) {
        try {
            return client.call(method, RpcClient.args()).message();
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
