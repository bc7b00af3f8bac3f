package work.lcod.automation.rpc;

import java.io.IOException;

/**
 * The connection to the peer is unusable: not connected, closed mid-call, or the peer sent
 * something that is not a response.
 */
public class TransportException extends IOException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
