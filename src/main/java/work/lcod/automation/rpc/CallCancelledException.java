package work.lcod.automation.rpc;

import java.io.InterruptedIOException;

/**
 * A call gave up before its response arrived, either while queued behind another call on the same
 * connection or while waiting for the peer.
 */
public class CallCancelledException extends InterruptedIOException {
    public CallCancelledException(String message) {
        super(message);
    }
}
