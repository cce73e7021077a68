package in.makerflow.infrastructure.stream;

/**
 * Quote stream connection state.
 *
 * DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED (loop),
 * STOPPING → DISCONNECTED once stop() is called.
 */
public enum StreamState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    STOPPING
}
