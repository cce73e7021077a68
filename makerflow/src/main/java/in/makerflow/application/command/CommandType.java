package in.makerflow.application.command;

/**
 * Command message type, from the optional "type" field.
 */
public enum CommandType {
    TRADE,          // Full lifecycle per account (default)
    ORDER,          // Single limit or BBO order per account, no exits
    EXIT,           // Close the symbol's positions per account
    PARTIAL_EXIT,   // Close a fraction of one direction's position per account
    HEARTBEAT;      // Sender liveness, logged only

    public static CommandType parse(String value) {
        if (value == null || value.isBlank()) {
            return TRADE;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command type: " + value, e);
        }
    }
}
