package respite.protocol;

/**
 * Malformed RESP input: unsupported type tag, bad length field, bulk string
 * terminator mismatch, or end of stream in the middle of a message.
 */
public class ProtocolViolationException extends Exception {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
