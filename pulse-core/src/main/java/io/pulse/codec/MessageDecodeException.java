package io.pulse.codec;

/**
 * Thrown by {@link MessageCodec#decode(byte[])} when the input is truncated or
 * structurally invalid. No partially decoded message is ever returned.
 */
public class MessageDecodeException extends RuntimeException {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
