package io.pulse.codec;

import io.pulse.Message;

/**
 * Converts a {@link Message} to bytes and back.
 *
 * <p>Implementations must round-trip every data field: {@code decode(encode(m)).equals(m)}.
 * The completion handler and state are not encoded; decoded messages carry
 * {@link io.pulse.AckHandler#NOOP} until a transport rebinds them with
 * {@link Message#toBuilder()}.
 *
 * <p>The default implementation ({@link JsonMessageCodec}) writes UTF-8 JSON and has no
 * external dependencies. Users who want a different wire format can implement this interface.
 *
 * @see #getDefault()
 */
public interface MessageCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link MessageCodec}
     */
    static MessageCodec getDefault() {
        return JsonMessageCodec.INSTANCE;
    }

    /**
     * Encodes a message.
     *
     * @param message the message to encode
     * @return the encoded bytes
     */
    byte[] encode(Message message);

    /**
     * Decodes a message.
     *
     * @param bytes the encoded bytes
     * @return the decoded message, completion flag clear
     * @throws MessageDecodeException if the bytes are truncated, malformed, or miss required fields
     */
    Message decode(byte[] bytes);
}
