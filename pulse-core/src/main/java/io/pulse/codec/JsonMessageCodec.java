package io.pulse.codec;

import io.pulse.Message;
import io.pulse.util.Json;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * UTF-8 JSON {@link MessageCodec}.
 *
 * <p>Layout: one object with string fields {@code id}, {@code topic}, {@code ackId},
 * {@code specVersion}, {@code type}, {@code source}, {@code destination}; {@code data} as
 * Base64; {@code attributes} as a flat object; {@code deliveryAttempt} as an integer;
 * {@code publishTime} / {@code receiveTime} as ISO-8601 instants. Absent optional fields
 * are omitted. Unknown fields are ignored on decode.
 *
 * <p>Obtain the shared instance through {@link MessageCodec#getDefault()}.
 */
public final class JsonMessageCodec implements MessageCodec {
    static final JsonMessageCodec INSTANCE = new JsonMessageCodec();

    JsonMessageCodec() {
    }

    @Override
    public byte[] encode(Message message) {
        Objects.requireNonNull(message, "message");
        StringBuilder sb = new StringBuilder(128);
        sb.append('{');
        field(sb, "id", message.id(), true);
        field(sb, "topic", message.topic(), false);
        field(sb, "ackId", message.ackId(), false);
        field(sb, "data", Base64.getEncoder().encodeToString(message.data()), false);
        if (!message.attributes().isEmpty()) {
            sb.append(",\"attributes\":");
            Json.appendObject(sb, message.attributes());
        }
        field(sb, "specVersion", message.specVersion(), false);
        field(sb, "type", message.type(), false);
        field(sb, "source", message.source(), false);
        field(sb, "destination", message.destination(), false);
        if (message.deliveryAttempt() != null) {
            sb.append(",\"deliveryAttempt\":").append(message.deliveryAttempt().intValue());
        }
        if (message.publishTime() != null) {
            field(sb, "publishTime", message.publishTime().toString(), false);
        }
        if (message.receiveTime() != null) {
            field(sb, "receiveTime", message.receiveTime().toString(), false);
        }
        sb.append('}');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Message decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MessageDecodeException("Empty message bytes");
        }
        Map<String, Object> json;
        try {
            json = Json.parseObject(utf8(bytes));
        } catch (IllegalArgumentException e) {
            throw new MessageDecodeException("Malformed message: " + e.getMessage(), e);
        }

        try {
            Message.Builder builder = Message.builder(requiredString(json, "topic"))
                    .id(requiredString(json, "id"))
                    .ackId(optionalString(json, "ackId"))
                    .specVersion(optionalString(json, "specVersion"))
                    .type(optionalString(json, "type"))
                    .source(optionalString(json, "source"))
                    .destination(optionalString(json, "destination"))
                    .attributes(attributes(json))
                    .deliveryAttempt(deliveryAttempt(json))
                    .publishTime(instant(json, "publishTime"))
                    .receiveTime(instant(json, "receiveTime"));
            String data = optionalString(json, "data");
            if (data != null) {
                builder.data(Base64.getDecoder().decode(data));
            }
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MessageDecodeException("Invalid message: " + e.getMessage(), e);
        }
    }

    private static void field(StringBuilder sb, String name, String value, boolean first) {
        if (value == null) {
            return;
        }
        if (!first) {
            sb.append(',');
        }
        Json.appendString(sb, name).append(':');
        Json.appendString(sb, value);
    }

    private static String utf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MessageDecodeException("Message bytes are not valid UTF-8", e);
        }
    }

    private static String requiredString(Map<String, Object> json, String name) {
        String value = optionalString(json, name);
        if (value == null) {
            throw new MessageDecodeException("Missing required field: " + name);
        }
        return value;
    }

    private static String optionalString(Map<String, Object> json, String name) {
        Object value = json.get(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new MessageDecodeException("Field " + name + " must be a string");
    }

    private static Map<String, String> attributes(Map<String, Object> json) {
        Object value = json.get("attributes");
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new MessageDecodeException("Field attributes must be an object");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new MessageDecodeException("Attribute " + entry.getKey() + " must be a string");
            }
            result.put((String) entry.getKey(), (String) entry.getValue());
        }
        return result;
    }

    private static Integer deliveryAttempt(Map<String, Object> json) {
        Object value = json.get("deliveryAttempt");
        if (value == null) {
            return null;
        }
        if (!(value instanceof Long)) {
            throw new MessageDecodeException("Field deliveryAttempt must be an integer");
        }
        long attempt = (Long) value;
        if (attempt > Integer.MAX_VALUE) {
            throw new MessageDecodeException("Field deliveryAttempt out of range: " + attempt);
        }
        return (int) attempt;
    }

    private static Instant instant(Map<String, Object> json, String name) {
        String value = optionalString(json, name);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MessageDecodeException("Field " + name + " is not an ISO-8601 instant", e);
        }
    }
}
