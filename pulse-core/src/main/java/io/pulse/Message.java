package io.pulse;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A delivered pub/sub message together with its once-only completion handle.
 *
 * <p>The data fields are immutable. Each message is assigned a ULID-based {@code id}
 * by default, and its {@code data} payload is limited to {@value #MAX_DATA_BYTES} bytes.
 *
 * <p>A transport builds a message at delivery time and binds an {@link AckHandler}
 * to it. Application code then calls {@link #ack()} or {@link #nack()}. The handler
 * fires at most once no matter how many calls are made or from how many threads;
 * every call after the first is ignored.
 *
 * <p>{@link #equals(Object)} and {@link #hashCode()} compare data fields only. The
 * completion state and the bound handler are not part of a message's value.
 *
 * @see AckHandler
 * @see io.pulse.codec.MessageCodec
 */
public final class Message {
    public static final int MAX_DATA_BYTES = 1024 * 1024; // 1MB

    private final String id;
    private final String topic;
    private final String ackId;
    private final byte[] data;
    private final Map<String, String> attributes;
    private final String specVersion;
    private final String type;
    private final String source;
    private final String destination;
    private final Integer deliveryAttempt;
    private final Instant publishTime;
    private final Instant receiveTime;

    private final AckHandler ackHandler;
    private final AtomicBoolean done = new AtomicBoolean(false);

    private Message(Builder builder) {
        this.id = builder.id == null ? newId() : builder.id;
        this.topic = Objects.requireNonNull(builder.topic, "topic");
        if (this.topic.isEmpty()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
        this.ackId = builder.ackId;

        byte[] payload = builder.data == null ? new byte[0] : builder.data;
        if (payload.length > MAX_DATA_BYTES) {
            throw new IllegalArgumentException("Data exceeds maximum size of " + MAX_DATA_BYTES + " bytes");
        }
        this.data = Arrays.copyOf(payload, payload.length);

        Map<String, String> attributeCopy = builder.attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        if (attributeCopy.containsKey(null)) {
            throw new IllegalArgumentException("attributes cannot contain null keys");
        }
        if (attributeCopy.containsValue(null)) {
            throw new IllegalArgumentException("attributes cannot contain null values");
        }
        this.attributes = attributeCopy;

        if (builder.deliveryAttempt != null && builder.deliveryAttempt < 1) {
            throw new IllegalArgumentException("deliveryAttempt must be >= 1, got: " + builder.deliveryAttempt);
        }
        this.deliveryAttempt = builder.deliveryAttempt;

        this.specVersion = builder.specVersion;
        this.type = builder.type;
        this.source = builder.source;
        this.destination = builder.destination;
        this.publishTime = builder.publishTime;
        this.receiveTime = builder.receiveTime;
        this.ackHandler = builder.ackHandler == null ? AckHandler.NOOP : builder.ackHandler;
    }

    /**
     * Creates a builder for a message published on the given topic.
     *
     * @param topic the topic name
     * @return a new builder
     */
    public static Builder builder(String topic) {
        return new Builder(topic);
    }

    /**
     * Returns a builder pre-populated with this message's data fields and handler.
     *
     * <p>Transports use this to attach an ack token, receive time and {@link AckHandler}
     * to a decoded message. The completion state is not copied: the new message starts
     * with its flag clear.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(topic)
                .id(id)
                .ackId(ackId)
                .data(data)
                .attributes(attributes)
                .specVersion(specVersion)
                .type(type)
                .source(source)
                .destination(destination)
                .deliveryAttempt(deliveryAttempt)
                .publishTime(publishTime)
                .receiveTime(receiveTime)
                .ackHandler(ackHandler);
    }

    /**
     * Signals successful processing.
     *
     * <p>Safe to call from any thread and any number of times; only the first
     * {@code ack()} or {@code nack()} reaches the bound {@link AckHandler}.
     */
    public void ack() {
        complete(true);
    }

    /**
     * Signals that the message will not or cannot be processed. The transport
     * decides how and when it is redelivered.
     *
     * <p>Safe to call from any thread and any number of times; only the first
     * {@code ack()} or {@code nack()} reaches the bound {@link AckHandler}.
     */
    public void nack() {
        complete(false);
    }

    /**
     * Returns {@code true} once {@link #ack()} or {@link #nack()} has been called.
     *
     * @return whether this message has been completed
     */
    public boolean isDone() {
        return done.get();
    }

    private void complete(boolean success) {
        if (!done.compareAndSet(false, true)) {
            return;
        }
        ackHandler.onComplete(ackId, success, receiveTime);
    }

    public String id() {
        return id;
    }

    public String topic() {
        return topic;
    }

    public String ackId() {
        return ackId;
    }

    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String specVersion() {
        return specVersion;
    }

    public String type() {
        return type;
    }

    public String source() {
        return source;
    }

    public String destination() {
        return destination;
    }

    /**
     * Returns how many times the transport has delivered this message, starting at 1,
     * or {@code null} if the transport does not track it.
     *
     * @return the delivery attempt, or {@code null}
     */
    public Integer deliveryAttempt() {
        return deliveryAttempt;
    }

    public Instant publishTime() {
        return publishTime;
    }

    public Instant receiveTime() {
        return receiveTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return id.equals(other.id)
                && topic.equals(other.topic)
                && Objects.equals(ackId, other.ackId)
                && Arrays.equals(data, other.data)
                && attributes.equals(other.attributes)
                && Objects.equals(specVersion, other.specVersion)
                && Objects.equals(type, other.type)
                && Objects.equals(source, other.source)
                && Objects.equals(destination, other.destination)
                && Objects.equals(deliveryAttempt, other.deliveryAttempt)
                && Objects.equals(publishTime, other.publishTime)
                && Objects.equals(receiveTime, other.receiveTime);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, topic, ackId, attributes, specVersion, type, source,
                destination, deliveryAttempt, publishTime, receiveTime);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Message{id=").append(id)
                .append(", topic=").append(topic)
                .append(", dataBytes=").append(data.length);
        if (type != null) {
            sb.append(", type=").append(type);
        }
        if (deliveryAttempt != null) {
            sb.append(", deliveryAttempt=").append(deliveryAttempt);
        }
        return sb.append(", done=").append(done.get()).append('}').toString();
    }

    /**
     * Builder for {@link Message}.
     */
    public static final class Builder {
        private final String topic;
        private String id;
        private String ackId;
        private byte[] data;
        private Map<String, String> attributes;
        private String specVersion;
        private String type;
        private String source;
        private String destination;
        private Integer deliveryAttempt;
        private Instant publishTime;
        private Instant receiveTime;
        private AckHandler ackHandler;

        private Builder(String topic) {
            this.topic = topic;
        }

        /**
         * Sets a custom message identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param id the message identifier
         * @return this builder
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the acknowledgement token issued by the delivering transport.
         *
         * @param ackId the transport-scoped ack token
         * @return this builder
         */
        public Builder ackId(String ackId) {
            this.ackId = ackId;
            return this;
        }

        /**
         * Sets the payload. The array is defensively copied at build time.
         *
         * <p>Optional. Defaults to an empty payload. Maximum size:
         * {@value Message#MAX_DATA_BYTES} bytes.
         *
         * @param data the raw payload
         * @return this builder
         */
        public Builder data(byte[] data) {
            this.data = data;
            return this;
        }

        /**
         * Sets the routing and codec attributes. The map is defensively copied at build time.
         *
         * <p>Optional. Defaults to an empty map. Null keys and values are rejected at build time.
         *
         * @param attributes the attributes
         * @return this builder
         */
        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder specVersion(String specVersion) {
            this.specVersion = specVersion;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        /**
         * Sets the transport's delivery counter.
         *
         * @param deliveryAttempt the attempt number (1-based), or {@code null} if unknown
         * @return this builder
         */
        public Builder deliveryAttempt(Integer deliveryAttempt) {
            this.deliveryAttempt = deliveryAttempt;
            return this;
        }

        public Builder publishTime(Instant publishTime) {
            this.publishTime = publishTime;
            return this;
        }

        public Builder receiveTime(Instant receiveTime) {
            this.receiveTime = receiveTime;
            return this;
        }

        /**
         * Binds the completion callback.
         *
         * <p>Optional. Defaults to {@link AckHandler#NOOP}.
         *
         * @param ackHandler the transport's completion callback
         * @return this builder
         */
        public Builder ackHandler(AckHandler ackHandler) {
            this.ackHandler = ackHandler;
            return this;
        }

        /**
         * Builds a {@link Message} with its completion flag clear.
         *
         * @return a new message
         * @throws NullPointerException     if {@code topic} is null
         * @throws IllegalArgumentException if {@code topic} is empty, data exceeds
         *                                  {@value Message#MAX_DATA_BYTES} bytes, attributes contain
         *                                  nulls, or {@code deliveryAttempt} is below 1
         */
        public Message build() {
            return new Message(this);
        }
    }

    private static String newId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
