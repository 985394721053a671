package com.questrail.lsnp.model;

import com.questrail.lsnp.api.InvalidMessageFormatException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * LsnpMessage
 * -----------------------------------------------------------------------------
 * One LSNP message: an ordered, open mapping of field name to string value.
 *
 * <p>The protocol is deliberately open-ended. Receivers ignore fields they do
 * not understand and senders may add fields freely, so the message is not a
 * fixed record type. Typed accessors ({@link #sender()}, {@link #requireInt},
 * ...) are layered on top of the raw mapping and fail with
 * {@link InvalidMessageFormatException} when a required field is missing or
 * malformed.</p>
 *
 * <p>Instances are immutable. Field order is preserved so that encoding is
 * stable and readable on the wire.</p>
 */
public final class LsnpMessage
{
    private final Map<String, String> fields;

    private LsnpMessage(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder(MessageType type) {
        Objects.requireNonNull(type, "type");
        return new Builder().put(LsnpFields.TYPE, type.wireName());
    }

    /**
     * Builds a message from raw decoded fields.
     *
     * @throws InvalidMessageFormatException if {@code TYPE} is absent or empty, or a
     *         field name is not legal on the wire
     */
    public static LsnpMessage of(Map<String, String> fields) {
        Objects.requireNonNull(fields, "fields");
        String type = fields.get(LsnpFields.TYPE);
        if (type == null || type.isEmpty()) {
            throw new InvalidMessageFormatException("Message has no TYPE field");
        }
        Builder b = new Builder();
        try {
            fields.forEach(b::put);
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageFormatException(e.getMessage(), e);
        }
        return b.build();
    }

    /**
     * Raw wire type name, which may not be a {@link MessageType} this node knows.
     */
    public String typeName() {
        return fields.get(LsnpFields.TYPE);
    }

    public Optional<MessageType> type() {
        return MessageType.fromWire(typeName());
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public String require(String key) {
        String value = fields.get(key);
        if (value == null) {
            throw new InvalidMessageFormatException(typeName() + " message is missing " + key);
        }
        return value;
    }

    public int requireInt(String key) {
        String raw = require(key);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidMessageFormatException(key + " is not an integer: '" + raw + "'", e);
        }
    }

    public long requireLong(String key) {
        String raw = require(key);
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidMessageFormatException(key + " is not an integer: '" + raw + "'", e);
        }
    }

    public UserId requireUser(String key) {
        String raw = require(key);
        try {
            return UserId.parse(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageFormatException(key + " is not a user id: '" + raw + "'", e);
        }
    }

    /**
     * Resolves the sender identifier. Known types use their declared sender
     * field; unknown types fall back to {@code FROM} and then {@code USER_ID}.
     */
    public UserId sender() {
        Optional<MessageType> t = type();
        if (t.isPresent()) {
            return requireUser(t.get().senderField());
        }
        return requireUser(has(LsnpFields.FROM) ? LsnpFields.FROM : LsnpFields.USER_ID);
    }

    public UserId recipient() {
        return requireUser(LsnpFields.TO);
    }

    public String messageId() {
        return require(LsnpFields.MESSAGE_ID);
    }

    /**
     * Sender's wall-clock timestamp in epoch seconds.
     */
    public long timestamp() {
        return requireLong(LsnpFields.TIMESTAMP);
    }

    public Map<String, String> fields() {
        return fields;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        fields.forEach(b::put);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LsnpMessage that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        // Avatar payloads and content can be large; keep log lines short.
        return "LsnpMessage[" + typeName() + " id=" + fields.get(LsnpFields.MESSAGE_ID)
                + " fields=" + fields.keySet() + "]";
    }

    public static final class Builder
    {
        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, String value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Field name must not be empty");
            }
            for (int i = 0; i < key.length(); i++) {
                char c = key.charAt(i);
                if (c == ':' || c == '\n' || c == '\r') {
                    throw new IllegalArgumentException("Illegal character in field name: '" + key + "'");
                }
            }
            fields.put(key, value);
            return this;
        }

        public Builder put(String key, UserId value) {
            return put(key, Objects.requireNonNull(value, "value").value());
        }

        public Builder put(String key, long value) {
            return put(key, Long.toString(value));
        }

        public Builder remove(String key) {
            fields.remove(key);
            return this;
        }

        public LsnpMessage build() {
            if (!fields.containsKey(LsnpFields.TYPE)) {
                throw new IllegalStateException("TYPE must be set");
            }
            return new LsnpMessage(fields);
        }
    }
}
