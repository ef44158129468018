package com.vantage.fanout;

import java.util.Objects;

/**
 * A named, typed delivery topic. Two channels are equal when name and message
 * type match; the engine rejects reusing a name with a different type.
 */
public final class EventChannel<M> {

    private final String name;
    private final Class<M> messageType;

    private EventChannel(String name, Class<M> messageType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
        this.name = name;
        this.messageType = Objects.requireNonNull(messageType, "messageType");
    }

    public static <M> EventChannel<M> of(String name, Class<M> messageType) {
        return new EventChannel<>(name, messageType);
    }

    public String getName() {
        return name;
    }

    public Class<M> getMessageType() {
        return messageType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventChannel)) {
            return false;
        }
        EventChannel<?> other = (EventChannel<?>) o;
        return name.equals(other.name) && messageType.equals(other.messageType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, messageType);
    }

    @Override
    public String toString() {
        return name + "<" + messageType.getSimpleName() + ">";
    }
}
