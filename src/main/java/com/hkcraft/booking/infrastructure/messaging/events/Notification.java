package com.hkcraft.booking.infrastructure.messaging.events;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification payload published for a single recipient.
 *
 * @author Craft Booking Team
 */
public class Notification {

    private String recipientId;
    private NotificationType type;
    private String title;
    private String message;
    private Map<String, Object> metadata;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public Notification() {
        this.metadata = new LinkedHashMap<>();
    }

    public Notification(NotificationType type, String title, String message) {
        this();
        this.type = type;
        this.title = title;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public static Notification of(NotificationType type, String title, String message) {
        return new Notification(type, title, message);
    }

    /**
     * Add a metadata entry.
     *
     * @return this notification for chaining
     */
    public Notification with(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
    }

    public NotificationType getType() {
        return type;
    }

    public void setType(NotificationType type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "Notification{" +
                "recipientId='" + recipientId + '\'' +
                ", type=" + type +
                ", title='" + title + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
