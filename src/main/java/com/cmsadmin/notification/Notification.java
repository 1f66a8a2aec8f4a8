package com.cmsadmin.notification;

import java.util.Objects;

/**
 * Message to surface to the admin at the next poll.
 * Immutable once created.
 */
public final class Notification {

    private final long timestamp;
    private final String subject;
    private final String body;

    /**
     * @param timestamp the time of the notification, seconds since epoch
     * @param subject subject of the notification
     * @param body body of the notification
     */
    public Notification(long timestamp, String subject, String body) {
        this.timestamp = timestamp;
        this.subject = Objects.requireNonNull(subject, "subject cannot be null");
        this.body = body == null ? "" : body;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Notification)) {
            return false;
        }
        Notification other = (Notification) o;
        return timestamp == other.timestamp && subject.equals(other.subject) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, subject, body);
    }

    @Override
    public String toString() {
        return String.format("Notification[%d: %s]", timestamp, subject);
    }
}
