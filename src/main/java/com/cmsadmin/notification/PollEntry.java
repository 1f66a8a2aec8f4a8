package com.cmsadmin.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One item of a poll answer, serialized as {type, timestamp, subject, text}.
 */
@JsonPropertyOrder({"type", "timestamp", "subject", "text"})
public final class PollEntry {

    public static final String TYPE_NEW_QUESTION = "new_question";
    public static final String TYPE_NOTIFICATION = "notification";

    private final String type;
    private final long timestamp;
    private final String subject;
    private final String text;

    private PollEntry(String type, long timestamp, String subject, String text) {
        this.type = type;
        this.timestamp = timestamp;
        this.subject = subject;
        this.text = text;
    }

    public static PollEntry of(PendingQuestion question) {
        return new PollEntry(TYPE_NEW_QUESTION, question.getQuestionTimestamp(), question.getSubject(), question.getText());
    }

    public static PollEntry of(Notification notification) {
        return new PollEntry(TYPE_NOTIFICATION, notification.getTimestamp(), notification.getSubject(), notification.getBody());
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("subject")
    public String getSubject() {
        return subject;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return String.format("PollEntry[%s %d: %s]", type, timestamp, subject);
    }
}
