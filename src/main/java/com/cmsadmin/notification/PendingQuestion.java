package com.cmsadmin.notification;

/**
 * A contestant question that has not been answered yet.
 */
public final class PendingQuestion {

    private final long questionTimestamp;
    private final String subject;
    private final String text;

    public PendingQuestion(long questionTimestamp, String subject, String text) {
        this.questionTimestamp = questionTimestamp;
        this.subject = subject;
        this.text = text;
    }

    public long getQuestionTimestamp() {
        return questionTimestamp;
    }

    public String getSubject() {
        return subject;
    }

    public String getText() {
        return text;
    }
}
