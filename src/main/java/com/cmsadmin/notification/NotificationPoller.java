package com.cmsadmin.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers the admin page's periodic notification poll.
 *
 * A poll returns the unanswered questions newer than the client's last poll
 * (recomputed every time) followed by every queued notification (drained).
 * The "since" timestamp filters only the questions, never the queue.
 */
public class NotificationPoller {
    private static final Logger log = LoggerFactory.getLogger(NotificationPoller.class);

    private final NotificationQueue queue;
    private final QuestionSource questionSource;
    private final ObjectMapper mapper = new ObjectMapper();

    public NotificationPoller(NotificationQueue queue, QuestionSource questionSource) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.questionSource = questionSource == null ? QuestionSource.NONE : questionSource;
    }

    /**
     * @param sinceTimestamp time of the client's previous poll, 0 for "everything"
     * @return questions first, then notifications in append order
     */
    public List<PollEntry> poll(long sinceTimestamp) {
        List<PollEntry> entries = new ArrayList<>();
        for (PendingQuestion question : questionSource.unansweredSince(sinceTimestamp)) {
            entries.add(PollEntry.of(question));
        }
        for (Notification notification : queue.drainAll()) {
            entries.add(PollEntry.of(notification));
        }
        if (!entries.isEmpty()) {
            log.debug("Poll since {} returned {} entries", sinceTimestamp, entries.size());
        }
        return entries;
    }

    /**
     * Same as {@link #poll(long)}, rendered as a JSON array.
     *
     * @throws JsonProcessingException if serialization fails
     */
    public String pollAsJson(long sinceTimestamp) throws JsonProcessingException {
        return mapper.writeValueAsString(poll(sinceTimestamp));
    }
}
