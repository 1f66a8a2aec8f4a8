package com.cmsadmin.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pending notifications, delivered to the next poller and then forgotten.
 *
 * append() and drainAll() share one lock and drainAll() swaps the whole buffer,
 * so an append racing with a drain lands either in the returned batch or in the
 * next one, never in both and never in neither.
 *
 * Best effort only: not durable, not replicated, lost on restart.
 */
public class NotificationQueue {
    private static final Logger log = LoggerFactory.getLogger(NotificationQueue.class);

    private final Object lock = new Object();
    private List<Notification> pending = new ArrayList<>(); // guarded by lock

    /**
     * Stores a notification to send at the first opportunity.
     */
    public void append(Notification notification) {
        Objects.requireNonNull(notification, "notification cannot be null");
        synchronized (lock) {
            pending.add(notification);
        }
        log.debug("Notification queued: {}", notification);
    }

    /**
     * Convenience overload of {@link #append(Notification)}.
     */
    public void append(long timestamp, String subject, String body) {
        append(new Notification(timestamp, subject, body));
    }

    /**
     * Removes and returns everything queued so far, in append order.
     *
     * @return the drained notifications, possibly empty
     */
    public List<Notification> drainAll() {
        List<Notification> drained;
        synchronized (lock) {
            if (pending.isEmpty()) {
                return Collections.emptyList();
            }
            drained = pending;
            pending = new ArrayList<>();
        }
        log.debug("Drained {} notification(s)", drained.size());
        return Collections.unmodifiableList(drained);
    }

    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }
}
