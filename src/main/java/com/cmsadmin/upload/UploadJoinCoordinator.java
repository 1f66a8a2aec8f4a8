package com.cmsadmin.upload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Joins N independent asynchronous store operations into one outcome.
 *
 * Lifecycle:
 *   1. begin() with the set of expected tags, plus the success and failure actions
 *   2. every part reports success (with its content id) or failure
 *   3. when the last part succeeds, the success action runs once with tag -> content id
 *   4. on the first failure, the failure action runs once; later reports are dropped
 *
 * The success action is the only place where an aggregated result may be persisted.
 * Parts stored before a failure are not deleted (the store has no delete verb):
 * they are logged as orphaned and left to the store's deduplication.
 *
 * Thread-safe: reports for the same session may race.
 */
public class UploadJoinCoordinator {
    private static final Logger log = LoggerFactory.getLogger(UploadJoinCoordinator.class);

    /**
     * Callback invoked when every part of a session has been stored.
     */
    @FunctionalInterface
    public interface SuccessAction {
        /**
         * @param contentIds content id of every expected tag
         */
        void onAllStored(Map<String, String> contentIds);
    }

    /**
     * Callback invoked when the first part of a session fails.
     */
    @FunctionalInterface
    public interface FailureAction {
        /**
         * @param tag the part that failed
         * @param error error description reported for that part
         */
        void onFailed(String tag, String error);
    }

    private final AtomicLong sessionIds = new AtomicLong();

    // Live sessions (sessionId -> session), removed once terminal
    private final Map<String, UploadSession> activeSessions = new ConcurrentHashMap<>();

    /**
     * Opens a session.
     *
     * @param expectedTags tags of the parts that must all succeed (e.g. {"input", "output"})
     * @param onSuccess action run once when all parts are stored
     * @param onFailure action run once on the first failure
     * @return the new session handle
     * @throws InvalidSessionException if expectedTags is empty
     */
    public UploadSession begin(Set<String> expectedTags, SuccessAction onSuccess, FailureAction onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess cannot be null");
        Objects.requireNonNull(onFailure, "onFailure cannot be null");
        if (expectedTags == null || expectedTags.isEmpty()) {
            throw new InvalidSessionException("An upload session needs at least one expected tag");
        }

        String sessionId = "upload-" + sessionIds.incrementAndGet();
        UploadSession session = new UploadSession(sessionId, expectedTags, onSuccess, onFailure);
        activeSessions.put(sessionId, session);
        log.debug("Session {} started, expecting {}", sessionId, expectedTags);
        return session;
    }

    /**
     * Records a stored part. Runs the success action if this was the last missing part.
     * No-op if the session is already terminal.
     *
     * @throws InvalidSessionException if tag is not expected or was already reported
     */
    public void reportSuccess(UploadSession session, String tag, String contentId) {
        UploadSession.Outcome outcome = session.recordSuccess(tag, contentId);
        switch (outcome) {
            case IGNORED:
                log.debug("Session {} already {}, ignoring success of '{}'", session.getId(), session.getState(), tag);
                return;
            case RECORDED:
                log.debug("Session {}: part '{}' stored as {}", session.getId(), tag, contentId);
                return;
            case COMPLETED:
                activeSessions.remove(session.getId());
                Map<String, String> contentIds = session.getContentIds();
                log.info("[OK] Session {} complete: {}", session.getId(), contentIds);
                // Outside the session monitor: the action may be slow or call back into us
                session.getOnSuccess().onAllStored(contentIds);
                return;
            default:
                throw new IllegalStateException("Unknown outcome: " + outcome);
        }
    }

    /**
     * Fails the session on its first failure and runs the failure action.
     * No-op if the session is already terminal.
     *
     * @throws InvalidSessionException if tag is not expected
     */
    public void reportFailure(UploadSession session, String tag, String error) {
        if (!session.recordFailure(tag)) {
            log.debug("Session {} already {}, ignoring failure of '{}'", session.getId(), session.getState(), tag);
            return;
        }
        activeSessions.remove(session.getId());

        Map<String, String> orphaned = session.getContentIds();
        log.warn("Session {} failed on '{}': {}", session.getId(), tag, error);
        if (!orphaned.isEmpty()) {
            log.warn("Session {} leaves orphaned content in the store: {}", session.getId(), orphaned);
        }
        session.getOnFailure().onFailed(tag, error);
    }

    public Optional<UploadSession> findSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    /**
     * @return number of sessions that are neither succeeded nor failed
     */
    public int getActiveSessionCount() {
        return activeSessions.size();
    }
}
