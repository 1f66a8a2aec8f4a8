package com.cmsadmin.upload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One multi-part store operation tracked by the UploadJoinCoordinator.
 *
 * State machine: PENDING -> SUCCEEDED (every expected tag stored)
 *                PENDING -> FAILED (first failure of any tag)
 * Both end states are terminal. All transitions happen under the session monitor,
 * so two parts completing at the same time cannot both win.
 */
public final class UploadSession {

    /**
     * Lifecycle state of a session.
     */
    public enum State {
        PENDING,
        SUCCEEDED,
        FAILED
    }

    /**
     * Result of recording a successful part.
     */
    enum Outcome {
        RECORDED,   // stored, other parts still missing
        COMPLETED,  // last missing part, session is now SUCCEEDED
        IGNORED     // session already terminal
    }

    private final String id;
    private final Set<String> expectedTags;
    private final UploadJoinCoordinator.SuccessAction onSuccess;
    private final UploadJoinCoordinator.FailureAction onFailure;

    private final Map<String, String> contentIds = new LinkedHashMap<>();
    private State state = State.PENDING;

    UploadSession(String id, Set<String> expectedTags,
                  UploadJoinCoordinator.SuccessAction onSuccess,
                  UploadJoinCoordinator.FailureAction onFailure) {
        this.id = id;
        this.expectedTags = Collections.unmodifiableSet(new LinkedHashSet<>(expectedTags));
        this.onSuccess = onSuccess;
        this.onFailure = onFailure;
    }

    synchronized Outcome recordSuccess(String tag, String contentId) {
        if (state != State.PENDING) {
            return Outcome.IGNORED;
        }
        checkExpected(tag);
        if (contentIds.containsKey(tag)) {
            throw new InvalidSessionException("Tag '" + tag + "' already reported for session " + id);
        }
        contentIds.put(tag, contentId);
        if (contentIds.size() == expectedTags.size()) {
            state = State.SUCCEEDED;
            return Outcome.COMPLETED;
        }
        return Outcome.RECORDED;
    }

    /**
     * @return true if this call moved the session to FAILED
     */
    synchronized boolean recordFailure(String tag) {
        if (state != State.PENDING) {
            return false;
        }
        checkExpected(tag);
        state = State.FAILED;
        return true;
    }

    private void checkExpected(String tag) {
        if (!expectedTags.contains(tag)) {
            throw new InvalidSessionException("Unexpected tag '" + tag + "' for session " + id
                + ", expected one of " + expectedTags);
        }
    }

    UploadJoinCoordinator.SuccessAction getOnSuccess() {
        return onSuccess;
    }

    UploadJoinCoordinator.FailureAction getOnFailure() {
        return onFailure;
    }

    public String getId() {
        return id;
    }

    public Set<String> getExpectedTags() {
        return expectedTags;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state != State.PENDING;
    }

    /**
     * @return copy of the tag -> content id map of the parts stored so far
     */
    public synchronized Map<String, String> getContentIds() {
        return new LinkedHashMap<>(contentIds);
    }

    @Override
    public synchronized String toString() {
        return String.format("UploadSession[%s: %s, stored=%s of %s]", id, state, contentIds.keySet(), expectedTags);
    }
}
