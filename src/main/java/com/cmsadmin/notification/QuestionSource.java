package com.cmsadmin.notification;

import java.util.Collections;
import java.util.List;

/**
 * Where unanswered questions come from (the contest database in production).
 */
@FunctionalInterface
public interface QuestionSource {

    /** Source with no questions at all, for deployments without a database. */
    QuestionSource NONE = since -> Collections.emptyList();

    /**
     * @param sinceTimestamp only questions asked strictly after this time (seconds)
     * @return unanswered questions, oldest first
     */
    List<PendingQuestion> unansweredSince(long sinceTimestamp);
}
