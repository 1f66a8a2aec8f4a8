package com.cmsadmin.server;

/**
 * Persistence of task files, implemented on top of the contest database.
 * Each method commits one change; digests are content ids returned by the file store.
 */
public interface TaskRepository {

    void setStatement(long taskId, String digest);

    void addAttachment(long taskId, String filename, String digest);

    void addManager(long taskId, String filename, String digest);

    /**
     * Appends a testcase to the task; its number is the task's current testcase count.
     */
    void addTestcase(long taskId, String inputDigest, String outputDigest, boolean isPublic);
}
