package com.cmsadmin.server;

import com.cmsadmin.notification.NotificationQueue;
import com.cmsadmin.rpc.RpcResponse;
import com.cmsadmin.storage.FileStorageClient;
import com.cmsadmin.upload.MultiPartUploader;
import com.cmsadmin.upload.UploadPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Admin actions that upload task files to the store and then record them on the task.
 *
 * The database is touched only after the store confirmed every file of the action;
 * any failure becomes a notification for the admin instead.
 */
public class ContestFileActions {
    private static final Logger log = LoggerFactory.getLogger(ContestFileActions.class);

    static final String INPUT = "input";
    static final String OUTPUT = "output";

    /**
     * Told when an action is over, so the caller can answer the HTTP request.
     */
    @FunctionalInterface
    public interface ActionCallback {
        /**
         * @param stored true if the files were stored and recorded
         */
        void done(boolean stored);
    }

    private final FileStorageClient storage;
    private final MultiPartUploader uploader;
    private final NotificationQueue notifications;
    private final TaskRepository tasks;

    public ContestFileActions(FileStorageClient storage, MultiPartUploader uploader,
                              NotificationQueue notifications, TaskRepository tasks) {
        this.storage = storage;
        this.uploader = uploader;
        this.notifications = notifications;
        this.tasks = tasks;
    }

    /**
     * Stores a task statement, which must be a PDF.
     */
    public void addStatement(long taskId, String taskName, String filename, byte[] data, ActionCallback done) {
        if (filename == null || !filename.endsWith(".pdf")) {
            addNotification("Invalid task statement", "The task statement must be a .pdf file.");
            done.done(false);
            return;
        }
        storeSingle(data, "Task statement for " + taskName, filename,
            "Task statement storage failed",
            digest -> tasks.setStatement(taskId, digest), done);
    }

    public void addAttachment(long taskId, String taskName, String filename, byte[] data, ActionCallback done) {
        storeSingle(data, "Task attachment for " + taskName, filename,
            "Attachment storage failed",
            digest -> tasks.addAttachment(taskId, filename, digest), done);
    }

    public void addManager(long taskId, String taskName, String filename, byte[] data, ActionCallback done) {
        storeSingle(data, "Task manager for " + taskName, filename,
            "Manager storage failed",
            digest -> tasks.addManager(taskId, filename, digest), done);
    }

    /**
     * Stores input and output concurrently; the testcase is recorded only when both are stored.
     */
    public void addTestcase(long taskId, String taskName, byte[] input, byte[] output, boolean isPublic,
                            ActionCallback done) {
        List<UploadPart> parts = List.of(
            new UploadPart(INPUT, input, "Testcase input for task " + taskName),
            new UploadPart(OUTPUT, output, "Testcase output for task " + taskName));

        uploader.storeAll(parts,
            contentIds -> commit("Testcase storage failed",
                () -> recordTestcase(taskId, contentIds, isPublic), done),
            (tag, error) -> {
                addNotification("Testcase storage failed", error);
                done.done(false);
            });
    }

    private void recordTestcase(long taskId, Map<String, String> contentIds, boolean isPublic) {
        tasks.addTestcase(taskId, contentIds.get(INPUT), contentIds.get(OUTPUT), isPublic);
        log.info("[OK] Testcase added to task {}", taskId);
    }

    /**
     * Shared flow of the single-file actions.
     */
    private void storeSingle(byte[] data, String description, String filename, String failureSubject,
                             Consumer<String> record, ActionCallback done) {
        storage.putFile(data, description, response -> onStored(response, failureSubject, record, done), filename);
    }

    private void onStored(RpcResponse response, String failureSubject, Consumer<String> record, ActionCallback done) {
        if (!response.isSuccess()) {
            addNotification(failureSubject, response.getError());
            done.done(false);
            return;
        }
        if (!(response.getResult() instanceof String)) {
            log.error("Store returned {} as content id for {}", response.getResult(), response.getTag());
            addNotification(failureSubject, MultiPartUploader.INVALID_CONTENT_ID);
            done.done(false);
            return;
        }
        String digest = (String) response.getResult();
        commit(failureSubject, () -> record.accept(digest), done);
        log.debug("{} stored as {}", response.getTag(), digest);
    }

    private void commit(String failureSubject, Runnable persist, ActionCallback done) {
        try {
            persist.run();
        } catch (RuntimeException e) {
            log.error("Recording stored files failed: {}", e.getMessage(), e);
            addNotification(failureSubject, "Database error: " + e.getMessage());
            done.done(false);
            return;
        }
        done.done(true);
    }

    private void addNotification(String subject, String text) {
        notifications.append(System.currentTimeMillis() / 1000, subject, text);
    }
}
