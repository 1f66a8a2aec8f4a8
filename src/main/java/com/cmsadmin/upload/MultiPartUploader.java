package com.cmsadmin.upload;

import com.cmsadmin.rpc.RpcResponse;
import com.cmsadmin.storage.FileStorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stores several files concurrently and commits only when all of them are stored.
 * Each part becomes one put_file call whose outcome is reported to the join coordinator.
 */
public class MultiPartUploader {
    private static final Logger log = LoggerFactory.getLogger(MultiPartUploader.class);

    public static final String INVALID_CONTENT_ID = "Invalid content id";

    private final FileStorageClient storage;
    private final UploadJoinCoordinator coordinator;

    public MultiPartUploader(FileStorageClient storage, UploadJoinCoordinator coordinator) {
        this.storage = storage;
        this.coordinator = coordinator;
    }

    /**
     * Issues one store call per part.
     *
     * @param parts parts to store, tags must be distinct
     * @param onSuccess runs once with tag -> content id when every part is stored
     * @param onFailure runs once on the first part that fails
     * @return the session tracking this upload
     * @throws InvalidSessionException if parts is empty or has duplicate tags
     */
    public UploadSession storeAll(List<UploadPart> parts,
                                  UploadJoinCoordinator.SuccessAction onSuccess,
                                  UploadJoinCoordinator.FailureAction onFailure) {
        Set<String> tags = new LinkedHashSet<>();
        for (UploadPart part : parts) {
            if (!tags.add(part.getTag())) {
                throw new InvalidSessionException("Duplicate part tag '" + part.getTag() + "'");
            }
        }

        UploadSession session = coordinator.begin(tags, onSuccess, onFailure);
        log.debug("Storing {} part(s) for session {}", parts.size(), session.getId());

        for (UploadPart part : parts) {
            // A part that fails synchronously is reported through the same callback,
            // so the return value needs no handling here.
            storage.putFile(part.getData(), part.getDescription(),
                response -> onStored(session, response), part.getTag());
        }
        return session;
    }

    private void onStored(UploadSession session, RpcResponse response) {
        String tag = (String) response.getTag();
        if (!response.isSuccess()) {
            coordinator.reportFailure(session, tag, response.getError());
        } else if (response.getResult() instanceof String) {
            coordinator.reportSuccess(session, tag, (String) response.getResult());
        } else {
            log.error("Store returned {} as content id for part '{}' of session {}",
                response.getResult(), tag, session.getId());
            coordinator.reportFailure(session, tag, INVALID_CONTENT_ID);
        }
    }
}
