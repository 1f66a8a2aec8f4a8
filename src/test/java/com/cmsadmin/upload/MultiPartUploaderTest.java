package com.cmsadmin.upload;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.rmi.RpcReply;
import com.cmsadmin.rpc.EventLoop;
import com.cmsadmin.rpc.FakeRemoteService;
import com.cmsadmin.rpc.FakeServiceLocator;
import com.cmsadmin.rpc.RpcClient;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;
import com.cmsadmin.service.ServiceRegistry;
import com.cmsadmin.storage.FileStorageClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiPartUploaderTest {

    private static final ServiceCoord STORAGE = new ServiceCoord(FileStorageClient.SERVICE_NAME, 0);

    private final FakeServiceLocator locator = new FakeServiceLocator();
    private final BlockingQueue<Object> outcomes = new LinkedBlockingQueue<>();
    private EventLoop eventLoop;
    private RpcClient rpcClient;
    private MultiPartUploader uploader;

    @BeforeEach
    void setUp() {
        AdminConfig config = new AdminConfig.Builder()
            .serviceRegistry(new ServiceRegistry.Builder()
                .add(FileStorageClient.SERVICE_NAME, new ServiceAddress("localhost", 28500))
                .build())
            .rpcTimeoutMs(1000)
            .build();
        eventLoop = new EventLoop("upload-test");
        rpcClient = new RpcClient(config, locator, eventLoop);
        uploader = new MultiPartUploader(new FileStorageClient(rpcClient), new UploadJoinCoordinator());
    }

    @AfterEach
    void tearDown() {
        rpcClient.shutdown();
        eventLoop.shutdown();
    }

    /**
     * Stores content under "digest-" + content, or fails for content "FAIL".
     */
    private static FakeRemoteService storeService() {
        return new FakeRemoteService(request -> {
            String content = new String(request.argument("binary_data", byte[].class), StandardCharsets.UTF_8);
            if (content.equals("FAIL")) {
                return RpcReply.failure(request.getCallId(), "disk full");
            }
            return RpcReply.success(request.getCallId(), "digest-" + content);
        });
    }

    private static UploadPart part(String tag, String content) {
        return new UploadPart(tag, content.getBytes(StandardCharsets.UTF_8), tag + " file");
    }

    @Test
    void commitsOnceWithEveryContentId() throws Exception {
        locator.register(STORAGE, storeService());

        uploader.storeAll(List.of(part("input", "1 2"), part("output", "3")),
            outcomes::add,
            (tag, error) -> outcomes.add("failed " + tag));

        assertThat(outcomes.poll(5, TimeUnit.SECONDS))
            .isEqualTo(Map.of("input", "digest-1 2", "output", "digest-3"));
        assertThat(outcomes.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void oneFailedPartFailsTheWholeUpload() throws Exception {
        locator.register(STORAGE, storeService());

        UploadSession session = uploader.storeAll(List.of(part("input", "1 2"), part("output", "FAIL")),
            outcomes::add,
            (tag, error) -> outcomes.add(tag + ": " + error));

        assertThat(outcomes.poll(5, TimeUnit.SECONDS)).isEqualTo("output: disk full");
        assertThat(outcomes.poll(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(session.getState()).isEqualTo(UploadSession.State.FAILED);
    }

    @Test
    void unreachableStoreFailsOnce() throws Exception {
        // nothing registered: every connection is refused

        uploader.storeAll(List.of(part("input", "a"), part("output", "b")),
            outcomes::add,
            (tag, error) -> outcomes.add(error));

        assertThat(outcomes.poll(5, TimeUnit.SECONDS)).isEqualTo("Connection failed.");
        assertThat(outcomes.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void nonStringContentIdFailsTheUpload() throws Exception {
        locator.register(STORAGE, new FakeRemoteService(request -> {
            String content = new String(request.argument("binary_data", byte[].class), StandardCharsets.UTF_8);
            return RpcReply.success(request.getCallId(), content.equals("3") ? Integer.valueOf(3) : "digest-" + content);
        }));

        UploadSession session = uploader.storeAll(List.of(part("input", "1 2"), part("output", "3")),
            outcomes::add,
            (tag, error) -> outcomes.add(tag + ": " + error));

        assertThat(outcomes.poll(5, TimeUnit.SECONDS)).isEqualTo("output: " + MultiPartUploader.INVALID_CONTENT_ID);
        assertThat(outcomes.poll(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(session.getState()).isEqualTo(UploadSession.State.FAILED);
    }

    @Test
    void duplicatePartTagsAreRejected() {
        assertThatThrownBy(() -> uploader.storeAll(List.of(part("input", "a"), part("input", "b")),
            outcomes::add, (tag, error) -> outcomes.add(error)))
            .isInstanceOf(InvalidSessionException.class);
    }
}
