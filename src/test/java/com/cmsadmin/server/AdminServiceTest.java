package com.cmsadmin.server;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.config.AdminConfigLoader;
import com.cmsadmin.notification.Notification;
import com.cmsadmin.notification.PendingQuestion;
import com.cmsadmin.notification.PollEntry;
import com.cmsadmin.rmi.RpcReply;
import com.cmsadmin.rmi.RpcRequest;
import com.cmsadmin.rpc.FakeRemoteService;
import com.cmsadmin.rpc.FakeServiceLocator;
import com.cmsadmin.rpc.ResponseCollector;
import com.cmsadmin.rpc.RpcResponse;
import com.cmsadmin.service.ServiceCoord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AdminServiceTest {

    private final FakeServiceLocator locator = new FakeServiceLocator();
    private final List<RpcRequest> evaluationRequests = new CopyOnWriteArrayList<>();
    private final FakeRemoteService evaluation = new FakeRemoteService(request -> {
        evaluationRequests.add(request);
        return RpcReply.success(request.getCallId(), request.getMethod());
    });
    private AdminService service;

    @BeforeEach
    void setUp() throws Exception {
        AdminConfig config;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("test-config.json")) {
            config = AdminConfigLoader.parse(in);
        }
        locator.register(AdminService.EVALUATION_SERVICE, evaluation);
        service = new AdminService(0, config, locator,
            since -> List.of(new PendingQuestion(since + 1, "Task sum", "Are inputs sorted?")));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    /**
     * Collects drained notifications until the expected count arrives or five seconds pass.
     */
    private List<Notification> awaitNotifications(int expected) throws InterruptedException {
        List<Notification> collected = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 5_000;
        while (collected.size() < expected && System.currentTimeMillis() < deadline) {
            collected.addAll(service.getNotifications().drainAll());
            Thread.sleep(10);
        }
        return collected;
    }

    @Test
    void startConnectsToReachableBackends() throws Exception {
        service.start();

        assertThat(service.getRpcClient().connectTo(AdminService.EVALUATION_SERVICE).isConnected()).isTrue();
        assertThat(service.getRpcClient().connectTo(AdminService.LOG_SERVICE).isConnected()).isFalse();
        assertThat(service.getCoord()).isEqualTo(new ServiceCoord("AdminWebServer", 0));
    }

    @Test
    void listsResourceServiceHostsByShard() {
        assertThat(service.resourceAddresses()).containsExactly(entry(0, "10.0.0.1"), entry(1, "10.0.0.2"));
    }

    @Test
    void browserCallOutsideTheAllowListNeverReachesTheBackend() throws Exception {
        ResponseCollector responses = new ResponseCollector();

        boolean sent = service.getBrowserProxy().call(AdminService.EVALUATION_SERVICE, "shutdown",
            Map.of(), responses, "page-1");

        assertThat(sent).isFalse();
        RpcResponse response = responses.next();
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).isEqualTo(BrowserRpcProxy.UNAUTHORIZED);
        assertThat(response.getTag()).isEqualTo("page-1");
        assertThat(evaluation.getInvocations()).isZero();
    }

    @Test
    void allowedBrowserCallIsForwarded() throws Exception {
        ResponseCollector responses = new ResponseCollector();

        boolean sent = service.getBrowserProxy().call(AdminService.EVALUATION_SERVICE, "queue_status",
            Map.of(), responses, "page-2");

        assertThat(sent).isTrue();
        RpcResponse response = responses.next();
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResult()).isEqualTo("queue_status");
        assertThat(evaluation.getInvocations()).isEqualTo(1);
    }

    @Test
    void reevaluationSendsOneRequestPerSubmission() throws Exception {
        service.reevaluateSubmissions(List.of(7L, 8L));

        long deadline = System.currentTimeMillis() + 5_000;
        while (evaluationRequests.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(evaluationRequests).extracting(RpcRequest::getMethod).containsOnly("new_submission");
        assertThat(evaluationRequests).extracting(r -> r.argument("submission_id", Long.class))
            .containsExactlyInAnyOrder(7L, 8L);
        Thread.sleep(200);
        assertThat(service.getNotifications().drainAll()).isEmpty();
    }

    @Test
    void failedReevaluationBecomesANotification() throws Exception {
        evaluation.setHandler(request -> RpcReply.failure(request.getCallId(), "queue full"));

        service.reevaluateSubmissions(List.of(7L));

        List<Notification> notifications = awaitNotifications(1);
        assertThat(notifications).extracting(Notification::getSubject).containsExactly("Reevaluation request failed");
        assertThat(notifications.get(0).getBody()).isEqualTo("Submission 7: queue full");
    }

    @Test
    void pollReturnsQuestionsThenQueuedNotifications() {
        service.addNotification(100, "Manager storage failed", "timeout");

        List<PollEntry> entries = service.getPoller().poll(50);

        assertThat(entries).extracting(PollEntry::getType)
            .containsExactly(PollEntry.TYPE_NEW_QUESTION, PollEntry.TYPE_NOTIFICATION);
        assertThat(entries.get(0).getTimestamp()).isEqualTo(51);
        assertThat(service.getPoller().poll(50)).hasSize(1);
    }

    @Test
    void argumentsTravelUnchanged() throws Exception {
        ResponseCollector responses = new ResponseCollector();
        Map<String, Serializable> args = Map.of("page", 2);

        service.getBrowserProxy().call(AdminService.EVALUATION_SERVICE, "submissions_status", args, responses, null);

        assertThat(responses.next().isSuccess()).isTrue();
        assertThat(evaluationRequests.get(0).getArguments()).containsEntry("page", 2);
    }
}
