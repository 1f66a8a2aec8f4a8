package com.cmsadmin.server;

import com.cmsadmin.auth.AuthorizationGate;
import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.notification.NotificationPoller;
import com.cmsadmin.notification.NotificationQueue;
import com.cmsadmin.notification.QuestionSource;
import com.cmsadmin.rpc.EventLoop;
import com.cmsadmin.rpc.RmiServiceLocator;
import com.cmsadmin.rpc.RpcClient;
import com.cmsadmin.rpc.ServiceLocator;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;
import com.cmsadmin.service.ServiceRegistry;
import com.cmsadmin.service.UnknownServiceException;
import com.cmsadmin.storage.FileStorageClient;
import com.cmsadmin.upload.MultiPartUploader;
import com.cmsadmin.upload.UploadJoinCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The admin front end service: owns every coordination component and wires them together.
 *
 * One instance per process. The notification queue, the join coordinator and the
 * RPC channels live as long as this object and are handed to whoever needs them.
 */
public class AdminService {
    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    public static final String SERVICE_NAME = "AdminWebServer";
    public static final ServiceCoord EVALUATION_SERVICE = new ServiceCoord("EvaluationService", 0);
    public static final ServiceCoord LOG_SERVICE = new ServiceCoord("LogService", 0);
    public static final String RESOURCE_SERVICE = "ResourceService";

    private final ServiceCoord coord;
    private final AdminConfig config;
    private final EventLoop eventLoop;
    private final RpcClient rpcClient;
    private final BrowserRpcProxy browserProxy;
    private final UploadJoinCoordinator uploadCoordinator;
    private final NotificationQueue notifications;
    private final NotificationPoller poller;
    private final FileStorageClient storage;
    private final MultiPartUploader uploader;

    /**
     * Creates the service, talking RMI to the backends.
     * @param shard shard index of this admin instance
     * @param config addressing and timing configuration
     * @param questionSource unanswered questions folded into every poll
     */
    public AdminService(int shard, AdminConfig config, QuestionSource questionSource) {
        this(shard, config, new RmiServiceLocator(), questionSource);
    }

    public AdminService(int shard, AdminConfig config, ServiceLocator locator, QuestionSource questionSource) {
        this.coord = new ServiceCoord(SERVICE_NAME, shard);
        this.config = config;
        this.eventLoop = new EventLoop(coord.toString());
        this.rpcClient = new RpcClient(config, locator, eventLoop);
        this.browserProxy = new BrowserRpcProxy(AuthorizationGate.adminDefaults(), rpcClient);
        this.uploadCoordinator = new UploadJoinCoordinator();
        this.notifications = new NotificationQueue();
        this.poller = new NotificationPoller(notifications, questionSource);
        this.storage = new FileStorageClient(rpcClient);
        this.uploader = new MultiPartUploader(storage, uploadCoordinator);
        log.debug("{} created with {}", coord, config);
    }

    /**
     * Opens the channels to the backends the admin pages use.
     * Unreachable services keep reconnecting in background; unconfigured ones are skipped.
     */
    public void start() {
        connect(EVALUATION_SERVICE);
        ServiceRegistry registry = config.getServiceRegistry();
        for (int shard = 0; shard < registry.shardCountOrZero(RESOURCE_SERVICE); shard++) {
            connect(new ServiceCoord(RESOURCE_SERVICE, shard));
        }
        connect(LOG_SERVICE);
        connect(storage.getCoord());
        log.info("[OK] {} started", coord);
    }

    private void connect(ServiceCoord target) {
        try {
            rpcClient.connectTo(target);
        } catch (UnknownServiceException e) {
            log.warn("{} not configured, skipping: {}", target, e.getMessage());
        }
    }

    /**
     * Stores a new notification to send at the first poll.
     * @param timestamp the time of the notification (seconds)
     * @param subject subject of the notification
     * @param text body of the notification
     */
    public void addNotification(long timestamp, String subject, String text) {
        notifications.append(timestamp, subject, text);
    }

    /**
     * @return host of every ResourceService shard, by shard index
     */
    public Map<Integer, String> resourceAddresses() {
        Map<Integer, String> addresses = new LinkedHashMap<>();
        ServiceRegistry registry = config.getServiceRegistry();
        for (int shard = 0; shard < registry.shardCountOrZero(RESOURCE_SERVICE); shard++) {
            try {
                ServiceAddress address = registry.address(new ServiceCoord(RESOURCE_SERVICE, shard));
                addresses.put(shard, address.getHost());
            } catch (UnknownServiceException e) {
                // Cannot happen while shard < shardCount; log in case the registry changes shape
                log.error("Shard {} of {} vanished: {}", shard, RESOURCE_SERVICE, e.getMessage());
            }
        }
        return Collections.unmodifiableMap(addresses);
    }

    /**
     * Asks the evaluation service to evaluate submissions again.
     * Trusted calls: they do not pass through the authorization gate.
     * A failed request is reported as a notification.
     *
     * @param submissionIds submissions already invalidated in the database
     */
    public void reevaluateSubmissions(List<Long> submissionIds) {
        for (Long submissionId : submissionIds) {
            Map<String, Serializable> args = Collections.singletonMap("submission_id", submissionId);
            rpcClient.invoke(EVALUATION_SERVICE, "new_submission", args, response -> {
                if (!response.isSuccess()) {
                    addNotification(System.currentTimeMillis() / 1000,
                        "Reevaluation request failed",
                        "Submission " + response.getTag() + ": " + response.getError());
                }
            }, submissionId);
        }
        log.info("Reevaluation requested for {} submission(s)", submissionIds.size());
    }

    /**
     * Creates the upload actions bound to a task database.
     */
    public ContestFileActions fileActions(TaskRepository tasks) {
        return new ContestFileActions(storage, uploader, notifications, tasks);
    }

    public ServiceCoord getCoord() {
        return coord;
    }

    public RpcClient getRpcClient() {
        return rpcClient;
    }

    public BrowserRpcProxy getBrowserProxy() {
        return browserProxy;
    }

    public UploadJoinCoordinator getUploadCoordinator() {
        return uploadCoordinator;
    }

    public NotificationQueue getNotifications() {
        return notifications;
    }

    public NotificationPoller getPoller() {
        return poller;
    }

    public FileStorageClient getStorage() {
        return storage;
    }

    /**
     * Closes every channel and stops the event loop.
     */
    public void shutdown() {
        log.info("Shutting down {}...", coord);
        rpcClient.shutdown();
        eventLoop.shutdown();
        log.info("[OK] {} shut down cleanly", coord);
    }
}
