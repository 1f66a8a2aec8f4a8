package com.cmsadmin.auth;

import com.cmsadmin.service.ServiceCoord;

/**
 * Backend methods the admin pages may call from the browser.
 * Anything not listed here is unreachable from an untrusted caller.
 */
public enum AdminRpcMethod {
    SUBMISSIONS_STATUS("EvaluationService", 0, "submissions_status"),
    QUEUE_STATUS("EvaluationService", 0, "queue_status"),
    WORKERS_STATUS("EvaluationService", 0, "workers_status"),
    LAST_MESSAGES("LogService", 0, "last_messages"),
    GET_RESOURCES("ResourceService", AllowRule.ANY_SHARD, "get_resources"),
    KILL_SERVICE("ResourceService", AllowRule.ANY_SHARD, "kill_service");

    private final String service;
    private final int shard;
    private final String methodName;

    AdminRpcMethod(String service, int shard, String methodName) {
        this.service = service;
        this.shard = shard;
        this.methodName = methodName;
    }

    public String getService() {
        return service;
    }

    public String getMethodName() {
        return methodName;
    }

    public AllowRule toRule() {
        return shard == AllowRule.ANY_SHARD
            ? AllowRule.onAnyShard(service, methodName)
            : AllowRule.onShard(new ServiceCoord(service, shard), methodName);
    }
}
