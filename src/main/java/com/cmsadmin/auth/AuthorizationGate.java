package com.cmsadmin.auth;

import com.cmsadmin.service.ServiceCoord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a browser may call a given backend method.
 *
 * Fail-closed: only (service, shard, method) triples present in the allow-list pass,
 * everything else, including null input, is denied.
 * The table is fixed at construction, so allow() is pure and deterministic.
 *
 * Server-initiated calls do not go through this gate.
 */
public final class AuthorizationGate {

    private final Set<AllowRule> rules;

    public AuthorizationGate(Collection<AllowRule> rules) {
        this.rules = Collections.unmodifiableSet(new LinkedHashSet<>(rules));
    }

    /**
     * The allow-list of the admin front end, see {@link AdminRpcMethod}.
     */
    public static AuthorizationGate adminDefaults() {
        Builder builder = new Builder();
        for (AdminRpcMethod method : AdminRpcMethod.values()) {
            builder.allow(method.toRule());
        }
        return builder.build();
    }

    /**
     * @param service the service called by the browser
     * @param method the name of the method called
     * @param arguments the arguments of the call (not used by the current policy)
     * @return true if ok, false if not authorized
     */
    public boolean allow(ServiceCoord service, String method, Map<String, ?> arguments) {
        if (service == null || method == null) {
            return false;
        }
        return rules.contains(AllowRule.onShard(service, method))
            || rules.contains(AllowRule.onAnyShard(service.getName(), method));
    }

    public static class Builder {
        private final Set<AllowRule> rules = new LinkedHashSet<>();

        public Builder allow(AllowRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule cannot be null"));
            return this;
        }

        public Builder allow(ServiceCoord coord, String method) {
            return allow(AllowRule.onShard(coord, method));
        }

        public Builder allowOnAnyShard(String service, String method) {
            return allow(AllowRule.onAnyShard(service, method));
        }

        public AuthorizationGate build() {
            return new AuthorizationGate(rules);
        }
    }
}
