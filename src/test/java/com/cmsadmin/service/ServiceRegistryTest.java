package com.cmsadmin.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRegistryTest {

    private final ServiceRegistry registry = new ServiceRegistry.Builder()
        .add("EvaluationService", new ServiceAddress("localhost", 25000))
        .add("ResourceService", new ServiceAddress("10.0.0.1", 28000))
        .add("ResourceService", new ServiceAddress("10.0.0.2", 28001))
        .build();

    @Test
    void shardsAreNumberedInInsertionOrder() throws Exception {
        assertThat(registry.shardCount("ResourceService")).isEqualTo(2);
        assertThat(registry.address(new ServiceCoord("ResourceService", 0)))
            .isEqualTo(new ServiceAddress("10.0.0.1", 28000));
        assertThat(registry.address(new ServiceCoord("ResourceService", 1)))
            .isEqualTo(new ServiceAddress("10.0.0.2", 28001));
    }

    @Test
    void unknownServiceIsReported() {
        assertThatThrownBy(() -> registry.shardCount("Scoring"))
            .isInstanceOf(UnknownServiceException.class)
            .hasMessageContaining("Scoring");
        assertThatThrownBy(() -> registry.address(new ServiceCoord("Scoring", 0)))
            .isInstanceOf(UnknownServiceException.class);
        assertThat(registry.shardCountOrZero("Scoring")).isZero();
    }

    @Test
    void shardOutOfRangeIsReported() {
        assertThatThrownBy(() -> registry.address(new ServiceCoord("EvaluationService", 1)))
            .isInstanceOf(UnknownServiceException.class)
            .hasMessage("Service EvaluationService has 1 shard(s), shard 1 does not exist");
    }

    @Test
    void registryIsNotAffectedByLaterBuilderCalls() throws Exception {
        ServiceRegistry.Builder builder = new ServiceRegistry.Builder()
            .add("LogService", new ServiceAddress("localhost", 29000));
        ServiceRegistry built = builder.build();

        builder.add("LogService", new ServiceAddress("localhost", 29001));

        assertThat(built.shardCount("LogService")).isEqualTo(1);
        assertThat(built.serviceNames()).containsExactly("LogService");
    }

    @Test
    void coordinatesAreValuesAndRejectBadInput() {
        assertThat(new ServiceCoord("LogService", 0)).isEqualTo(new ServiceCoord("LogService", 0));
        assertThat(new ServiceCoord("LogService", 0)).isNotEqualTo(new ServiceCoord("LogService", 1));
        assertThat(new ServiceCoord("LogService", 0).toString()).isEqualTo("LogService,0");

        assertThatThrownBy(() -> new ServiceCoord("LogService", -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServiceCoord(" ", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServiceAddress("localhost", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
