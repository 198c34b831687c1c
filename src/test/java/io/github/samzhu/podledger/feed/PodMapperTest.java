package io.github.samzhu.podledger.feed;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.github.samzhu.podledger.config.PodLedgerProperties;
import io.github.samzhu.podledger.dto.ContainerRequests;
import io.github.samzhu.podledger.dto.WorkloadInstance;

class PodMapperTest {

    private final PodMapper mapper = new PodMapper(PodLedgerProperties.defaults());

    @Test
    void shouldMapFinishedPod() {
        // Given
        Pod pod = new PodBuilder()
            .withNewMetadata()
                .withUid("u1").withNamespace("team-a").withName("trainer").withResourceVersion("42")
            .endMetadata()
            .withNewSpec()
                .withNodeName("node-1")
                .addNewInitContainer()
                    .withName("fetch")
                    .withNewResources().addToRequests("cpu", new Quantity("2")).endResources()
                .endInitContainer()
                .addNewContainer()
                    .withName("main")
                    .withNewResources()
                        .addToRequests("cpu", new Quantity("500m"))
                        .addToRequests("memory", new Quantity("1Gi"))
                        .addToRequests("nvidia.com/gpu", new Quantity("1"))
                    .endResources()
                .endContainer()
                .addNewContainer().withName("sidecar").endContainer()
            .endSpec()
            .withNewStatus()
                .withPhase("Succeeded")
                .withStartTime("2025-06-01T10:00:00Z")
                .addNewInitContainerStatus()
                    .withName("fetch")
                    .withNewState().withNewTerminated().withExitCode(0)
                        .withFinishedAt("2025-06-01T10:02:00Z").endTerminated().endState()
                .endInitContainerStatus()
                .addNewContainerStatus()
                    .withName("main")
                    .withNewState().withNewTerminated().withExitCode(0)
                        .withFinishedAt("2025-06-01T11:30:00Z").endTerminated().endState()
                .endContainerStatus()
                .addNewContainerStatus()
                    .withName("sidecar")
                    .withNewState().withNewRunning().endRunning().endState()
                .endContainerStatus()
            .endStatus()
            .build();

        // When
        WorkloadInstance instance = mapper.toInstance(pod);

        // Then
        assertThat(instance.uid()).isEqualTo("u1");
        assertThat(instance.displayName()).isEqualTo("team-a/trainer");
        assertThat(instance.node()).contains("node-1");
        assertThat(instance.phase()).isEqualTo("Succeeded");
        assertThat(instance.startTime()).contains(Instant.parse("2025-06-01T10:00:00Z"));
        assertThat(instance.initContainers()).containsExactly(new ContainerRequests("2", null, null));
        assertThat(instance.containers()).containsExactly(
            new ContainerRequests("500m", "1Gi", "1"),
            ContainerRequests.none());
        assertThat(instance.terminatedAt()).containsExactlyInAnyOrder(
            Instant.parse("2025-06-01T10:02:00Z"), Instant.parse("2025-06-01T11:30:00Z"));
        assertThat(instance.latestTerminatedAt()).contains(Instant.parse("2025-06-01T11:30:00Z"));
    }

    @Test
    void shouldMapPendingPodWithoutStatusDetails() {
        Pod pod = new PodBuilder()
            .withNewMetadata().withUid("u2").withNamespace("team-a").withName("queued").endMetadata()
            .withNewSpec().addNewContainer().withName("main").endContainer().endSpec()
            .withNewStatus().withPhase("Pending").endStatus()
            .build();

        WorkloadInstance instance = mapper.toInstance(pod);

        assertThat(instance.node()).isEmpty();
        assertThat(instance.startTime()).isEmpty();
        assertThat(instance.terminatedAt()).isEmpty();
        assertThat(instance.containers()).hasSize(1);
    }

    @Test
    void shouldUseConfiguredAcceleratorName() {
        PodMapper amd = new PodMapper(new PodLedgerProperties(null, null, null,
            new PodLedgerProperties.ResourceConfig("amd.com/gpu")));
        Pod pod = new PodBuilder()
            .withNewMetadata().withUid("u3").withNamespace("team-a").withName("rocm").endMetadata()
            .withNewSpec()
                .addNewContainer().withName("main")
                    .withNewResources()
                        .addToRequests("amd.com/gpu", new Quantity("2"))
                        .addToRequests("nvidia.com/gpu", new Quantity("1"))
                    .endResources()
                .endContainer()
            .endSpec()
            .build();

        List<ContainerRequests> containers = amd.toInstance(pod).containers();

        assertThat(containers).containsExactly(new ContainerRequests(null, null, "2"));
    }

    @Test
    void shouldParseOffsetTimestamps() {
        assertThat(PodMapper.parseTimestamp("2025-06-01T18:00:00+08:00"))
            .isEqualTo(Instant.parse("2025-06-01T10:00:00Z"));
        assertThat(PodMapper.parseTimestamp(null)).isNull();
    }
}
