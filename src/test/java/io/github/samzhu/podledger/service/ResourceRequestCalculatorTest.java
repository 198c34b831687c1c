package io.github.samzhu.podledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.podledger.dto.ContainerRequests;
import io.github.samzhu.podledger.dto.ResourceRequest;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.exception.ResourceQuantityParseException;

class ResourceRequestCalculatorTest {

    private final ResourceRequestCalculator calculator = new ResourceRequestCalculator();

    @Test
    void shouldSumMainContainers() {
        // Given: 兩個主容器同時執行
        WorkloadInstance instance = instance(
            List.of(),
            List.of(new ContainerRequests("500m", "1Gi", "1"), new ContainerRequests("250m", "512Mi", "1")));

        // When
        ResourceRequest request = calculator.calculate(instance);

        // Then
        assertThat(request.cpu()).isEqualByComparingTo("0.75");
        assertThat(request.memory()).isEqualByComparingTo("1610612736");
        assertThat(request.accelerator()).isEqualByComparingTo("2");
    }

    @Test
    void shouldUseInitPeakWhenLargerThanMainSum() {
        // Given: init 容器依序執行，只取最大值；CPU 峰值大於主容器總和，記憶體則相反
        WorkloadInstance instance = instance(
            List.of(new ContainerRequests("2", "256Mi", null), new ContainerRequests("1", "128Mi", null)),
            List.of(new ContainerRequests("500m", "1Gi", null), new ContainerRequests("500m", "1Gi", null)));

        // When
        ResourceRequest request = calculator.calculate(instance);

        // Then
        assertThat(request.cpu()).isEqualByComparingTo("2");
        assertThat(request.memory()).isEqualByComparingTo("2147483648");
        assertThat(request.accelerator()).isEqualByComparingTo("0");
    }

    @Test
    void shouldTreatMissingRequestsAsZero() {
        WorkloadInstance instance = instance(List.of(), List.of(ContainerRequests.none()));

        assertThat(calculator.calculate(instance)).satisfies(r -> {
            assertThat(r.cpu()).isEqualByComparingTo("0");
            assertThat(r.memory()).isEqualByComparingTo("0");
            assertThat(r.accelerator()).isEqualByComparingTo("0");
        });
    }

    @Test
    void shouldReturnZeroForPodWithoutContainers() {
        ResourceRequest request = calculator.calculate(instance(List.of(), List.of()));

        assertThat(request).isSameAs(ResourceRequest.ZERO);
        assertThat(request.cpu()).isEqualByComparingTo("0");
        assertThat(request.memory()).isEqualByComparingTo("0");
    }

    @Test
    void shouldPropagateParseError() {
        WorkloadInstance instance = instance(List.of(), List.of(new ContainerRequests("lots", null, null)));

        assertThatThrownBy(() -> calculator.calculate(instance))
            .isInstanceOf(ResourceQuantityParseException.class)
            .hasMessageContaining("lots");
    }

    private WorkloadInstance instance(List<ContainerRequests> init, List<ContainerRequests> main) {
        return new WorkloadInstance("uid-1", "team-a", "pod-1", "node-1", "Running", null, init, main, List.of());
    }
}
