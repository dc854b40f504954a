package com.kubelab.api.infrastructure.system;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SystemStatsProvider")
class SystemStatsProviderTest {

    private final SystemStatsProvider stats = new SystemStatsProvider();

    @Test
    @DisplayName("instance ID is hostname and pid")
    void instanceId() {
        assertThat(stats.instanceId())
                .isEqualTo(stats.hostname() + "-" + ProcessHandle.current().pid());
    }

    @Test
    @DisplayName("reports host facts")
    void hostFacts() {
        assertThat(stats.hostname()).isNotBlank();
        assertThat(stats.platform()).contains(System.getProperty("os.name"));
        assertThat(stats.javaVersion()).startsWith(String.valueOf(Runtime.version().feature()));
        assertThat(stats.cpuCount()).isPositive();
        assertThat(stats.cpuPercent()).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("memory snapshot is internally consistent")
    void memorySnapshot() {
        var memory = stats.memory();

        assertThat(memory.used()).isEqualTo(Math.max(0, memory.total() - memory.free()));
        assertThat(memory.available()).isEqualTo(memory.free());
        assertThat(memory.percent()).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("derives used and percent from total and free")
    void snapshotArithmetic() {
        var snapshot = SystemStatsProvider.MemorySnapshot.of(1000, 250);

        assertThat(snapshot.used()).isEqualTo(750);
        assertThat(snapshot.percent()).isEqualTo(75.0);
        assertThat(SystemStatsProvider.MemorySnapshot.of(0, 0).percent()).isZero();
    }

    @Test
    @DisplayName("disk usage is a percentage of the root filesystem")
    void diskUsage() {
        assertThat(stats.diskUsagePercent()).isNotNull().isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("disk usage is null when the path cannot be read")
    void diskUsageUnavailable() {
        var missing = new SystemStatsProvider(new File("/definitely/not/a/mount/point"));

        assertThat(missing.diskUsagePercent()).isNull();
    }
}
