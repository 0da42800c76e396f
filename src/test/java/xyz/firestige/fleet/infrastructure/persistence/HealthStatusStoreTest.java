package xyz.firestige.fleet.infrastructure.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.fleet.domain.state.HealthSnapshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("HealthStatusStore 单元测试")
class HealthStatusStoreTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("每个服务只保留最近一次结果，并可由新实例读回")
    void keepsLatestPerService() {
        Path file = dir.resolve("deployment-state.health.json");
        HealthStatusStore store = new HealthStatusStore(file);
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");

        store.record(new HealthSnapshot("grafana", false, "exit 1", t0));
        store.record(new HealthSnapshot("grafana", true, "healthy", t0.plusSeconds(30)));
        store.record(new HealthSnapshot("postgresql", true, "healthy", t0));

        Map<String, HealthSnapshot> reloaded = new HealthStatusStore(file).loadAll();
        assertEquals(2, reloaded.size());
        assertTrue(reloaded.get("grafana").healthy());
        assertEquals(t0.plusSeconds(30), reloaded.get("grafana").checkedAt());
    }

    @Test
    @DisplayName("文件损坏时忽略旧内容")
    void ignoresCorruptFile() throws Exception {
        Path file = dir.resolve("broken.health.json");
        Files.writeString(file, "{not json");

        assertTrue(new HealthStatusStore(file).loadAll().isEmpty());
    }

    @Test
    @DisplayName("未指定文件时只保存在内存中")
    void inMemory() {
        HealthStatusStore store = new HealthStatusStore(null);

        store.record(new HealthSnapshot("caddy", true, "healthy", Instant.EPOCH));

        assertEquals(1, store.loadAll().size());
        assertEquals(0, dir.toFile().list().length);
    }
}
