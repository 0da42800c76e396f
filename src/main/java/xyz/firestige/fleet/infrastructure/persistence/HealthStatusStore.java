package xyz.firestige.fleet.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.state.HealthSnapshot;
import xyz.firestige.fleet.exception.StateStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * 最近一次健康检查结果的存储，供 status 命令展示
 * <p>
 * file 为 null 时只保存在内存中
 */
public class HealthStatusStore {

    private static final Logger log = LoggerFactory.getLogger(HealthStatusStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, HealthSnapshot> snapshots = new TreeMap<>();
    private boolean loaded;

    public HealthStatusStore(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public synchronized void record(HealthSnapshot snapshot) {
        ensureLoaded();
        snapshots.put(snapshot.service(), snapshot);
        if (file == null) {
            return;
        }
        try {
            AtomicFileWriter.write(file, objectMapper.writeValueAsBytes(snapshots));
        } catch (IOException e) {
            throw new StateStoreException("写入健康状态文件失败: " + file, e);
        }
    }

    public synchronized Map<String, HealthSnapshot> loadAll() {
        ensureLoaded();
        return Map.copyOf(snapshots);
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        loaded = true;
        if (file == null || !Files.exists(file)) {
            return;
        }
        try {
            snapshots.putAll(objectMapper.readValue(file.toFile(), new TypeReference<Map<String, HealthSnapshot>>() {
            }));
        } catch (IOException e) {
            log.warn("Failed to read health status file {}, ignoring: {}", file, e.getMessage());
        }
    }
}
