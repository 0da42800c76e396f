package xyz.firestige.fleet.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.domain.state.DeploymentState;
import xyz.firestige.fleet.domain.state.DeploymentStateRepository;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.StateStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON 文件部署状态仓储
 * <p>
 * 文档格式：
 * <pre>
 * {"version": 1, "updated_at": "...",
 *  "services": {"postgresql": {"container": {"fingerprint": "sha256:...", "updated_at": "..."}}}}
 * </pre>
 * 读取时兼容没有 version 字段、直接以服务名为键的旧格式。
 */
public class JsonFileDeploymentStateRepository implements DeploymentStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileDeploymentStateRepository.class);

    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileDeploymentStateRepository(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public DeploymentState load() {
        if (!Files.exists(file)) {
            log.info("State file {} not found, starting from empty state", file);
            return DeploymentState.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isMissingNode() || root.isEmpty()) {
                return DeploymentState.empty();
            }
            if (!root.isObject()) {
                throw new StateStoreException("状态文件格式错误: " + file, null);
            }
            JsonNode services = root.has("version") ? root.path("services") : root;
            Instant updatedAt = parseInstant(root.path("updated_at"));
            List<DeploymentRecord> records = readRecords(services);
            log.debug("Loaded {} deployment records from {}", records.size(), file);
            return DeploymentState.of(records, updatedAt);
        } catch (IOException e) {
            throw new StateStoreException("读取状态文件失败: " + file, e);
        }
    }

    private List<DeploymentRecord> readRecords(JsonNode services) {
        List<DeploymentRecord> records = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> serviceIt = services.fields();
        while (serviceIt.hasNext()) {
            Map.Entry<String, JsonNode> serviceEntry = serviceIt.next();
            if (!serviceEntry.getValue().isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> kindIt = serviceEntry.getValue().fields();
            while (kindIt.hasNext()) {
                Map.Entry<String, JsonNode> kindEntry = kindIt.next();
                Optional<ResourceKind> kind = ResourceKind.fromWireName(kindEntry.getKey());
                if (kind.isEmpty()) {
                    log.warn("Ignoring unknown resource kind '{}' for service {}", kindEntry.getKey(), serviceEntry.getKey());
                    continue;
                }
                JsonNode value = kindEntry.getValue();
                String fingerprint = value.isTextual() ? value.asText() : value.path("fingerprint").asText(null);
                if (fingerprint == null) {
                    log.warn("Ignoring record without fingerprint: {}/{}", serviceEntry.getKey(), kindEntry.getKey());
                    continue;
                }
                records.add(new DeploymentRecord(serviceEntry.getKey(), kind.get(), fingerprint,
                        parseInstant(value.path("updated_at"))));
            }
        }
        return records;
    }

    private static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.warn("Unparseable timestamp in state file: {}", node.asText());
            return null;
        }
    }

    @Override
    public void save(DeploymentState state) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", FORMAT_VERSION);
        root.put("updated_at", (state.getUpdatedAt() == null ? Instant.now() : state.getUpdatedAt()).toString());
        ObjectNode services = root.putObject("services");
        for (String service : state.services()) {
            ObjectNode kinds = services.putObject(service);
            state.recordsOf(service).forEach((kind, record) -> {
                ObjectNode entry = kinds.putObject(kind.getWireName());
                entry.put("fingerprint", record.fingerprint());
                if (record.updatedAt() != null) {
                    entry.put("updated_at", record.updatedAt().toString());
                }
            });
        }
        try {
            AtomicFileWriter.write(file, objectMapper.writeValueAsBytes(root));
        } catch (IOException e) {
            throw new StateStoreException("写入状态文件失败: " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
