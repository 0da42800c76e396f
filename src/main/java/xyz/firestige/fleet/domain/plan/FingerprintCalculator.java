package xyz.firestige.fleet.domain.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceInterface;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.state.ResourceKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内容指纹计算
 * <p>
 * 对资源类型所属的清单片段做规范化 JSON 序列化（键排序、忽略 null）后取 SHA-256。
 * 片段划分保证服务接口中的每个字段只影响一种资源类型：
 * <ul>
 *     <li>container：地址、资源、端口、重启策略、环境变量、卷、供应参数、网络</li>
 *     <li>identity_registration：auth</li>
 *     <li>configuration_applied：config、db、proxy、health</li>
 * </ul>
 */
public class FingerprintCalculator {

    static final String PREFIX = "sha256:";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .defaultPropertyInclusion(JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL))
            .build();

    public String fingerprint(Manifest manifest, ServiceSpec service, ResourceKind kind) {
        return PREFIX + sha256(canonicalJson(fragment(manifest, service, kind)));
    }

    /**
     * 资源类型对应的清单片段
     */
    Map<String, Object> fragment(Manifest manifest, ServiceSpec service, ResourceKind kind) {
        ServiceInterface iface = service.serviceInterface();
        Map<String, Object> fragment = new LinkedHashMap<>();
        switch (kind) {
            case CONTAINER -> {
                fragment.put("ip", service.ip());
                fragment.put("hostname", service.hostname());
                fragment.put("vmid", service.vmid());
                fragment.put("resources", service.resources());
                fragment.put("ports", service.ports());
                fragment.put("restart_policy", service.restartPolicy());
                fragment.put("environment", service.environment());
                fragment.put("volumes", service.volumes());
                fragment.put("terraform", iface.terraform());
                fragment.put("network", manifest.getNetwork());
            }
            case IDENTITY_REGISTRATION -> fragment.put("auth", iface.auth());
            case CONFIGURATION_APPLIED -> {
                fragment.put("config", iface.config());
                fragment.put("db", iface.db());
                fragment.put("proxy", iface.proxy());
                fragment.put("health", iface.health());
            }
        }
        return fragment;
    }

    String canonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("无法序列化指纹片段", e);
        }
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
