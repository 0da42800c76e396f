package xyz.firestige.fleet.infrastructure.manifest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.fleet.domain.manifest.AuthFacet;
import xyz.firestige.fleet.domain.manifest.AuthType;
import xyz.firestige.fleet.domain.manifest.DbFacet;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.manifest.HealthFacet;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.NetworkSpec;
import xyz.firestige.fleet.domain.manifest.OrchestrationDefaults;
import xyz.firestige.fleet.domain.manifest.PhaseAssignments;
import xyz.firestige.fleet.domain.manifest.ProxyEndpoint;
import xyz.firestige.fleet.domain.manifest.ResourceSizing;
import xyz.firestige.fleet.domain.manifest.RestartPolicy;
import xyz.firestige.fleet.domain.manifest.ServiceInterface;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.manifest.TerraformFacet;
import xyz.firestige.fleet.validation.ValidationResult;
import xyz.firestige.fleet.validation.ValidationWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 清单绑定器：把属性树绑定为 {@link Manifest}
 * <p>
 * 只做结构与类型检查，错误带上出错路径（例如 services.guacamole.ports[1]）并全部收集，
 * 类型不符的字段按缺失处理，语义规则交给校验链。
 */
public class ManifestBinder {

    private static final Pattern SERVICE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
    private static final Pattern SIZE = Pattern.compile("^(\\d+)\\s*([KMGT]?)(i?B?)?$", Pattern.CASE_INSENSITIVE);

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
            "network", "core_services", "services", "deployment_phases", "orchestration",
            "health_check_timeout", "retry_attempts", "retry_delay", "enable_rollback", "enable_health_monitoring");

    private static final Set<String> SERVICE_KEYS = Set.of(
            "enable", "ip", "hostname", "vmid", "resources", "depends_on", "ports", "restart_policy",
            "environment", "volumes", "interface", "health_check");

    private static final Set<String> INTERFACE_KEYS = Set.of("db", "proxy", "auth", "health", "terraform", "config");

    private final ObjectMapper mapper;
    private final int defaultHealthInterval;
    private final int defaultHealthTimeout;
    private final int defaultHealthRetries;

    public ManifestBinder(ObjectMapper mapper, int defaultHealthInterval, int defaultHealthTimeout, int defaultHealthRetries) {
        this.mapper = mapper;
        this.defaultHealthInterval = defaultHealthInterval;
        this.defaultHealthTimeout = defaultHealthTimeout;
        this.defaultHealthRetries = defaultHealthRetries;
    }

    /**
     * 绑定结果：清单（可能不完整）与结构错误
     */
    public record Binding(Manifest manifest, ValidationResult result) {
    }

    public Binding bind(JsonNode root) {
        return new Session().bind(root);
    }

    /**
     * 单次绑定的状态
     */
    private class Session {

        private final ValidationResult result = new ValidationResult();

        Binding bind(JsonNode root) {
            if (root == null || !root.isObject()) {
                result.addError("manifest", "清单根节点必须是对象", "INVALID_TYPE", null);
                return new Binding(new Manifest(null, Map.of(), PhaseAssignments.EMPTY, OrchestrationDefaults.NONE), result);
            }
            warnUnknownKeys(root, "", TOP_LEVEL_KEYS);

            OrchestrationDefaults defaults = bindDefaults(root);
            NetworkSpec network = bindNetwork(root.get("network"));

            Map<String, ServiceSpec> services = new LinkedHashMap<>();
            bindServiceSection(root.get("core_services"), "core_services", true, defaults, services);
            bindServiceSection(root.get("services"), "services", false, defaults, services);

            PhaseAssignments phases = bindPhases(root.get("deployment_phases"));
            return new Binding(new Manifest(network, services, phases, defaults), result);
        }

        // ====== 全局段 ======

        private OrchestrationDefaults bindDefaults(JsonNode root) {
            JsonNode section = root.has("orchestration") ? root.get("orchestration") : root;
            String base = root.has("orchestration") ? "orchestration" : "";
            if (root.has("orchestration") && !section.isObject()) {
                typeError("orchestration", "对象", section);
                return OrchestrationDefaults.NONE;
            }
            Integer timeout = integer(section.get("health_check_timeout"), path(base, "health_check_timeout"));
            Integer attempts = integer(section.get("retry_attempts"), path(base, "retry_attempts"));
            Integer delay = integer(section.get("retry_delay"), path(base, "retry_delay"));
            checkNonNegative(timeout, path(base, "health_check_timeout"));
            checkNonNegative(attempts, path(base, "retry_attempts"));
            checkNonNegative(delay, path(base, "retry_delay"));
            return new OrchestrationDefaults(timeout, attempts, delay);
        }

        private NetworkSpec bindNetwork(JsonNode node) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isObject()) {
                typeError("network", "对象", node);
                return null;
            }
            return new NetworkSpec(
                    text(node.get("domain"), "network.domain"),
                    text(node.get("gateway"), "network.gateway"),
                    text(node.get("network_cidr"), "network.network_cidr"),
                    integer(node.get("vlan_tag"), "network.vlan_tag"),
                    text(node.get("dns_server"), "network.dns_server"));
        }

        private PhaseAssignments bindPhases(JsonNode node) {
            if (node == null || node.isNull()) {
                return PhaseAssignments.EMPTY;
            }
            if (!node.isObject()) {
                typeError("deployment_phases", "对象", node);
                return PhaseAssignments.EMPTY;
            }
            Map<DeploymentPhase, List<String>> map = new EnumMap<>(DeploymentPhase.class);
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String p = path("deployment_phases", entry.getKey());
                DeploymentPhase.fromManifestKey(entry.getKey()).ifPresentOrElse(
                        phase -> map.put(phase, stringList(entry.getValue(), p)),
                        () -> result.addError(p, "未知的部署阶段，可选值: tf_infra, nix_core, tf_auth_core, services",
                                "UNKNOWN_PHASE", entry.getKey()));
            }
            return new PhaseAssignments(map);
        }

        // ====== 服务 ======

        private void bindServiceSection(JsonNode node, String section, boolean core,
                                        OrchestrationDefaults defaults, Map<String, ServiceSpec> services) {
            if (node == null || node.isNull()) {
                return;
            }
            if (!node.isObject()) {
                typeError(section, "对象（服务名 -> 服务定义）", node);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String name = entry.getKey();
                String p = path(section, name);
                if (!SERVICE_NAME.matcher(name).matches()) {
                    result.addError(p, "服务名只能包含字母、数字、'.'、'_' 和 '-'", "INVALID_NAME", name);
                    continue;
                }
                if (services.containsKey(name)) {
                    result.addError(p, "服务名重复（core_services 与 services 中同时出现）", "DUPLICATE_SERVICE", name);
                    continue;
                }
                if (!entry.getValue().isObject()) {
                    typeError(p, "对象", entry.getValue());
                    continue;
                }
                services.put(name, bindService(name, core, entry.getValue(), p, defaults));
            }
        }

        private ServiceSpec bindService(String name, boolean core, JsonNode node, String p, OrchestrationDefaults defaults) {
            warnUnknownKeys(node, p, SERVICE_KEYS);
            Boolean enable = bool(node.get("enable"), path(p, "enable"));
            String restartValue = text(node.get("restart_policy"), path(p, "restart_policy"));
            RestartPolicy restartPolicy = null;
            if (restartValue != null) {
                restartPolicy = RestartPolicy.fromValue(restartValue).orElse(null);
                if (restartPolicy == null) {
                    result.addError(path(p, "restart_policy"), "重启策略只能是 always、unless-stopped 或 never",
                            "INVALID_VALUE", restartValue);
                }
            }

            JsonNode ifaceNode = node.get("interface");
            String ifacePath = path(p, "interface");
            // 旧格式把健康检查命令直接写在服务上
            if ((ifaceNode == null || !ifaceNode.has("health")) && node.hasNonNull("health_check")) {
                result.addWarning(ValidationWarning.of(path(p, "health_check"),
                        "health_check 已废弃，请改用 interface.health.liveness"));
            }

            return new ServiceSpec(
                    name,
                    core,
                    enable == null || enable,
                    text(node.get("ip"), path(p, "ip")),
                    text(node.get("hostname"), path(p, "hostname")),
                    integer(node.get("vmid"), path(p, "vmid")),
                    bindResources(node.get("resources"), path(p, "resources")),
                    new TreeSet<>(stringList(node.get("depends_on"), path(p, "depends_on"))),
                    intList(node.get("ports"), path(p, "ports")),
                    restartPolicy,
                    stringMap(node.get("environment"), path(p, "environment")),
                    stringList(node.get("volumes"), path(p, "volumes")),
                    bindInterface(name, ifaceNode, ifacePath, node.get("health_check"), defaults));
        }

        private ResourceSizing bindResources(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isObject()) {
                typeError(p, "对象", node);
                return null;
            }
            JsonNode cores = node.has("cores") ? node.get("cores") : node.get("cpu");
            JsonNode disk = node.has("disk") ? node.get("disk") : node.get("storage");
            return new ResourceSizing(
                    integer(cores, path(p, node.has("cores") ? "cores" : "cpu")),
                    size(node.get("memory"), path(p, "memory"), "M"),
                    size(disk, path(p, node.has("disk") ? "disk" : "storage"), "G"));
        }

        // ====== 服务接口 ======

        private ServiceInterface bindInterface(String service, JsonNode node, String p, JsonNode legacyHealth,
                                               OrchestrationDefaults defaults) {
            if (node == null || node.isNull()) {
                if (legacyHealth != null && legacyHealth.isTextual()) {
                    return new ServiceInterface(null, List.of(), null,
                            legacyHealthFacet(legacyHealth.asText(), defaults), null, null);
                }
                return ServiceInterface.EMPTY;
            }
            if (!node.isObject()) {
                typeError(p, "对象", node);
                return ServiceInterface.EMPTY;
            }
            warnUnknownKeys(node, p, INTERFACE_KEYS);

            HealthFacet health = bindHealth(node.get("health"), path(p, "health"), defaults);
            if (health == null && legacyHealth != null && legacyHealth.isTextual()) {
                health = legacyHealthFacet(legacyHealth.asText(), defaults);
            }
            return new ServiceInterface(
                    bindDb(node.get("db"), path(p, "db")),
                    bindProxy(service, node.get("proxy"), path(p, "proxy")),
                    bindAuth(node.get("auth"), path(p, "auth")),
                    health,
                    bindTerraform(node.get("terraform"), path(p, "terraform")),
                    objectMap(node.get("config"), path(p, "config")));
        }

        private DbFacet bindDb(JsonNode node, String p) {
            if (!isObject(node, p)) {
                return null;
            }
            return new DbFacet(
                    text(node.get("database"), path(p, "database")),
                    text(node.get("role"), path(p, "role")),
                    text(node.get("host"), path(p, "host")),
                    integer(node.get("port"), path(p, "port")),
                    text(node.get("mode"), path(p, "mode")));
        }

        /**
         * proxy 可以是单个入口、入口列表或“入口名 -> 入口”的映射，统一为列表
         */
        private List<ProxyEndpoint> bindProxy(String service, JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return List.of();
            }
            List<ProxyEndpoint> endpoints = new ArrayList<>();
            if (node.isArray()) {
                for (int i = 0; i < node.size(); i++) {
                    String ip = index(p, i);
                    if (isObject(node.get(i), ip)) {
                        JsonNode name = node.get(i).get("name");
                        endpoints.add(bindEndpoint(name != null && name.isTextual() ? name.asText() : service + "-" + i,
                                node.get(i), ip));
                    }
                }
            } else if (node.isObject() && (node.has("domain") || node.has("upstream"))) {
                endpoints.add(bindEndpoint(service, node, p));
            } else if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    String ep = path(p, entry.getKey());
                    if (isObject(entry.getValue(), ep)) {
                        endpoints.add(bindEndpoint(entry.getKey(), entry.getValue(), ep));
                    }
                }
            } else {
                typeError(p, "对象或列表", node);
            }
            return endpoints;
        }

        private ProxyEndpoint bindEndpoint(String name, JsonNode node, String p) {
            String pathValue = text(node.get("path"), path(p, "path"));
            Boolean tls = bool(node.get("tls"), path(p, "tls"));
            Boolean authz = bool(node.get("authz"), path(p, "authz"));
            return new ProxyEndpoint(
                    name,
                    text(node.get("domain"), path(p, "domain")),
                    pathValue == null ? "/" : pathValue,
                    text(node.get("upstream"), path(p, "upstream")),
                    tls == null || tls,
                    authz == null || authz,
                    stringMap(node.get("headers"), path(p, "headers")));
        }

        private AuthFacet bindAuth(JsonNode node, String p) {
            if (!isObject(node, p)) {
                return null;
            }
            String typeValue = text(node.get("type"), path(p, "type"));
            AuthType type = null;
            if (typeValue != null) {
                type = AuthType.fromValue(typeValue).orElse(null);
                if (type == null) {
                    result.addError(path(p, "type"), "认证方式只能是 oidc、forward_auth、local 或 none",
                            "INVALID_VALUE", typeValue);
                }
            }
            // 兼容 auth.oidc 嵌套写法
            JsonNode oidc = node.has("oidc") && node.get("oidc").isObject() ? node.get("oidc") : node;
            String op = oidc == node ? p : path(p, "oidc");
            String provider = text(node.get("provider"), path(p, "provider"));
            List<String> scopes = stringList(oidc.get("scopes"), path(op, "scopes"));
            String usernameClaim = text(oidc.get("username_claim"), path(op, "username_claim"));
            String groupsClaim = text(oidc.get("groups_claim"), path(op, "groups_claim"));
            return new AuthFacet(
                    type,
                    provider == null ? "authentik" : provider,
                    text(oidc.get("client_id"), path(op, "client_id")),
                    stringList(oidc.get("redirect_uris"), path(op, "redirect_uris")),
                    scopes.isEmpty() ? List.of("openid", "email", "profile") : scopes,
                    usernameClaim == null ? "preferred_username" : usernameClaim,
                    groupsClaim == null ? "groups" : groupsClaim);
        }

        private HealthFacet bindHealth(JsonNode node, String p, OrchestrationDefaults defaults) {
            if (!isObject(node, p)) {
                return null;
            }
            Integer interval = integer(node.get("interval"), path(p, "interval"));
            Integer timeout = integer(node.get("timeout"), path(p, "timeout"));
            Integer retries = integer(node.get("retries"), path(p, "retries"));
            checkNonNegative(interval, path(p, "interval"));
            if (timeout != null && timeout <= 0) {
                result.addError(path(p, "timeout"), "超时必须大于 0", "OUT_OF_RANGE", timeout);
            }
            if (retries != null && retries <= 0) {
                result.addError(path(p, "retries"), "尝试次数必须大于 0", "OUT_OF_RANGE", retries);
            }
            return new HealthFacet(
                    text(node.get("startup"), path(p, "startup")),
                    text(node.get("liveness"), path(p, "liveness")),
                    text(node.get("readiness"), path(p, "readiness")),
                    interval == null ? defaultHealthInterval : interval,
                    timeout == null ? defaultTimeout(defaults) : timeout,
                    retries == null ? defaultHealthRetries : retries);
        }

        private HealthFacet legacyHealthFacet(String command, OrchestrationDefaults defaults) {
            return new HealthFacet(null, command, null, defaultHealthInterval, defaultTimeout(defaults), defaultHealthRetries);
        }

        private int defaultTimeout(OrchestrationDefaults defaults) {
            Integer manifestTimeout = defaults.healthCheckTimeoutSeconds();
            return manifestTimeout != null && manifestTimeout > 0 ? manifestTimeout : defaultHealthTimeout;
        }

        private TerraformFacet bindTerraform(JsonNode node, String p) {
            if (!isObject(node, p)) {
                return null;
            }
            return new TerraformFacet(
                    stringList(node.get("modules"), path(p, "modules")),
                    stringList(node.get("targets"), path(p, "targets")),
                    stringList(node.get("apply_order"), path(p, "apply_order")),
                    objectMap(node.get("variables"), path(p, "variables")));
        }

        // ====== 基础类型 ======

        private boolean isObject(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return false;
            }
            if (!node.isObject()) {
                typeError(p, "对象", node);
                return false;
            }
            return true;
        }

        private String text(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isValueNode()) {
                typeError(p, "字符串", node);
                return null;
            }
            return node.asText();
        }

        private Integer integer(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (node.isIntegralNumber() && node.canConvertToInt()) {
                return node.intValue();
            }
            if (node.isTextual() && node.asText().trim().matches("-?\\d{1,9}")) {
                return Integer.parseInt(node.asText().trim());
            }
            typeError(p, "整数", node);
            return null;
        }

        private Boolean bool(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (node.isBoolean()) {
                return node.booleanValue();
            }
            typeError(p, "布尔值", node);
            return null;
        }

        /**
         * 容量，接受整数或带单位的字符串（512M、2G），换算到目标单位
         */
        private Integer size(JsonNode node, String p, String unit) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (node.isIntegralNumber()) {
                return integer(node, p);
            }
            if (node.isTextual()) {
                Matcher m = SIZE.matcher(node.asText().trim());
                if (m.matches()) {
                    long value = Long.parseLong(m.group(1));
                    String given = m.group(2).isEmpty() ? unit : m.group(2).toUpperCase(Locale.ROOT);
                    long converted = value * scale(given) / scale(unit);
                    if (converted <= Integer.MAX_VALUE) {
                        return (int) converted;
                    }
                }
            }
            typeError(p, "容量（整数或 512M、2G 形式）", node);
            return null;
        }

        private long scale(String unit) {
            return switch (unit) {
                case "K" -> 1L;
                case "M" -> 1024L;
                case "G" -> 1024L * 1024;
                case "T" -> 1024L * 1024 * 1024;
                default -> 1L;
            };
        }

        private List<String> stringList(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (node.isTextual()) {
                return List.of(node.asText());
            }
            if (!node.isArray()) {
                typeError(p, "字符串列表", node);
                return List.of();
            }
            List<String> values = new ArrayList<>();
            for (int i = 0; i < node.size(); i++) {
                String value = text(node.get(i), index(p, i));
                if (value != null) {
                    values.add(value);
                }
            }
            return values;
        }

        private List<Integer> intList(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                typeError(p, "整数列表", node);
                return List.of();
            }
            List<Integer> values = new ArrayList<>();
            for (int i = 0; i < node.size(); i++) {
                Integer value = integer(node.get(i), index(p, i));
                if (value != null) {
                    values.add(value);
                }
            }
            return values;
        }

        private Map<String, String> stringMap(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return Map.of();
            }
            if (!node.isObject()) {
                typeError(p, "对象", node);
                return Map.of();
            }
            Map<String, String> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String value = text(entry.getValue(), path(p, entry.getKey()));
                values.put(entry.getKey(), value == null ? "" : value);
            }
            return values;
        }

        private Map<String, Object> objectMap(JsonNode node, String p) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isObject()) {
                typeError(p, "对象", node);
                return null;
            }
            Map<String, Object> value = mapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return Collections.unmodifiableMap(value);
        }

        private void checkNonNegative(Integer value, String p) {
            if (value != null && value < 0) {
                result.addError(p, "不能为负数", "OUT_OF_RANGE", value);
            }
        }

        private void warnUnknownKeys(JsonNode node, String p, Set<String> known) {
            node.fieldNames().forEachRemaining(key -> {
                if (!known.contains(key)) {
                    result.addWarning(ValidationWarning.of(path(p, key), "未识别的字段，已忽略"));
                }
            });
        }

        private void typeError(String p, String expected, JsonNode actual) {
            result.addError(p, "类型错误，期望" + expected + "，实际为 " + actual.getNodeType().name().toLowerCase(Locale.ROOT),
                    "INVALID_TYPE", actual.isValueNode() ? actual.asText() : null);
        }
    }

    static String path(String base, String key) {
        return base == null || base.isEmpty() ? key : base + "." + key;
    }

    static String index(String base, int i) {
        return base + "[" + i + "]";
    }
}
