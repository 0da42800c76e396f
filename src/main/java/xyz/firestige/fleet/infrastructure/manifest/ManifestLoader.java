package xyz.firestige.fleet.infrastructure.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.validation.ValidationChain;
import xyz.firestige.fleet.validation.ValidationError;
import xyz.firestige.fleet.validation.ValidationResult;
import xyz.firestige.fleet.validation.ValidationWarning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 清单加载器
 * <p>
 * 职责：
 * 1. 读取 YAML / JSON 清单为属性树
 * 2. 绑定为领域模型，收集结构错误
 * 3. 执行语义校验链，汇总全部错误后一次性抛出 {@link ManifestValidationException}
 * <p>
 * 纯读取，无副作用
 */
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;
    private final ManifestBinder binder;
    private final ValidationChain validationChain;

    public ManifestLoader(ManifestBinder binder, ValidationChain validationChain) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.jsonMapper = new ObjectMapper();
        this.binder = binder;
        this.validationChain = validationChain;
    }

    public Manifest load(Path path) {
        log.info("Loading manifest from {}", path);
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestValidationException(List.of(
                    ValidationError.of("manifest", "无法读取清单文件: " + path + " (" + e.getMessage() + ")", "IO_ERROR")));
        }
        boolean json = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
        return parse(content, json);
    }

    /**
     * 解析清单文本
     *
     * @param content 清单内容
     * @param json    true 按 JSON 解析，否则按 YAML 解析
     */
    public Manifest parse(String content, boolean json) {
        JsonNode root;
        try {
            root = (json ? jsonMapper : yamlMapper).readTree(content);
        } catch (JsonProcessingException e) {
            String location = e.getLocation() == null ? "" :
                    " (line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr() + ")";
            throw new ManifestValidationException(List.of(
                    ValidationError.of("manifest", "清单语法错误" + location + ": " + e.getOriginalMessage(), "SYNTAX_ERROR")));
        }

        ManifestBinder.Binding binding = binder.bind(root);
        ValidationResult result = new ValidationResult();
        result.merge(binding.result());
        result.merge(validationChain.validate(binding.manifest()));

        for (ValidationWarning warning : result.getWarnings()) {
            log.warn("Manifest warning: {}", warning);
        }
        if (!result.isValid()) {
            log.error("Manifest validation failed with {} error(s)", result.getErrors().size());
            throw new ManifestValidationException(result.getErrors());
        }

        Manifest manifest = binding.manifest();
        log.info("Manifest loaded successfully: {} services ({} enabled)",
                manifest.getServices().size(), manifest.enabledServices().size());
        return manifest;
    }
}
