package xyz.firestige.fleet.domain.manifest;

import java.util.List;
import java.util.Map;

/**
 * 基础设施供应参数，原样传给供应后端
 */
public record TerraformFacet(List<String> modules, List<String> targets, List<String> applyOrder,
                             Map<String, Object> variables) {
}
