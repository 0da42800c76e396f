package xyz.firestige.fleet.exception;

import java.util.List;

/**
 * 依赖环异常
 * cyclePath 首尾为同一服务，例如 [a, b, c, a]
 */
public class CycleException extends OrchestratorException {

    private final List<String> cyclePath;

    public CycleException(List<String> cyclePath) {
        super(ErrorType.CYCLE_ERROR, "检测到依赖环: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
