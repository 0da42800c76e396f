package xyz.firestige.fleet.exception;

/**
 * 暂时性应用异常，按重试预算重试
 */
public class TransientApplyException extends OrchestratorException {

    public TransientApplyException(String message) {
        super(ErrorType.TRANSIENT_APPLY_ERROR, message);
    }

    public TransientApplyException(String message, Throwable cause) {
        super(ErrorType.TRANSIENT_APPLY_ERROR, message, cause);
    }
}
