package xyz.firestige.fleet.exception;

/**
 * 致命应用异常（凭据缺失、协作方永久拒绝等），不重试
 */
public class FatalApplyException extends OrchestratorException {

    public FatalApplyException(String message) {
        super(ErrorType.FATAL_APPLY_ERROR, message);
    }

    public FatalApplyException(String message, Throwable cause) {
        super(ErrorType.FATAL_APPLY_ERROR, message, cause);
    }
}
