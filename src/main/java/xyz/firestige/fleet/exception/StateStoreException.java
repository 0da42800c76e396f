package xyz.firestige.fleet.exception;

/**
 * 部署状态读写失败
 */
public class StateStoreException extends OrchestratorException {

    public StateStoreException(String message, Throwable cause) {
        super(ErrorType.STATE_STORE_ERROR, message, cause);
    }
}
