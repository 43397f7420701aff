package io.github.vevoly.datastore.api.exception;

/**
 * <h3>初始化异常</h3>
 *
 * <p>当 Builder 参数校验失败或数据目录无法创建时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Initialization exception.</b><br>
 * Thrown when a Builder's parameter validation fails or the data directory cannot be created.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class InitializationException extends JAtomicDataStoreException {
    public InitializationException(String message) {
        super(DataStoreErrorCode.INITIALIZATION_FAILED, message);
    }
    public InitializationException(String message, Throwable cause) {
        super(DataStoreErrorCode.INITIALIZATION_FAILED, message, cause);
    }
}
