package io.github.vevoly.datastore.api.exception;

/**
 * <h3>j-atomic-datastore 异常基类 (Base DataStore Exception)</h3>
 *
 * <p>所有由本框架内部抛出的、可预期的异常都应继承此类。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Base exception for the ledger datastore.</b><br>
 * All predictable exceptions thrown by the framework should extend this class.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class JAtomicDataStoreException extends Exception {

    private final DataStoreErrorCode errorCode;

    public JAtomicDataStoreException(DataStoreErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public JAtomicDataStoreException(DataStoreErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JAtomicDataStoreException(DataStoreErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public DataStoreErrorCode getErrorCode() {
        return errorCode;
    }
}
