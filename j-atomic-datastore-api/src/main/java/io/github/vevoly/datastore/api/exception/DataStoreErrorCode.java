package io.github.vevoly.datastore.api.exception;

/**
 * <h3>数据存储错误码 (DataStore Error Codes)</h3>
 *
 * <p>定义了存储层内部可能抛出的所有标准异常代码。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>DataStore Error Codes.</b><br>
 * Defines all standard exception codes that can be thrown by the persistence layer.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum DataStoreErrorCode {

    // --- 1xxx: 初始化与配置错误 (Initialization & Configuration) ---
    INITIALIZATION_FAILED(1001, "DataStore initialization failed"),

    // --- 2xxx: 运行时错误 (Runtime) ---
    ID_EXHAUSTED(2001, "Unable to allocate a unique identifier"),
    ID_PERSIST_FAILED(2002, "Failed to persist the issued id set"),

    // --- 3xxx: 持久化与恢复错误 (Persistence & Recovery) ---
    SNAPSHOT_SAVE_FAILED(3002, "Failed to save snapshot"),
    SNAPSHOT_LOAD_FAILED(3003, "Failed to load snapshot"),
    ACTIVITY_WRITE_FAILED(3004, "Failed to append to activity log"),
    ACTIVITY_READ_FAILED(3005, "Failed to read activity log");

    private final int code;
    private final String defaultMessage;

    DataStoreErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
