package io.github.vevoly.datastore.api.exception;

import lombok.Getter;

/**
 * <h3>快照加载异常</h3>
 *
 * <p>快照文件无法读取、不是合法 JSON 或实体字段不完整时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot load exception.</b><br>
 * Thrown when a snapshot file is unreadable, not valid JSON, or holds an incomplete entity.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
public class SnapshotLoadException extends JAtomicDataStoreException {

    private final String collection;

    public SnapshotLoadException(String collection, String message) {
        super(DataStoreErrorCode.SNAPSHOT_LOAD_FAILED, "[" + collection + "] " + message);
        this.collection = collection;
    }

    public SnapshotLoadException(String collection, String message, Throwable cause) {
        super(DataStoreErrorCode.SNAPSHOT_LOAD_FAILED, "[" + collection + "] " + message, cause);
        this.collection = collection;
    }
}
