package io.github.vevoly.datastore.api.exception;

import lombok.Getter;

/**
 * <h3>快照保存异常</h3>
 *
 * <p>序列化或原子替换失败时抛出。抛出时旧快照保持不变，临时文件已被清理。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot save exception.</b><br>
 * Thrown when serialization or the atomic replace fails. The previous snapshot is left untouched and the temp file is removed.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
public class SnapshotSaveException extends JAtomicDataStoreException {

    private final String collection;

    public SnapshotSaveException(String collection, String message, Throwable cause) {
        super(DataStoreErrorCode.SNAPSHOT_SAVE_FAILED, "[" + collection + "] " + message, cause);
        this.collection = collection;
    }
}
