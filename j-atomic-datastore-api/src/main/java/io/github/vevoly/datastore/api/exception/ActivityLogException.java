package io.github.vevoly.datastore.api.exception;

/**
 * <h3>活动日志异常</h3>
 *
 * <p>追加写入或读取活动日志失败时抛出。写入失败意味着该事件没有被持久化。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Activity log exception.</b><br>
 * Thrown when appending to or reading the activity log fails. A failed append means the event is not durable.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ActivityLogException extends JAtomicDataStoreException {
    public ActivityLogException(DataStoreErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
