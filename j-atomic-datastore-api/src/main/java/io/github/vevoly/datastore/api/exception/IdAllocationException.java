package io.github.vevoly.datastore.api.exception;

import lombok.Getter;

/**
 * <h3>编号分配异常</h3>
 *
 * <p>编号无法安全发放时抛出：号段耗尽，或已发放集合无法落盘。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Id allocation exception.</b><br>
 * Thrown when an id cannot be handed out safely: the namespace is exhausted, or the issued set cannot be persisted.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
public class IdAllocationException extends JAtomicDataStoreException {

    /**
     * 注册表名称 / Registry name
     */
    private final String registry;

    public IdAllocationException(DataStoreErrorCode errorCode, String registry, String message) {
        super(errorCode, message);
        this.registry = registry;
    }

    public IdAllocationException(DataStoreErrorCode errorCode, String registry, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.registry = registry;
    }
}
