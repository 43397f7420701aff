package io.github.vevoly.datastore.api.exception;

import lombok.Getter;

/**
 * <h3>编号耗尽异常</h3>
 *
 * <p>
 * 当编号分配器在最大尝试次数内始终碰撞时抛出。这意味着号段或随机源出现了严重问题，
 * 调用方不应重试，而应终止当前业务操作。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Identifier exhaustion exception.</b><br>
 * Thrown when an id allocator collides on every attempt within its cap.
 * Callers must not retry; the enclosing operation has to be halted.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
public class IdExhaustedException extends IdAllocationException {

    /**
     * 已尝试次数 / Attempts made
     */
    private final int attempts;

    public IdExhaustedException(String registry, int attempts) {
        super(DataStoreErrorCode.ID_EXHAUSTED, registry,
                String.format("Failed to generate unique %s id after %d attempts.", registry, attempts));
        this.attempts = attempts;
    }
}
