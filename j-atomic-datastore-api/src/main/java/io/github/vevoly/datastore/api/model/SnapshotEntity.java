package io.github.vevoly.datastore.api.model;

/**
 * <h3>快照实体接口 (Snapshot Entity)</h3>
 *
 * <p>
 * 所有可以写入快照集合的实体都必须实现此接口。快照加载后会逐个调用 {@link #validate()}，
 * 字段缺失的实体会让整个集合加载失败，而不是悄悄地产生一个残缺对象。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Entity.</b><br>
 * Every entity stored in a snapshot collection implements this. After a load each entity is validated;
 * an incomplete entity fails the whole collection instead of silently producing a partial object.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface SnapshotEntity {

    /**
     * 校验必填字段.
     * <br>
     * <span style="color: gray;">Check mandatory fields.</span>
     *
     * @throws IllegalStateException 实体不完整 (Entity is incomplete)
     */
    void validate();
}
