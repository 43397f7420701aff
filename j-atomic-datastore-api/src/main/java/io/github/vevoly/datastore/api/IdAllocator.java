package io.github.vevoly.datastore.api;

import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.api.exception.IdAllocationException;
import io.github.vevoly.datastore.api.model.IdRegistryStats;

import java.util.Collection;
import java.util.List;

/**
 * <h3>唯一编号分配器接口 (Id Allocator Interface)</h3>
 *
 * <p>
 * 发放在其持久化文件生命周期内从未发放过的编号。编号在交给调用方之前已经落盘。
 * 已发放集合只增不减，是跨进程重启判断唯一性的唯一依据。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Id Allocator Interface.</b><br>
 * Issues identifiers never issued before within the lifetime of the registry file; an id is durably recorded
 * before it is returned. The issued set only grows and is the single source of truth across restarts.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface IdAllocator {

    /**
     * 分配一个新编号.
     *
     * <span style="color: gray; font-size: 0.9em;">Allocate a new identifier.</span>
     *
     * @return 从未发放过的编号 (An id never issued before)
     * @throws IdAllocationException 所有尝试都发生碰撞 ({@code IdExhaustedException}), 或已发放集合无法落盘 (Every attempt collided, or the issued set could not be persisted). 调用方不应重试。
     */
    String generate() throws IdAllocationException;

    /**
     * 检查编号是否已发放.
     *
     * <span style="color: gray; font-size: 0.9em;">Check whether an id has been issued.</span>
     *
     * @param id 编号
     * @return true=已发放 (Issued)
     */
    boolean isAllocated(String id);

    /**
     * 登记一个外部已存在的编号 (例如从快照中读出的账号).
     *
     * <span style="color: gray; font-size: 0.9em;">Reserve an id that already exists elsewhere (e.g. read from a snapshot).</span>
     *
     * @param id 编号
     * @return true=本次新登记 (Newly reserved)
     */
    default boolean register(String id) {
        return registerAll(List.of(id)) > 0;
    }

    /**
     * 批量登记，整批只落盘一次.
     *
     * <span style="color: gray; font-size: 0.9em;">Reserve many ids with a single persist.</span>
     *
     * @param ids 编号集合
     * @return 新登记的数量 (Number of newly reserved ids)
     */
    int registerAll(Collection<String> ids);

    /**
     * 已发放数量 / Number of issued ids
     */
    int size();

    /**
     * 注册表统计信息 / Registry statistics
     */
    IdRegistryStats getStatistics();

    /**
     * 注册表类型 / Registry type
     */
    IdRegistryType getType();
}
