package io.github.vevoly.datastore.core.metrics;

import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

/**
 * <h3>监控指标管理器 (Metric Manager)</h3>
 *
 * <p>定义了存储层暴露给 Micrometer (Prometheus/Grafana) 的监控指标名称，并负责取得对应的计量器。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Metric Manager.</b><br>
 * Defines metric names exposed to Micrometer (Prometheus/Grafana) and hands out the matching meters.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class DataStoreMetricManager {

    // 指标名称 / Metric names
    public final String activityAppends;
    public final String activityAppendTime;
    public final String snapshotSaveTime;
    public final String snapshotSaveFailures;
    public final String replayApplied;
    public final String idAllocations;
    public final String idCollisions;

    // 标签名称 / Label names
    public static final String TAG_REGISTRY = "registry";
    public static final String TAG_COLLECTION = "collection";

    @Getter
    private final MeterRegistry registry;

    public DataStoreMetricManager(String prefix, MeterRegistry registry) {
        if (prefix == null || prefix.trim().isEmpty()) {
            prefix = JAtomicDataStoreConstant.DEFAULT_METRICS_PREFIX;
        }
        if (!prefix.endsWith(".")) {
            prefix += ".";
        }
        this.activityAppends = prefix + "activity.appends";
        this.activityAppendTime = prefix + "activity.append.time";
        this.snapshotSaveTime = prefix + "snapshot.save.time";
        this.snapshotSaveFailures = prefix + "snapshot.save.failures";
        this.replayApplied = prefix + "replay.applied";
        this.idAllocations = prefix + "id.allocations";
        this.idCollisions = prefix + "id.collisions";
        // 兜底，防止空指针 / Fallback to avoid NPE
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    /**
     * 无外部注册表时使用 / For use without an external registry
     */
    public static DataStoreMetricManager standalone() {
        return new DataStoreMetricManager(null, null);
    }

    public Counter activityAppendCounter() {
        return registry.counter(activityAppends);
    }

    public Timer activityAppendTimer() {
        return registry.timer(activityAppendTime);
    }

    public Timer snapshotSaveTimer(String collection) {
        return registry.timer(snapshotSaveTime, TAG_COLLECTION, collection);
    }

    public Counter snapshotSaveFailureCounter(String collection) {
        return registry.counter(snapshotSaveFailures, TAG_COLLECTION, collection);
    }

    public Counter replayAppliedCounter() {
        return registry.counter(replayApplied);
    }

    public Counter idAllocationCounter(String registryName) {
        return registry.counter(idAllocations, TAG_REGISTRY, registryName);
    }

    public Counter idCollisionCounter(String registryName) {
        return registry.counter(idCollisions, TAG_REGISTRY, registryName);
    }
}
