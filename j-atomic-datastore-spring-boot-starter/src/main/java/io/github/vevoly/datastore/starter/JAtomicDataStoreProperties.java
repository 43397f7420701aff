package io.github.vevoly.datastore.starter;

import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * <h3>数据存储配置属性 (Data Store Configuration Properties)</h3>
 *
 * <p>
 * 对应 {@code application.yml} 中的配置项。前缀为 <b>j-atomic-datastore</b>。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Data Store Configuration Properties.</b><br>
 * Maps to configuration items in {@code application.yml}. Prefix: <b>j-atomic-datastore</b>.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = JAtomicDataStoreConstant.J_ATOMIC_DATASTORE_ID)
public class JAtomicDataStoreProperties {

    /**
     * 数据存储根目录 (Base Directory).
     * <p><b>必填项。</b> 快照、活动日志和编号文件将存储在此目录下。</p>
     * <span style="color: gray;">Mandatory. Root directory for snapshots, the activity log and id files. e.g., ./data/</span>
     */
    private String baseDir;

    /**
     * 监控指标的前缀 (Metrics Prefix).
     * <p>默认为 "j-atomic-datastore."</p>
     * <span style="color: gray;">Metrics prefix. Default: "j-atomic-datastore.".</span>
     */
    private String metricsPrefix = JAtomicDataStoreConstant.DEFAULT_METRICS_PREFIX;

    /**
     * 每个注册表的最大尝试次数 (Max Attempts per Registry).
     * <p>键为注册表名，例如 {@code max-attempts.nach=200}。未配置的注册表使用默认值。</p>
     * <span style="color: gray;">Keyed by registry, e.g. {@code max-attempts.nach=200}. Unset registries keep their default.</span>
     */
    private Map<IdRegistryType, Integer> maxAttempts = new EnumMap<>(IdRegistryType.class);

}
