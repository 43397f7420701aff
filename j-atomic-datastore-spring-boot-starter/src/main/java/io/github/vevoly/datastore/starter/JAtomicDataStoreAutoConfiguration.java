package io.github.vevoly.datastore.starter;

import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.github.vevoly.datastore.api.exception.InitializationException;
import io.github.vevoly.datastore.core.LedgerDataStore;
import io.github.vevoly.datastore.core.clock.BankClock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * <h3>核心自动装配类 (Core Auto-Configuration)</h3>
 *
 * <p>
 * 利用 Spring Boot 的自动配置机制，将配置文件与数据存储组装在一起。
 * 只有配置了存储路径 ({@code j-atomic-datastore.base-dir}) 时才会创建数据存储。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Core Auto-Configuration.</b><br>
 * Assembles configuration properties and the data store using Spring Boot's auto-configuration mechanism.<br>
 * The data store is only created when the storage path ({@code j-atomic-datastore.base-dir}) is configured.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties(JAtomicDataStoreProperties.class)
@ConditionalOnProperty(prefix = JAtomicDataStoreConstant.J_ATOMIC_DATASTORE_ID, name = "base-dir")
public class JAtomicDataStoreAutoConfiguration {

    /**
     * 虚拟银行时钟，用户可自定义 / Virtual bank clock, may be overridden by the user
     */
    @Bean
    @ConditionalOnMissingBean(BankClock.class)
    public BankClock bankClock() {
        return new BankClock();
    }

    /**
     * <h3>数据存储 Bean (Ledger Data Store Bean)</h3>
     *
     * <p>组装 {@link LedgerDataStore}。容器中存在 {@link MeterRegistry} 时自动接入监控。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Assembles the {@link LedgerDataStore}.</b><br>
     * Metrics are wired in when a {@link MeterRegistry} is present in the context.
     * </span>
     *
     * @param props         配置文件属性 (Properties)
     * @param bankClock     银行时钟 (Bank clock)
     * @param meterRegistry 监控注册表，可选 (Optional meter registry)
     * @return 数据存储 (Data store)
     * @throws InitializationException 目录不可用或配置非法 (Directory unusable or invalid configuration)
     */
    @Bean
    @ConditionalOnMissingBean(LedgerDataStore.class)
    public LedgerDataStore ledgerDataStore(JAtomicDataStoreProperties props,
                                           BankClock bankClock,
                                           ObjectProvider<MeterRegistry> meterRegistry) throws InitializationException {
        LedgerDataStore.Builder builder = LedgerDataStore.builder()
                .baseDir(props.getBaseDir())
                .bankClock(bankClock)
                .metricsPrefix(props.getMetricsPrefix())
                .meterRegistry(meterRegistry.getIfAvailable());
        for (Map.Entry<IdRegistryType, Integer> entry : props.getMaxAttempts().entrySet()) {
            builder.maxAttempts(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }
}
