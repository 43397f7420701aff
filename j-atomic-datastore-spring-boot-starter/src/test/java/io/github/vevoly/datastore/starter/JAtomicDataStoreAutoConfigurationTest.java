package io.github.vevoly.datastore.starter;

import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.core.LedgerDataStore;
import io.github.vevoly.datastore.core.clock.BankClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JAtomicDataStoreAutoConfigurationTest {

    @TempDir
    Path dir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JAtomicDataStoreAutoConfiguration.class));

    @Test
    @DisplayName("未配置 base-dir 时不创建数据存储 / no data store without base-dir")
    void backsOffWithoutBaseDir() {
        runner.run(context -> assertThat(context).doesNotHaveBean(LedgerDataStore.class));
    }

    @Test
    void createsDataStoreUnderBaseDir() {
        runner.withPropertyValues("j-atomic-datastore.base-dir=" + dir.toString())
                .run(context -> {
                    assertThat(context).hasSingleBean(LedgerDataStore.class);
                    assertThat(context).hasSingleBean(BankClock.class);
                    LedgerDataStore store = context.getBean(LedgerDataStore.class);
                    assertThat(store.getBaseDir()).isEqualTo(dir.toAbsolutePath().normalize());
                    assertThat(store.accountNumbers().generate()).startsWith("5621");
                });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "j-atomic-datastore.base-dir=" + dir.toString(),
                        "j-atomic-datastore.metrics-prefix=bank.",
                        "j-atomic-datastore.max-attempts[NACH]=7")
                .run(context -> {
                    JAtomicDataStoreProperties props = context.getBean(JAtomicDataStoreProperties.class);
                    assertThat(props.getMetricsPrefix()).isEqualTo("bank.");
                    assertThat(props.getMaxAttempts()).containsEntry(IdRegistryType.NACH, 7);
                });
    }

    @Test
    @DisplayName("使用容器中的监控注册表和银行时钟 / uses the context's meter registry and bank clock")
    void usesUserBeans() {
        BankClock clock = new BankClock(Clock.fixed(Instant.parse("2025-06-30T00:00:00Z"), ZoneOffset.UTC));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        runner.withPropertyValues("j-atomic-datastore.base-dir=" + dir.toString())
                .withBean(BankClock.class, () -> clock)
                .withBean(MeterRegistry.class, () -> registry)
                .run(context -> {
                    LedgerDataStore store = context.getBean(LedgerDataStore.class);
                    assertThat(store.getBankClock()).isSameAs(clock);
                    assertThat(store.nachIds().generate()).startsWith("NACH20250630");
                    assertThat(registry.counter("j-atomic-datastore.id.allocations", "registry", "NACH").count())
                            .isEqualTo(1.0);
                });
    }
}
