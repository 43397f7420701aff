package io.github.vevoly.datastore.core.activity;

import io.github.vevoly.datastore.api.exception.ActivityLogException;
import io.github.vevoly.datastore.api.model.ActivityRecord;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityLogTest {

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private ActivityLog log;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        log = new ActivityLog(dir.resolve("nested/account_activity.csv"), new DataStoreMetricManager(null, registry));
    }

    private static ActivityRecord record(String txnId, String amount, String balance) {
        return ActivityRecord.builder()
                .timestamp("01-01-2025 10:00:00")
                .username("alice")
                .accountNumber("562100000001")
                .action("DEPOSIT")
                .amount(new BigDecimal(amount))
                .mode("CASH")
                .resultingBalance(new BigDecimal(balance))
                .txnId(txnId)
                .meta("category", "Salary, bonus")
                .build();
    }

    @Test
    @DisplayName("首次写入创建目录和表头 / first append creates directories and the header")
    void firstAppendWritesHeader() throws Exception {
        log.append(record("FHIC0000000001", "500", "1500"));

        List<String> lines = Files.readAllLines(log.getPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo(String.join(",", ActivityRecord.HEADER));
        assertThat(lines.get(1)).startsWith("01-01-2025 10:00:00,alice,562100000001,DEPOSIT,500,CASH,1500,FHIC0000000001,,");
        assertThat(registry.counter("j-atomic-datastore.activity.appends").count()).isEqualTo(1.0);
    }

    @Test
    void rowsReadBackInFileOrder() throws Exception {
        log.append(record("FHIC0000000001", "500", "1500"));
        log.append(record("FHIC0000000002", "200", "1300"));

        List<ActivityRow> rows = log.readAll();

        assertThat(rows).extracting(r -> r.cell("txnId")).containsExactly("FHIC0000000001", "FHIC0000000002");
        assertThat(rows.get(1).decimal("resultingBalance")).isEqualByComparingTo("1300");
        assertThat(rows.get(0).metadata()).containsEntry("category", "Salary, bonus");
        assertThat(rows.get(0).isBlank("chequeId")).isTrue();
        assertThat(log.size()).isEqualTo(2);
    }

    @Test
    void missingFileReadsAsEmpty() throws Exception {
        assertThat(log.exists()).isFalse();
        assertThat(log.readAll()).isEmpty();
        assertThat(log.size()).isZero();
    }

    @Test
    @DisplayName("残缺行被跳过，后续追加不受影响 / a torn row is skipped and later appends stay intact")
    void tornTailIsIsolated() throws Exception {
        log.append(record("FHIC0000000001", "500", "1500"));
        Files.writeString(log.getPath(), "01-01-2025 10:05:00,alice,5621", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        log.append(record("FHIC0000000002", "200", "1300"));

        assertThat(log.readAll()).extracting(r -> r.cell("txnId")).containsExactly("FHIC0000000001", "FHIC0000000002");
    }

    @Test
    @DisplayName("崩溃停在引号元数据内，重启后的追加不被吞掉 / a tear inside quoted metadata does not swallow appends after restart")
    void tornInsideQuotedMetadataAfterRestart() throws Exception {
        log.append(record("FHIC0000000001", "500", "1500"));
        Files.writeString(log.getPath(), "01-01-2025 10:05:00,alice,562100000001,DEPOSIT,900,CASH,2400,FHIC0000000009,,\"{\"\"categ",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        ActivityLog restarted = new ActivityLog(log.getPath(), null);
        restarted.append(record("FHIC0000000002", "200", "1300"));
        restarted.append(record("FHIC0000000003", "100", "1200"));

        List<ActivityRow> rows = restarted.readAll();
        assertThat(rows).extracting(r -> r.cell("txnId"))
                .containsExactly("FHIC0000000001", "FHIC0000000002", "FHIC0000000003");
        assertThat(rows.get(1).metadata()).containsEntry("category", "Salary, bonus");
    }

    @Test
    void tornInsideQuotedMetadataSameInstance() throws Exception {
        log.append(record("FHIC0000000001", "500", "1500"));
        Files.writeString(log.getPath(), "01-01-2025 10:05:00,alice,562100000001,DEPOSIT,900,CASH,2400,FHIC0000000009,,\"{\"\"categ",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        log.append(record("FHIC0000000002", "200", "1300"));

        assertThat(log.readAll()).extracting(r -> r.cell("txnId")).containsExactly("FHIC0000000001", "FHIC0000000002");
    }

    @Test
    @DisplayName("只写了一半的表头被补全 / a partially written header is completed")
    void tornHeaderIsCompleted() throws Exception {
        Files.createDirectories(log.getPath().getParent());
        Files.writeString(log.getPath(), "timestamp,usern", StandardCharsets.UTF_8);

        log.append(record("FHIC0000000001", "500", "1500"));

        List<String> lines = Files.readAllLines(log.getPath(), StandardCharsets.UTF_8);
        assertThat(lines.get(0)).isEqualTo(String.join(",", ActivityRecord.HEADER));
        assertThat(log.readAll()).extracting(r -> r.cell("txnId")).containsExactly("FHIC0000000001");
    }

    @Test
    @DisplayName("缺少末尾单元格的行仍可读取 / rows missing trailing cells are still read")
    void shortRowsAreRead() throws Exception {
        Files.createDirectories(log.getPath().getParent());
        Files.writeString(log.getPath(), String.join(",", ActivityRecord.HEADER) + "\n"
                + "01-01-2025 10:00:00,alice,562100000001,DEPOSIT,500,CASH,1500,FHIC0000000001\n", StandardCharsets.UTF_8);

        List<ActivityRow> rows = log.readAll();

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).cell("txnId")).isEqualTo("FHIC0000000001");
        assertThat(rows.get(0).isBlank("chequeId")).isTrue();
        assertThat(rows.get(0).metadata()).isEmpty();
    }

    @Test
    @DisplayName("旧表头的日志按其列顺序追加 / a log with an older header is appended in its own column order")
    void olderHeaderIsFollowed() throws Exception {
        Files.createDirectories(log.getPath().getParent());
        Files.writeString(log.getPath(), "timestamp,username,accountNumber,action,amount,mode,resultingBalance,txnId\n"
                + "01-01-2025 09:00:00,alice,562100000001,DEPOSIT,1000,CASH,1000,FHIC0000000001\n", StandardCharsets.UTF_8);

        log.append(record("FHIC0000000002", "500", "1500"));

        List<String> lines = Files.readAllLines(log.getPath(), StandardCharsets.UTF_8);
        assertThat(lines.get(2)).isEqualTo("01-01-2025 10:00:00,alice,562100000001,DEPOSIT,500,CASH,1500,FHIC0000000002");
        assertThat(log.readAll()).extracting(r -> r.cell("txnId")).containsExactly("FHIC0000000001", "FHIC0000000002");
    }

    @Test
    void appendToUnwritablePathFails() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        ActivityLog broken = new ActivityLog(blocker.resolve("account_activity.csv"), null);

        assertThatThrownBy(() -> broken.append(record("FHIC0000000001", "1", "1")))
                .isInstanceOf(ActivityLogException.class);
    }

    @Test
    @DisplayName("并发追加不丢行不交错 / concurrent appends neither lose nor interleave rows")
    void concurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        log.append(record("T" + thread + "-" + i, "1", String.valueOf(i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ActivityRow> rows = log.readAll();
        Set<String> ids = new HashSet<>();
        rows.forEach(r -> ids.add(r.cell("txnId")));
        assertThat(rows).hasSize(threads * perThread);
        assertThat(ids).hasSize(threads * perThread);
    }
}
