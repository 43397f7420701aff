package io.github.vevoly.datastore.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import io.github.vevoly.datastore.api.IdAllocator;
import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.github.vevoly.datastore.api.exception.ActivityLogException;
import io.github.vevoly.datastore.api.exception.IdAllocationException;
import io.github.vevoly.datastore.api.exception.InitializationException;
import io.github.vevoly.datastore.api.exception.SnapshotLoadException;
import io.github.vevoly.datastore.api.exception.SnapshotSaveException;
import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.model.ActivityRecord;
import io.github.vevoly.datastore.api.model.Customer;
import io.github.vevoly.datastore.api.model.Loan;
import io.github.vevoly.datastore.api.model.SnapshotEntity;
import io.github.vevoly.datastore.api.model.Transaction;
import io.github.vevoly.datastore.api.model.TransactionType;
import io.github.vevoly.datastore.core.activity.ActivityLog;
import io.github.vevoly.datastore.core.clock.BankClock;
import io.github.vevoly.datastore.core.id.RandomIdAllocator;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import io.github.vevoly.datastore.core.replay.ReplayEngine;
import io.github.vevoly.datastore.core.replay.ReplayReport;
import io.github.vevoly.datastore.core.snapshot.AccountCsvMirror;
import io.github.vevoly.datastore.core.snapshot.DataStoreGson;
import io.github.vevoly.datastore.core.snapshot.SnapshotCollection;
import io.github.vevoly.datastore.core.snapshot.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * <h3>账本数据存储门面 (Ledger Data Store)</h3>
 *
 * <p>
 * 这是对外暴露的统一入口，组合了 <b>快照 + 只追加活动日志</b> 的混合存储：
 * 业务操作计算新余额与交易，先通过 {@link #appendActivity(ActivityRecord)} 同步落盘，稍后再 {@link #saveAccounts(List)}；
 * 启动时 {@link #loadAccounts()} 读取快照，并由重放引擎补入日志中快照缺失的交易、恢复余额。
 * </p>
 *
 * <h3>数据流 (Data flow):</h3>
 * <pre>
 * Operation -> Transaction -> ActivityLog (append + force) -> Account (memory) -> SnapshotStore (atomic replace)
 * Start     -> SnapshotStore (JSON, CSV fallback) -> ReplayEngine (ActivityLog) -> Accounts
 * </pre>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Data Store (Facade).</b><br>
 * The unified entry point over a hybrid <b>snapshot + append-only activity log</b> store: an operation computes the new
 * balance and a transaction, makes it durable through {@link #appendActivity(ActivityRecord)}, and later calls
 * {@link #saveAccounts(List)}. On start {@link #loadAccounts()} reads the snapshot and the replay engine patches in
 * logged transactions the snapshot is missing, restoring balances.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class LedgerDataStore {

    @Getter
    private final Path baseDir;

    @Getter
    private final BankClock bankClock;

    @Getter
    private final ActivityLog activityLog;

    private final SnapshotStore snapshotStore;
    private final AccountCsvMirror accountCsvMirror;
    private final ReplayEngine replayEngine;
    private final Map<IdRegistryType, RandomIdAllocator> allocators;

    /**
     * 门面锁，串行化集合的加载与保存 / Facade lock serializing collection loads and saves
     */
    private final Lock lock = new ReentrantLock();

    private LedgerDataStore(Builder builder, Path baseDir, DataStoreMetricManager metrics) throws InitializationException {
        this.baseDir = baseDir;
        this.bankClock = builder.bankClock;
        this.snapshotStore = new SnapshotStore(baseDir, builder.gson, metrics);
        this.accountCsvMirror = new AccountCsvMirror(baseDir.resolve(JAtomicDataStoreConstant.ACCOUNTS_CSV_FILE));
        this.activityLog = new ActivityLog(baseDir.resolve(JAtomicDataStoreConstant.ACTIVITY_LOG_FILE), metrics);
        this.replayEngine = new ReplayEngine(activityLog, metrics.replayAppliedCounter());
        this.allocators = new EnumMap<>(IdRegistryType.class);
        for (IdRegistryType type : IdRegistryType.values()) {
            RandomIdAllocator.Builder allocator = RandomIdAllocator.builder()
                    .type(type)
                    .dataDir(baseDir)
                    .random(builder.random)
                    .bankClock(builder.bankClock)
                    .gson(builder.gson)
                    .metrics(metrics);
            Integer attempts = builder.maxAttempts.get(type);
            if (attempts != null) {
                allocator.maxAttempts(attempts);
            }
            allocators.put(type, allocator.build());
        }
        log.info("数据存储已初始化, 目录: {} / Data store initialized, dir: {}", baseDir, baseDir);
    }

    // ------------------------------------------------------------------ accounts

    /**
     * 加载账户并重放活动日志.
     * <p>
     * JSON 快照缺失或损坏时从 CSV 镜像重建最小账户。重放失败 (日志不可读) 只记录错误，返回快照内容。
     * 快照中带注册表前缀的账号与客户号会登记到对应的编号分配器。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Load accounts and replay the activity log.</b><br>
     * When the JSON snapshot is missing or corrupt, minimal accounts are rebuilt from the CSV mirror. A replay failure
     * (unreadable log) is logged and the snapshot content is returned. Account numbers and customer ids carrying the
     * registry prefix are reserved in their allocators.
     * </span>
     *
     * @return 账户列表 (可修改) / Mutable list of accounts
     */
    public List<Account> loadAccounts() {
        lock.lock();
        try {
            List<Account> accounts = readAccountSnapshot();
            try {
                ReplayReport report = replayEngine.replay(accounts);
                if (report.getApplied() > 0) {
                    log.info("从活动日志补入 {} 笔交易 / Patched {} transactions from the activity log",
                            report.getApplied(), report.getApplied());
                }
            } catch (ActivityLogException e) {
                log.error("活动日志重放失败，使用快照内容 / Replay failed, using snapshot content", e);
            }
            reserveAccountIds(accounts);
            return accounts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 加载账户，不重放 (诊断/工具用).
     * <br>
     * <span style="color: gray;">Load accounts without replay (diagnostics / tooling).</span>
     */
    public List<Account> loadAccountsWithoutReplay() {
        lock.lock();
        try {
            List<Account> accounts = readAccountSnapshot();
            reserveAccountIds(accounts);
            return accounts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 保存账户：JSON 快照与 CSV 镜像，各自原子替换.
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Save accounts:</b> JSON snapshot and CSV mirror, each atomically replaced.
     * </span>
     *
     * @param accounts 账户列表 (Accounts)
     * @return JSON 快照是否保存成功；CSV 镜像失败只记录日志 (Whether the JSON snapshot was saved; a CSV mirror failure is only logged)
     */
    public boolean saveAccounts(List<Account> accounts) {
        lock.lock();
        try {
            boolean saved = save(SnapshotCollection.ACCOUNTS, accounts);
            try {
                accountCsvMirror.write(accounts);
            } catch (IOException e) {
                log.error("账户 CSV 镜像保存失败 / Failed to save account CSV mirror", e);
            }
            return saved;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ customers & loans

    /**
     * 加载客户，损坏时返回空列表 / Load customers; empty list when corrupt
     */
    public List<Customer> loadCustomers() {
        lock.lock();
        try {
            List<Customer> customers = load(SnapshotCollection.CUSTOMERS);
            List<String> ids = new ArrayList<>();
            for (Customer customer : customers) {
                addIfPrefixed(ids, customer.getCustomerId(), IdRegistryType.CUSTOMER_ID);
            }
            reserve(IdRegistryType.CUSTOMER_ID, ids);
            return customers;
        } finally {
            lock.unlock();
        }
    }

    public boolean saveCustomers(List<Customer> customers) {
        lock.lock();
        try {
            return save(SnapshotCollection.CUSTOMERS, customers);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 加载贷款，损坏时返回空列表 / Load loans; empty list when corrupt
     */
    public List<Loan> loadLoans() {
        lock.lock();
        try {
            return load(SnapshotCollection.LOANS);
        } finally {
            lock.unlock();
        }
    }

    public boolean saveLoans(List<Loan> loans) {
        lock.lock();
        try {
            return save(SnapshotCollection.LOANS, loans);
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ activity

    /**
     * 追加活动记录 (同步落盘).
     * <br>
     * <span style="color: gray;">Append an activity record (durable before returning).</span>
     *
     * @throws ActivityLogException 写入失败，事件未持久化 (Write failed; the event is not durable)
     */
    public void appendActivity(ActivityRecord record) throws ActivityLogException {
        activityLog.append(record);
    }

    /**
     * 记录一笔交易 (标准写入路径).
     * <p>
     * 分配交易号，按银行时钟打时间戳，先写活动日志，成功后再追加到账户并更新余额。
     * 日志写入失败时账户保持不变。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Record a transaction (standard append path).</b><br>
     * Allocates the id, stamps it with the bank clock, appends the activity row, and only then appends the transaction
     * to the account and sets the balance. On a log failure the account is left untouched.
     * </span>
     *
     * @param account          账户 (Account)
     * @param type             交易类型 (Type)
     * @param amount           金额 (Amount)
     * @param resultingBalance 交易后余额 (Balance after the transaction)
     * @param mode             渠道，可为 null (Channel, nullable)
     * @param details          补充字段 (分类、商户、元数据等)，可为 null (Extra fields, nullable)
     * @return 已记录的交易 (Recorded transaction)
     * @throws IdAllocationException 交易号分配失败 (Id allocation failed)
     * @throws ActivityLogException  日志写入失败 (Log append failed)
     */
    public Transaction recordTransaction(Account account, TransactionType type, BigDecimal amount,
                                         BigDecimal resultingBalance, String mode,
                                         Consumer<Transaction.TransactionBuilder> details)
            throws IdAllocationException, ActivityLogException {
        Preconditions.checkNotNull(account, "account");
        Preconditions.checkNotNull(type, "type");
        Preconditions.checkNotNull(amount, "amount");
        Preconditions.checkNotNull(resultingBalance, "resultingBalance");

        Transaction.TransactionBuilder builder = Transaction.builder();
        if (details != null) {
            details.accept(builder);
        }
        Transaction transaction = builder
                .id(transactionIds().generate())
                .type(type)
                .amount(amount)
                .resultingBalance(resultingBalance)
                .timestamp(bankClock.formattedDateTime())
                .build();

        activityLog.append(ActivityRecord.of(account.getUsername(), account.getAccountNumber(), transaction, mode));
        account.appendTransaction(transaction);
        account.setBalance(resultingBalance);
        return transaction;
    }

    // ------------------------------------------------------------------ allocators

    public IdAllocator idAllocator(IdRegistryType type) {
        return allocators.get(type);
    }

    public IdAllocator transactionIds() {
        return idAllocator(IdRegistryType.TRANSACTION);
    }

    public IdAllocator nachIds() {
        return idAllocator(IdRegistryType.NACH);
    }

    public IdAllocator accountNumbers() {
        return idAllocator(IdRegistryType.ACCOUNT_NUMBER);
    }

    public IdAllocator customerIds() {
        return idAllocator(IdRegistryType.CUSTOMER_ID);
    }

    // ------------------------------------------------------------------ internals

    private List<Account> readAccountSnapshot() {
        if (Files.exists(snapshotStore.pathOf(SnapshotCollection.ACCOUNTS))) {
            try {
                return snapshotStore.load(SnapshotCollection.ACCOUNTS);
            } catch (SnapshotLoadException e) {
                log.warn("账户快照损坏，尝试 CSV 镜像 / Account snapshot corrupt, trying CSV mirror", e);
                preserveCorrupt(SnapshotCollection.ACCOUNTS);
            }
        }
        if (!accountCsvMirror.exists()) {
            return new ArrayList<>();
        }
        try {
            List<Account> accounts = accountCsvMirror.read();
            log.warn("已从 CSV 镜像重建 {} 个账户 (无交易历史) / Rebuilt {} accounts from CSV mirror (no history)",
                    accounts.size(), accounts.size());
            return accounts;
        } catch (IOException e) {
            log.error("账户 CSV 镜像读取失败 / Failed to read account CSV mirror", e);
            return new ArrayList<>();
        }
    }

    private void reserveAccountIds(List<Account> accounts) {
        List<String> numbers = new ArrayList<>();
        List<String> customers = new ArrayList<>();
        for (Account account : accounts) {
            addIfPrefixed(numbers, account.getAccountNumber(), IdRegistryType.ACCOUNT_NUMBER);
            addIfPrefixed(customers, account.getCustomerId(), IdRegistryType.CUSTOMER_ID);
        }
        reserve(IdRegistryType.ACCOUNT_NUMBER, numbers);
        reserve(IdRegistryType.CUSTOMER_ID, customers);
    }

    private static void addIfPrefixed(List<String> target, String id, IdRegistryType type) {
        if (!Strings.isNullOrEmpty(id) && id.startsWith(type.getPrefix())) {
            target.add(id);
        }
    }

    private void reserve(IdRegistryType type, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        int added = allocators.get(type).registerAll(ids);
        if (added > 0) {
            log.info("[{}] 登记已有编号 {} 个 / Reserved {} existing ids", type, added, added);
        }
    }

    private <T extends SnapshotEntity> List<T> load(SnapshotCollection<T> collection) {
        try {
            return snapshotStore.load(collection);
        } catch (SnapshotLoadException e) {
            log.error("快照加载失败 [{}]，返回空列表 / Failed to load [{}], returning empty list",
                    collection.getName(), collection.getName(), e);
            preserveCorrupt(collection);
            return new ArrayList<>();
        }
    }

    private void preserveCorrupt(SnapshotCollection<?> collection) {
        try {
            snapshotStore.preserveCorrupt(collection);
        } catch (IOException e) {
            log.error("损坏快照另存失败 [{}] / Failed to preserve corrupt snapshot [{}]",
                    collection.getName(), collection.getName(), e);
        }
    }

    private <T extends SnapshotEntity> boolean save(SnapshotCollection<T> collection, List<T> items) {
        try {
            snapshotStore.save(collection, items);
            return true;
        } catch (SnapshotSaveException e) {
            log.error("快照保存失败 [{}]，原文件保持不变 / Failed to save [{}], previous file kept",
                    collection.getName(), collection.getName(), e);
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 数据存储构建器 (Data Store Builder).
     * <p>用于配置和组装 LedgerDataStore。</p>
     */
    @Getter
    public static class Builder {
        // 基础配置 / Base Configuration
        private Path baseDir = Paths.get(JAtomicDataStoreConstant.DEFAULT_BASE_DIR);
        private BankClock bankClock;
        private Random random;
        private Gson gson;
        // Metrics
        private MeterRegistry meterRegistry;
        private String metricsPrefix;
        // 每个注册表的尝试上限 / Per-registry attempt cap
        private final Map<IdRegistryType, Integer> maxAttempts = new EnumMap<>(IdRegistryType.class);

        public Builder baseDir(Path dir) {
            this.baseDir = dir;
            return this;
        }

        public Builder baseDir(String dir) {
            this.baseDir = dir == null ? null : Paths.get(dir);
            return this;
        }

        public Builder bankClock(BankClock clock) {
            this.bankClock = clock;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder gson(Gson gson) {
            this.gson = gson;
            return this;
        }

        public Builder meterRegistry(MeterRegistry registry) {
            this.meterRegistry = registry;
            return this;
        }

        public Builder metricsPrefix(String prefix) {
            this.metricsPrefix = prefix;
            return this;
        }

        public Builder maxAttempts(IdRegistryType type, int attempts) {
            this.maxAttempts.put(type, attempts);
            return this;
        }

        public LedgerDataStore build() throws InitializationException {
            if (baseDir == null) {
                throw new InitializationException("Base directory is required.");
            }
            for (Map.Entry<IdRegistryType, Integer> entry : maxAttempts.entrySet()) {
                if (entry.getValue() < 1) {
                    throw new InitializationException("maxAttempts must be positive for " + entry.getKey() + ": " + entry.getValue());
                }
            }
            Path dir = baseDir.toAbsolutePath().normalize();
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new InitializationException("Cannot create data directory " + dir, e);
            }
            if (bankClock == null) {
                bankClock = new BankClock();
            }
            if (random == null) {
                random = new SecureRandom();
            }
            if (gson == null) {
                gson = DataStoreGson.create();
            }
            DataStoreMetricManager metrics = new DataStoreMetricManager(metricsPrefix, meterRegistry);
            return new LedgerDataStore(this, dir, metrics);
        }
    }
}
