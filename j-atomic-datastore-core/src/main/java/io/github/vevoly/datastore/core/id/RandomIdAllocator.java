package io.github.vevoly.datastore.core.id;

import com.google.gson.Gson;
import io.github.vevoly.datastore.api.IdAllocator;
import io.github.vevoly.datastore.api.constants.IdRegistryType;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.github.vevoly.datastore.api.exception.DataStoreErrorCode;
import io.github.vevoly.datastore.api.exception.IdAllocationException;
import io.github.vevoly.datastore.api.exception.IdExhaustedException;
import io.github.vevoly.datastore.api.exception.InitializationException;
import io.github.vevoly.datastore.api.model.IdRegistryStats;
import io.github.vevoly.datastore.core.clock.BankClock;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h3>随机编号分配器 (Random Id Allocator)</h3>
 *
 * <p>
 * 前缀 + (可选日期) + 随机数字，碰撞检查后重试，直到得到未发放过的编号或达到尝试上限。
 * 新编号在返回前已随整个集合原子落盘。所有操作在注入的注册表锁内执行。
 * </p>
 *
 * <ul>
 *     <li>{@link IdRegistryType.LoadPolicy#ONCE}: 首次使用时读取文件一次，之后以内存为准。</li>
 *     <li>{@link IdRegistryType.LoadPolicy#EVERY_CALL}: 每次调用前重新读取文件并与内存合并，集合只增不减。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Random Id Allocator.</b><br>
 * Prefix + (optional date) + random digits, retried on collision until an unused id is found or the attempt cap is hit.
 * The new id is atomically persisted with the whole set before it is returned. Every operation runs under the injected
 * registry lock.
 * <ul>
 *     <li>ONCE: the file is read on first use, memory is authoritative afterwards.</li>
 *     <li>EVERY_CALL: the file is re-read before each call and merged into memory; the set only grows.</li>
 * </ul>
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class RandomIdAllocator implements IdAllocator {

    private static final DateTimeFormatter NACH_DATE = DateTimeFormatter.ofPattern(JAtomicDataStoreConstant.NACH_DATE_PATTERN);

    private final IdRegistryType type;
    private final IdSetStore store;
    private final Lock lock;
    private final Random random;
    private final BankClock bankClock;
    private final int maxAttempts;
    private final Counter allocationCounter;
    private final Counter collisionCounter;

    private final Set<String> ids = new LinkedHashSet<>();
    private boolean loaded;

    private RandomIdAllocator(Builder builder) {
        this.type = builder.type;
        this.store = builder.store;
        this.lock = builder.lock;
        this.random = builder.random;
        this.bankClock = builder.bankClock;
        this.maxAttempts = builder.maxAttempts;
        this.allocationCounter = builder.metrics.idAllocationCounter(type.name());
        this.collisionCounter = builder.metrics.idCollisionCounter(type.name());
    }

    @Override
    public String generate() throws IdAllocationException {
        lock.lock();
        try {
            refresh();
            String datePart = type.isDateStamped() ? bankClock.today().format(NACH_DATE) : "";
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                String candidate = type.getPrefix() + datePart + randomDigits();
                if (!ids.add(candidate)) {
                    collisionCounter.increment();
                    continue;
                }
                try {
                    store.save(ids);
                } catch (IOException e) {
                    ids.remove(candidate);
                    throw new IdAllocationException(DataStoreErrorCode.ID_PERSIST_FAILED, type.name(),
                            "Failed to persist " + type.name() + " ids to " + store.getPath(), e);
                }
                allocationCounter.increment();
                return candidate;
            }
            log.error("[{}] 编号空间耗尽，已尝试 {} 次 / Id space exhausted after {} attempts", type, maxAttempts, maxAttempts);
            throw new IdExhaustedException(type.name(), maxAttempts);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isAllocated(String id) {
        lock.lock();
        try {
            refresh();
            return ids.contains(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int registerAll(Collection<String> candidates) {
        lock.lock();
        try {
            refresh();
            List<String> added = new ArrayList<>();
            for (String id : candidates) {
                if (id != null && !id.isBlank() && ids.add(id.trim())) {
                    added.add(id.trim());
                }
            }
            if (added.isEmpty()) {
                return 0;
            }
            try {
                store.save(ids);
            } catch (IOException e) {
                // 内存中保留登记，下次成功落盘时一并写出 / Kept in memory, written out with the next successful save
                log.error("[{}] 登记编号落盘失败 / Failed to persist {} registered ids", type, added.size(), e);
            }
            return added.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            refresh();
            return ids.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public IdRegistryStats getStatistics() {
        return new IdRegistryStats(type.name(), size(), store.getPath().toString(), type.getPrefix(), type.getIdLength());
    }

    @Override
    public IdRegistryType getType() {
        return type;
    }

    /**
     * 按加载策略同步磁盘内容，须持锁调用.
     * <br>
     * <span style="color: gray;">Sync with disk per load policy; caller holds the lock.</span>
     */
    private void refresh() {
        if (loaded && type.getLoadPolicy() == IdRegistryType.LoadPolicy.ONCE) {
            return;
        }
        try {
            ids.addAll(store.load());
        } catch (IOException e) {
            log.warn("[{}] 编号文件不可读，按空集合处理 / Id file unreadable, treated as empty: {}", type, store.getPath(), e);
        }
        loaded = true;
    }

    private String randomDigits() {
        StringBuilder digits = new StringBuilder(type.getRandomDigits());
        for (int i = 0; i < type.getRandomDigits(); i++) {
            digits.append(random.nextInt(10));
        }
        return digits.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 构建器 (Builder).
     */
    public static class Builder {
        private IdRegistryType type;
        private Path dataDir;
        private IdSetStore store;
        private Lock lock;
        private Random random;
        private BankClock bankClock;
        private Integer maxAttempts;
        private Gson gson;
        private DataStoreMetricManager metrics;

        public Builder type(IdRegistryType type) {
            this.type = type;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /**
         * 自定义存储 (缺省按注册表类型选择文件格式) / Custom store (defaults to the registry's file format)
         */
        public Builder store(IdSetStore store) {
            this.store = store;
            return this;
        }

        public Builder lock(Lock lock) {
            this.lock = lock;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder bankClock(BankClock bankClock) {
            this.bankClock = bankClock;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder gson(Gson gson) {
            this.gson = gson;
            return this;
        }

        public Builder metrics(DataStoreMetricManager metrics) {
            this.metrics = metrics;
            return this;
        }

        public RandomIdAllocator build() throws InitializationException {
            if (type == null) {
                throw new InitializationException("Id registry type must be set");
            }
            if (maxAttempts == null) {
                maxAttempts = type.getDefaultMaxAttempts();
            }
            if (maxAttempts < 1) {
                throw new InitializationException("maxAttempts must be positive for " + type + ": " + maxAttempts);
            }
            if (store == null) {
                if (dataDir == null) {
                    throw new InitializationException("Either dataDir or store must be set for " + type);
                }
                Path file = dataDir.resolve(type.getFileName());
                store = type.getFileFormat() == IdRegistryType.IdFileFormat.JSON_ARRAY
                        ? new JsonArrayIdSetStore(file, gson == null ? new Gson() : gson)
                        : new LineIdSetStore(file);
            }
            if (lock == null) {
                lock = new ReentrantLock();
            }
            if (random == null) {
                random = new SecureRandom();
            }
            if (bankClock == null) {
                bankClock = new BankClock();
            }
            if (metrics == null) {
                metrics = DataStoreMetricManager.standalone();
            }
            return new RandomIdAllocator(this);
        }
    }
}
