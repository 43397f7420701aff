package io.github.vevoly.datastore.core.snapshot;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import io.github.vevoly.datastore.api.exception.SnapshotLoadException;
import io.github.vevoly.datastore.api.exception.SnapshotSaveException;
import io.github.vevoly.datastore.api.model.SnapshotEntity;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h3>快照存储 (Snapshot Store)</h3>
 *
 * <p>
 * 负责实体集合的 JSON 序列化与持久化。使用 <b>Gson</b> 序列化，并使用 <b>原子文件操作</b> 保证数据的完整性：
 * 任一时刻目标文件要么是旧快照，要么是完整的新快照。保存由存储锁串行化，后写者生效。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Store.</b><br>
 * JSON serialization and persistence of entity collections. Uses <b>Gson</b> and <b>Atomic File Operations</b>:
 * at any instant the target is either the old snapshot or the complete new one. Saves are serialized by the store
 * lock; last writer wins.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class SnapshotStore {

    @Getter
    private final Path directory;
    private final Gson gson;
    private final DataStoreMetricManager metrics;
    private final Lock lock = new ReentrantLock();

    public SnapshotStore(Path directory, Gson gson, DataStoreMetricManager metrics) {
        this.directory = directory;
        this.gson = gson == null ? DataStoreGson.create() : gson;
        this.metrics = metrics == null ? DataStoreMetricManager.standalone() : metrics;
    }

    public Path pathOf(SnapshotCollection<?> collection) {
        return directory.resolve(collection.getFileName());
    }

    /**
     * 执行快照保存 (原子写入).
     * <p>失败时删除临时文件，原快照保持不变。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Execute Snapshot Saving (Atomic Write).</b><br>
     * On failure the temp file is removed and the previous snapshot is untouched.
     * </span>
     *
     * @param collection 集合 (Collection)
     * @param items      实体列表 (Entities)
     * @throws SnapshotSaveException 序列化或文件操作失败 (Serialization or file operation failed)
     */
    public <T extends SnapshotEntity> void save(SnapshotCollection<T> collection, List<T> items) throws SnapshotSaveException {
        Path target = pathOf(collection);
        Timer.Sample sample = Timer.start(metrics.getRegistry());
        lock.lock();
        try {
            AtomicFileWriter.write(target, writer -> {
                try {
                    gson.toJson(items, collection.getListType(), writer);
                } catch (JsonIOException e) {
                    throw new IOException("Failed to serialize " + collection.getName(), e);
                }
            });
            log.info("快照保存成功 [{}], 条数: {} / Snapshot saved [{}], count: {}",
                    collection.getName(), items.size(), collection.getName(), items.size());
        } catch (IOException | RuntimeException e) {
            metrics.snapshotSaveFailureCounter(collection.getName()).increment();
            throw new SnapshotSaveException(collection.getName(), "Failed to save snapshot to " + target, e);
        } finally {
            lock.unlock();
            sample.stop(metrics.snapshotSaveTimer(collection.getName()));
        }
    }

    /**
     * 加载快照.
     * <p>文件不存在返回空列表；空文件、JSON 损坏、空元素或校验失败一律抛出异常。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Load Snapshot.</b><br>
     * A missing file yields an empty list; an empty file, broken JSON, a null element or a failed validation all throw.
     * </span>
     *
     * @param collection 集合 (Collection)
     * @return 可修改的实体列表 (Mutable list of entities)
     * @throws SnapshotLoadException 快照损坏 (Corrupt snapshot)
     */
    public <T extends SnapshotEntity> List<T> load(SnapshotCollection<T> collection) throws SnapshotLoadException {
        Path file = pathOf(collection);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                log.info("未发现快照文件 [{}] / No snapshot found for [{}]", collection.getName(), collection.getName());
                return new ArrayList<>();
            }
            String json;
            try {
                json = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new SnapshotLoadException(collection.getName(), "Failed to read " + file, e);
            }
            if (json.isBlank()) {
                throw new SnapshotLoadException(collection.getName(), "Snapshot file is empty: " + file);
            }
            List<T> items;
            try {
                items = gson.fromJson(json, collection.getListType());
            } catch (JsonParseException e) {
                throw new SnapshotLoadException(collection.getName(), "Malformed JSON in " + file, e);
            }
            if (items == null) {
                throw new SnapshotLoadException(collection.getName(), "Snapshot holds no array: " + file);
            }
            for (int i = 0; i < items.size(); i++) {
                T item = items.get(i);
                if (item == null) {
                    throw new SnapshotLoadException(collection.getName(), "Null entry at index " + i);
                }
                try {
                    item.validate();
                } catch (IllegalStateException e) {
                    throw new SnapshotLoadException(collection.getName(), "Invalid entry at index " + i + ": " + e.getMessage(), e);
                }
            }
            log.info("快照加载成功 [{}], 条数: {} / Snapshot loaded [{}], count: {}",
                    collection.getName(), items.size(), collection.getName(), items.size());
            return new ArrayList<>(items);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 将损坏的快照复制为 {@code <文件名>.corrupt-<毫秒>}，避免之后的保存覆盖唯一副本.
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Copy a corrupt snapshot to {@code <file>.corrupt-<millis>} so a later save cannot overwrite the only copy.
     * </span>
     *
     * @param collection 集合 (Collection)
     * @return 副本路径 (Path of the copy)
     * @throws IOException 复制失败 (Copy failed)
     */
    public Path preserveCorrupt(SnapshotCollection<?> collection) throws IOException {
        Path file = pathOf(collection);
        Path copy = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        lock.lock();
        try {
            Files.copy(file, copy, StandardCopyOption.COPY_ATTRIBUTES);
        } finally {
            lock.unlock();
        }
        log.warn("损坏的快照已另存 [{}]: {} / Corrupt snapshot preserved [{}]: {}",
                collection.getName(), copy, collection.getName(), copy);
        return copy;
    }
}
