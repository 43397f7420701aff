package io.github.vevoly.datastore.core.activity;

import com.google.common.base.Strings;
import io.github.vevoly.datastore.api.exception.ActivityLogException;
import io.github.vevoly.datastore.api.exception.DataStoreErrorCode;
import io.github.vevoly.datastore.api.model.ActivityRecord;
import io.github.vevoly.datastore.api.utils.MoneyUtils;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * <h3>活动日志 (Activity Log)</h3>
 *
 * <p>
 * 只追加的 CSV 文件，每个影响余额的事件一行，写入后立即 {@code force} 到磁盘，从不改写。
 * 首次写入时创建文件与表头；已有文件按其自身表头的列顺序写入。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Activity Log.</b><br>
 * Append-only CSV file, one row per balance-affecting event, forced to disk before the append returns and never rewritten.
 * The file and its header row are created on first use; an existing file is written in the column order of its own header.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class ActivityLog {

    private static final String UTF8_BOM = "\uFEFF";

    @Getter
    private final Path path;

    private final Lock lock = new ReentrantLock();

    /**
     * 当前文件的表头；null 表示下次追加前需要检查文件 / Header of the file; null until the file has been inspected
     */
    private List<String> fileHeader;

    private final Counter appendCounter;
    private final Timer appendTimer;

    public ActivityLog(Path path, DataStoreMetricManager metrics) {
        this.path = path;
        DataStoreMetricManager m = metrics == null ? DataStoreMetricManager.standalone() : metrics;
        this.appendCounter = m.activityAppendCounter();
        this.appendTimer = m.activityAppendTimer();
    }

    /**
     * 追加一行并落盘.
     * <p>本实例首次追加前 (以及文件未以换行结尾时) 检查文件尾部：若上次崩溃留下残行 (未以换行结束或停在引号字段内)，先写入一段封闭残行的保护内容，
     * 使残行成为列数超出表头的行并在读取时被跳过，之后的行不受影响；只写了一部分的表头会被补全。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Append one row durably.</b><br>
     * Before the first append of this instance, and whenever the file does not end with a newline, the tail is inspected. A row torn by a crash (no trailing newline,
     * or stopped inside a quoted cell) is closed by a guard that turns it into a row wider than the header, so readers
     * skip it and later rows stay intact. A partially written header is completed.
     * </span>
     *
     * @param record 活动记录 (Activity record)
     * @throws ActivityLogException 写入或落盘失败，事件未持久化 (Write or force failed; the event is not durable)
     */
    public void append(ActivityRecord record) throws ActivityLogException {
        lock.lock();
        long start = System.nanoTime();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.READ)) {
                long size = channel.size();
                StringBuilder out = new StringBuilder();
                if (size == 0) {
                    fileHeader = ActivityRecord.HEADER;
                    out.append(CsvCodec.formatRow(ActivityRecord.HEADER));
                } else if (fileHeader == null || !endsWithNewline(channel, size)) {
                    out.append(recoverTail(channel, size));
                }
                out.append(CsvCodec.formatRow(toCells(record, fileHeader)));
                ByteBuffer buffer = ByteBuffer.wrap(out.toString().getBytes(StandardCharsets.UTF_8));
                long position = size;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(true);
            }
            appendCounter.increment();
        } catch (IOException e) {
            fileHeader = null;
            throw new ActivityLogException(DataStoreErrorCode.ACTIVITY_WRITE_FAILED,
                    "Failed to append activity " + record.getAction() + " / " + record.getTxnId() + " to " + path, e);
        } finally {
            appendTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            lock.unlock();
        }
    }

    /**
     * 按文件顺序遍历数据行.
     * <p>单元格按表头列名映射；缺少末尾单元格的行照常返回 (缺失列读作空)，列数多于表头的行 (崩溃残行) 记录告警后跳过。文件不存在时不做任何事。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Stream data rows in file order.</b><br>
     * Cells are mapped by header name. Rows missing trailing cells are returned as is (missing columns read as empty);
     * rows wider than the header (torn by a crash) are skipped with a warning. A missing file yields nothing.
     * </span>
     *
     * @param consumer 行消费者 (Row consumer)
     * @throws ActivityLogException 文件无法读取 (File unreadable)
     */
    public void forEach(Consumer<ActivityRow> consumer) throws ActivityLogException {
        lock.lock();
        try {
            if (!Files.exists(path)) {
                return;
            }
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                CsvCodec.RecordReader records = new CsvCodec.RecordReader(reader);
                List<String> header = readHeader(records);
                if (header == null) {
                    return;
                }
                long rowNumber = 0;
                List<String> cells;
                while ((cells = records.next()) != null) {
                    if (isEmptyLine(cells)) {
                        continue;
                    }
                    rowNumber++;
                    if (cells.size() > header.size()) {
                        log.warn("跳过损坏的活动日志行 #{} ({} 列, 表头 {} 列) / Skipping unreadable activity row #{} ({} cells, header has {})",
                                rowNumber, cells.size(), header.size(), rowNumber, cells.size(), header.size());
                        continue;
                    }
                    Map<String, String> row = new LinkedHashMap<>();
                    for (int i = 0; i < cells.size(); i++) {
                        row.put(header.get(i), cells.get(i));
                    }
                    consumer.accept(new ActivityRow(rowNumber, row));
                }
            }
        } catch (IOException e) {
            throw new ActivityLogException(DataStoreErrorCode.ACTIVITY_READ_FAILED, "Failed to read activity log " + path, e);
        } finally {
            lock.unlock();
        }
    }

    public List<ActivityRow> readAll() throws ActivityLogException {
        List<ActivityRow> rows = new ArrayList<>();
        forEach(rows::add);
        return rows;
    }

    /**
     * 可读数据行数 / Number of readable data rows
     */
    public long size() throws ActivityLogException {
        AtomicLong count = new AtomicLong();
        forEach(row -> count.incrementAndGet());
        return count.get();
    }

    public boolean exists() {
        return Files.exists(path);
    }

    static List<String> toCells(ActivityRecord record) {
        return Arrays.asList(
                record.getTimestamp(),
                record.getUsername(),
                record.getAccountNumber(),
                record.getAction(),
                MoneyUtils.toText(record.getAmount()),
                record.getMode(),
                MoneyUtils.toText(record.getResultingBalance()),
                record.getTxnId(),
                record.getChequeId(),
                MetadataCodec.encode(record.getMetadata()));
    }

    /**
     * 按给定表头排列单元格，表头中没有的列不写 / Arrange cells in the given header order; columns it lacks are not written
     */
    static List<String> toCells(ActivityRecord record, List<String> header) {
        List<String> cells = toCells(record);
        if (ActivityRecord.HEADER.equals(header)) {
            return cells;
        }
        List<String> arranged = new ArrayList<>(header.size());
        for (String column : header) {
            int index = ActivityRecord.HEADER.indexOf(column);
            arranged.add(index < 0 ? "" : cells.get(index));
        }
        return arranged;
    }

    /**
     * 检查已有文件的表头与尾部，返回写在新行之前的内容.
     * <br>
     * <span style="color: gray;">Inspect the header and tail of an existing file; returns what must precede the next row.</span>
     */
    private String recoverTail(FileChannel channel, long size) throws IOException {
        TailScan tail = TailScan.of(channel, size);
        String headerLine = CsvCodec.formatRow(ActivityRecord.HEADER);
        if (!tail.recordEnded && size < headerLine.length()) {
            String fragment = readText(channel, size);
            if (headerLine.startsWith(fragment)) {
                log.warn("活动日志表头不完整，已补全 / Activity log header was torn, completed: {}", path);
                fileHeader = ActivityRecord.HEADER;
                return headerLine.substring(fragment.length());
            }
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<String> header = readHeader(new CsvCodec.RecordReader(reader));
            fileHeader = header == null ? ActivityRecord.HEADER : header;
        }
        if (!ActivityRecord.HEADER.equals(fileHeader)) {
            log.warn("活动日志表头与当前格式不同，按文件表头写入 / Activity log header differs from the current layout, writing by the file header: {}",
                    fileHeader);
        }
        if (!tail.insideQuotes && tail.lastByte == '\n') {
            return "";
        }
        log.warn("活动日志末行不完整，已封闭残行 / Activity log ends with a torn row, fragment closed: {}", path);
        return (tail.insideQuotes ? "\"" : "") + Strings.repeat(",", fileHeader.size()) + "\n";
    }

    private static String readText(FileChannel channel, long size) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        long position = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        return new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
    }

    private static List<String> readHeader(CsvCodec.RecordReader records) throws IOException {
        List<String> first;
        do {
            first = records.next();
        } while (first != null && isEmptyLine(first));
        if (first == null) {
            return null;
        }
        List<String> header = new ArrayList<>(first.size());
        for (String name : first) {
            header.add(name.replace(UTF8_BOM, "").trim());
        }
        return header;
    }

    private static boolean isEmptyLine(List<String> cells) {
        return cells.size() == 1 && cells.get(0).isBlank();
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    /**
     * 文件尾部状态：双引号出现次数的奇偶决定是否停在引号字段内 (引号字段之外不会出现双引号).
     * <br>
     * <span style="color: gray;">Tail state: the parity of quote characters tells whether the file stops inside a quoted
     * cell (quotes never appear outside quoted cells).</span>
     */
    private static final class TailScan {

        private static final int CHUNK = 8192;

        boolean insideQuotes;
        boolean recordEnded;
        int lastByte = -1;

        static TailScan of(FileChannel channel, long size) throws IOException {
            TailScan scan = new TailScan();
            ByteBuffer buffer = ByteBuffer.allocate(CHUNK);
            long position = 0;
            while (position < size) {
                buffer.clear();
                int read = channel.read(buffer, position);
                if (read <= 0) {
                    break;
                }
                for (int i = 0; i < read; i++) {
                    byte b = buffer.get(i);
                    if (b == '"') {
                        scan.insideQuotes = !scan.insideQuotes;
                    } else if (b == '\n' && !scan.insideQuotes) {
                        scan.recordEnded = true;
                    }
                    scan.lastByte = b;
                }
                position += read;
            }
            return scan;
        }
    }
}
