package io.github.vevoly.datastore.core.snapshot;

import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * <h3>原子文件写入器 (Atomic File Writer)</h3>
 *
 * <p>
 * 先写入同目录下的临时文件并刷盘，再原子重命名到目标文件；读者永远看不到写了一半的文件。
 * 若文件系统不支持原子移动，退化为 "复制覆盖 + 删除临时文件"。
 * 任何一步失败都会删除临时文件，目标文件保持原样。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Atomic File Writer.</b><br>
 * Writes to a temp file in the same directory, syncs it, then atomically renames it onto the target, so readers never
 * observe a half-written file. Falls back to copy-then-delete when atomic moves are unsupported.
 * Any failure removes the temp file and leaves the target untouched.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public final class AtomicFileWriter {

    private AtomicFileWriter() {
    }

    /**
     * 写入内容的回调 / Content callback
     */
    @FunctionalInterface
    public interface ContentWriter {
        void writeTo(Writer writer) throws IOException;
    }

    /**
     * 原子替换目标文件.
     *
     * @param target  目标文件 (Target file)
     * @param content 内容回调 (Content callback)
     * @throws IOException 写入或替换失败 (Write or replace failed). 此时目标文件未被修改。
     */
    public static void write(Path target, ContentWriter content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = tempFileOf(target);
        try {
            // 1. 写入临时文件并刷盘 / Write temp file and sync
            try (FileOutputStream out = new FileOutputStream(temp.toFile());
                 Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
                content.writeTo(writer);
                writer.flush();
                out.getFD().sync();
            }
            // 2. 原子重命名 / Atomic rename
            replace(temp, target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    /**
     * 临时文件路径：目标文件名 + .tmp / Temp path: target name + .tmp
     */
    public static Path tempFileOf(Path target) {
        return target.resolveSibling(target.getFileName().toString() + JAtomicDataStoreConstant.TEMP_FILE_SUFFIX);
    }

    private static void replace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("不支持原子移动，改用复制覆盖: {} / Atomic move unsupported, falling back to copy: {}", target, target);
            copyThenDelete(temp, target);
        } catch (IOException e) {
            log.warn("原子移动失败，改用复制覆盖: {} / Atomic move failed, falling back to copy: {}", target, target, e);
            copyThenDelete(temp, target);
        }
    }

    private static void copyThenDelete(Path temp, Path target) throws IOException {
        Files.copy(temp, target, StandardCopyOption.REPLACE_EXISTING);
        Files.delete(temp);
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("临时文件清理失败 / Failed to delete temp file {}", temp, e);
        }
    }
}
