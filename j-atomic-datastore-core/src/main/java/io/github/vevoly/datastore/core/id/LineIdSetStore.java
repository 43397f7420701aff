package io.github.vevoly.datastore.core.id;

import io.github.vevoly.datastore.core.snapshot.AtomicFileWriter;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 每行一个编号 (NACH 号、账号、客户号).
 * <br>
 * <span style="color: gray;">One id per line (NACH ids, account numbers, customer ids).</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class LineIdSetStore implements IdSetStore {

    @Getter
    private final Path path;

    public LineIdSetStore(Path path) {
        this.path = path;
    }

    @Override
    public Set<String> load() throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        if (!Files.exists(path)) {
            return ids;
        }
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String id = line.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public void save(Set<String> ids) throws IOException {
        AtomicFileWriter.write(path, writer -> {
            for (String id : ids) {
                writer.write(id);
                writer.write('\n');
            }
        });
    }
}
