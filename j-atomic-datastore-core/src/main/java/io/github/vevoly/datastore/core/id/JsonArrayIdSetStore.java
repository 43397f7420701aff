package io.github.vevoly.datastore.core.id;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.github.vevoly.datastore.core.snapshot.AtomicFileWriter;
import lombok.Getter;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON 数组格式 (交易号).
 * <br>
 * <span style="color: gray;">JSON array format (transaction ids).</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class JsonArrayIdSetStore implements IdSetStore {

    private static final Type LIST_TYPE = new TypeToken<List<String>>() {}.getType();

    @Getter
    private final Path path;
    private final Gson gson;

    public JsonArrayIdSetStore(Path path, Gson gson) {
        this.path = path;
        this.gson = gson;
    }

    @Override
    public Set<String> load() throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        if (!Files.exists(path)) {
            return ids;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<String> list = gson.fromJson(reader, LIST_TYPE);
            if (list != null) {
                for (String id : list) {
                    if (id != null && !id.isBlank()) {
                        ids.add(id.trim());
                    }
                }
            }
        } catch (JsonParseException e) {
            throw new IOException("Corrupt id file " + path, e);
        }
        return ids;
    }

    @Override
    public void save(Set<String> ids) throws IOException {
        AtomicFileWriter.write(path, writer -> {
            try {
                gson.toJson(ids, LIST_TYPE, writer);
            } catch (JsonIOException e) {
                throw new IOException("Failed to serialize ids to " + path, e);
            }
        });
    }
}
