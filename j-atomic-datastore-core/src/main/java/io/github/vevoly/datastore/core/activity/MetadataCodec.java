package io.github.vevoly.datastore.core.activity;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h3>元数据编解码 (Metadata Codec)</h3>
 *
 * <p>
 * 元数据是一个字符串键值表。活动日志中以紧凑 JSON 对象存入单个 CSV 单元格；
 * 读取时同时兼容旧格式 {@code key=value;key=value}。
 * 快照 JSON 中同样兼容旧的字符串写法。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Metadata Codec.</b><br>
 * Metadata is a string-to-string map. In the activity log it is written as a compact JSON object inside one CSV cell;
 * reading also accepts the legacy {@code key=value;key=value} form, both in the log and in snapshot JSON.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class MetadataCodec {

    /**
     * 元数据字段的 Gson 类型 / Gson type of metadata fields
     */
    public static final Type METADATA_TYPE = new TypeToken<Map<String, String>>() {}.getType();

    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();
    private static final Splitter LEGACY_PAIRS = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter LEGACY_KEY_VALUE = Splitter.on('=').limit(2).trimResults();

    private MetadataCodec() {
    }

    /**
     * 编码为紧凑 JSON；空表编码为空串.
     * <br>
     * <span style="color: gray;">Encode as compact JSON; an empty map encodes to an empty string.</span>
     */
    public static String encode(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        return COMPACT.toJson(metadata, METADATA_TYPE);
    }

    /**
     * 解码单元格文本.
     * <br>
     * <span style="color: gray;">Decode cell text.</span>
     *
     * @param text JSON 对象或旧格式文本 (JSON object or legacy text)
     * @return 键值表，保持原顺序 (Map in original order)
     * @throws JsonParseException 以 '{' 开头但不是合法 JSON 对象 (Starts with '{' but is not a JSON object)
     */
    public static Map<String, String> decode(String text) {
        if (Strings.isNullOrEmpty(text) || text.isBlank()) {
            return Collections.emptyMap();
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("{")) {
            JsonElement element = JsonParser.parseString(trimmed);
            if (!element.isJsonObject()) {
                throw new JsonParseException("metadata is not a JSON object: " + trimmed);
            }
            return fromJsonObject(element.getAsJsonObject());
        }
        return decodeLegacy(trimmed);
    }

    static Map<String, String> decodeLegacy(String text) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String pair : LEGACY_PAIRS.split(text)) {
            List<String> kv = LEGACY_KEY_VALUE.splitToList(pair);
            if (kv.size() == 2) {
                result.put(kv.get(0), kv.get(1));
            }
        }
        return result;
    }

    private static Map<String, String> fromJsonObject(JsonObject object) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            result.put(entry.getKey(), value.isJsonPrimitive() ? value.getAsString() : value.toString());
        }
        return result;
    }

    /**
     * 快照 JSON 中元数据字段的适配器：对象照常读写，旧的字符串形式按旧格式解析.
     * <br>
     * <span style="color: gray;">Adapter for metadata fields in snapshot JSON: objects as usual, legacy strings parsed.</span>
     */
    public static TypeAdapter<Map<String, String>> snapshotAdapter() {
        return new TypeAdapter<>() {
            @Override
            public void write(JsonWriter out, Map<String, String> value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                out.beginObject();
                for (Map.Entry<String, String> entry : value.entrySet()) {
                    out.name(entry.getKey()).value(entry.getValue());
                }
                out.endObject();
            }

            @Override
            public Map<String, String> read(JsonReader in) throws IOException {
                JsonToken token = in.peek();
                if (token == JsonToken.NULL) {
                    in.nextNull();
                    return null;
                }
                if (token == JsonToken.STRING) {
                    return decodeLegacy(in.nextString());
                }
                return fromJsonObject(JsonParser.parseReader(in).getAsJsonObject());
            }
        };
    }
}
