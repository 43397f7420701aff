package io.github.vevoly.datastore.core.snapshot;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.vevoly.datastore.core.activity.MetadataCodec;

/**
 * 快照使用的 Gson 配置 (缩进输出，兼容旧的元数据字符串).
 * <br>
 * <span style="color: gray;">Gson setup for snapshots (pretty printed, legacy metadata strings accepted).</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class DataStoreGson {

    private DataStoreGson() {
    }

    public static GsonBuilder builder() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .registerTypeAdapter(MetadataCodec.METADATA_TYPE, MetadataCodec.snapshotAdapter());
    }

    public static Gson create() {
        return builder().create();
    }
}
