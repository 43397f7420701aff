package io.github.vevoly.datastore.core.id;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * <h3>编号集合存储 (Id Set Store)</h3>
 *
 * <p>已发放编号集合的文件格式。保存为整文件原子覆盖。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Id Set Store.</b><br>
 * File format of an issued-id set. Saves atomically overwrite the whole file.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface IdSetStore {

    /**
     * 读取集合，文件不存在时返回空集合.
     *
     * <span style="color: gray; font-size: 0.9em;">Read the set; an absent file yields an empty set.</span>
     *
     * @throws IOException 文件无法读取或格式损坏 (Unreadable or corrupt file)
     */
    Set<String> load() throws IOException;

    /**
     * 原子地覆盖保存.
     *
     * <span style="color: gray; font-size: 0.9em;">Atomically overwrite the file.</span>
     */
    void save(Set<String> ids) throws IOException;

    Path getPath();
}
