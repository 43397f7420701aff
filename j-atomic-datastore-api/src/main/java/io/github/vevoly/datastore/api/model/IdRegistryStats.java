package io.github.vevoly.datastore.api.model;

import lombok.Value;

/**
 * 编号注册表统计 / Id registry statistics
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class IdRegistryStats {
    String registry;
    int totalIds;
    String filePath;
    String prefix;
    int idLength;
}
