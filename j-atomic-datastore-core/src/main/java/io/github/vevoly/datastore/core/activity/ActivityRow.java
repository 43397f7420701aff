package io.github.vevoly.datastore.core.activity;

import com.google.common.base.Strings;
import io.github.vevoly.datastore.api.utils.MoneyUtils;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * <h3>活动日志原始行 (Raw Activity Row)</h3>
 *
 * <p>按表头列名索引的原始字符串单元格。是否可用由读取方逐行判断。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Raw Activity Row.</b><br>
 * Raw string cells keyed by header name. Whether a row is usable is judged by the reader, row by row.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class ActivityRow {

    /**
     * 数据行序号，从 1 开始，不含表头 / 1-based data row number, header excluded
     */
    long rowNumber;

    Map<String, String> cells;

    /**
     * 取单元格，缺失时返回空串 / Cell value, empty string when missing
     */
    public String cell(String column) {
        return Strings.nullToEmpty(cells.get(column)).trim();
    }

    public boolean isBlank(String column) {
        return cell(column).isEmpty();
    }

    /**
     * 解析金额列.
     *
     * @return 金额，空单元格返回 null (Amount, null for an empty cell)
     * @throws NumberFormatException 非法数字 (Not a number)
     */
    public BigDecimal decimal(String column) {
        return MoneyUtils.parse(cell(column));
    }

    /**
     * 解析元数据列.
     *
     * @throws com.google.gson.JsonParseException 元数据 JSON 损坏 (Broken metadata JSON)
     */
    public Map<String, String> metadata() {
        return MetadataCodec.decode(cells.get("metadata"));
    }
}
