package io.github.vevoly.datastore.api.utils;

import com.google.common.base.Strings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * <h3>金额工具类 (Money Utility)</h3>
 *
 * <p>
 * 负责金额在 <b>文本格式 (CSV 单元格)</b> 与 <b>{@link BigDecimal}</b> 之间的转换，以及展示格式化。
 * 存储层不对金额做任何舍入，写出的文本与读入的数值保持一致。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Money Utility.</b><br>
 * Converts amounts between <b>text (CSV cells)</b> and <b>{@link BigDecimal}</b>, and formats them for display.
 * The store never rounds: the text written is exactly the value that is read back.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class MoneyUtils {

    /**
     * 展示精度：2位小数
     * <br>
     * <span style="color: gray;">Display scale: 2 decimal places.</span>
     */
    private static final int DISPLAY_SCALE = 2;

    private static final String CURRENCY_PREFIX = "Rs. ";

    private MoneyUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 【读取】将文本解析为金额.
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>[Read] Parse text into an amount.</b>
     * </span>
     *
     * @param text CSV 单元格文本 (Cell text). 空串或 null 视为缺失。
     * @return 金额，缺失时返回 null (Amount, or null when absent)
     * @throws NumberFormatException 文本不是合法数字 (Text is not a number)
     */
    public static BigDecimal parse(String text) {
        if (Strings.isNullOrEmpty(text) || text.trim().isEmpty()) {
            return null;
        }
        return new BigDecimal(text.trim());
    }

    /**
     * 【写出】将金额转换为不带科学计数法的文本.
     * <br>
     * <span style="color: gray;">[Write] Plain text form of an amount, never in scientific notation.</span>
     *
     * @param amount 金额，允许为 null
     * @return 文本，null 时返回空串 (Text, empty string for null)
     */
    public static String toText(BigDecimal amount) {
        return amount == null ? "" : amount.toPlainString();
    }

    /**
     * 展示格式 (仅用于日志/界面).
     * <br>
     * <span style="color: gray;">Display format (logs / UI only), e.g. "Rs. 1,500.00".</span>
     *
     * @param amount 金额
     * @return 格式化后的金额字符串
     */
    public static String display(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return CURRENCY_PREFIX + format.format(value.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP));
    }
}
