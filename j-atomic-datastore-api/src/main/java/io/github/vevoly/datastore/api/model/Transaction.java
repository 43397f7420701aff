package io.github.vevoly.datastore.api.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.annotations.SerializedName;
import io.github.vevoly.datastore.api.utils.MoneyUtils;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * <h3>交易 (Transaction)</h3>
 *
 * <p>
 * 一笔资金变动的不可变记录。创建后只会被追加到所属账户，永不修改、永不删除。
 * 相同 {@code id} 的两笔交易在语义上必须完全一致，{@code id} 永不复用。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction.</b><br>
 * Immutable record of one balance change. Appended once to its account, never mutated or deleted.
 * Two transactions sharing an {@code id} are semantically identical; ids are never reused.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Transaction implements SnapshotEntity {

    /**
     * 全局唯一交易号 / Globally unique transaction id
     */
    private String id;

    /**
     * 交易类型原文；未知类型原样保留，保存时写回.
     * <br>
     * <span style="color: gray;">Type name as stored; unknown names are kept and written back unchanged.</span>
     */
    @SerializedName("type")
    private String typeName;

    private BigDecimal amount;

    /**
     * 该笔交易完成后的账户余额.
     * <br>
     * <span style="color: gray;">Account balance immediately after this transaction.</span>
     */
    private BigDecimal resultingBalance;

    /**
     * 创建时间，格式 dd-MM-yyyy HH:mm:ss / Creation time
     */
    private String timestamp;

    private String chequeId;

    private String category;

    private String merchant;

    private String paymentMethod;

    private Map<String, String> metadata;

    /**
     * 已知的交易类型.
     * <br>
     * <span style="color: gray;">The known transaction type.</span>
     *
     * @return 类型；类型名不在 {@link TransactionType} 中时返回 null (Null when the name is not a known type)
     */
    public TransactionType getType() {
        return TransactionType.fromAction(typeName).orElse(null);
    }

    public boolean isKnownType() {
        return getType() != null;
    }

    public Map<String, String> getMetadata() {
        return metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
    }

    public boolean isCredit() {
        TransactionType type = getType();
        return type != null && type.isCredit();
    }

    public boolean isDebit() {
        TransactionType type = getType();
        return type != null && type.isDebit();
    }

    /**
     * 单行展示文本 (仅用于界面/日志).
     * <br>
     * <span style="color: gray;">Single-line display text (UI / logs only).</span>
     */
    public String toDisplayLine() {
        StringBuilder line = new StringBuilder(String.format("%-15s %-20s %-33s %15s %15s",
                id, timestamp, displayType(),
                MoneyUtils.display(amount), MoneyUtils.display(resultingBalance)));
        String tag = Strings.isNullOrEmpty(category) ? Strings.nullToEmpty(merchant)
                : Strings.isNullOrEmpty(merchant) ? category : category + " - " + merchant;
        if (!tag.isEmpty()) {
            line.append(" (").append(tag).append(')');
        }
        return line.toString();
    }

    private String displayType() {
        TransactionType type = getType();
        return type == null ? Strings.nullToEmpty(typeName) : type.getDisplayName();
    }

    @Override
    public void validate() {
        Preconditions.checkState(!Strings.isNullOrEmpty(id), "transaction id is missing");
        Preconditions.checkState(!Strings.isNullOrEmpty(typeName), "transaction %s has no type", id);
        Preconditions.checkState(amount != null, "transaction %s has no amount", id);
        Preconditions.checkState(resultingBalance != null, "transaction %s has no resultingBalance", id);
    }

    public static class TransactionBuilder {

        public TransactionBuilder type(TransactionType type) {
            this.typeName = type == null ? null : type.name();
            return this;
        }
    }
}
