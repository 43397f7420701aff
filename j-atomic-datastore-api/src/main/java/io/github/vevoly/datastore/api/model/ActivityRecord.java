package io.github.vevoly.datastore.api.model;

import com.google.common.base.Strings;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h3>活动记录 (Activity Record)</h3>
 *
 * <p>
 * 活动日志中的一行。它是 {@link Transaction} 字段的超集，额外携带用户名、账号、动作与渠道。
 * 通过标准追加路径产生的每一笔交易都恰好对应一条 {@code txnId} 相同的活动记录。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Activity Record.</b><br>
 * One row of the activity log, a superset of {@link Transaction} fields plus username, account number, action and mode.
 * Every transaction created through the standard append path has exactly one record with the same {@code txnId}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@Builder
public class ActivityRecord {

    /**
     * 表头，列顺序即写出顺序 / Header; column order is write order
     */
    public static final List<String> HEADER = List.of(
            "timestamp", "username", "accountNumber", "action",
            "amount", "mode", "resultingBalance", "txnId",
            "chequeId", "metadata");

    String timestamp;
    String username;
    String accountNumber;
    String action;
    BigDecimal amount;
    String mode;
    BigDecimal resultingBalance;
    String txnId;
    String chequeId;
    @Singular("meta")
    Map<String, String> metadata;

    /**
     * 由一笔交易生成活动记录.
     * <p>交易的分类、商户、支付方式放入 metadata，与交易自身的 metadata 合并。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Build the record of a transaction.</b><br>
     * Category, merchant and payment method travel inside metadata, merged with the transaction's own metadata.
     * </span>
     *
     * @param username      用户名
     * @param accountNumber 账号
     * @param transaction   交易
     * @param mode          渠道 (NEFT / RTGS / UPI ...)，可为 null
     * @return 活动记录
     */
    public static ActivityRecord of(String username, String accountNumber, Transaction transaction, String mode) {
        Map<String, String> meta = new LinkedHashMap<>(transaction.getMetadata());
        putIfPresent(meta, JAtomicDataStoreConstant.META_CATEGORY, transaction.getCategory());
        putIfPresent(meta, JAtomicDataStoreConstant.META_MERCHANT, transaction.getMerchant());
        putIfPresent(meta, JAtomicDataStoreConstant.META_PAYMENT_METHOD, transaction.getPaymentMethod());
        return ActivityRecord.builder()
                .timestamp(transaction.getTimestamp())
                .username(username)
                .accountNumber(accountNumber)
                .action(transaction.getTypeName())
                .amount(transaction.getAmount())
                .mode(mode)
                .resultingBalance(transaction.getResultingBalance())
                .txnId(transaction.getId())
                .chequeId(transaction.getChequeId())
                .metadata(meta)
                .build();
    }

    private static void putIfPresent(Map<String, String> meta, String key, String value) {
        if (!Strings.isNullOrEmpty(value)) {
            meta.put(key, value);
        }
    }
}
