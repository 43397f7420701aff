package io.github.vevoly.datastore.core.replay;

import com.google.common.base.Strings;
import com.google.gson.JsonParseException;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.github.vevoly.datastore.api.exception.ActivityLogException;
import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.model.Transaction;
import io.github.vevoly.datastore.api.model.TransactionType;
import io.github.vevoly.datastore.core.activity.ActivityLog;
import io.github.vevoly.datastore.core.activity.ActivityRow;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <h3>重放引擎 (Replay Engine)</h3>
 *
 * <p>
 * 加载时将活动日志与 JSON 快照对账：按日志顺序 (旧到新) 把快照中缺失的可重放交易补入账户，
 * 并把余额设为该行记录的结果余额。以交易号去重，重复执行结果不变。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Replay Engine.</b><br>
 * Reconciles the activity log with the JSON snapshot at load time: in log order (oldest first) it patches replayable
 * transactions missing from the snapshot into their accounts and sets the balance to the row's resulting balance.
 * Deduplicated by transaction id, so running it again changes nothing.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class ReplayEngine {

    private final ActivityLog activityLog;
    private final Counter appliedCounter;

    public ReplayEngine(ActivityLog activityLog, Counter appliedCounter) {
        this.activityLog = activityLog;
        this.appliedCounter = appliedCounter;
    }

    /**
     * 对账户集合执行重放 (原地修改).
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Replay onto the accounts (mutated in place).</b>
     * </span>
     *
     * @param accounts 快照中加载的账户 (Accounts loaded from the snapshot)
     * @return 重放报告 (Replay report)
     * @throws ActivityLogException 日志无法读取 (Log unreadable)
     */
    public ReplayReport replay(List<Account> accounts) throws ActivityLogException {
        ReplayReport report = new ReplayReport();
        if (accounts.isEmpty() || !activityLog.exists()) {
            return report;
        }

        // 1. 账号索引为准，用户名兜底 / Account number is authoritative, username is the fallback
        Map<String, Account> byNumber = new HashMap<>();
        Map<String, Account> byUsername = new HashMap<>();
        // 账户的 hashCode 随交易追加而变，按对象身份索引 / Account hashCode changes as it grows, key by identity
        Map<Account, Set<String>> knownIds = new IdentityHashMap<>();
        for (Account account : accounts) {
            if (!Strings.isNullOrEmpty(account.getAccountNumber())) {
                byNumber.put(account.getAccountNumber(), account);
            }
            if (!Strings.isNullOrEmpty(account.getUsername())) {
                byUsername.put(account.getUsername(), account);
            }
            Set<String> ids = new HashSet<>();
            for (Transaction t : account.getTransactions()) {
                ids.add(t.getId());
            }
            knownIds.put(account, ids);
        }

        // 2. 按日志顺序处理 / Process in log order
        activityLog.forEach(row -> apply(row, byNumber, byUsername, knownIds, report));

        log.info("重放完成 / Replay finished: {}", report);
        return report;
    }

    private void apply(ActivityRow row, Map<String, Account> byNumber, Map<String, Account> byUsername,
                       Map<Account, Set<String>> knownIds, ReplayReport report) {
        report.scanned();

        Account account = byNumber.get(row.cell("accountNumber"));
        if (account == null) {
            account = byUsername.get(row.cell("username"));
        }
        if (account == null) {
            log.debug("行 #{} 找不到账户 / Row #{} matches no account", row.getRowNumber(), row.getRowNumber());
            report.unmatched();
            return;
        }

        Optional<TransactionType> type = TransactionType.fromAction(row.cell("action")).filter(TransactionType::isReplayable);
        if (type.isEmpty()) {
            report.ignoredAction();
            return;
        }

        String txnId = row.cell("txnId");
        BigDecimal amount;
        BigDecimal resultingBalance;
        Map<String, String> metadata;
        try {
            amount = row.decimal("amount");
            resultingBalance = row.decimal("resultingBalance");
            metadata = new LinkedHashMap<>(row.metadata());
        } catch (NumberFormatException | JsonParseException e) {
            log.warn("跳过字段非法的活动行 #{} / Skipping activity row #{} with bad fields: {}",
                    row.getRowNumber(), row.getRowNumber(), e.getMessage());
            report.malformed();
            return;
        }
        if (txnId.isEmpty() || amount == null || resultingBalance == null) {
            log.warn("跳过缺字段的活动行 #{} / Skipping activity row #{} with missing fields", row.getRowNumber(), row.getRowNumber());
            report.malformed();
            return;
        }

        Set<String> ids = knownIds.get(account);
        if (ids.contains(txnId)) {
            report.duplicate();
            return;
        }

        Transaction transaction = Transaction.builder()
                .id(txnId)
                .type(type.get())
                .amount(amount)
                .resultingBalance(resultingBalance)
                .timestamp(row.cell("timestamp"))
                .chequeId(Strings.emptyToNull(row.cell("chequeId")))
                .category(metadata.remove(JAtomicDataStoreConstant.META_CATEGORY))
                .merchant(metadata.remove(JAtomicDataStoreConstant.META_MERCHANT))
                .paymentMethod(metadata.remove(JAtomicDataStoreConstant.META_PAYMENT_METHOD))
                .metadata(metadata.isEmpty() ? null : metadata)
                .build();
        account.appendTransaction(transaction);
        account.setBalance(resultingBalance);
        ids.add(txnId);
        report.applied();
        if (appliedCounter != null) {
            appliedCounter.increment();
        }
        log.debug("补入交易 {} 到账户 {} / Patched {} into {}", txnId, account.getAccountNumber(), txnId, account.getAccountNumber());
    }
}
