package io.github.vevoly.datastore.core.replay;

import lombok.Getter;
import lombok.ToString;

/**
 * <h3>重放报告 (Replay Report)</h3>
 *
 * <p>一次重放中各类行的计数。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Replay Report.</b><br>
 * Row counts of one replay pass.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@ToString
public class ReplayReport {

    /**
     * 读取的数据行 / Data rows read
     */
    private long scanned;

    /**
     * 补入账户的交易 / Transactions patched into accounts
     */
    private long applied;

    /**
     * 账户已持有的交易 / Transactions the account already held
     */
    private long duplicates;

    /**
     * 找不到账户的行 / Rows matching no account
     */
    private long unmatched;

    /**
     * 非可重放动作的行 / Rows with a non-replayable action
     */
    private long ignoredActions;

    /**
     * 缺字段或数字非法的行 / Rows with missing fields or bad numbers
     */
    private long malformed;

    void scanned() {
        scanned++;
    }

    void applied() {
        applied++;
    }

    void duplicate() {
        duplicates++;
    }

    void unmatched() {
        unmatched++;
    }

    void ignoredAction() {
        ignoredActions++;
    }

    void malformed() {
        malformed++;
    }
}
