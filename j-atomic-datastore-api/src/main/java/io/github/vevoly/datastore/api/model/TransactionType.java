package io.github.vevoly.datastore.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * <h3>交易类型 (Transaction Type)</h3>
 *
 * <p>
 * 交易的动作标签。每个类型都带有资金方向 (入账/出账)，以及是否参与活动日志重放。
 * 活动日志中的非资金动作 (如 ACCOUNT_CREATED) 不在此枚举中；快照中出现的未知类型由 {@link Transaction} 按原文保留。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction Type.</b><br>
 * Action tag of a transaction. Each type carries a money direction and whether activity log replay restores it.
 * Non-monetary log actions (e.g. ACCOUNT_CREATED) are not part of this enum; unknown types found in snapshots
 * are kept verbatim by {@link Transaction}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum TransactionType {

    // --- 入账 (Credit) ---
    DEPOSIT(Direction.CREDIT, true, "Deposit"),
    NEFT_RECEIVED(Direction.CREDIT, true, "NEFT Transfer (Received)"),
    RTGS_RECEIVED(Direction.CREDIT, true, "RTGS Transfer (Received)"),
    INTER_ACCOUNT_RECEIVED(Direction.CREDIT, true, "Inter-Account Transfer (Received)"),
    SALARY(Direction.CREDIT, true, "Salary Credit"),
    SALARY_CREDIT(Direction.CREDIT, true, "Salary Credit"),
    LOAN_CREDIT(Direction.CREDIT, true, "Loan Disbursement"),

    // --- 出账 (Debit) ---
    WITHDRAW(Direction.DEBIT, true, "Withdrawal"),
    NEFT_SENT(Direction.DEBIT, true, "NEFT Transfer (Sent)"),
    RTGS_SENT(Direction.DEBIT, true, "RTGS Transfer (Sent)"),
    INTER_ACCOUNT_SENT(Direction.DEBIT, true, "Inter-Account Transfer (Sent)"),
    EXPENSE(Direction.DEBIT, true, "Expense"),
    BILL_PAYMENT(Direction.DEBIT, true, "Bill Payment"),
    LOAN_EMI(Direction.DEBIT, true, "Loan EMI"),
    CREDIT_CARD_PAYMENT(Direction.DEBIT, false, "Credit Card Payment"),
    CREDIT_CARD_BILL_PAYMENT(Direction.DEBIT, false, "Credit Card Bill Payment"),
    CREDIT_CARD_PURCHASE(Direction.DEBIT, false, "Credit Card Purchase"),
    DEBIT_CARD_PURCHASE(Direction.DEBIT, false, "Debit Card Purchase"),
    ATM_WITHDRAWAL(Direction.DEBIT, false, "ATM Withdrawal"),
    RECURRING_BILL(Direction.DEBIT, false, "Recurring Bill"),
    SWIFT_SENT(Direction.DEBIT, false, "SWIFT Transfer (Sent)"),

    // --- 费用 (Fees) ---
    AMB_FEE(Direction.DEBIT, true, "Average Monthly Balance Fee"),
    AMB_FEE_SETTLED(Direction.DEBIT, true, "AMB Fee Settlement"),
    TAX_DEDUCTED(Direction.DEBIT, true, "Tax Deduction (TDS)");

    private final Direction direction;
    private final boolean replayable;
    private final String displayName;

    TransactionType(Direction direction, boolean replayable, String displayName) {
        this.direction = direction;
        this.replayable = replayable;
        this.displayName = displayName;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * 是否可从活动日志重建.
     * <br>
     * <span style="color: gray;">Whether replay rebuilds this type from the activity log.</span>
     */
    public boolean isReplayable() {
        return replayable;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isCredit() {
        return direction == Direction.CREDIT;
    }

    public boolean isDebit() {
        return direction == Direction.DEBIT;
    }

    /**
     * 按活动日志中的 action 文本查找类型.
     * <br>
     * <span style="color: gray;">Look up a type by the action text of a log row.</span>
     *
     * @param action 动作文本 (Action text), 大小写不敏感
     * @return 对应类型；非交易动作返回 empty (Empty for non-transaction actions)
     */
    public static Optional<TransactionType> fromAction(String action) {
        if (action == null || action.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(action.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * 资金方向 / Money direction
     */
    public enum Direction {
        CREDIT,
        DEBIT
    }
}
