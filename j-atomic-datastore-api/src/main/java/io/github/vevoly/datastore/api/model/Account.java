package io.github.vevoly.datastore.api.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.JsonObject;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h3>账户 (Account)</h3>
 *
 * <p>
 * 账户聚合根。账户是其交易列表的唯一修改者：外部只能通过 {@link #appendTransaction(Transaction)} 追加交易。
 * 卡片、定期账单、工资档案由外部业务模块维护，存储层只把它们当作不透明的 JSON 文档原样保存。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Account aggregate.</b><br>
 * The account is the sole mutator of its transaction list; callers append through {@link #appendTransaction(Transaction)}.
 * Cards, recurring bills and the salary profile belong to collaborator modules and are kept as opaque JSON documents.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@Setter
@ToString(exclude = {"password", "transactions"})
@EqualsAndHashCode
@NoArgsConstructor
public class Account implements SnapshotEntity {

    private String customerId;
    private String username;
    private String password;
    private String firstName;
    private String lastName;
    private String dob;
    private String gender;
    private String accountType;
    private String accountNumber;
    private BigDecimal balance = BigDecimal.ZERO;

    @Setter(AccessLevel.NONE)
    private List<Transaction> transactions = new ArrayList<>();

    private int failedAttempts;
    private boolean locked;
    private BigDecimal pendingAmbFees = BigDecimal.ZERO;

    // --- 外部模块维护的文档 (Collaborator-owned documents) ---
    private List<JsonObject> recurringBills;
    private JsonObject salaryProfile;
    private List<JsonObject> cards;

    @Builder
    private Account(String customerId, String username, String password, String firstName, String lastName,
                    String dob, String gender, String accountType, String accountNumber, BigDecimal balance,
                    List<Transaction> transactions, int failedAttempts, boolean locked, BigDecimal pendingAmbFees,
                    List<JsonObject> recurringBills, JsonObject salaryProfile, List<JsonObject> cards) {
        this.customerId = customerId;
        this.username = username;
        this.password = password;
        this.firstName = firstName;
        this.lastName = lastName;
        this.dob = dob;
        this.gender = gender;
        this.accountType = accountType;
        this.accountNumber = accountNumber;
        this.balance = balance == null ? BigDecimal.ZERO : balance;
        this.transactions = transactions == null ? new ArrayList<>() : new ArrayList<>(transactions);
        this.failedAttempts = failedAttempts;
        this.locked = locked;
        this.pendingAmbFees = pendingAmbFees == null ? BigDecimal.ZERO : pendingAmbFees;
        this.recurringBills = recurringBills;
        this.salaryProfile = salaryProfile;
        this.cards = cards;
    }

    /**
     * 交易列表的只读视图，按追加顺序排列.
     * <br>
     * <span style="color: gray;">Read-only view of the transactions in append order.</span>
     */
    public List<Transaction> getTransactions() {
        return transactions == null ? Collections.emptyList() : Collections.unmodifiableList(transactions);
    }

    /**
     * 追加一笔交易 (唯一的交易写入口).
     * <br>
     * <span style="color: gray;">Append a transaction (the only write path for the transaction list).</span>
     *
     * @param transaction 交易
     */
    public void appendTransaction(Transaction transaction) {
        Preconditions.checkNotNull(transaction, "transaction");
        if (transactions == null) {
            transactions = new ArrayList<>();
        }
        transactions.add(transaction);
    }

    /**
     * 是否已持有指定交易号.
     * <br>
     * <span style="color: gray;">Whether a transaction with this id is already held.</span>
     */
    public boolean hasTransaction(String transactionId) {
        for (Transaction t : getTransactions()) {
            if (t.getId() != null && t.getId().equals(transactionId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void validate() {
        Preconditions.checkState(!Strings.isNullOrEmpty(accountNumber), "account number is missing");
        Preconditions.checkState(!Strings.isNullOrEmpty(username), "account %s has no username", accountNumber);
        Preconditions.checkState(balance != null, "account %s has no balance", accountNumber);
        for (Transaction transaction : getTransactions()) {
            Preconditions.checkState(transaction != null, "account %s holds a null transaction", accountNumber);
            transaction.validate();
        }
    }
}
