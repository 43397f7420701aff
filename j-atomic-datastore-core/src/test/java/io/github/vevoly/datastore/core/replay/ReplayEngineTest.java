package io.github.vevoly.datastore.core.replay;

import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.model.ActivityRecord;
import io.github.vevoly.datastore.api.model.Transaction;
import io.github.vevoly.datastore.api.model.TransactionType;
import io.github.vevoly.datastore.core.activity.ActivityLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplayEngineTest {

    @TempDir
    Path dir;

    private ActivityLog log;
    private ReplayEngine engine;

    @BeforeEach
    void setUp() {
        log = new ActivityLog(dir.resolve("account_activity.csv"), null);
        engine = new ReplayEngine(log, null);
    }

    private static Account alice(String balance) {
        return Account.builder()
                .customerId("CUST00000001")
                .username("alice")
                .accountNumber("562100000001")
                .balance(new BigDecimal(balance))
                .build();
    }

    private ActivityRecord.ActivityRecordBuilder row(String action, String txnId, String amount, String balance) {
        return ActivityRecord.builder()
                .timestamp("01-01-2025 10:00:00")
                .username("alice")
                .accountNumber("562100000001")
                .action(action)
                .amount(amount == null ? null : new BigDecimal(amount))
                .resultingBalance(balance == null ? null : new BigDecimal(balance))
                .txnId(txnId);
    }

    @Test
    @DisplayName("场景 A1: 1000 -> 存 500 -> 取 200 = 1300 / scenario A1")
    void scenarioA1() throws Exception {
        log.append(row("DEPOSIT", "T1", "500", "1500").build());
        log.append(row("WITHDRAW", "T2", "200", "1300").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        ReplayReport report = engine.replay(accounts);

        Account account = accounts.get(0);
        assertThat(account.getBalance()).isEqualByComparingTo("1300");
        assertThat(account.getTransactions()).extracting(Transaction::getId).containsExactly("T1", "T2");
        assertThat(account.getTransactions().get(0).getType()).isEqualTo(TransactionType.DEPOSIT);
        assertThat(report.getApplied()).isEqualTo(2);
    }

    @Test
    @DisplayName("重复重放不产生重复交易 / replaying twice adds nothing")
    void replayIsIdempotent() throws Exception {
        log.append(row("DEPOSIT", "T1", "500", "1500").build());
        log.append(row("WITHDRAW", "T2", "200", "1300").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        engine.replay(accounts);
        ReplayReport second = engine.replay(accounts);

        assertThat(accounts.get(0).getTransactions()).hasSize(2);
        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1300");
        assertThat(second.getApplied()).isZero();
        assertThat(second.getDuplicates()).isEqualTo(2);
    }

    @Test
    void transactionsAlreadyInSnapshotAreSkipped() throws Exception {
        log.append(row("DEPOSIT", "T1", "500", "1500").build());
        log.append(row("WITHDRAW", "T2", "200", "1300").build());
        Account account = alice("1500");
        account.appendTransaction(Transaction.builder()
                .id("T1").type(TransactionType.DEPOSIT)
                .amount(new BigDecimal("500")).resultingBalance(new BigDecimal("1500"))
                .build());

        engine.replay(new ArrayList<>(List.of(account)));

        assertThat(account.getTransactions()).extracting(Transaction::getId).containsExactly("T1", "T2");
        assertThat(account.getBalance()).isEqualByComparingTo("1300");
    }

    @Test
    @DisplayName("余额由日志顺序决定 / log order decides the final balance")
    void logOrderDecidesBalance() throws Exception {
        log.append(row("WITHDRAW", "T2", "200", "1300").build());
        log.append(row("DEPOSIT", "T1", "500", "1500").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        engine.replay(accounts);

        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1500");
        assertThat(accounts.get(0).getTransactions()).extracting(Transaction::getId).containsExactly("T2", "T1");
    }

    @Test
    void nonReplayableAndUnknownRowsAreIgnored() throws Exception {
        log.append(row("ACCOUNT_CREATED", "", null, null).build());
        log.append(row("CREDIT_CARD_PAYMENT", "C1", "100", "900").build());
        log.append(row("DEPOSIT", "X1", "100", "1100").accountNumber("562199999999").username("bob").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        ReplayReport report = engine.replay(accounts);

        assertThat(accounts.get(0).getTransactions()).isEmpty();
        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1000");
        assertThat(report.getIgnoredActions()).isEqualTo(2);
        assertThat(report.getUnmatched()).isEqualTo(1);
    }

    @Test
    void usernameResolvesWhenAccountNumberIsMissing() throws Exception {
        log.append(row("SALARY_CREDIT", "S1", "5000", "6000").accountNumber("").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        engine.replay(accounts);

        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("6000");
    }

    @Test
    @DisplayName("缺字段或数字非法的行被跳过 / rows with missing or bad fields are skipped")
    void malformedRowsAreSkipped() throws Exception {
        log.append(row("DEPOSIT", "", "500", "1500").build());
        log.append(row("DEPOSIT", "M1", null, "1500").build());
        Files.writeString(log.getPath(),
                "01-01-2025 10:00:00,alice,562100000001,DEPOSIT,abc,CASH,1500,M2,,\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        log.append(row("DEPOSIT", "OK1", "10", "1010").build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        ReplayReport report = engine.replay(accounts);

        assertThat(report.getMalformed()).isEqualTo(3);
        assertThat(accounts.get(0).getTransactions()).extracting(Transaction::getId).containsExactly("OK1");
        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1010");
    }

    @Test
    void descriptiveFieldsComeBackFromMetadata() throws Exception {
        log.append(row("EXPENSE", "E1", "250", "750")
                .chequeId("CHQ1")
                .meta("category", "Food")
                .meta("merchant", "Cafe")
                .meta("method", "UPI")
                .meta("note", "lunch")
                .build());
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        engine.replay(accounts);

        Transaction t = accounts.get(0).getTransactions().get(0);
        assertThat(t.getCategory()).isEqualTo("Food");
        assertThat(t.getMerchant()).isEqualTo("Cafe");
        assertThat(t.getPaymentMethod()).isEqualTo("UPI");
        assertThat(t.getChequeId()).isEqualTo("CHQ1");
        assertThat(t.getMetadata()).containsOnlyKeys("note");
    }

    @Test
    void legacyMetadataIsUnderstood() throws Exception {
        log.append(row("DEPOSIT", "L0", "1", "1001").build());
        Files.writeString(log.getPath(),
                "01-01-2025 10:00:00,alice,562100000001,EXPENSE,100,CASH,901,L1,,category=Food;merchant=Cafe\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        engine.replay(accounts);

        Transaction t = accounts.get(0).getTransactions().get(1);
        assertThat(t.getId()).isEqualTo("L1");
        assertThat(t.getCategory()).isEqualTo("Food");
        assertThat(t.getMerchant()).isEqualTo("Cafe");
        assertThat(t.getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("缺少 chequeId 与 metadata 列的旧行照常重放 / old rows without chequeId and metadata cells still replay")
    void rowsWithoutTrailingCellsReplay() throws Exception {
        log.append(row("DEPOSIT", "S0", "1", "1001").build());
        Files.writeString(log.getPath(),
                "01-01-2025 10:00:00,alice,562100000001,DEPOSIT,100,CASH,1101,S1\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));

        ReplayReport report = engine.replay(accounts);

        assertThat(report.getApplied()).isEqualTo(2);
        assertThat(accounts.get(0).getTransactions()).extracting(Transaction::getId).containsExactly("S0", "S1");
        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1101");
    }

    @Test
    void noLogMeansNoChanges() throws Exception {
        List<Account> accounts = new ArrayList<>(List.of(alice("1000")));
        ReplayReport report = engine.replay(accounts);
        assertThat(report.getScanned()).isZero();
        assertThat(accounts.get(0).getBalance()).isEqualByComparingTo("1000");
    }
}
