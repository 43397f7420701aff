package io.github.vevoly.datastore.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountTest {

    private static Transaction deposit(String id) {
        return Transaction.builder()
                .id(id)
                .type(TransactionType.DEPOSIT)
                .amount(new BigDecimal("500"))
                .resultingBalance(new BigDecimal("1500"))
                .timestamp("01-01-2025 10:00:00")
                .build();
    }

    @Test
    @DisplayName("交易列表只读，只能通过 appendTransaction 追加 / list is read-only outside appendTransaction")
    void transactionsAreReadOnly() {
        Account account = Account.builder().accountNumber("562100000001").username("alice").build();
        account.appendTransaction(deposit("FHIC0000000001"));

        assertThat(account.getTransactions()).hasSize(1);
        assertThat(account.hasTransaction("FHIC0000000001")).isTrue();
        assertThat(account.hasTransaction("FHIC0000000002")).isFalse();
        assertThatThrownBy(() -> account.getTransactions().add(deposit("FHIC0000000002")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void builderDefaultsBalanceToZero() {
        Account account = Account.builder().accountNumber("562100000001").username("alice").build();
        assertThat(account.getBalance()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(account.getPendingAmbFees()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void validateRejectsMissingAccountNumber() {
        Account account = Account.builder().username("alice").build();
        assertThatThrownBy(account::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void validateChecksEachTransaction() {
        Account account = Account.builder().accountNumber("562100000001").username("alice").build();
        account.appendTransaction(Transaction.builder().id("FHIC0000000001").type(TransactionType.DEPOSIT).build());
        assertThatThrownBy(account::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FHIC0000000001");
    }

    @Test
    @DisplayName("活动记录携带分类、商户和支付方式 / activity record carries category, merchant and method")
    void activityRecordMergesDescriptiveFields() {
        Transaction t = deposit("FHIC0000000001").toBuilder()
                .category("Food")
                .merchant("Cafe")
                .paymentMethod("UPI")
                .metadata(Map.of("note", "lunch"))
                .build();

        ActivityRecord record = ActivityRecord.of("alice", "562100000001", t, "UPI");

        assertThat(record.getAction()).isEqualTo("DEPOSIT");
        assertThat(record.getTxnId()).isEqualTo("FHIC0000000001");
        assertThat(record.getMetadata())
                .containsEntry("category", "Food")
                .containsEntry("merchant", "Cafe")
                .containsEntry("method", "UPI")
                .containsEntry("note", "lunch");
    }

    @Test
    void displayLineShowsAmountsAndTags() {
        Transaction t = deposit("FHIC0000000001").toBuilder().category("Salary").merchant("Acme").build();

        assertThat(t.toDisplayLine())
                .contains("FHIC0000000001", "Deposit", "Rs. 500.00", "Rs. 1,500.00")
                .endsWith("(Salary - Acme)");
    }
}
