package io.github.vevoly.datastore.core.snapshot;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.github.vevoly.datastore.api.exception.SnapshotLoadException;
import io.github.vevoly.datastore.api.exception.SnapshotSaveException;
import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.model.Customer;
import io.github.vevoly.datastore.api.model.Loan;
import io.github.vevoly.datastore.api.model.Transaction;
import io.github.vevoly.datastore.api.model.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.github.vevoly.datastore.core.metrics.DataStoreMetricManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotStoreTest {

    @TempDir
    Path dir;

    private SnapshotStore store() {
        return new SnapshotStore(dir, null, null);
    }

    static Account sampleAccount() {
        JsonObject salary = new JsonObject();
        salary.addProperty("employer", "Acme");
        Account account = Account.builder()
                .customerId("CUST00000001")
                .username("alice")
                .password("secret")
                .firstName("Alice")
                .accountType("Savings")
                .accountNumber("562100000001")
                .balance(new BigDecimal("1300.50"))
                .salaryProfile(salary)
                .build();
        account.appendTransaction(Transaction.builder()
                .id("FHIC0000000001")
                .type(TransactionType.EXPENSE)
                .amount(new BigDecimal("199.50"))
                .resultingBalance(new BigDecimal("1300.50"))
                .timestamp("01-01-2025 10:00:00")
                .category("Food")
                .metadata(Map.of("note", "<lunch & tea>"))
                .build());
        return account;
    }

    @Nested
    @DisplayName("往返 / round trip")
    class RoundTrip {

        @Test
        void accounts() throws Exception {
            Account account = sampleAccount();
            store().save(SnapshotCollection.ACCOUNTS, List.of(account));

            List<Account> loaded = store().load(SnapshotCollection.ACCOUNTS);

            assertThat(loaded).containsExactly(account);
            assertThat(loaded.get(0).getTransactions().get(0).getMetadata()).containsEntry("note", "<lunch & tea>");
            assertThat(loaded.get(0).getSalaryProfile().get("employer").getAsString()).isEqualTo("Acme");
        }

        @Test
        void customers() throws Exception {
            Customer customer = Customer.builder()
                    .customerId("CUST00000001").username("alice").cibilScore(750).salary(new BigDecimal("85000")).build();
            customer.linkAccount("562100000001");
            store().save(SnapshotCollection.CUSTOMERS, List.of(customer));

            assertThat(store().load(SnapshotCollection.CUSTOMERS)).containsExactly(customer);
        }

        @Test
        @DisplayName("贷款使用 snake_case 键 / loans use snake_case keys")
        void loansUseSnakeCase() throws Exception {
            Loan loan = Loan.builder()
                    .loanId("LN1").customerId("CUST00000001").principal(new BigDecimal("100000"))
                    .interestRate(new BigDecimal("10.5")).tenureMonths(12).status(Loan.STATUS_ACTIVE).build();
            store().save(SnapshotCollection.LOANS, List.of(loan));

            String json = Files.readString(dir.resolve("loans.json"), StandardCharsets.UTF_8);
            assertThat(json).contains("\"loan_id\"", "\"tenure_months\"", "\"interest_rate\"");
            assertThat(store().load(SnapshotCollection.LOANS)).containsExactly(loan);
        }

        @Test
        void missingFileLoadsEmpty() throws Exception {
            assertThat(store().load(SnapshotCollection.LOANS)).isEmpty();
        }

        @Test
        void loadedListIsMutable() throws Exception {
            store().save(SnapshotCollection.ACCOUNTS, List.of(sampleAccount()));
            List<Account> loaded = store().load(SnapshotCollection.ACCOUNTS);
            loaded.add(sampleAccount());
            assertThat(loaded).hasSize(2);
        }
    }

    @Nested
    @DisplayName("损坏的快照 / corrupt snapshots")
    class Corrupt {

        private void write(String json) throws IOException {
            Files.writeString(dir.resolve("bank_data.json"), json, StandardCharsets.UTF_8);
        }

        @Test
        void brokenJson() throws Exception {
            write("[{\"username\": ");
            assertThatThrownBy(() -> store().load(SnapshotCollection.ACCOUNTS))
                    .isInstanceOf(SnapshotLoadException.class)
                    .satisfies(e -> assertThat(((SnapshotLoadException) e).getCollection()).isEqualTo("accounts"));
        }

        @Test
        void emptyFile() throws Exception {
            write("");
            assertThatThrownBy(() -> store().load(SnapshotCollection.ACCOUNTS)).isInstanceOf(SnapshotLoadException.class);
        }

        @Test
        void nullEntry() throws Exception {
            write("[null]");
            assertThatThrownBy(() -> store().load(SnapshotCollection.ACCOUNTS))
                    .isInstanceOf(SnapshotLoadException.class)
                    .hasMessageContaining("index 0");
        }

        @Test
        void entityFailingValidation() throws Exception {
            write("[{\"username\": \"alice\", \"balance\": 10}]");
            assertThatThrownBy(() -> store().load(SnapshotCollection.ACCOUNTS))
                    .isInstanceOf(SnapshotLoadException.class)
                    .hasMessageContaining("account number");
        }

        @Test
        @DisplayName("损坏文件另存副本，原文件不动 / a corrupt file is copied aside and left in place")
        void preserveCorruptCopiesFile() throws Exception {
            write("[{\"username\": ");

            Path copy = store().preserveCorrupt(SnapshotCollection.ACCOUNTS);

            assertThat(copy.getFileName().toString()).startsWith("bank_data.json.corrupt-");
            assertThat(Files.readString(copy, StandardCharsets.UTF_8)).isEqualTo("[{\"username\": ");
            assertThat(dir.resolve("bank_data.json")).exists();
        }

        @Test
        void wrongShape() throws Exception {
            write("{\"accounts\": []}");
            assertThatThrownBy(() -> store().load(SnapshotCollection.ACCOUNTS)).isInstanceOf(SnapshotLoadException.class);
        }
    }

    @Test
    @DisplayName("序列化中途失败时旧快照保持完整 / a save failing midway leaves the previous snapshot intact")
    void failedSaveKeepsPreviousSnapshot() throws Exception {
        new SnapshotStore(dir, null, null).save(SnapshotCollection.ACCOUNTS, List.of(sampleAccount()));
        Path file = dir.resolve("bank_data.json");
        String before = Files.readString(file, StandardCharsets.UTF_8);

        Gson exploding = DataStoreGson.builder()
                .registerTypeAdapter(Transaction.class, new TypeAdapter<Transaction>() {
                    @Override
                    public void write(JsonWriter out, Transaction value) {
                        throw new IllegalStateException("simulated crash while writing");
                    }

                    @Override
                    public Transaction read(JsonReader in) {
                        throw new UnsupportedOperationException();
                    }
                })
                .create();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SnapshotStore store = new SnapshotStore(dir, exploding, new DataStoreMetricManager(null, registry));

        assertThatThrownBy(() -> store.save(SnapshotCollection.ACCOUNTS, List.of(sampleAccount())))
                .isInstanceOf(SnapshotSaveException.class);

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(before);
        assertThat(Files.exists(dir.resolve("bank_data.json.tmp"))).isFalse();
        assertThat(registry.counter("j-atomic-datastore.snapshot.save.failures", "collection", "accounts").count())
                .isEqualTo(1.0);
    }
}
