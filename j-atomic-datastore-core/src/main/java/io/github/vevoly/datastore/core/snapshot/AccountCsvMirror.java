package io.github.vevoly.datastore.core.snapshot;

import com.google.common.base.Strings;
import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.utils.MoneyUtils;
import io.github.vevoly.datastore.core.activity.CsvCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <h3>账户 CSV 镜像 (Account CSV Mirror)</h3>
 *
 * <p>
 * 账户的扁平 CSV 副本，不含交易。随账户快照一同原子写出；当 JSON 快照缺失或损坏时用于重建最小账户，
 * 交易历史随后仅由重放恢复。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Account CSV Mirror.</b><br>
 * Flat CSV copy of the accounts without transactions, written atomically next to the JSON snapshot. When the JSON
 * snapshot is missing or corrupt it rebuilds minimal accounts; history then comes from replay only.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class AccountCsvMirror {

    public static final List<String> HEADER = List.of(
            "username", "password", "firstName", "lastName", "dob",
            "gender", "accountType", "accountNumber", "balance",
            "failedAttempts", "locked");

    @Getter
    private final Path path;

    public AccountCsvMirror(Path path) {
        this.path = path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * 原子写出镜像 / Atomically write the mirror
     */
    public void write(List<Account> accounts) throws IOException {
        AtomicFileWriter.write(path, writer -> {
            writer.write(CsvCodec.formatRow(HEADER));
            for (Account account : accounts) {
                writer.write(CsvCodec.formatRow(Arrays.asList(
                        account.getUsername(),
                        account.getPassword(),
                        account.getFirstName(),
                        account.getLastName(),
                        account.getDob(),
                        account.getGender(),
                        account.getAccountType(),
                        account.getAccountNumber(),
                        MoneyUtils.toText(account.getBalance()),
                        String.valueOf(account.getFailedAttempts()),
                        String.valueOf(account.isLocked()))));
            }
        });
    }

    /**
     * 读取最小账户 (无交易、无客户号).
     * <p>无法解析的行记录告警后跳过。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Read minimal accounts (no transactions, no customer id).</b><br>
     * Rows that cannot be parsed are skipped with a warning.
     * </span>
     *
     * @return 账户列表，文件不存在时为空 (Accounts; empty when the file is absent)
     * @throws IOException 文件无法读取 (File unreadable)
     */
    public List<Account> read() throws IOException {
        List<Account> accounts = new ArrayList<>();
        if (!exists()) {
            return accounts;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CsvCodec.RecordReader records = new CsvCodec.RecordReader(reader);
            List<String> header = records.next();
            if (header == null) {
                return accounts;
            }
            List<String> cells;
            int line = 1;
            while ((cells = records.next()) != null) {
                line++;
                if (cells.size() == 1 && cells.get(0).isBlank()) {
                    continue;
                }
                Map<String, String> row = new HashMap<>();
                for (int i = 0; i < Math.min(header.size(), cells.size()); i++) {
                    row.put(header.get(i).trim(), cells.get(i));
                }
                try {
                    accounts.add(toAccount(row));
                } catch (RuntimeException e) {
                    log.warn("跳过无法解析的账户 CSV 行 {} / Skipping unparsable account CSV row {}: {}", line, line, e.getMessage());
                }
            }
        }
        return accounts;
    }

    private static Account toAccount(Map<String, String> row) {
        String accountNumber = Strings.nullToEmpty(row.get("accountNumber")).trim();
        if (accountNumber.isEmpty()) {
            throw new IllegalArgumentException("missing accountNumber");
        }
        BigDecimal balance = MoneyUtils.parse(row.get("balance"));
        String failedAttempts = Strings.nullToEmpty(row.get("failedAttempts")).trim();
        return Account.builder()
                .customerId("")
                .username(row.get("username"))
                .password(row.get("password"))
                .firstName(row.get("firstName"))
                .lastName(row.get("lastName"))
                .dob(row.get("dob"))
                .gender(row.get("gender"))
                .accountType(row.get("accountType"))
                .accountNumber(accountNumber)
                .balance(balance == null ? BigDecimal.ZERO : balance)
                .failedAttempts(failedAttempts.isEmpty() ? 0 : Integer.parseInt(failedAttempts))
                .locked("true".equalsIgnoreCase(Strings.nullToEmpty(row.get("locked")).trim()))
                .build();
    }
}
