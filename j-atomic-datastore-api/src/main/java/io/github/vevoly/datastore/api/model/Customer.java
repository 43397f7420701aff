package io.github.vevoly.datastore.api.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 客户 (Customer)
 * <p>客户身份、联系方式、关联账号，以及贷款审批模块使用的就业信息。</p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class Customer implements SnapshotEntity {

    private String customerId;
    private String username;
    private String password;
    private String firstName;
    private String lastName;
    private String dob;
    private String gender;
    private String phoneNumber;
    private String email;
    private List<String> accountNumbers;
    private int failedAttempts;
    private boolean locked;

    // --- 贷款/就业信息 (Loan / Employment) ---
    private Integer cibilScore;
    private BigDecimal salary;
    private String employerName;
    private String employerType;
    private String jobStartDate;
    private String employerCategory;
    private String city;
    private boolean kycCompleted;

    /**
     * 关联一个账号，已关联时忽略 / Link an account number, ignored when already linked
     */
    public void linkAccount(String accountNumber) {
        if (accountNumbers == null) {
            accountNumbers = new ArrayList<>();
        }
        if (!accountNumbers.contains(accountNumber)) {
            accountNumbers.add(accountNumber);
        }
    }

    @Override
    public void validate() {
        Preconditions.checkState(!Strings.isNullOrEmpty(customerId), "customer id is missing");
        Preconditions.checkState(!Strings.isNullOrEmpty(username), "customer %s has no username", customerId);
    }
}
