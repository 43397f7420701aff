package io.github.vevoly.datastore.api.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 贷款 (Loan)
 * <p>快照中的字段名沿用下划线风格 (loan_id, customer_id ...)。</p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loan implements SnapshotEntity {

    public static final String STATUS_ACTIVE = "Active";

    @SerializedName("loan_id")
    private String loanId;

    @SerializedName("customer_id")
    private String customerId;

    private BigDecimal principal;

    @SerializedName("interest_rate")
    private BigDecimal interestRate;

    @SerializedName("tenure_months")
    private int tenureMonths;

    /**
     * ISO 日期 yyyy-MM-dd / ISO date
     */
    @SerializedName("start_date")
    private String startDate;

    private String status;

    @SerializedName("emis_paid")
    private int emisPaid;

    @SerializedName("approval_reason")
    private String approvalReason;

    @SerializedName("closure_date")
    private String closureDate;

    @Override
    public void validate() {
        Preconditions.checkState(!Strings.isNullOrEmpty(loanId), "loan id is missing");
        Preconditions.checkState(!Strings.isNullOrEmpty(customerId), "loan %s has no customer", loanId);
        Preconditions.checkState(principal != null, "loan %s has no principal", loanId);
        Preconditions.checkState(tenureMonths > 0, "loan %s has invalid tenure %s", loanId, tenureMonths);
    }
}
