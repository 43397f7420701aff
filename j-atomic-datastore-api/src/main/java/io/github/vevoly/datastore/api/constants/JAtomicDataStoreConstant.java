package io.github.vevoly.datastore.api.constants;

/**
 * 系统常量 / System constant
 *
 * @since 1.0.0
 * @author vevoly
 */
public class JAtomicDataStoreConstant {

    public static final String J_ATOMIC_DATASTORE_ID = "j-atomic-datastore";

    // 配置默认值 / Config default value
    public static final String DEFAULT_BASE_DIR = "./data/";
    public static final String DEFAULT_METRICS_PREFIX = J_ATOMIC_DATASTORE_ID + ".";

    // 快照文件 / Snapshot files
    public static final String ACCOUNTS_JSON_FILE = "bank_data.json";
    public static final String ACCOUNTS_CSV_FILE = "accounts.csv";
    public static final String CUSTOMERS_JSON_FILE = "customers.json";
    public static final String LOANS_JSON_FILE = "loans.json";
    public static final String TEMP_FILE_SUFFIX = ".tmp";

    // 活动日志 / Activity log
    public static final String ACTIVITY_LOG_FILE = "account_activity.csv";

    // 编号注册表文件 / Id registry files
    public static final String TRANSACTION_IDS_FILE = "transaction_ids.json";
    public static final String NACH_IDS_FILE = "nach_ids.txt";
    public static final String ACCOUNT_NUMBERS_FILE = "account_numbers.txt";
    public static final String CUSTOMER_IDS_FILE = "customer_ids.txt";

    // 时间格式 / Time formats
    public static final String DATETIME_PATTERN = "dd-MM-yyyy HH:mm:ss";
    public static final String DATE_PATTERN = "dd-MM-yyyy";
    public static final String NACH_DATE_PATTERN = "yyyyMMdd";

    // 元数据中的交易字段 / Transaction fields carried in metadata
    public static final String META_CATEGORY = "category";
    public static final String META_MERCHANT = "merchant";
    public static final String META_PAYMENT_METHOD = "method";

    private JAtomicDataStoreConstant() {
    }
}
