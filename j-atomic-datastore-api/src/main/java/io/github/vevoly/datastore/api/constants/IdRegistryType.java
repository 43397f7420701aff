package io.github.vevoly.datastore.api.constants;

/**
 * <h3>编号注册表类型 (Id Registry Type)</h3>
 *
 * <p>
 * 系统中共有四类全局唯一编号，它们共享同一套 "随机生成 + 已发放集合查重" 的分配算法，
 * 但在前缀、位数、持久化格式和加载时机上各不相同。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Id Registry Type.</b><br>
 * Four classes of globally unique identifiers share one "random candidate + issued-set membership" algorithm,
 * but differ in prefix, width, persistence format and load policy.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum IdRegistryType {

    /**
     * <b>交易流水号</b> FHIC + 10 位随机数字，JSON 数组，首次使用时加载一次。
     * <br>
     * <span style="color: gray;">Transaction id: FHIC + 10 digits, JSON array, loaded once.</span>
     */
    TRANSACTION("FHIC", false, 10, JAtomicDataStoreConstant.TRANSACTION_IDS_FILE,
            IdFileFormat.JSON_ARRAY, LoadPolicy.ONCE, 1000),

    /**
     * <b>NACH 授权编号</b> NACH + yyyyMMdd + 6 位随机数字，按行存储，每次分配前重新读取文件。
     * <br>
     * <span style="color: gray;">NACH mandate id: NACH + date + 6 digits, line file, reloaded before every allocation.</span>
     */
    NACH("NACH", true, 6, JAtomicDataStoreConstant.NACH_IDS_FILE,
            IdFileFormat.LINES, LoadPolicy.EVERY_CALL, 100),

    /**
     * <b>账号</b> 5621 + 8 位随机数字。
     * <br>
     * <span style="color: gray;">Account number: 5621 + 8 digits.</span>
     */
    ACCOUNT_NUMBER("5621", false, 8, JAtomicDataStoreConstant.ACCOUNT_NUMBERS_FILE,
            IdFileFormat.LINES, LoadPolicy.EVERY_CALL, 1000),

    /**
     * <b>客户号</b> CUST + 8 位随机数字。
     * <br>
     * <span style="color: gray;">Customer id: CUST + 8 digits.</span>
     */
    CUSTOMER_ID("CUST", false, 8, JAtomicDataStoreConstant.CUSTOMER_IDS_FILE,
            IdFileFormat.LINES, LoadPolicy.EVERY_CALL, 1000);

    private final String prefix;
    private final boolean dateStamped;
    private final int randomDigits;
    private final String fileName;
    private final IdFileFormat fileFormat;
    private final LoadPolicy loadPolicy;
    private final int defaultMaxAttempts;

    IdRegistryType(String prefix, boolean dateStamped, int randomDigits, String fileName,
                   IdFileFormat fileFormat, LoadPolicy loadPolicy, int defaultMaxAttempts) {
        this.prefix = prefix;
        this.dateStamped = dateStamped;
        this.randomDigits = randomDigits;
        this.fileName = fileName;
        this.fileFormat = fileFormat;
        this.loadPolicy = loadPolicy;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isDateStamped() {
        return dateStamped;
    }

    public int getRandomDigits() {
        return randomDigits;
    }

    public String getFileName() {
        return fileName;
    }

    public IdFileFormat getFileFormat() {
        return fileFormat;
    }

    public LoadPolicy getLoadPolicy() {
        return loadPolicy;
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    /**
     * 编号总长度 (前缀 + 日期 + 随机位).
     * <br>
     * <span style="color: gray;">Total id length (prefix + date stamp + random digits).</span>
     */
    public int getIdLength() {
        return prefix.length() + (dateStamped ? JAtomicDataStoreConstant.NACH_DATE_PATTERN.length() : 0) + randomDigits;
    }

    /**
     * 已发放集合的文件格式 / On-disk format of the issued set
     */
    public enum IdFileFormat {
        JSON_ARRAY,
        LINES
    }

    /**
     * 已发放集合的加载时机 / When the issued set is read from disk
     */
    public enum LoadPolicy {
        /**
         * 首次使用时加载一次 / Loaded once on first use
         */
        ONCE,
        /**
         * 每次分配前重新加载，以感知外部对文件的修改 / Reloaded before every allocation to see external edits
         */
        EVERY_CALL
    }
}
