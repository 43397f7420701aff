package io.github.vevoly.datastore.core.snapshot;

import com.google.gson.reflect.TypeToken;
import io.github.vevoly.datastore.api.constants.JAtomicDataStoreConstant;
import io.github.vevoly.datastore.api.model.Account;
import io.github.vevoly.datastore.api.model.Customer;
import io.github.vevoly.datastore.api.model.Loan;
import io.github.vevoly.datastore.api.model.SnapshotEntity;
import lombok.Getter;
import lombok.ToString;

import java.lang.reflect.Type;
import java.util.List;

/**
 * <h3>快照集合 (Snapshot Collection)</h3>
 *
 * <p>一个实体集合的名称、文件名与反序列化类型。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Collection.</b><br>
 * Name, file name and deserialization type of one entity collection.
 * </span>
 *
 * @param <T> 实体类型 (Entity type)
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@ToString(of = {"name", "fileName"})
public final class SnapshotCollection<T extends SnapshotEntity> {

    public static final SnapshotCollection<Account> ACCOUNTS = new SnapshotCollection<>(
            "accounts", JAtomicDataStoreConstant.ACCOUNTS_JSON_FILE, new TypeToken<List<Account>>() {}.getType());

    public static final SnapshotCollection<Customer> CUSTOMERS = new SnapshotCollection<>(
            "customers", JAtomicDataStoreConstant.CUSTOMERS_JSON_FILE, new TypeToken<List<Customer>>() {}.getType());

    public static final SnapshotCollection<Loan> LOANS = new SnapshotCollection<>(
            "loans", JAtomicDataStoreConstant.LOANS_JSON_FILE, new TypeToken<List<Loan>>() {}.getType());

    private final String name;
    private final String fileName;
    private final Type listType;

    public SnapshotCollection(String name, String fileName, Type listType) {
        this.name = name;
        this.fileName = fileName;
        this.listType = listType;
    }
}
