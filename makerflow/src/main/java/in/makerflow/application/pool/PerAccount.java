package in.makerflow.application.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-account parameter: one value shared by every account, or a list aligned with the
 * pool's account order.
 */
public final class PerAccount<T> {

    private final T shared;
    private final List<T> values;

    private PerAccount(T shared, List<T> values) {
        this.shared = shared;
        this.values = values;
    }

    public static <T> PerAccount<T> shared(T value) {
        return new PerAccount<>(value, null);
    }

    /**
     * Index-aligned values. Null entries are allowed and reach the operation as null.
     */
    public static <T> PerAccount<T> of(List<T> values) {
        if (values == null) {
            throw new IllegalArgumentException("Per-account values cannot be null");
        }
        return new PerAccount<>(null, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public boolean isShared() {
        return values == null;
    }

    /**
     * @throws IllegalArgumentException if a value list does not have one entry per account
     */
    public List<T> resolve(int accountCount) {
        if (values == null) {
            return Collections.nCopies(accountCount, shared);
        }
        if (values.size() != accountCount) {
            throw new IllegalArgumentException(String.format(
                "Expected %d per-account values, got %d", accountCount, values.size()));
        }
        return values;
    }
}
