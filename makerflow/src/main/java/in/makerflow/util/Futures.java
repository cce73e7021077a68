package in.makerflow.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * CompletableFuture helpers.
 */
public final class Futures {

    /**
     * Strip CompletionException/ExecutionException wrappers added by future composition.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static <T> CompletableFuture<T> failed(Throwable t) {
        return CompletableFuture.failedFuture(t);
    }

    /**
     * Run a supplier that may throw synchronously, turning the throw into a failed future.
     */
    public static <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> supplier) {
        try {
            CompletableFuture<T> future = supplier.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("Operation returned no future"));
            }
            return future;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private Futures() {}
}
