package decision.engine.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public record Outcome<T>(T value, Throwable error) {

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(Throwable error) {
        return new Outcome<>(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public T orElse(T fallback) {
        return succeeded() && value != null ? value : fallback;
    }

    public String errorSummary() {
        if (error == null) {
            return "NONE";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /**
     * Waits for {@code future} until the shared {@code deadlineNanos} (a {@link System#nanoTime()} value).
     * Never throws; a timeout cancels the future and is reported as a failure.
     */
    public static <T> Outcome<T> awaitUntil(CompletableFuture<T> future, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return success(future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(e);
        } catch (ExecutionException e) {
            return failure(e.getCause() == null ? e : e.getCause());
        }
    }
}
