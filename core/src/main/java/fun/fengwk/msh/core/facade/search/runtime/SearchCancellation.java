package fun.fengwk.msh.core.facade.search.runtime;

import fun.fengwk.msh.core.facade.search.exception.SearchCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller owned cancellation signal shared by every suspension point of a search.
 *
 * <p>Delays wait on the signal directly. Blocking calls which can only be woken up by
 * an interrupt (rate limiter wait, HTTP send) register the current thread through
 * {@link #interruptOnCancel()} for the duration of the call.
 *
 * @author fengwk
 */
@Slf4j
public class SearchCancellation {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Guards {@link #callbacks} and {@link #reason}; callbacks run while holding it.
     */
    private final Object lock = new Object();

    private final List<Runnable> callbacks = new ArrayList<>();

    private volatile String reason;

    /**
     * Cancel the search, later calls are ignored.
     *
     * @return true if this call cancelled the signal
     */
    public boolean cancel(String reason) {
        synchronized (lock) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason == null || reason.isBlank() ? "cancelled" : reason;
            latch.countDown();
            for (Runnable callback : List.copyOf(callbacks)) {
                try {
                    callback.run();
                } catch (RuntimeException ex) {
                    log.warn("cancellation callback failed, error={}", ex.getMessage(), ex);
                }
            }
            callbacks.clear();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @throws SearchCancelledException if the signal is cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new SearchCancelledException(reason);
        }
    }

    /**
     * Wait for the given delay unless the signal fires first.
     *
     * @throws SearchCancelledException if cancelled before or during the wait
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (latch.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new SearchCancelledException(reason);
            }
        } catch (InterruptedException ex) {
            throw cancelledByInterrupt(ex);
        }
    }

    /**
     * Run {@code callback} once the signal fires, immediately when already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (lock) {
            if (reason == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {
        };
    }

    /**
     * Interrupt the current thread when the signal fires, until the registration is closed.
     *
     * <p>Closing after cancellation clears the interrupt flag raised by this registration,
     * so that a cancelled search does not leave the caller thread interrupted.
     */
    public Registration interruptOnCancel() {
        Thread thread = Thread.currentThread();
        Registration registration = onCancel(thread::interrupt);
        return () -> {
            registration.close();
            if (isCancelled() && Thread.currentThread() == thread) {
                Thread.interrupted();
            }
        };
    }

    /**
     * Translate an interrupt observed inside a blocking call.
     *
     * <p>An interrupt caused by this signal is consumed; an interrupt from elsewhere is
     * restored for the owner of the thread.
     */
    public SearchCancelledException cancelledByInterrupt(InterruptedException cause) {
        if (isCancelled()) {
            Thread.interrupted();
            return new SearchCancelledException(reason, cause);
        }
        Thread.currentThread().interrupt();
        return new SearchCancelledException("interrupted", cause);
    }

    /**
     * Handle of a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();

    }

}
