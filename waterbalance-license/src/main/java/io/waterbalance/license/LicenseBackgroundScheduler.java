package io.waterbalance.license;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link LicenseValidator#validateBackground()} periodically on a single
 * daemon thread, off the UI thread.
 *
 * <p>After each run the next one is scheduled with the validator's current
 * {@link LicenseValidator#checkInterval()}, so a tier change takes effect
 * without a restart. Results are handed to a listener; a run that throws is
 * logged and the schedule carries on.
 *
 * <p>{@link #stop()} cancels the timer. An in-flight validation is abandoned;
 * the local record is only written after a fetch completes, so this is safe.
 */
public class LicenseBackgroundScheduler implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseBackgroundScheduler.class.getName());

    static final String THREAD_NAME = "waterbalance-license-revalidation";

    private final LicenseValidator validator;
    private final Consumer<ValidationResult> listener;
    private final Supplier<Duration> interval;
    private final ScheduledExecutorService executor;

    private volatile boolean running;
    private ScheduledFuture<?> pending;

    /**
     * @param validator the process-wide validator
     * @param listener receives each background result (called on the scheduler thread)
     */
    public LicenseBackgroundScheduler(LicenseValidator validator, Consumer<ValidationResult> listener) {
        this(validator, listener, validator::checkInterval);
    }

    LicenseBackgroundScheduler(LicenseValidator validator, Consumer<ValidationResult> listener,
                               Supplier<Duration> interval) {
        this.validator = validator;
        this.listener = listener;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the timer. The first run happens one interval from now, since
     * startup validation has just run.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Scheduler has been stopped");
        }
        running = true;
        scheduleNext();
        LOG.info("Background license revalidation started");
    }

    /**
     * Stop the timer. Cannot be restarted.
     */
    public synchronized void stop() {
        if (!running && executor.isShutdown()) {
            return;
        }
        running = false;
        if (pending != null) {
            pending.cancel(true);
        }
        executor.shutdownNow();
        LOG.info("Background license revalidation stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Run one validation now on the scheduler thread.
     *
     * @return the result, also passed to the listener; null if the validation threw
     */
    public CompletableFuture<ValidationResult> runNow() {
        return CompletableFuture.supplyAsync(this::runOnce, executor);
    }

    public boolean isRunning() {
        return running;
    }

    private synchronized void scheduleNext() {
        if (!running) {
            return;
        }
        Duration delay = interval.get();
        LOG.fine("Next background license check in " + delay);
        pending = executor.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void tick() {
        try {
            runOnce();
        } finally {
            scheduleNext();
        }
    }

    private ValidationResult runOnce() {
        ValidationResult result;
        try {
            result = validator.validateBackground();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Background license validation failed", e);
            return null;
        }
        if (!result.isSuccess()) {
            LOG.warning("Background license check: " + result.error() + " - " + result.message());
        }
        try {
            listener.accept(result);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "License result listener failed", e);
        }
        return result;
    }
}
