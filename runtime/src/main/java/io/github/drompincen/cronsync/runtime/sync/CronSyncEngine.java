package io.github.drompincen.cronsync.runtime.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.cronsync.protocol.api.CronJob;
import io.github.drompincen.cronsync.protocol.api.CronJobInput;
import io.github.drompincen.cronsync.protocol.api.CronListResponse;
import io.github.drompincen.cronsync.protocol.api.CronRunLogEntry;
import io.github.drompincen.cronsync.protocol.api.CronRunsResponse;
import io.github.drompincen.cronsync.protocol.api.CronStatusResponse;
import io.github.drompincen.cronsync.protocol.event.PushMessage;
import io.github.drompincen.cronsync.protocol.rpc.AddRequest;
import io.github.drompincen.cronsync.protocol.rpc.CronRequest;
import io.github.drompincen.cronsync.protocol.rpc.ListRequest;
import io.github.drompincen.cronsync.protocol.rpc.RemoveRequest;
import io.github.drompincen.cronsync.protocol.rpc.RunMode;
import io.github.drompincen.cronsync.protocol.rpc.RunRequest;
import io.github.drompincen.cronsync.protocol.rpc.RunsRequest;
import io.github.drompincen.cronsync.protocol.rpc.StatusRequest;
import io.github.drompincen.cronsync.protocol.rpc.UpdateRequest;
import io.github.drompincen.cronsync.runtime.editor.JobEditorFields;
import io.github.drompincen.cronsync.runtime.editor.JobPayloadBuilder;
import io.github.drompincen.cronsync.runtime.editor.JobValidationException;
import io.github.drompincen.cronsync.runtime.gateway.CronGatewayRpc;
import io.github.drompincen.cronsync.runtime.gateway.GatewayDecodeException;
import io.github.drompincen.cronsync.runtime.gateway.GatewayPushSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Keeps a local mirror of the gateway's cron jobs, scheduler status and the selected job's run
 * log. State changes happen on the single-threaded {@code context} executor and are published
 * to observers as immutable {@link CronSyncSnapshot}s.
 *
 * <p>Every state mutation checks the running flag under {@code stateLock}, the same lock
 * {@link #stop()} takes to clear it, so nothing is published once {@code stop()} has returned.
 * Completions of requests issued before a stop/start cycle are recognised by their epoch and
 * dropped.
 *
 * <p>Observers are notified after the lock is released, by one thread at a time. A thread
 * that commits a change while another is still delivering leaves the newer snapshot to that
 * thread, so observers always see snapshots in commit order but may skip intermediate ones.
 */
public class CronSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(CronSyncEngine.class);

    static final String NO_JOBS_MESSAGE = "No cron jobs yet.";

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final CronGatewayRpc rpc;
    private final GatewayPushSource pushSource;
    private final ScheduledExecutorService context;
    private final CronSyncSettings settings;
    private final DebouncedTrigger jobsTrigger;
    private final DebouncedTrigger runsTrigger;
    private final CronEventReconciler reconciler;
    private final List<Consumer<CronSyncSnapshot>> observers = new CopyOnWriteArrayList<>();
    private final Queue<Consumer<CronSyncSnapshot>> joining = new ConcurrentLinkedQueue<>();
    private final AtomicInteger deliveryWip = new AtomicInteger();

    private final Object stateLock = new Object();

    // guarded by stateLock
    private boolean running;
    private long epoch;
    private ScheduledFuture<?> pollTask;
    private Disposable pushSubscription;
    private List<CronJob> jobs = List.of();
    private String selectedJobId;
    private List<CronRunLogEntry> runEntries = List.of();
    private Boolean schedulerEnabled;
    private String schedulerStorePath;
    private Integer schedulerJobCount;
    private Long schedulerNextWakeAtMs;
    private boolean loadingJobs;
    private boolean loadingRuns;
    private boolean saving;
    private String lastError;
    private String statusMessage;

    private volatile CronSyncSnapshot snapshot = CronSyncSnapshot.empty();
    // only touched by the thread that owns deliveryWip
    private CronSyncSnapshot delivered = snapshot;

    public CronSyncEngine(CronGatewayRpc rpc,
                          GatewayPushSource pushSource,
                          ScheduledExecutorService context,
                          CronSyncSettings settings,
                          ObjectMapper objectMapper) {
        this.rpc = rpc;
        this.pushSource = pushSource;
        this.context = context;
        this.settings = settings;
        this.jobsTrigger = new DebouncedTrigger("cron-jobs", context, this::refreshJobs);
        this.runsTrigger = new DebouncedTrigger("cron-runs", context, this::refreshSelectedRuns);
        this.reconciler = new CronEventReconciler(objectMapper, jobsTrigger, runsTrigger,
                () -> snapshot.selectedJobId(), settings);
    }

    /** Handle returned by {@link #subscribe}; closing it stops delivery. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    // ---------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------

    public void start() {
        synchronized (stateLock) {
            if (running) return;
            running = true;
            epoch++;
            publishLocked();
            long pollMs = settings.pollInterval().toMillis();
            pollTask = context.scheduleWithFixedDelay(this::refreshJobs, 0, pollMs, TimeUnit.MILLISECONDS);
            pushSubscription = pushSource.messages().subscribe(
                    message -> context.execute(() -> onPush(message)),
                    error -> log.warn("Gateway push stream terminated: {}", error.getMessage()),
                    () -> log.info("Gateway push stream completed"));
        }
        notifyObservers();
        log.info("Cron sync started (poll every {}ms)", settings.pollInterval().toMillis());
    }

    public void stop() {
        synchronized (stateLock) {
            if (!running) return;
            running = false;
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
            if (pushSubscription != null) {
                pushSubscription.dispose();
                pushSubscription = null;
            }
            jobsTrigger.cancelAll();
            runsTrigger.cancelAll();
            loadingJobs = false;
            loadingRuns = false;
            saving = false;
            publishLocked();
        }
        notifyObservers();
        log.info("Cron sync stopped");
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return running;
        }
    }

    // ---------------------------------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------------------------------

    public CronSyncSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Registers an observer and hands it the latest delivered snapshot before any newer one.
     * Observers run on whichever thread is delivering, outside the state lock; a slow observer
     * delays later notifications but never blocks state changes.
     */
    public Registration subscribe(Consumer<CronSyncSnapshot> observer) {
        Objects.requireNonNull(observer, "observer");
        joining.add(observer);
        notifyObservers();
        return () -> {
            joining.remove(observer);
            observers.remove(observer);
        };
    }

    // ---------------------------------------------------------------------------------------
    // Refreshes
    // ---------------------------------------------------------------------------------------

    /**
     * Fetches scheduler status and the full job list (disabled jobs included) concurrently.
     * A no-op while stopped or while a previous job refresh is still outstanding.
     */
    public CompletableFuture<Void> refreshJobs() {
        return onContext(this::beginRefreshJobs);
    }

    public CompletableFuture<Void> refreshRuns(String jobId) {
        return refreshRuns(jobId, settings.runLogLimit());
    }

    public CompletableFuture<Void> refreshRuns(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId");
        return onContext(() -> beginRefreshRuns(jobId, limit));
    }

    private CompletableFuture<Void> beginRefreshJobs() {
        long issuedIn;
        synchronized (stateLock) {
            if (!running || loadingJobs) return DONE;
            issuedIn = epoch;
            loadingJobs = true;
            lastError = null;
            statusMessage = null;
            publishLocked();
        }
        notifyObservers();
        CompletableFuture<Void> status = call(new StatusRequest(), settings.requestTimeout())
                .handleAsync((res, err) -> {
                    applyStatus(issuedIn, res, err);
                    return null;
                }, context);
        CompletableFuture<Void> list = call(new ListRequest(true), settings.requestTimeout())
                .handleAsync((res, err) -> {
                    applyJobs(issuedIn, res, err);
                    return null;
                }, context);
        return CompletableFuture.allOf(status, list)
                .handleAsync((v, err) -> {
                    mutate(issuedIn, () -> loadingJobs = false);
                    return null;
                }, context);
    }

    private void applyStatus(long issuedIn, CronStatusResponse res, Throwable err) {
        if (err != null || res == null) {
            // status is informational; the job list still drives the view
            log.debug("cron.status failed: {}", err == null ? "empty response" : describe(err));
            return;
        }
        mutate(issuedIn, () -> {
            schedulerEnabled = res.enabled();
            schedulerStorePath = res.storePath();
            schedulerJobCount = res.jobs();
            schedulerNextWakeAtMs = res.nextWakeAtMs();
        });
    }

    private void applyJobs(long issuedIn, CronListResponse res, Throwable err) {
        Throwable failure = err == null && res == null
                ? new GatewayDecodeException("cron.list returned no body", null)
                : err;
        if (failure != null) {
            String message = describe(failure);
            if (mutate(issuedIn, () -> lastError = message)) {
                log.warn("Failed to refresh cron jobs: {}", message);
            }
            return;
        }
        mutate(issuedIn, () -> {
            jobs = res.jobs();
            statusMessage = jobs.isEmpty() ? NO_JOBS_MESSAGE : null;
        });
    }

    private CompletableFuture<Void> beginRefreshRuns(String jobId, int limit) {
        long issuedIn;
        synchronized (stateLock) {
            if (!running || loadingRuns) return DONE;
            issuedIn = epoch;
            loadingRuns = true;
            publishLocked();
        }
        notifyObservers();
        return call(new RunsRequest(jobId, limit), settings.requestTimeout())
                .handleAsync((res, err) -> {
                    applyRuns(issuedIn, jobId, res, err);
                    return null;
                }, context);
    }

    private void applyRuns(long issuedIn, String jobId, CronRunsResponse res, Throwable err) {
        Throwable failure = err == null && res == null
                ? new GatewayDecodeException("cron.runs returned no body", null)
                : err;
        String message = failure == null ? null : describe(failure);
        boolean[] superseded = new boolean[1];
        boolean applied = mutate(issuedIn, () -> {
            loadingRuns = false;
            if (message != null) {
                lastError = message;
            } else if (jobId.equals(selectedJobId)) {
                runEntries = res.entries();
            } else {
                // a cleared selection keeps an empty run log
                superseded[0] = selectedJobId != null;
            }
        });
        if (!applied) return;
        if (message != null) {
            log.warn("Failed to refresh runs of {}: {}", jobId, message);
        } else if (superseded[0]) {
            log.debug("Discarding runs of {}; selection moved on", jobId);
            scheduleRunsRefresh();
        }
    }

    private void refreshSelectedRuns() {
        String selected = snapshot.selectedJobId();
        if (selected != null) {
            refreshRuns(selected);
        }
    }

    private void scheduleRunsRefresh() {
        synchronized (stateLock) {
            if (running) {
                runsTrigger.schedule(settings.runsDebounce());
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------------------------

    /**
     * Selects a job (or clears the selection with {@code null}). A changed selection clears
     * the run log; a non-null selection then loads its runs.
     */
    public CompletableFuture<Void> selectJob(String jobId) {
        return onContext(() -> {
            synchronized (stateLock) {
                if (!running) return DONE;
                if (!Objects.equals(selectedJobId, jobId)) {
                    selectedJobId = jobId;
                    runEntries = List.of();
                    publishLocked();
                }
            }
            notifyObservers();
            return jobId == null ? DONE : beginRefreshRuns(jobId, settings.runLogLimit());
        });
    }

    // ---------------------------------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------------------------------

    /** Triggers a run; failures land in {@code lastError}. */
    public CompletableFuture<Void> runJob(String jobId, boolean force) {
        Objects.requireNonNull(jobId, "jobId");
        long issuedIn = currentEpoch();
        return call(new RunRequest(jobId, RunMode.of(force)), settings.runTimeout())
                .handleAsync((ack, err) -> {
                    if (err != null) recordError(issuedIn, "run " + jobId, err);
                    return null;
                }, context);
    }

    /**
     * Removes a job and refreshes the job list whether or not removal succeeded. A failure is
     * recorded once that refresh has settled; on success the selection is cleared when it
     * pointed at the removed job.
     */
    public CompletableFuture<Void> removeJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        long issuedIn = currentEpoch();
        return call(new RemoveRequest(jobId), settings.requestTimeout())
                .handle((ack, err) -> err)
                .thenCompose(err -> refreshJobs().thenApply(v -> Optional.ofNullable(err)))
                .thenAcceptAsync(failure -> {
                    if (failure.isPresent()) {
                        recordError(issuedIn, "remove " + jobId, failure.get());
                        return;
                    }
                    mutate(issuedIn, () -> {
                        if (jobId.equals(selectedJobId)) {
                            selectedJobId = null;
                            runEntries = List.of();
                        }
                    });
                }, context);
    }

    public CompletableFuture<Void> setEnabled(String jobId, boolean enabled) {
        Objects.requireNonNull(jobId, "jobId");
        long issuedIn = currentEpoch();
        return call(new UpdateRequest(jobId, CronJobInput.enabledOnly(enabled)), settings.requestTimeout())
                .handleAsync((ack, err) -> {
                    if (err != null) recordError(issuedIn, "update " + jobId, err);
                    return err == null;
                }, context)
                .thenCompose(updated -> updated ? refreshJobs() : DONE);
    }

    /**
     * Adds a job ({@code jobId == null}) or patches an existing one, then refreshes the job
     * list. Unlike the other mutations, failures propagate to the caller.
     */
    public CompletableFuture<Void> upsertJob(String jobId, CronJobInput input) {
        Objects.requireNonNull(input, "input");
        CronRequest<JsonNode> request = jobId != null
                ? new UpdateRequest(jobId, input)
                : new AddRequest(input);
        return call(request, settings.requestTimeout())
                .thenCompose(ack -> refreshJobs());
    }

    /**
     * Validates the editor form and upserts the result. Fails with a
     * {@link JobValidationException} before anything is sent when the form is incomplete, and
     * with an {@link IllegalStateException} while another save is outstanding.
     */
    public CompletableFuture<Void> saveJob(String jobId, JobEditorFields fields) {
        CronJobInput input;
        try {
            input = JobPayloadBuilder.build(fields, jobId != null);
        } catch (JobValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        long issuedIn;
        synchronized (stateLock) {
            if (saving) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("a save is already in progress"));
            }
            issuedIn = epoch;
            if (running) {
                saving = true;
                publishLocked();
            }
        }
        notifyObservers();
        return upsertJob(jobId, input)
                .whenCompleteAsync((v, err) -> mutate(issuedIn, () -> saving = false), context);
    }

    // ---------------------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------------------

    private void onPush(PushMessage message) {
        synchronized (stateLock) {
            if (!running) return;
            try {
                reconciler.handle(message);
            } catch (RuntimeException e) {
                log.error("Failed to handle push message {}", message, e);
            }
        }
    }

    private <R> CompletableFuture<R> call(CronRequest<R> request, Duration timeout) {
        try {
            return rpc.call(request, timeout);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> onContext(Supplier<CompletableFuture<Void>> work) {
        return CompletableFuture.supplyAsync(work, context).thenCompose(Function.identity());
    }

    private long currentEpoch() {
        synchronized (stateLock) {
            return epoch;
        }
    }

    private void recordError(long issuedIn, String what, Throwable err) {
        String message = describe(err);
        if (mutate(issuedIn, () -> lastError = message)) {
            log.warn("Failed to {}: {}", what, message);
        }
    }

    private boolean mutate(long issuedIn, Runnable change) {
        synchronized (stateLock) {
            if (!running || issuedIn != epoch) return false;
            change.run();
            publishLocked();
        }
        notifyObservers();
        return true;
    }

    private void publishLocked() {
        snapshot = new CronSyncSnapshot(jobs, selectedJobId, runEntries,
                schedulerEnabled, schedulerStorePath, schedulerJobCount, schedulerNextWakeAtMs,
                loadingJobs, loadingRuns, saving, lastError, statusMessage, running);
    }

    // must not be called while holding stateLock
    private void notifyObservers() {
        if (deliveryWip.getAndIncrement() != 0) return;
        int missed = 1;
        do {
            CronSyncSnapshot latest = snapshot;
            if (latest != delivered) {
                delivered = latest;
                for (Consumer<CronSyncSnapshot> observer : observers) {
                    deliver(observer, latest);
                }
            }
            Consumer<CronSyncSnapshot> newcomer;
            while ((newcomer = joining.poll()) != null) {
                observers.add(newcomer);
                deliver(newcomer, delivered);
            }
            missed = deliveryWip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void deliver(Consumer<CronSyncSnapshot> observer, CronSyncSnapshot value) {
        try {
            observer.accept(value);
        } catch (RuntimeException e) {
            log.error("Snapshot observer failed", e);
        }
    }

    static String describe(Throwable err) {
        Throwable cause = err;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
