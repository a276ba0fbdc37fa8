package testlab.master.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.Device;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.Job;
import testlab.master.model.OutcomeResult;
import testlab.master.multinode.MultiNodeClient;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.multinode.Participant;
import testlab.master.multinode.SyncFailedException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each device pipeline in-process on its own thread. MultiNode pipelines
 * get a {@link MultiNodeClient} bound to their group, role and hostname.
 */
public class LocalDispatchGateway implements DispatchGateway {

    private static final Logger log = LoggerFactory.getLogger(LocalDispatchGateway.class);

    private final PipelineFactory pipelines;
    private final MultiNodeCoordinator coordinator;
    private final Duration syncTimeout;
    private final ExecutorService executor;
    private volatile DispatchCallback callback;
    private volatile boolean shuttingDown = false;

    public LocalDispatchGateway(PipelineFactory pipelines, MultiNodeCoordinator coordinator, Duration syncTimeout) {
        this.pipelines = pipelines;
        this.coordinator = coordinator;
        this.syncTimeout = syncTimeout;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lab-pipeline-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Where pipeline progress is reported. Must be set before the first {@link #start}.
     */
    public void setCallback(DispatchCallback callback) {
        this.callback = callback;
    }

    @Override
    public DispatchHandle start(Device device, Job job, GroupBinding binding) {
        DispatchCallback cb = Objects.requireNonNull(callback, "dispatch callback not set");
        DevicePipeline pipeline = pipelines.create(job, device);

        MultiNodeClient client = null;
        if (binding != null) {
            client = coordinator.client(binding.groupId(), new Participant(binding.role(), device.hostname()),
                    syncTimeout);
        }
        PipelineContext context = new PipelineContext(job, device, binding, client);

        Future<?> future = executor.submit(() -> runPipeline(pipeline, context, cb));
        log.info("Dispatched job {} to {}{}", job.id(), device.hostname(),
                binding != null ? " as " + binding.role() + " (" + binding.subId() + ")" : "");
        return new FutureHandle(future);
    }

    private void runPipeline(DevicePipeline pipeline, PipelineContext context, DispatchCallback cb) {
        long jobId = context.job().id();
        String hostname = context.device().hostname();

        OutcomeResult started = cb.reportStarted(jobId, hostname);
        if (started != OutcomeResult.RECORDED) {
            log.info("Pipeline for job {} on {} not run: {}", jobId, hostname, started);
            return;
        }

        DispatchOutcome outcome;
        try {
            pipeline.run(context);
            outcome = DispatchOutcome.complete();
        } catch (SyncFailedException e) {
            outcome = switch (e.status()) {
                case PEER_FAILED -> DispatchOutcome.incomplete(FailureKind.PEER_FAILED, e.getMessage());
                case TIMEOUT -> DispatchOutcome.incomplete(FailureKind.TIMEOUT, e.getMessage());
                default -> DispatchOutcome.canceled(e.getMessage());
            };
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = DispatchOutcome.canceled("pipeline interrupted");
        } catch (Exception e) {
            log.warn("Pipeline for job {} on {} failed", jobId, hostname, e);
            outcome = DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (shuttingDown) {
            // Left RUNNING; restart recovery ends it.
            log.info("Pipeline for job {} on {} stopped by shutdown, outcome not reported", jobId, hostname);
            return;
        }
        OutcomeResult reported = cb.reportOutcome(jobId, hostname, outcome);
        log.debug("Pipeline for job {} on {} ended {} -> {}", jobId, hostname, outcome.status(), reported);
    }

    @Override
    public void shutdown() {
        shuttingDown = true;
        executor.shutdownNow();
    }

    private record FutureHandle(Future<?> future) implements DispatchHandle {

        @Override
        public boolean isAlive() {
            return !future.isDone();
        }

        @Override
        public void cancel() {
            future.cancel(true);
        }
    }
}
