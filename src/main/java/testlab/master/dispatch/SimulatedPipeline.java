package testlab.master.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for a real deploy/boot/test pipeline: sleeps through each stage
 * and, for MultiNode jobs, synchronises with its peers after boot and after
 * the test. Fails with the configured probability.
 */
public final class SimulatedPipeline implements DevicePipeline {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPipeline.class);

    private final Duration runTime;
    private final double failRate;

    public SimulatedPipeline(Duration runTime, double failRate) {
        this.runTime = runTime;
        this.failRate = failRate;
    }

    public static PipelineFactory factory(Duration runTime) {
        return (job, device) -> new SimulatedPipeline(runTime, 0.0);
    }

    @Override
    public void run(PipelineContext context) throws Exception {
        String hostname = context.device().hostname();

        stage(hostname, "deploy");
        stage(hostname, "boot");

        if (context.isMultinode()) {
            context.multinode().barrier("booted", Map.of("hostname", hostname));
        }

        stage(hostname, "test");

        if (failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate) {
            throw new IllegalStateException("Simulated failure on " + hostname);
        }

        if (context.isMultinode()) {
            context.multinode().barrier("finished");
        }
    }

    private void stage(String hostname, String name) throws InterruptedException {
        long third = Math.max(1, runTime.toMillis() / 3);
        long delay = third <= 1 ? third : ThreadLocalRandom.current().nextLong(third / 2, third + 1);
        log.debug("Sim {}: {} ({}ms)", hostname, name, delay);
        Thread.sleep(delay);
    }
}
