package testlab.master;

import testlab.master.config.MasterConfig;
import testlab.master.dispatch.DevicePipeline;
import testlab.master.dispatch.PipelineFactory;
import testlab.master.model.Device;
import testlab.master.model.Job;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shared fixtures: private in-memory databases, fast configs and scriptable pipelines.
 */
public final class TestSupport {

    private TestSupport() {
    }

    public static String memoryDbUrl(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static MasterConfig config(String name) {
        return MasterConfig.defaults()
                .withDatabaseUrl(memoryDbUrl(name))
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withPassInterval(Duration.ofMillis(100))
                .withDefaultSyncTimeout(Duration.ofSeconds(5))
                .withSimulatedRunTime(Duration.ofMillis(30));
    }

    /** Poll until the condition holds, failing after ten seconds. */
    public static void await(String what, BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted waiting for " + what);
            }
        }
    }

    /**
     * Pipelines chosen per hostname. Unscripted devices block until
     * {@link #releaseAll()} (or until canceled), so their jobs stay RUNNING.
     */
    public static final class ScriptedPipelines implements PipelineFactory {

        private final Map<String, DevicePipeline> byHostname = new ConcurrentHashMap<>();
        private final CountDownLatch gate = new CountDownLatch(1);

        public ScriptedPipelines on(String hostname, DevicePipeline pipeline) {
            byHostname.put(hostname, pipeline);
            return this;
        }

        public void releaseAll() {
            gate.countDown();
        }

        @Override
        public DevicePipeline create(Job job, Device device) {
            DevicePipeline scripted = byHostname.get(device.hostname());
            if (scripted != null) {
                return scripted;
            }
            return context -> gate.await();
        }
    }
}
