package testlab.master.scheduler;

import testlab.master.TestSupport;
import testlab.master.TestSupport.ScriptedPipelines;
import testlab.master.config.Dependencies;
import testlab.master.config.MasterConfig;
import testlab.master.model.DeviceHealth;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.DeviceStatus;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.HealthProbeResult;
import testlab.master.model.Job;
import testlab.master.model.JobStatus;
import testlab.master.model.ReservationResult;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryServiceTest {

    private MasterConfig config;
    private Dependencies deps;

    @BeforeEach
    void setUp() {
        config = TestSupport.config("recovery");
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private Dependencies boot(ScriptedPipelines pipelines) {
        if (deps != null) {
            deps.close();
        }
        deps = Dependencies.create(config, pipelines);
        return deps;
    }

    private Job submitSingle(Dependencies d) {
        return d.jobService().submit(Job.builder().requirement(DeviceRequirement.of("pixel")).build());
    }

    private Job reload(Job job) {
        return deps.jobQueue().find(job.id()).orElseThrow();
    }

    @Test
    void runningJobLostInRestartEndsIncomplete() {
        Dependencies first = boot(new ScriptedPipelines());
        first.deviceRegistry().register("pixel-1", "pixel", List.of());
        first.deviceRegistry().reportHealth("pixel-1", HealthProbeResult.PASS);
        Job job = submitSingle(first);
        first.jobScheduler().runPass();
        TestSupport.await("job running",
                () -> first.jobQueue().find(job.id()).orElseThrow().status() == JobStatus.RUNNING);

        Dependencies second = boot(new ScriptedPipelines());
        assertEquals(JobStatus.RUNNING, reload(job).status());

        RecoveryReport report = second.recoveryService().reconcile();

        assertEquals(1, report.failed());
        Job lost = reload(job);
        assertEquals(JobStatus.INCOMPLETE, lost.status());
        assertEquals(FailureKind.INFRASTRUCTURE, lost.failureKind());
        var device = second.deviceRegistry().find("pixel-1").orElseThrow();
        assertEquals(DeviceStatus.IDLE, device.status());
        assertNull(device.currentJobId());
        assertEquals(DeviceHealth.UNKNOWN, device.health());
    }

    @Test
    void lostMultinodeJobEndsEveryMember() {
        Dependencies first = boot(new ScriptedPipelines());
        first.deviceRegistry().register("a", "pixel", List.of());
        first.deviceRegistry().register("b", "pixel", List.of());
        Job job = first.jobService().submit(Job.builder()
                .roles(Map.of("server", DeviceRequirement.of("pixel"), "client", DeviceRequirement.of("pixel")))
                .build());
        first.jobScheduler().runPass();
        TestSupport.await("members running", () -> first.jobService().findGroup(job.id())
                .map(g -> g.members().stream().allMatch(m -> m.status() == JobStatus.RUNNING))
                .orElse(false));
        String groupId = first.jobQueue().find(job.id()).orElseThrow().groupId();

        Dependencies second = boot(new ScriptedPipelines());
        RecoveryReport report = second.recoveryService().reconcile();

        assertEquals(2, report.failed());
        assertEquals(JobStatus.INCOMPLETE, reload(job).status());
        assertTrue(second.jobService().findGroup(job.id()).orElseThrow().members().stream()
                .allMatch(m -> m.status() == JobStatus.INCOMPLETE && m.failureKind() == FailureKind.INFRASTRUCTURE));
        assertTrue(second.deviceRegistry().findBusy().isEmpty());
        assertFalse(second.coordinator().isDeclared(groupId));
    }

    @Test
    void scheduledJobWithReservationIsDispatchedAgain() {
        Dependencies d = boot(new ScriptedPipelines().on("pixel-1", ctx -> {
        }));
        d.deviceRegistry().register("pixel-1", "pixel", List.of());
        Job job = submitSingle(d);
        assertEquals(ReservationResult.RESERVED, d.deviceRegistry().reserve("pixel-1", job.id()));
        assertTrue(d.jobQueue().markScheduled(job, null));

        RecoveryReport report = d.recoveryService().reconcile();

        assertEquals(1, report.resumed());
        TestSupport.await("job complete", () -> reload(job).status() == JobStatus.COMPLETE);
        TestSupport.await("device idle",
                () -> d.deviceRegistry().find("pixel-1").orElseThrow().status() == DeviceStatus.IDLE);
    }

    @Test
    void scheduledJobWithoutReservationEndsIncomplete() {
        Dependencies d = boot(new ScriptedPipelines());
        Job job = submitSingle(d);
        assertTrue(d.jobQueue().markScheduled(job, null));

        RecoveryReport report = d.recoveryService().reconcile();

        assertEquals(1, report.failed());
        Job lost = reload(job);
        assertEquals(JobStatus.INCOMPLETE, lost.status());
        assertEquals("reservation lost", lost.failureComment());
    }

    @Test
    void orphanReservationsAreReleased() {
        Dependencies d = boot(new ScriptedPipelines());
        d.deviceRegistry().register("done", "pixel", List.of());
        d.deviceRegistry().register("queued", "pixel", List.of());
        Job finished = submitSingle(d);
        Job waiting = submitSingle(d);
        d.deviceRegistry().reserve("done", finished.id());
        d.deviceRegistry().reserve("queued", waiting.id());
        d.jobQueue().markComplete(finished.id(), DispatchOutcome.canceled("gone"));

        RecoveryReport report = d.recoveryService().reconcile();

        assertEquals(2, report.released());
        assertTrue(d.deviceRegistry().findBusy().isEmpty());
        assertEquals(JobStatus.SUBMITTED, reload(waiting).status());
    }

    @Test
    void liveDispatchesAreLeftAlone() {
        Dependencies d = boot(new ScriptedPipelines());
        d.deviceRegistry().register("pixel-1", "pixel", List.of());
        Job job = submitSingle(d);
        d.jobScheduler().runPass();
        TestSupport.await("job running", () -> reload(job).status() == JobStatus.RUNNING);

        assertTrue(d.recoveryService().reconcile().isEmpty());
        assertEquals(JobStatus.RUNNING, reload(job).status());
        assertEquals(job.id(), d.deviceRegistry().find("pixel-1").orElseThrow().currentJobId());
    }

    @Test
    void reconcileIsIdempotent() {
        Dependencies d = boot(new ScriptedPipelines());
        Job job = submitSingle(d);
        d.jobQueue().markScheduled(job, null);

        assertFalse(d.recoveryService().reconcile().isEmpty());
        assertTrue(d.recoveryService().reconcile().isEmpty());
    }
}
