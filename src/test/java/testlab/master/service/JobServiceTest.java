package testlab.master.service;

import testlab.master.TestSupport;
import testlab.master.TestSupport.ScriptedPipelines;
import testlab.master.config.Dependencies;
import testlab.master.model.CancelResult;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceHealth;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.DeviceStatus;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.GroupMember;
import testlab.master.model.HealthProbeResult;
import testlab.master.model.Job;
import testlab.master.model.JobStatus;
import testlab.master.model.OutcomeResult;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private ScriptedPipelines pipelines;
    private Dependencies deps;
    private DeviceRegistry registry;
    private JobService jobs;

    @BeforeEach
    void setUp() {
        pipelines = new ScriptedPipelines();
        deps = Dependencies.create(TestSupport.config("jobs"), pipelines);
        registry = deps.deviceRegistry();
        jobs = deps.jobService();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private Job submitSingle() {
        return jobs.submit(Job.builder().description("single").requirement(DeviceRequirement.of("pixel")).build());
    }

    private Job submitPair(boolean serverEssential) {
        DeviceRequirement server = DeviceRequirement.of("pixel", "server");
        return jobs.submit(Job.builder()
                .description("pair")
                .roles(Map.of(
                        "server", serverEssential ? server.asEssential() : server,
                        "client", DeviceRequirement.of("pixel", "client")))
                .build());
    }

    private void registerPair() {
        registry.register("srv", "pixel", List.of("server"));
        registry.register("cli", "pixel", List.of("client"));
    }

    private Job reload(Job job) {
        return jobs.find(job.id()).orElseThrow();
    }

    private void awaitStatus(Job job, JobStatus status) {
        TestSupport.await("job " + job.id() + " " + status, () -> reload(job).status() == status);
    }

    private Device device(String hostname) {
        return registry.find(hostname).orElseThrow();
    }

    private GroupMember member(Job job, String hostname) {
        return jobs.findGroup(job.id()).orElseThrow().member(hostname).orElseThrow();
    }

    // ==================== Submission ====================

    @Test
    void submitRejectsInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> jobs.submit(Job.builder()
                .requirement(DeviceRequirement.of("pixel", 2, List.of())).build()));
        assertThrows(IllegalArgumentException.class, () -> jobs.submit(Job.builder()
                .roles(Map.of(" ", DeviceRequirement.of("pixel"))).build()));
        assertThrows(IllegalArgumentException.class, () -> jobs.submit(Job.builder()
                .roles(Map.of("client", DeviceRequirement.of("pixel", 0, List.of()))).build()));
        assertThrows(IllegalArgumentException.class, () -> jobs.submit(Job.builder()
                .requirement(DeviceRequirement.of("pixel")).healthCheck(true).requestedDevice("x").build()));
    }

    // ==================== Cancellation ====================

    @Test
    void cancelRunningJobFreesItsDevice() {
        registry.register("pixel-1", "pixel", List.of());
        Job job = submitSingle();
        deps.jobScheduler().runPass();
        awaitStatus(job, JobStatus.RUNNING);

        assertEquals(CancelResult.CANCELED, jobs.cancel(job.id()));

        Job canceled = reload(job);
        assertEquals(JobStatus.CANCELED, canceled.status());
        assertEquals(FailureKind.CANCELED, canceled.failureKind());
        assertNotNull(canceled.endTime());
        assertEquals(DeviceStatus.IDLE, device("pixel-1").status());
        assertEquals(CancelResult.ALREADY_TERMINAL, jobs.cancel(job.id()));
        assertEquals(CancelResult.NOT_FOUND, jobs.cancel(987654L));
    }

    @Test
    void cancelQueuedJobNeverSchedulesIt() {
        registry.register("pixel-1", "pixel", List.of());
        Job job = submitSingle();

        jobs.cancel(job.id());
        deps.jobScheduler().runPass();

        assertEquals(JobStatus.CANCELED, reload(job).status());
        assertNull(device("pixel-1").currentJobId());
    }

    @Test
    void cancelMultinodeJobCancelsWholeGroup() {
        registerPair();
        pipelines.on("srv", ctx -> ctx.multinode().receive("never-sent"));
        pipelines.on("cli", ctx -> ctx.multinode().receive("never-sent"));
        Job job = submitPair(false);
        deps.jobScheduler().runPass();
        awaitStatus(job, JobStatus.RUNNING);
        String groupId = reload(job).groupId();

        assertEquals(CancelResult.CANCELED, jobs.cancel(job.id()));

        assertEquals(JobStatus.CANCELED, reload(job).status());
        DeviceGroup group = jobs.findGroup(job.id()).orElseThrow();
        assertTrue(group.members().stream().allMatch(m -> m.status() == JobStatus.CANCELED));
        assertFalse(deps.coordinator().isDeclared(groupId));
        assertTrue(registry.findBusy().isEmpty());
        TestSupport.await("pipelines stopped", () -> deps.dispatcher().liveCount() == 0);
    }

    // ==================== MultiNode outcomes ====================

    @Test
    void groupCompletesWhenEveryMemberCompletes() {
        registerPair();
        AtomicReference<Map<String, Map<String, String>>> seenByClient = new AtomicReference<>();
        pipelines.on("srv", ctx -> ctx.multinode().barrier("setup", Map.of("port", "7000")));
        pipelines.on("cli", ctx -> seenByClient.set(ctx.multinode().barrier("setup")));
        Job job = submitPair(false);
        deps.jobScheduler().runPass();
        String groupId = reload(job).groupId();

        awaitStatus(job, JobStatus.COMPLETE);

        assertEquals("7000", seenByClient.get().get("server").get("port"));
        assertEquals(JobStatus.COMPLETE, member(job, "srv").status());
        assertEquals(JobStatus.COMPLETE, member(job, "cli").status());
        assertFalse(deps.coordinator().isDeclared(groupId));
        TestSupport.await("devices released", () -> registry.findBusy().isEmpty());
    }

    @Test
    void peerFailureEndsTheOtherMemberIncomplete() {
        registerPair();
        registry.reportHealth("srv", HealthProbeResult.PASS);
        pipelines.on("srv", ctx -> {
            throw new IllegalStateException("flash failed");
        });
        pipelines.on("cli", ctx -> ctx.multinode().barrier("setup"));
        Job job = submitPair(false);
        deps.jobScheduler().runPass();

        awaitStatus(job, JobStatus.INCOMPLETE);

        assertEquals(FailureKind.INFRASTRUCTURE, member(job, "srv").failureKind());
        assertEquals(JobStatus.INCOMPLETE, member(job, "cli").status());
        assertEquals(FailureKind.PEER_FAILED, member(job, "cli").failureKind());
        Job finished = reload(job);
        assertEquals(FailureKind.INFRASTRUCTURE, finished.failureKind());
        assertTrue(finished.failureComment().contains("srv"));
        assertEquals(DeviceHealth.UNKNOWN, device("srv").health());
        TestSupport.await("devices released", () -> registry.findBusy().isEmpty());
    }

    @Test
    void essentialRoleFailureCancelsRemainingMembers() {
        registerPair();
        pipelines.on("srv", ctx -> {
            throw new IllegalStateException("server crashed");
        });
        Job job = submitPair(true);
        deps.jobScheduler().runPass();

        awaitStatus(job, JobStatus.INCOMPLETE);

        assertEquals(JobStatus.INCOMPLETE, member(job, "srv").status());
        GroupMember client = member(job, "cli");
        assertEquals(JobStatus.CANCELED, client.status());
        assertTrue(client.failureComment().contains("essential role 'server'"));
        assertEquals(FailureKind.INFRASTRUCTURE, reload(job).failureKind());
        TestSupport.await("devices released", () -> registry.findBusy().isEmpty());
        TestSupport.await("pipelines stopped", () -> deps.dispatcher().liveCount() == 0);
    }

    // ==================== Callbacks ====================

    @Test
    void callbacksCheckJobAndDevice() {
        registry.register("pixel-1", "pixel", List.of());
        registry.register("pixel-2", "pixel", List.of());
        Job job = submitSingle();
        deps.jobScheduler().runPass();
        awaitStatus(job, JobStatus.RUNNING);
        String holder = device("pixel-1").currentJobId() != null ? "pixel-1" : "pixel-2";
        String other = holder.equals("pixel-1") ? "pixel-2" : "pixel-1";

        assertEquals(OutcomeResult.NOT_FOUND, jobs.reportOutcome(987654L, holder, DispatchOutcome.complete()));
        assertEquals(OutcomeResult.WRONG_DEVICE, jobs.reportOutcome(job.id(), other, DispatchOutcome.complete()));
        assertEquals(OutcomeResult.WRONG_DEVICE, jobs.reportStarted(job.id(), other));

        assertEquals(OutcomeResult.RECORDED, jobs.reportOutcome(job.id(), holder, DispatchOutcome.complete()));
        assertEquals(OutcomeResult.ALREADY_TERMINAL,
                jobs.reportOutcome(job.id(), holder, DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, "late")));
        assertEquals(JobStatus.COMPLETE, reload(job).status());
    }

    @Test
    void healthCheckOutcomeSetsDeviceHealth() {
        registry.register("good", "pixel", List.of());
        registry.register("bad", "pixel", List.of());
        pipelines.on("good", ctx -> {
        });
        pipelines.on("bad", ctx -> {
            throw new IllegalStateException("adb unreachable");
        });

        Job passing = jobs.submitHealthCheck(device("good"));
        Job failing = jobs.submitHealthCheck(device("bad"));
        deps.jobScheduler().runPass();

        awaitStatus(passing, JobStatus.COMPLETE);
        awaitStatus(failing, JobStatus.INCOMPLETE);
        assertEquals(DeviceHealth.GOOD, device("good").health());
        assertNotNull(device("good").lastHealthCheck());
        TestSupport.await("bad device offline", () -> device("bad").status() == DeviceStatus.OFFLINE);
        assertEquals(DeviceHealth.BAD, device("bad").health());
    }

    // ==================== Resubmission ====================

    @Test
    void resubmitQueuesFreshCopyOfFinishedJob() {
        Job job = submitSingle();
        jobs.cancel(job.id());

        Job copy = jobs.resubmit(job.id());

        assertNotEquals(job.id(), copy.id());
        assertEquals(JobStatus.SUBMITTED, copy.status());
        assertEquals(job.description(), copy.description());
        assertEquals(job.requirement(), copy.requirement());
    }

    @Test
    void resubmitRejectsUnfinishedUnknownAndHealthCheckJobs() {
        registry.register("pixel-1", "pixel", List.of());
        Job queued = submitSingle();
        Job check = jobs.submitHealthCheck(device("pixel-1"));
        jobs.cancel(check.id());

        assertThrows(IllegalStateException.class, () -> jobs.resubmit(queued.id()));
        assertThrows(NoSuchElementException.class, () -> jobs.resubmit(987654L));
        assertThrows(IllegalArgumentException.class, () -> jobs.resubmit(check.id()));
    }
}
