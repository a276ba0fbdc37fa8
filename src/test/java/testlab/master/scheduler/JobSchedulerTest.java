package testlab.master.scheduler;

import testlab.master.TestSupport;
import testlab.master.TestSupport.ScriptedPipelines;
import testlab.master.config.Dependencies;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.DeviceStatus;
import testlab.master.model.GroupMember;
import testlab.master.model.HealthProbeResult;
import testlab.master.model.Job;
import testlab.master.model.JobPriority;
import testlab.master.model.JobStatus;
import testlab.master.model.ReservationResult;
import testlab.master.repository.DeviceGroupRepository;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobService;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private ScriptedPipelines pipelines;
    private Dependencies deps;
    private DeviceRegistry registry;
    private JobService jobs;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        pipelines = new ScriptedPipelines();
        deps = Dependencies.create(TestSupport.config("sched"), pipelines);
        registry = deps.deviceRegistry();
        jobs = deps.jobService();
        scheduler = deps.jobScheduler();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private Job single(JobPriority priority) {
        return jobs.submit(Job.builder()
                .description("single")
                .submitter("tests")
                .priority(priority)
                .requirement(DeviceRequirement.of("pixel"))
                .build());
    }

    private Job multinode(Map<String, DeviceRequirement> roles) {
        return jobs.submit(Job.builder()
                .description("multinode")
                .submitter("tests")
                .priority(JobPriority.HIGH)
                .roles(roles)
                .build());
    }

    private JobStatus status(Job job) {
        return jobs.find(job.id()).orElseThrow().status();
    }

    private Device device(String hostname) {
        return registry.find(hostname).orElseThrow();
    }

    @Test
    void singleJobRunsOnEligibleDeviceAndReleasesIt() {
        registry.register("pixel-1", "pixel", List.of());
        Job job = single(JobPriority.MEDIUM);

        PassSummary summary = scheduler.runPass();

        assertEquals(1, summary.scheduled());
        assertEquals(1, summary.devicesReserved());
        TestSupport.await("job running", () -> status(job) == JobStatus.RUNNING);
        assertEquals(DeviceStatus.RUNNING, device("pixel-1").status());
        assertEquals(job.id(), device("pixel-1").currentJobId());

        pipelines.releaseAll();
        TestSupport.await("job complete", () -> status(job) == JobStatus.COMPLETE);
        TestSupport.await("device idle", () -> device("pixel-1").status() == DeviceStatus.IDLE);
        assertNull(device("pixel-1").currentJobId());
    }

    @Test
    void higherPriorityWinsTheOnlyDevice() {
        registry.register("pixel-1", "pixel", List.of());
        Job low = single(JobPriority.LOW);
        Job high = single(JobPriority.HIGH);

        PassSummary summary = scheduler.runPass();

        assertEquals(2, summary.examined());
        assertEquals(1, summary.scheduled());
        assertEquals(high.id(), device("pixel-1").currentJobId());
        assertEquals(JobStatus.SUBMITTED, status(low));
    }

    @Test
    void unmatchedJobStaysQueuedForNextPass() {
        Job job = single(JobPriority.MEDIUM);

        assertEquals(0, scheduler.runPass().scheduled());
        assertEquals(JobStatus.SUBMITTED, status(job));

        registry.register("pixel-1", "pixel", List.of());
        assertEquals(1, scheduler.runPass().scheduled());
        assertEquals(job.id(), device("pixel-1").currentJobId());
    }

    @Test
    void tagsAndHealthRestrictEligibility() {
        registry.register("plain", "pixel", List.of());
        registry.register("nfc-bad", "pixel", List.of("nfc"));
        registry.register("nfc-good", "pixel", List.of("nfc", "5g"));
        registry.reportHealth("nfc-bad", HealthProbeResult.FAIL);

        Job job = jobs.submit(Job.builder()
                .requirement(DeviceRequirement.of("pixel", "nfc"))
                .build());
        scheduler.runPass();

        assertEquals(job.id(), device("nfc-good").currentJobId());
        assertNull(device("plain").currentJobId());
        assertNull(device("nfc-bad").currentJobId());
    }

    @Test
    void multinodeReservesEveryRoleAtOnce() {
        registry.register("a", "pixel", List.of());
        registry.register("b", "pixel", List.of());
        registry.register("c", "pixel", List.of("wifi-ap"));
        Job job = multinode(Map.of(
                "server", DeviceRequirement.of("pixel", "wifi-ap"),
                "client", DeviceRequirement.of("pixel", 2, List.of())));

        PassSummary summary = scheduler.runPass();

        assertEquals(1, summary.scheduled());
        assertEquals(3, summary.devicesReserved());
        Job scheduled = jobs.find(job.id()).orElseThrow();
        assertNotNull(scheduled.groupId());
        assertTrue(deps.coordinator().isDeclared(scheduled.groupId()));

        DeviceGroup group = jobs.findGroup(job.id()).orElseThrow();
        assertEquals(scheduled.groupId(), group.groupId());
        assertEquals("server", group.member("c").orElseThrow().role());
        assertEquals(Map.of("client", 2, "server", 1), group.roleCounts());
        assertEquals(Set.of(job.id() + ".0", job.id() + ".1", job.id() + ".2"),
                group.members().stream().map(GroupMember::subId).collect(Collectors.toSet()));
        for (String host : List.of("a", "b", "c")) {
            assertEquals(job.id(), device(host).currentJobId());
        }
    }

    @Test
    void infeasibleMultinodeReservesNothing() {
        registry.register("a", "pixel", List.of());
        registry.register("b", "pixel", List.of());
        Job job = multinode(Map.of(
                "server", DeviceRequirement.of("pixel"),
                "client", DeviceRequirement.of("pixel", 2, List.of())));

        PassSummary summary = scheduler.runPass();

        assertEquals(0, summary.scheduled());
        assertEquals(JobStatus.SUBMITTED, status(job));
        assertTrue(registry.findBusy().isEmpty());
        assertTrue(jobs.findGroup(job.id()).isEmpty());
    }

    @Test
    void multinodeWaitsUntilEveryRoleCanBeFilled() {
        registry.register("pixel-1", "pixel", List.of());
        registry.register("router-1", "router", List.of());
        Job job = multinode(Map.of(
                "client", DeviceRequirement.of("pixel", 2, List.of()),
                "server", DeviceRequirement.of("router")));

        assertEquals(0, scheduler.runPass().scheduled());
        assertEquals(JobStatus.SUBMITTED, status(job));
        assertTrue(registry.findBusy().isEmpty());

        registry.register("pixel-2", "pixel", List.of());
        PassSummary summary = scheduler.runPass();

        assertEquals(1, summary.scheduled());
        assertEquals(3, summary.devicesReserved());
        Job scheduled = jobs.find(job.id()).orElseThrow();
        assertTrue(scheduled.status() == JobStatus.SCHEDULED || scheduled.status() == JobStatus.RUNNING);
        DeviceGroup group = jobs.findGroup(job.id()).orElseThrow();
        assertEquals(3, group.members().size());
        assertEquals(scheduled.groupId(), group.groupId());
        assertTrue(group.members().stream().allMatch(m -> m.groupId().equals(group.groupId())));
        assertTrue(deps.coordinator().isDeclared(group.groupId()));
        for (String host : List.of("pixel-1", "pixel-2", "router-1")) {
            assertTrue(device(host).status().isBusy(), host);
            assertEquals(job.id(), device(host).currentJobId());
        }
    }

    @Test
    void lostReservationRollsBackTheWholeGroup() {
        registry.register("a", "pixel", List.of());
        registry.register("b", "pixel", List.of());
        registry.register("c", "pixel", List.of("wifi-ap"));
        long otherJob = 999L;

        // "c" is taken by another job between planning and reservation
        DeviceRegistry racing = new DeviceRegistry(deps.deviceRepository(), deps.events()) {
            @Override
            public ReservationResult reserve(String hostname, long jobId) {
                if (hostname.equals("c") && jobId != otherJob) {
                    super.reserve(hostname, otherJob);
                }
                return super.reserve(hostname, jobId);
            }
        };
        JobScheduler racingScheduler = new JobScheduler(deps.jobQueue(), racing, deps.groupRepository(),
                deps.coordinator(), deps.dispatcher(), jobs);
        Job job = multinode(Map.of(
                "server", DeviceRequirement.of("pixel", "wifi-ap"),
                "client", DeviceRequirement.of("pixel", 2, List.of())));

        PassSummary summary = racingScheduler.runPass();

        assertEquals(0, summary.scheduled());
        assertEquals(0, summary.devicesReserved());
        assertEquals(1, summary.conflicts());
        assertEquals(JobStatus.SUBMITTED, status(job));
        for (String host : List.of("a", "b")) {
            assertEquals(DeviceStatus.IDLE, device(host).status());
            assertNull(device(host).currentJobId());
        }
        assertEquals(otherJob, device("c").currentJobId());
        assertTrue(jobs.findGroup(job.id()).isEmpty());
        assertNull(jobs.find(job.id()).orElseThrow().groupId());
    }

    @Test
    void cancelBeforeGroupIsSavedLeavesNoOpenMembers() {
        registry.register("a", "pixel", List.of());
        registry.register("b", "pixel", List.of());
        DeviceGroupRepository groups = deps.groupRepository();

        // the cancel lands after the job is SCHEDULED but before its group exists
        DeviceGroupRepository cancelingOnSave = new DeviceGroupRepository() {
            @Override
            public void save(DeviceGroup group) {
                jobs.cancel(group.jobId());
                groups.save(group);
            }

            @Override
            public Optional<DeviceGroup> findById(String groupId) {
                return groups.findById(groupId);
            }

            @Override
            public Optional<DeviceGroup> findByJobId(long jobId) {
                return groups.findByJobId(jobId);
            }

            @Override
            public boolean updateMember(JobStatus expected, GroupMember updated) {
                return groups.updateMember(expected, updated);
            }

            @Override
            public List<DeviceGroup> findActive() {
                return groups.findActive();
            }
        };
        JobScheduler racingScheduler = new JobScheduler(deps.jobQueue(), registry, cancelingOnSave,
                deps.coordinator(), deps.dispatcher(), jobs);
        Job job = multinode(Map.of(
                "server", DeviceRequirement.of("pixel"),
                "client", DeviceRequirement.of("pixel")));

        racingScheduler.runPass();

        Job canceled = jobs.find(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELED, canceled.status());
        DeviceGroup group = groups.findByJobId(job.id()).orElseThrow();
        assertEquals(2, group.members().size());
        assertTrue(group.members().stream().allMatch(m -> m.status() == JobStatus.CANCELED));
        assertFalse(deps.coordinator().isDeclared(group.groupId()));
        assertTrue(groups.findActive().isEmpty());
        TestSupport.await("devices released", () -> registry.findBusy().isEmpty());
    }

    @Test
    void blockedMultinodeDoesNotHoldBackSmallerJobs() {
        registry.register("a", "pixel", List.of());
        Job group = multinode(Map.of(
                "server", DeviceRequirement.of("pixel"),
                "client", DeviceRequirement.of("pixel")));
        Job small = single(JobPriority.LOW);

        scheduler.runPass();

        assertEquals(JobStatus.SUBMITTED, status(group));
        assertEquals(small.id(), device("a").currentJobId());
    }

    @Test
    void healthCheckIsPinnedToItsDevice() {
        registry.register("a", "pixel", List.of());
        registry.register("b", "pixel", List.of());
        Job check = jobs.submitHealthCheck(device("b"));

        scheduler.runPass();

        assertEquals(check.id(), device("b").currentJobId());
        assertNull(device("a").currentJobId());
    }

    @Test
    void concurrentPassesNeverShareADevice() throws Exception {
        for (int i = 0; i < 4; i++) {
            registry.register("dev-" + i, "pixel", List.of());
        }
        List<Job> submitted = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            submitted.add(single(JobPriority.MEDIUM));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<PassSummary>> passes = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                passes.add(pool.submit(() -> {
                    go.await();
                    return scheduler.runPass();
                }));
            }
            go.countDown();
            int scheduled = 0;
            for (Future<PassSummary> pass : passes) {
                scheduled += pass.get().scheduled();
            }
            assertEquals(4, scheduled);
        } finally {
            pool.shutdownNow();
        }

        Set<Long> holders = registry.findAll().stream()
                .map(Device::currentJobId)
                .collect(Collectors.toSet());
        assertEquals(4, holders.size());
        assertFalse(holders.contains(null));
        long queued = submitted.stream().filter(j -> status(j) == JobStatus.SUBMITTED).count();
        assertEquals(4, queued);
    }
}
