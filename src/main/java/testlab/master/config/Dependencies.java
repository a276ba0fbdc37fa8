package testlab.master.config;

import testlab.master.api.internal.v1.DispatchController;
import testlab.master.api.internal.v1.MultiNodeController;
import testlab.master.api.v1.DeviceController;
import testlab.master.api.v1.HealthController;
import testlab.master.api.v1.JobController;
import testlab.master.api.v1.QueueController;
import testlab.master.core.MasterEvents;
import testlab.master.dispatch.Dispatcher;
import testlab.master.dispatch.LocalDispatchGateway;
import testlab.master.dispatch.PipelineFactory;
import testlab.master.dispatch.SimulatedPipeline;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.repository.DeviceGroupRepository;
import testlab.master.repository.DeviceRepository;
import testlab.master.repository.JobRepository;
import testlab.master.repository.MessageRepository;
import testlab.master.scheduler.HealthCheckScheduler;
import testlab.master.scheduler.JobScheduler;
import testlab.master.scheduler.RecoveryReport;
import testlab.master.scheduler.RecoveryService;
import testlab.master.scheduler.ReservationReaper;
import testlab.master.scheduler.SchedulerDaemon;
import testlab.master.server.RouterHandler;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobQueue;
import testlab.master.service.JobService;
import testlab.master.store.Database;
import testlab.master.store.JdbcDeviceGroupRepository;
import testlab.master.store.JdbcDeviceRepository;
import testlab.master.store.JdbcJobRepository;
import testlab.master.store.JdbcMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(MasterConfig.fromEnv());
 * deps.start(); // recover persisted state, then start background passes
 * JobService jobs = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final MasterConfig config;
    private final Database database;
    private final DeviceRepository deviceRepository;
    private final JobRepository jobRepository;
    private final DeviceGroupRepository groupRepository;
    private final MessageRepository messageRepository;

    private final MasterEvents events;
    private final DeviceRegistry deviceRegistry;
    private final JobQueue jobQueue;
    private final MultiNodeCoordinator coordinator;
    private final LocalDispatchGateway gateway;
    private final Dispatcher dispatcher;
    private final JobService jobService;

    private final JobScheduler jobScheduler;
    private final HealthCheckScheduler healthCheckScheduler;
    private final RecoveryService recoveryService;
    private final SchedulerDaemon schedulerDaemon;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(MasterConfig config, PipelineFactory pipelines) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.deviceRepository = new JdbcDeviceRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.groupRepository = new JdbcDeviceGroupRepository(database);
        this.messageRepository = new JdbcMessageRepository(database);

        // Services
        this.events = new MasterEvents();
        this.deviceRegistry = new DeviceRegistry(deviceRepository, events);
        this.jobQueue = new JobQueue(jobRepository, events);
        this.coordinator = new MultiNodeCoordinator(messageRepository);
        this.gateway = new LocalDispatchGateway(pipelines, coordinator, config.defaultSyncTimeout());
        this.dispatcher = new Dispatcher(gateway);
        this.jobService = new JobService(jobQueue, deviceRegistry, groupRepository, coordinator, dispatcher);
        this.gateway.setCallback(jobService);

        // Background work
        this.jobScheduler = new JobScheduler(jobQueue, deviceRegistry, groupRepository, coordinator, dispatcher,
                jobService);
        this.healthCheckScheduler = new HealthCheckScheduler(deviceRegistry, jobQueue, jobService,
                config.healthCheckStaleAfter());
        this.recoveryService = new RecoveryService(jobQueue, deviceRegistry, groupRepository, coordinator,
                dispatcher, jobService);
        this.schedulerDaemon = new SchedulerDaemon(jobScheduler, new ReservationReaper(recoveryService),
                healthCheckScheduler, events, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies that run devices through the simulated pipeline.
     */
    public static Dependencies create(MasterConfig config) {
        return new Dependencies(config, SimulatedPipeline.factory(config.simulatedRunTime()));
    }

    public static Dependencies create(MasterConfig config, PipelineFactory pipelines) {
        return new Dependencies(config, pipelines);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(MasterConfig.fromEnv());
    }

    /**
     * Reconcile persisted state with what is actually running, then start the
     * background scheduler.
     */
    public RecoveryReport start() {
        RecoveryReport report = recoveryService.reconcile();
        if (!report.isEmpty()) {
            log.info("Startup recovery: {}", report);
        }
        schedulerDaemon.start();
        return report;
    }

    // Getters
    public MasterConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public DeviceRepository deviceRepository() {
        return deviceRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public DeviceGroupRepository groupRepository() {
        return groupRepository;
    }

    public MessageRepository messageRepository() {
        return messageRepository;
    }

    public MasterEvents events() {
        return events;
    }

    public DeviceRegistry deviceRegistry() {
        return deviceRegistry;
    }

    public JobQueue jobQueue() {
        return jobQueue;
    }

    public MultiNodeCoordinator coordinator() {
        return coordinator;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public JobService jobService() {
        return jobService;
    }

    public JobScheduler jobScheduler() {
        return jobScheduler;
    }

    public HealthCheckScheduler healthCheckScheduler() {
        return healthCheckScheduler;
    }

    public RecoveryService recoveryService() {
        return recoveryService;
    }

    public SchedulerDaemon schedulerDaemon() {
        return schedulerDaemon;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, deviceRegistry, jobQueue, dispatcher,
                            schedulerDaemon))
                    .registerController(new JobController(jobService, jobQueue))
                    .registerController(new QueueController(jobQueue))
                    .registerController(new DeviceController(deviceRegistry))
                    .registerController(new MultiNodeController(coordinator, config))
                    .registerController(new DispatchController(jobService));
            log.info("RouterHandler created with {} controllers", 6);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            schedulerDaemon.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        synchronized (this) {
            if (routerHandler != null) {
                routerHandler.shutdown();
            }
        }

        try {
            dispatcher.shutdown();
        } catch (RuntimeException e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
