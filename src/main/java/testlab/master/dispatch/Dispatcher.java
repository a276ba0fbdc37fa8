package testlab.master.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.GroupMember;
import testlab.master.model.Job;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands reserved devices to the {@link DispatchGateway} and keeps the live
 * handle of every started pipeline, keyed by job and hostname.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final DispatchGateway gateway;
    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, DispatchHandle>> live = new ConcurrentHashMap<>();

    public Dispatcher(DispatchGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Start a pipeline on every given device of the job.
     *
     * @param group the job's MultiNode group, or null for a single-device job
     * @return hostname to failure reason for devices whose pipeline could not be started
     */
    public Map<String, String> dispatch(Job job, List<Device> devices, DeviceGroup group) {
        Map<String, String> failures = new TreeMap<>();
        for (Device device : devices) {
            GroupBinding binding = null;
            if (group != null) {
                GroupMember member = group.member(device.hostname())
                        .orElseThrow(() -> new IllegalArgumentException(
                                device.hostname() + " is not in group " + group.groupId()));
                binding = GroupBinding.of(group, member);
            }
            try {
                DispatchHandle handle = gateway.start(device, job, binding);
                live.computeIfAbsent(job.id(), id -> new ConcurrentHashMap<>()).put(device.hostname(), handle);
            } catch (RuntimeException e) {
                log.error("Failed to start pipeline for job {} on {}", job.id(), device.hostname(), e);
                failures.put(device.hostname(), "dispatch failed: " + e.getMessage());
            }
        }
        return failures;
    }

    public boolean hasLiveDispatch(long jobId, String hostname) {
        Map<String, DispatchHandle> handles = live.get(jobId);
        if (handles == null) {
            return false;
        }
        DispatchHandle handle = handles.get(hostname);
        return handle != null && handle.isAlive();
    }

    public boolean hasLiveDispatch(long jobId) {
        Map<String, DispatchHandle> handles = live.get(jobId);
        return handles != null && handles.values().stream().anyMatch(DispatchHandle::isAlive);
    }

    /**
     * Cancel one device's pipeline and forget it.
     */
    public void cancel(long jobId, String hostname) {
        Map<String, DispatchHandle> handles = live.get(jobId);
        if (handles == null) {
            return;
        }
        DispatchHandle handle = handles.remove(hostname);
        if (handle != null && handle.isAlive()) {
            log.info("Canceling pipeline of job {} on {}", jobId, hostname);
            handle.cancel();
        }
        if (handles.isEmpty()) {
            live.remove(jobId, handles);
        }
    }

    /**
     * Cancel every pipeline of the job.
     */
    public void cancel(long jobId) {
        Map<String, DispatchHandle> handles = live.remove(jobId);
        if (handles == null) {
            return;
        }
        handles.forEach((hostname, handle) -> {
            if (handle.isAlive()) {
                log.info("Canceling pipeline of job {} on {}", jobId, hostname);
                handle.cancel();
            }
        });
    }

    /**
     * Drop the handle of a pipeline that reported its outcome.
     */
    public void forget(long jobId, String hostname) {
        Map<String, DispatchHandle> handles = live.get(jobId);
        if (handles != null) {
            handles.remove(hostname);
            if (handles.isEmpty()) {
                live.remove(jobId, handles);
            }
        }
    }

    /**
     * Drop handles of pipelines that have ended. A pipeline can report its
     * outcome before its handle is registered, leaving a dead entry behind.
     */
    public void purgeFinished() {
        live.forEach((jobId, handles) -> {
            handles.values().removeIf(h -> !h.isAlive());
            if (handles.isEmpty()) {
                live.remove(jobId, handles);
            }
        });
    }

    public int liveCount() {
        return live.values().stream()
                .mapToInt(h -> (int) h.values().stream().filter(DispatchHandle::isAlive).count())
                .sum();
    }

    /**
     * Stop the gateway without reporting outcomes; running jobs are left for
     * restart recovery.
     */
    public void shutdown() {
        gateway.shutdown();
        live.clear();
    }
}
