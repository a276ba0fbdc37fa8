package testlab.master.dispatch;

import testlab.master.model.Device;
import testlab.master.model.Job;

/**
 * Boundary to whatever runs the deploy/boot/test pipeline on a device.
 * Progress comes back through {@link DispatchCallback}.
 */
public interface DispatchGateway {

    /**
     * Start the pipeline of one device of a job.
     *
     * @param binding the device's place in its MultiNode group, or null for a single-device job
     * @throws RuntimeException if the pipeline could not be started
     */
    DispatchHandle start(Device device, Job job, GroupBinding binding);

    /**
     * Stop accepting work and cancel every running pipeline.
     */
    default void shutdown() {
    }
}
