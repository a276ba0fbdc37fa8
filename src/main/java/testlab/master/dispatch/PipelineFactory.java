package testlab.master.dispatch;

import testlab.master.model.Device;
import testlab.master.model.Job;

/**
 * Chooses the pipeline for a device of a job.
 */
@FunctionalInterface
public interface PipelineFactory {

    DevicePipeline create(Job job, Device device);
}
