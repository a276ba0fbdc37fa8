package testlab.master.dispatch;

import testlab.master.model.Device;
import testlab.master.model.Job;
import testlab.master.multinode.MultiNodeClient;

/**
 * Everything a running pipeline may use.
 */
public final class PipelineContext {

    private final Job job;
    private final Device device;
    private final GroupBinding binding;
    private final MultiNodeClient multinode;

    public PipelineContext(Job job, Device device, GroupBinding binding, MultiNodeClient multinode) {
        this.job = job;
        this.device = device;
        this.binding = binding;
        this.multinode = multinode;
    }

    public Job job() {
        return job;
    }

    public Device device() {
        return device;
    }

    public boolean isMultinode() {
        return binding != null;
    }

    /** Null for single-device jobs. */
    public GroupBinding binding() {
        return binding;
    }

    /**
     * @throws IllegalStateException for a single-device job
     */
    public MultiNodeClient multinode() {
        if (multinode == null) {
            throw new IllegalStateException("job " + job.id() + " is not a MultiNode job");
        }
        return multinode;
    }
}
