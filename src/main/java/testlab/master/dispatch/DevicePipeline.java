package testlab.master.dispatch;

/**
 * The work done on one device for one job.
 *
 * Returning normally means COMPLETE. A {@link testlab.master.multinode.SyncFailedException}
 * maps to PEER_FAILED / TIMEOUT / CANCELED, an interrupt to CANCELED and any
 * other exception to an INFRASTRUCTURE failure.
 */
@FunctionalInterface
public interface DevicePipeline {

    void run(PipelineContext context) throws Exception;
}
