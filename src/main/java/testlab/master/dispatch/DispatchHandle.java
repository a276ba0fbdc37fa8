package testlab.master.dispatch;

/**
 * A started device pipeline.
 */
public interface DispatchHandle {

    boolean isAlive();

    /**
     * Ask the pipeline to stop. It reports a CANCELED outcome unless it already finished.
     */
    void cancel();
}
