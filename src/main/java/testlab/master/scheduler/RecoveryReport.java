package testlab.master.scheduler;

/**
 * What a reconciliation run changed.
 *
 * @param resumed  devices whose pipeline was dispatched again
 * @param failed   job members ended INCOMPLETE because nothing was running them
 * @param released orphan reservations returned to the pool
 */
public record RecoveryReport(int resumed, int failed, int released) {

    public boolean isEmpty() {
        return resumed == 0 && failed == 0 && released == 0;
    }
}
