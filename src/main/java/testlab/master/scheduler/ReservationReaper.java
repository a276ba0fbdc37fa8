package testlab.master.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that reconciles reservations and dispatches.
 *
 * Work can get stuck if:
 * - a pipeline dies without reporting an outcome
 * - a reservation outlives its job (crash between two commits)
 *
 * Each run delegates to {@link RecoveryService#reconcile()}.
 */
public class ReservationReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReservationReaper.class);

    private final RecoveryService recovery;

    public ReservationReaper(RecoveryService recovery) {
        this.recovery = recovery;
    }

    @Override
    public void run() {
        try {
            RecoveryReport report = recovery.reconcile();
            if (report.isEmpty()) {
                log.debug("Reaper: nothing to reconcile");
            }
        } catch (Exception e) {
            log.error("Reservation reaper error", e);
        }
    }
}
