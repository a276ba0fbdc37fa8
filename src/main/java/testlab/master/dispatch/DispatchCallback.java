package testlab.master.dispatch;

import testlab.master.model.DispatchOutcome;
import testlab.master.model.OutcomeResult;

/**
 * Calls from the dispatch side back into the master. Both calls are idempotent.
 */
public interface DispatchCallback {

    OutcomeResult reportStarted(long jobId, String hostname);

    OutcomeResult reportOutcome(long jobId, String hostname, DispatchOutcome outcome);
}
