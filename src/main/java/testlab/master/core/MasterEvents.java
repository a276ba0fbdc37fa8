package testlab.master.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process change notifications. The scheduler daemon listens here to run
 * event-driven passes when the queue or the device pool changes.
 */
public final class MasterEvents {

    private static final Logger log = LoggerFactory.getLogger(MasterEvents.class);

    private final CopyOnWriteArrayList<Runnable> queueListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Runnable> deviceListeners = new CopyOnWriteArrayList<>();

    public void onQueueChanged(Runnable r) {
        queueListeners.add(r);
    }

    public void onDevicesChanged(Runnable r) {
        deviceListeners.add(r);
    }

    public void fireQueueChanged() {
        fire("queue", queueListeners);
    }

    public void fireDevicesChanged() {
        fire("devices", deviceListeners);
    }

    private static void fire(String topic, Iterable<Runnable> listeners) {
        for (Runnable r : listeners) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("{} listener failed", topic, e);
            }
        }
    }
}
