package testlab.master.repository;

import testlab.master.model.Device;
import testlab.master.model.ReservationResult;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Device persistence.
 * The reservation methods are compare-and-set operations on the device row.
 */
public interface DeviceRepository {

    /**
     * Insert a new device.
     *
     * @param device the device to save
     * @throws IllegalArgumentException if the hostname is already registered
     */
    void save(Device device);

    /**
     * Overwrite every mutable column of an existing device.
     *
     * @return true if the row exists
     */
    boolean update(Device device);

    Optional<Device> findByHostname(String hostname);

    /**
     * All devices, ordered by hostname.
     */
    List<Device> findAll();

    /**
     * Devices of a type, ordered by hostname.
     */
    List<Device> findByType(String deviceType);

    /**
     * Devices that are RESERVED or RUNNING.
     */
    List<Device> findBusy();

    /**
     * Atomically move a device from IDLE to RESERVED for a job.
     * Succeeds only when the row is IDLE, has no current job and its health
     * allows reservation. The update is committed before returning.
     *
     * @param hostname the device
     * @param jobId    the owning job
     * @return RESERVED, CONFLICT if the guard failed, NOT_FOUND if no such device
     */
    ReservationResult reserve(String hostname, long jobId);

    /**
     * Move a RESERVED device owned by the job to RUNNING.
     *
     * @return true if updated
     */
    boolean markRunning(String hostname, long jobId);

    /**
     * Release a device held by the given job. The device returns to IDLE, or to
     * OFFLINE when its health forbids reservation.
     *
     * @return true if the device was held by that job and has been released
     */
    boolean release(String hostname, long jobId);
}
