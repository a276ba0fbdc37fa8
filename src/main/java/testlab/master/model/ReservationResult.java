package testlab.master.model;

/**
 * Result of a compare-and-set device reservation.
 */
public enum ReservationResult {
    /** Device moved IDLE -> RESERVED for the job */
    RESERVED,

    /** Device was not idle or not healthy any more - lost the race */
    CONFLICT,

    /** No such device */
    NOT_FOUND
}
