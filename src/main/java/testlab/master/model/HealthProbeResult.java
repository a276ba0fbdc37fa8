package testlab.master.model;

/**
 * Result of an external health probe for a device.
 */
public enum HealthProbeResult {
    PASS,
    FAIL
}
