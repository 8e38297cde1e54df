package prism.coordinator.model;

/**
 * Result of reporting a terminal status for a job device.
 */
public enum JobDeviceUpdateResult {
    /** Status was written */
    UPDATED,

    /** Row already terminal - the report is ignored */
    ALREADY_TERMINAL,

    /** No such job device */
    NOT_FOUND
}
