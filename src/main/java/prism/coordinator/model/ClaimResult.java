package prism.coordinator.model;

/**
 * Result of trying to claim a pending job device.
 */
public enum ClaimResult {
    /** This caller moved the row from pending to running */
    CLAIMED,

    /** The row was no longer pending; another worker got there first */
    LOST,

    /** No such job device */
    NOT_FOUND
}
