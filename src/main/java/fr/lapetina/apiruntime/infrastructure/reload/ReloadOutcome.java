package fr.lapetina.apiruntime.infrastructure.reload;

/**
 * Result of one configuration reload cycle.
 */
public enum ReloadOutcome {
    /** Another update was already in progress; nothing was done. */
    BUSY,
    /** The configuration source failed. */
    LOAD_FAILED,
    /** The loaded configuration was rejected by validation. */
    INVALID,
    /** The loaded configuration equals the current one. */
    UNCHANGED,
    /** A changed configuration was published and components reloaded. */
    APPLIED
}
