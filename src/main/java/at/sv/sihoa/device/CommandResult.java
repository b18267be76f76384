package at.sv.sihoa.device;

public enum CommandResult {
    /**
     * A set command and a read-back request were queued.
     */
    ISSUED,
    /**
     * Ignored, as a previous command is still waiting for its confirmation.
     */
    SKIPPED_PENDING
}
