package miniredis.config;

/**
 * What the server sends back for a request that fails to decode or interpret.
 */
public enum ErrorReplyPolicy {
    /** Log the failure and send nothing. */
    DROP,
    /** Answer with the unknown-command error reply. */
    REPLY
}
