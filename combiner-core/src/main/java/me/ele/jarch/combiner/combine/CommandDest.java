package me.ele.jarch.combiner.combine;

/**
 * Where synthesized and proxied messages go.
 */
public enum CommandDest {
    /**
     * the client's reply stream, simple query protocol
     */
    REMOTE,
    /**
     * the client's reply stream, extended query protocol
     */
    REMOTE_EXECUTE,
    /**
     * nothing is emitted; the coordinator sends the equivalent reply itself
     */
    NONE;

    public boolean isRemote() {
        return this == REMOTE || this == REMOTE_EXECUTE;
    }
}
