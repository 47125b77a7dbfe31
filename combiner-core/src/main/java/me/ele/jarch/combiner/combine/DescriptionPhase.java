package me.ele.jarch.combiner.combine;

/**
 * Counter of the description phase of a QUERY cycle.
 * <p>
 * RowDescription and ParameterStatus share this one counter. A RowDescription is proxied
 * only when it is the first message counted here; a ParameterStatus is proxied only when it
 * is the message that brings the counter to the node count. Mixing both kinds in one cycle
 * therefore shifts which message of either kind is sent.
 */
public class DescriptionPhase {
    private int count = 0;

    /**
     * Count a RowDescription.
     *
     * @return true if it is the first message of the phase and must be proxied
     */
    public boolean onRowDescription() {
        return count++ == 0;
    }

    /**
     * Count a ParameterStatus.
     *
     * @return true if the counter just reached {@code nodeCount} and the message must be proxied
     */
    public boolean onParameterStatus(int nodeCount) {
        return ++count == nodeCount;
    }

    public int getCount() {
        return count;
    }

    public void reset() {
        count = 0;
    }
}
