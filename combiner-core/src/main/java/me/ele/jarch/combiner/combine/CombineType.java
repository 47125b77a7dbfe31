package me.ele.jarch.combiner.combine;

/**
 * How row counts of CommandComplete from several nodes reduce into one.
 */
public enum CombineType {
    /**
     * no numeric merge, the last CommandComplete is forwarded verbatim
     */
    NONE,
    /**
     * every node must report the same count, e.g. writes to a replicated table
     */
    SAME,
    /**
     * counts add up, e.g. writes to a partitioned table
     */
    SUM
}
