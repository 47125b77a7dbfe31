package me.ele.jarch.combiner.exception;

import me.ele.jarch.combiner.pg.util.SqlState;

/**
 * Fatal conditions a combiner can detect. None of them is retried by the combiner.
 */
public enum ErrorCode {
    /**
     * a node's reply contradicts the established request type, or the kind is impossible here
     */
    PROTOCOL_INCONSISTENCY(SqlState.DATA_CORRUPTED),
    /**
     * write to a replicated table returned different row counts from the data nodes
     */
    REPLICA_INCONSISTENCY(SqlState.DATA_CORRUPTED),
    /**
     * the plan attached an aggregate the combiner cannot reduce
     */
    UNSUPPORTED_REDUCTION(SqlState.FEATURE_NOT_SUPPORTED),
    /**
     * copy data cannot be converted from the server encoding to the client encoding
     */
    UNTRANSLATABLE_CHARACTER(SqlState.UNTRANSLATABLE_CHARACTER);

    private final String sqlState;

    ErrorCode(String sqlState) {
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
