package me.ele.jarch.combiner.exception;

import me.ele.jarch.combiner.pg.proto.ErrorResponse;
import me.ele.jarch.combiner.pg.util.Severity;

/**
 * Raised synchronously from merge or validate when the responses of the data nodes cannot be
 * combined. The statement must be aborted and reported with {@link #toErrorResponse()}.
 */
public class CombinerException extends RuntimeException {

    private static final long serialVersionUID = 4301982562519873511L;

    public final ErrorCode errorCode;
    public final String sqlState;
    public final String errorMessage;

    private CombinerException(Builder builder, Throwable t) {
        super(builder.errorMessage, t);
        this.errorCode = builder.errorCode;
        this.sqlState = builder.sqlState;
        this.errorMessage = builder.errorMessage;
    }

    private CombinerException(Builder builder) {
        super(builder.errorMessage);
        this.errorCode = builder.errorCode;
        this.sqlState = builder.sqlState;
        this.errorMessage = builder.errorMessage;
    }

    public static class Builder {
        // Required parameters
        private final ErrorCode errorCode;

        // Optional parameters - initialized to default values
        private String sqlState;
        private String errorMessage = "Unexpected response from the data nodes";

        public Builder(ErrorCode errorCode) {
            this.errorCode = errorCode;
            this.sqlState = errorCode.getSqlState();
        }

        public Builder setSqlState(String sqlState) {
            this.sqlState = sqlState;
            return this;
        }

        public Builder setErrorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public CombinerException build(Throwable t) {
            return new CombinerException(this, t);
        }

        public CombinerException build() {
            return new CombinerException(this);
        }
    }

    /**
     * @return the single ErrorResponse the client should see for the aborted statement
     */
    public ErrorResponse toErrorResponse() {
        return ErrorResponse.buildErrorResponse(Severity.ERROR, sqlState, errorMessage);
    }

    @Override public String toString() {
        return "ErrorCode:" + errorCode + ",SqlState:" + sqlState + ",ErrorMessage:"
            + errorMessage;
    }
}
