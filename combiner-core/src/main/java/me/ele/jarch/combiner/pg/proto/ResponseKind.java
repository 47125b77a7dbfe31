package me.ele.jarch.combiner.pg.proto;

import me.ele.jarch.combiner.combine.ResponseHandler;

/**
 * Closed set of backend message kinds a combiner can receive. Each constant routes to its own
 * {@link ResponseHandler} callback, so a new kind does not compile until it is handled.
 */
public enum ResponseKind {
    COPY_OUT_COMPLETE(PGFlags.B_COPY_DONE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onCopyOutComplete(payload);
        }
    },
    COMMAND_COMPLETE(PGFlags.COMMAND_COMPLETE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onCommandComplete(payload);
        }
    },
    ROW_DESCRIPTION(PGFlags.ROW_DESCRIPTION) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onRowDescription(payload);
        }
    },
    PARAMETER_STATUS(PGFlags.PARAMETER_STATUS) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onParameterStatus(payload);
        }
    },
    COPY_IN_RESPONSE(PGFlags.COPY_IN_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onCopyInResponse(payload);
        }
    },
    COPY_OUT_RESPONSE(PGFlags.COPY_OUT_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onCopyOutResponse(payload);
        }
    },
    COPY_OUT_DATA_ROW(PGFlags.B_COPY_DATA) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onCopyOutDataRow(payload);
        }
    },
    DATA_ROW(PGFlags.DATA_ROW) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onDataRow(payload);
        }
    },
    ERROR_RESPONSE(PGFlags.ERROR_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onErrorResponse(payload);
        }
    },
    NOTIFICATION_RESPONSE(PGFlags.NOTIFICATION_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onNotification(this, payload);
        }
    },
    NOTICE_RESPONSE(PGFlags.NOTICE_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onNotification(this, payload);
        }
    },
    EMPTY_QUERY(PGFlags.EMPTY_QUERY_RESPONSE) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onUnexpected(this, payload);
        }
    },
    /**
     * any tag outside this table
     */
    UNEXPECTED((byte) 0) {
        @Override public void dispatch(ResponseHandler handler, byte[] payload) {
            handler.onUnexpected(this, payload);
        }
    };

    private static final ResponseKind[] BY_TAG = new ResponseKind[256];

    static {
        for (ResponseKind kind : values()) {
            if (kind != UNEXPECTED) {
                BY_TAG[kind.tag & 0xff] = kind;
            }
        }
    }

    private final byte tag;

    ResponseKind(byte tag) {
        this.tag = tag;
    }

    /**
     * @return the wire tag, 0 for {@link #UNEXPECTED}
     */
    public byte getTag() {
        return tag;
    }

    public abstract void dispatch(ResponseHandler handler, byte[] payload);

    public static ResponseKind valueOf(byte tag) {
        ResponseKind kind = BY_TAG[tag & 0xff];
        return kind == null ? UNEXPECTED : kind;
    }
}
