package me.ele.jarch.combiner.pg.proto;

import me.ele.jarch.combiner.constant.Constants;
import me.ele.jarch.combiner.pg.util.Severity;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * Error report, a sequence of (field token, C string) pairs ended by a zero byte.
 * Data node errors are forwarded untouched; combiner errors are built with
 * {@link #buildErrorResponse(Severity, String, String)}.
 */
public class ErrorResponse extends PGMessage {
    private final Map<Byte, String> fieldWithValue;

    @Override protected List<byte[]> getPayload() {
        List<byte[]> payload = new LinkedList<>();
        fieldWithValue.forEach((type, value) -> {
            payload.add(new byte[] {type});
            payload.add(PGProto.buildNullStr(value));
        });
        payload.add(new byte[] {0x00});
        return payload;
    }

    @Override protected byte getTypeByte() {
        return PGFlags.ERROR_RESPONSE;
    }

    /**
     * Only severity, code and message: the combiner has no source location worth reporting.
     */
    public ErrorResponse(Severity severity, String sqlState, String message) {
        fieldWithValue = new LinkedHashMap<>();
        fieldWithValue.put(PGFlags.SEVERITY, severity.name());
        fieldWithValue.put(PGFlags.CODE, sqlState);
        fieldWithValue.put(PGFlags.MESSAGE, message);
    }

    public ErrorResponse(String sqlState, String message) {
        this(Severity.ERROR, sqlState, message);
    }

    private ErrorResponse(Map<Byte, String> fieldWithValue) {
        this.fieldWithValue = fieldWithValue;
    }

    public void addField(byte field, String value) {
        fieldWithValue.put(field, value);
    }

    public Map<Byte, String> getFieldWithValue() {
        return fieldWithValue;
    }

    public String getSeverity() {
        return fieldWithValue.getOrDefault(PGFlags.SEVERITY, "");
    }

    public String getSqlState() {
        return fieldWithValue.getOrDefault(PGFlags.CODE, "");
    }

    public String getMessage() {
        return fieldWithValue.getOrDefault(PGFlags.MESSAGE, "");
    }

    /**
     * @return true unless the severity is a notice level; an unknown severity counts as an error
     */
    public boolean abortsStatement() {
        Severity severity = Severity.fromName(getSeverity());
        return severity == null || severity.abortsStatement();
    }

    public static ErrorResponse loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        Map<Byte, String> fieldWithValue = new LinkedHashMap<>();
        while (proto.hasRemaining()) {
            byte field = proto.readByte();
            if (field == 0x00) {
                break;
            }
            fieldWithValue.put(field, proto.readNullStr());
        }
        return new ErrorResponse(fieldWithValue);
    }

    /**
     * build combiner ErrorResponse
     * message with prefix: [PGXC]
     */
    public static ErrorResponse buildErrorResponse(Severity severity, String sqlState,
        String message) {
        return new ErrorResponse(severity, sqlState, Constants.COMBINER_PREFIX + message);
    }

    @Override public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return fieldWithValue.equals(((ErrorResponse) o).fieldWithValue);
    }

    @Override public int hashCode() {
        return fieldWithValue.hashCode();
    }

    @Override public String toString() {
        final StringBuilder sb = new StringBuilder("ErrorResponse{");
        sb.append("severity=").append(getSeverity());
        sb.append(", sqlState='").append(getSqlState()).append('\'');
        sb.append(", message='").append(getMessage()).append('\'');
        sb.append(", fieldWithValue=").append(fieldWithValue);
        sb.append('}');
        return sb.toString();
    }
}
