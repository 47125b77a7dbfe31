package me.ele.jarch.combiner.pg.proto;

import java.util.LinkedList;
import java.util.List;

public class ParameterStatus extends PGMessage {
    private final String paramName;
    private final String paramValue;

    @Override protected List<byte[]> getPayload() {
        List<byte[]> payload = new LinkedList<>();
        payload.add(PGProto.buildNullStr(paramName));
        payload.add(PGProto.buildNullStr(paramValue));
        return payload;
    }

    @Override protected byte getTypeByte() {
        return PGFlags.PARAMETER_STATUS;
    }

    public ParameterStatus(String paramName, String paramValue) {
        this.paramName = paramName;
        this.paramValue = paramValue;
    }

    public String getParamName() {
        return paramName;
    }

    public String getParamValue() {
        return paramValue;
    }

    public static ParameterStatus loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        return new ParameterStatus(proto.readNullStr(), proto.readNullStr());
    }

    @Override public String toString() {
        return "ParameterStatus {paramName=" + paramName + ", paramValue=" + paramValue + "}";
    }

}
