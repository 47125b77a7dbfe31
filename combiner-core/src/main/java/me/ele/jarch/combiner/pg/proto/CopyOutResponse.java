package me.ele.jarch.combiner.pg.proto;

public class CopyOutResponse extends CopyResponse {

    public CopyOutResponse(int overallFormat, int[] columnFormats) {
        super(overallFormat, columnFormats);
    }

    @Override protected byte getTypeByte() {
        return PGFlags.COPY_OUT_RESPONSE;
    }

    public static CopyOutResponse loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int overallFormat = proto.readByte();
        return new CopyOutResponse(overallFormat, readColumnFormats(proto));
    }
}
