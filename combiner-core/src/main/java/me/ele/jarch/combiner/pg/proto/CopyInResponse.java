package me.ele.jarch.combiner.pg.proto;

public class CopyInResponse extends CopyResponse {

    public CopyInResponse(int overallFormat, int[] columnFormats) {
        super(overallFormat, columnFormats);
    }

    @Override protected byte getTypeByte() {
        return PGFlags.COPY_IN_RESPONSE;
    }

    public static CopyInResponse loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int overallFormat = proto.readByte();
        return new CopyInResponse(overallFormat, readColumnFormats(proto));
    }
}
