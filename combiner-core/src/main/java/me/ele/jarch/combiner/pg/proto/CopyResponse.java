package me.ele.jarch.combiner.pg.proto;

import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

/**
 * Common layout of CopyInResponse and CopyOutResponse:
 * overall format (int8), column count (int16), one format code (int16) per column.
 */
public abstract class CopyResponse extends PGMessage {
    private final int overallFormat;
    private final int[] columnFormats;

    protected CopyResponse(int overallFormat, int[] columnFormats) {
        this.overallFormat = overallFormat;
        this.columnFormats = columnFormats;
    }

    @Override protected List<byte[]> getPayload() {
        List<byte[]> bytes = new LinkedList<>();
        bytes.add(new byte[] {(byte) overallFormat});
        bytes.add(PGProto.buildInt16BE(columnFormats.length));
        for (int format : columnFormats) {
            bytes.add(PGProto.buildInt16BE(format));
        }
        return bytes;
    }

    public int getOverallFormat() {
        return overallFormat;
    }

    public int[] getColumnFormats() {
        return columnFormats;
    }

    protected static int[] readColumnFormats(PGProto proto) {
        int count = proto.readInt16();
        int[] formats = new int[Math.max(count, 0)];
        for (int i = 0; i < formats.length; i++) {
            formats[i] = proto.readInt16();
        }
        return formats;
    }

    @Override public String toString() {
        return getClass().getSimpleName() + " {overallFormat=" + overallFormat
            + ", columnFormats=" + Arrays.toString(columnFormats) + "}";
    }
}
