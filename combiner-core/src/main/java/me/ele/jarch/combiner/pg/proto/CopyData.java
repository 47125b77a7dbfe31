package me.ele.jarch.combiner.pg.proto;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * One chunk of COPY data, usually one row in text or csv format.
 */
public class CopyData extends PGMessage {
    private final byte[] data;

    @Override protected byte getTypeByte() {
        return PGFlags.B_COPY_DATA;
    }

    @Override protected List<byte[]> getPayload() {
        return Collections.singletonList(data);
    }

    public CopyData(byte[] data) {
        this.data = data;
    }

    public CopyData(String row) {
        this(row.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getData() {
        return data;
    }

    @Override public String toString() {
        return "CopyData {data=" + new String(data, StandardCharsets.UTF_8) + "}";
    }
}
