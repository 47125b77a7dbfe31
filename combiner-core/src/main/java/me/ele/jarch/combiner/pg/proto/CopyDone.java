package me.ele.jarch.combiner.pg.proto;

import java.util.Collections;
import java.util.List;

public class CopyDone extends PGMessage {
    public static final CopyDone INSTANCE = new CopyDone();

    @Override protected byte getTypeByte() {
        return PGFlags.B_COPY_DONE;
    }

    @Override protected List<byte[]> getPayload() {
        return Collections.emptyList();
    }

    private CopyDone() {
    }

    @Override public String toString() {
        return "CopyDone{}";
    }
}
