package me.ele.jarch.combiner.pg.proto;

import java.util.Collections;
import java.util.List;

/**
 * Completion tag of a statement, e.g. {@code UPDATE 12} or {@code INSERT 0 3}.
 */
public class CommandComplete extends PGMessage {
    private final String tag;

    @Override protected byte getTypeByte() {
        return PGFlags.COMMAND_COMPLETE;
    }

    @Override protected List<byte[]> getPayload() {
        return Collections.singletonList(PGProto.buildNullStr(tag));
    }

    public CommandComplete(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static CommandComplete loadFromPayload(byte[] payload) {
        return new CommandComplete(new PGProto(payload).readNullStr());
    }

    @Override public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("CommandComplete {tag=");
        builder.append(tag);
        builder.append("}");
        return builder.toString();
    }

}
