package me.ele.jarch.combiner.pg.proto;

import java.util.LinkedList;
import java.util.List;

/**
 * LISTEN/NOTIFY delivery. Forwarded unchanged by combiners.
 */
public class NotificationResponse extends PGMessage {
    private final int pid;
    private final String channel;
    private final String content;

    @Override protected List<byte[]> getPayload() {
        List<byte[]> payload = new LinkedList<>();
        payload.add(PGProto.buildInt32BE(pid));
        payload.add(PGProto.buildNullStr(channel));
        payload.add(PGProto.buildNullStr(content));
        return payload;
    }

    @Override protected byte getTypeByte() {
        return PGFlags.NOTIFICATION_RESPONSE;
    }

    public NotificationResponse(int pid, String channel, String content) {
        this.pid = pid;
        this.channel = channel;
        this.content = content;
    }

    public int getPid() {
        return pid;
    }

    public String getChannel() {
        return channel;
    }

    public String getContent() {
        return content;
    }

    public static NotificationResponse loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int pid = proto.readInt32();
        String channel = proto.readNullStr();
        String content = proto.readNullStr();
        return new NotificationResponse(pid, channel, content);
    }

    @Override public String toString() {
        final StringBuilder sb = new StringBuilder("NotificationResponse{");
        sb.append("pid=").append(pid);
        sb.append(", channel='").append(channel).append('\'');
        sb.append(", content='").append(content).append('\'');
        sb.append('}');
        return sb.toString();
    }
}
