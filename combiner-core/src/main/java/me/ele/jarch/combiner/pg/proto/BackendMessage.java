package me.ele.jarch.combiner.pg.proto;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;

import java.util.Arrays;

/**
 * One complete message read from a data node: the raw tag, its {@link ResponseKind} and the
 * payload that follows the length field.
 */
public class BackendMessage {
    private final byte type;
    private final ResponseKind kind;
    private final byte[] payload;

    public BackendMessage(byte type, byte[] payload) {
        this.type = type;
        this.kind = ResponseKind.valueOf(type);
        this.payload = payload;
    }

    public byte getType() {
        return type;
    }

    public ResponseKind getKind() {
        return kind;
    }

    public byte[] getPayload() {
        return payload;
    }

    public byte[] toPacket() {
        return PGMessage.buildPacket(type, payload);
    }

    /**
     * Split a whole packet into tag and payload.
     *
     * @throws CombinerException if the length field disagrees with the packet size
     */
    public static BackendMessage loadFromPacket(byte[] packet) {
        PGProto proto = new PGProto(packet);
        byte type = proto.readByte();
        int length = proto.readInt32();
        if (length < 4 || length - 4 != proto.remaining()) {
            throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY).setErrorMessage(
                String.format("malformed '%c' message: length %d, %d payload bytes", (char) type,
                    length, proto.remaining())).build();
        }
        return new BackendMessage(type, proto.readBytes(length - 4));
    }

    @Override public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("BackendMessage {type=");
        builder.append((char) type);
        builder.append(", kind=");
        builder.append(kind);
        builder.append(", payload=");
        builder.append(Arrays.toString(payload));
        builder.append("}");
        return builder.toString();
    }
}
