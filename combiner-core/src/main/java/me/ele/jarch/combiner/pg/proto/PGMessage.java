package me.ele.jarch.combiner.pg.proto;

import java.util.List;

/**
 * See <a href="https://www.postgresql.org/docs/current/protocol-message-formats.html">Postgresql Message Formats</a>
 * <p>
 * A packet is {@code tag | int32 length | payload} where the length counts itself and the
 * payload but not the tag. Combiners receive payloads and emit packets.
 */
public abstract class PGMessage {

    protected abstract byte getTypeByte();

    protected abstract List<byte[]> getPayload();

    public byte[] toPacket() {
        return buildPacket(getTypeByte(), toPayload());
    }

    /**
     * @return the message body without tag and length, as handed to a combiner
     */
    public byte[] toPayload() {
        return concat(getPayload());
    }

    public BackendMessage toBackendMessage() {
        return new BackendMessage(getTypeByte(), toPayload());
    }

    public static byte[] buildPacket(byte typeByte, byte[] payload) {
        byte[] packet = new byte[PGFlags.HEADER_SIZE + payload.length];
        packet[0] = typeByte;
        System.arraycopy(PGProto.buildInt32BE(payload.length + 4), 0, packet, 1, 4);
        System.arraycopy(payload, 0, packet, PGFlags.HEADER_SIZE, payload.length);
        return packet;
    }

    public static byte[] concat(List<byte[]> fields) {
        int size = 0;
        for (byte[] field : fields) {
            size += field.length;
        }
        byte[] bytes = new byte[size];
        int offset = 0;
        for (byte[] field : fields) {
            System.arraycopy(field, 0, bytes, offset, field.length);
            offset += field.length;
        }
        return bytes;
    }
}
