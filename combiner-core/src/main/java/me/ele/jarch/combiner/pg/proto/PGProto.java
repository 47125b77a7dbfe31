package me.ele.jarch.combiner.pg.proto;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;

import java.nio.charset.StandardCharsets;

/**
 * Cursor over a backend payload plus the big-endian builders used when re-serializing.
 * <p>
 * Reads are bounds checked: a payload shorter than its own header claims is a corrupted
 * response, reported as {@link ErrorCode#PROTOCOL_INCONSISTENCY}.
 */
public class PGProto {
    private final byte[] packet;
    private int offset;

    public PGProto(byte[] packet, int offset) {
        this.packet = packet;
        this.offset = offset;
    }

    public PGProto(byte[] packet) {
        this(packet, 0);
    }

    public boolean hasRemaining() {
        return offset < packet.length;
    }

    public int remaining() {
        return packet.length - offset;
    }

    public int getOffset() {
        return offset;
    }

    public void skip(int size) {
        ensureReadable(size);
        offset += size;
    }

    public byte[] readBytes(int size) {
        ensureReadable(size);
        byte[] bytes = new byte[size];
        System.arraycopy(packet, offset, bytes, 0, size);
        offset += size;
        return bytes;
    }

    public byte readByte() {
        ensureReadable(1);
        return packet[offset++];
    }

    public int readInt16() {
        ensureReadable(2);
        int value = packet[offset] << 8 | packet[offset + 1] & 0xff;
        offset += 2;
        return value;
    }

    public int readInt32() {
        ensureReadable(4);
        int value = (packet[offset] & 0xff) << 24 | (packet[offset + 1] & 0xff) << 16
            | (packet[offset + 2] & 0xff) << 8 | packet[offset + 3] & 0xff;
        offset += 4;
        return value;
    }

    /**
     * Read an unsigned big-endian integer of {@code width} bytes, 1 to 8.
     * Values of width 8 may not fit a signed long and must be treated as unsigned.
     */
    public long readUnsigned(int width) {
        ensureReadable(width);
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = value << 8 | packet[offset + i] & 0xff;
        }
        offset += width;
        return value;
    }

    /**
     * Read a C string. A missing terminator ends the string at the end of the payload.
     */
    public String readNullStr() {
        int endIndex = packet.length;
        for (int i = offset; i < packet.length; i++) {
            if (packet[i] == 0x00) {
                endIndex = i;
                break;
            }
        }
        String value = new String(packet, offset, endIndex - offset, StandardCharsets.UTF_8);
        offset = Math.min(endIndex + 1, packet.length);
        return value;
    }

    private void ensureReadable(int size) {
        if (size < 0 || offset + size > packet.length) {
            throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY)
                .setErrorMessage(String
                    .format("truncated response from the data nodes: need %d bytes at %d of %d",
                        size, offset, packet.length)).build();
        }
    }

    public static byte[] buildInt16BE(final int value) {
        byte[] bytes = new byte[2];
        bytes[0] = (byte) (value >>> 8);
        bytes[1] = (byte) value;
        return bytes;
    }

    public static byte[] buildInt32BE(final int value) {
        byte[] bytes = new byte[4];
        bytes[0] = (byte) (value >>> 24);
        bytes[1] = (byte) (value >>> 16);
        bytes[2] = (byte) (value >>> 8);
        bytes[3] = (byte) value;
        return bytes;
    }

    public static byte[] buildUnsignedBE(final long value, final int width) {
        byte[] bytes = new byte[width];
        for (int i = 0; i < width; i++) {
            bytes[i] = (byte) (value >>> (8 * (width - 1 - i)));
        }
        return bytes;
    }

    public static byte[] buildNullStr(String str) {
        byte[] strBytes = str.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[strBytes.length + 1];
        System.arraycopy(strBytes, 0, bytes, 0, strBytes.length);
        return bytes;
    }
}
