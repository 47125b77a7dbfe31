package me.ele.jarch.combiner.aggregate;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;
import me.ele.jarch.combiner.pg.proto.PGProto;

/**
 * Reads one binary integer field out of DataRow payloads.
 * <p>
 * Layout: int16 column count, then per column an int32 length (-1 for NULL) and the value.
 * For column 0 the length sits at offset 2 and the value at offset 6. The value is a
 * big-endian unsigned integer of 1 to 8 bytes; the width seen first is required of every
 * later row.
 */
public class AggregateValueDecoder {
    private static final int MAX_WIDTH = 8;

    private final int column;
    private int dataLen = 0;

    public AggregateValueDecoder(int column) {
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative: " + column);
        }
        this.column = column;
    }

    /**
     * @return the decoded unsigned value, or null if the field is SQL NULL
     */
    public Long decode(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int colCount = proto.readInt16();
        if (column >= colCount) {
            throw corrupted(
                String.format("aggregate column %d missing, row has %d", column, colCount));
        }
        for (int i = 0; i < column; i++) {
            int len = proto.readInt32();
            if (len > 0) {
                proto.skip(len);
            }
        }
        int len = proto.readInt32();
        if (len < 0) {
            return null;
        }
        if (len == 0 || len > MAX_WIDTH) {
            throw corrupted("unsupported aggregate value width " + len);
        }
        if (dataLen != 0 && dataLen != len) {
            throw corrupted(String
                .format("aggregate value width %d differs from %d of earlier nodes", len,
                    dataLen));
        }
        long value = proto.readUnsigned(len);
        dataLen = len;
        return value;
    }

    /**
     * @return width learned from the first non-NULL value, 0 before that
     */
    public int getDataLen() {
        return dataLen;
    }

    public int getColumn() {
        return column;
    }

    private static CombinerException corrupted(String message) {
        return new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY)
            .setErrorMessage(message).build();
    }
}
