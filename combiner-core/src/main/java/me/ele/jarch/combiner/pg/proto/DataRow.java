package me.ele.jarch.combiner.pg.proto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

public class DataRow extends PGMessage {
    private PGCol[] cols = new PGCol[0];

    @Override protected byte getTypeByte() {
        return PGFlags.DATA_ROW;
    }

    @Override protected List<byte[]> getPayload() {
        List<byte[]> bytes = new LinkedList<>();
        bytes.add(PGProto.buildInt16BE(cols.length));
        for (PGCol pgcol : cols) {
            bytes.add(pgcol.toBytes());
        }
        return bytes;
    }

    public DataRow() {
    }

    public DataRow(PGCol... cols) {
        setCols(cols);
    }

    public PGCol[] getCols() {
        return cols;
    }

    public void setCols(PGCol[] cols) {
        this.cols = cols == null ? new PGCol[0] : cols;
    }

    public int getColCount() {
        return cols.length;
    }

    public static DataRow loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int colCount = proto.readInt16();
        if (colCount <= 0) {
            return new DataRow();
        }
        PGCol[] cols = new PGCol[colCount];
        for (int i = 0; i < colCount; i++) {
            int colDataLen = proto.readInt32();
            if (colDataLen < 0) {
                cols[i] = new PGCol();
                continue;
            }
            cols[i] = new PGCol(proto.readBytes(colDataLen));
        }
        return new DataRow(cols);
    }

    @Override public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("DataRow {colCount=");
        builder.append(cols.length);
        builder.append(", cols=");
        builder.append(Arrays.toString(cols));
        builder.append("}");
        return builder.toString();
    }

    /**
     * One field of a row: int32 length (-1 for NULL) followed by the value bytes.
     */
    public static class PGCol {
        private final byte[] data;

        /**
         * NULL field
         */
        public PGCol() {
            this.data = null;
        }

        public PGCol(byte[] data) {
            this.data = data;
        }

        public static PGCol text(String value) {
            return new PGCol(value.getBytes(StandardCharsets.UTF_8));
        }

        public static PGCol binary(long value, int width) {
            return new PGCol(PGProto.buildUnsignedBE(value, width));
        }

        public byte[] getData() {
            return data;
        }

        public int getDataLen() {
            return data == null ? -1 : data.length;
        }

        public boolean isNull() {
            return data == null;
        }

        public byte[] toBytes() {
            List<byte[]> bytes = new LinkedList<>();
            bytes.add(PGProto.buildInt32BE(getDataLen()));
            if (data != null) {
                bytes.add(data);
            }
            return PGMessage.concat(bytes);
        }

        @Override public String toString() {
            StringBuilder builder = new StringBuilder();
            builder.append("PGCol {dataLen=");
            builder.append(getDataLen());
            builder.append(", data=");
            builder
                .append(Objects.isNull(data) ? "NULL" : new String(data, StandardCharsets.UTF_8));
            builder.append("}");
            return builder.toString();
        }
    }
}
