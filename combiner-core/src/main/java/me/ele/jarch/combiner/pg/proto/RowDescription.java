package me.ele.jarch.combiner.pg.proto;

import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

/**
 * Result schema of a query. Every node describes the same schema, the first one seen is sent.
 */
public class RowDescription extends PGMessage {
    private PGColumn[] columns = new PGColumn[0];

    @Override protected byte getTypeByte() {
        return PGFlags.ROW_DESCRIPTION;
    }

    @Override protected List<byte[]> getPayload() {
        List<byte[]> bytes = new LinkedList<>();
        bytes.add(PGProto.buildInt16BE(columns.length));
        for (PGColumn column : columns) {
            bytes.add(column.toBytes());
        }
        return bytes;
    }

    public RowDescription() {
    }

    public RowDescription(PGColumn... columns) {
        this.columns = columns == null ? new PGColumn[0] : columns;
    }

    public PGColumn[] getColumns() {
        return columns;
    }

    public int getColCount() {
        return columns.length;
    }

    public static RowDescription loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        int colCount = proto.readInt16();
        if (colCount <= 0) {
            return new RowDescription();
        }
        PGColumn[] columns = new PGColumn[colCount];
        for (int i = 0; i < colCount; i++) {
            PGColumn column = new PGColumn(proto.readNullStr());
            column.setTableOid(proto.readInt32());
            column.setColNo(proto.readInt16());
            column.setTypeOid(proto.readInt32());
            column.setTypeLen(proto.readInt16());
            column.setTypeMod(proto.readInt32());
            column.setFormat(proto.readInt16());
            columns[i] = column;
        }
        return new RowDescription(columns);
    }

    @Override public String toString() {
        return "RowDescription {colCount=" + columns.length + ", columns=" + Arrays
            .toString(columns) + "}";
    }

    public static class PGColumn {
        private final String name;
        /**
         * 0 unless the column is a plain table column
         */
        private int tableOid = 0;
        /**
         * attribute number in the table, 1-based, 0 unless a plain table column
         */
        private int colNo = 0;
        private int typeOid = 0;
        /**
         * negative for variable width types
         */
        private int typeLen = 0;
        private int typeMod = -1;
        /**
         * 0 text, 1 binary
         */
        private int format = PGFlags.FORMAT_TEXT;

        public PGColumn(String name) {
            this.name = name;
        }

        public PGColumn(String name, int typeOid, int typeLen, int format) {
            this.name = name;
            this.typeOid = typeOid;
            this.typeLen = typeLen;
            this.format = format;
        }

        public String getName() {
            return name;
        }

        public int getTableOid() {
            return tableOid;
        }

        public void setTableOid(int tableOid) {
            this.tableOid = tableOid;
        }

        public int getColNo() {
            return colNo;
        }

        public void setColNo(int colNo) {
            this.colNo = colNo;
        }

        public int getTypeOid() {
            return typeOid;
        }

        public void setTypeOid(int typeOid) {
            this.typeOid = typeOid;
        }

        public int getTypeLen() {
            return typeLen;
        }

        public void setTypeLen(int typeLen) {
            this.typeLen = typeLen;
        }

        public int getTypeMod() {
            return typeMod;
        }

        public void setTypeMod(int typeMod) {
            this.typeMod = typeMod;
        }

        public int getFormat() {
            return format;
        }

        public void setFormat(int format) {
            this.format = format;
        }

        byte[] toBytes() {
            List<byte[]> bytes = new LinkedList<>();
            bytes.add(PGProto.buildNullStr(name));
            bytes.add(PGProto.buildInt32BE(tableOid));
            bytes.add(PGProto.buildInt16BE(colNo));
            bytes.add(PGProto.buildInt32BE(typeOid));
            bytes.add(PGProto.buildInt16BE(typeLen));
            bytes.add(PGProto.buildInt32BE(typeMod));
            bytes.add(PGProto.buildInt16BE(format));
            return PGMessage.concat(bytes);
        }

        @Override public String toString() {
            return "PGColumn {name=" + name + ", tableOid=" + tableOid + ", colNo=" + colNo
                + ", typeOid=" + typeOid + ", typeLen=" + typeLen + ", typeMod=" + typeMod
                + ", format=" + format + "}";
        }
    }
}
