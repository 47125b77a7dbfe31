package me.ele.jarch.combiner.pg.proto;

/**
 * Backend message tags and field tokens of the PostgreSQL v3 protocol that a combiner sees.
 */
public class PGFlags {
    // copy sub-protocol, both directions
    public static final byte B_COPY_DATA = (byte) 'd';
    public static final byte B_COPY_DONE = (byte) 'c';

    // server side
    public static final byte COMMAND_COMPLETE = (byte) 'C';
    public static final byte COPY_IN_RESPONSE = (byte) 'G';
    public static final byte COPY_OUT_RESPONSE = (byte) 'H';
    public static final byte DATA_ROW = (byte) 'D';
    public static final byte EMPTY_QUERY_RESPONSE = (byte) 'I';
    public static final byte ERROR_RESPONSE = (byte) 'E';
    public static final byte NOTICE_RESPONSE = (byte) 'N';
    public static final byte NOTIFICATION_RESPONSE = (byte) 'A';
    public static final byte PARAMETER_STATUS = (byte) 'S';
    public static final byte READY_FOR_QUERY = (byte) 'Z';
    public static final byte ROW_DESCRIPTION = (byte) 'T';

    //single byte token, appear in ErrorResponse and NoticeResponse messages
    public static final byte SEVERITY = (byte) 'S';
    public static final byte CODE = (byte) 'C';
    public static final byte MESSAGE = (byte) 'M';
    public static final byte DETAIL = (byte) 'D';
    public static final byte HINT = (byte) 'H';
    public static final byte FILE = (byte) 'F';
    public static final byte LINE = (byte) 'L';
    public static final byte ROUTINE = (byte) 'R';

    // copy formats
    public static final int FORMAT_TEXT = 0;
    public static final int FORMAT_BINARY = 1;

    /**
     * tag(1) + length(4)
     */
    public static final int HEADER_SIZE = 5;
}
