package me.ele.jarch.combiner.combine;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;
import me.ele.jarch.combiner.pg.proto.PGProto;

/**
 * Extracts the row count from a CommandComplete tag.
 * <p>
 * Scans left to right keeping only the most recent run of digits: any other character resets
 * both the value and the digit counter. {@code "UPDATE 12"} gives (2, 12),
 * {@code "INSERT 0 0"} gives (1, 0), {@code "VACUUM"} gives (0, 0).
 */
public class RowCountParser {

    private RowCountParser() {
    }

    /**
     * @param payload CommandComplete payload, the tag ends at the first NUL or at the end
     */
    public static RowCount parse(byte[] payload) {
        return parse(new PGProto(payload).readNullStr());
    }

    public static RowCount parse(String tag) {
        int digits = 0;
        long rowCount = 0;
        for (int pos = 0; pos < tag.length(); pos++) {
            char c = tag.charAt(pos);
            if (c >= '0' && c <= '9') {
                try {
                    rowCount = Math.addExact(Math.multiplyExact(rowCount, 10L), c - '0');
                } catch (ArithmeticException e) {
                    throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY)
                        .setErrorMessage("row count out of range in command tag: " + tag)
                        .build(e);
                }
                digits++;
            } else {
                rowCount = 0;
                digits = 0;
            }
        }
        return digits == 0 ? RowCount.ABSENT : new RowCount(digits, rowCount);
    }
}
