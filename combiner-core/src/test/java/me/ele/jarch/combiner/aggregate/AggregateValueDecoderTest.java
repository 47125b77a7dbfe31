package me.ele.jarch.combiner.aggregate;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;
import me.ele.jarch.combiner.pg.proto.DataRow;
import me.ele.jarch.combiner.pg.proto.DataRow.PGCol;
import org.testng.annotations.Test;

import java.util.Arrays;

import static org.testng.Assert.*;

public class AggregateValueDecoderTest {

    private static void assertCorrupted(AggregateValueDecoder decoder, byte[] payload) {
        try {
            decoder.decode(payload);
            fail("payload must be rejected: " + Arrays.toString(payload));
        } catch (CombinerException e) {
            assertEquals(e.errorCode, ErrorCode.PROTOCOL_INCONSISTENCY);
        }
    }

    @Test public void testDecodeWidths() {
        assertEquals(new AggregateValueDecoder(0).decode(new DataRow(PGCol.binary(200, 1)).toPayload()),
            Long.valueOf(200));
        assertEquals(new AggregateValueDecoder(0).decode(new DataRow(PGCol.binary(65535, 2)).toPayload()),
            Long.valueOf(65535));
        assertEquals(new AggregateValueDecoder(0)
                .decode(new DataRow(PGCol.binary(0x0102030405L, 5)).toPayload()),
            Long.valueOf(0x0102030405L));
        assertEquals(new AggregateValueDecoder(0)
                .decode(new DataRow(PGCol.binary(0xffffffffffffffffL, 8)).toPayload()),
            Long.valueOf(-1L));
    }

    @Test public void testColumnZeroLayout() {
        // column count, length at offset 2, value at offset 6
        byte[] payload = new byte[] {0, 1, 0, 0, 0, 4, 0, 0, 1, 0};
        AggregateValueDecoder decoder = new AggregateValueDecoder(0);
        assertEquals(decoder.decode(payload), Long.valueOf(256));
        assertEquals(decoder.getDataLen(), 4);
    }

    @Test public void testLaterColumn() {
        AggregateValueDecoder decoder = new AggregateValueDecoder(2);
        byte[] payload =
            new DataRow(PGCol.text("skip me"), new PGCol(), PGCol.binary(77, 4)).toPayload();
        assertEquals(decoder.decode(payload), Long.valueOf(77));
        assertEquals(decoder.getColumn(), 2);
    }

    @Test public void testNullField() {
        AggregateValueDecoder decoder = new AggregateValueDecoder(0);
        assertNull(decoder.decode(new DataRow(new PGCol()).toPayload()));
        // NULL does not fix the width
        assertEquals(decoder.getDataLen(), 0);
        assertEquals(decoder.decode(new DataRow(PGCol.binary(3, 2)).toPayload()), Long.valueOf(3));
        assertEquals(decoder.getDataLen(), 2);
    }

    @Test public void testWidthMismatch() {
        AggregateValueDecoder decoder = new AggregateValueDecoder(0);
        decoder.decode(new DataRow(PGCol.binary(3, 4)).toPayload());
        assertCorrupted(decoder, new DataRow(PGCol.binary(3, 8)).toPayload());
    }

    @Test public void testUnsupportedWidth() {
        assertCorrupted(new AggregateValueDecoder(0), new DataRow(new PGCol(new byte[9])).toPayload());
        assertCorrupted(new AggregateValueDecoder(0), new DataRow(new PGCol(new byte[0])).toPayload());
    }

    @Test public void testTruncated() {
        AggregateValueDecoder decoder = new AggregateValueDecoder(0);
        // length says 4, only 2 bytes follow
        assertCorrupted(decoder, new byte[] {0, 1, 0, 0, 0, 4, 0, 1});
        // no room for the length
        assertCorrupted(decoder, new byte[] {0, 1, 0, 0});
        assertCorrupted(decoder, new byte[] {0});
    }

    @Test public void testMissingColumn() {
        assertCorrupted(new AggregateValueDecoder(1), new DataRow(PGCol.binary(1, 4)).toPayload());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeColumn() {
        new AggregateValueDecoder(-1);
    }
}
