package me.ele.jarch.combiner.combine;

import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;
import me.ele.jarch.combiner.pg.proto.CommandComplete;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;

import static org.testng.Assert.*;

public class RowCountParserTest {

    @Test public void testParseTrailingCount() {
        assertEquals(RowCountParser.parse("UPDATE 12"), new RowCount(2, 12));
        assertEquals(RowCountParser.parse("DELETE 0"), new RowCount(1, 0));
        assertEquals(RowCountParser.parse("SELECT 1000000"), new RowCount(7, 1000000));
    }

    @Test public void testOnlyLastDigitRunCounts() {
        // the oid of INSERT is dropped, only the row count is kept
        assertEquals(RowCountParser.parse("INSERT 0 0"), new RowCount(1, 0));
        assertEquals(RowCountParser.parse("INSERT 16384 25"), new RowCount(2, 25));
    }

    @Test public void testNoTrailingDigits() {
        RowCount rowCount = RowCountParser.parse("VACUUM");
        assertEquals(rowCount, RowCount.ABSENT);
        assertFalse(rowCount.isPresent());
        // a digit run followed by text is reset
        assertFalse(RowCountParser.parse("UPDATE 3 rows").isPresent());
        assertFalse(RowCountParser.parse("").isPresent());
    }

    @Test public void testParsePayload() {
        byte[] payload = new CommandComplete("UPDATE 7").toPayload();
        assertEquals(RowCountParser.parse(payload), new RowCount(1, 7));
        // missing terminator ends the tag at the end of the payload
        assertEquals(RowCountParser.parse("MOVE 42".getBytes(StandardCharsets.UTF_8)),
            new RowCount(2, 42));
    }

    @Test public void testOverflow() {
        try {
            RowCountParser.parse("UPDATE 99999999999999999999");
            fail("row count overflow must be rejected");
        } catch (CombinerException e) {
            assertEquals(e.errorCode, ErrorCode.PROTOCOL_INCONSISTENCY);
        }
        assertEquals(RowCountParser.parse("UPDATE " + Long.MAX_VALUE).value, Long.MAX_VALUE);
    }
}
