package me.ele.jarch.combiner.pg.util;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class SeverityTest {

    @Test public void testFromName() {
        assertEquals(Severity.fromName("ERROR"), Severity.ERROR);
        assertEquals(Severity.fromName("NOTICE"), Severity.NOTICE);
        assertNull(Severity.fromName("error"));
        assertNull(Severity.fromName(""));
        assertNull(Severity.fromName(null));
    }

    @Test public void testAbortsStatement() {
        assertTrue(Severity.ERROR.abortsStatement());
        assertTrue(Severity.FATAL.abortsStatement());
        assertTrue(Severity.PANIC.abortsStatement());
        assertFalse(Severity.WARNING.abortsStatement());
        assertFalse(Severity.NOTICE.abortsStatement());
        assertFalse(Severity.LOG.abortsStatement());
    }
}
