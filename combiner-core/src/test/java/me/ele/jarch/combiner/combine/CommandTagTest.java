package me.ele.jarch.combiner.combine;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class CommandTagTest {

    @Test public void testParse() {
        CommandTag tag = CommandTag.parse("INSERT 0 5");
        assertEquals(tag.getPrefix(), "INSERT 0 ");
        assertEquals(tag.getRowCount(), new RowCount(1, 5));
        assertEquals(tag.withRowCount(17), "INSERT 0 17");
    }

    @Test public void testWiderCount() {
        CommandTag tag = CommandTag.parse("UPDATE 9");
        assertEquals(tag.withRowCount(1234), "UPDATE 1234");
        tag = CommandTag.parse("DELETE 1234");
        assertEquals(tag.getPrefix(), "DELETE ");
        assertEquals(tag.withRowCount(0), "DELETE 0");
    }

    @Test public void testWithoutCount() {
        CommandTag tag = CommandTag.parse("CREATE TABLE");
        assertEquals(tag.getPrefix(), "CREATE TABLE");
        assertFalse(tag.getRowCount().isPresent());
    }
}
