package me.ele.jarch.combiner.pg.proto;

import me.ele.jarch.combiner.combine.ResponseHandler;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.testng.Assert.*;

public class ResponseKindTest {

    /**
     * Records the callback each kind lands on.
     */
    static class RecordingHandler implements ResponseHandler {
        final List<String> calls = new ArrayList<>();

        @Override public void onCopyOutComplete(byte[] payload) {
            calls.add("copyOutComplete");
        }

        @Override public void onCommandComplete(byte[] payload) {
            calls.add("commandComplete");
        }

        @Override public void onRowDescription(byte[] payload) {
            calls.add("rowDescription");
        }

        @Override public void onParameterStatus(byte[] payload) {
            calls.add("parameterStatus");
        }

        @Override public void onCopyInResponse(byte[] payload) {
            calls.add("copyInResponse");
        }

        @Override public void onCopyOutResponse(byte[] payload) {
            calls.add("copyOutResponse");
        }

        @Override public void onCopyOutDataRow(byte[] payload) {
            calls.add("copyOutDataRow");
        }

        @Override public void onDataRow(byte[] payload) {
            calls.add("dataRow");
        }

        @Override public void onErrorResponse(byte[] payload) {
            calls.add("errorResponse");
        }

        @Override public void onNotification(ResponseKind kind, byte[] payload) {
            calls.add("notification:" + kind);
        }

        @Override public void onUnexpected(ResponseKind kind, byte[] payload) {
            calls.add("unexpected:" + kind);
        }
    }

    @Test public void testValueOf() {
        assertEquals(ResponseKind.valueOf((byte) 'c'), ResponseKind.COPY_OUT_COMPLETE);
        assertEquals(ResponseKind.valueOf((byte) 'C'), ResponseKind.COMMAND_COMPLETE);
        assertEquals(ResponseKind.valueOf((byte) 'T'), ResponseKind.ROW_DESCRIPTION);
        assertEquals(ResponseKind.valueOf((byte) 'S'), ResponseKind.PARAMETER_STATUS);
        assertEquals(ResponseKind.valueOf((byte) 'G'), ResponseKind.COPY_IN_RESPONSE);
        assertEquals(ResponseKind.valueOf((byte) 'H'), ResponseKind.COPY_OUT_RESPONSE);
        assertEquals(ResponseKind.valueOf((byte) 'd'), ResponseKind.COPY_OUT_DATA_ROW);
        assertEquals(ResponseKind.valueOf((byte) 'D'), ResponseKind.DATA_ROW);
        assertEquals(ResponseKind.valueOf((byte) 'E'), ResponseKind.ERROR_RESPONSE);
        assertEquals(ResponseKind.valueOf((byte) 'A'), ResponseKind.NOTIFICATION_RESPONSE);
        assertEquals(ResponseKind.valueOf((byte) 'N'), ResponseKind.NOTICE_RESPONSE);
        assertEquals(ResponseKind.valueOf((byte) 'I'), ResponseKind.EMPTY_QUERY);
    }

    @Test public void testUnknownTags() {
        assertEquals(ResponseKind.valueOf(PGFlags.READY_FOR_QUERY), ResponseKind.UNEXPECTED);
        assertEquals(ResponseKind.valueOf((byte) 0), ResponseKind.UNEXPECTED);
        assertEquals(ResponseKind.valueOf((byte) 0xff), ResponseKind.UNEXPECTED);
    }

    @Test public void testTagRoundTrip() {
        for (ResponseKind kind : ResponseKind.values()) {
            if (kind != ResponseKind.UNEXPECTED) {
                assertEquals(ResponseKind.valueOf(kind.getTag()), kind);
            }
        }
    }

    @Test public void testDispatch() {
        RecordingHandler handler = new RecordingHandler();
        for (ResponseKind kind : ResponseKind.values()) {
            kind.dispatch(handler, new byte[0]);
        }
        assertEquals(handler.calls.size(), ResponseKind.values().length);
        assertEquals(handler.calls.get(ResponseKind.DATA_ROW.ordinal()), "dataRow");
        assertEquals(handler.calls.get(ResponseKind.NOTICE_RESPONSE.ordinal()),
            "notification:NOTICE_RESPONSE");
        assertEquals(handler.calls.get(ResponseKind.EMPTY_QUERY.ordinal()),
            "unexpected:EMPTY_QUERY");
        assertEquals(handler.calls.get(ResponseKind.UNEXPECTED.ordinal()),
            "unexpected:UNEXPECTED");
    }
}
