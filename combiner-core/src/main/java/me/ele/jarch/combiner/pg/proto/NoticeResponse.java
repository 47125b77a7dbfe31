package me.ele.jarch.combiner.pg.proto;

import java.util.LinkedList;
import java.util.List;

/**
 * Non-fatal message from a data node. Forwarded as-is while the combiner is healthy.
 */
public class NoticeResponse extends PGMessage {
    private final List<Notice> notices;

    @Override protected byte getTypeByte() {
        return PGFlags.NOTICE_RESPONSE;
    }

    @Override protected List<byte[]> getPayload() {
        List<byte[]> bytes = new LinkedList<>();
        for (Notice notice : notices) {
            bytes.add(new byte[] {notice.code});
            bytes.add(PGProto.buildNullStr(notice.getNotice()));
        }
        bytes.add(new byte[] {0x00});
        return bytes;
    }

    public NoticeResponse() {
        this(new LinkedList<>());
    }

    public NoticeResponse(List<Notice> notices) {
        this.notices = notices;
    }

    public List<Notice> getNotices() {
        return notices;
    }

    public NoticeResponse addNotice(byte code, String noticeMsg) {
        notices.add(new Notice(code, noticeMsg));
        return this;
    }

    public static NoticeResponse loadFromPayload(byte[] payload) {
        PGProto proto = new PGProto(payload);
        List<Notice> notices = new LinkedList<>();
        while (proto.hasRemaining()) {
            byte code = proto.readByte();
            if (code == 0x0) {
                break;
            }
            notices.add(new Notice(code, proto.readNullStr()));
        }
        return new NoticeResponse(notices);
    }

    @Override public String toString() {
        return "NoticeResponse {notices=" + notices + "}";
    }

    public static class Notice {
        public final byte code;
        private final String notice;

        public Notice(byte code, String notice) {
            this.code = code;
            this.notice = notice;
        }

        public String getNotice() {
            return notice;
        }

        @Override public String toString() {
            return "Notice {code=" + (char) code + ", notice=" + notice + "}";
        }
    }
}
