package me.ele.jarch.combiner.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import me.ele.jarch.combiner.exception.PacketTooLargeException;
import me.ele.jarch.combiner.exception.QuitException;
import me.ele.jarch.combiner.pg.proto.BackendMessage;
import me.ele.jarch.combiner.pg.proto.PGFlags;
import me.ele.jarch.combiner.util.CombinerConfig;

import java.util.List;

/**
 * Frames the byte stream of one data node connection into {@link BackendMessage}s.
 */
public class PGBackendMessageDecoder extends ByteToMessageDecoder {
    public static final String PKT_TOO_LARGE_ERR = "the length of the packet is too large";

    private final long maxPacketSize;

    public PGBackendMessageDecoder() {
        this(CombinerConfig.getInstance().getMaxPacketSize());
    }

    public PGBackendMessageDecoder(long maxPacketSize) {
        this.maxPacketSize = maxPacketSize;
    }

    @Override protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
        throws Exception {
        // wait until the heading size is prepared
        while (in.readableBytes() >= PGFlags.HEADER_SIZE) {
            int start = in.readerIndex();
            byte type = in.getByte(start);
            int length = in.getInt(start + 1);
            checkValidLength(length);
            // wait until whole payload prepared
            if (in.readableBytes() < length + 1) {
                return;
            }
            in.skipBytes(PGFlags.HEADER_SIZE);
            byte[] payload = new byte[length - 4];
            in.readBytes(payload);
            out.add(new BackendMessage(type, payload));
        }
    }

    private void checkValidLength(int length) throws QuitException {
        if (length < 4) {
            throw new QuitException("invalid packet length " + length);
        }
        if (length >= maxPacketSize) {
            throw new PacketTooLargeException(PKT_TOO_LARGE_ERR + ": " + length);
        }
    }
}
