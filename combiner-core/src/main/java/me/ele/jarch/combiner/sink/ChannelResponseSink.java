package me.ele.jarch.combiner.sink;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import me.ele.jarch.combiner.ResponseSink;

import java.util.Objects;

/**
 * Writes combined packets to the client channel. Writes are buffered by netty until
 * {@link #flush()}, which the combiner calls when a statement is validated.
 */
public class ChannelResponseSink extends ResponseSink {
    private final Channel clientChannel;

    public ChannelResponseSink(Channel clientChannel) {
        this.clientChannel = Objects.requireNonNull(clientChannel, "clientChannel");
    }

    @Override public void write(final byte[] bytes) {
        clientChannel.write(Unpooled.wrappedBuffer(bytes));
    }

    @Override public void flush() {
        clientChannel.flush();
    }

    public Channel getClientChannel() {
        return clientChannel;
    }
}
