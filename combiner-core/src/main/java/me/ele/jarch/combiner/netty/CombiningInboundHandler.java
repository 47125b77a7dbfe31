package me.ele.jarch.combiner.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import me.ele.jarch.combiner.combine.SerializedCombiner;
import me.ele.jarch.combiner.pg.proto.BackendMessage;
import me.ele.jarch.combiner.util.NoThrow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Last handler of a data node channel: hands every decoded message of the current statement to
 * the statement's combiner. Failures are reported to the statement owner, which aborts the
 * statement.
 */
public class CombiningInboundHandler extends SimpleChannelInboundHandler<BackendMessage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CombiningInboundHandler.class);

    private final String nodeName;
    private final SerializedCombiner combiner;
    private final Consumer<Throwable> onFailure;

    public CombiningInboundHandler(String nodeName, SerializedCombiner combiner,
        Consumer<Throwable> onFailure) {
        this.nodeName = nodeName;
        this.combiner = combiner;
        this.onFailure = onFailure;
    }

    @Override protected void channelRead0(ChannelHandlerContext ctx, BackendMessage msg) {
        combiner.merge(msg).addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.error("failed to combine {} from node {}", msg.getKind(), nodeName,
                    future.cause());
                NoThrow.call(() -> onFailure.accept(future.cause()));
            }
        });
    }

    @Override public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("error on data node channel {}", nodeName, cause);
        NoThrow.call(() -> onFailure.accept(cause));
        ctx.close();
    }
}
