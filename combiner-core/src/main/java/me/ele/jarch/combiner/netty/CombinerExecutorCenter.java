package me.ele.jarch.combiner.netty;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import me.ele.jarch.combiner.util.CombinerConfig;

import java.util.Objects;

/**
 * Holds the executors that run combiner merges. A statement is pinned to one executor for its
 * whole life so that its merges never run concurrently.
 */
public class CombinerExecutorCenter {

    private static volatile EventExecutorGroup mergeGroup;

    public static synchronized void init(int mergeThreads) {
        if (Objects.nonNull(mergeGroup)) {
            return;
        }
        mergeGroup = new DefaultEventExecutorGroup(mergeThreads,
            new ThreadFactoryBuilder().setNameFormat("combiner-merge-%d").setDaemon(true).build());
    }

    public static EventExecutorGroup getMergeGroup() {
        if (Objects.isNull(mergeGroup)) {
            init(CombinerConfig.getInstance().getMergeThreadCount());
        }
        return mergeGroup;
    }

    /**
     * @return the executor for a new statement, round robin over the group
     */
    public static EventExecutor nextExecutor() {
        return getMergeGroup().next();
    }

    public static synchronized Future<?> shutdownGracefully() {
        EventExecutorGroup group = Objects.requireNonNull(mergeGroup,
            "mergeGroup is null, nothing to shut down");
        mergeGroup = null;
        return group.shutdownGracefully();
    }
}
