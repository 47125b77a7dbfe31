package me.ele.jarch.combiner.netty;

import io.netty.util.concurrent.EventExecutor;
import org.testng.annotations.Test;

import java.util.concurrent.TimeUnit;

import static org.testng.Assert.*;

public class CombinerExecutorCenterTest {

    @Test public void testGroupFromConfig() throws Exception {
        EventExecutor first = CombinerExecutorCenter.nextExecutor();
        EventExecutor second = CombinerExecutorCenter.nextExecutor();
        // merge_thread_count=1 in the test configuration
        assertSame(first, second);
        assertEquals(first.submit(() -> first.inEventLoop()).get(5, TimeUnit.SECONDS),
            Boolean.TRUE);
        assertTrue(CombinerExecutorCenter.shutdownGracefully().await(5, TimeUnit.SECONDS));
        assertTrue(first.isShuttingDown());
        // a new group is created on demand
        assertNotSame(CombinerExecutorCenter.nextExecutor(), first);
        CombinerExecutorCenter.shutdownGracefully();
    }
}
