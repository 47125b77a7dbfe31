package me.ele.jarch.combiner.combine;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import me.ele.jarch.combiner.pg.proto.BackendMessage;

import java.util.function.Consumer;

/**
 * Runs every operation on one {@link ResponseCombiner} on a single executor.
 * <p>
 * Backend connections served by different I/O threads submit their messages here; the
 * executor applies them one at a time in submission order, which preserves each connection's
 * message order and keeps the combiner single-writer without locks.
 */
public class SerializedCombiner {
    private final ResponseCombiner combiner;
    private final EventExecutor executor;

    public SerializedCombiner(ResponseCombiner combiner, EventExecutor executor) {
        this.combiner = combiner;
        this.executor = executor;
    }

    /**
     * @return future of {@link ResponseCombiner#merge(BackendMessage)}, failed with the
     * {@link me.ele.jarch.combiner.exception.CombinerException} if the merge detected corruption
     */
    public Future<Boolean> merge(BackendMessage message) {
        return executor.submit(() -> combiner.merge(message));
    }

    public Future<Boolean> merge(byte[] packet) {
        return executor.submit(() -> combiner.merge(packet));
    }

    /**
     * Change the combiner (aggregates, copy sink) in order with the merges.
     */
    public Future<?> configure(Consumer<ResponseCombiner> action) {
        return executor.submit(() -> action.accept(combiner));
    }

    public Future<Boolean> validate() {
        return executor.submit(combiner::validate);
    }

    public Future<Boolean> validateAndClose() {
        return executor.submit(combiner::validateAndClose);
    }

    public Future<Boolean> validateAndReset() {
        return executor.submit(combiner::validateAndReset);
    }

    public EventExecutor executor() {
        return executor;
    }

    /**
     * For inspection on the executor thread only.
     */
    ResponseCombiner unwrap() {
        return combiner;
    }
}
