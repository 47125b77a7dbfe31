package me.ele.jarch.combiner.sink;

import me.ele.jarch.combiner.ResponseSink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Local destination of {@code COPY ... TO file}: raw rows are written to the stream unchanged.
 * The stream belongs to the caller, this sink never closes it.
 */
public class OutputStreamCopySink extends ResponseSink {
    private final OutputStream out;
    private long writtenRows = 0;

    public OutputStreamCopySink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override public void write(final byte[] bytes) {
        try {
            out.write(bytes);
            writtenRows++;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write copy row", e);
        }
    }

    @Override public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to flush copy destination", e);
        }
    }

    public long getWrittenRows() {
        return writtenRows;
    }
}
