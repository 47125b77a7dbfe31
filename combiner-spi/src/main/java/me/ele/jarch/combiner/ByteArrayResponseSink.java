package me.ele.jarch.combiner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Default implement of ResponseSink, keeps every write in memory in arrival order.
 */
public class ByteArrayResponseSink extends ResponseSink {
    private final List<byte[]> writes = new ArrayList<>();
    private int size = 0;
    private int flushCount = 0;

    @Override public void write(final byte[] bytes) {
        writes.add(bytes);
        size += bytes.length;
    }

    @Override public void flush() {
        flushCount++;
    }

    /**
     * @return every write, one element per {@link #write(byte[])} call.
     */
    public List<byte[]> getWrites() {
        return Collections.unmodifiableList(writes);
    }

    /**
     * @return all written bytes concatenated.
     */
    public byte[] toByteArray() {
        byte[] all = new byte[size];
        int offset = 0;
        for (byte[] write : writes) {
            System.arraycopy(write, 0, all, offset, write.length);
            offset += write.length;
        }
        return all;
    }

    public int size() {
        return size;
    }

    public int getFlushCount() {
        return flushCount;
    }

    public void clear() {
        writes.clear();
        size = 0;
    }
}
