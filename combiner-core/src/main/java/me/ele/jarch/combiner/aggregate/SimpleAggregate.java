package me.ele.jarch.combiner.aggregate;

import com.google.common.primitives.UnsignedLongs;

import java.nio.charset.StandardCharsets;

/**
 * Running reduction of one aggregate column over the single-row results of every node.
 * Created from the statement plan and attached to one combiner.
 */
public class SimpleAggregate {
    private final AggregateFunc func;
    private final AggregateValueDecoder decoder;
    private long value = 0;
    private boolean hasValue = false;
    private int responseCount = 0;

    public SimpleAggregate(AggregateFunc func) {
        this(func, 0);
    }

    /**
     * @param column position of the aggregated field in the DataRow
     */
    public SimpleAggregate(AggregateFunc func, int column) {
        this.func = func;
        this.decoder = new AggregateValueDecoder(column);
    }

    /**
     * Merge the DataRow of one node.
     *
     * @throws me.ele.jarch.combiner.exception.CombinerException if the function is not
     *                                                           supported or the row is malformed
     */
    public void mergeOne(byte[] payload) {
        if (!func.isSupported()) {
            throw func.unsupported();
        }
        Long colValue = decoder.decode(payload);
        if (colValue != null) {
            if (hasValue) {
                value = func.reduce(value, colValue);
            } else {
                // first non-NULL contribution seeds the value
                value = colValue;
                hasValue = true;
            }
        }
        responseCount++;
    }

    public boolean isComplete(int nodeCount) {
        return responseCount == nodeCount;
    }

    public AggregateFunc getFunc() {
        return func;
    }

    public int getResponseCount() {
        return responseCount;
    }

    public int getDataLen() {
        return decoder.getDataLen();
    }

    public int getColumn() {
        return decoder.getColumn();
    }

    public boolean hasValue() {
        return hasValue;
    }

    /**
     * @return the reduced value as unsigned, meaningful only if {@link #hasValue()}
     */
    public long getValue() {
        return value;
    }

    /**
     * @return the reduced value in text format, null if every node returned NULL
     */
    public byte[] toText() {
        if (!hasValue) {
            return null;
        }
        return UnsignedLongs.toString(value).getBytes(StandardCharsets.UTF_8);
    }

    @Override public String toString() {
        return "SimpleAggregate{func=" + func + ", column=" + getColumn() + ", value=" + (hasValue ?
            UnsignedLongs.toString(value) :
            "NULL") + ", responseCount=" + responseCount + '}';
    }
}
