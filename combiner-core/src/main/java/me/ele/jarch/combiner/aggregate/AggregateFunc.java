package me.ele.jarch.combiner.aggregate;

import com.google.common.primitives.UnsignedLongs;
import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;

/**
 * Reduction operators a plan may attach to a combiner. Only {@link #MAX} is implemented; the
 * others are recognised so that a plan naming them fails with a clear error.
 */
public enum AggregateFunc {
    NONE, COUNT, SUM, MAX, MIN, AVG;

    public static AggregateFunc valueOfFunc(final String func) {
        for (AggregateFunc afunc : values()) {
            if (afunc.name().equalsIgnoreCase(func)) {
                return afunc;
            }
        }
        return NONE;
    }

    public boolean isSupported() {
        return this == MAX;
    }

    /**
     * Fold one unsigned contribution into the running value.
     *
     * @param running current reduced value, unsigned
     * @param value   contribution of one node, unsigned
     * @throws CombinerException with {@link ErrorCode#UNSUPPORTED_REDUCTION} for anything but MAX
     */
    public long reduce(long running, long value) {
        switch (this) {
            case MAX:
                return UnsignedLongs.compare(value, running) > 0 ? value : running;
            case NONE:
            case COUNT:
            case SUM:
            case MIN:
            case AVG:
            default:
                throw unsupported();
        }
    }

    CombinerException unsupported() {
        return new CombinerException.Builder(ErrorCode.UNSUPPORTED_REDUCTION)
            .setErrorMessage("Unknown aggregate type: " + name()).build();
    }
}
