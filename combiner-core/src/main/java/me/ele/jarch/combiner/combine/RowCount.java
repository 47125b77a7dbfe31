package me.ele.jarch.combiner.combine;

/**
 * Last run of decimal digits in a command tag: how many digits and their value.
 */
public class RowCount {
    public static final RowCount ABSENT = new RowCount(0, 0);

    public final int digits;
    public final long value;

    public RowCount(int digits, long value) {
        this.digits = digits;
        this.value = value;
    }

    public boolean isPresent() {
        return digits > 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        RowCount that = (RowCount) o;
        return digits == that.digits && value == that.value;
    }

    @Override public int hashCode() {
        return 31 * digits + Long.hashCode(value);
    }

    @Override public String toString() {
        return "RowCount{digits=" + digits + ", value=" + value + '}';
    }
}
