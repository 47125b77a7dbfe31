package me.ele.jarch.combiner.combine;

/**
 * A CommandComplete tag split into the text before its trailing row count and the count.
 * {@code "INSERT 0 5"} is prefix {@code "INSERT 0 "} and count 5.
 * A merged tag is built from the prefix and the reduced count, never by editing the
 * original bytes.
 */
public class CommandTag {
    private final String prefix;
    private final RowCount rowCount;

    private CommandTag(String prefix, RowCount rowCount) {
        this.prefix = prefix;
        this.rowCount = rowCount;
    }

    public static CommandTag parse(String tag) {
        RowCount rowCount = RowCountParser.parse(tag);
        return new CommandTag(tag.substring(0, tag.length() - rowCount.digits), rowCount);
    }

    public String getPrefix() {
        return prefix;
    }

    public RowCount getRowCount() {
        return rowCount;
    }

    public String withRowCount(long count) {
        return prefix + count;
    }

    @Override public String toString() {
        return "CommandTag{prefix='" + prefix + "', rowCount=" + rowCount + '}';
    }
}
