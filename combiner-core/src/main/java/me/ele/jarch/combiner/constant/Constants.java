package me.ele.jarch.combiner.constant;

public class Constants {
    public static final String COMBINER_PREFIX = "[PGXC]";

    public static final long MAX_PACKET_SIZE = (long) 1024 * 1024 * 16;

    // keys of conf/combiner.properties
    public static final String SERVER_ENCODING = "server_encoding";
    public static final String CLIENT_ENCODING = "client_encoding";
    public static final String MERGE_THREAD_COUNT = "merge_thread_count";
    public static final String MAX_PACKET_SIZE_KEY = "max_packet_size";

    private Constants() {
    }
}
