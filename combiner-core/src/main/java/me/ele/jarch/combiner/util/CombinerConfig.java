package me.ele.jarch.combiner.util;

import me.ele.jarch.combiner.constant.Constants;
import me.ele.jarch.combiner.pg.util.PGCharsets;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Properties;

/**
 * Process wide settings, read from {@code conf/combiner.properties} on the classpath.
 * Missing file or keys fall back to defaults.
 */
public class CombinerConfig {
    private static final Logger logger = LoggerFactory.getLogger(CombinerConfig.class);
    static final String PROP_FILE = "conf/combiner.properties";

    private final Properties config = new Properties();

    private Charset serverEncoding = PGCharsets.forName("UTF8");
    private Charset clientEncoding = PGCharsets.forName("UTF8");
    private int mergeThreadCount = 2;
    private long maxPacketSize = Constants.MAX_PACKET_SIZE;

    static class INNER {
        static final CombinerConfig combinerConfig = newLoaded();
    }

    public static CombinerConfig getInstance() {
        return INNER.combinerConfig;
    }

    private static CombinerConfig newLoaded() {
        CombinerConfig combinerConfig = new CombinerConfig();
        combinerConfig.load();
        return combinerConfig;
    }

    public void load() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(PROP_FILE)) {
            if (Objects.isNull(in)) {
                logger.warn("configuration file {} not found, using defaults", PROP_FILE);
            } else {
                config.load(in);
            }
        } catch (IOException e) {
            logger.error("failed to load configuration file: " + PROP_FILE, e);
        }
        setAllProperty(config);
    }

    public void load(Properties properties) {
        config.putAll(properties);
        setAllProperty(config);
    }

    // set properties to memory variable
    private void setAllProperty(Properties props) {
        serverEncoding = PGCharsets.forName(props.getProperty(Constants.SERVER_ENCODING, "UTF8"));
        clientEncoding = PGCharsets.forName(props.getProperty(Constants.CLIENT_ENCODING, "UTF8"));
        mergeThreadCount = parsePositiveInt(props, Constants.MERGE_THREAD_COUNT, 2);
        maxPacketSize = parsePositiveInt(props, Constants.MAX_PACKET_SIZE_KEY,
            (int) Constants.MAX_PACKET_SIZE);
        logger.info(
            "combiner config: server_encoding={}, client_encoding={}, merge_thread_count={}, max_packet_size={}",
            serverEncoding, clientEncoding, mergeThreadCount, maxPacketSize);
    }

    private static int parsePositiveInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.warn("invalid {}: {}", key, value);
        }
        return defaultValue;
    }

    public Properties getConfig() {
        return config;
    }

    public Charset getServerEncoding() {
        return serverEncoding;
    }

    public Charset getClientEncoding() {
        return clientEncoding;
    }

    public int getMergeThreadCount() {
        return mergeThreadCount;
    }

    public long getMaxPacketSize() {
        return maxPacketSize;
    }
}
