package me.ele.jarch.combiner.pg.util;

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps PostgreSQL encoding names (server_encoding, client_encoding) to Java charsets.
 */
public class PGCharsets {
    private static final Map<String, Charset> PG_ENCODINGS = new HashMap<>();

    static {
        PG_ENCODINGS.put("UTF8", StandardCharsets.UTF_8);
        PG_ENCODINGS.put("UNICODE", StandardCharsets.UTF_8);
        PG_ENCODINGS.put("LATIN1", StandardCharsets.ISO_8859_1);
        PG_ENCODINGS.put("SQL_ASCII", StandardCharsets.US_ASCII);
        PG_ENCODINGS.put("WIN1252", Charset.forName("windows-1252"));
    }

    private PGCharsets() {
    }

    /**
     * @param pgEncoding encoding name as PostgreSQL spells it, case insensitive
     * @return the matching charset, UTF-8 for a blank name
     * @throws java.nio.charset.UnsupportedCharsetException if neither PostgreSQL nor Java knows the name
     */
    public static Charset forName(String pgEncoding) {
        if (StringUtils.isBlank(pgEncoding)) {
            return StandardCharsets.UTF_8;
        }
        Charset charset = PG_ENCODINGS.get(pgEncoding.trim().toUpperCase(Locale.ROOT));
        if (charset != null) {
            return charset;
        }
        return Charset.forName(pgEncoding.trim());
    }
}
