package me.ele.jarch.combiner.pg.util;

/**
 * See <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public class SqlState {
    public static final String DATA_CORRUPTED = "XX001";
    public static final String FEATURE_NOT_SUPPORTED = "0A000";
    public static final String INTERNAL_ERROR = "XX000";
    public static final String UNTRANSLATABLE_CHARACTER = "22P05";
    public static final String CHARACTER_NOT_IN_REPERTOIRE = "22021";

    private SqlState() {
    }
}
