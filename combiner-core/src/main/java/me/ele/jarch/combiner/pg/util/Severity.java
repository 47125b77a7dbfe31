package me.ele.jarch.combiner.pg.util;

/**
 * Value of the {@code S} field of ErrorResponse and NoticeResponse.
 * The first three end the statement on the node that sent them; the others only ever appear
 * in notices, which a combiner forwards.
 */
public enum Severity {
    ERROR(true), FATAL(true), PANIC(true), WARNING(false), NOTICE(false), DEBUG(false),
    INFO(false), LOG(false);

    private final boolean abortsStatement;

    Severity(boolean abortsStatement) {
        this.abortsStatement = abortsStatement;
    }

    public boolean abortsStatement() {
        return abortsStatement;
    }

    /**
     * @param name severity as sent by the server, e.g. {@code ERROR}; localized names are not known
     * @return the severity, null if the name is not one of the above
     */
    public static Severity fromName(String name) {
        for (Severity severity : values()) {
            if (severity.name().equals(name)) {
                return severity;
            }
        }
        return null;
    }
}
