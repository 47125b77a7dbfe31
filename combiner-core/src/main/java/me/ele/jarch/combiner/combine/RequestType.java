package me.ele.jarch.combiner.combine;

/**
 * Statement category, fixed by the first classified response of a cycle.
 */
public enum RequestType {
    NOT_DEFINED, COMMAND, QUERY, COPY_IN, COPY_OUT
}
