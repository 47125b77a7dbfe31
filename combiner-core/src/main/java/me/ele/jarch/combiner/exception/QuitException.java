package me.ele.jarch.combiner.exception;

/**
 * The backend connection can no longer be read and must be dropped.
 */
public class QuitException extends Exception {

    private static final long serialVersionUID = 1678109213830136697L;

    public QuitException(String message) {
        super(message);
    }

    public QuitException(String message, Exception cause) {
        super(message, cause);
    }
}
