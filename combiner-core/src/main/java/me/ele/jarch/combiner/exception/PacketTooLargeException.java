package me.ele.jarch.combiner.exception;

public class PacketTooLargeException extends QuitException {

    private static final long serialVersionUID = -162862259312150403L;

    public PacketTooLargeException(String message) {
        super(message);
    }
}
