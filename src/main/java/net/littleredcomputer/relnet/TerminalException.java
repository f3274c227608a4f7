package net.littleredcomputer.relnet;

public class TerminalException extends RelnetException {
    public TerminalException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "TerminalError";
    }
}
