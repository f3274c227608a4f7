package net.littleredcomputer.relnet;

public class ProbabilityException extends RelnetException {
    public ProbabilityException(String message) {
        super(message);
    }

    public ProbabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "ProbabilityError";
    }
}
