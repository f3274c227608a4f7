package net.littleredcomputer.relnet;

/**
 * Base of the failures that abort an encoding run. Each is a deterministic
 * property of the input, so none of them is ever retried.
 */
public abstract class RelnetException extends IllegalArgumentException {
    RelnetException(String message) {
        super(message);
    }

    RelnetException(String message, Throwable cause) {
        super(message, cause);
    }

    /** @return the short name of this failure, as reported by the driver */
    public abstract String kind();
}
