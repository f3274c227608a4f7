package net.littleredcomputer.relnet;

public class GraphFormatException extends RelnetException {
    private final int lineNumber;

    public GraphFormatException(int lineNumber, String message) {
        this(lineNumber, message, null);
    }

    public GraphFormatException(int lineNumber, String message, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /** @return one-based line of the graph file at fault, or 0 if the problem is not tied to a line */
    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public String kind() {
        return "FormatError";
    }
}
