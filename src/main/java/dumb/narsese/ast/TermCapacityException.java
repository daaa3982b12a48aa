package dumb.narsese.ast;

public class TermCapacityException extends Exception {
    private final TermType type;

    public TermCapacityException(TermType type, String message) {
        super(message + " (" + type + ", " + type.capacity() + ')');
        this.type = type;
    }

    public TermType type() {
        return type;
    }
}
