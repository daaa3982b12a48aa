package dumb.narsese.ast;

public enum TermCategory {
    ATOM,
    COMPOUND,
    STATEMENT
}
