package com.connections.api;

/**
 * The single failure type raised by graphs, the bulk-load pipeline and the
 * snapshot codec.
 *
 * The {@link ErrorKind} identifies the condition. The offending identifier,
 * couple or file name travel as structured context; the message is rendered
 * from the kind and that context.
 */
public class GraphException extends RuntimeException {
    private final ErrorKind kind;
    private final transient Identifier identifier;
    private final transient Couple couple;
    private final String detail;

    private GraphException(ErrorKind kind, Identifier identifier, Couple couple, String detail, Throwable cause) {
        super(render(kind, identifier, couple, detail), cause);
        this.kind = kind;
        this.identifier = identifier;
        this.couple = couple;
        this.detail = detail;
    }

    public static GraphException of(ErrorKind kind) {
        return new GraphException(kind, null, null, null, null);
    }

    public static GraphException of(ErrorKind kind, Identifier identifier) {
        return new GraphException(kind, identifier, null, null, null);
    }

    public static GraphException of(ErrorKind kind, Couple couple) {
        return new GraphException(kind, null, couple, null, null);
    }

    public static GraphException of(ErrorKind kind, Couple couple, Identifier identifier) {
        return new GraphException(kind, identifier, couple, null, null);
    }

    public static GraphException of(ErrorKind kind, Couple couple, Throwable cause) {
        return new GraphException(kind, null, couple, null, cause);
    }

    /** For conditions whose context is free text, such as a file name. */
    public static GraphException withDetail(ErrorKind kind, String detail) {
        return new GraphException(kind, null, null, detail, null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorKind.Family family() {
        return kind.family();
    }

    /** The offending node or edge identifier, or null. */
    public Identifier identifier() {
        return identifier;
    }

    /** The offending couple, or null. */
    public Couple couple() {
        return couple;
    }

    public String detail() {
        return detail;
    }

    private static String render(ErrorKind kind, Identifier identifier, Couple couple, String detail) {
        StringBuilder sb = new StringBuilder(kind.description());
        if (couple != null)
            sb.append(" [couple ").append(couple).append(']');
        if (identifier != null)
            sb.append(" [identifier ").append(identifier).append(']');
        if (detail != null)
            sb.append(" [").append(detail).append(']');
        return sb.toString();
    }
}
