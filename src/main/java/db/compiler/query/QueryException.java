package db.compiler.query;

/**
 * Base of every failure raised by the compilation pipeline. Carries the stage that
 * failed and, when known, the character offset in the query text.
 */
public abstract class QueryException extends RuntimeException {
    public static final int NO_POSITION = -1;

    private final Stage stage;
    private final int position;

    protected QueryException(Stage stage, String message, int position) {
        super(message);
        this.stage = stage;
        this.position = position;
    }

    public Stage stage() { return stage; }

    /** Offset into the query text, or {@link #NO_POSITION}. */
    public int position() { return position; }

    public boolean hasPosition() { return position != NO_POSITION; }

    /**
     * Renders the query with a caret under {@code position}, for front-ends that want
     * a pointed diagnostic.
     */
    public static String caret(String query, int position) {
        String text = query == null ? "" : query.replace('\n', ' ').replace('\r', ' ');
        int caretPos = Math.max(0, Math.min(position, text.length()));
        return text + System.lineSeparator() + " ".repeat(caretPos) + "^";
    }
}
