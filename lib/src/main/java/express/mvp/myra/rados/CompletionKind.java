package express.mvp.myra.rados;

/** Operation an asynchronous {@link Completion} was issued for. */
public enum CompletionKind {
    /** Object size and modification time. */
    STAT,

    /** Object data. */
    READ
}
