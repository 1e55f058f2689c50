package io.github.reugn.bind4j;

/**
 * Raised by {@link io.github.reugn.bind4j.syntax.FormReader} on malformed source text.
 */
public class FormSyntaxException extends BindException {

    private final int offset;

    public FormSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
