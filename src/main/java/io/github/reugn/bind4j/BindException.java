package io.github.reugn.bind4j;

/**
 * Base class for every error raised while reading or expanding binding forms.
 * <p>
 * All subclasses are hard errors: an expansion that throws one produces no tree.
 */
public class BindException extends RuntimeException {

    public BindException(String message) {
        super(message);
    }

    public BindException(String message, Throwable cause) {
        super(message, cause);
    }
}
