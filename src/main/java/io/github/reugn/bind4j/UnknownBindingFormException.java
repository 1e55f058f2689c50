package io.github.reugn.bind4j;

/**
 * Raised when a binding is tagged with, or resolves by shape to, a tag that no
 * handler was registered for.
 */
public class UnknownBindingFormException extends BindException {

    private final String tag;

    public UnknownBindingFormException(String tag) {
        super("No binding form registered for " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
