package io.github.reugn.bind4j;

import io.github.reugn.bind4j.expander.Declaration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised at the end of an expansion when declarations were never claimed by a
 * binding and the unused-declaration policy is {@code error}.
 */
public class UnusedDeclarationsException extends BindException {

    private final List<Declaration> declarations;

    public UnusedDeclarationsException(List<Declaration> declarations) {
        super("Unused declarations: " + declarations.stream()
                .map(d -> d.specifier().toString())
                .collect(Collectors.joining(", ")));
        this.declarations = List.copyOf(declarations);
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }
}
