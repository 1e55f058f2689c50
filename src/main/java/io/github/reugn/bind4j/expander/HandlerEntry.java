package io.github.reugn.bind4j.expander;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A registered binding form. One entry is shared by its canonical tag and all
 * of its synonyms.
 *
 * @param tag                   the canonical tag
 * @param synonyms              alternative tags, in registration order
 * @param generator             the fragment generator
 * @param acceptsMultipleValues whether a binding may supply several value forms
 */
public record HandlerEntry(String tag, List<String> synonyms, BindingFormGenerator generator,
                           boolean acceptsMultipleValues) {

    public HandlerEntry {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(generator, "generator");
        synonyms = List.copyOf(synonyms);
    }

    /**
     * Returns the canonical tag followed by the synonyms.
     */
    public List<String> group() {
        return Stream.concat(Stream.of(tag), synonyms.stream()).toList();
    }
}
