package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.annotation.BindingForm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Maps binding-form tags to their generators.
 *
 * <p>Every tag of a group, canonical or synonym, maps to the same
 * {@link HandlerEntry}, so synonyms share the generator and the
 * value-form capability. Tags are matched case-sensitively.
 *
 * <p><b>Lifecycle:</b> registration is additive and happens before expansion
 * starts; entries are never removed. Registration is not synchronized, while
 * lookups are safe from any number of threads once registration is done.
 *
 * <p><b>Introspection:</b>
 * <ul>
 *   <li>{@link #listTags()} - every registered tag</li>
 *   <li>{@link #listGroups()} - one list per binding form, canonical tag first</li>
 *   <li>{@link #synonymsOf(String)} - the group a tag belongs to</li>
 * </ul>
 * Listings are ordered case-insensitively by tag, canonical tag for groups.
 */
public final class BindingFormRegistry {

    private static final Comparator<String> TAG_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final Map<String, HandlerEntry> entries = new HashMap<>();
    private final List<HandlerEntry> groups = new ArrayList<>();

    /**
     * Creates a registry holding every generator published as a
     * {@link BindingFormGenerator} service.
     */
    public static BindingFormRegistry standard() {
        BindingFormRegistry registry = new BindingFormRegistry();
        for (BindingFormGenerator generator : ServiceLoader.load(BindingFormGenerator.class,
                BindingFormRegistry.class.getClassLoader())) {
            registry.register(generator);
        }
        return registry;
    }

    /**
     * Registers a generator described by its {@link BindingForm} annotation.
     *
     * @throws IllegalArgumentException if the class is not annotated or a tag is already registered
     */
    public HandlerEntry register(BindingFormGenerator generator) {
        BindingForm form = generator.getClass().getAnnotation(BindingForm.class);
        if (form == null) {
            throw new IllegalArgumentException(generator.getClass().getName()
                    + " is not annotated with @" + BindingForm.class.getSimpleName());
        }
        return register(form.value(), List.of(form.synonyms()), generator, form.acceptsMultipleValues());
    }

    /**
     * Registers a generator under a canonical tag and its synonyms.
     *
     * @param tag                   the canonical tag, e.g. {@code ":values"}
     * @param synonyms              alternative tags
     * @param generator             the fragment generator
     * @param acceptsMultipleValues whether bindings may supply several value forms
     * @return the registered entry
     * @throws IllegalArgumentException if any of the tags is already registered
     */
    public HandlerEntry register(String tag, Collection<String> synonyms, BindingFormGenerator generator,
                                 boolean acceptsMultipleValues) {
        HandlerEntry entry = new HandlerEntry(tag, List.copyOf(synonyms), generator, acceptsMultipleValues);
        List<String> group = entry.group();
        for (int i = 0; i < group.size(); i++) {
            String name = group.get(i);
            if (entries.containsKey(name) || group.subList(0, i).contains(name)) {
                throw new IllegalArgumentException("Binding form already registered: " + name);
            }
        }
        for (String name : group) {
            entries.put(name, entry);
        }
        groups.add(entry);
        return entry;
    }

    public Optional<HandlerEntry> resolve(String tag) {
        return Optional.ofNullable(entries.get(tag));
    }

    public boolean isRegistered(String tag) {
        return entries.containsKey(tag);
    }

    public List<String> listTags() {
        return entries.keySet().stream().sorted(TAG_ORDER).toList();
    }

    public List<List<String>> listGroups() {
        return groups.stream()
                .sorted(Comparator.comparing(HandlerEntry::tag, TAG_ORDER))
                .map(HandlerEntry::group)
                .toList();
    }

    /**
     * Returns the group of {@code tag}, canonical tag first, or an empty list
     * when the tag is not registered.
     */
    public List<String> synonymsOf(String tag) {
        HandlerEntry entry = entries.get(tag);
        return entry == null ? List.of() : entry.group();
    }
}
