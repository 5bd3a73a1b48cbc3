package alpha.nomagicheaders.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A mutable, ordered collection of media type parameters.<p>
 *
 * The insertion order is retained and is the order in which the parameters
 * are serialized. Parameters are addressed by name without regards to casing.
 * The list does not enforce unique names; a parameter with an already present
 * name may be added, but lookups by name always resolve the first match.<p>
 *
 * A {@code ParameterList} is owned by exactly one {@link MutableMediaType}. It
 * is not thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ParameterList implements Iterable<Parameter>
{
    private final List<Parameter> params;

    ParameterList() {
        this.params = new ArrayList<>();
    }

    ParameterList(Iterable<Parameter> copyFrom) {
        this();
        copyFrom.forEach(this::add);
    }

    /**
     * Appends the given parameter.
     *
     * @param parameter to add
     *
     * @throws NullPointerException if {@code parameter} is {@code null}
     */
    public void add(Parameter parameter) {
        params.add(requireNonNull(parameter));
    }

    /**
     * Removes the first parameter with the same name as the given parameter.<p>
     *
     * Only the name is considered. If no such parameter is present, this
     * method is a NOP.
     *
     * @param parameter whose name to remove
     *
     * @return {@code true} if a parameter was removed, otherwise {@code false}
     *
     * @throws NullPointerException if {@code parameter} is {@code null}
     */
    public boolean remove(Parameter parameter) {
        return remove(parameter.name());
    }

    /**
     * Removes the first parameter with the given name.
     *
     * @param name of parameter to remove
     *
     * @return {@code true} if a parameter was removed, otherwise {@code false}
     *
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public boolean remove(String name) {
        final int i = indexOf(name);
        if (i == -1) {
            return false;
        }
        params.remove(i);
        return true;
    }

    /**
     * Removes all parameters.
     */
    public void clear() {
        params.clear();
    }

    /**
     * Replaces the parameter at the given index.
     *
     * @param index of parameter to replace
     * @param parameter replacement
     *
     * @return the replaced parameter
     *
     * @throws NullPointerException
     *             if {@code parameter} is {@code null}
     * @throws IndexOutOfBoundsException
     *             if {@code index} is out of range
     */
    public Parameter set(int index, Parameter parameter) {
        return params.set(index, requireNonNull(parameter));
    }

    /**
     * Returns the parameter at the given index.
     *
     * @param index of parameter
     *
     * @return the parameter at the given index
     *
     * @throws IndexOutOfBoundsException
     *             if {@code index} is out of range
     */
    public Parameter get(int index) {
        return params.get(index);
    }

    /**
     * Returns the index of the first parameter with the given name.
     *
     * @param name of parameter
     *
     * @return the index, or -1 if not found
     *
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public int indexOf(String name) {
        requireNonNull(name);
        for (int i = 0; i < params.size(); ++i) {
            if (params.get(i).hasName(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the first parameter with the given name.
     *
     * @param name of parameter
     *
     * @return the first parameter with the given name, if present
     *
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<Parameter> first(String name) {
        final int i = indexOf(name);
        return i == -1 ? Optional.empty() : Optional.of(params.get(i));
    }

    /**
     * Returns the number of parameters.
     *
     * @return the number of parameters
     */
    public int size() {
        return params.size();
    }

    /**
     * Returns {@code true} if there are no parameters.
     *
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return params.isEmpty();
    }

    /**
     * Returns a sequential stream of the parameters.
     *
     * @return a sequential stream of the parameters
     */
    public Stream<Parameter> stream() {
        return params.stream();
    }

    /**
     * Returns an unmodifiable view of this list.<p>
     *
     * The view reflects subsequent modifications made to this list.
     *
     * @return an unmodifiable view of this list
     */
    public List<Parameter> asList() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Returns an iterator over the parameters, in insertion order.<p>
     *
     * The iterator supports removal.
     *
     * @return an iterator
     */
    @Override
    public Iterator<Parameter> iterator() {
        return params.iterator();
    }

    @Override
    public String toString() {
        return params.toString();
    }
}
