package io.github.jakubt4.ithil.selection;

/**
 * A filterable attribute of entity type {@code E}.
 *
 * <p>{@link #property()} is the attribute name the store adapter resolves in its
 * own query language; {@link #valueOf} reads the same attribute from an
 * in-memory entity.
 */
public interface Field<E> {

    String property();

    String valueOf(E entity);
}
