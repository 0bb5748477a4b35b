package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;
import io.github.jakubt4.ithil.selection.FieldPredicate;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only query surface over telescope and image metadata.
 *
 * <p>Every call acquires its own connection and releases it before returning,
 * whether the query succeeded or not. Any method may throw
 * {@link io.github.jakubt4.ithil.error.StoreUnavailableException} when the store
 * cannot be reached.
 */
public interface MetadataStore {

    List<Telescope> queryTelescopes(FieldPredicate<Telescope> predicate);

    TelescopeInventory queryDistinctTelescopeFields();

    /**
     * Images of one telescope and one observing night that satisfy the predicate,
     * ordered by acquisition time.
     */
    List<Image> queryImages(FieldPredicate<Image> predicate, Telescope telescope, LocalDate dayObs);
}
