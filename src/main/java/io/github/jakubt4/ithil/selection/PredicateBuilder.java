package io.github.jakubt4.ithil.selection;

import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;
import org.springframework.stereotype.Component;

/**
 * Turns {@link SelectionCriteria} into one predicate over telescopes and one
 * over images. Each non-blank criterion becomes an exact-match constraint;
 * everything else is left unconstrained.
 */
@Component
public class PredicateBuilder {

    public SelectionPredicates build(final SelectionCriteria criteria) {
        var telescopes = FieldPredicate.<Telescope>always();
        telescopes = andIfSet(telescopes, TelescopeField.SITE, criteria.site());
        telescopes = andIfSet(telescopes, TelescopeField.INSTRUMENT, criteria.instrument());
        telescopes = andIfSet(telescopes, TelescopeField.TELESCOPE_ID, criteria.telescopeId());
        telescopes = andIfSet(telescopes, TelescopeField.CAMERA_TYPE, criteria.cameraType());

        var images = FieldPredicate.<Image>always();
        images = andIfSet(images, ImageField.FILTER_NAME, criteria.filterName());
        if (isSet(criteria.binning())) {
            images = images.and(ImageField.CCDSUM, Binning.toNative(criteria.binning()));
        }
        images = andIfSet(images, ImageField.IMAGE_TYPE, criteria.imageType());

        return new SelectionPredicates(telescopes, images);
    }

    private static <E> FieldPredicate<E> andIfSet(final FieldPredicate<E> predicate,
                                                  final Field<E> field,
                                                  final String value) {
        return isSet(value) ? predicate.and(field, value.trim()) : predicate;
    }

    private static boolean isSet(final String value) {
        return value != null && !value.isBlank();
    }
}
