package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.selection.FieldPredicate;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;

/**
 * Translates {@link FieldPredicate} constraints into JPA criteria. Each
 * constraint's field property names an attribute of the target entity.
 */
final class Specifications {

    private Specifications() {
    }

    static <T, E> Specification<T> matching(final FieldPredicate<E> predicate) {
        return (root, query, cb) -> cb.and(predicate.constraints().stream()
                .map(constraint -> cb.equal(root.get(constraint.field().property()), constraint.value()))
                .toArray(Predicate[]::new));
    }

    static Specification<ImageEntity> takenBy(final String telescopeId) {
        return (root, query, cb) -> cb.equal(root.get("telescope").get("telescopeId"), telescopeId);
    }

    static Specification<ImageEntity> onNight(final LocalDate dayObs) {
        return (root, query, cb) -> cb.equal(root.get("dayObs"), dayObs);
    }
}
