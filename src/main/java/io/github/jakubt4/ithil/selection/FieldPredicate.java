package io.github.jakubt4.ithil.selection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Conjunction of field/value equality constraints over entity type {@code E}.
 *
 * <p>Instances are immutable. Composition only ever narrows: {@link #and} adds
 * constraints and there is no disjunction. The combinators inherited from
 * {@link Predicate} return plain predicates, which store adapters cannot translate. Two predicates are equal when they
 * hold the same set of constraints, regardless of the order they were added
 * in. The predicate carries no store dependency; store adapters translate
 * {@link #constraints()} into their own query language.
 *
 * @param <E> entity type the constraints apply to
 */
public final class FieldPredicate<E> implements Predicate<E> {

    /**
     * A single {@code field == value} test.
     */
    public record Constraint<E>(Field<E> field, String value) {

        public Constraint {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }

        boolean matches(final E entity) {
            return value.equals(field.valueOf(entity));
        }

        @Override
        public String toString() {
            return field.property() + "='" + value + "'";
        }
    }

    private static final FieldPredicate<?> ALWAYS = new FieldPredicate<>(Set.of());

    private final Set<Constraint<E>> constraints;

    private FieldPredicate(final Set<Constraint<E>> constraints) {
        this.constraints = constraints;
    }

    /**
     * The neutral predicate: no constraints, matches every entity.
     */
    @SuppressWarnings("unchecked")
    public static <E> FieldPredicate<E> always() {
        return (FieldPredicate<E>) ALWAYS;
    }

    public static <E> FieldPredicate<E> where(final Field<E> field, final String value) {
        return FieldPredicate.<E>always().and(field, value);
    }

    public FieldPredicate<E> and(final Field<E> field, final String value) {
        return with(Set.of(new Constraint<>(field, value)));
    }

    public FieldPredicate<E> and(final FieldPredicate<E> other) {
        return with(other.constraints);
    }

    private FieldPredicate<E> with(final Set<Constraint<E>> added) {
        if (constraints.containsAll(added)) {
            return this;
        }
        final var merged = new LinkedHashSet<>(constraints);
        merged.addAll(added);
        return new FieldPredicate<>(Collections.unmodifiableSet(merged));
    }

    @Override
    public boolean test(final E entity) {
        return constraints.stream().allMatch(constraint -> constraint.matches(entity));
    }

    public Set<Constraint<E>> constraints() {
        return constraints;
    }

    public boolean isNeutral() {
        return constraints.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldPredicate<?> other && constraints.equals(other.constraints);
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        if (constraints.isEmpty()) {
            return "TRUE";
        }
        return constraints.stream()
                .map(Constraint::toString)
                .collect(Collectors.joining(" AND "));
    }
}
