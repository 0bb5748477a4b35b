package io.github.jakubt4.ithil.selection;

import io.github.jakubt4.ithil.model.Image;
import io.github.jakubt4.ithil.model.Telescope;

public record SelectionPredicates(FieldPredicate<Telescope> telescopes, FieldPredicate<Image> images) {
}
