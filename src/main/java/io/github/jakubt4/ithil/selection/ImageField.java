package io.github.jakubt4.ithil.selection;

import io.github.jakubt4.ithil.model.Image;

import java.util.function.Function;

public enum ImageField implements Field<Image> {

    FILTER_NAME("filterName", Image::filterName),
    CCDSUM("ccdsum", Image::ccdsum),
    IMAGE_TYPE("imageType", Image::imageType);

    private final String property;
    private final Function<Image, String> accessor;

    ImageField(final String property, final Function<Image, String> accessor) {
        this.property = property;
        this.accessor = accessor;
    }

    @Override
    public String property() {
        return property;
    }

    @Override
    public String valueOf(final Image image) {
        return accessor.apply(image);
    }
}
