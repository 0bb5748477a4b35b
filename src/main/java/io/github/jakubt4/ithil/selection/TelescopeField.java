package io.github.jakubt4.ithil.selection;

import io.github.jakubt4.ithil.model.Telescope;

import java.util.function.Function;

public enum TelescopeField implements Field<Telescope> {

    SITE("site", Telescope::site),
    INSTRUMENT("instrument", Telescope::instrument),
    TELESCOPE_ID("telescopeId", Telescope::telescopeId),
    CAMERA_TYPE("cameraType", Telescope::cameraType);

    private final String property;
    private final Function<Telescope, String> accessor;

    TelescopeField(final String property, final Function<Telescope, String> accessor) {
        this.property = property;
        this.accessor = accessor;
    }

    @Override
    public String property() {
        return property;
    }

    @Override
    public String valueOf(final Telescope telescope) {
        return accessor.apply(telescope);
    }
}
