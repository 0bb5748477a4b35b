package io.github.jakubt4.ithil.store;

import java.util.List;

/**
 * Distinct telescope attribute values known to the store, used to validate
 * selection criteria before a run.
 */
public record TelescopeInventory(List<String> sites,
                                 List<String> instruments,
                                 List<String> telescopeIds,
                                 List<String> cameraTypes) {

    public TelescopeInventory {
        sites = List.copyOf(sites);
        instruments = List.copyOf(instruments);
        telescopeIds = List.copyOf(telescopeIds);
        cameraTypes = List.copyOf(cameraTypes);
    }
}
