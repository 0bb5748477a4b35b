package io.github.jakubt4.ithil.model;

/**
 * A site/instrument/camera combination as registered in the metadata store.
 *
 * @param telescopeId unique telescope identifier (e.g. "1m0-009")
 * @param site        site code (e.g. "lsc")
 * @param instrument  instrument code (e.g. "kb78")
 * @param cameraType  camera family (e.g. "Sinistro", "SBig")
 */
public record Telescope(String telescopeId, String site, String instrument, String cameraType) {
}
