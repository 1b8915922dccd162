package com.mimecast.lodestar.client;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Versions supported by a homeserver.
 * <p>Only used to validate a delegated homeserver answers {@code /_matrix/client/versions}.
 */
public class Versions {

    /**
     * Specification versions supported.
     */
    @SerializedName("versions")
    private List<String> versions;

    /**
     * Unstable features and whether they are enabled.
     */
    @SerializedName("unstable_features")
    private Map<String, Boolean> unstableFeatures;

    /**
     * Gets versions.
     *
     * @return List of version strings, null when absent.
     */
    public List<String> getVersions() {
        return versions;
    }

    /**
     * Gets unstable features.
     *
     * @return Map of feature name to enabled flag, empty when absent.
     */
    public Map<String, Boolean> getUnstableFeatures() {
        return unstableFeatures != null ? unstableFeatures : Collections.emptyMap();
    }
}
