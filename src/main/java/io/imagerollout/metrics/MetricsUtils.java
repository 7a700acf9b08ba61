package io.imagerollout.metrics;

import io.imagerollout.enums.EntityKind;

import java.util.HashMap;
import java.util.Map;

import static io.imagerollout.metrics.MetricsConstants.ENTITY_KIND_TAG;
import static io.imagerollout.metrics.MetricsConstants.SITE_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    /**
     * Builds a map of metrics tags holding the site identifier.
     *
     * @param siteId the site identifier, may be null for site-less meters
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildSiteTags(String siteId) {
        Map<String, String> tags = new HashMap<>();
        tags.put(SITE_TAG, siteId != null ? siteId : "none");
        return tags;
    }

    /**
     * Builds a map of metrics tags including site identifier and entity kind.
     *
     * @param siteId the site identifier
     * @param kind the kind of desktop entity
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildSiteTags(String siteId, EntityKind kind) {
        Map<String, String> tags = buildSiteTags(siteId);
        tags.put(ENTITY_KIND_TAG, kind.getValue());
        return tags;
    }
}
