package com.hangar.runtime;

import com.hangar.config.HangarProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Labels attached to every project container: management markers for Hangar
 * and routing metadata the Traefik edge proxy reads to configure itself.
 */
public final class ContainerLabels {

    public static final String MANAGED = "hangar.managed";
    public static final String PROJECT_ID = "hangar.project-id";
    public static final String PROJECT_SLUG = "hangar.project-slug";

    private ContainerLabels() {}

    public static Map<String, String> managedMarker() {
        return Map.of(MANAGED, "true");
    }

    public static Map<String, String> forProject(String projectId, String slug,
                                                 HangarProperties.Domain domain, int containerPort) {
        var labels = new LinkedHashMap<String, String>();
        labels.put(MANAGED, "true");
        labels.put(PROJECT_ID, projectId);
        labels.put(PROJECT_SLUG, slug);

        String router = "traefik.http.routers." + slug;
        labels.put("traefik.enable", "true");
        labels.put(router + ".rule", "Host(`" + slug + "." + domain.getBaseDomain() + "`)");
        labels.put(router + ".entrypoints", domain.isUseHttps() ? "websecure" : "web");
        labels.put("traefik.http.services." + slug + ".loadbalancer.server.port", String.valueOf(containerPort));
        if (domain.isUseHttps()) {
            labels.put(router + ".tls", "true");
            labels.put(router + ".tls.certresolver", domain.getCertResolver());
        }
        return labels;
    }
}
