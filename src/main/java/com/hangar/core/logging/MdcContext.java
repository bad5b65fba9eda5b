package com.hangar.core.logging;

import com.hangar.core.model.Project;
import org.slf4j.MDC;

/**
 * Utility for managing Hangar-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId, String slug) {
        if (projectId != null) {
            MDC.put("projectId", projectId);
        }
        if (slug != null) {
            MDC.put("projectSlug", slug);
        }
    }

    public static void setProject(Project project) {
        setProject(project.getId(), project.getSlug());
    }

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("projectSlug");
        MDC.remove("operation");
    }
}
