package com.hangar.vault;

import com.hangar.core.model.Credentials;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Renders vault records as an operator-readable text report.
 */
@Component
public class CredentialReport {

    private final Clock clock;

    public CredentialReport(Clock clock) {
        this.clock = clock;
    }

    public String render(List<Credentials> credentials) {
        var sb = new StringBuilder();
        sb.append("# PocketBase Database Credentials\n");
        sb.append("# Generated: ").append(clock.instant()).append('\n');
        sb.append("# KEEP THIS FILE SECURE - DO NOT COMMIT TO VERSION CONTROL\n\n");
        for (Credentials c : credentials) {
            String url = baseUrl(c.domain());
            sb.append("## ").append(c.projectName()).append(" (").append(c.projectSlug()).append(")\n");
            sb.append("Database ID: ").append(c.projectId()).append('\n');
            sb.append("Domain: ").append(url).append('\n');
            sb.append("Admin URL: ").append(url).append("/_/\n");
            sb.append("Admin Email: ").append(c.adminEmail()).append('\n');
            sb.append("Admin Password: ").append(c.adminPassword()).append('\n');
            sb.append("Created: ").append(c.createdAt()).append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Stored domains are either a bare host or a full URL (localhost projects).
     */
    private static String baseUrl(String domain) {
        if (domain == null) return "";
        return domain.startsWith("http://") || domain.startsWith("https://") ? domain : "https://" + domain;
    }
}
