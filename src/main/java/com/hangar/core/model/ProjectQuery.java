package com.hangar.core.model;

/**
 * Filters for listing projects. All fields are optional.
 *
 * @param status     exact status match
 * @param clientName case-insensitive substring of the client name
 * @param search     case-insensitive substring of name, slug or description
 * @param limit      max results, {@code null} or non-positive for all
 * @param offset     results to skip
 */
public record ProjectQuery(
    ProjectStatus status,
    String clientName,
    String search,
    Integer limit,
    Integer offset
) {
    public static ProjectQuery all() {
        return new ProjectQuery(null, null, null, null, null);
    }
}
