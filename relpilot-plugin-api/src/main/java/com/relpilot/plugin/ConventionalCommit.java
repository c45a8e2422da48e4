package com.relpilot.plugin;

import java.util.List;

/**
 * A parsed conventional commit ({@code type(scope)!: description}).
 *
 * @param hash                commit hash
 * @param type                commit type (feat, fix, ...)
 * @param scope               optional scope
 * @param description         subject line after the type prefix
 * @param body                commit body
 * @param breaking            whether the commit is a breaking change
 * @param breakingDescription text of the BREAKING CHANGE footer
 * @param issues              referenced issues; never null
 * @param author              commit author
 * @param date                commit date (ISO yyyy-MM-dd)
 */
public record ConventionalCommit(
        String hash,
        String type,
        String scope,
        String description,
        String body,
        boolean breaking,
        String breakingDescription,
        List<String> issues,
        String author,
        String date
) {
    public ConventionalCommit {
        hash = hash != null ? hash : "";
        type = type != null ? type : "";
        scope = scope != null ? scope : "";
        description = description != null ? description : "";
        body = body != null ? body : "";
        breakingDescription = breakingDescription != null ? breakingDescription : "";
        issues = issues != null ? List.copyOf(issues) : List.of();
        author = author != null ? author : "";
        date = date != null ? date : "";
    }

    /** Convenience for the common case: hash, type and description only. */
    public static ConventionalCommit of(String hash, String type, String description) {
        return new ConventionalCommit(hash, type, "", description, "", false, "", List.of(), "", "");
    }
}
