package com.relpilot.plugin;

import java.util.List;

/**
 * Commits of a release grouped into the seven categories plugins understand.
 * Categories the host tracks separately (tests, build, ci, chores, reverts) are folded into {@code other}.
 */
public record CategorizedChanges(
        List<ConventionalCommit> features,
        List<ConventionalCommit> fixes,
        List<ConventionalCommit> breaking,
        List<ConventionalCommit> performance,
        List<ConventionalCommit> refactor,
        List<ConventionalCommit> docs,
        List<ConventionalCommit> other
) {
    public CategorizedChanges {
        features = features != null ? List.copyOf(features) : List.of();
        fixes = fixes != null ? List.copyOf(fixes) : List.of();
        breaking = breaking != null ? List.copyOf(breaking) : List.of();
        performance = performance != null ? List.copyOf(performance) : List.of();
        refactor = refactor != null ? List.copyOf(refactor) : List.of();
        docs = docs != null ? List.copyOf(docs) : List.of();
        other = other != null ? List.copyOf(other) : List.of();
    }

    public static CategorizedChanges empty() {
        return new CategorizedChanges(null, null, null, null, null, null, null);
    }

    public int size() {
        return features.size() + fixes.size() + breaking.size() + performance.size()
                + refactor.size() + docs.size() + other.size();
    }
}
