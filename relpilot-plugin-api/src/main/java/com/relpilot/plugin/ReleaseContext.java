package com.relpilot.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Information about the release being processed. Built by the host before each
 * {@link Plugin#execute} call; read-only from the plugin's perspective.
 */
public final class ReleaseContext {

    private static final ReleaseContext EMPTY = builder().build();

    private final String version;
    private final String previousVersion;
    private final String tagName;
    private final String releaseType;
    private final String repositoryUrl;
    private final String repositoryOwner;
    private final String repositoryName;
    private final String branch;
    private final String commitSha;
    private final String changelog;
    private final String releaseNotes;
    private final CategorizedChanges changes;
    private final Map<String, String> environment;

    private ReleaseContext(Builder b) {
        this.version = b.version;
        this.previousVersion = b.previousVersion;
        this.tagName = b.tagName;
        this.releaseType = b.releaseType;
        this.repositoryUrl = b.repositoryUrl;
        this.repositoryOwner = b.repositoryOwner;
        this.repositoryName = b.repositoryName;
        this.branch = b.branch;
        this.commitSha = b.commitSha;
        this.changelog = b.changelog;
        this.releaseNotes = b.releaseNotes;
        this.changes = b.changes;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(b.environment));
    }

    public static ReleaseContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Release version, e.g. "1.2.3". */
    public String getVersion() {
        return version;
    }

    public String getPreviousVersion() {
        return previousVersion;
    }

    /** Full tag name, e.g. "v1.2.3". */
    public String getTagName() {
        return tagName;
    }

    /** major, minor or patch. */
    public String getReleaseType() {
        return releaseType;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public String getRepositoryOwner() {
        return repositoryOwner;
    }

    public String getRepositoryName() {
        return repositoryName;
    }

    public String getBranch() {
        return branch;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public String getChangelog() {
        return changelog;
    }

    public String getReleaseNotes() {
        return releaseNotes;
    }

    /** Categorized commits, or null when the host did not compute them. */
    public CategorizedChanges getChanges() {
        return changes;
    }

    /** Filtered environment variables; never null. */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Builder toBuilder() {
        return builder()
                .version(version)
                .previousVersion(previousVersion)
                .tagName(tagName)
                .releaseType(releaseType)
                .repositoryUrl(repositoryUrl)
                .repositoryOwner(repositoryOwner)
                .repositoryName(repositoryName)
                .branch(branch)
                .commitSha(commitSha)
                .changelog(changelog)
                .releaseNotes(releaseNotes)
                .changes(changes)
                .environment(environment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReleaseContext that = (ReleaseContext) o;
        return version.equals(that.version)
                && previousVersion.equals(that.previousVersion)
                && tagName.equals(that.tagName)
                && releaseType.equals(that.releaseType)
                && repositoryUrl.equals(that.repositoryUrl)
                && repositoryOwner.equals(that.repositoryOwner)
                && repositoryName.equals(that.repositoryName)
                && branch.equals(that.branch)
                && commitSha.equals(that.commitSha)
                && changelog.equals(that.changelog)
                && releaseNotes.equals(that.releaseNotes)
                && Objects.equals(changes, that.changes)
                && environment.equals(that.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, previousVersion, tagName, releaseType, repositoryUrl, repositoryOwner,
                repositoryName, branch, commitSha, changelog, releaseNotes, changes, environment);
    }

    @Override
    public String toString() {
        return "ReleaseContext{version=" + version + ", tag=" + tagName + ", branch=" + branch + "}";
    }

    public static final class Builder {
        private String version = "";
        private String previousVersion = "";
        private String tagName = "";
        private String releaseType = "";
        private String repositoryUrl = "";
        private String repositoryOwner = "";
        private String repositoryName = "";
        private String branch = "";
        private String commitSha = "";
        private String changelog = "";
        private String releaseNotes = "";
        private CategorizedChanges changes;
        private Map<String, String> environment = Map.of();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = nonNull(version);
            return this;
        }

        public Builder previousVersion(String previousVersion) {
            this.previousVersion = nonNull(previousVersion);
            return this;
        }

        public Builder tagName(String tagName) {
            this.tagName = nonNull(tagName);
            return this;
        }

        public Builder releaseType(String releaseType) {
            this.releaseType = nonNull(releaseType);
            return this;
        }

        public Builder repositoryUrl(String repositoryUrl) {
            this.repositoryUrl = nonNull(repositoryUrl);
            return this;
        }

        public Builder repositoryOwner(String repositoryOwner) {
            this.repositoryOwner = nonNull(repositoryOwner);
            return this;
        }

        public Builder repositoryName(String repositoryName) {
            this.repositoryName = nonNull(repositoryName);
            return this;
        }

        public Builder branch(String branch) {
            this.branch = nonNull(branch);
            return this;
        }

        public Builder commitSha(String commitSha) {
            this.commitSha = nonNull(commitSha);
            return this;
        }

        public Builder changelog(String changelog) {
            this.changelog = nonNull(changelog);
            return this;
        }

        public Builder releaseNotes(String releaseNotes) {
            this.releaseNotes = nonNull(releaseNotes);
            return this;
        }

        public Builder changes(CategorizedChanges changes) {
            this.changes = changes;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public ReleaseContext build() {
            return new ReleaseContext(this);
        }

        private static String nonNull(String s) {
            return s != null ? s : "";
        }
    }
}
