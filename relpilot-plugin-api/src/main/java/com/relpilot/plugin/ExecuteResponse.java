package com.relpilot.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link Plugin#execute}. A failed publish (bad credentials, missing file) is reported here
 * with {@code success=false} and an {@code error} string, never as an exception, so the host always
 * has a structured result to log and display.
 */
public final class ExecuteResponse {

    private final boolean success;
    private final String message;
    private final String error;
    private final Map<String, Object> outputs;
    private final List<Artifact> artifacts;

    private ExecuteResponse(Builder b) {
        this.success = b.success;
        this.message = b.message != null ? b.message : "";
        this.error = b.error != null ? b.error : "";
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.outputs));
        this.artifacts = List.copyOf(b.artifacts);
    }

    public static ExecuteResponse success(String message) {
        return builder().success(true).message(message).build();
    }

    public static ExecuteResponse failure(String error) {
        return builder().success(false).error(error).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    /** Error message when {@link #isSuccess()} is false; empty otherwise. */
    public String getError() {
        return error;
    }

    /** Plugin outputs (e.g. release URL, package id); never null. */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    /** Artifacts created by the plugin, in the order the plugin reported them. */
    public List<Artifact> getArtifacts() {
        return artifacts;
    }

    public Builder toBuilder() {
        return builder().success(success).message(message).error(error).outputs(outputs).artifacts(artifacts);
    }

    @Override
    public String toString() {
        return success
                ? "ExecuteResponse{success, message=" + message + "}"
                : "ExecuteResponse{failed, error=" + error + "}";
    }

    public static final class Builder {
        private boolean success;
        private String message;
        private String error;
        private Map<String, Object> outputs = new LinkedHashMap<>();
        private List<Artifact> artifacts = new ArrayList<>();

        private Builder() {
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs != null ? new LinkedHashMap<>(outputs) : new LinkedHashMap<>();
            return this;
        }

        public Builder output(String key, Object value) {
            this.outputs.put(key, value);
            return this;
        }

        public Builder artifacts(List<Artifact> artifacts) {
            this.artifacts = artifacts != null ? new ArrayList<>(artifacts) : new ArrayList<>();
            return this;
        }

        public Builder artifact(Artifact artifact) {
            this.artifacts.add(artifact);
            return this;
        }

        public ExecuteResponse build() {
            return new ExecuteResponse(this);
        }
    }
}
