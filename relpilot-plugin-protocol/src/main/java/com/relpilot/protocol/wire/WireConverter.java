package com.relpilot.protocol.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relpilot.plugin.Artifact;
import com.relpilot.plugin.CategorizedChanges;
import com.relpilot.plugin.ConventionalCommit;
import com.relpilot.plugin.Hook;
import com.relpilot.plugin.Info;
import com.relpilot.plugin.ReleaseContext;
import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.ValidationError;
import com.relpilot.plugin.progress.LogLevel;
import com.relpilot.plugin.progress.LogNotification;
import com.relpilot.plugin.progress.Progress;
import com.relpilot.plugin.progress.ProgressKind;
import com.relpilot.plugin.progress.ProgressToken;
import com.relpilot.plugin.progress.ProgressValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between the plugin API types and their protobuf messages. Every method accepts null
 * and maps it to the empty value of the other side; null strings travel as {@code ""}.
 */
public final class WireConverter {

    private WireConverter() {
    }

    /** {@code null} maps to {@link WireHook#HOOK_UNSPECIFIED}. */
    public static WireHook toWire(Hook hook) {
        if (hook == null) return WireHook.HOOK_UNSPECIFIED;
        return switch (hook) {
            case PRE_INIT -> WireHook.HOOK_PRE_INIT;
            case POST_INIT -> WireHook.HOOK_POST_INIT;
            case PRE_PLAN -> WireHook.HOOK_PRE_PLAN;
            case POST_PLAN -> WireHook.HOOK_POST_PLAN;
            case PRE_VERSION -> WireHook.HOOK_PRE_VERSION;
            case POST_VERSION -> WireHook.HOOK_POST_VERSION;
            case PRE_NOTES -> WireHook.HOOK_PRE_NOTES;
            case POST_NOTES -> WireHook.HOOK_POST_NOTES;
            case PRE_APPROVE -> WireHook.HOOK_PRE_APPROVE;
            case POST_APPROVE -> WireHook.HOOK_POST_APPROVE;
            case PRE_PUBLISH -> WireHook.HOOK_PRE_PUBLISH;
            case POST_PUBLISH -> WireHook.HOOK_POST_PUBLISH;
            case ON_SUCCESS -> WireHook.HOOK_ON_SUCCESS;
            case ON_ERROR -> WireHook.HOOK_ON_ERROR;
        };
    }

    /** Unspecified, unrecognized and {@code null} hooks map to {@code null}. */
    public static Hook fromWire(WireHook hook) {
        if (hook == null) return null;
        return switch (hook) {
            case HOOK_PRE_INIT -> Hook.PRE_INIT;
            case HOOK_POST_INIT -> Hook.POST_INIT;
            case HOOK_PRE_PLAN -> Hook.PRE_PLAN;
            case HOOK_POST_PLAN -> Hook.POST_PLAN;
            case HOOK_PRE_VERSION -> Hook.PRE_VERSION;
            case HOOK_POST_VERSION -> Hook.POST_VERSION;
            case HOOK_PRE_NOTES -> Hook.PRE_NOTES;
            case HOOK_POST_NOTES -> Hook.POST_NOTES;
            case HOOK_PRE_APPROVE -> Hook.PRE_APPROVE;
            case HOOK_POST_APPROVE -> Hook.POST_APPROVE;
            case HOOK_PRE_PUBLISH -> Hook.PRE_PUBLISH;
            case HOOK_POST_PUBLISH -> Hook.POST_PUBLISH;
            case HOOK_ON_SUCCESS -> Hook.ON_SUCCESS;
            case HOOK_ON_ERROR -> Hook.ON_ERROR;
            default -> null;
        };
    }

    public static ReleaseContextMessage toWire(ReleaseContext ctx) {
        if (ctx == null) return ReleaseContextMessage.getDefaultInstance();
        ReleaseContextMessage.Builder builder = ReleaseContextMessage.newBuilder()
                .setVersion(orEmpty(ctx.getVersion()))
                .setPreviousVersion(orEmpty(ctx.getPreviousVersion()))
                .setTagName(orEmpty(ctx.getTagName()))
                .setReleaseType(orEmpty(ctx.getReleaseType()))
                .setRepositoryUrl(orEmpty(ctx.getRepositoryUrl()))
                .setRepositoryOwner(orEmpty(ctx.getRepositoryOwner()))
                .setRepositoryName(orEmpty(ctx.getRepositoryName()))
                .setBranch(orEmpty(ctx.getBranch()))
                .setCommitSha(orEmpty(ctx.getCommitSha()))
                .setChangelog(orEmpty(ctx.getChangelog()))
                .setReleaseNotes(orEmpty(ctx.getReleaseNotes()));
        if (ctx.getChanges() != null) {
            builder.setChanges(toWireChanges(ctx.getChanges()));
        }
        for (Map.Entry<String, String> e : ctx.getEnvironment().entrySet()) {
            if (e.getKey() != null) {
                builder.putEnvironment(e.getKey(), orEmpty(e.getValue()));
            }
        }
        return builder.build();
    }

    public static ReleaseContext fromWire(ReleaseContextMessage msg) {
        if (msg == null) return ReleaseContext.empty();
        return ReleaseContext.builder()
                .version(msg.getVersion())
                .previousVersion(msg.getPreviousVersion())
                .tagName(msg.getTagName())
                .releaseType(msg.getReleaseType())
                .repositoryUrl(msg.getRepositoryUrl())
                .repositoryOwner(msg.getRepositoryOwner())
                .repositoryName(msg.getRepositoryName())
                .branch(msg.getBranch())
                .commitSha(msg.getCommitSha())
                .changelog(msg.getChangelog())
                .releaseNotes(msg.getReleaseNotes())
                .changes(msg.hasChanges() ? fromWireChanges(msg.getChanges()) : null)
                .environment(msg.getEnvironmentMap())
                .build();
    }

    public static CategorizedChangesMessage toWireChanges(CategorizedChanges changes) {
        if (changes == null) return CategorizedChangesMessage.getDefaultInstance();
        return CategorizedChangesMessage.newBuilder()
                .addAllFeatures(toWireCommits(changes.features()))
                .addAllFixes(toWireCommits(changes.fixes()))
                .addAllBreaking(toWireCommits(changes.breaking()))
                .addAllPerformance(toWireCommits(changes.performance()))
                .addAllRefactor(toWireCommits(changes.refactor()))
                .addAllDocs(toWireCommits(changes.docs()))
                .addAllOther(toWireCommits(changes.other()))
                .build();
    }

    public static CategorizedChanges fromWireChanges(CategorizedChangesMessage msg) {
        if (msg == null) return null;
        return new CategorizedChanges(
                fromWireCommits(msg.getFeaturesList()),
                fromWireCommits(msg.getFixesList()),
                fromWireCommits(msg.getBreakingList()),
                fromWireCommits(msg.getPerformanceList()),
                fromWireCommits(msg.getRefactorList()),
                fromWireCommits(msg.getDocsList()),
                fromWireCommits(msg.getOtherList()));
    }

    static List<ConventionalCommitMessage> toWireCommits(List<ConventionalCommit> commits) {
        if (commits == null) return List.of();
        List<ConventionalCommitMessage> result = new ArrayList<>(commits.size());
        for (ConventionalCommit c : commits) {
            if (c == null) continue;
            ConventionalCommitMessage.Builder builder = ConventionalCommitMessage.newBuilder()
                    .setHash(orEmpty(c.hash()))
                    .setType(orEmpty(c.type()))
                    .setScope(orEmpty(c.scope()))
                    .setDescription(orEmpty(c.description()))
                    .setBody(orEmpty(c.body()))
                    .setBreaking(c.breaking())
                    .setBreakingDescription(orEmpty(c.breakingDescription()))
                    .setAuthor(orEmpty(c.author()))
                    .setDate(orEmpty(c.date()));
            for (String issue : c.issues()) {
                builder.addIssues(orEmpty(issue));
            }
            result.add(builder.build());
        }
        return result;
    }

    static List<ConventionalCommit> fromWireCommits(List<ConventionalCommitMessage> commits) {
        if (commits == null) return List.of();
        List<ConventionalCommit> result = new ArrayList<>(commits.size());
        for (ConventionalCommitMessage c : commits) {
            result.add(new ConventionalCommit(c.getHash(), c.getType(), c.getScope(), c.getDescription(), c.getBody(),
                    c.getBreaking(), c.getBreakingDescription(), List.copyOf(c.getIssuesList()), c.getAuthor(),
                    c.getDate()));
        }
        return result;
    }

    /** Index i of the result corresponds to index i of the input; null elements are skipped. */
    public static List<ArtifactMessage> toWireArtifacts(List<Artifact> artifacts) {
        if (artifacts == null) return List.of();
        List<ArtifactMessage> result = new ArrayList<>(artifacts.size());
        for (Artifact a : artifacts) {
            if (a == null) continue;
            result.add(ArtifactMessage.newBuilder()
                    .setName(orEmpty(a.name()))
                    .setPath(orEmpty(a.path()))
                    .setType(orEmpty(a.type()))
                    .setSize(a.size())
                    .setChecksum(orEmpty(a.checksum()))
                    .build());
        }
        return result;
    }

    /** Index i of the result corresponds to index i of the input. */
    public static List<Artifact> fromWireArtifacts(List<ArtifactMessage> artifacts) {
        if (artifacts == null) return List.of();
        List<Artifact> result = new ArrayList<>(artifacts.size());
        for (ArtifactMessage a : artifacts) {
            result.add(new Artifact(a.getName(), a.getPath(), a.getType(), a.getSize(), a.getChecksum()));
        }
        return result;
    }

    public static PluginInfoMessage toWire(Info info) {
        if (info == null) info = Info.empty();
        PluginInfoMessage.Builder builder = PluginInfoMessage.newBuilder()
                .setName(orEmpty(info.name()))
                .setVersion(orEmpty(info.version()))
                .setDescription(orEmpty(info.description()))
                .setAuthor(orEmpty(info.author()))
                .setConfigSchema(orEmpty(info.configSchema()));
        for (Hook hook : info.hooks()) {
            if (hook != null) builder.addHooks(hook.value());
        }
        return builder.build();
    }

    /** Hook strings this side does not know are dropped. */
    public static Info fromWire(PluginInfoMessage msg) {
        if (msg == null) return Info.empty();
        List<Hook> hooks = new ArrayList<>();
        for (String value : msg.getHooksList()) {
            Hook hook = Hook.fromValue(value);
            if (hook != null) hooks.add(hook);
        }
        return new Info(msg.getName(), msg.getVersion(), msg.getDescription(), msg.getAuthor(), hooks,
                msg.getConfigSchema());
    }

    public static ValidateResponseMessage toWire(ValidateResponse resp) {
        if (resp == null) return ValidateResponseMessage.newBuilder().setValid(true).build();
        ValidateResponseMessage.Builder builder = ValidateResponseMessage.newBuilder().setValid(resp.valid());
        for (ValidationError e : resp.errors()) {
            if (e == null) continue;
            builder.addErrors(ValidationErrorMessage.newBuilder()
                    .setField(orEmpty(e.field()))
                    .setMessage(orEmpty(e.message()))
                    .setCode(orEmpty(e.code())));
        }
        return builder.build();
    }

    public static ValidateResponse fromWire(ValidateResponseMessage msg) {
        if (msg == null) return ValidateResponse.ok();
        List<ValidationError> errors = new ArrayList<>(msg.getErrorsCount());
        for (ValidationErrorMessage e : msg.getErrorsList()) {
            errors.add(new ValidationError(e.getField(), e.getMessage(), e.getCode()));
        }
        return new ValidateResponse(msg.getValid(), errors);
    }

    public static ProgressMessage toWire(Progress progress) {
        ProgressValue value = progress.value();
        return ProgressMessage.newBuilder()
                .setToken(progress.token().value())
                .setKind(value.kind().toValue())
                .setTitle(orEmpty(value.title()))
                .setMessage(orEmpty(value.message()))
                .setPercentage(value.percentage())
                .setCancellable(value.cancellable())
                .setTotalSteps(progress.totalSteps())
                .build();
    }

    /** Returns {@code null} for a message without a token. Unknown kinds read as {@code report}. */
    public static Progress fromWire(ProgressMessage msg) {
        if (msg == null || msg.getToken().isEmpty()) return null;
        ProgressValue value = new ProgressValue(ProgressKind.fromValue(msg.getKind()), emptyToNull(msg.getTitle()),
                emptyToNull(msg.getMessage()), msg.getPercentage(), msg.getCancellable());
        return new Progress(ProgressToken.of(msg.getToken()), value, msg.getTotalSteps());
    }

    public static LogMessage toWire(LogNotification notification) throws JsonProcessingException {
        return LogMessage.newBuilder()
                .setLevel(notification.level().toValue())
                .setMessage(orEmpty(notification.message()))
                .setLogger(orEmpty(notification.logger()))
                .setData(notification.data() != null ? encodeMap(notification.data()) : "")
                .build();
    }

    /**
     * Unknown levels read as {@code info}.
     *
     * @throws JsonProcessingException when the data field is not a JSON object
     */
    public static LogNotification fromWire(LogMessage msg) throws JsonProcessingException {
        Map<String, Object> data = msg.getData().isEmpty() ? null : decodeMap(msg.getData());
        return new LogNotification(LogLevel.fromValue(msg.getLevel()), msg.getMessage(),
                emptyToNull(msg.getLogger()), data);
    }

    /**
     * Wraps progress or log params in a notification message.
     *
     * @throws IllegalArgumentException when {@code params} is neither
     * @throws JsonProcessingException  when log data cannot be encoded
     */
    public static NotificationMessage toNotification(String method, Object params) throws JsonProcessingException {
        NotificationMessage.Builder builder = NotificationMessage.newBuilder().setMethod(orEmpty(method));
        if (params instanceof Progress progress) {
            builder.setProgress(toWire(progress));
        } else if (params instanceof LogNotification notification) {
            builder.setLog(toWire(notification));
        } else {
            throw new IllegalArgumentException("unsupported notification params: "
                    + (params == null ? "null" : params.getClass().getName()));
        }
        return builder.build();
    }

    /**
     * Returns the {@link Progress} or {@link LogNotification} carried by {@code msg}, or
     * {@code null} when it carries neither or a progress event without a token.
     *
     * @throws JsonProcessingException when log data is not a JSON object
     */
    public static Object fromNotification(NotificationMessage msg) throws JsonProcessingException {
        return switch (msg.getParamsCase()) {
            case PROGRESS -> fromWire(msg.getProgress());
            case LOG -> fromWire(msg.getLog());
            default -> null;
        };
    }

    /** Encodes a free-form map as a JSON string; null encodes as {@code {}}. */
    public static String encodeMap(Map<String, Object> map) throws JsonProcessingException {
        return ProtocolJson.MAPPER.writeValueAsString(map != null ? map : Map.of());
    }

    /**
     * Decodes a JSON object string. Null or blank input decodes to an empty map.
     *
     * @throws JsonProcessingException when the text is not a JSON object
     */
    public static Map<String, Object> decodeMap(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        Map<String, Object> map = ProtocolJson.MAPPER.readValue(json, ProtocolJson.MAP_TYPE);
        return map != null ? map : new LinkedHashMap<>();
    }

    private static String orEmpty(String s) {
        return s != null ? s : "";
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
