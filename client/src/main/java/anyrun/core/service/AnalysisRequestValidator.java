package anyrun.core.service;

import java.net.URI;
import java.util.regex.Pattern;

import anyrun.core.model.analysis.AnalysisListRequest;
import anyrun.core.model.analysis.AnalysisRequest;
import anyrun.core.model.common.ValidationResult;

/**
 * Structural checks applied before a request is sent.
 *
 * <p>Rejected requests never reach the rate limiter or the network. Domain rules that depend
 * on the sandbox environment (which OS supports which browser, for example) are left to the
 * service.
 */
public class AnalysisRequestValidator {

    static final int MAX_USER_TAGS = 8;
    private static final Pattern USER_TAG = Pattern.compile("[a-zA-Z0-9-]{1,16}");

    public ValidationResult validate(AnalysisRequest request) {
        if (request == null) {
            return ValidationResult.invalid("analysis request is required");
        }
        switch (request.objectType()) {
            case FILE -> {
                if (request.content() == null || request.content().length == 0) {
                    return ValidationResult.invalid("file content is required when obj_type is file");
                }
            }
            case URL, DOWNLOAD -> {
                if (!isHttpUrl(request.url())) {
                    return ValidationResult.invalid(
                            "obj_url must be an http or https URL when obj_type is " + request.objectType().value());
                }
            }
            case RERUN -> {
                if (request.rerunTaskId() == null || request.rerunTaskId().isBlank()) {
                    return ValidationResult.invalid("task_rerun_uuid is required when obj_type is rerun");
                }
            }
        }
        return validateTags(request);
    }

    public ValidationResult validate(AnalysisListRequest request) {
        if (request.skip() < 0) {
            return ValidationResult.invalid("skip must not be negative");
        }
        if (request.limit() < 1 || request.limit() > AnalysisListRequest.MAX_LIMIT) {
            return ValidationResult.invalid("limit must be between 1 and " + AnalysisListRequest.MAX_LIMIT);
        }
        return ValidationResult.valid();
    }

    public ValidationResult validateTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return ValidationResult.invalid("task id is required");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateTags(AnalysisRequest request) {
        final var tags = request.userTags();
        if (tags.size() > MAX_USER_TAGS) {
            return ValidationResult.invalid("at most " + MAX_USER_TAGS + " user tags are allowed");
        }
        for (var tag : tags) {
            if (tag == null || !USER_TAG.matcher(tag).matches()) {
                return ValidationResult.invalid(
                        "user tag '" + tag + "' must be 1 to 16 characters of a-z, A-Z, 0-9 or '-'");
            }
        }
        return ValidationResult.valid();
    }

    private static boolean isHttpUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            final var uri = URI.create(value.trim());
            final var scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
