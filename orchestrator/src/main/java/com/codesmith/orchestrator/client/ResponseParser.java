package com.codesmith.orchestrator.client;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the generated code out of a model's text reply.
 *
 * Models usually wrap code in a markdown fence, sometimes with prose around
 * it and sometimes with more than one fence. A fence labelled with the target
 * language wins; otherwise the first fence is used.
 */
public final class ResponseParser {

    // ```lang ... ``` with an optional label; group 1 = label, group 2 = body
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```([\\w#+.-]*)[^\\n]*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Code from the best matching fence, or empty if the reply has no fence.
     */
    public static Optional<String> extractCodeBlock(String response, String language) {
        if (response == null) {
            return Optional.empty();
        }
        Set<String> labels = labelsFor(language);
        Matcher m = CODE_BLOCK.matcher(response);
        String first = null;
        while (m.find()) {
            String body = m.group(2).strip();
            if (labels.contains(m.group(1).toLowerCase(Locale.ROOT))) {
                return Optional.of(body);
            }
            if (first == null) {
                first = body;
            }
        }
        return Optional.ofNullable(first);
    }

    /**
     * The artifact to validate: the fenced code if there is any, else the
     * whole reply with surrounding whitespace removed.
     */
    public static String extractArtifact(String response, String language) {
        return extractCodeBlock(response, language)
                .orElseGet(() -> response == null ? "" : response.strip());
    }

    private static Set<String> labelsFor(String language) {
        if (language == null) {
            return Set.of();
        }
        String lang = language.toLowerCase(Locale.ROOT);
        return switch (lang) {
            case "csharp", "c#", "cs"         -> Set.of("csharp", "c#", "cs");
            case "javascript", "js"           -> Set.of("javascript", "js");
            case "typescript", "ts"           -> Set.of("typescript", "ts");
            case "python", "py"               -> Set.of("python", "py");
            case "kotlin", "kt"               -> Set.of("kotlin", "kt");
            default                           -> Set.of(lang);
        };
    }
}
