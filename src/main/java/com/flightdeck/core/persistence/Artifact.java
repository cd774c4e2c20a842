package com.flightdeck.core.persistence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Something an agent produced that is worth keeping apart from the conversation,
 * currently the fenced code blocks of its replies.
 */
public record Artifact(
    String id,
    String agentId,
    String type,
    String title,
    String content,
    String language,
    Instant timestamp
) {

    public static final String TYPE_CODE = "code";

    private static final Pattern CODE_FENCE = Pattern.compile("```([\\w+#.-]*)[^\\n]*\\n(.*?)```", Pattern.DOTALL);

    /**
     * Fenced code blocks from an assistant reply. Tool-call blocks are not artifacts.
     */
    public static List<Artifact> extractCode(String agentId, String text, Instant at) {
        var artifacts = new ArrayList<Artifact>();
        if (text == null) {
            return artifacts;
        }
        Matcher m = CODE_FENCE.matcher(text);
        while (m.find()) {
            String language = m.group(1);
            String body = m.group(2).strip();
            if ("tool".equals(language) || body.isEmpty()) {
                continue;
            }
            String lang = language.isEmpty() ? "text" : language;
            artifacts.add(new Artifact("artifact-" + UUID.randomUUID().toString().substring(0, 8), agentId,
                    TYPE_CODE, lang + " snippet", body, lang, at));
        }
        return artifacts;
    }
}
