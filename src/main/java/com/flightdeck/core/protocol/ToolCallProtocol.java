package com.flightdeck.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightdeck.core.model.ToolCall;
import com.flightdeck.core.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tool calls from free-form model output.
 * <p>
 * A tool call is a fenced block tagged {@code tool} holding a JSON object with a
 * required {@code name} and optional {@code params}:
 * <pre>
 * ```tool
 * {"name": "read_file", "params": {"path": "src/App.tsx"}}
 * ```
 * </pre>
 * Malformed JSON goes through {@link #repair(String)} and, failing that, a regex
 * extraction of the {@code name} and {@code code} fields. Blocks that still cannot be
 * read are reported in {@link ParseResult#invalid()}.
 * <p>
 * Agents are prompted to emit exactly one block per turn; callers execute only
 * {@link ParseResult#first()} and ignore any further calls.
 */
@Component
public class ToolCallProtocol {

    private static final Logger log = LoggerFactory.getLogger(ToolCallProtocol.class);

    static final String FENCE = "```";
    static final String TAG = "tool";
    static final int INVALID_PREVIEW_LENGTH = 200;

    private static final Pattern NAME_FIELD = Pattern.compile("\"name\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern CODE_FIELD = Pattern.compile("\"code\"\\s*:\\s*\"([\\s\\S]*)\"", Pattern.DOTALL);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolCallProtocol() {
        this(new ObjectMapper());
    }

    public ToolCallProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses every {@code tool} block in the text, in document order.
     */
    public ParseResult parse(String modelText) {
        var calls = new ArrayList<ToolCall>();
        var invalid = new ArrayList<String>();
        for (String block : extractBlocks(modelText)) {
            Optional<ToolCall> call = parseBlock(block);
            if (call.isPresent()) {
                calls.add(call.get());
            } else {
                log.debug("Unparseable tool block: {}", TextNormalizer.preview(block, INVALID_PREVIEW_LENGTH));
                invalid.add(TextNormalizer.preview(block.trim(), INVALID_PREVIEW_LENGTH));
            }
        }
        return new ParseResult(calls, invalid);
    }

    /**
     * Single forward scan for fenced {@code tool} blocks. The opening fence must be
     * followed by the tag and then whitespace; the block ends at the next fence.
     */
    static List<String> extractBlocks(String text) {
        var blocks = new ArrayList<String>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf(FENCE + TAG, pos);
            if (open < 0) {
                break;
            }
            int bodyStart = open + FENCE.length() + TAG.length();
            if (bodyStart < text.length() && !Character.isWhitespace(text.charAt(bodyStart))) {
                // e.g. ```tools or ```toolbox: not a tool block
                pos = bodyStart;
                continue;
            }
            int close = text.indexOf(FENCE, bodyStart);
            if (close < 0) {
                // unterminated fence: take the rest so repair can still try
                blocks.add(text.substring(bodyStart));
                break;
            }
            blocks.add(text.substring(bodyStart, close));
            pos = close + FENCE.length();
        }
        return blocks;
    }

    private Optional<ToolCall> parseBlock(String block) {
        String json = block.trim();
        Optional<Map<String, Object>> parsed = readObject(json);
        if (parsed.isEmpty()) {
            String repaired = repair(json);
            parsed = readObject(repaired);
            if (parsed.isPresent()) {
                log.debug("Repaired malformed tool block");
            }
        }
        if (parsed.isPresent()) {
            return toToolCall(parsed.get());
        }
        return extractWithRegex(json);
    }

    private Optional<Map<String, Object>> readObject(String json) {
        if (json.isEmpty() || json.charAt(0) != '{') {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private static Optional<ToolCall> toToolCall(Map<String, Object> object) {
        if (!(object.get("name") instanceof String name) || name.isBlank()) {
            return Optional.empty();
        }
        Object params = object.get("params");
        if (params instanceof Map<?, ?> map) {
            return Optional.of(new ToolCall(name, (Map<String, Object>) map));
        }
        // No params object: any other top-level fields are the params
        var rest = new LinkedHashMap<>(object);
        rest.remove("name");
        rest.remove("params");
        return Optional.of(new ToolCall(name, rest));
    }

    /**
     * Last resort for code-bearing calls whose JSON quoting is broken: pulls the
     * {@code name} and the raw {@code code} string straight out of the text.
     */
    private static Optional<ToolCall> extractWithRegex(String raw) {
        Matcher name = NAME_FIELD.matcher(raw);
        if (!name.find()) {
            return Optional.empty();
        }
        var params = new LinkedHashMap<String, Object>();
        Matcher code = CODE_FIELD.matcher(raw);
        if (code.find()) {
            params.put("code", unescape(code.group(1)));
        }
        log.debug("Recovered tool call '{}' by field extraction", name.group(1));
        return Optional.of(new ToolCall(name.group(1), params));
    }

    private static String unescape(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case '/' -> sb.append('/');
                    default -> sb.append('\\').append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Best-effort structural repair of a JSON object.
     * <ul>
     *   <li>Text before the first {@code {} is dropped.</li>
     *   <li>If a balanced object exists, everything after it (extra closing braces,
     *       stray quotes, trailing prose) is cut off.</li>
     *   <li>Otherwise an unterminated string is closed and the missing {@code }}s are
     *       appended.</li>
     * </ul>
     * Braces inside JSON strings are not counted. The function is idempotent:
     * {@code repair(repair(x)).equals(repair(x))}.
     */
    public static String repair(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        int start = text.indexOf('{');
        if (start < 0) {
            return text;
        }
        text = text.substring(start);

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(0, i + 1);
                }
            }
        }

        // Unbalanced: close what is still open
        var sb = new StringBuilder(text);
        if (inString) {
            if (escaped) {
                sb.setLength(sb.length() - 1);
            }
            sb.append('"');
        }
        sb.append("}".repeat(Math.max(depth, 0)));
        return sb.toString();
    }

    /**
     * Result of parsing one model turn.
     *
     * @param calls   successfully parsed calls, in document order
     * @param invalid previews of blocks that could not be parsed
     */
    public record ParseResult(List<ToolCall> calls, List<String> invalid) {

        public ParseResult {
            calls = List.copyOf(calls);
            invalid = List.copyOf(invalid);
        }

        /** The call that gets executed; later calls in the same turn are ignored. */
        public Optional<ToolCall> first() {
            return calls.isEmpty() ? Optional.empty() : Optional.of(calls.get(0));
        }

        public boolean hasInvalid() {
            return !invalid.isEmpty();
        }
    }
}
