package dev.pairreview.analysis.voice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pairreview.config.AnalysisProperties;
import dev.pairreview.domain.entity.Comment;
import dev.pairreview.domain.enums.Side;
import dev.pairreview.domain.valueobject.SuggestionDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form voice output into suggestions.
 *
 * <p>JSON is located by trying, in order: the whole text, a fenced {@code ```json} block, the span
 * from the first '{' to the last '}', then each brace-balanced object. Suggestions missing
 * {@code file}, {@code type} or {@code title} are dropped, as are those under the confidence floor
 * and those whose file path does not fit the store. Over-long types and titles are cut to fit.
 */
@Component
public class VoiceOutputParser {

    private static final Logger log = LoggerFactory.getLogger(VoiceOutputParser.class);
    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*([\\s\\S]*?)```");

    private final ObjectMapper objectMapper;
    private final double minConfidence;
    private final double defaultConfidence;

    public VoiceOutputParser(ObjectMapper objectMapper, AnalysisProperties properties) {
        this.objectMapper = objectMapper;
        this.minConfidence = properties.minConfidence();
        this.defaultConfidence = properties.defaultConfidence();
    }

    /**
     * @throws VoiceInvocationException when the text contains no JSON object
     */
    public VoiceResponse parse(String voiceKey, String text) {
        JsonNode root = extractJson(text)
                .orElseThrow(() -> new VoiceInvocationException(voiceKey,
                        "No JSON object found in output (%d chars)".formatted(text == null ? 0 : text.length())));

        List<SuggestionDraft> suggestions = new ArrayList<>();
        int dropped = 0;
        for (JsonNode node : root.path("suggestions")) {
            Optional<SuggestionDraft> draft = toDraft(node);
            if (draft.isPresent()) {
                suggestions.add(draft.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} invalid or low-confidence suggestions from {}", dropped, voiceKey);
        }
        String summary = root.hasNonNull("summary") ? root.get("summary").asText() : null;
        return new VoiceResponse(suggestions, summary, text);
    }

    Optional<JsonNode> extractJson(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<JsonNode> whole = tryParse(text.strip());
        if (whole.isPresent()) return whole;

        Matcher fenced = FENCED_JSON.matcher(text);
        while (fenced.find()) {
            Optional<JsonNode> node = tryParse(fenced.group(1).strip());
            if (node.isPresent()) return node;
        }

        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        if (first >= 0 && last > first) {
            Optional<JsonNode> span = tryParse(text.substring(first, last + 1));
            if (span.isPresent()) return span;
        }

        for (String candidate : balancedObjects(text)) {
            Optional<JsonNode> node = tryParse(candidate);
            if (node.isPresent()) return node;
        }
        return Optional.empty();
    }

    // ── Internal ───────────────────────────────────────────────────

    private Optional<JsonNode> tryParse(String candidate) {
        if (!candidate.startsWith("{")) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Candidate is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Top-level brace-balanced substrings, skipping braces inside string literals. */
    static List<String> balancedObjects(String text) {
        List<String> objects = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) start = i;
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) objects.add(text.substring(start, i + 1));
            }
        }
        return objects;
    }

    private Optional<SuggestionDraft> toDraft(JsonNode node) {
        String file = text(node, "file");
        String type = text(node, "type");
        String title = text(node, "title");
        if (file == null || type == null || title == null) return Optional.empty();
        if (file.length() > Comment.FILE_LENGTH) {
            log.debug("Dropping suggestion with a {}-char file path", file.length());
            return Optional.empty();
        }

        double confidence = node.path("confidence").isNumber()
                ? node.get("confidence").asDouble()
                : defaultConfidence;
        if (confidence < minConfidence) return Optional.empty();

        Integer lineStart = integer(node, "line_start");
        if (lineStart == null) lineStart = integer(node, "line");
        Integer lineEnd = integer(node, "line_end");
        boolean fileLevel = node.path("is_file_level").asBoolean(lineStart == null);

        return Optional.of(new SuggestionDraft(file, lineStart, lineEnd, side(node),
                clamp(type.toLowerCase(Locale.ROOT), Comment.TYPE_LENGTH), clamp(title, Comment.TITLE_LENGTH),
                body(node), reasoning(node), Math.min(confidence, 1.0), fileLevel, null, 0));
    }

    static String clamp(String value, int maxLength) {
        if (value.length() <= maxLength) return value;
        return value.substring(0, maxLength - 1) + "…";
    }

    private static String body(JsonNode node) {
        String description = text(node, "description");
        if (description == null) description = text(node, "body");
        String suggestion = text(node, "suggestion");
        StringBuilder body = new StringBuilder(description == null ? "" : description);
        if (suggestion != null) {
            body.append("\n\n**Suggestion:** ").append(suggestion);
        }
        return body.toString();
    }

    private static String reasoning(JsonNode node) {
        JsonNode reasoning = node.path("reasoning");
        if (reasoning.isArray()) {
            List<String> steps = new ArrayList<>();
            reasoning.forEach(step -> steps.add(step.asText()));
            return String.join("\n", steps);
        }
        return reasoning.isTextual() ? reasoning.asText() : null;
    }

    private static Side side(JsonNode node) {
        String side = text(node, "old_or_new");
        if (side == null) side = text(node, "side");
        if (side == null) return Side.RIGHT;
        return switch (side.toUpperCase(Locale.ROOT)) {
            case "OLD", "LEFT" -> Side.LEFT;
            default -> Side.RIGHT;
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }
}
