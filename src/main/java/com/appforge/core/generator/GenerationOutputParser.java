package com.appforge.core.generator;

import com.appforge.core.model.ErrorKind;
import com.appforge.core.provider.ProviderException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses a completion of the form {@code {"files": {"path": "content"}, "notes": "..."}},
 * tolerating a surrounding markdown code fence.
 */
public class GenerationOutputParser {

    private static final Logger log = LoggerFactory.getLogger(GenerationOutputParser.class);

    private final ObjectMapper mapper;

    public GenerationOutputParser() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ParsedOutput parse(String provider, String completion) {
        if (completion == null || completion.isBlank()) {
            throw invalid(provider, "empty completion");
        }
        String cleaned = stripFence(completion);
        JsonNode root;
        try {
            root = mapper.readTree(cleaned);
        } catch (Exception e) {
            log.debug("Unparseable completion from {} ({} chars)", provider, cleaned.length());
            throw new ProviderException(ErrorKind.INVALID_OUTPUT, provider,
                    "Completion is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid(provider, "completion is not a JSON object");
        }
        JsonNode filesNode = root.get("files");
        if (filesNode == null || !filesNode.isObject() || filesNode.isEmpty()) {
            throw invalid(provider, "completion contains no files");
        }

        Map<String, String> files = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = filesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey().trim();
            if (path.isEmpty() || path.startsWith("/") || path.contains("..")) {
                throw invalid(provider, "illegal file path '" + field.getKey() + "'");
            }
            if (!field.getValue().isTextual()) {
                throw invalid(provider, "content of '" + path + "' is not a string");
            }
            files.put(path, field.getValue().asText());
        }
        JsonNode notes = root.get("notes");
        return new ParsedOutput(files, notes == null || notes.isNull() ? "" : notes.asText());
    }

    static String stripFence(String completion) {
        String cleaned = completion.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static ProviderException invalid(String provider, String reason) {
        return new ProviderException(ErrorKind.INVALID_OUTPUT, provider, "Unusable completion: " + reason);
    }

    public record ParsedOutput(Map<String, String> files, String notes) {}
}
