package com.chatcoach.infrastructure.ai.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Turns raw model text into a JSON tree. Applies the {@link RepairStep} transforms in order,
 * parses strictly and, failing that, falls back to the first complete object found in the
 * original text. Every failure is handed to the {@link FailedOutputStore}.
 */
@Slf4j
public class ResilientJsonExtractor {

    private final ObjectMapper objectMapper;
    private final FailedOutputStore failedOutputStore;
    private final int excerptLength;

    public ResilientJsonExtractor(ObjectMapper objectMapper, FailedOutputStore failedOutputStore, int excerptLength) {
        this.objectMapper = objectMapper;
        this.failedOutputStore = failedOutputStore;
        this.excerptLength = excerptLength;
    }

    public JsonNode extract(String rawText, String requestId) {
        String original = rawText == null ? "" : rawText;

        String repaired = original;
        for (RepairStep step : RepairStep.repairs()) {
            repaired = step.apply(repaired);
            if (step == RepairStep.STRIP_CODE_FENCE && repaired.isEmpty()) {
                throw fail("Model output is empty", original, RepairStep.STRIP_CODE_FENCE, requestId, null);
            }
        }

        JsonProcessingException strictError = null;
        try {
            JsonNode node = objectMapper.readTree(repaired);
            if (node != null && node.isContainerNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            strictError = e;
        }

        List<String> candidates = JsonRepairs.completeObjects(original);
        for (String candidate : candidates) {
            JsonNode node = tryParse(candidate);
            if (node == null) {
                node = tryParse(JsonRepairs.removeInvalidEscapes(candidate));
            }
            if (node != null) {
                log.debug("[Extractor] Recovered object by bracket matching for request {}", requestId);
                return node;
            }
        }

        String reason = strictError != null
                ? strictError.getOriginalMessage()
                : "Output is not a JSON object or array";
        throw fail(reason + " (" + candidates.size() + " complete object candidates)",
                original, RepairStep.PARSE, requestId, strictError);
    }

    private JsonNode tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private UnparsableModelOutputException fail(String reason, String original, RepairStep step,
                                                String requestId, Throwable cause) {
        String excerpt = original.length() > excerptLength
                ? original.substring(0, excerptLength) + "..."
                : original;
        log.warn("[Extractor] Unparsable output for request {} at {}: {} | excerpt={}",
                requestId, step, reason, excerpt);
        try {
            failedOutputStore.save(FailedOutputRecord.of(requestId, original, reason));
        } catch (RuntimeException e) {
            log.error("[Extractor] Failed to persist unparsable output for request {}", requestId, e);
        }
        return new UnparsableModelOutputException(reason, original, step, excerpt, cause);
    }
}
