package com.chatcoach.infrastructure.ai.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes one JSON file per failure: {@code failed_reply_<timestamp>_<seq>.json}.
 */
@Slf4j
public class FileFailedOutputStore implements FailedOutputStore {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final AtomicLong sequence = new AtomicLong();

    public FileFailedOutputStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(FailedOutputRecord record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", record.timestamp().toString());
        node.put("requestId", record.requestId());
        node.put("rawTextTruncated", record.rawTextTruncated());
        node.put("rawTextLength", record.rawTextLength());
        node.put("parseError", record.parseError());

        String fileName = "failed_reply_" + FILE_TIMESTAMP.format(record.timestamp())
                + "_" + sequence.incrementAndGet() + ".json";
        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(fileName);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), node);
            log.info("[FailedOutput] Saved failed output for request {} to {}", record.requestId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write failed output to " + directory, e);
        }
    }

    @Override
    public List<FailedOutputRecord> findByRequestId(String requestId) {
        List<FailedOutputRecord> found = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return found;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "failed_reply_*.json")) {
            for (Path file : files) {
                JsonNode node = objectMapper.readTree(file.toFile());
                if (requestId.equals(node.path("requestId").asText(null))) {
                    found.add(new FailedOutputRecord(
                            Instant.parse(node.path("timestamp").asText()),
                            requestId,
                            node.path("rawTextTruncated").asText(""),
                            node.path("rawTextLength").asInt(),
                            node.path("parseError").asText("")));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read failed outputs from " + directory, e);
        }
        found.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
        return found;
    }
}
