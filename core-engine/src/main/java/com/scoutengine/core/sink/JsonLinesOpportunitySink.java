package com.scoutengine.core.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutengine.core.model.Opportunity;
import com.scoutengine.core.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends opportunities to a file as JSON lines, one object per line, with
 * snake_case property names and ISO-8601 timestamps.
 *
 * <p>
 * Every opportunity of a batch is serialized before the file is opened, so a
 * serialization failure leaves the file untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesOpportunitySink implements OpportunitySink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesOpportunitySink.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonLinesOpportunitySink(Path path) {
        this(path, ObjectMappers.create());
    }

    public JsonLinesOpportunitySink(Path path, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void write(List<Opportunity> opportunities) {
        Objects.requireNonNull(opportunities, "opportunities must not be null");
        if (opportunities.isEmpty()) {
            return;
        }

        List<String> lines = new ArrayList<>(opportunities.size());
        for (Opportunity opportunity : opportunities) {
            try {
                lines.add(mapper.writeValueAsString(opportunity));
            } catch (JsonProcessingException e) {
                throw new SinkWriteException("Failed to serialize opportunity " + opportunity.getId(), e);
            }
        }

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                for (String line : lines) {
                    writer.write(line);
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new SinkWriteException("Failed to append opportunities to " + path, e);
        }
        LOG.info("Wrote {} opportunity(ies) to {}", lines.size(), path);
    }
}
