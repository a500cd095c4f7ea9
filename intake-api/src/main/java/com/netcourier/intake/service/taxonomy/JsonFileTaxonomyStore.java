package com.netcourier.intake.service.taxonomy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Taxonomy kept as a pretty-printed JSON array of {@code {name, description}} objects. Every call
 * reads the whole file and every append rewrites it, so edits made by another process between a
 * read and a write are lost.
 */
@Component
public class JsonFileTaxonomyStore implements TaxonomyStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaxonomyStore.class);
    private static final TypeReference<List<TypeEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    static final List<TypeEntry> DEFAULT_TYPES = List.of(
            new TypeEntry("report", "Стандартный отчёт"),
            new TypeEntry("invoice", "Счёт на оплату"),
            new TypeEntry("presentation", "Презентация")
    );

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileTaxonomyStore(IntakeProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getTaxonomyFile()), objectMapper);
    }

    public JsonFileTaxonomyStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        seedIfMissing();
    }

    @Override
    public List<TypeEntry> findAll() {
        try {
            return List.copyOf(objectMapper.readValue(file.toFile(), ENTRY_LIST));
        } catch (IOException e) {
            throw new IntakeException(IntakeFailure.TAXONOMY_IO_FAILURE, "Failed to read taxonomy file " + file, e);
        }
    }

    @Override
    public Optional<TypeEntry> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return findAll().stream()
                .filter(entry -> entry.matchesIgnoringCase(name))
                .findFirst();
    }

    @Override
    public synchronized List<TypeEntry> appendIfAbsent(TypeEntry entry) {
        List<TypeEntry> types = new ArrayList<>(findAll());
        boolean present = types.stream().anyMatch(existing -> existing.name().equals(entry.name()));
        if (!present) {
            types.add(entry);
            write(types);
            log.info("Added document type '{}' to taxonomy", entry.name());
        }
        return List.copyOf(types);
    }

    private void seedIfMissing() {
        if (Files.exists(file)) {
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IntakeException(IntakeFailure.TAXONOMY_IO_FAILURE, "Failed to create taxonomy directory for " + file, e);
        }
        write(DEFAULT_TYPES);
        log.info("Seeded taxonomy file {} with {} default types", file, DEFAULT_TYPES.size());
    }

    private void write(List<TypeEntry> types) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), types);
        } catch (IOException e) {
            throw new IntakeException(IntakeFailure.TAXONOMY_IO_FAILURE, "Failed to write taxonomy file " + file, e);
        }
    }
}
