package com.diamondline.ingest.service;

import com.diamondline.ingest.util.NameNormalizer;
import jakarta.annotation.PostConstruct;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Known team abbreviation variants ("CHW", "CHA", "Chicago White Sox") mapped to the
 * canonical abbreviation ("CWS"). Loaded from a two-column CSV: {@code alias,canonical}.
 */
@Component
public class AbbreviationTable {
    private static final Logger log = LoggerFactory.getLogger(AbbreviationTable.class);

    private final ResourceLoader resourceLoader;
    private final String path;
    private volatile Map<String, String> aliasToCanonical = Map.of();

    public AbbreviationTable(ResourceLoader resourceLoader,
                             @Value("${diamondline.identity.abbreviations-path:classpath:identity/team_abbreviations.csv}") String path) {
        this.resourceLoader = resourceLoader;
        this.path = path;
    }

    /** Table backed by an in-memory map instead of a CSV resource. */
    public static AbbreviationTable of(Map<String, String> entries) {
        AbbreviationTable table = new AbbreviationTable(null, null);
        Map<String, String> m = new HashMap<>();
        entries.forEach((alias, canonical) -> table.put(m, alias, canonical));
        table.aliasToCanonical = Map.copyOf(m);
        return table;
    }

    @PostConstruct
    public void init() {
        if (resourceLoader == null || path == null || path.isBlank()) return;
        reload();
    }

    public synchronized void reload() {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.warn("[Identity][Abbreviations] table not found at {}, continuing with an empty table", path);
            aliasToCanonical = Map.of();
            return;
        }
        Map<String, String> m = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            CSVFormat fmt = CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setCommentMarker('#')
                    .setTrim(true)
                    .build();
            try (CSVParser parser = new CSVParser(reader, fmt)) {
                for (CSVRecord rec : parser) {
                    String alias = rec.get("alias");
                    String canonical = rec.get("canonical");
                    if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
                        log.warn("[Identity][Abbreviations] skipping incomplete row {} in {}", rec.getRecordNumber(), path);
                        continue;
                    }
                    put(m, alias, canonical);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load abbreviation table from " + path, e);
        }
        aliasToCanonical = Map.copyOf(m);
        log.info("[Identity][Abbreviations] loaded entries={} from {}", aliasToCanonical.size(), path);
    }

    /** Canonical abbreviation for any known variant; canonical abbreviations map to themselves. */
    public Optional<String> canonical(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        return Optional.ofNullable(aliasToCanonical.get(NameNormalizer.normalizeToken(token)));
    }

    public int size() {
        return aliasToCanonical.size();
    }

    private void put(Map<String, String> m, String alias, String canonical) {
        String canon = NameNormalizer.normalizeToken(canonical);
        m.put(NameNormalizer.normalizeToken(alias), canon);
        m.putIfAbsent(canon, canon);
    }
}
