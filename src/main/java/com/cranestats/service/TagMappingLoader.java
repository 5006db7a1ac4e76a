package com.cranestats.service;

import com.cranestats.model.TagMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the tag-change table (TAG, FV columns). A missing or unreadable table yields an
 * empty mapping so every tag falls back to its raw name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TagMappingLoader {

    static final String RAW_COLUMN = "tag";
    static final String NAME_COLUMN = "fv";

    private final ResourceLoader resourceLoader;
    private final CsvTableReader csvTableReader;

    public TagMapping load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Tag mapping file '{}' not found, raw tag names will be used", location);
            return TagMapping.empty();
        }
        try {
            List<Map<String, String>> rows = csvTableReader.read(resource);
            Map<String, String> rawToName = new HashMap<>();
            for (Map<String, String> row : rows) {
                if (!row.containsKey(RAW_COLUMN) || !row.containsKey(NAME_COLUMN)) {
                    log.error("Tag mapping file '{}' lacks TAG/FV columns, raw tag names will be used", location);
                    return TagMapping.empty();
                }
                String raw = row.get(RAW_COLUMN);
                String name = row.get(NAME_COLUMN);
                if (raw != null && name != null) {
                    rawToName.put(raw, name);
                }
            }
            TagMapping mapping = new TagMapping(rawToName);
            log.info("Loaded {} tag mappings from '{}'", mapping.size(), location);
            return mapping;
        } catch (IOException | RuntimeException e) {
            log.error("Error reading tag mapping file '{}': {}", location, e.getMessage());
            return TagMapping.empty();
        }
    }
}
