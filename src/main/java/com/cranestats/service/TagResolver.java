package com.cranestats.service;

import com.cranestats.model.TagMapping;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves cleaned tag details to metric names for one ingestion run and remembers
 * which codes fell back to their raw name.
 */
public class TagResolver {

    private final TagMapping mapping;
    private final Set<String> unmapped = ConcurrentHashMap.newKeySet();

    public TagResolver(TagMapping mapping) {
        this.mapping = mapping;
    }

    public String resolve(String rawTag) {
        String name = mapping.resolve(rawTag);
        if (!mapping.contains(rawTag)) {
            unmapped.add(name);
        }
        return name;
    }

    public List<String> unmappedTags() {
        return unmapped.stream().sorted().toList();
    }
}
