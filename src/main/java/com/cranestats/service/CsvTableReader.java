package com.cranestats.service;

import com.cranestats.model.TagMapping;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads header-first CSV tables into rows keyed by lower-cased, cleaned column name.
 */
@Component
public class CsvTableReader {

    private final CsvMapper csvMapper;

    public CsvTableReader() {
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    }

    public List<Map<String, String>> read(Resource resource) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
                 .with(schema)
                 .readValues(in)) {
            while (it.hasNextValue()) {
                Map<String, String> row = new LinkedHashMap<>();
                it.nextValue().forEach((column, value) ->
                    row.put(TagMapping.clean(column).toLowerCase(Locale.ROOT), value));
                rows.add(row);
            }
        }
        return rows;
    }
}
