package com.segcalc.validation.golden;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the golden catalogue CSV (header row required) into {@link GoldenRecord}s.
 */
@Component
public class GoldenDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(GoldenDatasetLoader.class);

    private final CsvMapper csvMapper;
    private final Resource location;

    public GoldenDatasetLoader(
            @Value("${segcalc.validation.golden-dataset:classpath:golden/reference_catalogue.csv}") Resource location) {
        this.location = location;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public GoldenDataset load() {
        return load(location);
    }

    /**
     * @throws GoldenDatasetException when the file is missing, unreadable, empty
     *                                or contains a row without a name
     */
    public GoldenDataset load(Resource resource) {
        String source = resource.getDescription();
        if (!resource.exists()) {
            throw new GoldenDatasetException(source, "golden dataset not found");
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<GoldenRecord> rows;
        try (InputStream in = resource.getInputStream()) {
            MappingIterator<GoldenRecord> it = csvMapper.readerFor(GoldenRecord.class).with(schema).readValues(in);
            rows = it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new GoldenDatasetException(source, "failed to read golden dataset: " + e.getMessage(), e);
        }

        if (rows.isEmpty()) {
            throw new GoldenDatasetException(source, "golden dataset has no rows");
        }
        for (int i = 0; i < rows.size(); i++) {
            GoldenRecord row = rows.get(i);
            if (row.getName() == null || row.getName().isBlank()) {
                throw new GoldenDatasetException(source, "row " + (i + 1) + " has no name");
            }
            if (row.getWinnerReference() == null) {
                throw new GoldenDatasetException(source, "row " + (i + 1) + " (" + row.getName() + ") has no reference winner");
            }
        }

        log.info("[GoldenDataset] Loaded. source={} rows={}", source, rows.size());
        return new GoldenDataset(source, rows);
    }
}
