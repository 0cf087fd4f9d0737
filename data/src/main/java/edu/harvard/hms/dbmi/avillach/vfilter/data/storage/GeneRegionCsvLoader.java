package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import edu.harvard.hms.dbmi.avillach.vfilter.data.query.GeneRegion;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads gene regions from a CSV file with the header {@code reference_genome_id,label,start,end}.
 */
public class GeneRegionCsvLoader {

    private static final Logger log = LoggerFactory.getLogger(GeneRegionCsvLoader.class);

    public static final String REFERENCE_GENOME_ID = "reference_genome_id";
    public static final String LABEL = "label";
    public static final String START = "start";
    public static final String END = "end";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(REFERENCE_GENOME_ID, LABEL, START, END)
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .build();

    public List<GeneRegion> load(File geneFile) {
        try (CSVParser parser = CSVParser.parse(geneFile, StandardCharsets.UTF_8, FORMAT)) {
            List<GeneRegion> regions = parse(parser);
            log.info("Loaded " + regions.size() + " gene regions from " + geneFile.getAbsolutePath());
            return regions;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read gene regions from " + geneFile, e);
        }
    }

    public List<GeneRegion> load(Reader reader) {
        try (CSVParser parser = CSVParser.parse(reader, FORMAT)) {
            return parse(parser);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read gene regions", e);
        }
    }

    private List<GeneRegion> parse(CSVParser parser) {
        List<GeneRegion> regions = new ArrayList<>();
        for (CSVRecord record : parser) {
            try {
                regions.add(new GeneRegion(
                    record.get(REFERENCE_GENOME_ID), record.get(LABEL), Long.parseLong(record.get(START)), Long.parseLong(record.get(END))
                ));
            } catch (IllegalArgumentException e) {
                // NumberFormatException included
                throw new IllegalArgumentException("Invalid gene region on line " + record.getRecordNumber() + ": " + e.getMessage(), e);
            }
        }
        return regions;
    }
}
