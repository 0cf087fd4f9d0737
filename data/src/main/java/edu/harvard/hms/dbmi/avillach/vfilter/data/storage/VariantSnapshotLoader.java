package edu.harvard.hms.dbmi.avillach.vfilter.data.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;

public class VariantSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(VariantSnapshotLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads a JSON snapshot, gzipped if the file name ends in ".gz".
     */
    public VariantSnapshot load(File snapshotFile) {
        log.info("Loading variant snapshot from " + snapshotFile.getAbsolutePath());
        try {
            VariantSnapshot snapshot;
            if (snapshotFile.getName().endsWith(".gz")) {
                try (InputStream in = new GZIPInputStream(new FileInputStream(snapshotFile))) {
                    snapshot = objectMapper.readValue(in, VariantSnapshot.class);
                }
            } else {
                snapshot = objectMapper.readValue(snapshotFile, VariantSnapshot.class);
            }
            log.info("Loaded " + snapshot.getVariants().size() + " variants and " + snapshot.getFields().size() + " field declarations");
            return snapshot;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read variant snapshot " + snapshotFile, e);
        }
    }

    public VariantSnapshot load(InputStream in) {
        try {
            return objectMapper.readValue(in, VariantSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read variant snapshot", e);
        }
    }
}
