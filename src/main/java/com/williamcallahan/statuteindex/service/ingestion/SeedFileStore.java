package com.williamcallahan.statuteindex.service.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.williamcallahan.statuteindex.config.AppProperties;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStub;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Filesystem home of the ingestion outputs: the discovered catalog index and one seed JSON file
 * per document ({@code <year>_<number>.json}).
 */
@Service
public class SeedFileStore {
    private static final Logger log = LoggerFactory.getLogger(SeedFileStore.class);

    static final String CATALOG_INDEX_FILE = "act-index.json";
    private static final String SEED_SUFFIX = ".json";

    private static final TypeReference<List<CatalogIndexEntry>> CATALOG_INDEX_TYPE = new TypeReference<>() {};

    private final Path sourceDir;
    private final Path seedDir;
    private final String collection;
    private final ObjectMapper objectMapper;

    @Autowired
    public SeedFileStore(AppProperties appProperties) {
        this(
                Path.of(appProperties.getIngestion().getSourceDir()),
                Path.of(appProperties.getIngestion().getSeedDir()),
                appProperties.getLegislation().getCollection());
    }

    SeedFileStore(Path sourceDir, Path seedDir, String collection) {
        this.sourceDir = sourceDir;
        this.seedDir = seedDir;
        this.collection = collection;
        this.objectMapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Catalog index row as persisted in {@code act-index.json}.
     */
    public record CatalogIndexEntry(String title, int year, int number, String url, String updated) {

        static CatalogIndexEntry fromStub(DocumentStub stub) {
            return new CatalogIndexEntry(stub.title(), stub.year(), stub.number(), stub.url(), stub.updated());
        }
    }

    public Path seedPath(DocumentStub stub) {
        return seedDir.resolve(stub.year() + "_" + stub.number() + SEED_SUFFIX);
    }

    public boolean hasSeed(DocumentStub stub) {
        return Files.exists(seedPath(stub));
    }

    /**
     * Writes the seed for one document, replacing any previous file.
     *
     * @throws IOException if the file cannot be written
     */
    public void writeSeed(DocumentStub stub, ParsedStatute statute) throws IOException {
        Path seedPath = seedPath(stub);
        Files.createDirectories(seedPath.getParent());
        Files.writeString(seedPath, objectMapper.writeValueAsString(statute), StandardCharsets.UTF_8);
    }

    /**
     * Reads every seed file in the seed directory; unreadable files are logged and skipped.
     *
     * @return parsed seeds in file-name order, empty when the directory does not exist
     * @throws IOException if the directory cannot be listed
     */
    public List<ParsedStatute> readSeeds() throws IOException {
        if (!Files.isDirectory(seedDir)) {
            return List.of();
        }
        List<Path> seedFiles;
        try (Stream<Path> entries = Files.list(seedDir)) {
            seedFiles = entries.filter(path -> path.getFileName().toString().endsWith(SEED_SUFFIX))
                    .sorted()
                    .toList();
        }
        List<ParsedStatute> seeds = new ArrayList<>(seedFiles.size());
        for (Path seedFile : seedFiles) {
            try {
                seeds.add(objectMapper.readValue(seedFile.toFile(), ParsedStatute.class));
            } catch (IOException | RuntimeException unreadable) {
                log.warn("Skipping unreadable seed {}: {}", seedFile.getFileName(), unreadable.getMessage());
            }
        }
        return seeds;
    }

    public Path catalogIndexPath() {
        return sourceDir.resolve(CATALOG_INDEX_FILE);
    }

    /**
     * Persists the discovered catalog.
     *
     * @throws IOException if the index cannot be written
     */
    public void writeCatalogIndex(List<DocumentStub> catalog) throws IOException {
        List<CatalogIndexEntry> rows = catalog.stream().map(CatalogIndexEntry::fromStub).toList();
        Path indexPath = catalogIndexPath();
        Files.createDirectories(indexPath.getParent());
        Files.writeString(indexPath, objectMapper.writeValueAsString(rows), StandardCharsets.UTF_8);
    }

    /**
     * Reads the cached catalog index.
     *
     * @return catalog entries, or empty when no index has been written yet
     * @throws IOException if an existing index cannot be read or parsed
     */
    public Optional<List<DocumentStub>> readCatalogIndex() throws IOException {
        Path indexPath = catalogIndexPath();
        if (!Files.exists(indexPath)) {
            return Optional.empty();
        }
        List<CatalogIndexEntry> rows = objectMapper.readValue(indexPath.toFile(), CATALOG_INDEX_TYPE);
        List<DocumentStub> catalog = new ArrayList<>(rows.size());
        for (CatalogIndexEntry row : rows) {
            if (row.title() == null || row.title().isBlank()) {
                log.warn("Skipping untitled catalog index row {}/{}", row.year(), row.number());
                continue;
            }
            String url = row.url() == null ? "" : row.url();
            catalog.add(new DocumentStub(collection, row.year(), row.number(), row.title(), url, row.updated()));
        }
        return Optional.of(catalog);
    }
}
