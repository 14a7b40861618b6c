package com.platform.datakeeper.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.datakeeper.error.ActionExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Filesystem archive. Every regular file under a root is a unit whose type is its
 * extension; metadata lives in a {@code <file>.meta.json} sidecar holding
 * {@code tags}, {@code timestamp} and {@code attributes}. Without a sidecar the unit
 * has no tags and its timestamp is the file's modification time.
 * 
 * Samples can be read and written for CSV units only (one row per time sample,
 * one column per channel).
 */
@Slf4j
public class FileSystemDataStore implements DataStoreAdapter {
    
    static final String SIDECAR_SUFFIX = ".meta.json";
    private static final String CSV = "csv";
    
    private final ObjectMapper objectMapper;
    
    public FileSystemDataStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Override
    public List<DataUnit> discover(Collection<String> roots) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (String root : roots) {
            Path dir = Path.of(root).toAbsolutePath().normalize();
            if (!Files.isDirectory(dir)) {
                log.debug("Selector path {} does not exist, skipping", dir);
                continue;
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(SIDECAR_SUFFIX))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .forEach(files::add);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        }
        
        List<DataUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            units.add(describe(file));
        }
        return units;
    }
    
    /**
     * Builds the unit for a single file from the file and its sidecar.
     */
    public DataUnit describe(Path file) throws IOException {
        Sidecar sidecar = readSidecar(file);
        Instant timestamp = sidecarTimestamp(file, sidecar);
        if (timestamp == null) {
            timestamp = Files.getLastModifiedTime(file).toInstant();
        }
        return new DataUnit(
            file.toString(),
            extensionOf(file),
            sidecar.tags == null ? Set.of() : new LinkedHashSet<>(sidecar.tags),
            sidecar.attributes == null ? Map.of() : sidecar.attributes,
            timestamp,
            Files.size(file));
    }
    
    private static Instant sidecarTimestamp(Path file, Sidecar sidecar) {
        if (sidecar.timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(sidecar.timestamp);
        } catch (DateTimeParseException e) {
            log.warn("Sidecar of {} has unparseable timestamp '{}', using modification time", 
                file, sidecar.timestamp);
            return null;
        }
    }
    
    @Override
    public Optional<DataUnit> find(String path) throws IOException {
        Path file = Path.of(path);
        return Files.isRegularFile(file) ? Optional.of(describe(file)) : Optional.empty();
    }
    
    @Override
    public SampleMatrix read(DataUnit unit) throws IOException {
        requireCsv(unit);
        Path file = Path.of(unit.path());
        List<double[]> rows = new ArrayList<>();
        
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] cells = line.split(",");
                double[] row = new double[cells.length];
                for (int i = 0; i < cells.length; i++) {
                    try {
                        row[i] = Double.parseDouble(cells[i].trim());
                    } catch (NumberFormatException e) {
                        throw ActionExecutionException.format(
                            unit.path() + ":" + lineNo + ": not a number '" + cells[i].trim() + "'");
                    }
                }
                rows.add(row);
            }
        }
        
        try {
            return new SampleMatrix(rows.toArray(double[][]::new));
        } catch (IllegalArgumentException e) {
            throw ActionExecutionException.format(unit.path() + ": " + e.getMessage());
        }
    }
    
    @Override
    public DataUnit write(DataUnit source, String suffix, SampleMatrix data,
                          Map<String, Object> attributes, boolean replace) throws IOException {
        requireCsv(source);
        Path sourceFile = Path.of(source.path());
        Path target = replace ? sourceFile : sibling(sourceFile, suffix);
        Path temp = Files.createTempFile(sourceFile.getParent(), ".dk-", ".tmp");
        
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (int t = 0; t < data.samples(); t++) {
                    StringBuilder line = new StringBuilder();
                    for (int c = 0; c < data.channels(); c++) {
                        if (c > 0) line.append(',');
                        line.append(data.get(t, c));
                    }
                    writer.write(line.toString());
                    writer.newLine();
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        
        Map<String, Object> merged = new HashMap<>(source.attributes());
        merged.putAll(attributes);
        
        Sidecar sidecar = new Sidecar();
        sidecar.tags = new ArrayList<>(source.tags());
        sidecar.timestamp = merged.containsKey("timestamp") 
            ? String.valueOf(merged.remove("timestamp")) 
            : source.timestamp().toString();
        sidecar.attributes = merged;
        objectMapper.writeValue(sidecarOf(target).toFile(), sidecar);
        
        log.debug("Wrote {} ({} x {}){}", target, data.samples(), data.channels(), replace ? " replacing source" : "");
        return describe(target);
    }
    
    @Override
    public void delete(DataUnit unit) throws IOException {
        Path file = Path.of(unit.path());
        Files.deleteIfExists(file);
        Files.deleteIfExists(sidecarOf(file));
    }
    
    @Override
    public long sizeOf(DataUnit unit) throws IOException {
        Path file = Path.of(unit.path());
        return Files.exists(file) ? Files.size(file) : 0L;
    }
    
    private Sidecar readSidecar(Path file) throws IOException {
        Path sidecar = sidecarOf(file);
        if (!Files.exists(sidecar)) {
            return new Sidecar();
        }
        try {
            return objectMapper.readValue(sidecar.toFile(), new TypeReference<Sidecar>() {});
        } catch (IOException e) {
            log.warn("Ignoring unreadable metadata sidecar {}: {}", sidecar, e.getMessage());
            return new Sidecar();
        }
    }
    
    private static void requireCsv(DataUnit unit) {
        if (!CSV.equals(unit.dataType())) {
            throw ActionExecutionException.format("sample access not supported for type '" + unit.dataType() + "'");
        }
    }
    
    static Path sidecarOf(Path file) {
        return file.resolveSibling(file.getFileName() + SIDECAR_SUFFIX);
    }
    
    private static Path sibling(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        return file.resolveSibling(stem + "_" + suffix + ext);
    }
    
    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
    
    /**
     * Sidecar JSON shape.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Sidecar {
        public List<String> tags;
        public String timestamp;
        public Map<String, Object> attributes;
    }
}
