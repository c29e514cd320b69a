package com.polkadot.analytics.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.engine.anomaly.AnomalyArtifact;
import com.polkadot.analytics.engine.forecast.ForecastArtifact;
import com.polkadot.analytics.model.ModelKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed model cache. Layout under the root:
 * <pre>
 *   forecast/&lt;entity&gt;/&lt;metric&gt;/&lt;kind&gt;.bin      (Java serialization)
 *   anomaly/&lt;entity&gt;/&lt;metric&gt;/&lt;method&gt;.json   (Jackson)
 * </pre>
 * Path segments are URL-encoded. Writes go to a temporary sibling that is atomically
 * moved into place, so a reader sees either the previous or the new artifact.
 */
@Repository
public class ModelArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactStore.class);

    static final String FORECAST_DIR = "forecast";
    static final String ANOMALY_DIR = "anomaly";
    private static final String FORECAST_EXT = ".bin";
    private static final String ANOMALY_EXT = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public ModelArtifactStore(AnalyticsConfig config) {
        this(Paths.get(config.getModelCacheDir()));
    }

    public ModelArtifactStore(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getRoot() {
        return root;
    }

    public void saveForecast(ModelKey key, ForecastArtifact artifact) throws IOException {
        writeAtomically(path(FORECAST_DIR, key, FORECAST_EXT), out -> {
            try (ObjectOutputStream oos = new ObjectOutputStream(out)) {
                oos.writeObject(artifact);
            }
        });
        log.info("Persisted forecast artifact {}", key);
    }

    public Optional<ForecastArtifact> loadForecast(ModelKey key) throws IOException {
        Path file = path(FORECAST_DIR, key, FORECAST_EXT);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            return Optional.of((ForecastArtifact) ois.readObject());
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IOException("Unreadable forecast artifact " + file, e);
        }
    }

    public void saveAnomaly(ModelKey key, AnomalyArtifact artifact) throws IOException {
        writeAtomically(path(ANOMALY_DIR, key, ANOMALY_EXT), out -> objectMapper.writeValue(out, artifact));
        log.info("Persisted anomaly artifact {}", key);
    }

    public Optional<AnomalyArtifact> loadAnomaly(ModelKey key) throws IOException {
        Path file = path(ANOMALY_DIR, key, ANOMALY_EXT);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), AnomalyArtifact.class));
    }

    public boolean forecastExists(ModelKey key) {
        return Files.exists(path(FORECAST_DIR, key, FORECAST_EXT));
    }

    public List<ModelKey> listForecastKeys() {
        return listKeys(FORECAST_DIR, FORECAST_EXT);
    }

    public List<ModelKey> listAnomalyKeys() {
        return listKeys(ANOMALY_DIR, ANOMALY_EXT);
    }

    private List<ModelKey> listKeys(String kindDir, String extension) {
        Path base = root.resolve(kindDir);
        List<ModelKey> keys = new ArrayList<>();
        if (!Files.isDirectory(base)) {
            return keys;
        }
        try (Stream<Path> files = Files.walk(base, 3)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .filter(p -> base.relativize(p).getNameCount() == 3)
                    .forEach(p -> {
                        Path relative = base.relativize(p);
                        String file = relative.getName(2).toString();
                        keys.add(new ModelKey(
                                decode(relative.getName(0).toString()),
                                decode(relative.getName(1).toString()),
                                decode(file.substring(0, file.length() - extension.length()))));
                    });
        } catch (IOException e) {
            log.error("Failed to list artifacts under {}", base, e);
        }
        return keys;
    }

    private Path path(String kindDir, ModelKey key, String extension) {
        return root.resolve(kindDir)
                .resolve(encode(key.entityId()))
                .resolve(encode(key.metric()))
                .resolve(encode(key.variant()) + extension);
    }

    private void writeAtomically(Path target, ArtifactWriter writer) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                writer.write(out);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    // '.' is encoded too so that "." and ".." never become path navigation
    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    static String decode(String segment) {
        return URLDecoder.decode(segment, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface ArtifactWriter {
        void write(OutputStream out) throws IOException;
    }
}
