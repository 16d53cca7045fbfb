package de.bsommerfeld.tscache.aggregation.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DefinitionHistory} backed by a directory of {@code <id>.json} files.
 *
 * <pre>
 * {
 *   "id": "channel",
 *   "versions": [
 *     { "version": "v1", "effective-from": "2025-01-01T00:00:00Z",
 *       "values": ["google", "meta"], "other-policy": "computed" }
 *   ]
 * }
 * </pre>
 *
 * A version is in force from its {@code effective-from} until the next
 * version's. A missing {@code other-policy} is read as {@code undefined}.
 * Files are parsed once per id.
 */
public class JsonDefinitionHistory implements DefinitionHistory {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDefinitionHistory.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DefinitionFile(
            @JsonProperty("id") String id,
            @JsonProperty("versions") List<VersionEntry> versions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VersionEntry(
            @JsonProperty("version") String version,
            @JsonProperty("effective-from") Instant effectiveFrom,
            @JsonProperty("values") List<String> values,
            @JsonProperty("other-policy") OtherPolicy otherPolicy) {
    }

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path directory;
    private final Map<String, List<VersionEntry>> files = new ConcurrentHashMap<>();

    public JsonDefinitionHistory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<String> resolveVersion(String definitionId, Instant asOf) {
        VersionEntry inForce = null;
        for (VersionEntry entry : versions(definitionId)) {
            if (entry.effectiveFrom().isAfter(asOf))
                break;
            inForce = entry;
        }
        return Optional.ofNullable(inForce).map(VersionEntry::version);
    }

    @Override
    public Optional<ContextDefinition> load(String definitionId, String version) {
        return versions(definitionId).stream()
                .filter(v -> v.version().equals(version))
                .findFirst()
                .map(v -> new ContextDefinition(definitionId, v.version(),
                        v.values() == null ? List.of() : v.values(),
                        v.otherPolicy() == null ? OtherPolicy.UNDEFINED : v.otherPolicy()));
    }

    private List<VersionEntry> versions(String definitionId) {
        return files.computeIfAbsent(definitionId, this::readFile);
    }

    private List<VersionEntry> readFile(String definitionId) {
        Path file = directory.resolve(definitionId + ".json");
        if (!Files.exists(file)) {
            LOG.debug("No definition file for '{}' in {}", definitionId, directory);
            return List.of();
        }
        try {
            DefinitionFile parsed = mapper.readValue(file.toFile(), DefinitionFile.class);
            if (parsed.id() != null && !parsed.id().equals(definitionId))
                LOG.warn("Definition file {} declares id '{}'", file, parsed.id());
            List<VersionEntry> versions = parsed.versions() == null ? List.of() : parsed.versions();
            for (VersionEntry v : versions) {
                if (v.version() == null || v.effectiveFrom() == null)
                    throw new IllegalArgumentException("Version entry in " + file
                            + " needs 'version' and 'effective-from'");
            }
            LOG.info("Loaded {} version(s) of context '{}'", versions.size(), definitionId);
            return versions.stream().sorted(Comparator.comparing(VersionEntry::effectiveFrom)).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read context definition " + file, e);
        }
    }
}
