package com.eainde.council.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One JSON file per record under {@code <directory>/<collection>/<id>.json}.
 * Writes go to a temporary file first and are moved into place, so readers never see half a record.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "council.store.type", havingValue = "file")
public class JsonFileCouncilStore implements CouncilStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileCouncilStore(@Value("${council.store.directory:data}") String directory, ObjectMapper objectMapper) {
        this(Path.of(directory), objectMapper);
    }

    public JsonFileCouncilStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
        log.info("Council records stored under {}", root.toAbsolutePath());
    }

    @Override
    public <T> void put(EntityKind kind, String id, T record) {
        Path target = file(kind, id);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), id, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), record);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(tmp, e);
            throw new UncheckedIOException("Failed to write " + kind.collection() + "/" + id, e);
        }
    }

    private static void discard(Path tmp, IOException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    @Override
    public <T> Optional<T> get(EntityKind kind, String id, Class<T> type) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path path = file(kind, id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path, type));
    }

    @Override
    public <T> List<T> list(EntityKind kind, Class<T> type, Predicate<? super T> filter) {
        Path dir = root.resolve(kind.collection());
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<T> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(p -> {
                        T record = read(p, type);
                        if (filter.test(record)) {
                            records.add(record);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + kind.collection(), e);
        }
        return records;
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    private Path file(EntityKind kind, String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Unsafe record id: " + id);
        }
        return root.resolve(kind.collection()).resolve(id + ".json");
    }
}
