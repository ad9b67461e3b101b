package io.herald.core.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

public final class FileJobStore implements JobStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileJobStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return path;
    }

    @Override
    public List<Job> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, new TypeReference<List<Job>>() {
        });
    }

    @Override
    public void save(List<Job> jobs) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs);
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, json + System.lineSeparator());
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
