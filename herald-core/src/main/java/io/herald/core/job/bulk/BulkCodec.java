package io.herald.core.job.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.herald.core.job.JobValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class BulkCodec {
    private final ObjectMapper json = new ObjectMapper();
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public String write(JobsDocument document, BulkFormat format) throws IOException {
        return switch (format) {
            case JSON -> json.writerWithDefaultPrettyPrinter().writeValueAsString(document) + System.lineSeparator();
            case YAML -> yaml.writeValueAsString(document);
        };
    }

    public JobsDocument read(String content, BulkFormat format) throws IOException {
        if (content == null || content.isBlank()) {
            throw new JobValidationException("bulk document is empty");
        }
        ObjectMapper mapper = format == BulkFormat.YAML ? yaml : json;
        try {
            return mapper.readValue(content, JobsDocument.class);
        } catch (JsonMappingException e) {
            throw mappingError(e);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("malformed bulk document: " + e.getOriginalMessage());
        }
    }

    /**
     * Names the offending entry ({@code jobs[i]}) and field from the binding path, e.g. a string
     * given for {@code every_seconds}.
     */
    private static JobValidationException mappingError(JsonMappingException e) {
        List<JsonMappingException.Reference> path = e.getPath();
        String entry = null;
        String field = null;
        for (int i = 0; i < path.size(); i++) {
            JsonMappingException.Reference reference = path.get(i);
            if (entry == null && "jobs".equals(reference.getFieldName())
                && i + 1 < path.size() && path.get(i + 1).getIndex() >= 0) {
                entry = "jobs[" + path.get(i + 1).getIndex() + "]";
                i++;
            } else if (entry != null && reference.getFieldName() != null) {
                field = reference.getFieldName();
            }
        }
        if (entry == null) {
            return new JobValidationException("malformed bulk document: " + e.getOriginalMessage());
        }
        String message = field == null
            ? "malformed entry: " + e.getOriginalMessage()
            : "invalid value for '" + field + "': " + e.getOriginalMessage();
        return new JobValidationException(entry, message);
    }

    public JobsDocument read(Path path) throws IOException {
        return read(Files.readString(path), BulkFormat.forPath(path));
    }

    public void write(JobsDocument document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, write(document, BulkFormat.forPath(path)));
    }
}
