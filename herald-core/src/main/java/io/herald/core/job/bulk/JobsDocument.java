package io.herald.core.job.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobsDocument(List<JobEntry> jobs) {

    public JobsDocument {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}
