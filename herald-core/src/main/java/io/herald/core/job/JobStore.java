package io.herald.core.job;

import java.io.IOException;
import java.util.List;

public interface JobStore {
    List<Job> load() throws IOException;

    void save(List<Job> jobs) throws IOException;
}
