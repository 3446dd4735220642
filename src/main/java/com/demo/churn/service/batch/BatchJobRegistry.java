package com.demo.churn.service.batch;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.exception.BatchJobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Jobs by id, for polling. Only the most recent finished jobs are kept. */
@Slf4j
@Component
public class BatchJobRegistry {

    private final int retained;
    private final Map<String, BatchJob> jobs = new LinkedHashMap<>();

    public BatchJobRegistry(ChurnProperties props) {
        this.retained = props.getBatch().getRetainedJobs();
    }

    public synchronized void register(BatchJob job) {
        jobs.put(job.getId(), job);
        int excess = jobs.size() - retained;
        Iterator<BatchJob> it = jobs.values().iterator();
        while (excess > 0 && it.hasNext()) {
            BatchJob old = it.next();
            if (old.isFinished()) {
                it.remove();
                excess--;
                log.debug("Batch job {} evicted from registry", old.getId());
            }
        }
    }

    public synchronized BatchJob get(String id) {
        BatchJob job = jobs.get(id);
        if (job == null) throw new BatchJobNotFoundException(id);
        return job;
    }

    public synchronized List<BatchJob> list() {
        return List.copyOf(jobs.values());
    }
}
