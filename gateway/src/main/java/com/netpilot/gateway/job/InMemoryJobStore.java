package com.netpilot.gateway.job;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-lifetime job map. Entries are never evicted. */
@Component
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public boolean add(Job job) {
        return jobs.putIfAbsent(job.getId(), job) == null;
    }

    @Override
    public Optional<Job> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public int size() {
        return jobs.size();
    }
}
