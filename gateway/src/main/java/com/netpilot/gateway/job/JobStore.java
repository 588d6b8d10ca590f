package com.netpilot.gateway.job;

import java.util.Optional;

/**
 * Where jobs live between submission and polling.
 * The only implementation is in-memory; jobs do not survive a restart.
 */
public interface JobStore {

    /** Store a new job; false if its id is already taken. */
    boolean add(Job job);

    Optional<Job> findById(String id);

    int size();
}
