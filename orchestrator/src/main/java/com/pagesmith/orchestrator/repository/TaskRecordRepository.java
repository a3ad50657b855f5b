package com.pagesmith.orchestrator.repository;

import com.pagesmith.orchestrator.model.TaskRecord;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Status store: the only state shared between concurrently running tasks and
 * the status-query path.
 *
 * Writes to one nonce are serialized; reads and writes of different nonces do
 * not wait on each other. Everything returned is a detached copy, so callers
 * can hold on to it without seeing (or causing) concurrent changes.
 */
public interface TaskRecordRepository {

    /**
     * Store a freshly accepted record.
     *
     * @throws DuplicateNonceException if a record with the same nonce exists
     */
    TaskRecord create(TaskRecord record);

    /** Point lookup by nonce. */
    Optional<TaskRecord> findByNonce(String nonce);

    /**
     * Apply {@code mutation} atomically to the record for {@code nonce} and return
     * the resulting state. If the mutation throws, the stored record is unchanged.
     *
     * The mutation runs while the per-nonce lock is held, so it must not do I/O.
     *
     * @throws NoSuchElementException if the nonce is unknown
     */
    TaskRecord update(String nonce, Consumer<TaskRecord> mutation);

    /** All records, oldest first. */
    List<TaskRecord> findAll();

    /** Records not yet in a terminal state. */
    long countActive();
}
