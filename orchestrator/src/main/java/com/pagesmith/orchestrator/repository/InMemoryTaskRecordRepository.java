package com.pagesmith.orchestrator.repository;

import com.pagesmith.orchestrator.model.TaskRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Process-local status store backed by a {@link ConcurrentHashMap}.
 *
 * {@code compute} gives us one writer at a time per nonce without a global
 * lock; {@code get} never blocks. Mutations are applied to a copy which only
 * replaces the stored record when the mutation completes, so a rejected state
 * transition leaves nothing half-written.
 *
 * Records live until the process exits.
 */
@Repository
public class InMemoryTaskRecordRepository implements TaskRecordRepository {

    private final ConcurrentMap<String, TaskRecord> records = new ConcurrentHashMap<>();

    @Override
    public TaskRecord create(TaskRecord record) {
        TaskRecord stored = record.copy();
        if (records.putIfAbsent(stored.getNonce(), stored) != null) {
            throw new DuplicateNonceException(stored.getNonce());
        }
        return stored.copy();
    }

    @Override
    public Optional<TaskRecord> findByNonce(String nonce) {
        TaskRecord r = records.get(nonce);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public TaskRecord update(String nonce, Consumer<TaskRecord> mutation) {
        TaskRecord updated = records.computeIfPresent(nonce, (key, current) -> {
            TaskRecord next = current.copy();
            mutation.accept(next);
            return next;
        });
        if (updated == null) {
            throw new NoSuchElementException("No task for nonce " + nonce);
        }
        return updated.copy();
    }

    @Override
    public List<TaskRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(TaskRecord::getCreatedAt))
                .map(TaskRecord::copy)
                .toList();
    }

    @Override
    public long countActive() {
        return records.values().stream()
                .filter(r -> !r.getState().isTerminal())
                .count();
    }
}
