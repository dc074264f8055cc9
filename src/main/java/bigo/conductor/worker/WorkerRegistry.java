package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Backend -> worker handle, one slot per backend.
 * Each slot owns a single permit: a handle runs at most one task at a time,
 * and {@link #tryAcquire(Backend)} is the only way to get to it.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    static final class Slot {
        final Worker worker;
        final Semaphore permit = new Semaphore(1);

        Slot(Worker worker) {
            this.worker = worker;
        }
    }

    /** Point-in-time view of one slot. */
    public record WorkerStatus(Backend backend, boolean busy, boolean available) {
    }

    private final ConcurrentHashMap<Backend, Slot> slots = new ConcurrentHashMap<>();

    /** Register a worker, replacing any handle already registered for its backend. */
    public void register(Worker worker) {
        Objects.requireNonNull(worker, "worker");
        Backend backend = Objects.requireNonNull(worker.backend(), "worker backend");
        Slot previous = slots.put(backend, new Slot(worker));
        if (previous != null) {
            log.info("Replaced worker for {}", backend);
        } else {
            log.info("Registered worker for {}", backend);
        }
    }

    public boolean isRegistered(Backend backend) {
        return slots.containsKey(backend);
    }

    /** Registered, not leased, and the handle reports itself ready. */
    public boolean available(Backend backend) {
        Slot slot = slots.get(backend);
        return slot != null && slot.permit.availablePermits() > 0 && slot.worker.available();
    }

    /**
     * Take exclusive use of the backend's handle.
     *
     * @return a lease to execute with and close, or empty if the backend is
     *         unregistered, busy, or not ready
     */
    public Optional<WorkerLease> tryAcquire(Backend backend) {
        Slot slot = slots.get(backend);
        if (slot == null || !slot.worker.available()) {
            return Optional.empty();
        }
        if (!slot.permit.tryAcquire()) {
            log.debug("Worker {} is busy", backend);
            return Optional.empty();
        }
        return Optional.of(new WorkerLease(slot.worker, slot.permit));
    }

    public int size() {
        return slots.size();
    }

    /** Registered backends in declaration order. */
    public List<Backend> backends() {
        List<Backend> list = new ArrayList<>(slots.keySet());
        list.sort(null);
        return list;
    }

    public List<WorkerStatus> snapshot() {
        List<WorkerStatus> list = new ArrayList<>();
        for (Backend backend : backends()) {
            Slot slot = slots.get(backend);
            if (slot != null) {
                boolean busy = slot.permit.availablePermits() == 0;
                list.add(new WorkerStatus(backend, busy, !busy && slot.worker.available()));
            }
        }
        return list;
    }
}
