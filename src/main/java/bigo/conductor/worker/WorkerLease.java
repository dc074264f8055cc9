package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive hold on a registered worker. Closing releases the handle; closing twice is a no-op.
 */
public final class WorkerLease implements AutoCloseable {

    private final Worker worker;
    private final Semaphore permit;
    private final AtomicBoolean released = new AtomicBoolean(false);

    WorkerLease(Worker worker, Semaphore permit) {
        this.worker = worker;
        this.permit = permit;
    }

    public Backend backend() {
        return worker.backend();
    }

    public ExecutionResult execute(ExecutionContext ctx, Task task) throws WorkerException {
        if (released.get()) {
            throw new IllegalStateException("lease on " + backend() + " already released");
        }
        return worker.execute(ctx, task);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            permit.release();
        }
    }
}
