package com.example.mailagent.workflow;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises work on one instance inside this process. Different instances never wait on each other.
 * Across processes the row lock taken by {@link InstanceTransactions} does the same job.
 */
@Component
public class InstanceLocks {

    private final ConcurrentMap<String, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String instanceId, Supplier<T> work) {
        Holder holder = locks.compute(instanceId, (id, existing) -> {
            Holder h = existing != null ? existing : new Holder();
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return work.get();
        } finally {
            holder.lock.unlock();
            locks.compute(instanceId, (id, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute
        private int users;
    }
}
