package lab.reconciler.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-JVM exclusive locks keyed by an identifier. Callers pair it with a database row lock
 * so the exclusion also holds between processes. A key's lock lives only while some
 * thread holds or waits for it.
 */
public class KeyedLocks {

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // holders and waiters, guarded by the map's per-key compute
        private int users;
    }

    private final String name;
    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public KeyedLocks(String name) {
        this.name = name;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        try {
            entry.lock.lock();
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    int activeKeys() {
        return locks.size();
    }

    @Override
    public String toString() {
        return "KeyedLocks[" + name + ", keys=" + locks.size() + "]";
    }
}
