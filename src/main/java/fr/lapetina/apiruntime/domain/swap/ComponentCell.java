package fr.lapetina.apiruntime.domain.swap;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hot-swappable slot holding one immutable component instance.
 *
 * Readers copy the current reference under the read lock and release it
 * immediately; they may keep using that instance for as long as they like.
 * A writer replaces the reference under the write lock and gets the previous
 * instance back, so it can close it once in-flight readers are done.
 *
 * Replacement is a single reference assignment: a reader sees either the old
 * or the new instance, never a partially built one.
 *
 * @param <T> component type, expected to be immutable or internally thread-safe
 */
public final class ComponentCell<T> {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String name;

    // Guarded by lock
    private T current;

    public ComponentCell(String name, T initial) {
        this.name = Objects.requireNonNull(name, "Cell name is required");
        this.current = Objects.requireNonNull(initial, "Initial value is required");
    }

    /**
     * Returns the currently installed instance.
     */
    public T read() {
        lock.readLock().lock();
        try {
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Installs {@code replacement} and returns the instance it replaced.
     */
    public T swap(T replacement) {
        Objects.requireNonNull(replacement, "Replacement is required");
        lock.writeLock().lock();
        try {
            T previous = current;
            current = replacement;
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ComponentCell{" +
                "name='" + name + '\'' +
                ", current=" + read() +
                '}';
    }
}
