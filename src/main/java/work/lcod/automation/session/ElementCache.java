package work.lcod.automation.session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded map from generated reference keys ({@code e1}, {@code e2}, ...) to element handles.
 * Least recently used entries are evicted once {@link #capacity()} is reached.
 */
public final class ElementCache<E> {
    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final AtomicLong counter = new AtomicLong();
    private final Map<String, E> entries;

    public ElementCache() {
        this(DEFAULT_CAPACITY);
    }

    public ElementCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, E> eldest) {
                return size() > ElementCache.this.capacity;
            }
        };
    }

    public String add(E element) {
        var key = "e" + counter.incrementAndGet();
        synchronized (entries) {
            entries.put(key, element);
        }
        return key;
    }

    public Optional<E> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            return Optional.ofNullable(entries.get(key));
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
