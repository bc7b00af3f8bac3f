package work.lcod.automation.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.session.ElementDriver;
import work.lcod.automation.session.LaunchRequest;
import work.lcod.automation.session.SessionResult;
import work.lcod.automation.session.WindowCriteria;

/**
 * Scriptable in-memory backend. Elements are plain automation ids carrying a property map; every
 * call is recorded in {@link #calls()}.
 */
public final class FakeDriver implements ElementDriver<String> {
    private final Map<String, Map<String, String>> elements = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> misses = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean attached = true;
    private volatile Duration clickDelay = Duration.ZERO;
    private volatile Duration stubbornClick = Duration.ZERO;
    private final AtomicInteger inProgress = new AtomicInteger();
    private final AtomicInteger maxInProgress = new AtomicInteger();

    /** Adds an element; {@code properties} are alternating keys and values. */
    public FakeDriver element(String automationId, String... properties) {
        var props = new ConcurrentHashMap<String, String>();
        props.put("Name", automationId);
        props.put("IsEnabled", "True");
        for (int i = 0; i + 1 < properties.length; i += 2) {
            props.put(properties[i], properties[i + 1]);
        }
        elements.put(automationId, props);
        return this;
    }

    public FakeDriver property(String automationId, String key, String value) {
        elements.get(automationId).put(key, value);
        return this;
    }

    /** The next {@code count} lookups of {@code automationId} fail as if it had not appeared yet. */
    public FakeDriver missFirst(String automationId, int count) {
        misses.put(automationId, new AtomicInteger(count));
        return this;
    }

    public FakeDriver clickDelay(Duration delay) {
        this.clickDelay = delay;
        return this;
    }

    /** Clicks keep the backend busy for {@code busy} and ignore interrupts, like a native UI call. */
    public FakeDriver stubbornClick(Duration busy) {
        this.stubbornClick = busy;
        return this;
    }

    /** Calls inside the backend right now; clicks, focus, finds and typing are counted. */
    public int callsInProgress() {
        return inProgress.get();
    }

    public int maxConcurrentCalls() {
        return maxInProgress.get();
    }

    public FakeDriver attached(boolean attached) {
        this.attached = attached;
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    @Override
    public SessionResult<String> attach(String processName) {
        calls.add("attach " + processName);
        attached = true;
        return SessionResult.ok("Attached to " + processName);
    }

    @Override
    public SessionResult<String> attachByPid(int pid) {
        calls.add("attach pid " + pid);
        attached = true;
        return SessionResult.ok("Attached to pid " + pid);
    }

    @Override
    public boolean isAttached() {
        return attached;
    }

    @Override
    public SessionResult<String> focus() {
        enter();
        try {
            calls.add("focus");
            return SessionResult.ok("Window focused");
        } finally {
            leave();
        }
    }

    @Override
    public SessionResult<String> snapshot(int maxDepth) {
        calls.add("snapshot " + maxDepth);
        return SessionResult.ok("Window (depth " + maxDepth + ")");
    }

    @Override
    public SessionResult<String> find(ElementCriteria criteria) {
        enter();
        try {
            calls.add("find " + criteria.describe());
            var id = criteria.automationId() != null ? criteria.automationId() : byName(criteria.name());
            return lookup(id);
        } finally {
            leave();
        }
    }

    @Override
    public SessionResult<String> findByPath(List<String> path) {
        calls.add("findByPath " + String.join("/", path));
        return lookup(path.isEmpty() ? null : path.get(path.size() - 1));
    }

    @Override
    public List<String> children(String parent) {
        calls.add("children " + parent);
        var ids = new TreeSet<String>();
        elements.forEach((id, props) -> {
            if (parent == null ? !props.containsKey("Parent") : parent.equals(props.get("Parent"))) {
                ids.add(id);
            }
        });
        return List.copyOf(ids);
    }

    @Override
    public SessionResult<String> click(String element) {
        enter();
        try {
            calls.add("click " + element);
            if (!stubbornClick.isZero()) {
                long until = System.nanoTime() + stubbornClick.toNanos();
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            } else if (!clickDelay.isZero()) {
                try {
                    Thread.sleep(clickDelay.toMillis());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return SessionResult.failure("Interrupted");
                }
            }
            return SessionResult.ok("Clicked " + describe(element));
        } finally {
            leave();
        }
    }

    @Override
    public SessionResult<String> rightClick(String element) {
        calls.add("rightClick " + element);
        return SessionResult.ok("Right-clicked " + describe(element));
    }

    @Override
    public SessionResult<String> typeText(String text) {
        enter();
        try {
            calls.add("type " + text);
            return SessionResult.ok("Typed '" + text + "'");
        } finally {
            leave();
        }
    }

    @Override
    public SessionResult<String> sendKeys(String keys) {
        calls.add("sendKeys " + keys);
        return SessionResult.ok("Sent keys: " + keys);
    }

    @Override
    public SessionResult<String> setValue(String element, String value) {
        calls.add("setValue " + element + "=" + value);
        elements.get(element).put("Value", value);
        return SessionResult.ok("Set value of " + describe(element) + " to '" + value + "'");
    }

    @Override
    public SessionResult<String> getValue(String element) {
        var value = elements.get(element).getOrDefault("Value", "");
        return SessionResult.ok(value, "Value: " + value);
    }

    @Override
    public SessionResult<String> readProperty(String element, String property) {
        var value = elements.get(element).get(property);
        if (value == null) {
            return SessionResult.failure("Property '" + property + "' not available on " + describe(element));
        }
        return SessionResult.ok(value, property + "=" + value);
    }

    @Override
    public Map<String, String> properties(String element) {
        return new LinkedHashMap<>(new TreeMap<>(elements.get(element)));
    }

    @Override
    public boolean isEnabled(String element) {
        return Boolean.parseBoolean(elements.get(element).getOrDefault("IsEnabled", "True"));
    }

    @Override
    public SessionResult<String> fileDialog(String filePath) {
        calls.add("fileDialog " + filePath);
        return SessionResult.ok("File dialog set to " + filePath);
    }

    @Override
    public SessionResult<String> screenshot() {
        calls.add("screenshot");
        return SessionResult.ok("iVBORw0KGgo=", "Screenshot captured");
    }

    @Override
    public SessionResult<String> launch(LaunchRequest request) {
        calls.add("launch " + request.exePath());
        attached = true;
        return SessionResult.ok("Launched " + request.exePath());
    }

    @Override
    public SessionResult<String> waitForWindow(WindowCriteria criteria, Duration timeout, Duration pollInterval) {
        calls.add("waitForWindow " + criteria.titleContains());
        return SessionResult.ok("Window ready: " + criteria.titleContains());
    }

    @Override
    public String describe(String element) {
        return "Button [" + element + "]";
    }

    private void enter() {
        var now = inProgress.incrementAndGet();
        maxInProgress.accumulateAndGet(now, Math::max);
    }

    private void leave() {
        inProgress.decrementAndGet();
    }

    private String byName(String name) {
        if (name == null) {
            return null;
        }
        for (var entry : elements.entrySet()) {
            if (name.equals(entry.getValue().get("Name"))) {
                return entry.getKey();
            }
        }
        return null;
    }

    private SessionResult<String> lookup(String id) {
        if (id == null || !elements.containsKey(id)) {
            return SessionResult.failure("Element not found");
        }
        var remaining = misses.get(id);
        if (remaining != null && remaining.getAndDecrement() > 0) {
            return SessionResult.failure("Element not found");
        }
        return SessionResult.ok(id, "Found " + describe(id));
    }
}
