package work.lcod.automation.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.automation.model.ElementCriteria;

/**
 * {@link AutomationSession} over an {@link ElementDriver}: located elements are stored in an
 * {@link ElementCache} and exposed to callers by reference key only.
 */
public final class CachedSession<E> implements AutomationSession {
    private final ElementDriver<E> driver;
    private final ElementCache<E> cache;

    public CachedSession(ElementDriver<E> driver) {
        this(driver, new ElementCache<>());
    }

    public CachedSession(ElementDriver<E> driver, ElementCache<E> cache) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public ElementCache<E> cache() {
        return cache;
    }

    @Override
    public SessionResult<String> attach(String processName) {
        return driver.attach(processName);
    }

    @Override
    public SessionResult<String> attachByPid(int pid) {
        return driver.attachByPid(pid);
    }

    @Override
    public boolean isAttached() {
        return driver.isAttached();
    }

    @Override
    public SessionResult<String> focus() {
        return driver.focus();
    }

    @Override
    public SessionResult<String> snapshot(int maxDepth) {
        return driver.snapshot(maxDepth);
    }

    @Override
    public SessionResult<ElementRef> find(ElementCriteria criteria) {
        return register(driver.find(criteria));
    }

    @Override
    public SessionResult<ElementRef> findByPath(List<String> path) {
        return register(driver.findByPath(path));
    }

    @Override
    public SessionResult<List<ElementRef>> children(String ref) {
        E parent = null;
        if (ref != null) {
            var resolved = cache.get(ref);
            if (resolved.isEmpty()) {
                return unknownRef(ref);
            }
            parent = resolved.get();
        }
        var refs = new ArrayList<ElementRef>();
        for (var child : driver.children(parent)) {
            refs.add(new ElementRef(cache.add(child), driver.describe(child)));
        }
        return SessionResult.ok(refs, "Found " + refs.size() + " children");
    }

    @Override
    public SessionResult<String> click(String ref) {
        return withElement(ref, driver::click);
    }

    @Override
    public SessionResult<String> rightClick(String ref) {
        return withElement(ref, driver::rightClick);
    }

    @Override
    public SessionResult<String> typeText(String text) {
        return driver.typeText(text);
    }

    @Override
    public SessionResult<String> sendKeys(String keys) {
        return driver.sendKeys(keys);
    }

    @Override
    public SessionResult<String> setValue(String ref, String value) {
        return withElement(ref, element -> driver.setValue(element, value));
    }

    @Override
    public SessionResult<String> getValue(String ref) {
        return withElement(ref, driver::getValue);
    }

    @Override
    public SessionResult<String> readProperty(String ref, String property) {
        return withElement(ref, element -> driver.readProperty(element, property));
    }

    @Override
    public SessionResult<Map<String, String>> properties(String ref) {
        return withElement(ref, element -> {
            var properties = driver.properties(element);
            return SessionResult.ok(properties, properties.size() + " properties");
        });
    }

    @Override
    public SessionResult<Boolean> isEnabled(String ref) {
        return withElement(ref, element -> {
            var enabled = driver.isEnabled(element);
            return SessionResult.ok(enabled, "IsEnabled=" + enabled);
        });
    }

    @Override
    public SessionResult<String> fileDialog(String filePath) {
        return driver.fileDialog(filePath);
    }

    @Override
    public SessionResult<String> screenshot() {
        return driver.screenshot();
    }

    @Override
    public SessionResult<String> launch(LaunchRequest request) {
        return driver.launch(request);
    }

    @Override
    public SessionResult<String> waitForWindow(WindowCriteria criteria, Duration timeout, Duration pollInterval) {
        return driver.waitForWindow(criteria, timeout, pollInterval);
    }

    private SessionResult<ElementRef> register(SessionResult<E> found) {
        if (!found.success() || found.value() == null) {
            return SessionResult.failure(found.message());
        }
        var key = cache.add(found.value());
        return SessionResult.ok(new ElementRef(key, driver.describe(found.value())), found.message());
    }

    private <T> SessionResult<T> withElement(String ref, Function<E, SessionResult<T>> action) {
        var element = ref == null ? null : cache.get(ref).orElse(null);
        if (element == null) {
            return unknownRef(ref);
        }
        return action.apply(element);
    }

    private static <T> SessionResult<T> unknownRef(String ref) {
        return SessionResult.failure("Unknown ref '" + ref + "'");
    }
}
