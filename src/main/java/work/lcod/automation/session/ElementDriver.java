package work.lcod.automation.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import work.lcod.automation.model.ElementCriteria;

/**
 * Element-handle level backend. {@link CachedSession} turns handles into reference keys.
 *
 * @param <E> native element handle type
 */
public interface ElementDriver<E> {
    SessionResult<String> attach(String processName);

    SessionResult<String> attachByPid(int pid);

    boolean isAttached();

    SessionResult<String> focus();

    SessionResult<String> snapshot(int maxDepth);

    SessionResult<E> find(ElementCriteria criteria);

    SessionResult<E> findByPath(List<String> path);

    List<E> children(E parent);

    SessionResult<String> click(E element);

    SessionResult<String> rightClick(E element);

    SessionResult<String> typeText(String text);

    SessionResult<String> sendKeys(String keys);

    SessionResult<String> setValue(E element, String value);

    SessionResult<String> getValue(E element);

    SessionResult<String> readProperty(E element, String property);

    Map<String, String> properties(E element);

    boolean isEnabled(E element);

    SessionResult<String> fileDialog(String filePath);

    SessionResult<String> screenshot();

    SessionResult<String> launch(LaunchRequest request);

    SessionResult<String> waitForWindow(WindowCriteria criteria, Duration timeout, Duration pollInterval);

    /** Short description used in messages, e.g. {@code Button "OK" [okButton]}. */
    String describe(E element);
}
