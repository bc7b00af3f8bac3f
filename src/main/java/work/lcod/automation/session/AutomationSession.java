package work.lcod.automation.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import work.lcod.automation.model.ElementCriteria;

/**
 * Backend capability driven by the macro executor. Elements are addressed by reference keys handed
 * out by {@link #find}, {@link #findByPath} and {@link #children}.
 *
 * <p>Implementations are not required to be reentrant; callers serialize access.
 */
public interface AutomationSession {
    SessionResult<String> attach(String processName);

    SessionResult<String> attachByPid(int pid);

    boolean isAttached();

    SessionResult<String> focus();

    /** Text rendering of the element tree of the attached window, {@code maxDepth} levels deep. */
    SessionResult<String> snapshot(int maxDepth);

    SessionResult<ElementRef> find(ElementCriteria criteria);

    SessionResult<ElementRef> findByPath(List<String> path);

    /** Children of {@code ref}, or of the attached window when {@code ref} is null. */
    SessionResult<List<ElementRef>> children(String ref);

    SessionResult<String> click(String ref);

    SessionResult<String> rightClick(String ref);

    SessionResult<String> typeText(String text);

    SessionResult<String> sendKeys(String keys);

    SessionResult<String> setValue(String ref, String value);

    SessionResult<String> getValue(String ref);

    SessionResult<String> readProperty(String ref, String property);

    SessionResult<Map<String, String>> properties(String ref);

    SessionResult<Boolean> isEnabled(String ref);

    SessionResult<String> fileDialog(String filePath);

    /** Captures the attached window; the value is the PNG image, base64 encoded. */
    SessionResult<String> screenshot();

    SessionResult<String> launch(LaunchRequest request);

    SessionResult<String> waitForWindow(WindowCriteria criteria, Duration timeout, Duration pollInterval);
}
