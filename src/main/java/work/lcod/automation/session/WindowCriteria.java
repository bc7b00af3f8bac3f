package work.lcod.automation.session;

import work.lcod.automation.model.ElementCriteria;

/**
 * Readiness condition for {@link AutomationSession#waitForWindow}: a window whose title contains
 * {@code titleContains} and, when {@code element} is not empty, that also shows a matching element.
 */
public record WindowCriteria(String titleContains, ElementCriteria element) {
    public WindowCriteria {
        element = element == null ? ElementCriteria.NONE : element;
    }
}
