package work.lcod.automation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StepActionTest {
    @Test
    void resolvesWireNamesAndAlias() {
        assertEquals(Optional.of(StepAction.FIND_BY_PATH), StepAction.fromName(" Find_By_Path "));
        assertEquals(Optional.of(StepAction.SEND_KEYS), StepAction.fromName("keys"));
        assertTrue(StepAction.fromName("nope").isEmpty());
        assertTrue(StepAction.fromName(null).isEmpty());
    }

    @Test
    void attachmentIndependentActions() {
        assertTrue(StepAction.WAIT.attachmentIndependent());
        assertTrue(StepAction.LAUNCH.attachmentIndependent());
        assertFalse(StepAction.CLICK.attachmentIndependent());
        assertFalse(StepAction.SCREENSHOT.attachmentIndependent());
    }

    @Test
    void acceptedNamesAreSorted() {
        var names = StepAction.acceptedNames();
        assertEquals("attach", names.get(0));
        assertEquals(StepAction.values().length + 1, names.size());
    }
}
