import io.rileyhe1.tur.Shell.ShellAction;
import io.rileyhe1.tur.Shell.ShellEvents;
import io.rileyhe1.tur.Shell.ShellTopic;
import io.rileyhe1.tur.Util.Subscription;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ShellEvents.
 */
class ShellEventsTest
{
    private ShellEvents events;

    @BeforeEach
    void setUp()
    {
        events = new ShellEvents();
    }

    @Test
    void testDeliversToTopicSubscribersInOrder()
    {
        List<String> seen = new ArrayList<>();
        events.subscribe(ShellTopic.ACTION, action -> seen.add("first:" + action));
        events.subscribe(ShellTopic.ACTION, action -> seen.add("second:" + action));
        events.subscribe(ShellTopic.HOME_EMPTY_STATE, empty -> seen.add("home:" + empty));

        events.publish(ShellTopic.ACTION, ShellAction.OPEN_ADD_DIALOG);

        assertEquals(List.of("first:OPEN_ADD_DIALOG", "second:OPEN_ADD_DIALOG"), seen);
    }

    @Test
    void testUnsubscribe()
    {
        List<ShellAction> seen = new ArrayList<>();
        Subscription subscription = events.subscribe(ShellTopic.ACTION, seen::add);

        subscription.close();
        events.publish(ShellTopic.ACTION, ShellAction.QUIT_APP);

        assertTrue(seen.isEmpty());
    }

    @Test
    void testFailingListenerIsIsolated()
    {
        List<ShellAction> seen = new ArrayList<>();
        events.subscribe(ShellTopic.ACTION, action -> { throw new IllegalStateException("listener bug"); });
        events.subscribe(ShellTopic.ACTION, seen::add);

        events.publish(ShellTopic.ACTION, ShellAction.TOGGLE_SIDEBAR);

        assertEquals(List.of(ShellAction.TOGGLE_SIDEBAR), seen);
    }

    @Test
    void testLastPayloadIsRetained()
    {
        assertFalse(events.isHomeEmpty(), "Home is not empty until told otherwise");
        assertFalse(events.lastPayload(ShellTopic.HOME_EMPTY_STATE).isPresent());

        events.publish(ShellTopic.HOME_EMPTY_STATE, true);

        assertTrue(events.isHomeEmpty());
        assertEquals(Boolean.TRUE, events.lastPayload(ShellTopic.HOME_EMPTY_STATE).get());
    }

    @Test
    void testRejectsNulls()
    {
        assertThrows(IllegalArgumentException.class, () -> events.publish(ShellTopic.ACTION, null));
        assertThrows(IllegalArgumentException.class, () -> events.subscribe(null, action -> { }));
        assertThrows(IllegalArgumentException.class, () -> events.subscribe(ShellTopic.ACTION, null));
    }
}
