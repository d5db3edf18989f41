package benchgrid.events;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class EventLineTest {

    @Test
    void formatsWithAndWithoutTask() {
        assertEquals("NODE w1 EVENT TASK_ASSIGNED TIME 100.000000 TASK matmul",
                EventLine.format("w1", EventKind.TASK_ASSIGNED, 100.0, "matmul"));
        assertEquals("NODE w1 EVENT TASK_REQUESTED TIME 1.500000",
                EventLine.format("w1", EventKind.TASK_REQUESTED, 1.5, null));
    }

    @Test
    void rejectsNodesThatBreakTokenization() {
        assertThrows(IllegalArgumentException.class,
                () -> EventLine.format("two words", EventKind.TASK_FINISHED, 1, "primes"));
        assertThrows(IllegalArgumentException.class,
                () -> EventLine.format(" ", EventKind.TASK_FINISHED, 1, "primes"));
    }

    @Test
    void parsesTargets() {
        EventTarget t = EventTarget.parse("logger.local:5001");

        assertEquals("logger.local", t.host());
        assertEquals(5001, t.port());
        assertThrows(IllegalArgumentException.class, () -> EventTarget.parse("logger.local"));
        assertThrows(IllegalArgumentException.class, () -> EventTarget.parse("host:abc"));
        assertThrows(IllegalArgumentException.class, () -> EventTarget.parse("host:70000"));
    }

    @Test
    void parsesKindsExactly() {
        assertEquals(EventKind.TASK_FINISHED, EventKind.parse("TASK_FINISHED").orElseThrow());
        assertTrue(EventKind.parse("TASK_STARTED").isEmpty());
    }
}
