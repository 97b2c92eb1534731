package hle.affinity.backend;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandleResourcesTest {

    private static AutoCloseable tracked(List<String> closed, String name) {
        return () -> closed.add(name);
    }

    @Test
    void shouldReleaseInReverseOrder() {
        List<String> closed = new ArrayList<>();
        HandleResources resources = new HandleResources("handle-1");

        resources.register(tracked(closed, "connector"));
        resources.register(tracked(closed, "session"));
        resources.register(tracked(closed, "processor"));

        assertEquals(3, resources.size());
        assertEquals(3, resources.releaseAll());
        assertEquals(List.of("processor", "session", "connector"), closed);
        assertEquals(0, resources.size());
    }

    @Test
    void shouldContinueAfterFailedRelease() {
        List<String> closed = new ArrayList<>();
        HandleResources resources = new HandleResources("handle-2");
        AutoCloseable broken = () -> {
            throw new IllegalStateException("session already gone");
        };

        resources.register(tracked(closed, "connector"));
        resources.register(broken);
        resources.register(tracked(closed, "processor"));

        assertEquals(2, resources.releaseAll());
        assertEquals(List.of("processor", "connector"), closed);
    }

    @Test
    void shouldReleaseOnlyOnce() {
        List<String> closed = new ArrayList<>();
        HandleResources resources = new HandleResources("handle-3");
        resources.register(tracked(closed, "connector"));

        resources.releaseAll();
        assertEquals(0, resources.releaseAll());

        assertEquals(1, closed.size());
    }

    @Test
    void shouldReturnRegisteredResource() {
        HandleResources resources = new HandleResources("handle-4");
        AutoCloseable connector = tracked(new ArrayList<>(), "connector");

        assertSame(connector, resources.register(connector));
        assertThrows(NullPointerException.class, () -> resources.register((AutoCloseable) null));
    }
}
