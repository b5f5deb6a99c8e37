package io.faultline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("faultline-transport-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("faultline-transport-1", thread.getName());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("retry-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertEquals("retry-1", t1.getName());
        assertEquals("retry-2", t2.getName());
    }

    @Test
    void threadsLogTheirOwnUncaughtExceptions() throws InterruptedException {
        DaemonThreadFactory factory = new DaemonThreadFactory("crash-");
        Thread thread = factory.newThread(() -> {
            throw new IllegalStateException("boom");
        });

        assertNotNull(thread.getUncaughtExceptionHandler());
        thread.start();
        thread.join(5000);
        assertTrue(!thread.isAlive());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () ->
                new DaemonThreadFactory(null));
    }
}
