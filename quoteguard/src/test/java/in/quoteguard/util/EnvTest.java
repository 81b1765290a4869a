package in.quoteguard.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "QUOTEGUARD_ENV_TEST_KEY";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void fallsBackToDefaultWhenUnset() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(7, Env.getInt(KEY, 7));
        assertEquals(Duration.ofSeconds(5), Env.getSeconds(KEY, Duration.ofSeconds(5)));
        assertTrue(Env.getBool(KEY, true));
    }

    @Test
    void readsSystemProperty() {
        System.setProperty(KEY, " 45 ");

        assertEquals(45, Env.getInt(KEY, 0));
        assertEquals(45L, Env.getLong(KEY, 0L));
        assertEquals(Duration.ofSeconds(45), Env.getSeconds(KEY, Duration.ZERO));
    }

    @Test
    void unparseableNumberUsesDefault() {
        System.setProperty(KEY, "two minutes");

        assertEquals(3, Env.getInt(KEY, 3));
        assertEquals(Duration.ofMinutes(2), Env.getSeconds(KEY, Duration.ofMinutes(2)));
    }

    @Test
    void parsesBooleans() {
        System.setProperty(KEY, "TRUE");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "off");
        assertFalse(Env.getBool(KEY, true));
    }
}
