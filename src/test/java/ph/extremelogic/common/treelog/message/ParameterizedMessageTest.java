package ph.extremelogic.common.treelog.message;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParameterizedMessageTest {

    @Test
    @DisplayName("Should substitute placeholders in order")
    void testSubstitution() {
        assertEquals("user bob logged in from 10.0.0.1",
                ParameterizedMessage.format("user {} logged in from {}", "bob", "10.0.0.1"));
    }

    @Test
    @DisplayName("Should render null arguments as null")
    void testNullArgument() {
        assertEquals("value=null", ParameterizedMessage.format("value={}", (Object) null));
    }

    @Test
    @DisplayName("Should leave surplus placeholders untouched")
    void testMissingArguments() {
        assertEquals("a=1 b={}", ParameterizedMessage.format("a={} b={}", 1));
    }

    @Test
    @DisplayName("Should append leftover arguments")
    void testLeftoverArguments() {
        assertEquals("done [2, x]", ParameterizedMessage.format("done", 2, "x"));
    }

    @Test
    @DisplayName("Should return the format unchanged without arguments")
    void testNoArguments() {
        assertEquals("plain {}", ParameterizedMessage.format("plain {}"));
        assertNull(ParameterizedMessage.format(null, 1));
    }
}
