package anyrun.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheKeys")
class CacheKeysTest {

    @Test
    @DisplayName("should join operation and arguments")
    void shouldJoinArguments() {
        assertEquals("list_analyses:false:0:25", CacheKeys.of("list_analyses", false, 0, 25));
    }

    @Test
    @DisplayName("should use the operation alone without arguments")
    void shouldUseOperationAlone() {
        assertEquals("get_environment", CacheKeys.of("get_environment"));
        assertEquals("get_environment", CacheKeys.of("get_environment", List.of()));
    }

    @Test
    @DisplayName("should keep arguments containing the separator apart")
    void shouldNotCollideOnSeparator() {
        assertNotEquals(CacheKeys.of("op", "a:b", "c"), CacheKeys.of("op", "a", "b:c"));
    }

    @Test
    @DisplayName("should be deterministic")
    void shouldBeDeterministic() {
        assertEquals(CacheKeys.of("get_analysis", "abc"), CacheKeys.of("get_analysis", List.of("abc")));
    }

    @Test
    @DisplayName("should reject a blank operation")
    void shouldRejectBlankOperation() {
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.of(" "));
    }
}
