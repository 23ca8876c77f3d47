import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.options.AttributeRange;
import io.github.flameyossnowy.associative.api.utils.AttributeValues;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttributeRangeTest {

    @Test
    void boundsAreInclusive() {
        AttributeRange range = AttributeRange.between(100, 200);

        assertTrue(range.contains(100L));
        assertTrue(range.contains(200L));
        assertTrue(range.contains(150.5d));
        assertFalse(range.contains(99L));
        assertFalse(range.contains(201L));
    }

    @Test
    void openBounds() {
        assertTrue(AttributeRange.atLeast(100).contains(Long.MAX_VALUE));
        assertFalse(AttributeRange.atLeast(100).contains(99L));
        assertTrue(AttributeRange.atMost("m").contains("apple"));
        assertFalse(AttributeRange.atMost("m").contains("zebra"));
    }

    @Test
    void nullIsNeverContained() {
        assertFalse(AttributeRange.atLeast(0).contains(null));
    }

    @Test
    void rangeNeedsABound() {
        assertThrows(IllegalArgumentException.class, () -> new AttributeRange(null, null));
    }

    @Test
    void comparisonRules() {
        assertEquals(0, AttributeValues.compare(3, 3L));
        assertTrue(AttributeValues.compare(2L, 2.5d) < 0);
        assertTrue(AttributeValues.compare(null, "a") < 0);
        assertTrue(AttributeValues.compare(false, true) < 0);
        assertTrue(AttributeValues.compare("dailymotion", "vimeo") < 0);
        assertTrue(AttributeValues.equal(120, 120L));
        assertThrows(ValidationException.class, () -> AttributeValues.compare("1", 1L));
    }
}
