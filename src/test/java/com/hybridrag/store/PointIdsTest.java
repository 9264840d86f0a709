package com.hybridrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import com.hybridrag.error.ValidationException;

class PointIdsTest {

    @Test
    void shouldDeriveSameIdForSamePathAndLineRegardlessOfSeparator() {
        long unix = PointIds.forFile("docs/guide.md", 12);
        long windows = PointIds.forFile("docs\\guide.md", 12);

        assertEquals(unix, windows);
        assertNotEquals(unix, PointIds.forFile("docs/guide.md", 13));
        assertTrue(unix >= 0);
    }

    @Test
    void shouldIgnoreWhitespaceDifferencesForContentIds() {
        assertEquals(PointIds.forContent("hello   world\n"), PointIds.forContent("  hello world"));
        assertNotEquals(PointIds.forContent("hello world"), PointIds.forContent("hello worlds"));
    }

    @Test
    void shouldKeyFileAnchoredChunksByLocationNotContent() {
        Chunk first = Chunk.doc("a.md", 3, 5, "Intro", ContentType.TEXT, "one");
        Chunk edited = first.withContent("two");
        Chunk floating = Chunk.doc(null, 3, 5, "Intro", ContentType.TEXT, "one");

        assertEquals(PointIds.forChunk(first), PointIds.forChunk(edited));
        assertEquals(PointIds.forContent("one"), PointIds.forChunk(floating));
    }

    @Test
    void shouldParseNumericAndDecimalStringIds() {
        assertEquals(42L, PointIds.parse(42));
        assertEquals(9_007_199_254_740_993L, PointIds.parse("9007199254740993"));
        assertEquals(7L, PointIds.parse(" 7 "));
        assertEquals(12L, PointIds.parse(12.0));
        assertEquals(Long.MAX_VALUE, PointIds.parse(BigInteger.valueOf(Long.MAX_VALUE)));
    }

    @Test
    void shouldRejectInvalidIds() {
        assertThrows(ValidationException.class, () -> PointIds.parse(null));
        assertThrows(ValidationException.class, () -> PointIds.parse("abc"));
        assertThrows(ValidationException.class, () -> PointIds.parse(-1));
        assertThrows(ValidationException.class, () -> PointIds.parse(""));
    }

    @Test
    void shouldRejectIdsThatDoNotFitExactly() {
        assertThrows(ValidationException.class, () -> PointIds.parse(1.5));
        assertThrows(ValidationException.class, () -> PointIds.parse(Double.NaN));
        assertThrows(ValidationException.class, () -> PointIds.parse(BigInteger.ONE.shiftLeft(64).add(BigInteger.TEN)));
        assertThrows(ValidationException.class, () -> PointIds.parse(new BigDecimal("1e30")));
    }
}
