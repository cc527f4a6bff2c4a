package com.example.usagemeter.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsageLimitTest {

    @Test
    void shouldParseNumbersAndUnlimited() {
        assertEquals(UsageLimit.of(100), UsageLimit.parse(" 100 "));
        assertTrue(UsageLimit.parse("Unlimited").isUnlimited());
        assertEquals(0, UsageLimit.parse("0").getValue());
    }

    @Test
    void shouldRejectMalformedLimits() {
        assertThrows(IllegalArgumentException.class, () -> UsageLimit.parse(""));
        assertThrows(IllegalArgumentException.class, () -> UsageLimit.parse("-5"));
        assertThrows(IllegalArgumentException.class, () -> UsageLimit.parse("lots"));
        assertThrows(IllegalStateException.class, () -> UsageLimit.unlimited().getValue());
    }

    @Test
    void shouldPermitTotalsUpToTheCeiling() {
        UsageLimit ten = UsageLimit.of(10);

        assertTrue(ten.permits(10));
        assertFalse(ten.permits(11));
        assertTrue(UsageLimit.unlimited().permits(Long.MAX_VALUE));
        assertFalse(UsageLimit.of(0).permits(1));
    }

    @Test
    void shouldReportPercentUsed() {
        assertEquals(50.0, UsageLimit.of(10).percentUsed(5));
        assertEquals(100.0, UsageLimit.of(0).percentUsed(0));
        assertEquals(0.0, UsageLimit.unlimited().percentUsed(1_000_000));
    }

    @Test
    void shouldOrderLimits() {
        assertTrue(UsageLimit.of(1000).isGreaterThan(UsageLimit.of(10)));
        assertFalse(UsageLimit.of(10).isGreaterThan(UsageLimit.of(10)));
        assertTrue(UsageLimit.unlimited().isGreaterThan(UsageLimit.of(10)));
        assertFalse(UsageLimit.unlimited().isGreaterThan(UsageLimit.unlimited()));
        assertFalse(UsageLimit.of(10).isGreaterThan(UsageLimit.unlimited()));
    }
}
