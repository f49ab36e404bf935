package com.routecast.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteTest {

    @Nested
    @DisplayName("route key")
    class RouteKeyTests {

        @Test
        @DisplayName("key is pipe-separated origin|destination|product|weekday")
        void keyFormat() {
            assertEquals("ATL|DFW|PARCEL|2", new Route("ATL", "DFW", "PARCEL", 2).routeKey());
        }

        @Test
        @DisplayName("fromKey reverses routeKey")
        void parse() {
            Route route = new Route("ORD", "LAX", "FREIGHT", 5);
            assertEquals(route, Route.fromKey(route.routeKey()));
        }

        @Test
        @DisplayName("malformed keys are rejected")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> Route.fromKey("ATL|DFW|PARCEL"));
            assertThrows(IllegalArgumentException.class, () -> Route.fromKey("ATL|DFW|PARCEL|mon"));
        }

        @Test
        @DisplayName("segments may not contain the separator")
        void separatorInSegment() {
            assertThrows(IllegalArgumentException.class, () -> new Route("A|B", "DFW", "PARCEL", 1));
        }
    }

    @Nested
    @DisplayName("period ordering")
    class PeriodTests {

        @Test
        @DisplayName("orders by year then week")
        void ordering() {
            assertTrue(Period.of(1, 2025).isAfter(Period.of(52, 2024)));
            assertTrue(Period.of(10, 2025).compareTo(Period.of(11, 2025)) < 0);
        }

        @Test
        @DisplayName("plusWeeks rolls over after week 52 in a 52-week year")
        void rollover() {
            assertEquals(Period.of(2, 2026), Period.of(51, 2025).plusWeeks(3));
            assertEquals(Period.of(1, 2026), Period.of(53, 2025).plusWeeks(1));
            assertEquals(Period.of(7, 2025), Period.of(7, 2025).plusWeeks(0));
        }

        @Test
        @DisplayName("plusWeeks passes through ISO week 53 of a long year")
        void longYear() {
            assertEquals(Period.of(53, 2026), Period.of(52, 2026).plusWeeks(1));
            assertEquals(Period.of(1, 2027), Period.of(53, 2026).plusWeeks(1));
            assertEquals(Period.of(1, 2021), Period.of(51, 2020).plusWeeks(3));
        }

        @Test
        @DisplayName("week outside 1..53 is rejected")
        void invalidWeek() {
            assertThrows(IllegalArgumentException.class, () -> Period.of(0, 2025));
            assertThrows(IllegalArgumentException.class, () -> Period.of(54, 2025));
        }
    }

    @Test
    @DisplayName("tier badness follows declaration order")
    void tierOrder() {
        assertTrue(ConfidenceTier.LOW.isWorseThan(ConfidenceTier.MEDIUM));
        assertTrue(ConfidenceTier.MEDIUM.isWorseThan(ConfidenceTier.HIGH));
        assertFalse(ConfidenceTier.HIGH.isWorseThan(ConfidenceTier.HIGH));
    }
}
