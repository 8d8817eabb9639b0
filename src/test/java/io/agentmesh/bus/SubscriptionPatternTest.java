package io.agentmesh.bus;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SubscriptionPatternTest {

    @Test
    void compilesEachPatternKind() {
        Assertions.assertEquals(SubscriptionPattern.Kind.ALL, SubscriptionPattern.compile("*").kind());
        Assertions.assertEquals(SubscriptionPattern.Kind.PREFIX, SubscriptionPattern.compile("price:*").kind());
        Assertions.assertEquals(SubscriptionPattern.Kind.SUFFIX, SubscriptionPattern.compile("*:tick").kind());
        Assertions.assertEquals(SubscriptionPattern.Kind.EXACT, SubscriptionPattern.compile("price:update").kind());
    }

    @Test
    void matchesByKind() {
        SubscriptionPattern prefix = SubscriptionPattern.compile("price:*");
        Assertions.assertTrue(prefix.matches("price:update"));
        Assertions.assertTrue(prefix.matches("price:"));
        Assertions.assertFalse(prefix.matches("prices:update"));
        Assertions.assertFalse(prefix.matches("price"));

        SubscriptionPattern suffix = SubscriptionPattern.compile("*:tick");
        Assertions.assertTrue(suffix.matches("clock:tick"));
        Assertions.assertFalse(suffix.matches("clock:ticks"));

        SubscriptionPattern exact = SubscriptionPattern.compile("clock:minute");
        Assertions.assertTrue(exact.matches("clock:minute"));
        Assertions.assertFalse(exact.matches("clock:minute:reply"));

        Assertions.assertTrue(SubscriptionPattern.compile("*").matches("anything:at:all"));
        Assertions.assertFalse(SubscriptionPattern.compile("*").matches(null));
    }

    @Test
    void rejectsBlankPattern() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SubscriptionPattern.compile(" "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SubscriptionPattern.compile(null));
    }
}
