package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.domain.model.SubscriptionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for EventFilterMatcher glob semantics.
 */
class EventFilterMatcherTest {

    @Test
    @DisplayName("Wildcard '*' matches every type")
    void starMatchesEverything() {
        assertThat(EventFilterMatcher.matches("*", "order.created")).isTrue();
        assertThat(EventFilterMatcher.matches("*", "ping")).isTrue();
    }

    @Test
    @DisplayName("Trailing '*' matches one or more remaining segments")
    void trailingStarMatchesRemainingSegments() {
        assertThat(EventFilterMatcher.matches("order.*", "order.created")).isTrue();
        assertThat(EventFilterMatcher.matches("order.*", "order.item.added")).isTrue();
        assertThat(EventFilterMatcher.matches("order.*", "order")).isFalse();
        assertThat(EventFilterMatcher.matches("order.*", "invoice.created")).isFalse();
    }

    @Test
    @DisplayName("Inner '*' matches exactly one segment")
    void innerStarMatchesSingleSegment() {
        assertThat(EventFilterMatcher.matches("*.created", "order.created")).isTrue();
        assertThat(EventFilterMatcher.matches("*.created", "order.item.created")).isFalse();
        assertThat(EventFilterMatcher.matches("order.*.added", "order.item.added")).isTrue();
    }

    @Test
    @DisplayName("Prefix pattern inside a segment")
    void prefixPatternWithinSegment() {
        assertThat(EventFilterMatcher.matches("order.cre*", "order.created")).isTrue();
        assertThat(EventFilterMatcher.matches("order.cre*", "order.cancelled")).isFalse();
    }

    @Test
    @DisplayName("Exact pattern matches only the identical type")
    void exactMatch() {
        assertThat(EventFilterMatcher.matches("order.created", "order.created")).isTrue();
        assertThat(EventFilterMatcher.matches("order.created", "order.created.v2")).isFalse();
        assertThat(EventFilterMatcher.matches(null, "order.created")).isFalse();
    }

    @Test
    @DisplayName("Subscription with empty sources accepts any source, otherwise one must match")
    void subscriptionFilters() {
        Subscription anySource = Subscription.builder()
                .eventTypes(List.of("order.*"))
                .sources(List.of())
                .status(SubscriptionStatus.ACTIVE)
                .build();
        Subscription shopOnly = Subscription.builder()
                .eventTypes(List.of("order.*", "invoice.paid"))
                .sources(List.of("shop"))
                .status(SubscriptionStatus.ACTIVE)
                .build();

        assertThat(EventFilterMatcher.matches(anySource, "order.created", "pos")).isTrue();
        assertThat(EventFilterMatcher.matches(shopOnly, "invoice.paid", "shop")).isTrue();
        assertThat(EventFilterMatcher.matches(shopOnly, "order.created", "pos")).isFalse();
        assertThat(EventFilterMatcher.matches(shopOnly, "user.created", "shop")).isFalse();
    }
}
