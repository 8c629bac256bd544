package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.Subscription;

import java.util.Collection;

/**
 * Nokta ile ayrılmış type/source glob eşleştirmesi.
 * "*" her şeyi eşler; ara segmentte "*" tek segment, son segmentte "*" kalan bir veya daha fazla segmenti eşler.
 * Segment içinde "order_*" gibi önek kalıpları da desteklenir.
 */
public final class EventFilterMatcher {

    private EventFilterMatcher() {
    }

    /** Subscription filtresi: type glob setinden biri ve (boş değilse) source setinden biri eşleşmeli. */
    public static boolean matches(Subscription subscription, String type, String source) {
        Collection<String> types = subscription.getEventTypes();
        boolean typeMatches = types == null || types.isEmpty() || matchesAny(types, type);
        return typeMatches && matchesAnyOrEmpty(subscription.getSources(), source);
    }

    /** Boş veya null kalıp seti her değeri kabul eder. */
    public static boolean matchesAnyOrEmpty(Collection<String> patterns, String value) {
        return patterns == null || patterns.isEmpty() || matchesAny(patterns, value);
    }

    public static boolean matchesAny(Collection<String> patterns, String value) {
        return patterns.stream().anyMatch(pattern -> matches(pattern, value));
    }

    public static boolean matches(String pattern, String value) {
        if (pattern == null || value == null) {
            return false;
        }
        if ("*".equals(pattern) || pattern.equals(value)) {
            return true;
        }

        String[] patternSegments = pattern.split("\\.", -1);
        String[] valueSegments = value.split("\\.", -1);
        for (int i = 0; i < patternSegments.length; i++) {
            String segment = patternSegments[i];
            boolean last = i == patternSegments.length - 1;
            if (last && "*".equals(segment)) {
                return valueSegments.length > i;
            }
            if (i >= valueSegments.length || !segmentMatches(segment, valueSegments[i])) {
                return false;
            }
        }
        return patternSegments.length == valueSegments.length;
    }

    private static boolean segmentMatches(String segment, String value) {
        if ("*".equals(segment)) {
            return true;
        }
        if (segment.endsWith("*")) {
            return value.startsWith(segment.substring(0, segment.length() - 1));
        }
        return segment.equals(value);
    }
}
