package org.sn.realtime.subscription;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sn.realtime.testutils.TestUtil.PARAMETRIZED_TEST_DISPLAY_NAME;
import static org.sn.realtime.testutils.TestUtil.assertException;

import java.util.List;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.realtime.testutils.TestBase;


public class SubscriptionKeyTest extends TestBase {
    @Test
    void testSingleToken() {
        var key = new SubscriptionKey("jobs", CacheKeyDescriptor.of("jobs-list"));
        assertEquals("jobs::jobs-list", key.asString());
        assertFalse(key.descriptor().isList());
    }

    @Test
    void testList() {
        var key = new SubscriptionKey("job_assignments", CacheKeyDescriptor.of("assignments", "42"));
        assertEquals("job_assignments::[\"assignments\",\"42\"]", key.asString());
        assertTrue(key.descriptor().isList());
        assertThat(key.descriptor().tokens(), Matchers.contains("assignments", "42"));
    }

    @Test
    void testOneElementListIsSameAsToken() {
        assertEquals(CacheKeyDescriptor.of("jobs-list"), CacheKeyDescriptor.of(List.of("jobs-list")));
        assertEquals(new SubscriptionKey("jobs", CacheKeyDescriptor.of("jobs-list")),
                     new SubscriptionKey("jobs", CacheKeyDescriptor.of(List.of("jobs-list"))));
        assertNotEquals(CacheKeyDescriptor.of("a", "b"), CacheKeyDescriptor.of("b", "a"));
    }

    @ParameterizedTest(name = PARAMETRIZED_TEST_DISPLAY_NAME)
    @ValueSource(strings = {"jobs::jobs-list", "job_assignments::[\"assignments\",\"42\"]", "timesheets::[not json"})
    void testParse(String value) {
        assertEquals(value, SubscriptionKey.parse(value).asString());
    }

    @Test
    void testParseList() {
        var key = SubscriptionKey.parse("jobs::[\"jobs-list\",\"today\"]");
        assertEquals("jobs", key.table());
        assertEquals(CacheKeyDescriptor.of("jobs-list", "today"), key.descriptor());
    }

    @Test
    void testInvalid() {
        assertException(() -> SubscriptionKey.parse("jobs"), IllegalArgumentException.class, "not a subscription key: 'jobs'");
        assertException(() -> new SubscriptionKey("", CacheKeyDescriptor.of("x")), IllegalArgumentException.class);
        assertException(() -> CacheKeyDescriptor.of(List.of()), IllegalArgumentException.class);
    }
}
