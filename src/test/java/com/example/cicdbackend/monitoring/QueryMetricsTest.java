package com.example.cicdbackend.monitoring;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;

class QueryMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final QueryMetrics metrics = new QueryMetrics(registry);

    @Test
    void successfulQueryIsTimed() {
        String result = metrics.time("list_approvals", () -> "rows");

        assertEquals("rows", result);
        assertEquals(1, registry.get("cicd.query.duration")
                .tag("operation", "list_approvals").tag("outcome", "success").timer().count());
        assertNull(registry.find("cicd.query.errors").counter());
    }

    @Test
    void failedQueryIsCountedAndRethrown() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");

        DataAccessResourceFailureException thrown = assertThrows(DataAccessResourceFailureException.class,
                () -> metrics.time("get_deployment", () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(1.0, registry.get("cicd.query.errors")
                .tag("operation", "get_deployment")
                .tag("exception", "DataAccessResourceFailureException")
                .counter().count());
        assertEquals(1, registry.get("cicd.query.duration")
                .tag("operation", "get_deployment").tag("outcome", "error").timer().count());
    }
}
