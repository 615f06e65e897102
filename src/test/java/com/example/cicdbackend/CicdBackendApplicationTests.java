package com.example.cicdbackend;

import com.example.cicdbackend.config.BackendProperties;
import com.example.cicdbackend.config.DataSourceConfig;
import com.example.cicdbackend.service.ApprovalQueryService;
import com.example.cicdbackend.service.DeploymentQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CicdBackendApplicationTests {

    @Autowired
    private BackendProperties properties;

    @Autowired
    private ApprovalQueryService approvalQueryService;

    @Autowired
    private DeploymentQueryService deploymentQueryService;

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(approvalQueryService);
        assertNotNull(deploymentQueryService);
    }

    @Test
    void configurationIsLoaded() {
        assertEquals("test", properties.getEnvironment());
        assertEquals("test-host", properties.getHostname());
        assertEquals(100, properties.getQuery().getMaxLimit());
        assertEquals(5, properties.getQuery().getMaxLineageDepth());
        assertEquals(Duration.ofMillis(10), properties.getSystemInfo().getCpuSampleInterval());
        assertFalse(properties.isDatabaseConfigured());
    }

    @Test
    void databaseUrlPoolIsOnlyBuiltWhenConfigured() {
        assertTrue(context.getBeansOfType(DataSourceConfig.class).isEmpty());
    }
}
