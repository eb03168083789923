package com.skyt;

import com.skyt.core.oracle.ContractTestOracle;
import com.skyt.core.oracle.Oracle;
import com.skyt.core.strategy.StrategyRegistry;
import com.skyt.pipeline.PipelineState;
import com.skyt.pipeline.TransformResult;
import com.skyt.pipeline.TransformationPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SkytApplicationTest {

    @Autowired
    private TransformationPipeline pipeline;

    @Autowired
    private StrategyRegistry strategies;

    @Autowired
    private Oracle oracle;

    @Test
    void contextLoads() {
        assertNotNull(pipeline);
        assertEquals(10, strategies.getStrategies().size());
        assertTrue(oracle instanceof ContractTestOracle);
    }

    @Test
    void testWiredPipelineConverges() {
        TransformResult result = pipeline.transform(
                "int f(int n) { int r = n + 1; return r; }", "int f(int n) { return n + 1; }");

        assertEquals(PipelineState.CONVERGED, result.getOutcome());
    }
}
