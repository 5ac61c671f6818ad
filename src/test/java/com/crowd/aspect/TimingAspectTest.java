package com.crowd.aspect;

import com.crowd.model.result.RecomputeResult;
import com.crowd.service.SignalService;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class TimingAspectTest {

    @Autowired
    private SignalService signalService;

    @Test
    public void testTimedMethodRecordsExecutionTime() {
        // Given
        TimingAspect.getAndClearExecutionTime();
        
        // When
        RecomputeResult result = signalService.requestRecompute("9q8yy");
        
        // Then
        assertEquals("9q8yy", result.getGroupPrefix());
        String executionTime = TimingAspect.getAndClearExecutionTime();
        assertTrue(executionTime.endsWith("ms"));
        
        // After clearing, should get "0ms" if no timing is active
        assertEquals("0ms", TimingAspect.getAndClearExecutionTime());
    }
    
    @Test
    public void testTimedServicesAreProxied() {
        // If the Spring context starts with the service proxied, the aspect is in place
        assertTrue(AopUtils.isAopProxy(signalService));
    }
    
    @Test
    public void testFailureLoggedWithStackTrace(CapturedOutput output) {
        // Given
        TimingAspect.getAndClearExecutionTime();
        
        // When: a cell shorter than the grouping precision is rejected by the aggregation pass
        assertThrows(IllegalArgumentException.class, () -> signalService.requestRecompute("dr5"));
        
        // Then
        assertTrue(TimingAspect.getAndClearExecutionTime().endsWith("ms"));
        assertTrue(output.getAll().contains("requestRecompute failed after"));
        assertTrue(output.getAll().contains("ERROR"));
        assertTrue(output.getAll().contains("java.lang.IllegalArgumentException: Cell 'dr5' is shorter"));
    }
}
