package com.vidnyan.patchast;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.patchast.application.port.in.PatchSourceUseCase;
import com.vidnyan.patchast.application.port.out.PythonParser;
import com.vidnyan.patchast.adapter.out.parser.PythonProcessParser;
import com.vidnyan.patchast.application.service.PatchingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "patchast.parse-timeout=5s")
class PatchAstApplicationTests {

    @Autowired
    private PatchSourceUseCase patchSourceUseCase;

    @Autowired
    private PythonParser pythonParser;

    @Autowired
    private PatchAstProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    @Qualifier("parserStreamExecutor")
    private ExecutorService parserStreamExecutor;

    @Test
    void contextLoads_ShouldWirePortsToAdapters() {
        assertInstanceOf(PatchingService.class, patchSourceUseCase);
        assertInstanceOf(PythonProcessParser.class, pythonParser);
    }

    @Test
    void properties_ShouldBindFromEnvironment() {
        assertEquals(Duration.ofSeconds(5), properties.getParseTimeout());
        assertEquals("python3", properties.getPythonExecutable());
        assertEquals("<string>", properties.getDefaultFilename());
        assertFalse(properties.isCollectChildren());
    }

    @Test
    void objectMapper_ShouldOnlyBeConfiguredForReading() {
        assertFalse(objectMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertFalse(objectMapper.isEnabled(SerializationFeature.INDENT_OUTPUT));
    }

    @Test
    void parserStreamExecutor_ShouldBeDedicatedPool() {
        assertFalse(parserStreamExecutor.isShutdown());
        assertNotSame(ForkJoinPool.commonPool(), parserStreamExecutor);
    }
}
