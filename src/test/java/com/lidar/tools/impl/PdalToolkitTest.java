package com.lidar.tools.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.config.LidarProperties;
import com.lidar.exception.ToolExecutionException;
import com.lidar.tools.PointPipeline;
import com.lidar.tools.ProcessResult;
import com.lidar.tools.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PdalToolkitTest {

    @Mock
    private ProcessRunner processRunner;

    private PdalToolkit toolkit;

    @BeforeEach
    void setUp() {
        toolkit = new PdalToolkit(processRunner, new ObjectMapper(), new LidarProperties());
    }

    @Test
    void testPipelineGoesThroughStdin() {
        // Given
        PointPipeline pipeline = PointPipeline.ingest(Path.of("/work/in.laz"), Path.of("/work/out.laz"), null);

        // When
        toolkit.runPipeline(pipeline, Path.of("/work"));

        // Then
        ArgumentCaptor<String> stdin = ArgumentCaptor.forClass(String.class);
        verify(processRunner).run(eq(List.of("pdal", "pipeline", "--stdin")), stdin.capture(),
            eq(Path.of("/work")), any());
        assertTrue(stdin.getValue().startsWith("{\"pipeline\":["));
        assertTrue(stdin.getValue().contains("filters.outlier"));
    }

    @Test
    void testPointCountFromMetadata() {
        when(processRunner.run(anyList(), isNull(), any(), any()))
            .thenReturn(new ProcessResult(0, "{\"metadata\":{\"count\":1843221,\"minx\":610000.0}}", ""));

        assertEquals(1843221L, toolkit.pointCount(Path.of("/work/colorized.laz")));
    }

    @Test
    void testPointCountMissing() {
        when(processRunner.run(anyList(), isNull(), any(), any()))
            .thenReturn(new ProcessResult(0, "{\"metadata\":{}}", ""));

        assertThrows(ToolExecutionException.class, () -> toolkit.pointCount(Path.of("/work/colorized.laz")));
    }

    @Test
    void testPointCountUnreadable() {
        when(processRunner.run(anyList(), isNull(), any(), any()))
            .thenReturn(new ProcessResult(0, "not json", ""));

        assertThrows(ToolExecutionException.class, () -> toolkit.pointCount(Path.of("/work/colorized.laz")));
    }
}
