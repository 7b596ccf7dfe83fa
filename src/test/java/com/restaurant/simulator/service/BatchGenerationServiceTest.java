package com.restaurant.simulator.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.model.GenerationSummary;
import com.restaurant.simulator.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class BatchGenerationServiceTest {

    private GenerationService generationService;
    private ExecutorService executor;
    private BatchGenerationService batchService;

    @BeforeEach
    void setUp() {
        generationService = mock(GenerationService.class);
        executor = Executors.newFixedThreadPool(2);
        batchService = new BatchGenerationService(generationService, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void generateAll_returnsSummariesInRequestOrder() {
        List<GenerationRequest> requests = List.of(
                TestDataFactory.createRequest("loc-a", 7),
                TestDataFactory.createRequest("loc-b", 7),
                TestDataFactory.createRequest("loc-c", 7));
        when(generationService.generateAndStore(any()))
                .thenAnswer(inv -> TestDataFactory.createSummary(
                        inv.<GenerationRequest>getArgument(0).getLocationId(), GenerationService.STATUS_SUCCESS));

        List<GenerationSummary> summaries = batchService.generateAll(requests);

        assertThat(summaries).extracting(GenerationSummary::getLocationId).containsExactly("loc-a", "loc-b", "loc-c");
        assertThat(summaries).allMatch(s -> GenerationService.STATUS_SUCCESS.equals(s.getStatus()));
        verify(generationService, times(3)).generateAndStore(any());
    }

    @Test
    void generateAll_failedLocation_doesNotStopOthers() {
        when(generationService.generateAndStore(argThat(r -> r != null && "loc-bad".equals(r.getLocationId()))))
                .thenThrow(new AerospikeException(ResultCode.SERVER_NOT_AVAILABLE, "node down"));
        when(generationService.generateAndStore(argThat(r -> r != null && "loc-ok".equals(r.getLocationId()))))
                .thenReturn(TestDataFactory.createSummary("loc-ok", GenerationService.STATUS_SUCCESS));

        List<GenerationSummary> summaries = batchService.generateAll(List.of(
                TestDataFactory.createRequest("loc-bad", 7),
                TestDataFactory.createRequest("loc-ok", 7)));

        assertThat(summaries.get(0).getStatus()).isEqualTo(GenerationService.STATUS_FAILED);
        assertThat(summaries.get(0).getError()).contains("node down");
        assertThat(summaries.get(1).getStatus()).isEqualTo(GenerationService.STATUS_SUCCESS);
    }
}
