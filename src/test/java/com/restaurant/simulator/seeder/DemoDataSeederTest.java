package com.restaurant.simulator.seeder;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.model.GenerationRequest;
import com.restaurant.simulator.service.BatchGenerationService;
import com.restaurant.simulator.service.GenerationService;
import com.restaurant.simulator.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class DemoDataSeederTest {

    @Test
    void seedRequests_coverConfiguredLocationsForAYear() {
        DemoDataSeeder seeder = new DemoDataSeeder(mock(BatchGenerationService.class), new GeneratorProperties());

        List<GenerationRequest> requests = seeder.seedRequests(TestDataFactory.REFERENCE_DATE);

        assertThat(requests).extracting(GenerationRequest::getLocationId)
                .containsExactly("loc-malasana", "loc-centro", "loc-chamberi", "loc-salamanca");
        assertThat(requests).allMatch(r -> r.getHorizonDays() == 365);
        assertThat(requests).allMatch(r -> TestDataFactory.REFERENCE_DATE.equals(r.getReferenceDate()));
        assertThat(requests.get(1).getOverrides().getBaseDailySales()).isEqualTo(5500.0);
        assertThat(requests.get(3).getOverrides().getAvgTicketMean()).isEqualTo(23.0);
    }

    @Test
    void run_seedsAllLocationsInOneBatch_andToleratesFailures() {
        BatchGenerationService batch = mock(BatchGenerationService.class);
        when(batch.generateAll(anyList())).thenReturn(List.of(
                TestDataFactory.createSummary("loc-malasana", GenerationService.STATUS_SUCCESS),
                TestDataFactory.createSummary("loc-centro", GenerationService.STATUS_FAILED)));
        DemoDataSeeder seeder = new DemoDataSeeder(batch, new GeneratorProperties());

        seeder.run();

        verify(batch, times(1)).generateAll(argThat(list -> list.size() == 4));
    }

    @Test
    void displayName_prefersConfiguredName() {
        DemoDataSeeder seeder = new DemoDataSeeder(mock(BatchGenerationService.class), new GeneratorProperties());

        assertThat(seeder.displayName("loc-centro")).isEqualTo("La Taberna Centro (loc-centro)");
        assertThat(seeder.displayName("loc-unknown")).isEqualTo("loc-unknown");
    }
}
