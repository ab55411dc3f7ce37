package com.pricetracker.harvester.config;

import com.pricetracker.harvester.service.CatalogQueryService;
import com.pricetracker.harvester.service.HarvestOrchestrator;
import com.pricetracker.harvester.service.HarvestService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HarvestControllerTest {

    private final HarvestService harvestService = mock(HarvestService.class);
    private final HarvestController controller = new HarvestController(
            harvestService, mock(HarvestOrchestrator.class), mock(CatalogQueryService.class));

    @Test
    void triggerWhileRunningIsRejectedWithConflict() {
        when(harvestService.isRunning()).thenReturn(true);

        ResponseEntity<Map<String, String>> response = controller.trigger();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("status", "already-running");
        verify(harvestService, never()).runHarvest();
    }
}
