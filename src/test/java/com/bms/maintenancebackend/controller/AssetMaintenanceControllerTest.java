package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.config.SecurityConfig;
import com.bms.maintenancebackend.dto.AssetReliabilityMetrics;
import com.bms.maintenancebackend.dto.RecordMaintenanceRequest;
import com.bms.maintenancebackend.exception.ValidationException;
import com.bms.maintenancebackend.maintenance.MaintenanceHistoryService;
import com.bms.maintenancebackend.model.MaintenanceHistory;
import com.bms.maintenancebackend.service.AssetReliabilityService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AssetMaintenanceController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class AssetMaintenanceControllerTest {

    private static final String RECORD_BODY = "{"
            + "\"organizationId\":\"org1\","
            + "\"maintenanceType\":\"PREVENTIVE\","
            + "\"performedDate\":\"2024-04-02T09:00:00\","
            + "\"description\":\"Replaced filters\","
            + "\"nextMaintenanceDue\":\"2024-07-01T00:00:00\""
            + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MaintenanceHistoryService historyService;

    @MockBean
    private AssetReliabilityService reliabilityService;

    @Test
    @WithMockUser(authorities = "MANAGER")
    void testRecordMaintenance_usesPathAsset() throws Exception {
        MaintenanceHistory history = new MaintenanceHistory();
        history.setId("h1");
        history.setAssetId("A1");
        history.setNextMaintenanceDue(LocalDateTime.of(2024, 7, 1, 0, 0));
        when(historyService.recordCompletedMaintenance(argThat((RecordMaintenanceRequest r) ->
                "A1".equals(r.getAssetId()) && LocalDateTime.of(2024, 7, 1, 0, 0).equals(r.getNextMaintenanceDue()))))
                .thenReturn(history);

        mockMvc.perform(post("/api/assets/A1/maintenance-history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECORD_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("h1"))
                .andExpect(jsonPath("$.nextMaintenanceDue").value("2024-07-01T00:00:00"));
    }

    @Test
    @WithMockUser(authorities = "MANAGER")
    void testRecordMaintenance_missingPerformedDate() throws Exception {
        mockMvc.perform(post("/api/assets/A1/maintenance-history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\":\"org1\",\"maintenanceType\":\"CORRECTIVE\",\"description\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.performedDate").exists());

        verifyNoInteractions(historyService);
    }

    @Test
    @WithMockUser(authorities = "MANAGER")
    void testRecordMaintenance_invalidDates() throws Exception {
        when(historyService.recordCompletedMaintenance(any()))
                .thenThrow(new ValidationException("nextMaintenanceDue", "Next maintenance due cannot be before the performed date"));

        mockMvc.perform(post("/api/assets/A1/maintenance-history")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECORD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.nextMaintenanceDue").exists());
    }

    @Test
    @WithMockUser(authorities = "ADMIN")
    void testGetHistory() throws Exception {
        MaintenanceHistory history = new MaintenanceHistory();
        history.setId("h1");
        when(historyService.getHistory("A1", "org1", 5)).thenReturn(List.of(history));

        mockMvc.perform(get("/api/assets/A1/maintenance-history").param("organizationId", "org1").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("h1"));
    }

    @Test
    @WithMockUser(authorities = "ADMIN")
    void testGetReliability_defaultPeriod() throws Exception {
        when(reliabilityService.calculateAssetReliability("A1", "org1", 12)).thenReturn(AssetReliabilityMetrics.builder()
                .assetId("A1")
                .periodMonths(12)
                .maintenanceFrequency(4)
                .build());

        mockMvc.perform(get("/api/assets/A1/reliability").param("organizationId", "org1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.periodMonths").value(12))
                .andExpect(jsonPath("$.maintenanceFrequency").value(4));
    }

    @Test
    @WithMockUser(authorities = "TECHNICIAN")
    void testGetReliability_forbiddenForTechnician() throws Exception {
        mockMvc.perform(get("/api/assets/A1/reliability").param("organizationId", "org1"))
                .andExpect(status().isForbidden());
    }
}
