package com.bms.maintenancebackend.controller;

import com.bms.maintenancebackend.config.SecurityConfig;
import com.bms.maintenancebackend.dto.ComplaintConversionRequest;
import com.bms.maintenancebackend.exception.InvalidStateException;
import com.bms.maintenancebackend.maintenance.ComplaintConversionService;
import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderCategory;
import com.bms.maintenancebackend.model.WorkOrderPriority;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ComplaintController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class ComplaintControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ComplaintConversionService conversionService;

    private WorkOrder workOrder(WorkOrderStatus status, String assignedTo) {
        WorkOrder workOrder = new WorkOrder();
        workOrder.setId("wo1");
        workOrder.setOrganizationId("org1");
        workOrder.setComplaintId("C1");
        workOrder.setCategory(WorkOrderCategory.PLUMBING);
        workOrder.setPriority(WorkOrderPriority.MEDIUM);
        workOrder.setStatus(status);
        workOrder.setAssignedTo(assignedTo);
        return workOrder;
    }

    @Test
    @WithMockUser(username = "manager-1", authorities = "MANAGER")
    void testConvertToWorkOrder_withoutBody() throws Exception {
        when(conversionService.convertComplaintToWorkOrder(eq("C1"), eq("org1"), isNull(), eq("manager-1")))
                .thenReturn(workOrder(WorkOrderStatus.OPEN, null));

        mockMvc.perform(post("/api/complaints/C1/convert-to-work-order").param("organizationId", "org1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("wo1"))
                .andExpect(jsonPath("$.category").value("PLUMBING"))
                .andExpect(jsonPath("$.status").value("OPEN"));
    }

    @Test
    @WithMockUser(username = "manager-1", authorities = "ADMIN")
    void testConvertToWorkOrder_withOverrides() throws Exception {
        when(conversionService.convertComplaintToWorkOrder(eq("C1"), eq("org1"),
                argThat((ComplaintConversionRequest r) -> r != null
                        && "tech-9".equals(r.getAssignedTo())
                        && r.getPriority() == WorkOrderPriority.HIGH),
                eq("manager-1")))
                .thenReturn(workOrder(WorkOrderStatus.ASSIGNED, "tech-9"));

        mockMvc.perform(post("/api/complaints/C1/convert-to-work-order")
                        .param("organizationId", "org1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assignedTo\":\"tech-9\",\"priority\":\"HIGH\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ASSIGNED"))
                .andExpect(jsonPath("$.assignedTo").value("tech-9"));
    }

    @Test
    @WithMockUser(authorities = "MANAGER")
    void testConvertToWorkOrder_alreadyLinked() throws Exception {
        when(conversionService.convertComplaintToWorkOrder(any(), any(), any(), any()))
                .thenThrow(new InvalidStateException("Complaint C1 is already linked to work order wo0"));

        mockMvc.perform(post("/api/complaints/C1/convert-to-work-order").param("organizationId", "org1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"));
    }

    @Test
    @WithMockUser(authorities = "TECHNICIAN")
    void testConvertToWorkOrder_forbiddenForTechnician() throws Exception {
        mockMvc.perform(post("/api/complaints/C1/convert-to-work-order").param("organizationId", "org1"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(conversionService);
    }
}
