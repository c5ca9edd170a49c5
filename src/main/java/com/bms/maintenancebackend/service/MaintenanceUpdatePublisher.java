package com.bms.maintenancebackend.service;

import com.bms.maintenancebackend.dto.MaintenanceRunSummary;
import com.bms.maintenancebackend.model.WorkOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class MaintenanceUpdatePublisher {

    public static final String WORK_ORDER_TOPIC = "/topic/work-orders";
    public static final String RUN_TOPIC = "/topic/maintenance-runs";

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public MaintenanceUpdatePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void publishWorkOrderUpdate(WorkOrder workOrder) {
        messagingTemplate.convertAndSend(WORK_ORDER_TOPIC, workOrder);
    }

    public void publishRunSummary(MaintenanceRunSummary summary) {
        messagingTemplate.convertAndSend(RUN_TOPIC, summary);
    }
}
