package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.WorkOrder;
import com.bms.maintenancebackend.model.WorkOrderStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WorkOrderRepository extends MongoRepository<WorkOrder, String> {

    Optional<WorkOrder> findByIdAndOrganizationId(String id, String organizationId);

    List<WorkOrder> findByOrganizationIdAndStatusOrderByCreatedAtDesc(String organizationId, WorkOrderStatus status);

}
