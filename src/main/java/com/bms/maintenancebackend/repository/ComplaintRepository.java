package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.Complaint;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ComplaintRepository extends MongoRepository<Complaint, String> {

    Optional<Complaint> findByIdAndOrganizationId(String id, String organizationId);
}
