package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.Unit;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UnitRepository extends MongoRepository<Unit, String> {

    Optional<Unit> findByIdAndOrganizationId(String id, String organizationId);
}
