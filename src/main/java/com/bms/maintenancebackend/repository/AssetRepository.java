package com.bms.maintenancebackend.repository;

import com.bms.maintenancebackend.model.Asset;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AssetRepository extends MongoRepository<Asset, String> {

    List<Asset> findByOrganizationIdAndStatus(String organizationId, Asset.AssetStatus status);

    Optional<Asset> findByIdAndOrganizationId(String id, String organizationId);
}
