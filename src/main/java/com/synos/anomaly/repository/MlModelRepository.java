package com.synos.anomaly.repository;

import com.synos.anomaly.entity.MlModelRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MlModelRepository extends JpaRepository<MlModelRecord, String> {
}
