package com.synos.anomaly.repository;

import com.synos.anomaly.entity.BaselineRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BaselineRepository extends JpaRepository<BaselineRecord, String> {
}
