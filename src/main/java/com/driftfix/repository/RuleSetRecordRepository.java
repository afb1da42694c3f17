package com.driftfix.repository;

import com.driftfix.entity.RuleSetRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleSetRecordRepository extends JpaRepository<RuleSetRecord, String> {
}
