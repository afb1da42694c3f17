package com.driftfix.repository;

import com.driftfix.domain.RuleSetHistory;

import java.util.Optional;

public interface RuleSetStore {

    void save(String modelId, RuleSetHistory history);

    Optional<RuleSetHistory> load(String modelId);
}
