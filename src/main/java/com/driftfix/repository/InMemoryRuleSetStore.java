package com.driftfix.repository;

import com.driftfix.domain.RuleSetHistory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "drift.patch-store.type", havingValue = "memory")
public class InMemoryRuleSetStore implements RuleSetStore {

    private final ConcurrentHashMap<String, RuleSetHistory> histories = new ConcurrentHashMap<>();

    @Override
    public void save(String modelId, RuleSetHistory history) {
        histories.put(modelId, history);
    }

    @Override
    public Optional<RuleSetHistory> load(String modelId) {
        return Optional.ofNullable(histories.get(modelId));
    }
}
