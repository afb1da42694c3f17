package com.driftfix.repository;

import com.driftfix.domain.RuleSetHistory;
import com.driftfix.entity.RuleSetRecord;
import com.driftfix.exception.RuleSetStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "drift.patch-store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaRuleSetStore implements RuleSetStore {

    private final RuleSetRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void save(String modelId, RuleSetHistory history) {
        String json;
        try {
            json = objectMapper.writeValueAsString(history);
        } catch (JsonProcessingException ex) {
            throw new RuleSetStoreException("Could not serialize rule set for model '" + modelId + "'", ex);
        }
        RuleSetRecord record = repository.findById(modelId)
            .orElseGet(() -> RuleSetRecord.builder().modelId(modelId).build());
        record.setActiveVersion(history.getActive().getVersion());
        record.setCanRollBack(history.canRollBack());
        record.setHistoryJson(json);
        repository.save(record);
        log.debug("Rule set persisted | modelId={} | activeVersion={}", modelId, record.getActiveVersion());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RuleSetHistory> load(String modelId) {
        return repository.findById(modelId).map(record -> {
            try {
                return objectMapper.readValue(record.getHistoryJson(), RuleSetHistory.class);
            } catch (JsonProcessingException ex) {
                throw new RuleSetStoreException("Stored rule set for model '" + modelId + "' is unreadable", ex);
            }
        });
    }
}
