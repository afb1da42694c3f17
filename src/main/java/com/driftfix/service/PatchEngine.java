package com.driftfix.service;

import com.driftfix.config.PatchEngineSettings;
import com.driftfix.domain.AppliedPatch;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.domain.RuleSetHistory;
import com.driftfix.exception.RollbackException;
import com.driftfix.repository.RuleSetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns the active preprocessing rule set of every model. {@link #apply} and
 * {@link #rollback} are the only mutators and run under the model's write
 * lock; readers take the read lock and work on an immutable snapshot.
 * Rollback is exactly one level deep.
 * <p>
 * Locks are striped by model id, so two models may share a lock but one model
 * always maps to the same one. Only models with stored state are cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatchEngine {

    private final RuleSetStore store;
    private final PatchEngineSettings settings;

    private static final int LOCK_STRIPES = 64;

    private final ReentrantReadWriteLock[] locks = newStripes();
    private final ConcurrentHashMap<String, RuleSetHistory> histories = new ConcurrentHashMap<>();

    public PreprocessingRuleSet apply(String modelId, AppliedPatch patch) {
        return apply(modelId, List.of(patch));
    }

    public PreprocessingRuleSet apply(String modelId, List<AppliedPatch> patches) {
        if (patches.isEmpty()) {
            throw new IllegalArgumentException("At least one patch is required");
        }
        return withLock(modelId, true, () -> {
            RuleSetHistory next = history(modelId)
                .applied(patches, Instant.now(), settings.maxPatchLogSize());
            persist(modelId, next);
            log.info("Patches applied | modelId={} | version={} | patches={} | types={}",
                     modelId, next.getActive().getVersion(), patches.size(),
                     patches.stream().map(AppliedPatch::getType).toList());
            return next.getActive();
        });
    }

    public PreprocessingRuleSet rollback(String modelId) {
        return withLock(modelId, true, () -> {
            RuleSetHistory current = history(modelId);
            if (!current.canRollBack()) {
                throw new RollbackException(modelId);
            }
            RuleSetHistory next = current.rolledBack(Instant.now());
            persist(modelId, next);
            log.info("Rule set rolled back | modelId={} | from={} | to={}",
                     modelId, current.getActive().getVersion(), next.getActive().getVersion());
            return next.getActive();
        });
    }

    public FeatureMatrix transform(String modelId, FeatureMatrix features) {
        features.requireFinite("Input");
        return activeRuleSet(modelId).transform(features);
    }

    public FeatureMatrix adjustOutputs(String modelId, FeatureMatrix outputs) {
        return activeRuleSet(modelId).adjustOutputs(outputs);
    }

    public PreprocessingRuleSet activeRuleSet(String modelId) {
        return withLock(modelId, false, () -> history(modelId).getActive());
    }

    public boolean canRollBack(String modelId) {
        return withLock(modelId, false, () -> history(modelId).canRollBack());
    }

    public List<AppliedPatch> patchLog(String modelId) {
        return withLock(modelId, false, () -> history(modelId).getPatchLog());
    }

    private RuleSetHistory history(String modelId) {
        RuleSetHistory cached = histories.get(modelId);
        if (cached != null) {
            return cached;
        }
        // unknown models get a fresh identity history that is not cached
        return store.load(modelId)
            .map(loaded -> {
                RuleSetHistory raced = histories.putIfAbsent(modelId, loaded);
                return raced != null ? raced : loaded;
            })
            .orElseGet(RuleSetHistory::initial);
    }

    private void persist(String modelId, RuleSetHistory next) {
        // store first: a failed save leaves the cached state untouched
        store.save(modelId, next);
        histories.put(modelId, next);
    }

    private <T> T withLock(String modelId, boolean write, Supplier<T> action) {
        ReentrantReadWriteLock rw = locks[Math.floorMod(modelId.hashCode(), LOCK_STRIPES)];
        Lock lock = write ? rw.writeLock() : rw.readLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static ReentrantReadWriteLock[] newStripes() {
        ReentrantReadWriteLock[] stripes = new ReentrantReadWriteLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
        return stripes;
    }
}
