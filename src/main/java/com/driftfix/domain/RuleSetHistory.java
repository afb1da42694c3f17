package com.driftfix.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RuleSetHistory {
    PreprocessingRuleSet active;
    PreprocessingRuleSet previous;
    long latestVersion;
    List<AppliedPatch> patchLog;

    public static RuleSetHistory initial() {
        return RuleSetHistory.builder()
            .active(PreprocessingRuleSet.identity())
            .latestVersion(0)
            .patchLog(List.of())
            .build();
    }

    public boolean canRollBack() {
        return previous != null;
    }

    public RuleSetHistory applied(List<AppliedPatch> patches, Instant now, int maxLogSize) {
        long version = latestVersion + 1;
        PreprocessingRuleSet next = active;
        List<AppliedPatch> log = new ArrayList<>(patchLog);
        for (AppliedPatch patch : patches) {
            next = next.compose(patch.getId(), patch.getParameters());
            log.add(patch.toBuilder().appliedAt(now).ruleSetVersion(version).build());
        }
        next = next.toBuilder().version(version).createdAt(now).build();
        return toBuilder()
            .active(next)
            .previous(active)
            .latestVersion(version)
            .patchLog(trim(log, maxLogSize))
            .build();
    }

    public RuleSetHistory rolledBack(Instant now) {
        long revertedVersion = active.getVersion();
        List<AppliedPatch> log = new ArrayList<>(patchLog.size());
        for (AppliedPatch patch : patchLog) {
            if (patch.getRuleSetVersion() == revertedVersion && patch.getRolledBackAt() == null) {
                log.add(patch.toBuilder().rolledBackAt(now).build());
            } else {
                log.add(patch);
            }
        }
        return toBuilder()
            .active(previous)
            .previous(null)
            .patchLog(Collections.unmodifiableList(log))
            .build();
    }

    private static List<AppliedPatch> trim(List<AppliedPatch> log, int maxLogSize) {
        int from = Math.max(0, log.size() - maxLogSize);
        return Collections.unmodifiableList(new ArrayList<>(log.subList(from, log.size())));
    }
}
