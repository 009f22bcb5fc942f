package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InconsistentScheduleException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 完整排程：活动 id -> Assignment，外加软违反列表。
 * <p>
 * 只能通过 {@link Builder} 增量组装，build() 之后不可变。
 */
public final class Schedule {

    private final Map<String, Assignment> assignments;
    private final List<Violation> violations;
    private final long makespanMs;

    private Schedule(Map<String, Assignment> assignments, List<Violation> violations) {
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.violations = List.copyOf(violations);
        long max = 0;
        for (Assignment a : assignments.values()) {
            max = Math.max(max, a.getEndMs());
        }
        this.makespanMs = max;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Schedule of(Collection<Assignment> assignments) {
        Builder b = builder();
        assignments.forEach(b::assign);
        return b.build();
    }

    public Collection<Assignment> getAssignments() {
        return assignments.values();
    }

    public Optional<Assignment> get(String activityId) {
        return Optional.ofNullable(assignments.get(activityId));
    }

    public boolean contains(String activityId) {
        return assignments.containsKey(activityId);
    }

    public int size() {
        return assignments.size();
    }

    /** 所有 assignment 的最大结束时间，空排程为 0 */
    public long getMakespanMs() {
        return makespanMs;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public double getPenalty() {
        return violations.stream().mapToDouble(Violation::getPenalty).sum();
    }

    public boolean hasHardViolations() {
        return violations.stream().anyMatch(Violation::isHard);
    }

    @Override
    public String toString() {
        return "Schedule[" + assignments.size() + " assignments, makespan=" + makespanMs + "]";
    }

    public static final class Builder {
        private final Map<String, Assignment> assignments = new LinkedHashMap<>();
        private final List<Violation> violations = new ArrayList<>();

        private Builder() {
        }

        public Builder assign(Assignment assignment) {
            if (assignments.putIfAbsent(assignment.getActivityId(), assignment) != null) {
                throw new InconsistentScheduleException("activity 重复排程: " + assignment.getActivityId());
            }
            return this;
        }

        public Builder violation(Violation violation) {
            violations.add(violation);
            return this;
        }

        public Builder violations(Collection<Violation> list) {
            violations.addAll(list);
            return this;
        }

        public Schedule build() {
            return new Schedule(assignments, violations);
        }
    }
}
