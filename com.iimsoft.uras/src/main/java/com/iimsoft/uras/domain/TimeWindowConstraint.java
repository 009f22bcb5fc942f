package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.time.TimeWindow;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class TimeWindowConstraint extends Constraint {

    private final ConstraintTarget target;
    private final String targetId;
    private final TimeWindow window;

    public TimeWindowConstraint(ConstraintTarget target, String targetId, TimeWindow window) {
        if (targetId == null) {
            throw new InvalidSpecException("time window 约束缺少 targetId");
        }
        this.target = Objects.requireNonNull(target, "target");
        this.targetId = targetId;
        this.window = Objects.requireNonNull(window, "window");
    }

    public static TimeWindowConstraint forActivity(String activityId, TimeWindow window) {
        return new TimeWindowConstraint(ConstraintTarget.ACTIVITY, activityId, window);
    }

    public static TimeWindowConstraint forTask(String taskId, TimeWindow window) {
        return new TimeWindowConstraint(ConstraintTarget.TASK, taskId, window);
    }

    @Override
    public Kind getKind() {
        return Kind.TIME_WINDOW;
    }

    @Override
    public String toString() {
        return "TimeWindow[" + target + " " + targetId + " " + window + "]";
    }
}
