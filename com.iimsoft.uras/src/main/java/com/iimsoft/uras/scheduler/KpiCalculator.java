package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.exception.InconsistentScheduleException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 无状态的 KPI 聚合。排程里出现问题中不存在的活动 / 资源时抛 {@link InconsistentScheduleException}。
 */
public final class KpiCalculator {

    private KpiCalculator() {
    }

    public static ScheduleKpi calculate(Schedule schedule, ProblemIndex index) {
        long[] busy = new long[index.resourceCount()];
        long[] completion = new long[index.taskCount()];
        boolean[] hasCompletion = new boolean[index.taskCount()];

        for (Assignment as : schedule.getAssignments()) {
            int a = index.activityIndexOf(as.getActivityId());
            int r = index.resourceIndexOf(as.getResourceId());
            int t = index.taskOf(a);
            if (!index.task(t).getId().equals(as.getTaskId())) {
                throw new InconsistentScheduleException("assignment " + as.getActivityId()
                        + " 的 taskId=" + as.getTaskId() + " 与问题不一致");
            }
            busy[r] += as.durationMs();
            if (!hasCompletion[t] || as.getEndMs() > completion[t]) {
                completion[t] = as.getEndMs();
                hasCompletion[t] = true;
            }
        }

        long total = 0;
        long max = 0;
        int onTime = 0;
        int counted = 0;
        double flow = 0;
        for (int t = 0; t < index.taskCount(); t++) {
            if (!hasCompletion[t]) {
                continue;
            }
            Task task = index.task(t);
            counted++;
            long tardiness = task.getDueMs() == null ? 0 : Math.max(0, completion[t] - task.getDueMs());
            if (tardiness > 0) {
                total += tardiness;
                max = Math.max(max, tardiness);
            } else {
                onTime++;
            }
            long release = task.getReleaseMs() == null ? index.originMs() : task.getReleaseMs();
            flow += completion[t] - release;
        }

        long makespan = schedule.getMakespanMs();
        Map<String, Double> utilization = new LinkedHashMap<>();
        double utilSum = 0;
        for (int r = 0; r < index.resourceCount(); r++) {
            Resource res = index.resource(r);
            long available = res.getCalendar().availableTimeBetween(index.originMs(), makespan) * index.capacity(r);
            double u = available <= 0 ? 0.0 : (double) busy[r] / available;
            utilization.put(res.getId(), u);
            utilSum += u;
        }

        return new ScheduleKpi(
                makespan,
                total,
                counted == 0 ? 0.0 : (double) total / counted,
                max,
                counted == 0 ? 1.0 : (double) onTime / counted,
                utilization,
                utilization.isEmpty() ? 0.0 : utilSum / utilization.size(),
                counted == 0 ? 0.0 : flow / counted);
    }
}
