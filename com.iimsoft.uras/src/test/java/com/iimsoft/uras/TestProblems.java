package com.iimsoft.uras;

import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.ActivityDuration;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.domain.TimeWindowConstraint;
import com.iimsoft.uras.time.TimeWindow;

import java.util.List;

/**
 * 测试共用的小规模问题。
 */
public final class TestProblems {

    private TestProblems() {
    }

    public static Resource machine(String id) {
        return Resource.builder().id(id).category("machine").build();
    }

    public static Resource machine(String id, double efficiency) {
        return Resource.builder().id(id).category("machine").efficiency(efficiency).build();
    }

    public static Activity activity(String id, String taskId, int sequence, long ms, String... resourceIds) {
        return Activity.builder()
                .id(id)
                .taskId(taskId)
                .sequence(sequence)
                .duration(ActivityDuration.fixed(ms))
                .resourceGroup("machine", List.of(resourceIds))
                .build();
    }

    public static Task task(String id, Activity... activities) {
        Task.TaskBuilder b = Task.builder().id(id);
        for (Activity a : activities) {
            b.activity(a);
        }
        return b.build();
    }

    /** T1/A1 5000 ms，可用 M1（效率 1.0）或 M2（效率 0.9） */
    public static SchedulingProblem singleActivityTwoMachines() {
        return SchedulingProblem.builder()
                .resource(machine("M1"))
                .resource(machine("M2", 0.9))
                .task(task("T1", activity("A1", "T1", 1, 5000, "M1", "M2")))
                .build();
    }

    /**
     * A1 -> A2（同一任务的顺序），A2 必须在 8000 前完成，但 A1 最早 5000 才完工。
     */
    public static SchedulingProblem unreachableDeadline() {
        return SchedulingProblem.builder()
                .resource(machine("M1"))
                .resource(machine("M2"))
                .task(task("T1",
                        activity("A1", "T1", 1, 5000, "M1"),
                        activity("A2", "T1", 2, 5000, "M2")))
                .constraint(TimeWindowConstraint.forActivity("A2", TimeWindow.deadline(8000)))
                .build();
    }

    /**
     * 两个任务、两台机器的交叉路线，最优 makespan = 5000（两台机器都满负荷）。
     */
    public static SchedulingProblem crossedJobShop() {
        return SchedulingProblem.builder()
                .resource(machine("M1"))
                .resource(machine("M2"))
                .task(task("J1",
                        activity("J1-1", "J1", 1, 3000, "M1"),
                        activity("J1-2", "J1", 2, 2000, "M2")))
                .task(task("J2",
                        activity("J2-1", "J2", 1, 3000, "M2"),
                        activity("J2-2", "J2", 2, 2000, "M1")))
                .build();
    }

    /**
     * 单机两任务：优先级高的长任务会被贪心先排，导致短任务违反软截止。
     * 最优是先做短任务：makespan 5000，无罚分。
     */
    public static SchedulingProblem priorityVersusSoftDeadline() {
        return SchedulingProblem.builder()
                .resource(machine("M1"))
                .task(Task.builder().id("LONG").priority(5)
                        .activity(activity("L1", "LONG", 1, 4000, "M1")).build())
                .task(task("SHORT", activity("S1", "SHORT", 1, 1000, "M1")))
                .constraint(TimeWindowConstraint.forActivity("S1", TimeWindow.deadline(1000).soft(1.0)))
                .build();
    }

    /** 3 个任务 × 3 道工序，3 台机器，带效率差异，供 GA 使用 */
    public static SchedulingProblem threeByThree() {
        return SchedulingProblem.builder()
                .resource(machine("M1"))
                .resource(machine("M2", 0.8))
                .resource(machine("M3", 1.25))
                .task(task("J1",
                        activity("J1-1", "J1", 1, 3000, "M1", "M2"),
                        activity("J1-2", "J1", 2, 2000, "M2", "M3"),
                        activity("J1-3", "J1", 3, 2000, "M1", "M3")))
                .task(task("J2",
                        activity("J2-1", "J2", 1, 2000, "M2", "M3"),
                        activity("J2-2", "J2", 2, 4000, "M1"),
                        activity("J2-3", "J2", 3, 1000, "M2", "M3")))
                .task(task("J3",
                        activity("J3-1", "J3", 1, 2500, "M1", "M3"),
                        activity("J3-2", "J3", 2, 1500, "M1", "M2"),
                        activity("J3-3", "J3", 3, 3000, "M2", "M3")))
                .build();
    }
}
