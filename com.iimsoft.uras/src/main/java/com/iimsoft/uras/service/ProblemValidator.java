package com.iimsoft.uras.service;

import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.time.TimeWindow;

import java.util.List;

/**
 * 入口校验，任何算法运行前执行一次，失败抛 {@link InvalidSpecException}。
 * 结构性检查（重复 id、未知引用、前驱环）由 {@link ProblemIndex} 构造时完成；
 * 这里补充同一对象上互相矛盾的硬时间窗。
 * <p>
 * 前驱链导致的不可达（例如后继的硬截止早于前驱最早完工）不算矛盾，由求解器报告 INFEASIBLE。
 */
public final class ProblemValidator {

    private ProblemValidator() {
    }

    public static ProblemIndex validate(SchedulingProblem problem) {
        Double confidence = problem.getDurationConfidence();
        if (confidence != null && !(confidence > 0 && confidence < 1)) {
            throw new InvalidSpecException("durationConfidence 必须在 (0, 1) 内: " + confidence);
        }
        ProblemIndex index = new ProblemIndex(problem);
        for (int a = 0; a < index.activityCount(); a++) {
            checkActivityWindows(index, a);
        }
        for (int t = 0; t < index.taskCount(); t++) {
            checkTaskWindows(index, t);
        }
        return index;
    }

    private static void checkActivityWindows(ProblemIndex index, int a) {
        List<TimeWindow> windows = index.activityWindows(a);
        long dur = index.minEffectiveMs(a);
        long lb = Long.MIN_VALUE;
        long ub = Long.MAX_VALUE;
        int hard = 0;
        for (TimeWindow w : windows) {
            if (!w.isHard()) {
                continue;
            }
            hard++;
            lb = Math.max(lb, w.lowerStartBound(dur));
            ub = Math.min(ub, w.upperStartBound(dur));
        }
        if (hard > 0 && lb > ub) {
            throw new InvalidSpecException("activity " + index.activity(a).getId()
                    + " 的硬时间窗互相矛盾：最早开始 " + lb + " 晚于最晚开始 " + ub);
        }
    }

    private static void checkTaskWindows(ProblemIndex index, int t) {
        long lb = Long.MIN_VALUE;
        long ub = Long.MAX_VALUE;
        for (TimeWindow w : index.taskWindows(t)) {
            if (!w.isHard()) {
                continue;
            }
            if (w.getEarliestStartMs() != null) {
                lb = Math.max(lb, w.getEarliestStartMs());
            }
            if (w.getLatestEndMs() != null) {
                ub = Math.min(ub, w.getLatestEndMs());
            }
        }
        if (lb > ub) {
            throw new InvalidSpecException("task " + index.task(t).getId()
                    + " 的硬时间窗互相矛盾：最早开始 " + lb + " 晚于最晚结束 " + ub);
        }
    }
}
