package com.iimsoft.uras.cp;

import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.score.Evaluation;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 目前最好的可行解。多个搜索线程共享，只通过 CAS 提交更优解。
 */
final class Incumbent {

    static final class Best {
        final Schedule schedule;
        final Evaluation evaluation;

        Best(Schedule schedule, Evaluation evaluation) {
            this.schedule = schedule;
            this.evaluation = evaluation;
        }

        long cost() {
            return evaluation.getCost();
        }
    }

    private final AtomicReference<Best> best = new AtomicReference<>();

    /** @return 是否成为新的最优 */
    boolean offer(Schedule schedule, Evaluation evaluation) {
        Best candidate = new Best(schedule, evaluation);
        while (true) {
            Best current = best.get();
            if (current != null && current.cost() <= candidate.cost()) {
                return false;
            }
            if (best.compareAndSet(current, candidate)) {
                return true;
            }
        }
    }

    Best get() {
        return best.get();
    }

    long cost() {
        Best b = best.get();
        return b == null ? Long.MAX_VALUE : b.cost();
    }
}
