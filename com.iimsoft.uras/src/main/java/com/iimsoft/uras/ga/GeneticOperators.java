package com.iimsoft.uras.ga;

import com.iimsoft.uras.domain.ProblemIndex;

import java.util.List;

/**
 * 选择 / 交叉 / 变异。交叉和变异直接改传入的子代（调用方先 copy）。
 * 序列交叉后可能违反跨任务的前驱关系，由解码器修复。
 */
class GeneticOperators {

    private final ProblemIndex index;
    private final RandomSource random;

    GeneticOperators(ProblemIndex index, RandomSource random) {
        this.index = index;
        this.random = random;
    }

    // ============ 选择 ============

    Chromosome tournament(List<Chromosome> pop, int k) {
        int n = pop.size();
        Chromosome best = null;
        for (int i = 0; i < Math.max(1, k); i++) {
            Chromosome c = pop.get(random.randomInt(0, n));
            if (best == null || c.score().compareTo(best.score()) > 0) {
                best = c;
            }
        }
        return best;
    }

    /**
     * 轮盘赌：可行个体权重 1 / (1 + cost)，不可行个体权重再按硬违规量压低。
     */
    Chromosome roulette(List<Chromosome> pop) {
        double[] w = new double[pop.size()];
        double total = 0;
        for (int i = 0; i < w.length; i++) {
            w[i] = weight(pop.get(i));
            total += w[i];
        }
        double pick = random.randomDouble() * total;
        for (int i = 0; i < w.length; i++) {
            pick -= w[i];
            if (pick <= 0) {
                return pop.get(i);
            }
        }
        return pop.get(pop.size() - 1);
    }

    private static double weight(Chromosome c) {
        if (c.evaluation == null) {
            return 0;
        }
        double w = 1.0 / (1.0 + Math.max(0, c.evaluation.getCost()));
        long hard = c.evaluation.getScore().hardScore();
        return hard < 0 ? w / (1.0 + 1e6 * -(double) hard) : w;
    }

    // ============ 交叉 ============

    void crossover(Chromosome a, Chromosome b, CrossoverType type) {
        int[] s1;
        int[] s2;
        if (type == CrossoverType.LOX) {
            int i = random.randomInt(0, a.size());
            int j = random.randomInt(0, a.size());
            int from = Math.min(i, j);
            int to = Math.max(i, j);
            s1 = lox(a.sequence, b.sequence, from, to);
            s2 = lox(b.sequence, a.sequence, from, to);
        } else {
            boolean[] keep = new boolean[index.taskCount()];
            for (int t = 0; t < keep.length; t++) {
                keep[t] = random.randomBoolean();
            }
            s1 = pox(a.sequence, b.sequence, keep);
            s2 = pox(b.sequence, a.sequence, keep);
        }
        System.arraycopy(s1, 0, a.sequence, 0, s1.length);
        System.arraycopy(s2, 0, b.sequence, 0, s2.length);
        uniformResources(a, b);
        a.evaluation = null;
        b.evaluation = null;
    }

    /** keep[t] 为真的任务，其工序留在 p1 中的位置；空位按 p2 中的相对顺序填入其余工序 */
    int[] pox(int[] p1, int[] p2, boolean[] keep) {
        int n = p1.length;
        int[] child = new int[n];
        boolean[] fixed = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (keep[index.taskOf(p1[i])]) {
                child[i] = p1[i];
                fixed[i] = true;
            }
        }
        int pos = 0;
        for (int a : p2) {
            if (keep[index.taskOf(a)]) {
                continue;
            }
            while (fixed[pos]) {
                pos++;
            }
            child[pos++] = a;
        }
        return child;
    }

    /** p1[from..to] 原位保留，其余位置按 p2 的顺序从左到右填 */
    int[] lox(int[] p1, int[] p2, int from, int to) {
        int n = p1.length;
        int[] child = new int[n];
        boolean[] used = new boolean[n];
        for (int i = from; i <= to; i++) {
            child[i] = p1[i];
            used[p1[i]] = true;
        }
        int pos = 0;
        for (int a : p2) {
            if (used[a]) {
                continue;
            }
            if (pos == from) {
                pos = to + 1;
            }
            child[pos++] = a;
        }
        return child;
    }

    void uniformResources(Chromosome a, Chromosome b) {
        for (int i = 0; i < a.resource.length; i++) {
            if (random.randomBoolean()) {
                int t = a.resource[i];
                a.resource[i] = b.resource[i];
                b.resource[i] = t;
            }
        }
    }

    // ============ 变异 ============

    /** 逐位置按 rate 触发，每次以该位置为一端做一次 swap / insert / invert */
    void mutateSequence(Chromosome c, MutationType type, double rate) {
        int n = c.size();
        if (n < 2) {
            return;
        }
        for (int i = 0; i < n; i++) {
            if (random.randomDouble() >= rate) {
                continue;
            }
            int j = random.randomInt(0, n - 1);
            if (j >= i) {
                j++;
            }
            apply(c.sequence, type, i, j);
            c.evaluation = null;
        }
    }

    static void apply(int[] seq, MutationType type, int i, int j) {
        switch (type) {
            case INSERT: {
                int v = seq[i];
                if (i < j) {
                    System.arraycopy(seq, i + 1, seq, i, j - i);
                } else {
                    System.arraycopy(seq, j, seq, j + 1, i - j);
                }
                seq[j] = v;
                break;
            }
            case INVERT: {
                for (int lo = Math.min(i, j), hi = Math.max(i, j); lo < hi; lo++, hi--) {
                    int t = seq[lo];
                    seq[lo] = seq[hi];
                    seq[hi] = t;
                }
                break;
            }
            case SWAP:
            default: {
                int t = seq[i];
                seq[i] = seq[j];
                seq[j] = t;
            }
        }
    }

    /** 逐基因按 rate 重新抽取资源 */
    void mutateResources(Chromosome c, double rate) {
        for (int a = 0; a < c.resource.length; a++) {
            int options = index.allowed(a).length;
            if (options > 1 && random.randomDouble() < rate) {
                int k = random.randomInt(0, options - 1);
                c.resource[a] = k >= c.resource[a] ? k + 1 : k;
                c.evaluation = null;
            }
        }
    }
}
