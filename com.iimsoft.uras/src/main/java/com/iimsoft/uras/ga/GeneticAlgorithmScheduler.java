package com.iimsoft.uras.ga;

import com.iimsoft.uras.dispatching.DispatchingRules;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.scheduler.SimpleScheduler;
import com.iimsoft.uras.scheduler.SolveResult;
import com.iimsoft.uras.scheduler.SolveStatus;
import com.iimsoft.uras.score.Evaluation;
import com.iimsoft.uras.score.ObjectiveWeights;
import com.iimsoft.uras.score.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 遗传算法排程：
 * - 基因 = 工序序列排列 + 每个活动的资源选择
 * - 适应度 = ScheduleEvaluator 的 HardSoftLongScore（硬违规优先，其次 makespan / 软罚分加权代价）
 * - 选择 = 锦标赛或轮盘赌
 * - 交叉 = 序列 POX / LOX，资源向量均匀交叉
 * - 变异 = 序列 swap / insert / invert，资源逐基因重抽
 * - 精英保留；代数上限或连续无改进代数达到上限即停止
 */
public class GeneticAlgorithmScheduler {

    public static final String ALGORITHM = "GA";

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneticAlgorithmScheduler.class);

    public static class GAParams {
        public int populationSize = 120;
        public int generations = 400;
        public double crossoverRate = 0.9;
        public double mutationRate = 0.05;         // 序列逐位置变异率
        public double resourceMutationRate = 0.03; // 资源逐基因变异率
        public int stagnationLimit = 60;           // 0 表示不早停
        public int tournamentSize = 4;
        public int eliteCount = 2;                 // 精英保留
        public SelectionType selection = SelectionType.TOURNAMENT;
        public CrossoverType crossover = CrossoverType.POX;
        public MutationType mutation = MutationType.SWAP;
        public boolean parallelEvaluation = true;
        public long randomSeed = 0L;               // 0 表示使用 ThreadLocalRandom
        public boolean seedWithGreedy = true;
        public double makespanWeight = 1.0;
        public double penaltyWeight = 1.0;
    }

    private static final Comparator<Chromosome> BY_SCORE = Comparator.comparing(Chromosome::score);

    private final GAParams params;
    private final RuleEngine engine;

    public GeneticAlgorithmScheduler(GAParams params, RuleEngine engine) {
        this.params = Objects.requireNonNull(params, "params");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public GeneticAlgorithmScheduler(GAParams params) {
        this(params, DispatchingRules.defaultEngine());
    }

    public GaResult solve(ProblemIndex index) {
        long t0 = System.currentTimeMillis();
        int n = index.activityCount();
        int popSize = Math.max(2, params.populationSize);
        LOGGER.info("GA started: activities={}, population={}, generations={}, seed={}",
                n, popSize, params.generations, params.randomSeed);

        for (int a = 0; a < n; a++) {
            if (index.allowed(a).length == 0) {
                Map<String, Number> stats = new LinkedHashMap<>();
                stats.put("generations", 0);
                SolveResult r = SolveResult.infeasible(ALGORITHM,
                        "activity " + index.activity(a).getId() + " 没有任何可用资源", stats);
                return new GaResult(r, List.of(), 0, false);
            }
        }

        ObjectiveWeights weights = new ObjectiveWeights(params.makespanWeight, params.penaltyWeight);
        ScheduleDecoder decoder = new ScheduleDecoder(index, new ScheduleEvaluator(index, weights));
        RandomSource random = new RandomSource(params.randomSeed);
        ChromosomeFactory factory = new ChromosomeFactory(index, random);
        GeneticOperators ops = new GeneticOperators(index, random);

        // 生成种群
        List<Chromosome> population = new ArrayList<>(popSize);
        if (params.seedWithGreedy) {
            SolveResult greedy = new SimpleScheduler(engine, weights).solve(index);
            if (greedy.hasSchedule()) {
                population.add(factory.fromSchedule(greedy.getSchedule()));
            }
        }
        while (population.size() < popSize) {
            switch (population.size() % 3) {
                case 0:
                    population.add(factory.random());
                    break;
                case 1:
                    population.add(factory.loadBalanced());
                    break;
                default:
                    population.add(factory.shortestTime());
            }
        }
        evaluatePopulation(population, decoder);
        population.sort(BY_SCORE); // 越大越好，最优在末尾

        // 演化
        Chromosome globalBest = population.get(population.size() - 1).copy();
        List<GaResult.GenerationStats> history = new ArrayList<>();
        history.add(stats(0, population, globalBest));
        int noImprove = 0;
        int gen = 0;
        boolean stagnated = false;
        while (gen < params.generations) {
            gen++;
            List<Chromosome> next = new ArrayList<>(popSize);

            int elites = Math.min(Math.max(0, params.eliteCount), population.size());
            for (int i = population.size() - elites; i < population.size(); i++) {
                next.add(population.get(i).copy());
            }

            while (next.size() < popSize) {
                Chromosome c1 = select(ops, population).copy();
                Chromosome c2 = select(ops, population).copy();
                if (random.randomDouble() < params.crossoverRate) {
                    ops.crossover(c1, c2, params.crossover);
                }
                ops.mutateSequence(c1, params.mutation, params.mutationRate);
                ops.mutateSequence(c2, params.mutation, params.mutationRate);
                ops.mutateResources(c1, params.resourceMutationRate);
                ops.mutateResources(c2, params.resourceMutationRate);
                next.add(c1);
                if (next.size() < popSize) next.add(c2);
            }

            evaluatePopulation(next, decoder);
            next.sort(BY_SCORE);

            Chromosome best = next.get(next.size() - 1);
            if (best.score().compareTo(globalBest.score()) > 0) {
                globalBest = best.copy();
                noImprove = 0;
            } else {
                noImprove++;
            }
            population = next;
            GaResult.GenerationStats s = stats(gen, population, globalBest);
            history.add(s);
            LOGGER.debug("GA generation {}: best={}, populationBest={}, feasible={}/{}",
                    gen, globalBest.score(), best.score(), s.getFeasibleCount(), popSize);

            if (params.stagnationLimit > 0 && noImprove >= params.stagnationLimit) {
                stagnated = true;
                break;
            }
        }

        // 回放最佳解
        Schedule raw = decoder.decode(globalBest);
        Evaluation eval = decoder.getEvaluator().evaluate(raw);
        Map<String, Number> stats = new LinkedHashMap<>();
        stats.put("generations", gen);
        stats.put("evaluations", (long) popSize * (gen + 1));
        stats.put("elapsedMs", System.currentTimeMillis() - t0);

        SolveResult result;
        if (eval.isFeasible()) {
            result = new SolveResult(ALGORITHM, SolveStatus.FEASIBLE, decoder.getEvaluator().annotate(raw, eval), eval,
                    false, stagnated ? "连续 " + noImprove + " 代无改进，提前停止" : null, stats);
        } else {
            result = new SolveResult(ALGORITHM, SolveStatus.INFEASIBLE, null, eval, false,
                    "最优个体仍违反硬约束: " + eval.hardViolations().get(0).getMessage(), stats);
        }
        LOGGER.info("GA finished: status={}, generations={}, bestScore={}, elapsed={}ms",
                result.getStatus(), gen, eval.getScore(), stats.get("elapsedMs"));
        return new GaResult(result, history, gen, stagnated);
    }

    private Chromosome select(GeneticOperators ops, List<Chromosome> population) {
        if (params.selection == SelectionType.ROULETTE) {
            return ops.roulette(population);
        }
        return ops.tournament(population, params.tournamentSize);
    }

    private void evaluatePopulation(List<Chromosome> pop, ScheduleDecoder decoder) {
        if (params.parallelEvaluation) {
            pop.parallelStream().filter(c -> c.evaluation == null).forEach(decoder::evaluate);
        } else {
            pop.stream().filter(c -> c.evaluation == null).forEach(decoder::evaluate);
        }
    }

    private static GaResult.GenerationStats stats(int gen, List<Chromosome> pop, Chromosome globalBest) {
        long popBest = -1;
        long worst = -1;
        double sum = 0;
        int feasible = 0;
        for (Chromosome c : pop) {
            if (!c.evaluation.isFeasible()) {
                continue;
            }
            long cost = c.evaluation.getCost();
            popBest = popBest < 0 ? cost : Math.min(popBest, cost);
            worst = Math.max(worst, cost);
            sum += cost;
            feasible++;
        }
        return new GaResult.GenerationStats(gen, globalBest.score().hardScore(),
                globalBest.evaluation.isFeasible() ? globalBest.evaluation.getCost() : -1,
                popBest, feasible == 0 ? -1 : sum / feasible, worst, feasible);
    }
}
