package com.iimsoft.uras.service;

import com.iimsoft.uras.api.dto.ScheduleRequest;
import com.iimsoft.uras.api.dto.ScheduleResponse;
import com.iimsoft.uras.config.EngineConfig;
import com.iimsoft.uras.cp.CpConfig;
import com.iimsoft.uras.cp.CpSatSolver;
import com.iimsoft.uras.dispatching.EvaluationMode;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.exception.ErrorKind;
import com.iimsoft.uras.exception.InfeasibleException;
import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.exception.SchedulingException;
import com.iimsoft.uras.ga.CrossoverType;
import com.iimsoft.uras.ga.GaResult;
import com.iimsoft.uras.ga.GeneticAlgorithmScheduler;
import com.iimsoft.uras.ga.GeneticAlgorithmScheduler.GAParams;
import com.iimsoft.uras.ga.MutationType;
import com.iimsoft.uras.ga.SelectionType;
import com.iimsoft.uras.scheduler.KpiCalculator;
import com.iimsoft.uras.scheduler.SimpleScheduler;
import com.iimsoft.uras.scheduler.SolveResult;
import com.iimsoft.uras.scheduler.SolveStatus;
import com.iimsoft.uras.score.ObjectiveWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 对外唯一入口 {@code schedule(request) -> response}：
 * 校验 → 构建问题 → 按算法求解 → 计算 KPI → 组装响应。
 * 不保留任何请求间状态；所有异常在这里转换为 failure{kind, message}，
 * 校验通过之后才出现的异常归为 INTERNAL_ERROR。
 */
public class SchedulingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulingService.class);

    private final EngineConfig defaults;

    public SchedulingService(EngineConfig defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public SchedulingService() {
        this(EngineConfig.load());
    }

    public ScheduleResponse schedule(ScheduleRequest request) {
        try {
            return solve(request);
        } catch (SchedulingException e) {
            LOGGER.info("Scheduling request rejected: kind={}, message={}", e.getKind(), e.getMessage());
            return ScheduleResponse.failure(e.getKind().name(), e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Scheduling request failed with an internal error", e);
            return ScheduleResponse.failure(ErrorKind.INTERNAL_ERROR.name(), "内部错误: " + e);
        }
    }

    /** 不可行或没有解时抛 {@link InfeasibleException}，其余与 {@link #schedule} 相同 */
    public ScheduleResponse scheduleOrThrow(ScheduleRequest request) {
        ScheduleResponse response = solve(request);
        if (!response.success) {
            throw new InfeasibleException(response.message);
        }
        return response;
    }

    private ScheduleResponse solve(ScheduleRequest request) {
        if (request == null) {
            throw new InvalidSpecException("request 不能为空");
        }
        ProblemIndex index = buildIndex(request);
        EngineConfig cfg = merge(defaults.copy(), request.algorithm);
        String algorithm = request.algorithm == null || request.algorithm.type == null
                ? SimpleScheduler.ALGORITHM : request.algorithm.type.trim().toUpperCase(Locale.ROOT);
        RuleEngine engine = cfg.dispatching.toEngine();

        LOGGER.info("Scheduling request: algorithm={}, tasks={}, activities={}, resources={}",
                algorithm, index.taskCount(), index.activityCount(), index.resourceCount());

        SolveResult result;
        List<GaResult.GenerationStats> history = null;
        switch (algorithm) {
            case SimpleScheduler.ALGORITHM:
                result = new SimpleScheduler(engine, new ObjectiveWeights(cfg.cp.makespanWeight, cfg.cp.penaltyWeight))
                        .solve(index);
                break;
            case GeneticAlgorithmScheduler.ALGORITHM:
                GaResult ga = new GeneticAlgorithmScheduler(cfg.ga, engine).solve(index);
                result = ga.getResult();
                history = ga.getHistory();
                break;
            case CpSatSolver.ALGORITHM:
            case "CP":
                result = new CpSatSolver(cfg.cp, engine).solve(index);
                break;
            default:
                throw new InvalidSpecException("未知算法: " + algorithm + "（可选 GREEDY / GA / CP_SAT）");
        }
        return toResponse(result, index, history);
    }

    /** 领域对象构造期间的空指针 / 非法参数都是请求本身不合法 */
    private static ProblemIndex buildIndex(ScheduleRequest request) {
        try {
            SchedulingProblem problem = ProblemMapper.toProblem(request);
            return ProblemValidator.validate(problem);
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new InvalidSpecException("请求缺少必填字段或取值不合法: " + e.getMessage(), e);
        }
    }

    private static ScheduleResponse toResponse(SolveResult result, ProblemIndex index,
                                               List<GaResult.GenerationStats> history) {
        ScheduleResponse r;
        if (result.hasSchedule()) {
            r = new ScheduleResponse();
            r.success = true;
            r.schedule = ProblemMapper.toScheduleDto(result.getSchedule());
            r.kpi = ProblemMapper.toKpiDto(KpiCalculator.calculate(result.getSchedule(), index));
            r.message = result.getMessage();
        } else {
            ErrorKind kind = result.getStatus() == SolveStatus.BUDGET_EXCEEDED ? ErrorKind.BUDGET_EXCEEDED : ErrorKind.INFEASIBLE;
            r = ScheduleResponse.failure(kind.name(), result.getMessage());
        }
        r.algorithm = result.getAlgorithm();
        r.status = result.getStatus().name();
        r.provenOptimal = result.isProvenOptimal();
        r.stats = new LinkedHashMap<>(result.getStats());
        if (result.getEvaluation() != null) {
            r.score = result.getEvaluation().getScore().toString();
            r.cost = result.getEvaluation().getCost();
            r.violations = ProblemMapper.toViolationDtos(result.getEvaluation().hardViolations());
        }
        if (history != null) {
            r.generations = ProblemMapper.toGenerationDtos(history);
        }
        return r;
    }

    /** 请求参数逐字段覆盖默认值，null 表示沿用 */
    static EngineConfig merge(EngineConfig cfg, ScheduleRequest.AlgorithmDto alg) {
        if (alg == null) {
            return cfg;
        }
        if (alg.dispatching != null) {
            ScheduleRequest.DispatchingDto d = alg.dispatching;
            if (d.rules != null && !d.rules.isEmpty()) cfg.dispatching.rules = d.rules;
            if (d.mode != null) cfg.dispatching.mode = ProblemMapper.parseEnum(EvaluationMode.class, d.mode, "dispatching.mode");
            if (d.weights != null) cfg.dispatching.weights = d.weights;
            if (d.ruleParameters != null) cfg.dispatching.ruleParameters = d.ruleParameters;
        }
        if (alg.ga != null) {
            ScheduleRequest.GaDto g = alg.ga;
            GAParams p = cfg.ga;
            if (g.populationSize != null) p.populationSize = g.populationSize;
            if (g.generations != null) p.generations = g.generations;
            if (g.crossoverRate != null) p.crossoverRate = g.crossoverRate;
            if (g.mutationRate != null) p.mutationRate = g.mutationRate;
            if (g.resourceMutationRate != null) p.resourceMutationRate = g.resourceMutationRate;
            if (g.stagnationLimit != null) p.stagnationLimit = g.stagnationLimit;
            if (g.tournamentSize != null) p.tournamentSize = g.tournamentSize;
            if (g.eliteCount != null) p.eliteCount = g.eliteCount;
            if (g.selection != null) p.selection = ProblemMapper.parseEnum(SelectionType.class, g.selection, "ga.selection");
            if (g.crossover != null) p.crossover = ProblemMapper.parseEnum(CrossoverType.class, g.crossover, "ga.crossover");
            if (g.mutation != null) p.mutation = ProblemMapper.parseEnum(MutationType.class, g.mutation, "ga.mutation");
            if (g.parallelEvaluation != null) p.parallelEvaluation = g.parallelEvaluation;
            if (g.randomSeed != null) p.randomSeed = g.randomSeed;
            if (g.seedWithGreedy != null) p.seedWithGreedy = g.seedWithGreedy;
            if (g.makespanWeight != null) p.makespanWeight = g.makespanWeight;
            if (g.penaltyWeight != null) p.penaltyWeight = g.penaltyWeight;
            checkGa(p);
        }
        if (alg.cp != null) {
            ScheduleRequest.CpDto c = alg.cp;
            CpConfig p = cfg.cp;
            if (c.timeLimitMs != null) p.timeLimitMs = c.timeLimitMs;
            if (c.nodeLimit != null) p.nodeLimit = c.nodeLimit;
            if (c.makespanWeight != null) p.makespanWeight = c.makespanWeight;
            if (c.penaltyWeight != null) p.penaltyWeight = c.penaltyWeight;
            if (c.timeStepMs != null) p.timeStepMs = c.timeStepMs;
            if (c.maxTimeSlots != null) p.maxTimeSlots = c.maxTimeSlots;
            if (c.parallelWorkers != null) p.parallelWorkers = c.parallelWorkers;
            if (c.seedWithGreedy != null) p.seedWithGreedy = c.seedWithGreedy;
            if (c.stopAfterFirst != null) p.stopAfterFirst = c.stopAfterFirst;
            if (p.timeStepMs != null && p.timeStepMs <= 0) {
                throw new InvalidSpecException("cp.timeStepMs 必须 > 0: " + p.timeStepMs);
            }
        }
        return cfg;
    }

    private static void checkGa(GAParams p) {
        if (p.populationSize < 2) {
            throw new InvalidSpecException("ga.populationSize 必须 >= 2: " + p.populationSize);
        }
        if (p.generations < 0) {
            throw new InvalidSpecException("ga.generations 不能为负: " + p.generations);
        }
        if (p.crossoverRate < 0 || p.crossoverRate > 1 || p.mutationRate < 0 || p.mutationRate > 1
                || p.resourceMutationRate < 0 || p.resourceMutationRate > 1) {
            throw new InvalidSpecException("ga 交叉率 / 变异率必须在 [0, 1] 内");
        }
    }
}
