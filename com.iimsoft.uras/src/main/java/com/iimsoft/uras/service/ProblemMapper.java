package com.iimsoft.uras.service;

import com.iimsoft.uras.api.dto.ScheduleRequest;
import com.iimsoft.uras.api.dto.ScheduleResponse;
import com.iimsoft.uras.calendar.ShiftCalendarFactory;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.ActivityDuration;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.CapacityConstraint;
import com.iimsoft.uras.domain.Constraint;
import com.iimsoft.uras.domain.ConstraintTarget;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.domain.PrecedenceConstraint;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.ResourceKind;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.domain.TimeWindowConstraint;
import com.iimsoft.uras.domain.Violation;
import com.iimsoft.uras.domain.ViolationType;
import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.ga.GaResult;
import com.iimsoft.uras.scheduler.ScheduleKpi;
import com.iimsoft.uras.time.DurationDistribution;
import com.iimsoft.uras.time.PertEstimate;
import com.iimsoft.uras.time.TimeWindow;
import com.iimsoft.uras.time.WindowType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * DTO 与领域模型互转。两个方向都不丢字段：
 * toProblem(toRequest(p)) 与 p 等价（按班次配置的日历回写为显式区间）。
 */
public final class ProblemMapper {

    private ProblemMapper() {
    }

    // ============ DTO -> domain ============

    public static SchedulingProblem toProblem(ScheduleRequest dto) {
        SchedulingProblem.SchedulingProblemBuilder b = SchedulingProblem.builder()
                .originMs(dto.originMs == null ? 0L : dto.originMs)
                .durationConfidence(dto.durationConfidence);
        if (dto.resources != null) {
            for (ScheduleRequest.ResourceDto r : dto.resources) {
                b.resource(toResource(r));
            }
        }
        if (dto.tasks != null) {
            for (ScheduleRequest.TaskDto t : dto.tasks) {
                b.task(toTask(t));
            }
        }
        if (dto.constraints != null) {
            for (ScheduleRequest.ConstraintDto c : dto.constraints) {
                b.constraint(toConstraint(c));
            }
        }
        return b.build();
    }

    private static Resource toResource(ScheduleRequest.ResourceDto r) {
        return Resource.builder()
                .id(r.id)
                .name(r.name)
                .kind(parseEnum(ResourceKind.class, r.kind, "resource.kind"))
                .category(r.category)
                .capacity(r.capacity)
                .efficiency(r.efficiency)
                .calendar(toCalendar(r.calendar))
                .build();
    }

    private static Calendar toCalendar(ScheduleRequest.CalendarDto c) {
        if (c == null) {
            return Calendar.always();
        }
        List<Interval> windows = new ArrayList<>();
        List<Interval> blocked = new ArrayList<>();
        if (c.windows != null) {
            c.windows.forEach(w -> windows.add(new Interval(w.startMs, w.endMs)));
        }
        if (c.blocked != null) {
            c.blocked.forEach(w -> blocked.add(new Interval(w.startMs, w.endMs)));
        }
        if (c.shifts != null) {
            if (c.shiftStartMs == null || c.shiftDays == null) {
                throw new InvalidSpecException("按班次配置日历时必须给出 shiftStartMs 和 shiftDays");
            }
            Calendar shifts = ShiftCalendarFactory.build(c.shifts, c.shiftStartMs, c.shiftDays);
            windows.addAll(shifts.getWindows());
            blocked.addAll(shifts.getBlocked());
        }
        if (windows.isEmpty()) {
            if (blocked.isEmpty()) {
                return Calendar.always();
            }
            // 只给停机时段：其余时间都可用
            windows.addAll(Calendar.always().getWindows());
        }
        return new Calendar(windows, blocked);
    }

    private static Task toTask(ScheduleRequest.TaskDto t) {
        if (t.id == null || t.id.isBlank()) {
            throw new InvalidSpecException("task.id 不能为空");
        }
        Task.TaskBuilder b = Task.builder()
                .id(t.id)
                .name(t.name)
                .category(t.category)
                .priority(t.priority)
                .dueMs(t.dueMs)
                .releaseMs(t.releaseMs)
                .noPrecedence(Boolean.TRUE.equals(t.noPrecedence));
        if (t.activities != null) {
            for (ScheduleRequest.ActivityDto a : t.activities) {
                b.activity(toActivity(t.id, a));
            }
        }
        return b.build();
    }

    private static Activity toActivity(String taskId, ScheduleRequest.ActivityDto a) {
        if (a.duration == null || a.duration.processing == null) {
            throw new InvalidSpecException("activity " + a.id + " 缺少 duration.processing");
        }
        Activity.ActivityBuilder b = Activity.builder()
                .id(a.id)
                .taskId(taskId)
                .sequence(a.sequence)
                .duration(new ActivityDuration(a.duration.setupMs, toDistribution(a.id, a.duration.processing),
                        a.duration.teardownMs));
        if (a.resourceGroups != null) {
            a.resourceGroups.forEach((k, v) -> b.resourceGroup(k, v == null ? List.of() : v));
        }
        if (a.predecessors != null) {
            a.predecessors.forEach(b::predecessor);
        }
        if (a.attributes != null) {
            a.attributes.forEach(b::attribute);
        }
        return b.build();
    }

    static DurationDistribution toDistribution(String owner, ScheduleRequest.DistributionDto d) {
        DurationDistribution.Kind kind = parseEnum(DurationDistribution.Kind.class, d.kind, "duration.kind");
        if (kind == null) {
            kind = DurationDistribution.Kind.FIXED;
        }
        switch (kind) {
            case PERT:
                return DurationDistribution.pert(require(owner, d.optimisticMs, "optimisticMs"),
                        require(owner, d.mostLikelyMs, "mostLikelyMs"), require(owner, d.pessimisticMs, "pessimisticMs"));
            case UNIFORM:
                return DurationDistribution.uniform(require(owner, d.minMs, "minMs"), require(owner, d.maxMs, "maxMs"));
            case TRIANGULAR:
                return DurationDistribution.triangular(require(owner, d.minMs, "minMs"),
                        require(owner, d.modeMs, "modeMs"), require(owner, d.maxMs, "maxMs"));
            case LOG_NORMAL:
                return DurationDistribution.logNormal(require(owner, d.mu, "mu"), require(owner, d.sigma, "sigma"));
            case FIXED:
            default:
                return DurationDistribution.fixed(require(owner, d.ms, "ms"));
        }
    }

    private static <T> T require(String owner, T value, String field) {
        if (value == null) {
            throw new InvalidSpecException("activity " + owner + " 的时长分布缺少 " + field);
        }
        return value;
    }

    private static Constraint toConstraint(ScheduleRequest.ConstraintDto c) {
        Constraint.Kind kind = parseEnum(Constraint.Kind.class, c.kind, "constraint.kind");
        if (kind == null) {
            throw new InvalidSpecException("constraint.kind 不能为空");
        }
        switch (kind) {
            case PRECEDENCE:
                return new PrecedenceConstraint(c.beforeActivityId, c.afterActivityId,
                        c.minDelayMs == null ? 0L : c.minDelayMs);
            case CAPACITY:
                if (c.maxConcurrent == null) {
                    throw new InvalidSpecException("capacity constraint 缺少 maxConcurrent");
                }
                return new CapacityConstraint(c.resourceId, c.maxConcurrent);
            case TIME_WINDOW:
            default:
                if (c.window == null) {
                    throw new InvalidSpecException("time window constraint 缺少 window");
                }
                ConstraintTarget target = parseEnum(ConstraintTarget.class, c.target, "constraint.target");
                return new TimeWindowConstraint(target == null ? ConstraintTarget.ACTIVITY : target, c.targetId,
                        toWindow(c.window));
        }
    }

    static TimeWindow toWindow(ScheduleRequest.WindowDto w) {
        WindowType type = parseEnum(WindowType.class, w.type, "window.type");
        if (type == null) {
            type = WindowType.SOFT;
        }
        double penalty = w.penaltyPerMs != null ? w.penaltyPerMs : (type == WindowType.SOFT ? 1.0 : 0.0);
        return new TimeWindow(w.earliestStartMs, w.latestStartMs, w.earliestEndMs, w.latestEndMs, type, penalty);
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidSpecException(field + " 取值不合法: " + value, e);
        }
    }

    // ============ domain -> DTO ============

    public static ScheduleRequest toRequest(SchedulingProblem problem) {
        ScheduleRequest dto = new ScheduleRequest();
        dto.originMs = problem.getOriginMs();
        dto.durationConfidence = problem.getDurationConfidence();
        dto.resources = new ArrayList<>();
        for (Resource r : problem.getResources()) {
            ScheduleRequest.ResourceDto rd = new ScheduleRequest.ResourceDto();
            rd.id = r.getId();
            rd.name = r.getName();
            rd.kind = r.getKind().name();
            rd.category = r.getCategory();
            rd.capacity = r.getCapacity();
            rd.efficiency = r.getEfficiency();
            if (!r.getCalendar().isAlways()) {
                rd.calendar = new ScheduleRequest.CalendarDto();
                rd.calendar.windows = toIntervals(r.getCalendar().getWindows());
                rd.calendar.blocked = toIntervals(r.getCalendar().getBlocked());
            }
            dto.resources.add(rd);
        }
        dto.tasks = new ArrayList<>();
        for (Task t : problem.getTasks()) {
            ScheduleRequest.TaskDto td = new ScheduleRequest.TaskDto();
            td.id = t.getId();
            td.name = t.getName();
            td.category = t.getCategory();
            td.priority = t.getPriority();
            td.dueMs = t.getDueMs();
            td.releaseMs = t.getReleaseMs();
            td.noPrecedence = t.isNoPrecedence();
            td.activities = new ArrayList<>();
            for (Activity a : t.getActivities()) {
                td.activities.add(toActivityDto(a));
            }
            dto.tasks.add(td);
        }
        dto.constraints = new ArrayList<>();
        for (Constraint c : problem.getConstraints()) {
            dto.constraints.add(toConstraintDto(c));
        }
        return dto;
    }

    private static List<ScheduleRequest.IntervalDto> toIntervals(List<Interval> list) {
        List<ScheduleRequest.IntervalDto> out = new ArrayList<>(list.size());
        for (Interval i : list) {
            out.add(new ScheduleRequest.IntervalDto(i.getStartMs(), i.getEndMs()));
        }
        return out;
    }

    private static ScheduleRequest.ActivityDto toActivityDto(Activity a) {
        ScheduleRequest.ActivityDto ad = new ScheduleRequest.ActivityDto();
        ad.id = a.getId();
        ad.sequence = a.getSequence();
        ad.duration = new ScheduleRequest.DurationDto();
        ad.duration.setupMs = a.getDuration().getSetupMs();
        ad.duration.teardownMs = a.getDuration().getTeardownMs();
        ad.duration.processing = toDistributionDto(a.getDuration().getProcessing());
        ad.resourceGroups = new LinkedHashMap<>(a.getResourceGroups());
        ad.predecessors = new ArrayList<>(a.getPredecessors());
        ad.attributes = new LinkedHashMap<>(a.getAttributes());
        return ad;
    }

    static ScheduleRequest.DistributionDto toDistributionDto(DurationDistribution d) {
        ScheduleRequest.DistributionDto dd = new ScheduleRequest.DistributionDto();
        dd.kind = d.getKind().name();
        if (d instanceof DurationDistribution.Fixed) {
            dd.ms = ((DurationDistribution.Fixed) d).getMs();
        } else if (d instanceof DurationDistribution.Pert) {
            PertEstimate e = ((DurationDistribution.Pert) d).getEstimate();
            dd.optimisticMs = e.getOptimisticMs();
            dd.mostLikelyMs = e.getMostLikelyMs();
            dd.pessimisticMs = e.getPessimisticMs();
        } else if (d instanceof DurationDistribution.Uniform) {
            dd.minMs = ((DurationDistribution.Uniform) d).getMinMs();
            dd.maxMs = ((DurationDistribution.Uniform) d).getMaxMs();
        } else if (d instanceof DurationDistribution.Triangular) {
            DurationDistribution.Triangular t = (DurationDistribution.Triangular) d;
            dd.minMs = t.getMinMs();
            dd.modeMs = t.getModeMs();
            dd.maxMs = t.getMaxMs();
        } else if (d instanceof DurationDistribution.LogNormal) {
            dd.mu = ((DurationDistribution.LogNormal) d).getMu();
            dd.sigma = ((DurationDistribution.LogNormal) d).getSigma();
        }
        return dd;
    }

    private static ScheduleRequest.ConstraintDto toConstraintDto(Constraint c) {
        ScheduleRequest.ConstraintDto cd = new ScheduleRequest.ConstraintDto();
        cd.kind = c.getKind().name();
        if (c instanceof PrecedenceConstraint) {
            PrecedenceConstraint p = (PrecedenceConstraint) c;
            cd.beforeActivityId = p.getBeforeActivityId();
            cd.afterActivityId = p.getAfterActivityId();
            cd.minDelayMs = p.getMinDelayMs();
        } else if (c instanceof CapacityConstraint) {
            CapacityConstraint cap = (CapacityConstraint) c;
            cd.resourceId = cap.getResourceId();
            cd.maxConcurrent = cap.getMaxConcurrent();
        } else if (c instanceof TimeWindowConstraint) {
            TimeWindowConstraint tw = (TimeWindowConstraint) c;
            cd.target = tw.getTarget().name();
            cd.targetId = tw.getTargetId();
            cd.window = toWindowDto(tw.getWindow());
        }
        return cd;
    }

    static ScheduleRequest.WindowDto toWindowDto(TimeWindow w) {
        ScheduleRequest.WindowDto wd = new ScheduleRequest.WindowDto();
        wd.earliestStartMs = w.getEarliestStartMs();
        wd.latestStartMs = w.getLatestStartMs();
        wd.earliestEndMs = w.getEarliestEndMs();
        wd.latestEndMs = w.getLatestEndMs();
        wd.type = w.getType().name();
        wd.penaltyPerMs = w.getPenaltyPerMs();
        return wd;
    }

    // ============ 结果 ============

    public static ScheduleResponse.ScheduleDto toScheduleDto(Schedule schedule) {
        ScheduleResponse.ScheduleDto sd = new ScheduleResponse.ScheduleDto();
        sd.assignments = new ArrayList<>();
        for (Assignment a : schedule.getAssignments()) {
            ScheduleResponse.AssignmentDto ad = new ScheduleResponse.AssignmentDto();
            ad.activityId = a.getActivityId();
            ad.taskId = a.getTaskId();
            ad.resourceId = a.getResourceId();
            ad.startMs = a.getStartMs();
            ad.endMs = a.getEndMs();
            sd.assignments.add(ad);
        }
        sd.violations = toViolationDtos(schedule.getViolations());
        sd.makespanMs = schedule.getMakespanMs();
        sd.penalty = schedule.getPenalty();
        return sd;
    }

    public static Schedule toSchedule(ScheduleResponse.ScheduleDto dto) {
        Schedule.Builder b = Schedule.builder();
        for (ScheduleResponse.AssignmentDto a : dto.assignments) {
            b.assign(new Assignment(a.activityId, a.taskId, a.resourceId, a.startMs, a.endMs));
        }
        if (dto.violations != null) {
            for (ScheduleResponse.ViolationDto v : dto.violations) {
                b.violation(new Violation(parseEnum(ViolationType.class, v.type, "violation.type"),
                        v.relatedIds, v.hard, v.message, v.penalty));
            }
        }
        return b.build();
    }

    public static List<ScheduleResponse.ViolationDto> toViolationDtos(List<Violation> violations) {
        List<ScheduleResponse.ViolationDto> out = new ArrayList<>(violations.size());
        for (Violation v : violations) {
            ScheduleResponse.ViolationDto vd = new ScheduleResponse.ViolationDto();
            vd.type = v.getType().name();
            vd.relatedIds = new ArrayList<>(v.getRelatedIds());
            vd.hard = v.isHard();
            vd.message = v.getMessage();
            vd.penalty = v.getPenalty();
            out.add(vd);
        }
        return out;
    }

    public static ScheduleResponse.KpiDto toKpiDto(ScheduleKpi kpi) {
        ScheduleResponse.KpiDto k = new ScheduleResponse.KpiDto();
        k.makespanMs = kpi.getMakespanMs();
        k.totalTardinessMs = kpi.getTotalTardinessMs();
        k.meanTardinessMs = kpi.getMeanTardinessMs();
        k.maxTardinessMs = kpi.getMaxTardinessMs();
        k.onTimeRate = kpi.getOnTimeRate();
        k.utilizationByResource = new LinkedHashMap<>(kpi.getUtilizationByResource());
        k.averageUtilization = kpi.getAverageUtilization();
        k.averageFlowTimeMs = kpi.getAverageFlowTimeMs();
        return k;
    }

    public static List<ScheduleResponse.GenerationDto> toGenerationDtos(List<GaResult.GenerationStats> history) {
        List<ScheduleResponse.GenerationDto> out = new ArrayList<>(history.size());
        for (GaResult.GenerationStats s : history) {
            ScheduleResponse.GenerationDto g = new ScheduleResponse.GenerationDto();
            g.generation = s.getGeneration();
            g.bestHardScore = s.getBestHardScore();
            g.bestCost = s.getBestCost();
            g.populationBestCost = s.getPopulationBestCost();
            g.averageCost = s.getAverageCost();
            g.worstCost = s.getWorstCost();
            g.feasibleCount = s.getFeasibleCount();
            out.add(g);
        }
        return out;
    }
}
