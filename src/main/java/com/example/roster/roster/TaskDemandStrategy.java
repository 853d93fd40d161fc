package com.example.roster.roster;

import com.example.roster.exception.RosterConfigurationException;
import com.example.roster.task.TaskDemandCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Min-headcount run whose floor comes from task coverage, never below the caller's own floor.
 */
@Component
public class TaskDemandStrategy implements SchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TaskDemandStrategy.class);

    private final TaskDemandCalculator calculator;
    private final MinHeadcountStrategy delegate;

    public TaskDemandStrategy(TaskDemandCalculator calculator, MinHeadcountStrategy delegate) {
        this.calculator = calculator;
        this.delegate = delegate;
    }

    @Override
    public OptimizationMode mode() {
        return OptimizationMode.TASKS;
    }

    @Override
    public int effectiveMinStaff(SchedulingContext ctx) {
        return Math.max(ctx.minStaff(), demand(ctx).minHeadcount());
    }

    @Override
    public StrategyResult generate(SchedulingContext ctx) {
        TaskDemandCalculator.Demand demand = demand(ctx);
        int floor = Math.max(ctx.minStaff(), demand.minHeadcount());
        logger.info("Task coverage requires {} people per day (requested floor {}), using {}",
                demand.minHeadcount(), ctx.minStaff(), floor);

        StrategyResult inner = delegate.generate(ctx.withMinStaff(floor));
        List<String> warnings = new ArrayList<>(demand.warnings());
        warnings.addAll(inner.warnings());
        return new StrategyResult(inner.grid(), floor, warnings);
    }

    private TaskDemandCalculator.Demand demand(SchedulingContext ctx) {
        if (ctx.tasks().isEmpty()) {
            throw new RosterConfigurationException(RosterConfigurationException.EMPTY_TASK_LIST,
                    "Task-based optimization needs at least one task");
        }
        return calculator.requiredHeadcount(ctx.tasks(), ctx.startDate(), ctx.dateOf(Math.max(0, ctx.totalDays() - 1)));
    }
}
