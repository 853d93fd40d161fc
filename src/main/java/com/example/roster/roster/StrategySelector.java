package com.example.roster.roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each optimization mode to the strategy registered for it.
 */
@Component
public class StrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(StrategySelector.class);

    private final Map<OptimizationMode, SchedulingStrategy> strategies = new EnumMap<>(OptimizationMode.class);

    public StrategySelector(List<SchedulingStrategy> available) {
        for (SchedulingStrategy strategy : available) {
            SchedulingStrategy previous = strategies.putIfAbsent(strategy.mode(), strategy);
            if (previous != null) {
                logger.warn("Ignoring duplicate strategy {} for mode {}; keeping {}",
                        strategy.getClass().getSimpleName(), strategy.mode(), previous.getClass().getSimpleName());
            }
        }
        logger.info("Registered roster strategies: {}", strategies.keySet());
    }

    public SchedulingStrategy select(OptimizationMode mode) {
        SchedulingStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for mode " + mode);
        }
        return strategy;
    }

    public Set<OptimizationMode> availableModes() {
        return Collections.unmodifiableSet(strategies.keySet());
    }
}
