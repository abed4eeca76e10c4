package com.lexsched.lexsched_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.lexsched.lexsched_api.solver.constraint.ConstraintRegistry;
import com.lexsched.lexsched_api.solver.constraint.SchedulingConstraint;

/**
 * Logs the effective solver configuration on application startup.
 */
@Component
public class SchedulerStartupLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerStartupLogger.class);

    private final SchedulerProperties properties;
    private final ConstraintRegistry constraintRegistry;

    public SchedulerStartupLogger(SchedulerProperties properties, ConstraintRegistry constraintRegistry) {
        this.properties = properties;
        this.constraintRegistry = constraintRegistry;
    }

    @Override
    public void run(String... args) {
        logger.info("=== SCHEDULER CONFIGURATION ===");
        logger.info("Solver time limit per stage: {}", properties.getSolver().getTimeLimit());
        logger.info("Solver workers: {}", properties.getSolver().getNumWorkers());
        logger.info("Overlap buffer: {} minutes", properties.getOverlapBufferMinutes());
        for (SchedulingConstraint constraint : constraintRegistry.getConstraints()) {
            logger.info("Hard constraint: {}", constraint.getName());
        }
        logger.info("CORS origins: {}", properties.getCors().getAllowedOrigins());
    }
}
