package com.lexsched.lexsched_api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.lexsched.lexsched_api.solver.adapter.CpSatSolverAdapter;
import com.lexsched.lexsched_api.solver.adapter.SolverAdapter;
import com.lexsched.lexsched_api.solver.constraint.ConstraintRegistry;
import com.lexsched.lexsched_api.solver.engine.LexicographicOptimizer;
import com.lexsched.lexsched_api.solver.model.ModelBuilder;

/**
 * Wires the solver core from {@link SchedulerProperties}. The core classes themselves carry no Spring annotations.
 */
@Configuration
public class SolverConfig {

    @Bean
    public SolverAdapter solverAdapter(SchedulerProperties properties) {
        SchedulerProperties.Solver solver = properties.getSolver();
        return new CpSatSolverAdapter(solver.getTimeLimit(), solver.getNumWorkers(), solver.isLogSearchProgress());
    }

    @Bean
    public LexicographicOptimizer lexicographicOptimizer(SolverAdapter solverAdapter) {
        return new LexicographicOptimizer(solverAdapter);
    }

    @Bean
    public ModelBuilder modelBuilder(SchedulerProperties properties) {
        return new ModelBuilder(properties.getOverlapBufferMinutes());
    }

    @Bean
    public ConstraintRegistry constraintRegistry() {
        return ConstraintRegistry.defaults();
    }
}
