package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.optimize.OptimizationStrategies;
import com.gnovoa.tourney.optimize.OptimizerProperties;
import com.gnovoa.tourney.optimize.ScheduleOptimizer;
import com.gnovoa.tourney.out.EventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RunnerWiring {

    @Bean
    public OptimizationStrategies optimizationStrategies(OptimizerProperties props) {
        return new OptimizationStrategies(props);
    }

    @Bean
    public ScheduleOptimizer scheduleOptimizer(OptimizationStrategies strategies) {
        return new ScheduleOptimizer(strategies);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService optimizationExecutor(RunnerProperties props) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "optimizer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(props.workerThreads(), threads);
    }

    @Bean
    public OptimizationJobFactory optimizationJobFactory(ScheduleOptimizer optimizer, OptimizationStrategies strategies,
                                                         EventPublisher publisher, ExecutorService optimizationExecutor) {
        return new OptimizationJobFactory(optimizer, strategies, publisher, optimizationExecutor);
    }
}
