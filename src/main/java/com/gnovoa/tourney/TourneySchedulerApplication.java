// Namespace
package com.gnovoa.tourney;

// Imports
import com.gnovoa.tourney.optimize.OptimizerProperties;
import com.gnovoa.tourney.rules.RuleProperties;
import com.gnovoa.tourney.runner.RunnerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({OptimizerProperties.class, RuleProperties.class, RunnerProperties.class})
public class TourneySchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TourneySchedulerApplication.class, args);
  }
}
