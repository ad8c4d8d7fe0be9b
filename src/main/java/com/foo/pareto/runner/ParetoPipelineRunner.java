package com.foo.pareto.runner;

import com.foo.pareto.service.pipeline.ParetoPipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs the pipeline once when the application starts. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "pareto.etl",
    name = "run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class ParetoPipelineRunner implements ApplicationRunner {

  private final ParetoPipelineOrchestrator orchestrator;

  @Override
  public void run(ApplicationArguments args) throws Exception {
    ParetoPipelineOrchestrator.PipelineResult result = orchestrator.run();
    log.info(
        "Star schema ready for BI: {} item(s), {} branch(es), {} fact row(s)",
        result.schema().items().size(),
        result.schema().branches().size(),
        result.schema().facts().size());
    result.outputFiles().forEach(file -> log.info("  {}", file));
  }
}
