package com.rcpilot.config;

import com.rcpilot.core.filesystem.FileSystemManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the {@code rcpilot.*} properties into a {@link RepairConfig} and the
 * beans derived from it.
 */
@Configuration
public class RcPilotConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RcPilotConfiguration.class);

    @Bean
    public RepairConfig repairConfig(
            @Value("${rcpilot.paths.sources-dir:sources}")                  String  sourcesDir,
            @Value("${rcpilot.paths.artifacts-dir:artifacts}")              String  artifactsDir,
            @Value("${rcpilot.paths.output-dir:output}")                    String  outputDir,
            @Value("${rcpilot.spec.max-iterations:5}")                      int     specMaxIterations,
            @Value("${rcpilot.lemma.enabled:true}")                         boolean lemmaEnabled,
            @Value("${rcpilot.lemma.max-iterations:3}")                     int     lemmaMaxIterations,
            @Value("${rcpilot.lemma.escalate-on-proof-failure:false}")      boolean escalateOnProofFailure,
            @Value("${rcpilot.lemma.coq-root:refinedc.project}")            String  coqRoot,
            @Value("${rcpilot.lemma.imports:refinedc.typing.typing}")       String  lemmaImports,
            @Value("${rcpilot.verifier.command:refinedc check}")            String  verifierCommand,
            @Value("${rcpilot.timeouts.iteration-seconds:300}")             long    iterationSeconds,
            @Value("${rcpilot.timeouts.flow-seconds:3600}")                 long    flowSeconds,
            @Value("${rcpilot.concurrency.max-flows:4}")                    int     maxFlows
    ) {
        RepairConfig config = RepairConfig.builder()
                .sourcesDir(sourcesDir)
                .artifactsDir(artifactsDir)
                .outputDir(outputDir)
                .specMaxIterations(specMaxIterations)
                .lemmaEnabled(lemmaEnabled)
                .lemmaMaxIterations(lemmaMaxIterations)
                .escalateOnProofFailure(escalateOnProofFailure)
                .coqRoot(coqRoot)
                .lemmaImports(splitList(lemmaImports))
                .verifierCommand(verifierCommand)
                .iterationTimeout(Duration.ofSeconds(iterationSeconds))
                .flowTimeout(Duration.ofSeconds(flowSeconds))
                .maxFlows(maxFlows)
                .build();

        log.info("[Config] {}", config);
        return config;
    }

    /** Root of every artifact, lemma file, stored state and project report. */
    @Bean
    public FileSystemManager artifactFileSystem(RepairConfig config) {
        return new FileSystemManager(config.getArtifactsDir());
    }

    @Bean(name = "repairExecutor")
    public ThreadPoolTaskExecutor repairExecutor(RepairConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // one thread per concurrent flow; extra files wait in the queue
        executor.setCorePoolSize(config.getMaxFlows());
        executor.setMaxPoolSize(config.getMaxFlows());
        executor.setThreadNamePrefix("repair-flow-");

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("[Config] Repair executor configured: flows={}", executor.getMaxPoolSize());
        return executor;
    }

    static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) return items;
        for (String part : value.split(",")) {
            if (!part.isBlank()) items.add(part.trim());
        }
        return items;
    }
}
