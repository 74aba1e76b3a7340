package com.chicu.aimonitor.ml.retraining.config;

import com.chicu.aimonitor.ml.retraining.data.DataCollectionStage;
import com.chicu.aimonitor.ml.retraining.data.SyntheticTrainingDataCollector;
import com.chicu.aimonitor.ml.retraining.data.TrainingDataCollector;
import com.chicu.aimonitor.ml.retraining.deploy.DeploymentStage;
import com.chicu.aimonitor.ml.retraining.deploy.ModelDeployer;
import com.chicu.aimonitor.ml.retraining.deploy.SimulatedModelDeployer;
import com.chicu.aimonitor.ml.retraining.performance.ModelPerformanceSource;
import com.chicu.aimonitor.ml.retraining.training.ModelTrainer;
import com.chicu.aimonitor.ml.retraining.training.SimulatedModelTrainer;
import com.chicu.aimonitor.ml.retraining.training.TrainingStage;
import com.chicu.aimonitor.ml.retraining.training.sidecar.SidecarModelTrainer;
import com.chicu.aimonitor.ml.retraining.training.sidecar.TrainerSidecarProperties;
import com.chicu.aimonitor.ml.retraining.validation.ValidationStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Сборка пайплайна переобучения.
 *
 * Реальные реализации (ModelTrainer, TrainingDataCollector, ModelPerformanceSource, ModelDeployer)
 * подхватываются из контекста; если бина нет, стадия работает на симуляции.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({RetrainingProperties.class, TrainerSidecarProperties.class})
public class RetrainingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Пул стадий задач. Потолок одновременных задач держит оркестратор, здесь только потоки.
     */
    @Bean(name = "retrainingJobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService retrainingJobExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("retraining-job-" + seq.incrementAndGet());
            return t;
        });
    }

    @Bean
    @ConditionalOnProperty(prefix = "ml.retraining.trainer.sidecar", name = "enabled", havingValue = "true")
    public ModelTrainer sidecarModelTrainer(OkHttpClient okHttpClient,
                                            ObjectMapper objectMapper,
                                            TrainerSidecarProperties props) {
        log.info("🧠 ModelTrainer = ML sidecar ({})", props.getBaseUrl());
        return new SidecarModelTrainer(okHttpClient, objectMapper, props);
    }

    @Bean
    public DataCollectionStage dataCollectionStage(ObjectProvider<TrainingDataCollector> collector,
                                                   RetrainingProperties props,
                                                   Clock clock) {
        return new DataCollectionStage(
                collector.getIfAvailable(),
                new SyntheticTrainingDataCollector(new Random(props.getSimulation().getSeed()), clock)
        );
    }

    @Bean
    public TrainingStage trainingStage(ObjectProvider<ModelTrainer> trainer, RetrainingProperties props) {
        return new TrainingStage(
                trainer.getIfAvailable(),
                new SimulatedModelTrainer(new Random(props.getSimulation().getSeed() + 1))
        );
    }

    @Bean
    public ValidationStage validationStage(ObjectProvider<ModelPerformanceSource> performanceSource,
                                           RetrainingProperties props,
                                           Clock clock) {
        return new ValidationStage(
                performanceSource.getIfAvailable(),
                new Random(props.getSimulation().getSeed() + 2),
                clock
        );
    }

    @Bean
    public DeploymentStage deploymentStage(ObjectProvider<ModelDeployer> deployer,
                                           RetrainingProperties props,
                                           Clock clock) {
        return new DeploymentStage(
                deployer.getIfAvailable(),
                new SimulatedModelDeployer(
                        new Random(props.getSimulation().getSeed() + 3),
                        props.getSimulation().getDeploymentSuccessRate()
                ),
                clock
        );
    }
}
