package com.models_api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.broker.TaskBroker;
import com.models_api.database.JdbcTableStore;
import com.models_api.database.TableStore;
import com.models_api.helper.ModelsBackgroundHandler;
import com.models_api.plugin.ModelTypeRegistry;
import com.models_api.service.ModelsDBBackgroundManager;
import com.models_api.service.ModelsDBManager;
import com.models_api.service.ModelsManager;
import com.models_api.service.TaskTrackingContext;
import org.modelmapper.ModelMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * The API side and the worker each get their own {@link ModelsManager} over the same folder;
 * they only share the files.
 */
@Configuration
@EnableConfigurationProperties(ModelsProperties.class)
public class ModelsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModelsBackgroundHandler modelsHandler(ModelsProperties properties) {
        return new ModelsBackgroundHandler(properties.isValidate());
    }

    @Bean
    @Primary
    public ModelsManager modelsManager(ModelsProperties properties, ModelTypeRegistry registry,
                                       ModelsBackgroundHandler modelsHandler, ObjectMapper objectMapper, Clock clock) {
        return new ModelsManager(Path.of(properties.getFolder()), properties.getSuffix(), registry, modelsHandler,
                objectMapper, clock);
    }

    @Bean
    public ModelsManager workerModelsManager(ModelsProperties properties, ModelTypeRegistry registry,
                                             ModelsBackgroundHandler modelsHandler, ObjectMapper objectMapper, Clock clock) {
        return new ModelsManager(Path.of(properties.getFolder()), properties.getSuffix(), registry, modelsHandler,
                objectMapper, clock);
    }

    @Bean
    public TableStore tableStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new JdbcTableStore(jdbcTemplate, transactionTemplate);
    }

    @Bean
    @Primary
    public ModelsDBManager modelsDBManager(ModelsManager modelsManager, TableStore tableStore) {
        return new ModelsDBManager(modelsManager, tableStore);
    }

    @Bean
    public ModelsDBManager workerModelsDBManager(@Qualifier("workerModelsManager") ModelsManager workerModelsManager,
                                                 TableStore tableStore) {
        return new ModelsDBManager(workerModelsManager, tableStore);
    }

    @Bean
    public TaskTrackingContext taskTrackingContext() {
        return new TaskTrackingContext();
    }

    @Bean
    public ModelsDBBackgroundManager modelsBackgroundManager(ModelsManager modelsManager, TaskBroker taskBroker,
                                                             ModelsBackgroundHandler modelsHandler,
                                                             TaskTrackingContext taskTrackingContext,
                                                             ModelMapper modelMapper, ModelsProperties properties,
                                                             Clock clock) {
        return new ModelsDBBackgroundManager(modelsManager, taskBroker, modelsHandler, taskTrackingContext,
                modelMapper, properties.getBackground(), clock);
    }

    @Bean(name = "modelsWorkerExecutor")
    public ThreadPoolTaskExecutor modelsWorkerExecutor(ModelsProperties properties) {
        int threads = Math.max(1, properties.getWorker().getConcurrency());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setThreadNamePrefix("models-worker-");
        exec.setCorePoolSize(threads);
        exec.setMaxPoolSize(threads);
        // the worker only claims as many tasks as it has free threads
        exec.setQueueCapacity(threads);
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(30);
        exec.initialize();
        return exec;
    }
}
