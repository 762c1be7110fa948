package com.models_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "models")
public class ModelsProperties {

    /** Folder holding model artifacts and their metadata. */
    private String folder = "models";

    private String suffix = ".model";

    /** Turns off the type, existence and payload checks. Name checks always run. */
    private boolean validate = true;

    private Worker worker = new Worker();

    private Background background = new Background();

    @Data
    public static class Worker {
        private boolean enabled = true;
        /** Defaults to a random id per process. */
        private String id;
        private int concurrency = 2;
        private long pollIntervalMs = 500;
    }

    @Data
    public static class Background {
        private Duration taskTtl = Duration.ofMinutes(10);
        private long reaperIntervalMs = 30_000;
        private boolean cancelOnShutdown = false;
        private int defaultPriority = 0;
    }
}
