package com.forgemind.core.health;

import com.forgemind.core.llm.LanguageModelClient;
import com.forgemind.core.store.BehaviorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final BehaviorStore store;
    private final LanguageModelClient languageModel;
    private final ExecutorService jobExecutor;

    public HealthCheckService(
            @Autowired(required = false) BehaviorStore store,
            @Autowired(required = false) LanguageModelClient languageModel,
            @Autowired(required = false) @Qualifier("evolutionJobExecutor") ExecutorService jobExecutor) {
        this.store = store;
        this.languageModel = languageModel;
        this.jobExecutor = jobExecutor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkLanguageModel());
        results.add(checkJobExecutor());
        return results;
    }

    private HealthStatus checkStore() {
        if (store == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN, "No BehaviorStore configured", Map.of());
        }
        try {
            int behaviors = store.listAll().size();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    store.getClass().getSimpleName() + " reachable",
                    Map.of("behaviors", String.valueOf(behaviors)));
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN, "Store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLanguageModel() {
        if (languageModel == null) {
            return new HealthStatus("language-model", HealthStatus.Status.DOWN,
                    "No LanguageModelClient configured", Map.of());
        }
        return new HealthStatus("language-model", HealthStatus.Status.UP,
                "LanguageModelClient available (" + languageModel.getClass().getSimpleName() + ")", Map.of());
    }

    private HealthStatus checkJobExecutor() {
        if (jobExecutor == null) {
            return new HealthStatus("job-executor", HealthStatus.Status.DOWN, "No job executor configured", Map.of());
        }
        if (jobExecutor.isShutdown()) {
            return new HealthStatus("job-executor", HealthStatus.Status.DOWN, "Job executor shut down", Map.of());
        }
        if (jobExecutor instanceof ThreadPoolExecutor pool) {
            HealthStatus.Status status = pool.getActiveCount() >= pool.getMaximumPoolSize() && !pool.getQueue().isEmpty()
                    ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
            return new HealthStatus("job-executor", status,
                    pool.getActiveCount() + "/" + pool.getMaximumPoolSize() + " threads busy",
                    Map.of("queued", String.valueOf(pool.getQueue().size())));
        }
        return new HealthStatus("job-executor", HealthStatus.Status.UP, "Job executor running", Map.of());
    }
}
