package com.strv.newsletter.main;

import com.strv.newsletter.config.BasicConfig;
import com.strv.newsletter.config.DispatchConfig;
import com.strv.newsletter.config.WorkerConfig;
import com.strv.newsletter.issue.IssueFanout;
import com.strv.newsletter.issue.IssueRenderer;
import com.strv.newsletter.mail.MailSender;
import com.strv.newsletter.mail.MailSenderFactory;
import com.strv.newsletter.metrics.DispatchMetrics;
import com.strv.newsletter.metrics.MetricsEndpoint;
import com.strv.newsletter.metrics.MetricsRegistry;
import com.strv.newsletter.worker.EmailWorkerPool;
import com.strv.newsletter.worker.LifecycleContext;
import com.strv.newsletter.worker.LoggingFailedJobHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;

/**
 * Dispatch service wiring.
 *
 * <p>Builds the mail sender, metrics, worker pool and issue fan-out from a {@link DispatchConfig}
 * <br>and owns the root lifecycle context the pool is started with.
 *
 * <p>{@link #shutdown()} cancels that context and waits for the pool to drain, bounded by
 * <br>worker.shutdownTimeoutSeconds when it is positive.
 * <br>{@link #registerShutdownHook()} runs the same on JVM termination.
 */
public class Dispatcher {
    private static final Logger log = LogManager.getLogger(Dispatcher.class);

    private final DispatchConfig config;
    private final LifecycleContext context = new LifecycleContext();
    private EmailWorkerPool pool;
    private IssueFanout fanout;
    private MetricsEndpoint endpoint;

    /**
     * Constructs a new Dispatcher instance.
     *
     * @param config DispatchConfig instance.
     */
    public Dispatcher(DispatchConfig config) {
        this.config = config;
    }

    /**
     * Builds and starts the service.
     *
     * @throws IOException If the metrics endpoint cannot bind.
     */
    public void start() throws IOException {
        WorkerConfig worker = config.getWorker();
        BasicConfig metricsConfig = config.getMetrics();
        boolean metricsEnabled = metricsConfig.getBooleanProperty("enabled", false);

        MailSender sender = MailSenderFactory.createMailSender(config.getMail());

        MeterRegistry registry;
        if (metricsEnabled) {
            PrometheusMeterRegistry prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            MetricsRegistry.register(prometheusRegistry);
            registry = prometheusRegistry;
        } else {
            registry = new SimpleMeterRegistry();
        }

        pool = new EmailWorkerPool(sender, worker.getQueueCapacity(), worker.getSendTimeout(),
                new LoggingFailedJobHandler(), new DispatchMetrics(registry));
        fanout = new IssueFanout(pool, new IssueRenderer(config.getAppBaseUrl()));

        pool.start(context, worker.getCount());

        if (metricsEnabled) {
            endpoint = new MetricsEndpoint(pool);
            endpoint.start(Math.toIntExact(metricsConfig.getLongProperty("port", 8090L)));
        }

        log.info("Dispatcher started: provider={}, workers={}, queueCapacity={}, metrics={}",
                config.getMail().getProvider(), pool.getWorkerCount(), pool.getQueueCapacity(), metricsEnabled);
    }

    /**
     * Cancels the lifecycle and waits for the pool to drain.
     *
     * @return True if the pool stopped within the configured shutdown timeout, or at all when there is none.
     */
    public synchronized boolean shutdown() {
        if (pool == null) {
            return true;
        }

        context.cancel();
        boolean drained = true;
        Duration timeout = config.getWorker().getShutdownTimeout();
        try {
            if (timeout.isZero() || timeout.isNegative()) {
                pool.stop();
            } else {
                drained = pool.stop(timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for email workers to drain");
            drained = false;
        }

        if (endpoint != null) {
            endpoint.stop();
            endpoint = null;
        }
        log.info("Dispatcher shutdown finished: drained={}, state={}", drained, pool.getState());
        return drained;
    }

    /**
     * Registers a JVM shutdown hook calling {@link #shutdown()}.
     */
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "dispatcher-shutdown"));
    }

    /**
     * Blocks until the lifecycle is cancelled.
     *
     * @throws InterruptedException If interrupted while waiting.
     */
    public void awaitShutdown() throws InterruptedException {
        context.await();
    }

    public LifecycleContext getContext() {
        return context;
    }

    public EmailWorkerPool getPool() {
        return pool;
    }

    public IssueFanout getFanout() {
        return fanout;
    }

    public MetricsEndpoint getEndpoint() {
        return endpoint;
    }
}
