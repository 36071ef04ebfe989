package xyz.vvrf.reactor.flow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 流程框架的配置属性类。
 * 绑定 'flow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
@Validated
public class FlowFrameworkProperties {

    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Http http = new Http();
    @Valid
    private final Llm llm = new Llm();
    @Valid
    private final Crawler crawler = new Crawler();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 节点执行调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "flow-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, IMMEDIATE
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Http {
        /**
         * API 节点单次请求的超时时间。
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Llm {
        @NotBlank
        private String ollamaUrl = "http://localhost:11434";
        @NotBlank
        private String openaiUrl = "https://api.openai.com";
        /**
         * 为空时不发送 Authorization 头。
         */
        private String openaiApiKey;
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Getter
    @Setter
    public static class Crawler {
        /**
         * 爬虫后端地址。
         */
        @NotBlank
        private String baseUrl = "http://localhost:8000";
        /**
         * 在请求自身的抓取超时之外额外等待的时间。
         */
        @NotNull
        private Duration extraTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监听器。
         */
        private boolean loggingEnabled = true;
        /**
         * 是否注册实时事件流监听器。
         */
        private boolean realtimeEnabled = false;
        /**
         * 运行完成后实时事件保留的时间。
         */
        @NotNull
        private Duration realtimeRetention = Duration.ofMinutes(30);
    }

    @Override
    public String toString() {
        return "FlowFrameworkProperties{" +
                "scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}}, http={timeout=" + http.timeout +
                "}, llm={ollamaUrl='" + llm.ollamaUrl + '\'' +
                ", openaiUrl='" + llm.openaiUrl + '\'' +
                ", openaiApiKey=" + (llm.openaiApiKey != null ? "******" : "null") +
                ", timeout=" + llm.timeout +
                "}, crawler={baseUrl='" + crawler.baseUrl + '\'' +
                ", extraTimeout=" + crawler.extraTimeout +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                ", realtimeEnabled=" + monitor.realtimeEnabled +
                ", realtimeRetention=" + monitor.realtimeRetention +
                "}}";
    }
}
