package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeState;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerFlowMonitorListener implements FlowMonitorListener {

    private final MeterRegistry meterRegistry;

    // 指标名称
    static final String METRIC_NODE_EXECUTION_TIME = "flow.node.execution.time";
    static final String METRIC_NODE_EXECUTION_TOTAL = "flow.node.execution.total";
    static final String METRIC_RUN_EXECUTION_TIME = "flow.run.execution.time";

    // 标签键
    private static final String TAG_NODE_TYPE = "node.type";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    public MicrometerFlowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onRunStart(String runId, FlowGraph graph, String triggerNodeId) {
        // 运行指标在完成时记录
    }

    @Override
    public void onRunComplete(String runId, Duration totalDuration, Map<String, NodeState> finalStates, Throwable error) {
        Tags tags = Tags.of(Tag.of(TAG_STATUS, error == null ? STATUS_SUCCESS : STATUS_FAILURE));
        try {
            Timer.builder(METRIC_RUN_EXECUTION_TIME)
                    .tags(tags)
                    .description("流程运行总耗时")
                    .register(meterRegistry)
                    .record(totalDuration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录运行计时器指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onNodeStart(String runId, String nodeId, String nodeType) {
        // 计数器/计时器在结束时记录
    }

    @Override
    public void onNodeSuccess(String runId, String nodeId, String nodeType, Duration duration, Object result) {
        Tags tags = Tags.of(
                Tag.of(TAG_NODE_TYPE, nodeType),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeFailure(String runId, String nodeId, String nodeType, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = Tags.of(
                Tag.of(TAG_NODE_TYPE, nodeType),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_NODE_EXECUTION_TIME)
                    .tags(tags)
                    .description("流程节点执行时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按节点类型和状态统计的执行总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
