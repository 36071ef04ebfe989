package xyz.vvrf.reactor.flow.core;

/**
 * 节点执行状态。
 * idle -> running -> {success, error}；skipped 保留给观察者使用。
 */
public enum NodeStatus {
    /** 尚未执行。*/
    IDLE,
    /** 正在执行。*/
    RUNNING,
    /** 执行成功，结果可能为 null（分支终止）。*/
    SUCCESS,
    /** 执行失败，携带错误信息。*/
    ERROR,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == SKIPPED;
    }
}
