package com.work.escrow.core.event;

/**
 * 事件发布端口。实现可以写日志、落库或投递消息总线；
 * 协议只把它当作旁路，发布失败不会影响状态流转。
 */
@FunctionalInterface
public interface EscrowEventPublisher {

    void publish(EscrowEvent event);

    static EscrowEventPublisher noop() {
        return event -> {
        };
    }
}
