package com.work.escrow.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface EscrowMetrics {

    default void reservation(String result) {
    }

    default void response(String outcome) {
    }

    default void withdrawal() {
    }

    default void removal(String operation, boolean hadReservation) {
    }

    default void eventPublishFailed(String type) {
    }
}
