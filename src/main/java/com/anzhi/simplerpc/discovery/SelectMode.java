package com.anzhi.simplerpc.discovery;

/**
 * 负载均衡策略。
 */
public enum SelectMode {
    // 随机选择
    RANDOM,
    // 轮询
    ROUND_ROBIN
}
