package com.sentinel.domain.common;

/**
 * Event types carried by the event bus.
 * Producers are sync jobs, API handlers and the worker pool; consumers are
 * event listeners, metrics, job history and progress UIs.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // JOB LIFECYCLE (emitted by the worker pool and progress reporters)
    // ═══════════════════════════════════════════════════════════════
    JOB_STARTED,
    JOB_PROGRESS,
    JOB_COMPLETED,
    JOB_FAILED,

    // ═══════════════════════════════════════════════════════════════
    // DOMAIN EVENTS (translated into jobs by listeners)
    // ═══════════════════════════════════════════════════════════════

    // Portfolio state changed (sync finished, trade executed, deposit booked)
    STATE_CHANGED,

    // Planner produced a fresh recommendation set
    RECOMMENDATIONS_READY,

    // Broker sync found an unreinvested dividend
    DIVIDEND_DETECTED,

    // ═══════════════════════════════════════════════════════════════
    // INFORMATIONAL (no listener attached by default)
    // ═══════════════════════════════════════════════════════════════
    PRICE_UPDATED,
    TRADE_EXECUTED,
    SYSTEM_STATUS
}
