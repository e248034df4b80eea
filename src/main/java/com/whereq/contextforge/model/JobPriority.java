package com.whereq.contextforge.model;

/**
 * Job priorities, lowest first. Dequeue order is highest priority first.
 */
public enum JobPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
