package cn.leancloud.kafka.dispatch;

/**
 * Marks a member whose visibility was relaxed only so that tests in this package can reach it.
 */
@interface VisibleForTesting {}
