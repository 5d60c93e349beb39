package com.fintech.strategyengine.util;

import com.fintech.strategyengine.domain.Timeframe;

/**
 * Maps tick timestamps onto timeframe bucket grids.
 * Buckets align to timeframe boundaries, optionally shifted by an alignment offset so that
 * hourly and daily buckets follow exchange-local wall-clock time (e.g. +05:30 for NSE).
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class TimeWindowManager {

    private final long alignmentOffsetMs;

    public TimeWindowManager() {
        this(0L);
    }

    /**
     * @param alignmentOffsetMs Offset added to timestamps before flooring (local time minus UTC)
     */
    public TimeWindowManager(long alignmentOffsetMs) {
        this.alignmentOffsetMs = alignmentOffsetMs;
    }

    /**
     * Returns the start of the bucket containing the timestamp.
     * Floors toward negative infinity, so pre-epoch timestamps align as well.
     *
     * @param eventTime The tick timestamp (epoch millis)
     * @param timeframe The series timeframe
     * @return The aligned bucket start (epoch millis)
     */
    public long bucketStart(long eventTime, Timeframe timeframe) {
        long size = timeframe.toMillis();
        return Math.floorDiv(eventTime + alignmentOffsetMs, size) * size - alignmentOffsetMs;
    }

    /**
     * Checks if a tick belongs to a bucket after the current one.
     *
     * @param eventTime The incoming tick's timestamp
     * @param currentBucketStart The open candle's bucket start
     * @param timeframe The series timeframe
     * @return true if the tick rolls the series over
     */
    public boolean isNewBucket(long eventTime, long currentBucketStart, Timeframe timeframe) {
        return bucketStart(eventTime, timeframe) > currentBucketStart;
    }

    /**
     * Checks if a tick belongs to a bucket before the current one.
     *
     * @param eventTime The tick's timestamp
     * @param currentBucketStart The open candle's bucket start
     * @param timeframe The series timeframe
     * @return true if the tick arrived late
     */
    public boolean isLate(long eventTime, long currentBucketStart, Timeframe timeframe) {
        return bucketStart(eventTime, timeframe) < currentBucketStart;
    }

    /**
     * Number of bucket steps between the buckets of two timestamps.
     * A value above 1 on rollover means the feed was silent for whole buckets.
     */
    public long bucketsBetween(long fromTimestamp, long toTimestamp, Timeframe timeframe) {
        long fromBucket = bucketStart(fromTimestamp, timeframe);
        long toBucket = bucketStart(toTimestamp, timeframe);
        return (toBucket - fromBucket) / timeframe.toMillis();
    }

    public long getAlignmentOffsetMs() {
        return alignmentOffsetMs;
    }
}
