package com.fintech.strategyengine.aggregation;

import com.fintech.strategyengine.domain.Candle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Closed candles plus at most one forming candle for one (instrument, timeframe) pair.
 * Closed candles are strictly increasing by bucket start and never change once closed.
 *
 * Not thread-safe; {@link AggregationEngine} guards each series with its own lock.
 */
public final class CandleSeries {

    /** Result of applying one price to the series. */
    public enum Outcome {
        /** Series had no forming candle; one was opened. */
        OPENED,
        /** Price extended the forming candle. */
        UPDATED,
        /** Forming candle closed and a new one opened. */
        ROLLED_OVER,
        /** Price belongs to an earlier bucket; nothing changed. */
        LATE
    }

    private final int maxHistory;
    private final ArrayDeque<Candle> closed = new ArrayDeque<>();
    private MutableCandle forming;

    public CandleSeries(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive, got " + maxHistory);
        }
        this.maxHistory = maxHistory;
    }

    /**
     * Installs backfilled candles. Candles are sorted by bucket and any that do not advance
     * the bucket are skipped. The last one becomes the forming candle, since the vendor
     * returns the current bucket while it is still trading.
     *
     * @return number of candles accepted
     */
    public int seed(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return 0;
        }
        List<Candle> ordered = new ArrayList<>(candles);
        ordered.sort(Comparator.comparingLong(Candle::bucketStart));

        int accepted = 0;
        for (Candle candle : ordered) {
            if (forming != null && candle.bucketStart() <= forming.bucketStart) {
                continue;
            }
            if (forming != null) {
                close();
            }
            forming = new MutableCandle(candle);
            accepted++;
        }
        return accepted;
    }

    /**
     * Applies one price at the given bucket.
     *
     * @param bucketStart Bucket of the tick, already aligned
     * @param price Tick price
     * @return what happened to the series
     */
    public Outcome apply(long bucketStart, double price) {
        if (forming == null) {
            forming = new MutableCandle(bucketStart, price);
            return Outcome.OPENED;
        }
        if (bucketStart == forming.bucketStart) {
            forming.update(price);
            return Outcome.UPDATED;
        }
        if (bucketStart > forming.bucketStart) {
            close();
            forming = new MutableCandle(bucketStart, price);
            return Outcome.ROLLED_OVER;
        }
        return Outcome.LATE;
    }

    private void close() {
        closed.addLast(forming.toCandle());
        while (closed.size() > maxHistory) {
            closed.removeFirst();
        }
    }

    /** Returns an immutable snapshot of closed candles, oldest first. */
    public List<Candle> closedCandles() {
        return List.copyOf(closed);
    }

    /** Returns the most recently closed candle, if any. */
    public Optional<Candle> lastClosed() {
        return Optional.ofNullable(closed.peekLast());
    }

    /** Returns the forming candle as an immutable value. */
    public Optional<Candle> formingCandle() {
        return forming == null ? Optional.empty() : Optional.of(forming.toCandle());
    }

    /** Returns the forming candle's bucket, or {@code Long.MIN_VALUE} when none. */
    public long formingBucket() {
        return forming == null ? Long.MIN_VALUE : forming.bucketStart;
    }

    public int closedCount() {
        return closed.size();
    }

    /**
     * Forming candle; mutated in place while its bucket is current.
     */
    private static final class MutableCandle {
        final long bucketStart;
        final double open;
        double high;
        double low;
        double close;

        MutableCandle(long bucketStart, double price) {
            this.bucketStart = bucketStart;
            this.open = price;
            this.high = price;
            this.low = price;
            this.close = price;
        }

        MutableCandle(Candle candle) {
            this.bucketStart = candle.bucketStart();
            this.open = candle.open();
            this.high = candle.high();
            this.low = candle.low();
            this.close = candle.close();
        }

        void update(double price) {
            this.high = Math.max(this.high, price);
            this.low = Math.min(this.low, price);
            this.close = price;
        }

        Candle toCandle() {
            return new Candle(bucketStart, open, high, low, close);
        }
    }
}
