package com.fintech.strategyengine.strategy;

import com.fintech.strategyengine.domain.Candle;
import com.fintech.strategyengine.domain.Signal;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Close-channel breakout: buy when the last close exceeds the highest close of the previous
 * {@code length} candles, sell when it falls below the lowest, otherwise neutral.
 */
@Component
public class ChannelBreakoutStrategy implements TradingStrategy {

    public static final String ID = "ChannelBreakout";
    public static final String LENGTH = "length";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Signal evaluate(List<Candle> history, Map<String, Object> parameters) {
        int length = positiveInt(parameters.get(LENGTH));

        // needs length+1 closed candles
        if (history.size() <= length) {
            throw StrategyException.insufficientHistory(ID, (long) length + 1, history.size());
        }

        int last = history.size() - 1;
        double highestClose = Double.NEGATIVE_INFINITY;
        double lowestClose = Double.POSITIVE_INFINITY;
        for (int i = last - length; i < last; i++) {
            double close = history.get(i).close();
            highestClose = Math.max(highestClose, close);
            lowestClose = Math.min(lowestClose, close);
        }

        double lastClose = history.get(last).close();
        if (lastClose > highestClose) {
            return Signal.BUY;
        }
        if (lastClose < lowestClose) {
            return Signal.SELL;
        }
        return Signal.NEUTRAL;
    }

    private static int positiveInt(Object value) {
        int parsed;
        if (value instanceof Number) {
            Number number = (Number) value;
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw StrategyException.invalidParameter(ID, LENGTH, value);
            }
            parsed = number.intValue();
        } else if (value instanceof String) {
            try {
                parsed = Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw StrategyException.invalidParameter(ID, LENGTH, value);
            }
        } else {
            throw StrategyException.invalidParameter(ID, LENGTH, value);
        }
        if (parsed <= 0) {
            throw StrategyException.invalidParameter(ID, LENGTH, value);
        }
        return parsed;
    }
}
