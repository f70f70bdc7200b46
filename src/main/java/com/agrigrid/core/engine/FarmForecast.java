package com.agrigrid.core.engine;

import com.agrigrid.core.analytics.StressIndicators;
import com.agrigrid.core.analytics.YieldForecast;

public record FarmForecast(long tick, YieldForecast yield, StressIndicators stress) {}
