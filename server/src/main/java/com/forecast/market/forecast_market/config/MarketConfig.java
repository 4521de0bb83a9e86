package com.forecast.market.forecast_market.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.forecast.market.forecast_market.analytics.InMemoryInfoEventFeed;
import com.forecast.market.forecast_market.analytics.InfoEventFeed;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.engine.MarketEngine;
import com.forecast.market.forecast_market.engine.PricingEngine;
import com.forecast.market.forecast_market.engine.ProbabilityModel;
import com.forecast.market.forecast_market.engine.RiskWeightedLmsrModel;
import com.forecast.market.forecast_market.execution.MarketExecutionRegistry;
import com.forecast.market.forecast_market.repositories.MarketRepository;
import com.forecast.market.forecast_market.repositories.MarketStateRepository;
import com.forecast.market.forecast_market.repositories.PositionRepository;
import com.forecast.market.forecast_market.risk.RiskControlService;
import com.forecast.market.forecast_market.service.Ledger;

@Configuration
@EnableConfigurationProperties({ MarketProperties.class, RiskProperties.class, TrendProperties.class })
public class MarketConfig {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketStore marketStore(MarketRepository marketRepository,
                                   MarketStateRepository marketStateRepository,
                                   PositionRepository positionRepository,
                                   MarketProperties properties,
                                   Clock clock) {
        return new MarketStore(marketRepository, marketStateRepository, positionRepository,
                properties.idleFlushThresholdMillis(), clock);
    }

    @Bean
    ProbabilityModel probabilityModel() {
        return new RiskWeightedLmsrModel();
    }

    @Bean
    PricingEngine pricingEngine(MarketProperties properties) {
        return new PricingEngine(properties.platformFee());
    }

    @Bean
    public MarketExecutionRegistry marketExecutionRegistry() {
        return new MarketExecutionRegistry();
    }

    @Bean
    public MarketEngine marketEngine(MarketStore marketStore, ProbabilityModel probabilityModel,
                                     PricingEngine pricingEngine, Ledger ledger,
                                     RiskControlService riskControlService, Clock clock) {
        return new MarketEngine(marketStore, probabilityModel, pricingEngine, ledger, riskControlService, clock);
    }

    @Bean
    @ConditionalOnMissingBean(InfoEventFeed.class)
    public InMemoryInfoEventFeed infoEventFeed(Clock clock) {
        return new InMemoryInfoEventFeed(clock);
    }
}
