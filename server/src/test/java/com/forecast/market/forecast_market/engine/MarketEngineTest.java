package com.forecast.market.forecast_market.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.config.RiskProperties;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketStatus;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.PositionStatus;
import com.forecast.market.forecast_market.entity.TradeRequest;
import com.forecast.market.forecast_market.exception.ErrorKind;
import com.forecast.market.forecast_market.exception.InsufficientBalanceException;
import com.forecast.market.forecast_market.exception.InvalidStakeException;
import com.forecast.market.forecast_market.exception.MarketException;
import com.forecast.market.forecast_market.exception.MarketInactiveException;
import com.forecast.market.forecast_market.exception.MarketNotFoundException;
import com.forecast.market.forecast_market.exception.OutcomeNotFoundException;
import com.forecast.market.forecast_market.exception.TradeRejectedException;
import com.forecast.market.forecast_market.repositories.MarketRepository;
import com.forecast.market.forecast_market.repositories.MarketStateRepository;
import com.forecast.market.forecast_market.repositories.PositionRepository;
import com.forecast.market.forecast_market.repositories.RiskControlStateRepository;
import com.forecast.market.forecast_market.risk.RiskControlService;
import com.forecast.market.forecast_market.support.InMemoryLedger;
import com.forecast.market.forecast_market.support.MarketFixtures;
import com.forecast.market.forecast_market.support.MutableClock;

class MarketEngineTest {

    private static final String MARKET = "m1";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-17T10:00:00Z"));
    private final InMemoryLedger ledger = new InMemoryLedger();
    private MarketStore store;

    @BeforeEach
    void setUp() {
        store = new MarketStore(mock(MarketRepository.class), mock(MarketStateRepository.class),
                mock(PositionRepository.class), 1_000, clock);
        store.createMarket(MarketFixtures.binaryBook(MARKET, 100));
        ledger.fund("alice", Money.of(10_000));
    }

    @Test
    void stakeMovesProbabilityTowardsBackedOutcome() {
        TradeResult result = engine(RiskProperties.defaults()).executeTrade(trade("alice", MarketFixtures.YES, 100, null));

        assertThat(result.probabilitiesBefore()).containsEntry(MarketFixtures.YES, 50).containsEntry(MarketFixtures.NO, 50);
        assertThat(result.probabilitiesAfter().get(MarketFixtures.YES)).isGreaterThan(50);
        assertThat(result.probabilitiesAfter().get(MarketFixtures.NO)).isLessThan(50);
        assertThat(result.probabilitiesAfter().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(100);
        assertThat(result.replayed()).isFalse();

        MarketBook book = store.requireBook(MARKET);
        Market market = book.market();
        Outcome yes = market.findOutcome(MarketFixtures.YES).orElseThrow();
        assertThat(market.getTotalVolume()).isEqualTo(Money.of(100));
        assertThat(yes.getTotalStake()).isEqualTo(Money.of(100));
        assertThat(yes.getProbability()).isEqualTo(result.probabilitiesAfter().get(MarketFixtures.YES));
        assertThat(yes.getStakeShare()).isEqualTo(100);
        assertThat(book.state().accumulator(MarketFixtures.YES)).isCloseTo(50.0, within(1e-12));
        assertThat(book.state().getLastTradeTimestamp()).isEqualTo(clock.millis());
    }

    @Test
    void positionCarriesBothSettlementBranches() {
        TradeResult result = engine(RiskProperties.defaults()).executeTrade(trade("alice", MarketFixtures.YES, 100, null));

        Position position = result.position();
        assertThat(position.getStatus()).isEqualTo(PositionStatus.ACTIVE);
        assertThat(position.getOddsAtPrediction()).isEqualTo(50.0);
        assertThat(position.getPotentialReturn()).isEqualTo(Money.of("149.5"));
        assertThat(position.getLossRefund()).isEqualTo(Money.of(50));
        assertThat(position.getActualReturn()).isEqualTo(Money.ZERO);
        assertThat(result.breakdown().winProfit()).isEqualTo(Money.of("49.5"));

        assertThat(ledger.getBalance("alice")).isEqualTo(Money.of(9_900));
        assertThat(store.requireBook(MARKET).positions()).containsExactly(position);
    }

    @Test
    void rejectsInvalidRequestsWithoutTouchingTheMarket() {
        MarketEngine engine = engine(RiskProperties.defaults());
        MarketBook before = store.requireBook(MARKET);

        assertThatThrownBy(() -> engine.executeTrade(trade("alice", MarketFixtures.YES, 0, null)))
                .isInstanceOf(InvalidStakeException.class)
                .satisfies(e -> assertThat(((MarketException) e).getKind()).isEqualTo(ErrorKind.VALIDATION));
        assertThatThrownBy(() -> engine.executeTrade(TradeRequest.builder()
                .userId("alice").marketId("nope").outcomeId(MarketFixtures.YES).stake(Money.of(10)).build()))
                .isInstanceOf(MarketNotFoundException.class);
        assertThatThrownBy(() -> engine.executeTrade(trade("alice", "maybe", 10, null)))
                .isInstanceOf(OutcomeNotFoundException.class);

        assertThat(store.requireBook(MARKET)).isSameAs(before);
        assertThat(ledger.getBalance("alice")).isEqualTo(Money.of(10_000));
    }

    @Test
    void closedMarketDoesNotTrade() {
        MarketBook book = store.requireBook(MARKET);
        Market closed = book.market().copy();
        closed.setStatus(MarketStatus.CLOSED);
        store.commitAndPersist(book.withMarket(closed), List.of());

        assertThatThrownBy(() -> engine(RiskProperties.defaults()).executeTrade(trade("alice", MarketFixtures.YES, 10, null)))
                .isInstanceOf(MarketInactiveException.class)
                .satisfies(e -> assertThat(((MarketException) e).getKind()).isEqualTo(ErrorKind.STATE_CONFLICT));
    }

    @Test
    void riskRejectionLeavesNoTrace() {
        ledger.fund("bob", Money.of(100));
        MarketBook before = store.requireBook(MARKET);

        assertThatThrownBy(() -> engine(RiskProperties.defaults()).executeTrade(trade("bob", MarketFixtures.YES, 50, null)))
                .isInstanceOf(TradeRejectedException.class)
                .satisfies(e -> assertThat(((TradeRejectedException) e).getBlockedReasons())
                        .anyMatch(r -> r.contains("exceeds 10%")));

        assertThat(store.requireBook(MARKET)).isSameAs(before);
        assertThat(ledger.getBalance("bob")).isEqualTo(Money.of(100));
    }

    @Test
    void failedDebitPublishesNothingAndBooksNoSpend() {
        RiskProperties permissive = new RiskProperties(1_000.0, 500.0, null, null, null, null, null);
        RiskControlService risk = riskControl(permissive);
        MarketEngine engine = new MarketEngine(store, new RiskWeightedLmsrModel(), new PricingEngine(), ledger, risk, clock);
        ledger.fund("bob", Money.of(10));
        risk.setDailyLimit("bob", Money.of(50));
        MarketBook before = store.requireBook(MARKET);

        assertThatThrownBy(() -> engine.executeTrade(trade("bob", MarketFixtures.YES, 50, null)))
                .isInstanceOf(InsufficientBalanceException.class);

        assertThat(store.requireBook(MARKET)).isSameAs(before);
        assertThat(risk.evaluate("bob", Money.of(50)).dailyRemaining()).isEqualTo(Money.of(50));
    }

    @Test
    void repeatedNonceReturnsTheOriginalPosition() {
        MarketEngine engine = engine(RiskProperties.defaults());

        TradeResult first = engine.executeTrade(trade("alice", MarketFixtures.YES, 100, "nonce-1"));
        TradeResult second = engine.executeTrade(trade("alice", MarketFixtures.YES, 100, "nonce-1"));

        assertThat(second.replayed()).isTrue();
        assertThat(second.position().getId()).isEqualTo(first.position().getId());
        assertThat(store.requireBook(MARKET).positions()).hasSize(1);
        assertThat(ledger.getBalance("alice")).isEqualTo(Money.of(9_900));
    }

    @Test
    void nonceIsScopedToTheUserWhoSentIt() {
        MarketEngine engine = engine(RiskProperties.defaults());
        ledger.fund("bob", Money.of(10_000));

        TradeResult alice = engine.executeTrade(trade("alice", MarketFixtures.YES, 100, "1"));
        TradeResult bob = engine.executeTrade(trade("bob", MarketFixtures.NO, 100, "1"));
        TradeResult bobRetry = engine.executeTrade(trade("bob", MarketFixtures.NO, 100, "1"));

        assertThat(bob.replayed()).isFalse();
        assertThat(bob.position().getId()).isNotEqualTo(alice.position().getId());
        assertThat(bobRetry.replayed()).isTrue();
        assertThat(bobRetry.position().getId()).isEqualTo(bob.position().getId());
        assertThat(store.requireBook(MARKET).positions()).hasSize(2);
        assertThat(ledger.getBalance("bob")).isEqualTo(Money.of(9_900));
    }

    @Test
    void quoteUsesCurrentProbability() {
        TradeBreakdown quote = engine(RiskProperties.defaults()).quote(MARKET, MarketFixtures.NO, Money.of(100));

        assertThat(quote.probability()).isEqualTo(0.5);
        assertThat(quote.winReturn()).isEqualTo(Money.of("149.5"));
        assertThat(store.requireBook(MARKET).positions()).isEmpty();
    }

    private MarketEngine engine(RiskProperties riskProperties) {
        return new MarketEngine(store, new RiskWeightedLmsrModel(), new PricingEngine(), ledger,
                riskControl(riskProperties), clock);
    }

    private RiskControlService riskControl(RiskProperties riskProperties) {
        return new RiskControlService(mock(RiskControlStateRepository.class), ledger, riskProperties, clock);
    }

    private static TradeRequest trade(String userId, String outcomeId, long stake, String nonce) {
        return TradeRequest.builder()
                .userId(userId)
                .marketId(MARKET)
                .outcomeId(outcomeId)
                .stake(Money.of(stake))
                .nonce(nonce)
                .build();
    }
}
