package com.forecast.market.forecast_market.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;

import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketState;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.exception.ConsistencyViolationException;
import com.forecast.market.forecast_market.exception.MarketNotFoundException;
import com.forecast.market.forecast_market.repositories.MarketRepository;
import com.forecast.market.forecast_market.repositories.MarketStateRepository;
import com.forecast.market.forecast_market.repositories.PositionRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Hot-path home of every market book.
 *
 * Books are loaded lazily from Mongo and replaced wholesale on commit. Trades
 * are written back once a market goes idle; market creation and resolution
 * are written through immediately.
 */
@Slf4j
public class MarketStore {
    private final ConcurrentHashMap<String, MarketBook> books = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> lastPersisted = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> dirtyPositions = new ConcurrentHashMap<>();

    private final MarketRepository marketRepository;
    private final MarketStateRepository marketStateRepository;
    private final PositionRepository positionRepository;
    private final long idleFlushThresholdMs;
    private final Clock clock;

    public MarketStore(MarketRepository marketRepository,
                       MarketStateRepository marketStateRepository,
                       PositionRepository positionRepository,
                       long idleFlushThresholdMs,
                       Clock clock) {
        this.marketRepository = marketRepository;
        this.marketStateRepository = marketStateRepository;
        this.positionRepository = positionRepository;
        this.idleFlushThresholdMs = idleFlushThresholdMs;
        this.clock = clock;
    }

    public Optional<MarketBook> findBook(String marketId) {
        if (marketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(books.computeIfAbsent(marketId, this::load));
    }

    public MarketBook requireBook(String marketId) {
        return findBook(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
    }

    public Collection<MarketBook> allBooks() {
        return List.copyOf(books.values());
    }

    /**
     * Load every market from the store, e.g. for the daily snapshot job.
     */
    public void warmUp() {
        for (Market market : marketRepository.findAll()) {
            findBook(market.getId());
        }
        log.info("Market store warmed up with {} markets", books.size());
    }

    public void createMarket(MarketBook book) {
        if (books.putIfAbsent(book.marketId(), book) != null) {
            throw new IllegalStateException("Market already exists: " + book.marketId());
        }
        persist(book, List.of());
    }

    /**
     * Publish the book produced by a trade. Persisted when the market goes idle.
     */
    public void commit(MarketBook next, Position changed) {
        books.put(next.marketId(), next);
        markDirty(next.marketId(), List.of(changed.getId()));
    }

    /**
     * Publish and persist immediately. Used for settlement.
     */
    public void commitAndPersist(MarketBook next, Collection<Position> changed) {
        books.put(next.marketId(), next);
        persist(next, changed);
    }

    @Scheduled(fixedDelayString = "${forecast.market.flush-interval-millis:1000}")
    public void flushIdleMarkets() {
        long now = clock.millis();

        for (MarketBook book : books.values()) {
            long lastTrade = book.state().getLastTradeTimestamp();
            long persistedAt = lastPersisted.getOrDefault(book.marketId(), Long.MIN_VALUE);
            boolean pending = dirtyPositions.containsKey(book.marketId());
            if (now - lastTrade > idleFlushThresholdMs && (persistedAt < lastTrade || pending)) {
                persist(book, takeDirty(book));
            }
        }
    }

    /**
     * Removes the dirty ids that {@code book} holds and returns those positions.
     * Ids committed after {@code book} was read stay dirty for the next flush.
     */
    private List<Position> takeDirty(MarketBook book) {
        List<Position> taken = new ArrayList<>();
        dirtyPositions.computeIfPresent(book.marketId(), (id, ids) -> {
            for (Position position : book.positions()) {
                if (ids.remove(position.getId())) {
                    taken.add(position);
                }
            }
            return ids.isEmpty() ? null : ids;
        });
        return taken;
    }

    private void markDirty(String marketId, Collection<String> positionIds) {
        dirtyPositions.compute(marketId, (id, ids) -> {
            Set<String> next = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            next.addAll(positionIds);
            return next;
        });
    }

    private void persist(MarketBook book, Collection<Position> changed) {
        try {
            marketRepository.save(book.market());
            marketStateRepository.save(book.state());
            if (!changed.isEmpty()) {
                positionRepository.saveAll(changed);
            }
            // a later trade carries a later timestamp and makes the market due again
            lastPersisted.merge(book.marketId(), book.state().getLastTradeTimestamp(), Math::max);
            log.debug("Persisted market: {} ({} positions)", book.marketId(), changed.size());
        } catch (Exception e) {
            log.error("Failed to persist market: {}", book.marketId(), e);
            // keep the positions dirty so the next flush retries them
            markDirty(book.marketId(), changed.stream().map(Position::getId).toList());
        }
    }

    private MarketBook load(String marketId) {
        Optional<Market> market = marketRepository.findById(marketId);
        if (market.isEmpty()) {
            log.warn("Market not found in database: {}", marketId);
            return null; // markets are created through MarketLifecycleService, never on trade
        }
        MarketState state = marketStateRepository.findById(marketId)
                .orElseThrow(() -> new ConsistencyViolationException("Market " + marketId + " has no pricing state"));
        List<Position> positions = positionRepository.findByMarketIdOrderByCreatedAtAsc(marketId);
        lastPersisted.put(marketId, state.getLastTradeTimestamp());
        return new MarketBook(market.get(), state, positions);
    }

    Map<String, Set<String>> dirtyPositionsView() {
        return dirtyPositions;
    }
}
