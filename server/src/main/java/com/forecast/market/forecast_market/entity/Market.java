package com.forecast.market.forecast_market.entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A forecasting market with two or more outcomes.
 *
 * Invariants:
 * - outcome probabilities sum to 100
 * - winningOutcomeId is set iff status == RESOLVED
 * - totalVolume equals the sum of outcome stakes
 */
@Document(collection = "markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Market {
    @MongoId
    private String id;

    private String title;
    private String description;
    private String category;

    @Indexed
    @Builder.Default
    private MarketStatus status = MarketStatus.ACTIVE;

    @Builder.Default
    private List<Outcome> outcomes = new ArrayList<>();

    @Builder.Default
    private Money totalVolume = Money.ZERO;

    private String winningOutcomeId;

    private long createdAt;
    private Long closeDate;
    private Long resolutionDate;

    public Optional<Outcome> findOutcome(String outcomeId) {
        if (outcomeId == null) {
            return Optional.empty();
        }
        return outcomes.stream().filter(o -> outcomeId.equals(o.getId())).findFirst();
    }

    public List<String> outcomeIds() {
        return outcomes.stream().map(Outcome::getId).toList();
    }

    /**
     * Deep copy: outcomes are copied so the original can stay visible to
     * readers while the copy is being mutated.
     */
    public Market copy() {
        List<Outcome> copied = new ArrayList<>(outcomes.size());
        for (Outcome o : outcomes) {
            copied.add(o.copy());
        }
        return new Market(id, title, description, category, status, copied, totalVolume,
                winningOutcomeId, createdAt, closeDate, resolutionDate);
    }
}
