package com.forecast.market.forecast_market.service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Transaction;
import com.forecast.market.forecast_market.entity.User;
import com.forecast.market.forecast_market.exception.InsufficientBalanceException;
import com.forecast.market.forecast_market.repositories.TransactionRepository;
import com.forecast.market.forecast_market.repositories.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger-first balances. The transactions collection is the SOURCE OF TRUTH;
 * the latest entry of a user carries the running balance, and User.balance is
 * a cache refreshed after every entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService implements Ledger {

    private final TransactionRepository transactionRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> userLocks = new ConcurrentHashMap<>();

    /**
     * O(1) lookup via the balanceAfter field of the latest entry.
     */
    @Override
    public Money getBalance(String userId) {
        Transaction latest = transactionRepository.findTopByUserIdOrderByTimestampDesc(userId);
        return latest != null ? latest.getBalanceAfter() : Money.ZERO;
    }

    @Override
    public void credit(String userId, Money amount, LedgerReference reference) {
        requirePositive(amount);
        synchronized (lockFor(userId)) {
            append(userId, amount, reference);
        }
    }

    @Override
    public void debit(String userId, Money amount, LedgerReference reference) {
        requirePositive(amount);
        synchronized (lockFor(userId)) {
            Money balance = getBalance(userId);
            if (balance.isLessThan(amount)) {
                throw new InsufficientBalanceException(userId, balance, amount);
            }
            append(userId, amount.negate(), reference);
        }
    }

    public void deposit(String userId, Money amount) {
        credit(userId, amount, LedgerReference.deposit());
        log.info("Deposit: userId={}, amount={}", userId, amount);
    }

    public List<Transaction> history(String userId) {
        return transactionRepository.findByUserIdOrderByTimestampDesc(userId);
    }

    /**
     * Sum of every entry. Reconciliation only, O(n).
     */
    public Money computeBalanceFromLedgerFullScan(String userId) {
        return Money.sum(transactionRepository.findAllByUserIdForBalanceCompute(userId).stream()
                .map(Transaction::getAmount)
                .toList());
    }

    /**
     * Periodic reconciliation - ensures cached balances match the ledger.
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public void reconcileAllBalances() {
        log.info("Starting balance reconciliation from ledger...");

        try {
            int reconciled = 0;
            int drifted = 0;
            for (User user : userRepository.findAll()) {
                Money ledgerBalance = computeBalanceFromLedgerFullScan(user.getUserId());
                if (!ledgerBalance.equals(user.getBalance())) {
                    log.warn("Balance drift detected for user {}: cached={}, ledger={}",
                        user.getUserId(), user.getBalance(), ledgerBalance);
                    user.setBalance(ledgerBalance);
                    user.setUpdatedAt(clock.millis());
                    userRepository.save(user);
                    drifted++;
                }
                reconciled++;
            }
            log.info("Balance reconciliation complete: {} users checked, {} corrected", reconciled, drifted);
        } catch (Exception e) {
            log.error("Balance reconciliation failed: {}", e.getMessage(), e);
        }
    }

    private void append(String userId, Money signedAmount, LedgerReference reference) {
        if (reference.nonce() != null && transactionRepository.existsByNonce(reference.nonce())) {
            log.warn("Duplicate ledger entry skipped: userId={}, nonce={}", userId, reference.nonce());
            return;
        }
        Money balanceAfter = getBalance(userId).add(signedAmount);
        long now = clock.millis();

        Transaction transaction = Transaction.builder()
                .userId(userId)
                .marketId(reference.marketId())
                .positionId(reference.positionId())
                .type(reference.type())
                .amount(signedAmount)
                .timestamp(now)
                .nonce(reference.nonce())
                .balanceAfter(balanceAfter)
                .build();
        transactionRepository.save(transaction);

        User user = userRepository.findById(userId)
                .orElseGet(() -> User.builder().userId(userId).build());
        user.setBalance(balanceAfter);
        user.setUpdatedAt(now);
        userRepository.save(user);

        log.debug("Ledger {}: userId={}, amount={}, balanceAfter={}", reference.type(), userId, signedAmount, balanceAfter);
    }

    private Object lockFor(String userId) {
        return userLocks.computeIfAbsent(userId, id -> new Object());
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new IllegalArgumentException("Ledger amount must be positive: " + amount);
        }
    }
}
