package com.ainp.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;

/**
 * Credit account of one agent, in atomic units (1 credit = 1000 units).
 * Invariant: balance >= reserved >= 0.
 */
@Entity
@Table(name = "credit_accounts")
public class CreditAccount {

    @Id
    @Column(name = "agent_did", nullable = false, updatable = false)
    private String agentDid;

    @PositiveOrZero
    @Column(nullable = false)
    private long balance;

    @PositiveOrZero
    @Column(nullable = false)
    private long reserved;

    @PositiveOrZero
    @Column(nullable = false)
    private long earned;

    @PositiveOrZero
    @Column(nullable = false)
    private long spent;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected CreditAccount() {}

    public static CreditAccount create(String agentDid, long initialBalance, Instant now) {
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance must be non-negative");
        }
        var account = new CreditAccount();
        account.agentDid = agentDid;
        account.balance = initialBalance;
        account.reserved = 0;
        account.earned = 0;
        account.spent = 0;
        account.createdAt = now;
        account.updatedAt = now;
        return account;
    }

    public long getAvailable() {
        return balance - reserved;
    }

    public void reserve(long amount, Instant now) {
        requireNonNegative(amount);
        if (amount > getAvailable()) {
            throw new IllegalStateException("Insufficient available credits to reserve");
        }
        this.reserved += amount;
        this.updatedAt = now;
    }

    /**
     * Drops {@code reservedAmount} from the reservation and debits {@code spentAmount} of it.
     */
    public void release(long reservedAmount, long spentAmount, Instant now) {
        requireNonNegative(reservedAmount);
        requireNonNegative(spentAmount);
        if (spentAmount > reservedAmount) {
            throw new IllegalArgumentException("Cannot spend more than reserved");
        }
        if (reservedAmount > reserved) {
            throw new IllegalStateException("Cannot release more than reserved");
        }
        this.reserved -= reservedAmount;
        this.balance -= spentAmount;
        this.spent += spentAmount;
        this.updatedAt = now;
    }

    public void deposit(long amount, Instant now) {
        requireNonNegative(amount);
        this.balance = Math.addExact(balance, amount);
        this.updatedAt = now;
    }

    public void earn(long amount, Instant now) {
        requireNonNegative(amount);
        this.balance = Math.addExact(balance, amount);
        this.earned = Math.addExact(earned, amount);
        this.updatedAt = now;
    }

    public void spend(long amount, Instant now) {
        requireNonNegative(amount);
        if (amount > getAvailable()) {
            throw new IllegalStateException("Insufficient available credits to spend");
        }
        this.balance -= amount;
        this.spent += amount;
        this.updatedAt = now;
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
    }

    // Getters
    public String getAgentDid() { return agentDid; }
    public long getBalance() { return balance; }
    public long getReserved() { return reserved; }
    public long getEarned() { return earned; }
    public long getSpent() { return spent; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
