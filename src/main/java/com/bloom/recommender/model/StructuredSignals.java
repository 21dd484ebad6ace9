package com.bloom.recommender.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Optional structured activity evidence (for example an on-chain or app activity log).
 *
 * <p>{@code entityInteractions} holds one entry per interaction with the id of the entity
 * touched, so repeats are meaningful. {@code counterparties} holds free-form labels of
 * whatever was interacted with and is scanned for early/established markers.
 */
public final class StructuredSignals {
    private final List<String> entityInteractions;
    private final List<String> assets;
    private final List<String> counterparties;
    private final List<String> governanceActions;
    private final int totalInteractions;

    public StructuredSignals(List<String> entityInteractions,
                             List<String> assets,
                             List<String> counterparties,
                             List<String> governanceActions,
                             int totalInteractions) {
        this.entityInteractions = withoutNulls(entityInteractions);
        this.assets = withoutNulls(assets);
        this.counterparties = withoutNulls(counterparties);
        this.governanceActions = withoutNulls(governanceActions);
        this.totalInteractions = Math.max(totalInteractions, this.entityInteractions.size());
    }

    public List<String> getEntityInteractions() { return entityInteractions; }
    public List<String> getAssets() { return assets; }
    public List<String> getCounterparties() { return counterparties; }
    public List<String> getGovernanceActions() { return governanceActions; }
    public int getTotalInteractions() { return totalInteractions; }

    public int uniqueEntityCount() {
        return new HashSet<>(entityInteractions).size();
    }

    public int uniqueAssetCount() {
        return new HashSet<>(assets).size();
    }

    /** Average number of interactions per distinct entity, 0 when nothing was touched. */
    public double averageInteractionsPerEntity() {
        int unique = uniqueEntityCount();
        if (unique == 0) return 0.0;
        return (double) entityInteractions.size() / unique;
    }

    private static List<String> withoutNulls(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public boolean isEmpty() {
        return entityInteractions.isEmpty() && assets.isEmpty() && counterparties.isEmpty()
                && governanceActions.isEmpty() && totalInteractions == 0;
    }
}
