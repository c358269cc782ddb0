package com.astrazeneca.symetrics.resolvers;

import com.astrazeneca.symetrics.adapters.ScoreTableAdapter;
import com.astrazeneca.symetrics.adapters.SynvepTableAdapter;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.StoreUnavailableException;
import com.astrazeneca.symetrics.store.Row;
import com.astrazeneca.symetrics.store.TableStore;

import java.util.List;
import java.util.Optional;

/**
 * Translates variants between hg19 and hg38 through the SYNVEP table, the only one that carries positions of
 * both builds. Coverage is limited to the variants present in that table.
 * <p>
 * If the bridge table maps one position to several, the first mapping is used and a warning is printed,
 * so a round trip can end at another position than the one it started from.
 */
public class LiftoverResolver {
    private final TableStore scoreStore;
    private final SynvepTableAdapter bridge;

    /**
     * @param scoreStore store with the SYNVEP table
     */
    public LiftoverResolver(TableStore scoreStore) {
        this(scoreStore, new SynvepTableAdapter());
    }

    public LiftoverResolver(TableStore scoreStore, SynvepTableAdapter bridge) {
        this.scoreStore = scoreStore;
        this.bridge = bridge;
    }

    /**
     * @param variant variant in hg19 or hg38
     * @return the variant in the opposite build or empty if the bridge table doesn't contain it
     * @throws StoreUnavailableException if the store can't be queried
     */
    public Optional<VariantKey> translate(VariantKey variant) {
        List<Row> rows = scoreStore.select(bridge.bridgeQuery(variant));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        if (rows.size() > 1) {
            System.err.printf("WARNING: %d mappings of %s found in %s, the first one is used.%n",
                    rows.size(), variant, bridge.getTable());
        }
        Row row = rows.get(0);
        // row exists but has no position in the opposite build
        if (row.get(ScoreTableAdapter.POS) == null) {
            return Optional.empty();
        }
        VariantKey lifted = new VariantKey(
                row.getString(ScoreTableAdapter.CHR),
                row.getInt(ScoreTableAdapter.POS),
                row.getString(ScoreTableAdapter.REF),
                row.getString(ScoreTableAdapter.ALT),
                variant.genome.opposite());
        return Optional.of(lifted);
    }
}
