package com.astrazeneca.symetrics.resolvers;

import com.astrazeneca.symetrics.adapters.ScoreTableAdapter;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.BuildMismatchException;
import com.astrazeneca.symetrics.exception.StoreUnavailableException;
import com.astrazeneca.symetrics.exception.UnsupportedBuildException;
import com.astrazeneca.symetrics.store.Row;
import com.astrazeneca.symetrics.store.TableStore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves scores of a variant: picks the adapter of the requested family, runs its query in the store the
 * family lives in and converts the first matched row into a record.
 */
public class ScoreResolver {
    private final Map<ScoreFamily.Store, TableStore> stores;
    private final Map<ScoreFamily, ScoreTableAdapter> adapters;

    /**
     * @param scoreStore store with SILVA, SURF, SYNVEP and SPLICEAI tables
     * @param populationStore store with gnomAD table
     */
    public ScoreResolver(TableStore scoreStore, TableStore populationStore) {
        this(scoreStore, populationStore, ScoreTableAdapter.defaultAdapters());
    }

    public ScoreResolver(TableStore scoreStore, TableStore populationStore,
                         Map<ScoreFamily, ScoreTableAdapter> adapters) {
        this.stores = new EnumMap<>(ScoreFamily.Store.class);
        this.stores.put(ScoreFamily.Store.SCORES, scoreStore);
        this.stores.put(ScoreFamily.Store.POPULATION, populationStore);
        this.adapters = Collections.unmodifiableMap(new EnumMap<>(adapters));
    }

    /**
     * Looks the variant up in the table of the score family.
     * @param family score family
     * @param variant variant in the build the table indexes
     * @return record of the first matched row or empty if the table has no such variant
     * @throws BuildMismatchException if the table doesn't index the variant's build
     * @throws UnsupportedBuildException if population frequencies are requested for hg19
     * @throws StoreUnavailableException if the store can't be queried
     */
    public Optional<ScoreRecord> resolve(ScoreFamily family, VariantKey variant) {
        ScoreTableAdapter adapter = getAdapter(family);
        adapter.checkBuild(variant);
        TableStore store = stores.get(family.getStore());
        if (store == null) {
            throw new IllegalStateException("Table store for " + family + " is not configured");
        }
        List<Row> rows = store.select(adapter.query(variant));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(adapter.toRecord(variant, rows.get(0)));
    }

    /**
     * @param family score family
     * @return true if the table of the family indexes the variant's build without liftover
     */
    public boolean isIndexed(ScoreFamily family, VariantKey variant) {
        return getAdapter(family).supports(variant.genome);
    }

    public ScoreTableAdapter getAdapter(ScoreFamily family) {
        ScoreTableAdapter adapter = adapters.get(family);
        if (adapter == null) {
            throw new IllegalArgumentException("No score table adapter for " + family);
        }
        return adapter;
    }
}
