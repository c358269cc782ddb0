package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.constraints.ConstraintNormalizer;
import com.astrazeneca.symetrics.constraints.GnomadConstraintReader;
import com.astrazeneca.symetrics.data.ConstraintRecord;
import com.astrazeneca.symetrics.data.GnomadConstraintRecord;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.resolvers.LiftoverResolver;
import com.astrazeneca.symetrics.resolvers.ScoreResolver;
import com.astrazeneca.symetrics.store.JdbcTableStore;
import com.astrazeneca.symetrics.store.TableStore;

import java.util.List;
import java.util.Optional;

/**
 * Entry point of the library: variant scores, liftover and gene constraint scores. Holds no connections,
 * every call opens and closes its own.
 */
public class Symetrics {
    private final ScoreResolver scoreResolver;
    private final LiftoverResolver liftoverResolver;
    private final ConstraintNormalizer constraintNormalizer;
    private final GnomadConstraintReader gnomadConstraintReader;

    public Symetrics(Configuration conf) {
        TableStore scoreStore = new JdbcTableStore(conf.scoreDatabase);
        TableStore populationStore = conf.populationDatabase == null ? null : new JdbcTableStore(conf.populationDatabase);
        this.scoreResolver = new ScoreResolver(scoreStore, populationStore);
        this.liftoverResolver = new LiftoverResolver(scoreStore);
        this.constraintNormalizer = new ConstraintNormalizer(conf.constraintFiles);
        this.gnomadConstraintReader = conf.gnomadConstraints == null ? null : new GnomadConstraintReader(conf.gnomadConstraints);
    }

    public Symetrics(ScoreResolver scoreResolver, LiftoverResolver liftoverResolver,
                     ConstraintNormalizer constraintNormalizer, GnomadConstraintReader gnomadConstraintReader) {
        this.scoreResolver = scoreResolver;
        this.liftoverResolver = liftoverResolver;
        this.constraintNormalizer = constraintNormalizer;
        this.gnomadConstraintReader = gnomadConstraintReader;
    }

    /**
     * RSCU, dRSCU, GERP++ and CpG/CpG_exon of the variant (hg19).
     */
    public Optional<ScoreRecord> getSilvaScore(VariantKey variant) {
        return resolve(ScoreFamily.CONSERVATION, variant);
    }

    /**
     * SURF of the variant (hg38).
     */
    public Optional<ScoreRecord> getSurfScore(VariantKey variant) {
        return resolve(ScoreFamily.SURFACE_ACCESSIBILITY, variant);
    }

    /**
     * synVep of the variant (hg19 or hg38).
     */
    public Optional<ScoreRecord> getSynvepScore(VariantKey variant) {
        return resolve(ScoreFamily.SYNONYMOUS_PATHOGENICITY, variant);
    }

    /**
     * Maximum SpliceAI delta score of the variant (hg38).
     */
    public Optional<ScoreRecord> getSpliceAiScore(VariantKey variant) {
        return resolve(ScoreFamily.SPLICE_EFFECT, variant);
    }

    /**
     * gnomAD AC, AN and AF of the variant (hg38 only).
     */
    public Optional<ScoreRecord> getGnomadData(VariantKey variant) {
        return resolve(ScoreFamily.POPULATION_FREQUENCY, variant);
    }

    public Optional<ScoreRecord> resolve(ScoreFamily family, VariantKey variant) {
        return scoreResolver.resolve(family, variant);
    }

    /**
     * Resolves the score, lifting the variant over first if the table doesn't index its build.
     * The record then carries the coordinates of the lifted variant.
     * @param family score family
     * @param variant variant in any build
     * @return record or empty if either liftover or lookup found nothing
     */
    public Optional<ScoreRecord> resolveLifted(ScoreFamily family, VariantKey variant) {
        if (scoreResolver.isIndexed(family, variant)) {
            return scoreResolver.resolve(family, variant);
        }
        Optional<VariantKey> lifted = liftoverResolver.translate(variant);
        if (!lifted.isPresent()) {
            return Optional.empty();
        }
        return scoreResolver.resolve(family, lifted.get());
    }

    /**
     * Converts the variant position from its build to the other one (hg19 to hg38 and otherwise).
     */
    public Optional<VariantKey> liftover(VariantKey variant) {
        return liftoverResolver.translate(variant);
    }

    /**
     * SYMETRICS score of the gene: p-value and FDR of the pooled proportion test of the metric group and the
     * z statistic before and after scaling.
     * @param group metric group, e.g. SYNVEP, SURF, GERP, CpG, CpG_exon, RSCU, dRSCU, SpliceAI
     * @param gene HGNC symbol
     */
    public Optional<ConstraintRecord> getPropScore(String group, String gene) {
        return constraintNormalizer.normalize(group, gene);
    }

    /**
     * gnomAD synonymous, missense and loss of function z scores and pLI of all transcripts of the gene.
     */
    public List<GnomadConstraintRecord> getGnomadConstraints(String gene) {
        if (gnomadConstraintReader == null) {
            throw new IllegalStateException("gnomAD constraint table is not configured (collection.gnomad.constraints)");
        }
        return gnomadConstraintReader.find(gene);
    }
}
