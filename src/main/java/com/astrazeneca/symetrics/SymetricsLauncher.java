package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.ConstraintRecord;
import com.astrazeneca.symetrics.data.GnomadConstraintRecord;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.BuildMismatchException;
import com.astrazeneca.symetrics.exception.ConstraintSourceMissedException;
import com.astrazeneca.symetrics.exception.InvalidGroupException;
import com.astrazeneca.symetrics.exception.StoreUnavailableException;
import com.astrazeneca.symetrics.exception.UnsupportedBuildException;
import com.astrazeneca.symetrics.exception.WrongAnnotationFormatException;
import com.astrazeneca.symetrics.exception.WrongVariantFormatException;
import com.astrazeneca.symetrics.printers.RecordPrinter;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Class runs the requests of the current command line: score lookups and liftover of the variant,
 * constraint scores of the gene.
 */
public class SymetricsLauncher {
    private final Symetrics symetrics;
    private final RecordPrinter printer;

    public SymetricsLauncher(Symetrics symetrics, RecordPrinter printer) {
        this.symetrics = symetrics;
        this.printer = printer;
    }

    /**
     * Runs all requested operations. A failed operation is reported to STDERR and doesn't stop the others.
     * @param config configuration with the requests
     * @return number of operations that failed
     */
    public int start(Configuration config) {
        int failures = 0;
        if (config.hasVariantRequest()) {
            failures += variantRequests(config);
        }
        if (config.metricGroup != null) {
            failures += propScore(config.metricGroup, config.gene);
        }
        if (config.gnomadConstraintsRequested) {
            failures += gnomadConstraints(config.gene);
        }
        return failures;
    }

    private int variantRequests(Configuration config) {
        VariantKey variant;
        try {
            variant = VariantKey.parse(config.variant, config.genome);
        } catch (WrongVariantFormatException e) {
            return reportFailure("variant", e);
        }
        int failures = 0;
        if (config.liftover) {
            failures += liftover(variant);
        }
        for (ScoreFamily family : config.families) {
            failures += resolve(family, variant, config.liftoverBeforeLookup);
        }
        return failures;
    }

    private int liftover(VariantKey variant) {
        try {
            Optional<VariantKey> lifted = symetrics.liftover(variant);
            if (lifted.isPresent()) {
                printer.print(lifted.get().toMap());
            } else {
                System.err.println("Liftover of " + variant + " is not possible: variant not found in the bridge table");
            }
            return 0;
        } catch (StoreUnavailableException | WrongVariantFormatException | IllegalStateException e) {
            return reportFailure("liftover", e);
        }
    }

    private int resolve(ScoreFamily family, VariantKey variant, boolean liftoverBeforeLookup) {
        try {
            Optional<ScoreRecord> record = liftoverBeforeLookup
                    ? symetrics.resolveLifted(family, variant)
                    : symetrics.resolve(family, variant);
            if (record.isPresent()) {
                printer.print(record.get().toMap());
            } else {
                System.err.println("Variant " + variant + " not found for " + family);
            }
            return 0;
        } catch (BuildMismatchException | UnsupportedBuildException | StoreUnavailableException
                | WrongAnnotationFormatException | WrongVariantFormatException | IllegalStateException e) {
            return reportFailure(family.name(), e);
        }
    }

    private int propScore(String group, String gene) {
        try {
            Optional<ConstraintRecord> record = symetrics.getPropScore(group, gene);
            if (record.isPresent()) {
                printer.print(record.get().toMap());
            } else {
                System.err.println("Gene " + gene + " not found in group " + group);
            }
            return 0;
        } catch (InvalidGroupException | ConstraintSourceMissedException | UncheckedIOException
                | IllegalArgumentException e) {
            return reportFailure(group, e);
        }
    }

    private int gnomadConstraints(String gene) {
        try {
            List<GnomadConstraintRecord> records = symetrics.getGnomadConstraints(gene);
            if (records.isEmpty()) {
                System.err.println("Gene " + gene + " not found in gnomAD constraints");
            }
            for (GnomadConstraintRecord record : records) {
                printer.print(record.toMap());
            }
            return 0;
        } catch (IllegalStateException | UncheckedIOException | IllegalArgumentException e) {
            return reportFailure("gnomAD constraints", e);
        }
    }

    private int reportFailure(String operation, RuntimeException e) {
        System.err.println("Request " + operation + " failed: " + e.getMessage());
        return 1;
    }
}
