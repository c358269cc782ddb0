package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.exception.InvalidGroupException;
import com.astrazeneca.symetrics.exception.WrongVariantFormatException;
import com.astrazeneca.symetrics.printers.PrinterType;
import org.apache.commons.cli.*;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        Options options = buildOptions();

        CommandLineParser parser = new BasicParser();

        Configuration config = null;

        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.getOptions().length == 0 || cmd.hasOption("H")) {
                help(options);
            }
            config = parseCmd(cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            System.err.print("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                Object object = iterator.next();
                System.err.print(object);
                if (iterator.hasNext()) {
                    System.err.print(", ");
                }
            }
            System.err.println();
            help(options);
        }

        return config;
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if values of options are wrong or options required by the request are missing
     */
    Configuration parseCmd(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();

        config.configPath = cmd.getOptionValue("c");
        config.variant = cmd.getOptionValue("v");
        config.gene = cmd.getOptionValue("g");
        config.metricGroup = cmd.getOptionValue("m");
        config.liftover = cmd.hasOption("l");
        config.liftoverBeforeLookup = cmd.hasOption("L");
        config.gnomadConstraintsRequested = cmd.hasOption("gc");

        try {
            if (cmd.hasOption("r")) {
                config.genome = GenomeBuild.fromName(cmd.getOptionValue("r"));
            }
            if (cmd.hasOption("s")) {
                config.families.addAll(parseFamilies(cmd.getOptionValue("s")));
            }
        } catch (WrongVariantFormatException | InvalidGroupException e) {
            throw new ParseException(e.getMessage());
        }

        if (cmd.hasOption("DP")) {
            String defaultPrinter = cmd.getOptionValue("DP", PrinterType.OUT.name());
            switch (defaultPrinter) {
                case "OUT": config.printerType = PrinterType.OUT; break;
                case "ERR": config.printerType = PrinterType.ERR; break;
                default: config.printerType = PrinterType.OUT;
            }
        }

        if (config.hasVariantRequest() && config.variant == null) {
            throw new ParseException("Variant (option -v) is required for score lookup and liftover");
        }
        if (config.hasGeneRequest() && config.gene == null) {
            throw new ParseException("Gene (option -g) is required for constraint scores");
        }
        if (!config.hasVariantRequest() && !config.hasGeneRequest()) {
            throw new ParseException("Nothing to do: set score families (-s), liftover (-l), metric group (-m) " +
                    "or gnomAD constraints (-gc)");
        }
        return config;
    }

    /**
     * @param value comma-separated list of score families or ALL
     * @return score families in the given order
     */
    static List<ScoreFamily> parseFamilies(String value) {
        if ("ALL".equalsIgnoreCase(value.trim())) {
            return Arrays.asList(ScoreFamily.values());
        }
        ScoreFamily[] families = Arrays.stream(value.split(","))
                .map(ScoreFamily::fromName)
                .distinct()
                .toArray(ScoreFamily[]::new);
        return Arrays.asList(families);
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    private Options buildOptions() {
        Options options = new Options();
        options.addOption("H", "?", false, "Print this help page");
        options.addOption("l", "liftover", false, "Translate the variant to the other genome build (hg19 <-> hg38) using the SYNVEP table");
        options.addOption("L", "lift", false, "Liftover the variant before the lookup if the score table doesn't index its genome build");
        options.addOption("gc", "gnomad-constraints", false, "Print gnomAD constraints (syn_z, mis_z, lof_z, pLI) of the gene set by -g");

        options.addOption(OptionBuilder.withArgName("config.json")
                .hasArg(true)
                .withDescription("The JSON configuration file with locations of the score databases and constraint tables")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("config")
                .create('c'));

        options.addOption(OptionBuilder.withArgName("chr-pos-ref-alt")
                .hasArg(true)
                .withDescription("The variant, e.g. 7-91763673-C-A")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("variant")
                .create('v'));

        options.addOption(OptionBuilder.withArgName("hg19/hg38")
                .hasArg(true)
                .withDescription("The genome build of the variant position. Default: hg38")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("reference")
                .create('r'));

        options.addOption(OptionBuilder.withArgName("family[,family]")
                .hasArg(true)
                .withDescription("The score families to look the variant up in: CONSERVATION (hg19), SURFACE_ACCESSIBILITY (hg38), "
                        + "SYNONYMOUS_PATHOGENICITY (hg19/hg38), SPLICE_EFFECT (hg38), POPULATION_FREQUENCY (hg38) or ALL")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("scores")
                .create('s'));

        options.addOption(OptionBuilder.withArgName("gene")
                .hasArg(true)
                .withDescription("The HGNC symbol of the gene for constraint scores")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("gene")
                .create('g'));

        options.addOption(OptionBuilder.withArgName("group")
                .hasArg(true)
                .withDescription("The metric group of the normalized constraint score: SYNVEP, SURF, GERP, CpG, CpG_exon, RSCU, dRSCU, SpliceAI")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("group")
                .create('m'));

        options.addOption(OptionBuilder.withArgName("OUT/ERR")
                .hasArg(true)
                .withDescription("The printer type used for records output. Default: OUT (System.out)")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("defaultPrinter")
                .create("DP"));

        return options;
    }

    private void help(Options options) {
        HelpFormatter formater = new HelpFormatter();
        formater.setOptionComparator(null);
        formater.printHelp(142, "symetrics -c config.json [-v chr-pos-ref-alt] [-r hg19|hg38] [-s families] [-l] [-L] "
                        + "[-g gene] [-m group] [-gc]",
                "SYMETRICS looks up precomputed scores of synonymous variants (SILVA conservation and codon usage, SURF,\n" +
                        "synVep, SpliceAI and gnomAD frequencies), converts variant positions between hg19 and hg38 and reports\n" +
                        "the normalized gene constraint score of the pooled proportion test of each metric group.\nOptions:",
                options, "");

        System.exit(0);
    }
}
