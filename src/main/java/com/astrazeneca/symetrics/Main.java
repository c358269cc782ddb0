package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.printers.RecordPrinter;
import org.apache.commons.cli.*;

import java.io.IOException;

public class Main {
    /**
     * Method to build options from command line, read the configuration file and run the requests
     * @param args array of arguments from command line
     * @throws ParseException if command line options can't be parsed
     * @throws IOException if configuration file can't be read
     */
    public static void main(String[] args) throws ParseException, IOException {
        Configuration config = new CmdParser().parseParams(args);
        new ConfigurationReader().read(config.configPath, config);
        SymetricsLauncher launcher = new SymetricsLauncher(new Symetrics(config),
                RecordPrinter.createPrinter(config.printerType));
        if (launcher.start(config) > 0) {
            System.exit(1);
        }
    }
}
