package org.carball.xtd.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.analyzer.SchemaAnalyzer;
import org.carball.xtd.config.ConfigurationLoader;
import org.carball.xtd.config.XtdConfig;
import org.carball.xtd.error.XtdException;
import org.carball.xtd.parser.XmlDocumentParser;
import org.carball.xtd.parser.XmlNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

@Slf4j
public class XtdCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;

    public static void main(String[] args) {
        PrintStream stdout = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.exit(run(args, System.in, stdout, System.err));
    }

    /**
     * Runs one conversion and returns the process exit code.
     */
    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        return run(args, new ConfigurationLoader(), stdin, stdout, stderr);
    }

    static int run(String[] args, ConfigurationLoader loader,
                   InputStream stdin, PrintStream stdout, PrintStream stderr) {
        try {
            if (loader.isHelpRequested(args)) {
                stdout.print(ConfigurationLoader.getUsage());
                return EXIT_OK;
            }

            XtdConfig config = loader.loadConfiguration(args);
            XmlDocumentParser parser = new XmlDocumentParser();

            XmlNode document = config.getInputFile() != null
                    ? parser.parse(config.getInputFile())
                    : parser.parse(stdin);
            XmlNode validationDocument = config.getValidationFile() != null
                    ? parser.parse(config.getValidationFile())
                    : null;

            String output = new SchemaAnalyzer(config).convert(document, validationDocument);

            if (config.getOutputFile() != null) {
                Files.writeString(config.getOutputFile(), output, StandardCharsets.UTF_8);
            } else {
                stdout.print(output);
                stdout.flush();
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            stderr.println("Configuration error: " + e.getMessage());
            stderr.println();
            stderr.print(ConfigurationLoader.getUsage());
            log.debug("Configuration error details", e);
            return EXIT_USAGE;
        } catch (XtdException e) {
            stderr.println(e.getMessage());
            log.debug("Conversion failed", e);
            return e.getExitCode();
        } catch (IOException e) {
            stderr.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_IO;
        }
    }
}
