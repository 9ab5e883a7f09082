package main;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONException;

import analysis.nilness.NilnessChecker;
import analysis.nilness.NilnessReport;
import analysis.nilness.NilnessResults;
import analysis.nilness.RecordedSourceLocator;
import ir.Function;
import ir.Program;
import ir.serialization.JSONProgramReader;
import ir.serialization.ProgramLoadException;
import util.Logger;
import util.print.CFGWriter;

import com.beust.jcommander.ParameterException;

/**
 * Check programs for field accesses through possibly nil pointers, see usage
 */
public class NilnessMain {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FOUND = 1;
    public static final int EXIT_ERROR = 2;

    /**
     * Run the check and exit with {@link #EXIT_CLEAN} if nothing was found, {@link #EXIT_FOUND} if a trace was found
     * and {@link #EXIT_ERROR} for bad arguments or input
     *
     * @param args options and parameters see useage (pass in "-h") for details
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the check
     *
     * @param args command line arguments
     * @param out traces are printed here
     * @param err usage and error messages are printed here
     * @return exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        NilnessOptions options;
        try {
            options = NilnessOptions.getOptions(args);
        }
        catch (ParameterException e) {
            err.println(e.getMessage());
            err.println(NilnessOptions.getUseage());
            return EXIT_ERROR;
        }
        if (options.shouldPrintUseage()) {
            err.println(NilnessOptions.getUseage());
            return EXIT_CLEAN;
        }
        if (options.getFiles().isEmpty()) {
            err.println("No program files given");
            err.println(NilnessOptions.getUseage());
            return EXIT_ERROR;
        }
        Logger.setOutputLevel(options.getOutputLevel());

        Program program;
        List<File> files = new ArrayList<>();
        for (String f : options.getFiles()) {
            files.add(new File(f));
        }
        try {
            program = JSONProgramReader.read(files);
        }
        catch (ProgramLoadException e) {
            err.println("Could not load program: " + e.getMessage());
            return EXIT_ERROR;
        }

        List<Function> entries = new ArrayList<>();
        for (String name : options.getEntryPoints()) {
            Function f = program.getFunction(name);
            if (f == null) {
                err.println("No entry function " + name);
                return EXIT_ERROR;
            }
            entries.add(f);
        }

        NilnessChecker checker = new NilnessChecker(options.getMaxRecursion());
        NilnessResults results = entries.isEmpty() ? checker.analyze(program) : checker.analyze(program, entries);

        if (options.getFileLevel() >= 1) {
            for (Function f : program.getFunctions()) {
                if (!f.isExternal()) {
                    CFGWriter.writeToFile(f, options.getOutputDir());
                }
            }
        }

        NilnessReport report = NilnessReport.create(results, new RecordedSourceLocator());
        report.print(out);

        if (options.getJsonFile() != null) {
            String fileName = options.getJsonFile();
            try (Writer w = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(fileName),
                                                                          StandardCharsets.UTF_8))) {
                report.writeJSON(w);
                Logger.println(1, "JSON written to: " + fileName);
            }
            catch (IOException | JSONException e) {
                err.println("Could not write JSON to file, " + fileName + ", " + e.getMessage());
                return EXIT_ERROR;
            }
        }
        return report.isEmpty() ? EXIT_CLEAN : EXIT_FOUND;
    }
}
