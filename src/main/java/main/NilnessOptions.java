package main;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.nilness.NilnessEvaluator;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

public final class NilnessOptions {

    /**
     * Output folder default is "tests"
     */
    private static final String DEFAULT_OUTPUT_DIR = "tests";

    /**
     * Serialized packages to analyze
     */
    @Parameter(description = "JSON files, one per package, holding the SSA form of the program to check")
    private List<String> files = new ArrayList<>();

    @Parameter(names = { "-out" }, description = "Output directory, default is the tests directory.")
    private String outputDir = DEFAULT_OUTPUT_DIR;

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output): 0 traces only, 1 functions analyzed and recursion cut-offs, 2 every value evaluated, 3 block traversal", validateWith = NonNegativeValidator.class)
    private Integer outputLevel = 0;

    /**
     * Level of file output
     */
    @Parameter(names = "-fileLevel", description = "Level of file output (higher means more files will be written): 1 writes a graphviz dot CFG for every analyzed function", validateWith = NonNegativeValidator.class)
    private Integer fileLevel = 0;

    /**
     * Entry functions, all functions are analyzed if none is given
     */
    @Parameter(names = { "-e", "-entry" }, description = "Qualified name (e.g. main.main) of an entry function, may be repeated. Only functions reachable from the entries through static calls are checked.")
    private List<String> entryPoints = new ArrayList<>();

    /**
     * File to write the report to as JSON
     */
    @Parameter(names = { "-json" }, description = "Write the traces found to this file as JSON")
    private String jsonFile;

    @Parameter(names = { "-maxRecursion" }, description = "Number of times a function may be active on the call stack with arguments of the same shape", validateWith = PositiveValidator.class)
    private Integer maxRecursion = NilnessEvaluator.DEFAULT_MAX_RECURSION;

    private NilnessOptions() {
        // Do not instantiate
    }

    /**
     * Parse the command line
     *
     * @param args command line arguments
     * @return options
     * @throws ParameterException if the arguments are malformed
     */
    public static NilnessOptions getOptions(String[] args) {
        NilnessOptions o = new NilnessOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public String getOutputDir() {
        return outputDir;
    }

    public boolean shouldPrintUseage() {
        return help;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public int getFileLevel() {
        return fileLevel;
    }

    public List<String> getEntryPoints() {
        return Collections.unmodifiableList(entryPoints);
    }

    /**
     * @return file to write the JSON report to, null if none should be written
     */
    public String getJsonFile() {
        return jsonFile;
    }

    public int getMaxRecursion() {
        return maxRecursion;
    }

    /**
     * Usage message
     *
     * @return String containing the documentation
     */
    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        NilnessOptions o = new NilnessOptions();
        JCommander jc = new JCommander(o);
        jc.setProgramName("nilness");
        jc.usage(sb);
        return sb.toString() + "\n" + exitCodeUsage();
    }

    static String exitCodeUsage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Exit codes:\n");
        sb.append("\t0 - no possible nil dereference found\n");
        sb.append("\t1 - at least one possible nil dereference found\n");
        sb.append("\t2 - bad command line or program could not be loaded\n");
        return sb.toString();
    }

    public static class NonNegativeValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parse(name, value) < 0) {
                throw new ParameterException("Parameter " + name + " must not be negative (found " + value + ")");
            }
        }
    }

    public static class PositiveValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parse(name, value) < 1) {
                throw new ParameterException("Parameter " + name + " must be positive (found " + value + ")");
            }
        }
    }

    static int parse(String name, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new ParameterException("Parameter " + name + " must be an integer (found " + value + ")");
        }
    }
}
