package analysis.nilness;

import java.util.Collection;
import java.util.Set;

import analysis.StaticCallGraph;
import ir.Function;
import ir.Program;
import util.Logger;
import util.print.PrettyPrinter;

/**
 * Runs the nilness evaluation on every function of a program, each analyzed without knowledge of its arguments, and
 * collects the traces of possible nil dereferences
 */
public class NilnessChecker {

    private final int maxRecursion;

    public NilnessChecker() {
        this(NilnessEvaluator.DEFAULT_MAX_RECURSION);
    }

    /**
     * @param maxRecursion number of times a function may be active with the same argument shape
     */
    public NilnessChecker(int maxRecursion) {
        this.maxRecursion = maxRecursion;
    }

    /**
     * Analyze every function of the program
     *
     * @param program program to check
     * @return traces found
     */
    public NilnessResults analyze(Program program) {
        logRecursion(new StaticCallGraph(program));
        return analyze(program.getFunctions());
    }

    /**
     * Analyze the functions reachable from the entries through static calls
     *
     * @param program program to check
     * @param entries entry functions
     * @return traces found
     */
    public NilnessResults analyze(Program program, Collection<Function> entries) {
        StaticCallGraph cg = new StaticCallGraph(program);
        logRecursion(cg);
        Set<Function> seeds = cg.getReachableFunctions(entries);
        Logger.println(1, seeds.size() + " of " + program.getFunctions().size() + " functions reachable from "
                + entries.size() + " entries");
        return analyze(seeds);
    }

    /**
     * Analyze each seed in turn, results are appended in seed order
     *
     * @param seeds functions to analyze
     * @return traces found
     */
    public NilnessResults analyze(Collection<Function> seeds) {
        long start = System.currentTimeMillis();
        Logger.println(1, "RUNNING: nilness check of " + seeds.size() + " functions");
        NilnessResults results = new NilnessResults();
        NilnessEvaluator evaluator = new NilnessEvaluator(maxRecursion);
        for (Function f : seeds) {
            if (f.isExternal()) {
                continue;
            }
            Logger.println(1, "SEED: " + PrettyPrinter.functionString(f));
            evaluator.evaluateSeed(f, results);
            assert evaluator.isIdle();
        }
        Logger.println(1, "FINISHED: nilness check found " + results.size() + " traces, took "
                + (System.currentTimeMillis() - start) + "ms");
        return results;
    }

    private static void logRecursion(StaticCallGraph cg) {
        for (Set<Function> scc : cg.getRecursiveComponents()) {
            StringBuilder sb = new StringBuilder("RECURSIVE:");
            for (Function f : scc) {
                sb.append(" ").append(f.getQualifiedName());
            }
            Logger.println(1, sb.toString());
        }
    }
}
