package analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;
import com.ibm.wala.util.graph.traverse.SCCIterator;

import ir.BasicBlock;
import ir.Call;
import ir.Function;
import ir.Instruction;
import ir.MakeClosure;
import ir.Program;

/**
 * Call graph with an edge from a function to every function it calls directly, and to every function it creates a
 * closure of. Calls through interfaces and function values are not resolved.
 */
public class StaticCallGraph {

    private final Graph<Function> graph = SlowSparseNumberedGraph.make();

    public StaticCallGraph(Program program) {
        for (Function f : program.getFunctions()) {
            graph.addNode(f);
        }
        for (Function f : program.getFunctions()) {
            for (BasicBlock bb : f.getBlocks()) {
                for (Instruction i : bb) {
                    Function callee = null;
                    if (i instanceof Call) {
                        callee = ((Call) i).getStaticCallee();
                    }
                    else if (i instanceof MakeClosure) {
                        callee = ((MakeClosure) i).getFunction();
                    }
                    if (callee != null) {
                        if (!graph.containsNode(callee)) {
                            graph.addNode(callee);
                        }
                        if (!graph.hasEdge(f, callee)) {
                            graph.addEdge(f, callee);
                        }
                    }
                }
            }
        }
    }

    /**
     * Functions that can be reached from the given entries, including the entries
     *
     * @param entries entry functions
     * @return reachable functions, entries first
     */
    public Set<Function> getReachableFunctions(Collection<Function> entries) {
        Collection<Function> reachable = DFS.getReachableNodes(graph, entries);
        Set<Function> result = new LinkedHashSet<>(entries);
        result.addAll(reachable);
        return result;
    }

    /**
     * Functions that may (transitively) call themselves
     *
     * @return recursive functions grouped by strongly connected component
     */
    public List<Set<Function>> getRecursiveComponents() {
        List<Set<Function>> recursive = new ArrayList<>();
        SCCIterator<Function> sccs = new SCCIterator<>(graph);
        while (sccs.hasNext()) {
            Set<Function> scc = sccs.next();
            Function f = scc.iterator().next();
            if (scc.size() > 1 || graph.hasEdge(f, f)) {
                recursive.add(scc);
            }
        }
        return recursive;
    }

    /**
     * @param caller calling function
     * @param callee called function
     * @return true if the caller calls the callee or creates a closure of it directly
     */
    public boolean hasEdge(Function caller, Function callee) {
        return graph.containsNode(caller) && graph.containsNode(callee) && graph.hasEdge(caller, callee);
    }

    public int getNumberOfFunctions() {
        return graph.getNumberOfNodes();
    }
}
