package ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import types.TypeRepository;

/**
 * A whole program: the functions and globals of every loaded package and their declared types
 */
public final class Program {

    private final TypeRepository types = new TypeRepository();
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final Map<String, Global> globals = new LinkedHashMap<>();

    public TypeRepository getTypes() {
        return types;
    }

    /**
     * Add a function, keyed by its qualified name
     *
     * @param f function to add
     */
    public void addFunction(Function f) {
        Function prev = functions.put(f.getQualifiedName(), f);
        assert prev == null : "Duplicate function " + f.getQualifiedName();
    }

    /**
     * @param qualified name of the form "pkg.name"
     * @return the function or null if there is none
     */
    public Function getFunction(String qualified) {
        return functions.get(qualified);
    }

    /**
     * @return all functions, in the order they were added
     */
    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public void addGlobal(Global g) {
        Global prev = globals.put(g.getQualifiedName(), g);
        assert prev == null : "Duplicate global " + g.getQualifiedName();
    }

    public Global getGlobal(String qualified) {
        return globals.get(qualified);
    }

    public Collection<Global> getGlobals() {
        return Collections.unmodifiableCollection(globals.values());
    }
}
