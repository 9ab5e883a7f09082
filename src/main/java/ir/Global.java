package ir;

import types.PointerType;
import types.Type;

/**
 * Package level variable. As a value it is the address of the variable.
 */
public final class Global implements Value {

    private final String pkg;
    private final String name;
    private final Type type;

    /**
     * @param pkg package declaring the variable
     * @param name unqualified name
     * @param varType type of the variable, the global itself has the pointer type
     */
    public Global(String pkg, String name, Type varType) {
        this.pkg = pkg;
        this.name = name;
        this.type = new PointerType(varType);
    }

    public String getPackage() {
        return pkg;
    }

    public String getQualifiedName() {
        return pkg + "." + name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
