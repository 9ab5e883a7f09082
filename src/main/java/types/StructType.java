package types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Struct with an ordered list of named fields
 */
public final class StructType extends Type {

    /**
     * Named field of a struct
     */
    public static final class Field {
        private final String name;
        private final Type type;

        public Field(String name, Type type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public Type getType() {
            return type;
        }

        @Override
        public String toString() {
            return name + " " + type;
        }
    }

    private final List<Field> fields;

    public StructType(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * Index of the field with the given name
     *
     * @param name field name
     * @return index of the field or -1 if there is no such field
     */
    public int indexOf(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("struct{");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(fields.get(i));
        }
        return sb.append("}").toString();
    }
}
