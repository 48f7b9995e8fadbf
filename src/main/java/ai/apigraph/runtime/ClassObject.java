package ai.apigraph.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.apigraph.model.Names;

/**
 * A class: declared module and qualified name, base classes, and a class body
 * of raw attributes in definition order.
 */
public final class ClassObject {

    // these two mark slot behavior only and never become instance slots
    private static final Set<String> SLOT_MARKERS = Set.of("__dict__", "__weakref__");

    private final String module;
    private final String qualifiedName;
    private final List<ClassObject> bases;
    private final Map<String, Object> body = new LinkedHashMap<>();
    private final Set<String> slots = new LinkedHashSet<>();

    public ClassObject(String module, String qualifiedName, ClassObject... bases) {
        this.module = Objects.requireNonNull(module, "module");
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        this.bases = List.of(bases);
    }

    public String module() {
        return module;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public String simpleName() {
        return Names.simpleNameOf(qualifiedName);
    }

    public List<ClassObject> bases() {
        return bases;
    }

    public ClassObject set(String attribute, Object value) {
        body.put(Objects.requireNonNull(attribute, "attribute"), value);
        return this;
    }

    public Map<String, Object> body() {
        return Collections.unmodifiableMap(body);
    }

    /**
     * Declares instance slots. Each slot also places a slot descriptor in the
     * class body, the way slot declarations do.
     */
    public ClassObject slots(String... names) {
        for (String slot : names) {
            if (SLOT_MARKERS.contains(slot)) {
                continue;
            }
            slots.add(slot);
            body.put(slot, new SlotDescriptor(this, slot));
        }
        return this;
    }

    public Set<String> slotNames() {
        return Collections.unmodifiableSet(slots);
    }

    /** This class followed by its ancestors, depth first, left to right, without repeats. */
    public List<ClassObject> lineage() {
        final Set<ClassObject> seen = new LinkedHashSet<>();
        collect(this, seen);
        return new ArrayList<>(seen);
    }

    private static void collect(ClassObject cls, Set<ClassObject> seen) {
        if (!seen.add(cls)) {
            return;
        }
        for (ClassObject base : cls.bases) {
            collect(base, seen);
        }
    }

    public boolean isSubclassOf(ClassObject other) {
        return lineage().contains(other);
    }

    /** Looks an attribute up through the lineage, raw (unbound). */
    public Object lookup(String attribute) {
        for (ClassObject cls : lineage()) {
            if (cls.body.containsKey(attribute)) {
                return cls.body.get(attribute);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "<class " + Names.fullyQualified(module, qualifiedName) + ">";
    }
}
