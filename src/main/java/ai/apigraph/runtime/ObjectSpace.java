package ai.apigraph.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

import ai.apigraph.model.ValueKind;

/**
 * In-memory program image: the set of loaded modules plus deferred modules
 * that load when another module is first inspected. Implements
 * {@link Reflector} over the object model in this package.
 */
public final class ObjectSpace implements Reflector {

    private final Map<String, Object> loaded = new LinkedHashMap<>();
    private final Map<String, Supplier<?>> deferred = new LinkedHashMap<>();

    public ObjectSpace install(ModuleObject module) {
        return install(module.name(), module);
    }

    /** Registers a loaded entry; entries need not be genuine modules. */
    public ObjectSpace install(String name, Object module) {
        loaded.put(Objects.requireNonNull(name, "name"), module);
        return this;
    }

    public ObjectSpace defer(String name, Supplier<?> loader) {
        deferred.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(loader, "loader"));
        return this;
    }

    public Optional<Object> module(String name) {
        return Optional.ofNullable(loaded.get(name));
    }

    public boolean isLoaded(String name) {
        return loaded.containsKey(name);
    }

    private void load(String name) throws ReflectionException {
        if (loaded.containsKey(name)) {
            return;
        }
        final Supplier<?> loader = deferred.remove(name);
        if (loader == null) {
            throw new ReflectionException("No module named " + name);
        }
        loaded.put(name, loader.get());
    }

    @Override
    public ValueKind kindOf(Object value) {
        if (value instanceof ModuleObject) {
            return ValueKind.MODULE;
        }
        if (value instanceof ClassObject) {
            return ValueKind.CLASS;
        }
        if (isCallable(value)) {
            return ValueKind.ROUTINE;
        }
        return ValueKind.DATA;
    }

    private static boolean isCallable(Object value) {
        return value instanceof FunctionObject
                || value instanceof BoundMethod
                || value instanceof ClassMethod
                || value instanceof StaticMethod
                || value instanceof Property
                || value instanceof CachedProperty
                || value instanceof Partial;
    }

    @Override
    public Map<String, Object> loadedModules() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(loaded));
    }

    @Override
    public boolean isModule(Object value) {
        return value instanceof ModuleObject;
    }

    @Override
    public String moduleName(Object module) {
        if (module instanceof ModuleObject m) {
            return m.name();
        }
        throw new IllegalArgumentException("Not a module: " + module);
    }

    @Override
    public Optional<String> declaringModule(Object value) {
        if (value instanceof ClassObject c) {
            return Optional.of(c.module());
        }
        if (value instanceof FunctionObject f) {
            return Optional.of(f.module());
        }
        final Object inner = wrapped(value);
        return inner == null ? Optional.empty() : declaringModule(inner);
    }

    @Override
    public Optional<String> qualifiedName(Object value) {
        if (value instanceof ClassObject c) {
            return Optional.of(c.qualifiedName());
        }
        if (value instanceof FunctionObject f) {
            return Optional.of(f.qualifiedName());
        }
        final Object inner = wrapped(value);
        return inner == null ? Optional.empty() : qualifiedName(inner);
    }

    private static Object wrapped(Object value) {
        if (value instanceof BoundMethod b) {
            return b.function();
        }
        if (value instanceof ClassMethod c) {
            return c.function();
        }
        if (value instanceof StaticMethod s) {
            return s.function();
        }
        if (value instanceof Property p) {
            return p.getter();
        }
        if (value instanceof CachedProperty c) {
            return c.function();
        }
        if (value instanceof Partial p) {
            return p.function();
        }
        return null;
    }

    @Override
    public Map<String, Object> moduleMembers(Object module) throws ReflectionException {
        if (!(module instanceof ModuleObject m)) {
            throw new ReflectionException("Cannot list members of " + module + ": not a module");
        }
        for (String name : m.loadsOnAccess()) {
            load(name);
        }
        return Collections.unmodifiableMap(new TreeMap<>(m.attributes()));
    }

    @Override
    public List<ClassAttribute> classAttributes(Object cls) {
        if (!(cls instanceof ClassObject c)) {
            return List.of();
        }
        final List<ClassAttribute> out = new ArrayList<>(c.body().size());
        for (var e : c.body().entrySet()) {
            out.add(new ClassAttribute(e.getKey(), e.getValue(), bindThroughClass(c, e.getValue())));
        }
        return out;
    }

    // Value of cls.attribute after descriptor binding; each access creates a fresh bound method.
    private static Object bindThroughClass(ClassObject cls, Object raw) {
        if (raw instanceof ClassMethod cm) {
            return new BoundMethod(cls, cm.function());
        }
        if (raw instanceof StaticMethod sm) {
            return sm.function();
        }
        return raw;
    }

    @Override
    public DescriptorShape shapeOf(Object rawAttribute) {
        if (rawAttribute instanceof ClassMethod) {
            return DescriptorShape.CLASS_METHOD;
        }
        if (rawAttribute instanceof StaticMethod) {
            return DescriptorShape.STATIC_METHOD;
        }
        if (rawAttribute instanceof Property) {
            return DescriptorShape.PROPERTY;
        }
        if (rawAttribute instanceof CachedProperty) {
            return DescriptorShape.CACHED_PROPERTY;
        }
        if (isCallable(rawAttribute)) {
            return DescriptorShape.ROUTINE;
        }
        return DescriptorShape.DATA;
    }

    @Override
    public Optional<BindingLayer> unwrapBinding(Object callable) {
        if (callable instanceof BoundMethod b) {
            return Optional.of(BindingLayer.bound(b.receiver(), b.function()));
        }
        final Object inner = wrapped(callable);
        return inner == null ? Optional.empty() : Optional.of(BindingLayer.unbound(inner));
    }

    @Override
    public List<ParameterKind> parameterKinds(Object callable) throws SignatureException {
        if (callable instanceof FunctionObject f) {
            return f.parameterKinds();
        }
        if (callable instanceof BoundMethod b) {
            return dropPositional(parameterKinds(b.function()), 1, callable);
        }
        if (callable instanceof Partial p) {
            return dropPositional(parameterKinds(p.function()), p.boundArguments(), callable);
        }
        final Object inner = wrapped(callable);
        if (inner == null) {
            throw new SignatureException(callable + " is not callable");
        }
        return parameterKinds(inner);
    }

    // Consumes n leading positional parameters; a var-positional parameter absorbs the rest.
    private static List<ParameterKind> dropPositional(List<ParameterKind> kinds, int n, Object callable)
            throws SignatureException {
        final List<ParameterKind> out = new ArrayList<>(kinds);
        int remaining = n;
        while (remaining > 0) {
            if (out.isEmpty() || !out.get(0).acceptsPositional()) {
                throw new SignatureException("invalid signature for " + callable
                        + ": too many positional arguments bound");
            }
            if (out.get(0) == ParameterKind.VAR_POSITIONAL) {
                break;
            }
            out.remove(0);
            remaining--;
        }
        return out;
    }

    @Override
    public Set<String> slots(Object cls) {
        if (cls instanceof ClassObject c) {
            return c.slotNames();
        }
        return Set.of();
    }

    @Override
    public boolean isInstance(Object value, Object cls) {
        return value instanceof InstanceObject i
                && cls instanceof ClassObject c
                && i.type().isSubclassOf(c);
    }

    @Override
    public List<Object> typeLineage(Object value) {
        if (value instanceof InstanceObject i) {
            return List.copyOf(i.type().lineage());
        }
        return List.of();
    }

    @Override
    public Optional<String> constructorSource(Object cls) {
        if (!(cls instanceof ClassObject c)) {
            return Optional.empty();
        }
        Object init = c.lookup("__init__");
        while (init != null && !(init instanceof FunctionObject)) {
            init = wrapped(init);
        }
        return init == null ? Optional.empty() : ((FunctionObject) init).source();
    }

    @Override
    public Optional<Path> sourceFile(Object module) {
        if (module instanceof ModuleObject m) {
            return m.sourceFile();
        }
        return Optional.empty();
    }

    @Override
    public String describe(Object value) {
        return String.valueOf(value);
    }
}
