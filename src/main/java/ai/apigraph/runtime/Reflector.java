package ai.apigraph.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.apigraph.model.ValueKind;

/**
 * Reflection capability over a live object model.
 * <p>
 * The graph never inspects values directly; everything it knows about a value
 * (its kind, declared names, descriptor shape, bound receivers, signature)
 * comes through this interface, so the resolution algorithms stay independent
 * of any one object model. {@link ObjectSpace} is the in-memory implementation.
 */
public interface Reflector {

    ValueKind kindOf(Object value);

    /**
     * Snapshot of the currently loaded modules by name, in load order.
     * Inspecting a module may load further modules, so callers re-read this
     * until it stops growing.
     */
    Map<String, Object> loadedModules();

    /** True for genuine module objects. */
    boolean isModule(Object value);

    String moduleName(Object module);

    /** Name of the module a class or routine was declared in. */
    Optional<String> declaringModule(Object value);

    /** Declared qualified name (without module) of a class or routine. */
    Optional<String> qualifiedName(Object value);

    /** All attributes visible on a module. */
    Map<String, Object> moduleMembers(Object module) throws ReflectionException;

    /** Attributes defined in a class body, in definition order. */
    List<ClassAttribute> classAttributes(Object cls);

    DescriptorShape shapeOf(Object rawAttribute);

    /**
     * Peels one wrapping layer off a callable: a bound method, a class or
     * static method wrapper, a property getter, a partial or a cached
     * computation. Empty when the value is a root callable (or not callable).
     */
    Optional<BindingLayer> unwrapBinding(Object callable);

    /** Parameter kinds of a callable, as it would be invoked. */
    List<ParameterKind> parameterKinds(Object callable) throws SignatureException;

    /** Instance slot names declared by a class. */
    Set<String> slots(Object cls);

    boolean isInstance(Object value, Object cls);

    /**
     * Runtime type of a value followed by its ancestor types, nearest first.
     * Empty for values with no type in this object model.
     */
    List<Object> typeLineage(Object value);

    /** Source text of the constructor a class would run, if available. */
    Optional<String> constructorSource(Object cls);

    /** Source file a module was loaded from, if known. */
    Optional<Path> sourceFile(Object module);

    /** Short human readable rendering, used for anonymous values in logs. */
    String describe(Object value);
}
