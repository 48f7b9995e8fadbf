package ai.apigraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import ai.apigraph.model.Names;
import ai.apigraph.runtime.BoundMethod;
import ai.apigraph.runtime.CachedProperty;
import ai.apigraph.runtime.ClassMethod;
import ai.apigraph.runtime.ClassObject;
import ai.apigraph.runtime.FunctionObject;
import ai.apigraph.runtime.InstanceObject;
import ai.apigraph.runtime.ModuleObject;
import ai.apigraph.runtime.ObjectSpace;
import ai.apigraph.runtime.ParameterKind;
import ai.apigraph.runtime.Partial;
import ai.apigraph.runtime.Property;
import ai.apigraph.runtime.Sentinel;
import ai.apigraph.runtime.StaticMethod;

/**
 * Reads a JSON program image into an {@link ObjectSpace}.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "package": "pkg",
 *   "modules":   [{"name", "source", "loads", "deferred", "members": {name: value}}],
 *   "classes":   [{"id": "mod::Qual", "bases": [id], "slots": [name], "members": {name: value}}],
 *   "functions": [{"id": "mod::Qual.f", "params": [param], "source", "uninspectable"}],
 *   "objects":   [{"id": "mod::NAME", "class": id, "attributes": {name: value}}],
 *   "nonModules": {name: value}
 * }
 * </pre>
 * Parameters are {@code "x"}, {@code "*args"}, {@code "**kwargs"} or
 * {@code {"name", "kind"}}. Values are JSON scalars or one-key objects:
 * {@code ref}, {@code classmethod}, {@code staticmethod}, {@code property},
 * {@code cachedProperty}, {@code partial} (with {@code args}), {@code bound}
 * (with {@code self}), {@code sentinel}, {@code list}, {@code map},
 * {@code instance}.
 * <p>
 * Objects are created first and filled second, so members may refer to
 * anything in the image, cycles included.
 */
public final class ImageLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ImageLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public ProgramImage load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Image file not found: " + file);
        }
        final JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException ex) {
            throw new ImageFormatException("Malformed image " + file + ": "
                    + Names.abbreviate(ex.getOriginalMessage(), 200));
        }
        final Path base = file.toAbsolutePath().getParent();
        return new Loader(base).load(root);
    }

    public ProgramImage load(String json, Path baseDir) throws IOException {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ImageFormatException("Malformed image: " + Names.abbreviate(ex.getOriginalMessage(), 200));
        }
        return new Loader(baseDir).load(root);
    }

    /** One load: id table plus the pending class definitions. */
    private static final class Loader {

        private final Path baseDir;
        private final Map<String, Object> byId = new LinkedHashMap<>();
        private final Map<String, JsonNode> classDefs = new LinkedHashMap<>();
        private final Set<String> classesInProgress = new HashSet<>();

        Loader(Path baseDir) {
            this.baseDir = baseDir;
        }

        ProgramImage load(JsonNode root) throws ImageFormatException {
            if (root == null || !root.isObject()) {
                throw new ImageFormatException("Image must be a JSON object");
            }

            // pass 1: create every addressable object
            final List<ModuleObject> modules = new ArrayList<>();
            for (JsonNode m : array(root, "modules")) {
                final ModuleObject module = new ModuleObject(text(m, "name"));
                if (m.hasNonNull("source")) {
                    final Path source = Path.of(m.get("source").asText());
                    module.withSourceFile(source.isAbsolute() || baseDir == null ? source : baseDir.resolve(source));
                }
                for (JsonNode load : array(m, "loads")) {
                    module.loadsOnAccess(load.asText());
                }
                define(module.name(), module);
                modules.add(module);
            }
            for (JsonNode c : array(root, "classes")) {
                final String id = text(c, "id");
                if (classDefs.put(id, c) != null) {
                    throw new ImageFormatException("Duplicate class " + id);
                }
            }
            for (String id : classDefs.keySet()) {
                classById(id);
            }
            for (JsonNode f : array(root, "functions")) {
                define(text(f, "id"), function(f));
            }
            for (JsonNode o : array(root, "objects")) {
                final String id = text(o, "id");
                final Object type = classById(text(o, "class"));
                define(id, new InstanceObject((ClassObject) type));
            }

            // pass 2: fill members
            for (JsonNode m : array(root, "modules")) {
                final ModuleObject module = (ModuleObject) byId.get(text(m, "name"));
                for (Iterator<Map.Entry<String, JsonNode>> it = fields(m, "members"); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> e = it.next();
                    module.set(e.getKey(), value(e.getValue()));
                }
            }
            for (var e : classDefs.entrySet()) {
                final ClassObject cls = (ClassObject) byId.get(e.getKey());
                final List<String> slots = new ArrayList<>();
                for (JsonNode slot : array(e.getValue(), "slots")) {
                    slots.add(slot.asText());
                }
                cls.slots(slots.toArray(new String[0]));
                for (Iterator<Map.Entry<String, JsonNode>> it = fields(e.getValue(), "members"); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> m = it.next();
                    cls.set(m.getKey(), value(m.getValue()));
                }
            }
            for (JsonNode o : array(root, "objects")) {
                final InstanceObject instance = (InstanceObject) byId.get(text(o, "id"));
                for (Iterator<Map.Entry<String, JsonNode>> it = fields(o, "attributes"); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> e = it.next();
                    instance.set(e.getKey(), value(e.getValue()));
                }
            }

            final ObjectSpace space = new ObjectSpace();
            for (int i = 0; i < modules.size(); i++) {
                final ModuleObject module = modules.get(i);
                if (array(root, "modules").get(i).path("deferred").asBoolean(false)) {
                    space.defer(module.name(), () -> module);
                } else {
                    space.install(module);
                }
            }
            for (Iterator<Map.Entry<String, JsonNode>> it = fields(root, "nonModules"); it.hasNext(); ) {
                final Map.Entry<String, JsonNode> e = it.next();
                space.install(e.getKey(), value(e.getValue()));
            }
            LOG.debug("Loaded image: {} modules, {} classes, {} ids", modules.size(), classDefs.size(), byId.size());

            final String packageName = root.hasNonNull("package") ? root.get("package").asText() : null;
            return new ProgramImage(space, packageName);
        }

        private void define(String id, Object value) throws ImageFormatException {
            if (byId.putIfAbsent(id, value) != null) {
                throw new ImageFormatException("Duplicate id " + id);
            }
        }

        // bases first; recursion depth is bounded by inheritance depth
        private Object classById(String id) throws ImageFormatException {
            final Object existing = byId.get(id);
            if (existing != null) {
                if (!(existing instanceof ClassObject)) {
                    throw new ImageFormatException(id + " is not a class");
                }
                return existing;
            }
            final JsonNode def = classDefs.get(id);
            if (def == null) {
                throw new ImageFormatException("Unknown class " + id);
            }
            if (!classesInProgress.add(id)) {
                throw new ImageFormatException("Inheritance cycle at " + id);
            }
            final List<ClassObject> bases = new ArrayList<>();
            for (JsonNode b : array(def, "bases")) {
                bases.add((ClassObject) classById(b.asText()));
            }
            final ClassObject cls = new ClassObject(Names.moduleOf(id), qualifiedPart(id),
                    bases.toArray(new ClassObject[0]));
            classesInProgress.remove(id);
            define(id, cls);
            return cls;
        }

        private static FunctionObject function(JsonNode f) throws ImageFormatException {
            final String id = text(f, "id");
            final FunctionObject fn;
            if (f.path("uninspectable").asBoolean(false)) {
                fn = FunctionObject.uninspectable(Names.moduleOf(id), qualifiedPart(id));
            } else {
                final List<FunctionObject.Parameter> params = new ArrayList<>();
                for (JsonNode p : array(f, "params")) {
                    params.add(parameter(p, id));
                }
                fn = FunctionObject.withParameters(Names.moduleOf(id), qualifiedPart(id), params);
            }
            if (f.hasNonNull("source")) {
                fn.withSource(f.get("source").asText());
            }
            return fn;
        }

        private static FunctionObject.Parameter parameter(JsonNode p, String owner) throws ImageFormatException {
            if (p.isTextual()) {
                final String text = p.asText();
                if (text.startsWith("**")) {
                    return FunctionObject.Parameter.varKeyword(text.substring(2));
                }
                if (text.startsWith("*")) {
                    return FunctionObject.Parameter.varPositional(text.substring(1));
                }
                return FunctionObject.Parameter.positional(text);
            }
            if (p.isObject()) {
                try {
                    return new FunctionObject.Parameter(text(p, "name"), ParameterKind.valueOf(text(p, "kind")));
                } catch (IllegalArgumentException ex) {
                    throw new ImageFormatException("Unknown parameter kind in " + owner + ": " + p.get("kind"));
                }
            }
            throw new ImageFormatException("Bad parameter in " + owner + ": " + p);
        }

        private Object value(JsonNode v) throws ImageFormatException {
            if (v == null || v.isNull()) {
                return null;
            }
            if (v.isTextual()) {
                return v.asText();
            }
            if (v.isBoolean()) {
                return v.asBoolean();
            }
            if (v.isIntegralNumber()) {
                if (v.canConvertToInt()) {
                    return v.intValue();
                }
                return v.canConvertToLong() ? (Object) v.longValue() : (Object) v.bigIntegerValue();
            }
            if (v.isNumber()) {
                return v.doubleValue();
            }
            if (!v.isObject() || v.size() == 0) {
                throw new ImageFormatException("Bad value encoding: " + Names.abbreviate(v.toString(), 200));
            }
            if (v.has("ref")) {
                final String id = v.get("ref").asText();
                final Object target = byId.get(id);
                if (target == null) {
                    throw new ImageFormatException("Unknown reference " + id);
                }
                return target;
            }
            if (v.has("classmethod")) {
                return new ClassMethod(value(v.get("classmethod")));
            }
            if (v.has("staticmethod")) {
                return new StaticMethod(value(v.get("staticmethod")));
            }
            if (v.has("property")) {
                return new Property(value(v.get("property")));
            }
            if (v.has("cachedProperty")) {
                return new CachedProperty(value(v.get("cachedProperty")));
            }
            if (v.has("partial")) {
                return new Partial(value(v.get("partial")), v.path("args").asInt(0));
            }
            if (v.has("bound")) {
                return new BoundMethod(value(v.get("self")), value(v.get("bound")));
            }
            if (v.has("sentinel")) {
                try {
                    return Sentinel.valueOf(v.get("sentinel").asText());
                } catch (IllegalArgumentException ex) {
                    throw new ImageFormatException("Unknown sentinel " + v.get("sentinel"));
                }
            }
            if (v.has("list")) {
                final List<Object> list = new ArrayList<>();
                for (JsonNode item : v.get("list")) {
                    list.add(value(item));
                }
                return list;
            }
            if (v.has("map")) {
                final Map<String, Object> map = new LinkedHashMap<>();
                for (Iterator<Map.Entry<String, JsonNode>> it = v.get("map").fields(); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> e = it.next();
                    map.put(e.getKey(), value(e.getValue()));
                }
                return map;
            }
            if (v.has("instance")) {
                return new InstanceObject((ClassObject) classById(v.get("instance").asText()));
            }
            throw new ImageFormatException("Unknown value encoding: " + Names.abbreviate(v.toString(), 200));
        }

        private static String qualifiedPart(String id) throws ImageFormatException {
            final int sep = id.indexOf(Names.MODULE_SEPARATOR);
            if (sep <= 0 || sep + Names.MODULE_SEPARATOR.length() >= id.length()) {
                throw new ImageFormatException("Expected module::qualname, got " + id);
            }
            return id.substring(sep + Names.MODULE_SEPARATOR.length());
        }

        private static JsonNode array(JsonNode parent, String field) throws ImageFormatException {
            final JsonNode node = parent.path(field);
            if (node.isMissingNode() || node.isNull()) {
                return MissingNode.getInstance();
            }
            if (!node.isArray()) {
                throw new ImageFormatException("Field " + field + " must be an array");
            }
            return node;
        }

        private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode parent, String field)
                throws ImageFormatException {
            final JsonNode node = parent.path(field);
            if (node.isMissingNode() || node.isNull()) {
                return Collections.emptyIterator();
            }
            if (!node.isObject()) {
                throw new ImageFormatException("Field " + field + " must be an object");
            }
            return node.fields();
        }

        private static String text(JsonNode parent, String field) throws ImageFormatException {
            final JsonNode node = parent.get(field);
            if (node == null || !node.isTextual() || node.asText().isEmpty()) {
                throw new ImageFormatException("Missing field " + field + " in " + Names.abbreviate(parent.toString(), 200));
            }
            return node.asText();
        }
    }
}
