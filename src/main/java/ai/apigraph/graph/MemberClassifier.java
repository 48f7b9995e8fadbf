package ai.apigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.apigraph.model.Binding;
import ai.apigraph.model.MemberKind;
import ai.apigraph.runtime.BindingLayer;
import ai.apigraph.runtime.ClassAttribute;
import ai.apigraph.runtime.DescriptorShape;
import ai.apigraph.runtime.ParameterKind;
import ai.apigraph.runtime.Reflector;
import ai.apigraph.runtime.SignatureException;

/**
 * Decides the kind and binding category of one class-body attribute from its
 * descriptor shape, the receivers bound along its wrapping chain and, for
 * plain functions, its signature.
 */
public final class MemberClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(MemberClassifier.class);

    private final Reflector reflector;

    public MemberClassifier(Reflector reflector) {
        this.reflector = Objects.requireNonNull(reflector, "reflector");
    }

    public record Classification(MemberKind kind, Binding binding, String reason) {
    }

    /**
     * @param cls       the class whose body holds the attribute
     * @param attribute the attribute, raw and as seen through the class
     * @param slots     instance slot names declared by the class
     */
    public Classification classify(Object cls, ClassAttribute attribute, Set<String> slots) {
        final DescriptorShape shape = reflector.shapeOf(attribute.raw());
        return switch (shape) {
            case CACHED_PROPERTY -> new Classification(MemberKind.PROPERTY, Binding.INSTANCE, "cached_property");
            case PROPERTY -> new Classification(MemberKind.PROPERTY, Binding.INSTANCE, "property");
            case DATA -> slots.contains(attribute.name())
                    ? new Classification(MemberKind.DATA, Binding.INSTANCE, "slots")
                    : new Classification(MemberKind.DATA, Binding.STATIC, "other");
            default -> classifyCallable(cls, attribute, shape);
        };
    }

    private Classification classifyCallable(Object cls, ClassAttribute attribute, DescriptorShape shape) {
        final List<Object> receivers = receivers(attribute.bound());
        final boolean boundToClass = containsIdentity(receivers, cls);

        if (shape == DescriptorShape.CLASS_METHOD) {
            return method(Binding.CLASS, "classmethod");
        }
        if (shape == DescriptorShape.STATIC_METHOD) {
            return boundToClass
                    ? method(Binding.CLASS, "bound_staticmethod")
                    : method(Binding.STATIC, "staticmethod");
        }
        if (boundToClass) {
            return method(Binding.CLASS, "bound");
        }
        for (Object receiver : receivers) {
            if (reflector.isInstance(receiver, cls)) {
                return method(Binding.SINGLETON, "bound");
            }
        }
        if (!receivers.isEmpty()) {
            return method(Binding.STATIC, "bound");
        }

        try {
            final List<ParameterKind> params = reflector.parameterKinds(attribute.bound());
            if (!params.isEmpty() && params.get(0).acceptsPositional()) {
                return method(Binding.INSTANCE, "unbound");
            }
        } catch (SignatureException ex) {
            LOG.warn("Could not inspect signature of {}: {}", attribute.name(), ex.getMessage());
        }
        return method(Binding.STATIC, "signature");
    }

    /** Receivers bound along the wrapping chain, outermost first. */
    List<Object> receivers(Object callable) {
        final List<Object> out = new ArrayList<>();
        final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Object current = callable;
        while (current != null && seen.add(current)) {
            final Optional<BindingLayer> layer = reflector.unwrapBinding(current);
            if (layer.isEmpty()) {
                break;
            }
            if (layer.get().bound()) {
                out.add(layer.get().receiver());
            }
            current = layer.get().next();
        }
        return out;
    }

    private static boolean containsIdentity(List<Object> values, Object target) {
        for (Object v : values) {
            if (v == target) {
                return true;
            }
        }
        return false;
    }

    private static Classification method(Binding binding, String reason) {
        return new Classification(MemberKind.METHOD, binding, reason);
    }
}
