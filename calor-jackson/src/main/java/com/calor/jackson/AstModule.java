package com.calor.jackson;

import com.calor.ast.*;
import com.calor.jackson.mixins.NodeMixin;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for the Calor tree.
 *
 * Node kinds are discovered from the sealed {@link Node} hierarchy, so adding a record to a
 * {@code permits} list is enough to make it serializable.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("CalorAstModule", new Version(0, 1, 0, "SNAPSHOT", "com.calor", "calor-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Pattern.class, NodeMixin.class);

        context.setMixInAnnotations(DecimalLiteral.class, DecimalLiteralMixin.class);

        List<Class<?>> nodeTypes = nodeTypes();
        NamedType[] named = new NamedType[nodeTypes.size()];
        for (int i = 0; i < named.length; i++) {
            named[i] = new NamedType(nodeTypes.get(i), nodeTypes.get(i).getSimpleName());
        }
        context.registerSubtypes(named);
    }

    /**
     * All concrete record types reachable from {@link Node}.
     */
    static List<Class<?>> nodeTypes() {
        List<Class<?>> result = new ArrayList<>();
        collect(Node.class, result);
        return result;
    }

    private static void collect(Class<?> type, List<Class<?>> out) {
        if (type.isSealed()) {
            for (Class<?> sub : type.getPermittedSubclasses()) {
                collect(sub, out);
            }
        } else if (!type.isInterface() && !out.contains(type)) {
            out.add(type);
        }
    }

    // ==================== Serialization Mixins ====================

    // Decimal literals keep their exact digits
    private abstract static class DecimalLiteralMixin {
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        abstract BigDecimal value();
    }
}
