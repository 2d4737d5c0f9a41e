package org.caureq.caureqmonitor.api.error;

import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Turns Java property paths reported by Bean Validation ({@code assetInfo.disks[0].name})
 * into the JSON paths the client sent ({@code asset_info.disks[0].name}).
 *
 * <p>Names come from the application's {@link ObjectMapper}, so the naming strategy and
 * explicit {@code @JsonProperty} renames are the ones used on the wire.
 */
@Component
@RequiredArgsConstructor
public class FieldPaths {
    private final ObjectMapper mapper;

    /** @param root type the path starts from */
    public String toJson(Class<?> root, String javaPath) {
        if (javaPath == null || javaPath.isEmpty()) return javaPath;
        var out = new StringBuilder();
        JavaType current = mapper.constructType(root);
        for (var segment : javaPath.split("\\.")) {
            int bracket = segment.indexOf('[');
            var name = bracket < 0 ? segment : segment.substring(0, bracket);
            var suffix = bracket < 0 ? "" : segment.substring(bracket);

            var property = current == null ? null : property(current, name);
            String jsonName;
            if (property != null) {
                jsonName = property.getName();
                current = elementType(property.getPrimaryType());
            } else {
                jsonName = byStrategy(name);
                current = null;
            }
            if (out.length() > 0) out.append('.');
            out.append(jsonName).append(suffix);
        }
        return out.toString();
    }

    /** Path of a Jackson mapping failure, already in JSON names. */
    public String toJson(JsonMappingException ex) {
        return toJson(ex.getPath());
    }

    /** Path of the value the parser stood on, for stream-level failures that carry no reference chain. */
    public String toJson(JsonStreamContext context) {
        var parts = new ArrayDeque<String>();
        for (var ctx = context; ctx != null && !ctx.inRoot(); ctx = ctx.getParent()) {
            if (ctx.inArray()) {
                parts.push("[" + Math.max(ctx.getCurrentIndex(), 0) + "]");
            } else if (ctx.getCurrentName() != null) {
                parts.push("." + ctx.getCurrentName());
            }
        }
        var out = String.join("", parts);
        return out.startsWith(".") ? out.substring(1) : out;
    }

    String toJson(List<JsonMappingException.Reference> refs) {
        var out = new StringBuilder();
        for (var ref : refs) {
            if (ref.getFieldName() != null) {
                if (out.length() > 0) out.append('.');
                out.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                out.append('[').append(ref.getIndex()).append(']');
            }
        }
        return out.toString();
    }

    private BeanPropertyDefinition property(JavaType type, String internalName) {
        if (type.isContainerType() || type.getRawClass().getName().startsWith("java.")) return null;
        var description = mapper.getSerializationConfig().introspect(type);
        for (var p : description.findProperties()) {
            if (p.getInternalName().equals(internalName)) return p;
        }
        return null;
    }

    private String byStrategy(String name) {
        PropertyNamingStrategy strategy = mapper.getSerializationConfig().getPropertyNamingStrategy();
        return strategy == null ? name : strategy.nameForField(mapper.getSerializationConfig(), null, name);
    }

    private static JavaType elementType(JavaType type) {
        return type.isCollectionLikeType() || type.isArrayType() ? type.getContentType() : type;
    }
}
