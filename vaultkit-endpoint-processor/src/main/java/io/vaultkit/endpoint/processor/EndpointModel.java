package io.vaultkit.endpoint.processor;

import io.vaultkit.endpoint.RequestMethod;
import io.vaultkit.endpoint.VaultEndpoint;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.RecordComponentElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;

/**
 * Everything the templates need to know about one {@code @VaultEndpoint} record,
 * validated against the record's declaration.
 */
final class EndpointModel {

    static final String INTERFACE_SUFFIX = "Endpoint";
    static final String BUILDER_SUFFIX = "Builder";

    private static final String JSON_PROPERTY = "com.fasterxml.jackson.annotation.JsonProperty";

    /** Names of the generated contract methods, which components must not shadow. */
    private static final Set<String> RESERVED_NAMES = Set.of(
            "requestMethod", "requestPath", "queryParameters", "requestBody", "responseType");

    enum Role {
        PATH,
        QUERY,
        SKIP,
        BODY_FIELD,
        RAW_BODY
    }

    record Component(String name, String type, Role role, String key,
                     String optionalOf, String listOf) {
    }

    private final String packageName;
    private final String recordName;
    private final RequestMethod method;
    private final String responseType;
    private final boolean builder;
    private final PathTemplate template;
    private final List<Component> components;

    private EndpointModel(String packageName, String recordName, RequestMethod method,
                          String responseType, boolean builder, PathTemplate template,
                          List<Component> components) {
        this.packageName = packageName;
        this.recordName = recordName;
        this.method = method;
        this.responseType = responseType;
        this.builder = builder;
        this.template = template;
        this.components = components;
    }

    /**
     * Reads and validates an annotated element.
     *
     * @param element the element carrying {@code @VaultEndpoint}
     * @param env     the processing environment
     * @return the model
     * @throws EndpointDefinitionException if the declaration is invalid
     */
    static EndpointModel of(Element element, ProcessingEnvironment env) throws EndpointDefinitionException {
        if (element.getKind() != ElementKind.RECORD) {
            throw new EndpointDefinitionException("@VaultEndpoint can only be applied to a record", element);
        }
        TypeElement record = (TypeElement) element;
        if (record.getNestingKind() != NestingKind.TOP_LEVEL) {
            throw new EndpointDefinitionException(
                    "@VaultEndpoint record " + record.getSimpleName() + " must be a top-level type", record);
        }
        if (!record.getTypeParameters().isEmpty()) {
            throw new EndpointDefinitionException(
                    "@VaultEndpoint record " + record.getSimpleName() + " must not declare type parameters", record);
        }

        Elements elements = env.getElementUtils();
        Types types = env.getTypeUtils();
        String recordName = record.getSimpleName().toString();
        String interfaceName = recordName + INTERFACE_SUFFIX;
        PackageElement pkg = elements.getPackageOf(record);
        String packageName = pkg.isUnnamed() ? "" : pkg.getQualifiedName().toString();
        if (record.getInterfaces().stream().noneMatch(i -> namesInterface(i, packageName, interfaceName))) {
            throw new EndpointDefinitionException(
                    "@VaultEndpoint record " + recordName + " must implement " + interfaceName, record);
        }

        AnnotationMirror annotation = findAnnotation(record, VaultEndpoint.class.getCanonicalName());
        String path = "";
        String methodValue = "";
        TypeMirror response = null;
        boolean builder = false;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                : elements.getElementValuesWithDefaults(annotation).entrySet()) {
            Object value = entry.getValue().getValue();
            switch (entry.getKey().getSimpleName().toString()) {
                case "path":
                    path = (String) value;
                    break;
                case "method":
                    methodValue = (String) value;
                    break;
                case "response":
                    if (!(value instanceof TypeMirror) || ((TypeMirror) value).getKind() == TypeKind.ERROR) {
                        throw new EndpointDefinitionException(
                                "Response type of " + recordName + " cannot be resolved", record);
                    }
                    response = (TypeMirror) value;
                    break;
                case "builder":
                    builder = (Boolean) value;
                    break;
                default:
                    break;
            }
        }

        PathTemplate template;
        try {
            template = PathTemplate.parse(path);
        } catch (IllegalArgumentException e) {
            throw new EndpointDefinitionException(e.getMessage(), record);
        }

        TypeMirror stringType = elements.getTypeElement("java.lang.String").asType();
        TypeMirror optionalType = types.erasure(elements.getTypeElement("java.util.Optional").asType());
        TypeMirror listType = types.erasure(elements.getTypeElement("java.util.List").asType());

        Set<String> placeholders = template.placeholders();
        Set<String> names = new HashSet<>();
        List<Component> components = new ArrayList<>();
        for (RecordComponentElement rc : record.getRecordComponents()) {
            String name = rc.getSimpleName().toString();
            names.add(name);
            if (RESERVED_NAMES.contains(name)) {
                throw new EndpointDefinitionException(
                        "Component name '" + name + "' clashes with a generated Endpoint method", rc);
            }

            VaultEndpoint.Query query = rc.getAnnotation(VaultEndpoint.Query.class);
            boolean skip = rc.getAnnotation(VaultEndpoint.Skip.class) != null;
            boolean body = rc.getAnnotation(VaultEndpoint.Body.class) != null;
            int markers = (query != null ? 1 : 0) + (skip ? 1 : 0) + (body ? 1 : 0);
            if (markers > 1) {
                throw new EndpointDefinitionException(
                        "Component '" + name + "' can carry only one of @Skip, @Query or @Body", rc);
            }

            TypeMirror type = rc.asType();
            Role role;
            String key = null;
            if (placeholders.contains(name)) {
                if (query != null || body) {
                    throw new EndpointDefinitionException(
                            "Component '" + name + "' fills a path placeholder and cannot be sent elsewhere", rc);
                }
                if (!types.isSameType(type, stringType)) {
                    throw new EndpointDefinitionException(
                            "Path placeholder '" + name + "' must be a String component, found " + type, rc);
                }
                role = Role.PATH;
            } else if (skip) {
                role = Role.SKIP;
            } else if (query != null) {
                role = Role.QUERY;
                key = query.value().isEmpty() ? wireName(rc) : query.value();
            } else if (body) {
                role = Role.RAW_BODY;
            } else {
                role = Role.BODY_FIELD;
                key = wireName(rc);
            }

            String optionalOf = null;
            String listOf = null;
            if (type.getKind() == TypeKind.DECLARED) {
                List<? extends TypeMirror> arguments = ((DeclaredType) type).getTypeArguments();
                TypeMirror erased = types.erasure(type);
                if (types.isSameType(erased, optionalType)) {
                    optionalOf = arguments.isEmpty() ? "java.lang.Object" : arguments.get(0).toString();
                } else if (types.isSameType(erased, listType) && arguments.size() == 1
                        && arguments.get(0).getKind() == TypeKind.DECLARED
                        && ((DeclaredType) arguments.get(0)).getTypeArguments().isEmpty()) {
                    listOf = arguments.get(0).toString();
                }
            }
            components.add(new Component(name, type.toString(), role, key, optionalOf, listOf));
        }

        for (String placeholder : placeholders) {
            if (!names.contains(placeholder)) {
                throw new EndpointDefinitionException(
                        "Path placeholder '{" + placeholder + "}' does not name a component of " + recordName, record);
            }
        }

        long rawBodies = components.stream().filter(c -> c.role() == Role.RAW_BODY).count();
        long bodyFields = components.stream().filter(c -> c.role() == Role.BODY_FIELD).count();
        if (rawBodies > 1) {
            throw new EndpointDefinitionException(recordName + " declares more than one @Body component", record);
        }
        if (rawBodies == 1 && bodyFields > 0) {
            throw new EndpointDefinitionException(
                    recordName + " mixes a @Body component with body fields; mark the others @Skip or @Query", record);
        }

        RequestMethod method;
        if (methodValue.isBlank()) {
            method = rawBodies + bodyFields > 0 ? RequestMethod.POST : RequestMethod.GET;
        } else {
            try {
                method = RequestMethod.fromValue(methodValue);
            } catch (IllegalArgumentException e) {
                throw new EndpointDefinitionException(e.getMessage(), record);
            }
        }

        return new EndpointModel(packageName, recordName, method, types.erasure(response).toString(),
                builder, template, List.copyOf(components));
    }

    /**
     * The generated interface does not exist yet in the first round, so it shows up as an error
     * type named the way the source wrote it: simple or fully qualified.
     */
    private static boolean namesInterface(TypeMirror type, String packageName, String interfaceName) {
        String name = type.toString();
        int generics = name.indexOf('<');
        if (generics >= 0) {
            name = name.substring(0, generics);
        }
        return name.equals(interfaceName)
                || (!packageName.isEmpty() && name.equals(packageName + "." + interfaceName));
    }

    private static AnnotationMirror findAnnotation(Element element, String annotationName) {
        for (AnnotationMirror mirror : element.getAnnotationMirrors()) {
            TypeElement annotationType = (TypeElement) mirror.getAnnotationType().asElement();
            if (annotationType.getQualifiedName().contentEquals(annotationName)) {
                return mirror;
            }
        }
        return null;
    }

    /**
     * Returns the JSON key for a component: the Jackson {@code @JsonProperty} value
     * when one is declared on the component, its accessor or its field, otherwise
     * the snake_case name.
     */
    private static String wireName(RecordComponentElement rc) {
        List<Element> candidates = new ArrayList<>();
        candidates.add(rc);
        if (rc.getAccessor() != null) {
            candidates.add(rc.getAccessor());
        }
        for (Element enclosed : rc.getEnclosingElement().getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.FIELD && enclosed.getSimpleName().equals(rc.getSimpleName())) {
                candidates.add(enclosed);
            }
        }
        for (Element candidate : candidates) {
            AnnotationMirror jsonProperty = findAnnotation(candidate, JSON_PROPERTY);
            if (jsonProperty == null) {
                continue;
            }
            for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                    : jsonProperty.getElementValues().entrySet()) {
                if (entry.getKey().getSimpleName().contentEquals("value")) {
                    String value = (String) entry.getValue().getValue();
                    if (!value.isEmpty()) {
                        return value;
                    }
                }
            }
        }
        return SnakeCase.toSnakeCase(rc.getSimpleName().toString());
    }

    String packageName() {
        return packageName;
    }

    String recordName() {
        return recordName;
    }

    String interfaceName() {
        return recordName + INTERFACE_SUFFIX;
    }

    String builderName() {
        return recordName + BUILDER_SUFFIX;
    }

    boolean builder() {
        return builder;
    }

    RequestMethod method() {
        return method;
    }

    List<Component> components() {
        return components;
    }

    String qualify(String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    /**
     * Builds the FreeMarker data model shared by the endpoint and builder templates.
     */
    Map<String, Object> toDataModel(String generator) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("generator", generator);
        model.put("packageName", packageName);
        model.put("recordName", recordName);
        model.put("interfaceName", interfaceName());
        model.put("builderName", builderName());
        model.put("method", method.name());
        model.put("responseType", responseType);
        model.put("pathDoc", template.toString().replace("*/", "*&#47;"));

        List<Map<String, Object>> segments = new ArrayList<>();
        for (PathTemplate.Segment segment : template.segments()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("placeholder", segment.placeholder());
            s.put("text", segment.placeholder() ? segment.text() : javaLiteral(segment.text()));
            segments.add(s);
        }
        model.put("pathSegments", segments);

        List<Map<String, Object>> all = new ArrayList<>();
        List<Map<String, Object>> query = new ArrayList<>();
        List<Map<String, Object>> body = new ArrayList<>();
        for (Component component : components) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("name", component.name());
            c.put("type", component.type());
            if (component.optionalOf() != null) {
                c.put("optionalOf", component.optionalOf());
            }
            if (component.listOf() != null) {
                c.put("listOf", component.listOf());
            }
            if (component.key() != null) {
                c.put("key", javaLiteral(component.key()));
            }
            all.add(c);
            if (component.role() == Role.QUERY) {
                query.add(c);
            } else if (component.role() == Role.BODY_FIELD) {
                body.add(c);
            } else if (component.role() == Role.RAW_BODY) {
                model.put("rawBody", component.name());
            }
        }
        model.put("components", all);
        model.put("queryFields", query);
        model.put("bodyFields", body);
        return model;
    }

    static String javaLiteral(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
