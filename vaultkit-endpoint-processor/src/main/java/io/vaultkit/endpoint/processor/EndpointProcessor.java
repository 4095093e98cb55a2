package io.vaultkit.endpoint.processor;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;
import io.vaultkit.endpoint.VaultEndpoint;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;

/**
 * Generates the {@code Endpoint} implementation, and optionally a builder, for every
 * record annotated with {@link VaultEndpoint}.
 *
 * <p>For a record {@code ReadSecretRequest} this writes, in the same package:
 * <ul>
 *   <li>{@code ReadSecretRequestEndpoint}: an interface extending
 *       {@code Endpoint<Response>} whose default methods derive the verb, expanded
 *       path, query parameters, body and response type from the record components</li>
 *   <li>{@code ReadSecretRequestBuilder}: a fluent builder, when {@code builder = true}</li>
 * </ul>
 *
 * <p>Invalid declarations (unknown placeholders, non-String path components, unknown
 * verbs, conflicting component roles) are reported as compile errors on the
 * offending element. Sources are rendered from FreeMarker templates on the
 * processor's classpath.
 */
@SupportedAnnotationTypes("io.vaultkit.endpoint.VaultEndpoint")
public class EndpointProcessor extends AbstractProcessor {

    private static final String TEMPLATE_PATH = "/io/vaultkit/endpoint/processor";
    private static final String ENDPOINT_TEMPLATE = "endpoint.ftl";
    private static final String BUILDER_TEMPLATE = "builder.ftl";

    private Configuration templates;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.templates = buildFmConfiguration();
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(VaultEndpoint.class)) {
            EndpointModel model;
            try {
                model = EndpointModel.of(element, processingEnv);
            } catch (EndpointDefinitionException e) {
                Element target = e.getElement() != null ? e.getElement() : element;
                processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, e.getMessage(), target);
                continue;
            }

            Map<String, Object> dataModel = model.toDataModel(EndpointProcessor.class.getName());
            render(ENDPOINT_TEMPLATE, model.qualify(model.interfaceName()), dataModel, element);
            if (model.builder()) {
                render(BUILDER_TEMPLATE, model.qualify(model.builderName()), dataModel, element);
            }
        }
        return true;
    }

    private void render(String templateName, String qualifiedName, Map<String, Object> dataModel,
                        Element origin) {
        try {
            Template template = templates.getTemplate(templateName);
            JavaFileObject source = processingEnv.getFiler().createSourceFile(qualifiedName, origin);
            try (Writer writer = source.openWriter()) {
                template.process(dataModel, writer);
            }
        } catch (IOException | TemplateException e) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                    "Failed to generate " + qualifiedName + ": " + e.getMessage(), origin);
        }
    }

    private static Configuration buildFmConfiguration() {
        Version version = Configuration.VERSION_2_3_31;
        Configuration cfg = new Configuration(version);
        cfg.setClassForTemplateLoading(EndpointProcessor.class, TEMPLATE_PATH);
        cfg.setDefaultEncoding(StandardCharsets.UTF_8.name());
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }
}
