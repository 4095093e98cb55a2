package io.vaultkit.endpoint.processor;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vaultkit.endpoint.Endpoint;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Compiles sample sources with {@link EndpointProcessor} through the JDK compiler API.
 */
final class TestCompiler {

    private TestCompiler() {
    }

    static Result compile(Path workDir, Map<String, String> sources) throws IOException {
        Path sourceDir = Files.createDirectories(workDir.resolve("src"));
        Path classes = Files.createDirectories(workDir.resolve("classes"));
        Path generated = Files.createDirectories(workDir.resolve("generated"));

        List<Path> files = new ArrayList<>();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            Path file = sourceDir.resolve(source.getKey().replace('.', '/') + ".java");
            Files.createDirectories(file.getParent());
            Files.writeString(file, source.getValue(), StandardCharsets.UTF_8);
            files.add(file);
        }

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            List<String> options = List.of(
                    "-d", classes.toString(),
                    "-s", generated.toString(),
                    "-classpath", classpathOf(Endpoint.class, JsonProperty.class));
            JavaCompiler.CompilationTask task = compiler.getTask(null, fileManager, diagnostics, options, null,
                    fileManager.getJavaFileObjectsFromPaths(files));
            task.setProcessors(List.of(new EndpointProcessor()));
            boolean success = task.call();
            return new Result(success, diagnostics.getDiagnostics(), classes, generated);
        }
    }

    private static String classpathOf(Class<?>... types) {
        List<String> entries = new ArrayList<>();
        for (Class<?> type : types) {
            try {
                entries.add(Paths.get(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                throw new IllegalStateException(e);
            }
        }
        return String.join(System.getProperty("path.separator"), entries);
    }

    static final class Result {

        private final boolean success;
        private final List<Diagnostic<? extends JavaFileObject>> diagnostics;
        private final Path classes;
        private final Path generated;

        Result(boolean success, List<Diagnostic<? extends JavaFileObject>> diagnostics, Path classes,
               Path generated) {
            this.success = success;
            this.diagnostics = diagnostics;
            this.classes = classes;
            this.generated = generated;
        }

        boolean success() {
            return success;
        }

        List<String> errors() {
            return diagnostics.stream()
                    .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                    .map(d -> d.getMessage(Locale.ROOT))
                    .collect(Collectors.toList());
        }

        String generatedSource(String qualifiedName) {
            try {
                return Files.readString(generated.resolve(qualifiedName.replace('.', '/') + ".java"));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        URLClassLoader classLoader() {
            try {
                return new URLClassLoader(new URL[]{classes.toUri().toURL()}, TestCompiler.class.getClassLoader());
            } catch (MalformedURLException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
