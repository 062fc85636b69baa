package org.releven.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the compiler in a separate JVM where no other code has touched Jena.
 */
public class FreshJvmTest {

    private record Result(int exitCode, String output) {
    }

    private static Result run(final Class<?> mainClass)
            throws IOException, InterruptedException {
        String classPath = System.getProperty("surefire.test.class.path",
            System.getProperty("java.class.path"));
        String java = Path.of(System.getProperty("java.home"), "bin", "java")
            .toString();
        ProcessBuilder builder = new ProcessBuilder(List.of(java, "-cp",
            classPath, mainClass.getName()));
        builder.environment().put("OTEL_TRACING_ENABLED", "false");
        builder.redirectErrorStream(true);
        Process process = builder.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        assertTrue(process.waitFor(60, TimeUnit.SECONDS), output);
        return new Result(process.exitValue(), output);
    }

    @Test
    @DisplayName("First compile in a new JVM succeeds")
    public void testFirstCompile() throws Exception {
        Result result = run(FirstCompile.class);

        assertEquals(0, result.exitCode(), result.output());
        assertTrue(result.output().contains("SELECT DISTINCT"),
            result.output());
        assertFalse(result.output().contains("ExceptionInInitializerError"),
            result.output());
    }

    @Test
    @DisplayName("Demo in a new JVM compiles without errors")
    public void testDemoMain() throws Exception {
        Result result = run(Main.class);

        assertEquals(0, result.exitCode(), result.output());
        assertTrue(result.output().contains("Query compiled and validated"),
            result.output());
        assertFalse(result.output().contains("Error:"), result.output());
    }
}
