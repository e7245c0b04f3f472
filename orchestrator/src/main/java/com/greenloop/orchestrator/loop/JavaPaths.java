package com.greenloop.orchestrator.loop;

import java.util.List;
import java.util.Optional;

/**
 * Maven source-layout conventions used to pair classes, tests and files.
 */
public final class JavaPaths {

    private static final List<String> SOURCE_ROOTS = List.of("src/main/java/", "src/test/java/");

    // Longest first so "FooTests" is not cut down to "FooTest" minus "s".
    private static final List<String> TEST_SUFFIXES = List.of("TestCase", "Tests", "Test", "IT");

    private JavaPaths() {}

    /**
     * Derive the fully-qualified class name from a Java file path.
     *
     * Works for absolute and workspace-relative paths as long as a standard
     * source root appears in them.
     */
    public static Optional<String> classNameOf(String path) {
        if (path == null || !path.endsWith(".java")) return Optional.empty();
        String normalized = path.replace('\\', '/');
        for (String root : SOURCE_ROOTS) {
            int idx = normalized.lastIndexOf(root);
            if (idx >= 0) {
                String relative = normalized.substring(idx + root.length(), normalized.length() - ".java".length());
                return relative.isEmpty() ? Optional.empty() : Optional.of(relative.replace('/', '.'));
            }
        }
        return Optional.empty();
    }

    /** {@code com.acme.Outer$Inner} → {@code com.acme.Outer}. */
    public static String topLevelClass(String classFqn) {
        int dollar = classFqn.indexOf('$');
        return dollar >= 0 ? classFqn.substring(0, dollar) : classFqn;
    }

    /**
     * Name of the production class a test class exercises, following the
     * surefire naming conventions ({@code FooTest}, {@code FooTests},
     * {@code FooTestCase}, {@code FooIT}, {@code TestFoo}).
     */
    public static Optional<String> classUnderTest(String testFqn) {
        String fqn = topLevelClass(testFqn);
        int dot = fqn.lastIndexOf('.');
        String pkg = dot >= 0 ? fqn.substring(0, dot + 1) : "";
        String simple = fqn.substring(dot + 1);

        for (String suffix : TEST_SUFFIXES) {
            if (simple.endsWith(suffix) && simple.length() > suffix.length()) {
                return Optional.of(pkg + simple.substring(0, simple.length() - suffix.length()));
            }
        }
        if (simple.startsWith("Test") && simple.length() > 4) {
            return Optional.of(pkg + simple.substring(4));
        }
        return Optional.empty();
    }

    /** Conventional name of the unit test for a production class. */
    public static String testClassFor(String classFqn) {
        return topLevelClass(classFqn) + "Test";
    }

    /**
     * Conventional location of the unit test for a production source file:
     * {@code src/main/java/a/B.java} → {@code src/test/java/a/BTest.java}.
     */
    public static String testPathFor(String sourcePath) {
        String normalized = sourcePath.replace('\\', '/');
        int idx = normalized.lastIndexOf("src/main/java/");
        String testPath = idx >= 0
                ? normalized.substring(0, idx) + "src/test/java/" + normalized.substring(idx + "src/main/java/".length())
                : normalized;
        return testPath.substring(0, testPath.length() - ".java".length()) + "Test.java";
    }
}
