package com.babeltest.core.diagnostics;

/**
 * Remediation hints attached to resolution and construction failures.
 */
public final class Suggestions {

    private Suggestions() {}

    public static String targetFormat() {
        return "Use format 'module.function' or 'module.Type.method'";
    }

    public static String registerModule(String target) {
        return "Register the module that owns '" + target + "' through a TargetRegistrar";
    }

    public static String zeroArgConstructor(String typeName) {
        return "Add a public zero-argument constructor to " + typeName;
    }

    /**
     * Example factory class the user can add so the type can be built with its dependencies.
     */
    public static String factory(String typeName, String factoryClassName, String methodName) {
        int dot = factoryClassName.lastIndexOf('.');
        String pkg = dot > 0 ? factoryClassName.substring(0, dot) : "";
        String simple = dot > 0 ? factoryClassName.substring(dot + 1) : factoryClassName;
        return "Create a factory:\n\n"
                + (pkg.isEmpty() ? "" : "    package " + pkg + ";\n\n")
                + "    public class " + simple + " {\n"
                + "        public static " + typeName + " " + methodName + "() {\n"
                + "            return new " + typeName + "(/* dependencies */);\n"
                + "        }\n"
                + "    }";
    }
}
