package com.babeltest.fixtures.math;

import java.util.List;

public final class Calculator {

    private Calculator() {}

    public record Profile(String name, int age, List<String> tags) {}

    public static int add(int a, int b) {
        return a + b;
    }

    public static double divide(double a, double b) {
        if (b == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return a / b;
    }

    public static String greet(String name) {
        return "Hello, " + name + "!";
    }

    public static Profile profile(String name, int age) {
        return new Profile(name, age, List.of("new", "trial"));
    }

    public static boolean isEven(int n) {
        return n % 2 == 0;
    }

    public static Object nothing() {
        return null;
    }

    public static String shout(String text) {
        System.out.println("shouting " + text);
        System.err.println("warning: loud");
        return text.toUpperCase();
    }

    public static int total(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).sum();
    }
}
