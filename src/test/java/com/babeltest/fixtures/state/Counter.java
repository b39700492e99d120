package com.babeltest.fixtures.state;

public class Counter {

    private int count;

    public int increment() {
        return ++count;
    }

    public int current() {
        return count;
    }
}
