package com.babeltest.fixtures.services;

public class AppConfig {

    public static class Region {
        public String code() {
            return "eu-west";
        }
    }

    private final Region region = new Region();

    public Region getRegion() {
        return region;
    }
}
