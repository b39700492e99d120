package com.babeltest.core.executor;

/**
 * Optional executor capability: suite and test boundary notifications.
 */
public interface LifecycleAware {

    void onSuiteStart(String suiteName);

    void onSuiteEnd(String suiteName);

    void onTestStart(String testName);

    void onTestEnd(String testName);
}
