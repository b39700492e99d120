package com.babeltest.core.mock;

import com.babeltest.core.diagnostics.ResolutionException;
import com.babeltest.core.model.CalledAssertion;
import com.babeltest.core.model.MockSpec;
import com.babeltest.core.model.MutatesSpec;
import com.babeltest.core.resolve.CallInterceptor;
import com.babeltest.core.resolve.Invocable;
import com.babeltest.core.resolve.MethodOverrides;
import com.babeltest.core.resolve.Resolver;
import com.babeltest.core.resolve.TargetLocation;
import com.babeltest.core.resolve.TargetModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Installs the mocks and spies of one test as a single {@link MockScope}.
 *
 * <p>Module functions are swapped in their registry binding. Methods of registered
 * interface types are overridden in the registry's {@link MethodOverrides}, which every
 * collaborator proxy consults. The mock's {@code given} matcher is not consulted: each
 * call gets the configured behaviour.
 */
public class MockInstaller {

    private static final Logger log = LoggerFactory.getLogger(MockInstaller.class);

    private final Resolver resolver;
    private final MethodOverrides overrides;
    private final FailureFactory failures;

    public MockInstaller(Resolver resolver, MethodOverrides overrides, FailureFactory failures) {
        this.resolver = resolver;
        this.overrides = overrides;
        this.failures = failures;
    }

    /**
     * Installs all mocks, then all spies. When any installation fails, whatever was
     * already installed is restored before the exception propagates.
     *
     * @throws MockInstallationException when a target cannot be located or overridden
     */
    public MockScope install(List<MockSpec> mocks, MutatesSpec mutates) {
        MockScope scope = new MockScope();
        try {
            for (MockSpec mock : mocks) {
                installMock(scope, mock);
            }
            if (mutates != null && !mutates.isEmpty()) {
                for (CalledAssertion called : mutates.called()) {
                    installSpy(scope, called);
                }
            }
            return scope;
        } catch (RuntimeException e) {
            scope.close();
            throw e instanceof MockInstallationException installation
                    ? installation
                    : new MockInstallationException(e.getMessage(), e);
        }
    }

    private void installMock(MockScope scope, MockSpec mock) {
        TargetLocation location = locate(mock.target(), "mock");
        Invocable behaviour = behaviour(mock, location);
        if (location.isFunction()) {
            TargetModule module = location.module();
            Invocable original = module.rebind(location.memberName(), behaviour);
            scope.onClose(() -> module.rebind(location.memberName(), original));
        } else {
            requireInterface(location, mock.target());
            MethodOverrides.Registration registration =
                    overrides.install(location.overrideKey(), call -> behaviour.invoke(call.arguments()));
            scope.onClose(registration::close);
        }
        log.debug("Mock installed: {} -> {}", location.path(), mock.raises() != null ? "throws" : "returns");
    }

    private void installSpy(MockScope scope, CalledAssertion called) {
        TargetLocation location = locate(called.target(), "spy");
        String path = location.path();
        CallRecorder recorder = scope.recorder();
        if (location.isFunction()) {
            TargetModule module = location.module();
            Invocable original = module.findFunction(location.memberName())
                    .orElseThrow(() -> new MockInstallationException("No function bound at " + path));
            module.rebind(location.memberName(), recording(path, recorder, original));
            scope.onClose(() -> module.rebind(location.memberName(), original));
        } else {
            requireInterface(location, called.target());
            CallInterceptor spy = call -> {
                recorder.record(path, call.arguments());
                return call.proceed();
            };
            MethodOverrides.Registration registration = overrides.install(location.overrideKey(), spy);
            scope.onClose(registration::close);
        }
        scope.spy(called, path);
        log.debug("Spy installed: {}", path);
    }

    private Invocable behaviour(MockSpec mock, TargetLocation location) {
        if (mock.raises() != null) {
            Supplier<Throwable> failure = failures.prepare(mock.raises(), location);
            return arguments -> {
                throw raise(failure.get());
            };
        }
        Object value = mock.returns();
        return arguments -> value;
    }

    private static Invocable recording(String path, CallRecorder recorder, Invocable delegate) {
        return new Invocable() {
            @Override
            public Object invoke(Map<String, Object> arguments) throws Exception {
                recorder.record(path, arguments);
                return delegate.invoke(arguments);
            }

            @Override
            public boolean isAsync() {
                return delegate.isAsync();
            }
        };
    }

    private TargetLocation locate(String target, String kind) {
        try {
            return resolver.locate(target);
        } catch (ResolutionException e) {
            throw new MockInstallationException("Cannot resolve " + kind + " target " + target + ": " + e.getMessage(), e);
        }
    }

    private static void requireInterface(TargetLocation location, String target) {
        if (!location.type().isInterface()) {
            throw new MockInstallationException("Cannot override " + target + ": "
                    + location.type().getSimpleName() + " is a class; register the collaborator by its interface");
        }
    }

    private static Exception raise(Throwable failure) {
        if (failure instanceof Error error) {
            throw error;
        }
        return failure instanceof Exception exception ? exception : new MockedFailure("Throwable", failure.getMessage());
    }
}
