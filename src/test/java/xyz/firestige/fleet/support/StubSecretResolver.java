package xyz.firestige.fleet.support;

import xyz.firestige.fleet.exception.FatalApplyException;
import xyz.firestige.fleet.infrastructure.external.SecretResolver;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存凭据解析器，未登记的引用视为无法解析
 */
public class StubSecretResolver implements SecretResolver {

    private final Map<String, String> secrets = new ConcurrentHashMap<>();
    private volatile boolean resolveAll;

    public static StubSecretResolver resolvingAll() {
        StubSecretResolver resolver = new StubSecretResolver();
        resolver.resolveAll = true;
        return resolver;
    }

    public StubSecretResolver with(String reference, String value) {
        secrets.put(reference, value);
        return this;
    }

    @Override
    public String resolve(String reference) {
        String value = secrets.get(reference);
        if (value != null) {
            return value;
        }
        if (resolveAll) {
            return "secret-" + reference;
        }
        throw new FatalApplyException("无法解析凭据: " + reference);
    }

    @Override
    public boolean canResolve(String reference) {
        return resolveAll || secrets.containsKey(reference);
    }
}
