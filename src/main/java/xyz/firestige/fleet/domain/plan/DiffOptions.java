package xyz.firestige.fleet.domain.plan;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 运维覆盖选项
 * <ul>
 *     <li>only：仅处理指定服务</li>
 *     <li>skip：指定服务的工作项以 skip 动作输出</li>
 *     <li>force：指定服务的所有资源强制更新</li>
 * </ul>
 */
public final class DiffOptions {

    private static final DiffOptions NONE = new DiffOptions(Set.of(), Set.of(), Set.of());

    private final Set<String> only;
    private final Set<String> skip;
    private final Set<String> force;

    private DiffOptions(Collection<String> only, Collection<String> skip, Collection<String> force) {
        this.only = Collections.unmodifiableSet(new TreeSet<>(only));
        this.skip = Collections.unmodifiableSet(new TreeSet<>(skip));
        this.force = Collections.unmodifiableSet(new TreeSet<>(force));
    }

    public static DiffOptions none() {
        return NONE;
    }

    public static DiffOptions of(Collection<String> only, Collection<String> skip, Collection<String> force) {
        return new DiffOptions(
                only == null ? Set.of() : only,
                skip == null ? Set.of() : skip,
                force == null ? Set.of() : force);
    }

    public static DiffOptions forcing(String... services) {
        return new DiffOptions(Set.of(), Set.of(), Set.of(services));
    }

    public boolean selects(String service) {
        return only.isEmpty() || only.contains(service);
    }

    public boolean skips(String service) {
        return skip.contains(service);
    }

    public boolean forces(String service) {
        return force.contains(service);
    }

    public Set<String> getOnly() {
        return only;
    }

    public Set<String> getSkip() {
        return skip;
    }

    public Set<String> getForce() {
        return force;
    }

    @Override
    public String toString() {
        return "DiffOptions{only=" + only + ", skip=" + skip + ", force=" + force + '}';
    }
}
