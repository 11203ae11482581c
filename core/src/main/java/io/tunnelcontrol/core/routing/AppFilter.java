package io.tunnelcontrol.core.routing;

import java.util.List;
import java.util.Set;

/**
 * Which applications have their traffic captured by the tunnel.
 *
 * <p>
 * A non-empty allow-list captures only the listed applications. Otherwise every application is
 * captured except the controlling application itself, whose own control traffic must stay off the
 * tunnel.
 *
 * @param mode       whether {@code packages} is an allow-list or a deny-list
 * @param packages   application identifiers the mode applies to
 */
public record AppFilter(Mode mode, Set<String> packages) {

    public enum Mode {
        ALLOW_ONLY,
        DISALLOW
    }

    public AppFilter {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        packages = packages == null ? Set.of() : Set.copyOf(packages);
    }

    /**
     * Builds the filter for a session.
     *
     * @param allowedApps  the user's allow-list; blank entries are ignored
     * @param selfPackage  identifier of the controlling application
     */
    public static AppFilter of(List<String> allowedApps, String selfPackage) {
        Set<String> allowed = allowedApps == null
                ? Set.of()
                : Set.copyOf(allowedApps.stream()
                        .filter(app -> app != null && !app.isBlank())
                        .map(String::trim)
                        .toList());
        if (!allowed.isEmpty()) {
            return new AppFilter(Mode.ALLOW_ONLY, allowed);
        }
        if (selfPackage == null || selfPackage.isBlank()) {
            return new AppFilter(Mode.DISALLOW, Set.of());
        }
        return new AppFilter(Mode.DISALLOW, Set.of(selfPackage));
    }

    /** Whether traffic from {@code packageName} goes through the tunnel. */
    public boolean captures(String packageName) {
        return mode == Mode.ALLOW_ONLY ? packages.contains(packageName) : !packages.contains(packageName);
    }
}
