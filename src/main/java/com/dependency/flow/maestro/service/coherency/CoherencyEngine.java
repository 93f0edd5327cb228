package com.dependency.flow.maestro.service.coherency;

import com.dependency.flow.maestro.model.Asset;
import com.dependency.flow.maestro.model.CoherencyErrorDetails;
import com.dependency.flow.maestro.model.CoherencyMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the dependency edits a target branch needs for a new build.
 *
 * Two layers are computed:
 * 1. Non-coherency updates: dependencies produced by the build whose version differs
 *    from the target's manifest.
 * 2. Coherency updates: dependencies tied to a coherent parent take the version the parent's
 *    own manifest declares at the parent's (possibly just updated) commit. Chains are resolved
 *    parents first.
 *
 * In STRICT mode an unresolvable requirement is reported as a {@link CoherencyErrorDetails}
 * but never removes updates from the result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CoherencyEngine {

    private final DependencyGraphReader graphReader;

    public CoherencyResult getRequiredUpdates(String targetRepository,
                                              String targetBranch,
                                              String sourceRepository,
                                              String sourceSha,
                                              List<Asset> assets,
                                              CoherencyMode mode) {
        List<DependencyDetail> current = graphReader.getDependencies(targetRepository, targetBranch);

        List<DependencyUpdate> nonCoherency = getRequiredNonCoherencyUpdates(sourceRepository, sourceSha, assets, current);
        CoherencyResult coherency = getRequiredCoherencyUpdates(current, nonCoherency, mode);

        List<DependencyUpdate> all = DependencyUpdates.merge(nonCoherency, coherency.getRequiredUpdates());

        log.info("Computed {} required updates ({} coherency) for {}@{} from {}@{}, coherency {}",
                all.size(), coherency.getRequiredUpdates().size(), targetRepository, targetBranch,
                sourceRepository, sourceSha, coherency.isCoherencySuccessful() ? "ok" : "failed");

        return CoherencyResult.builder()
                .requiredUpdates(all)
                .coherencySuccessful(coherency.isCoherencySuccessful())
                .errors(coherency.getErrors())
                .build();
    }

    /**
     * Direct bumps: every unpinned, parentless dependency matching an asset of the build.
     */
    public List<DependencyUpdate> getRequiredNonCoherencyUpdates(String sourceRepository,
                                                                 String sourceSha,
                                                                 List<Asset> assets,
                                                                 List<DependencyDetail> current) {
        Map<String, Asset> assetsByName = new HashMap<>();
        for (Asset asset : assets) {
            assetsByName.put(key(asset.getName()), asset);
        }

        List<DependencyUpdate> updates = new ArrayList<>();
        for (DependencyDetail dependency : current) {
            if (dependency.isPinned() || dependency.getCoherentParentDependencyName() != null) {
                continue;
            }
            Asset asset = assetsByName.get(key(dependency.getName()));
            if (asset == null) {
                continue;
            }
            boolean changed = !asset.getVersion().equals(dependency.getVersion())
                    || !Objects.equals(sourceRepository, dependency.getRepoUri())
                    || !Objects.equals(sourceSha, dependency.getCommit());
            if (!changed) {
                continue;
            }
            DependencyDetail to = dependency.toBuilder()
                    .version(asset.getVersion())
                    .repoUri(sourceRepository)
                    .commit(sourceSha)
                    .build();
            updates.add(new DependencyUpdate(dependency, to));
        }
        return updates;
    }

    /**
     * Transitive bumps needed so that every coherent child matches what its parent declares.
     */
    public CoherencyResult getRequiredCoherencyUpdates(List<DependencyDetail> current,
                                                       List<DependencyUpdate> plannedUpdates,
                                                       CoherencyMode mode) {
        CoherencyResolution resolution = new CoherencyResolution(current, plannedUpdates, mode);
        for (DependencyDetail dependency : current) {
            if (dependency.getCoherentParentDependencyName() != null) {
                resolution.resolve(dependency.getName(), new LinkedHashSet<>());
            }
        }
        return CoherencyResult.builder()
                .requiredUpdates(resolution.updates)
                .coherencySuccessful(resolution.errors.isEmpty())
                .errors(resolution.errors)
                .build();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Working set for one coherency pass.
     */
    private final class CoherencyResolution {

        private final Map<String, DependencyDetail> original = new LinkedHashMap<>();
        private final Map<String, DependencyDetail> resolved = new LinkedHashMap<>();
        private final Set<String> done = new HashSet<>();
        private final List<DependencyUpdate> updates = new ArrayList<>();
        private final List<CoherencyErrorDetails> errors = new ArrayList<>();
        private final CoherencyMode mode;

        CoherencyResolution(List<DependencyDetail> current, List<DependencyUpdate> plannedUpdates, CoherencyMode mode) {
            this.mode = mode;
            for (DependencyDetail dependency : current) {
                original.put(key(dependency.getName()), dependency);
                resolved.put(key(dependency.getName()), dependency);
            }
            for (DependencyUpdate update : plannedUpdates) {
                resolved.put(key(update.getDependencyName()), update.getTo());
            }
        }

        void resolve(String name, Set<String> visiting) {
            String childKey = key(name);
            if (done.contains(childKey)) {
                return;
            }
            DependencyDetail child = original.get(childKey);
            String parentName = child.getCoherentParentDependencyName();
            if (parentName == null) {
                done.add(childKey);
                return;
            }
            if (!visiting.add(childKey)) {
                reportError("Circular coherent parent chain: " + String.join(" -> ", visiting) + " -> " + childKey,
                        List.of("Remove the coherent parent attribute from one of the dependencies in the chain"));
                done.add(childKey);
                return;
            }

            String parentKey = key(parentName);
            DependencyDetail parentOriginal = original.get(parentKey);
            if (parentOriginal == null) {
                reportError("Coherent parent " + parentName + " of " + name + " is not a dependency of the target",
                        List.of("Add " + parentName + " to the target's dependencies",
                                "Remove the coherent parent attribute from " + name));
                visiting.remove(childKey);
                done.add(childKey);
                return;
            }

            resolve(parentName, visiting);
            DependencyDetail parent = resolved.get(parentKey);

            if (!parentChanged(parentOriginal, parent)) {
                visiting.remove(childKey);
                done.add(childKey);
                return;
            }

            DependencyDetail required = findIn(graphReader.getDependencies(parent.getRepoUri(), parent.getCommit()), name);
            if (required == null) {
                reportError(parent.getRepoUri() + " @ " + parent.getCommit() + " does not contain dependency " + name,
                        List.of("Add " + name + " to the dependencies of " + parent.getRepoUri(),
                                "Remove the coherent parent attribute from " + name));
            } else if (required.getVersion() == null) {
                reportError(parent.getRepoUri() + " @ " + parent.getCommit() + " declares dependency " + name
                                + " without a version",
                        List.of("Declare a version for " + name + " in " + parent.getRepoUri()));
            } else if (!Objects.equals(required.getVersion(), resolved.get(childKey).getVersion())) {
                if (child.isPinned()) {
                    reportError("Dependency " + name + " is pinned to " + child.getVersion()
                                    + " but " + parentName + " requires " + required.getVersion(),
                            List.of("Unpin " + name, "Update " + name + " to " + required.getVersion() + " manually"));
                } else {
                    DependencyDetail to = child.toBuilder()
                            .version(required.getVersion())
                            .repoUri(required.getRepoUri())
                            .commit(required.getCommit())
                            .build();
                    resolved.put(childKey, to);
                    updates.add(new DependencyUpdate(child, to));
                }
            }

            visiting.remove(childKey);
            done.add(childKey);
        }

        private void reportError(String error, List<String> potentialSolutions) {
            if (mode != CoherencyMode.STRICT) {
                log.debug("Ignoring coherency problem in legacy mode: {}", error);
                return;
            }
            log.warn("Coherency check failed: {}", error);
            errors.add(CoherencyErrorDetails.builder()
                    .error(error)
                    .potentialSolutions(new ArrayList<>(potentialSolutions))
                    .build());
        }

        private boolean parentChanged(DependencyDetail before, DependencyDetail after) {
            return !Objects.equals(before.getVersion(), after.getVersion())
                    || !Objects.equals(before.getCommit(), after.getCommit())
                    || !Objects.equals(before.getRepoUri(), after.getRepoUri());
        }

        private DependencyDetail findIn(List<DependencyDetail> dependencies, String name) {
            for (DependencyDetail dependency : dependencies) {
                if (dependency.getName().equalsIgnoreCase(name)) {
                    return dependency;
                }
            }
            return null;
        }
    }
}
