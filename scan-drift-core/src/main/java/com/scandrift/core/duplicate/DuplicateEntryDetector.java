package com.scandrift.core.duplicate;

import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.StaleDuplicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds projects that track the same file under the same target.
 *
 * <p>Projects are grouped by target id and the sub-identifier {@link DuplicatePolicy} extracts from their name.
 * In every group of two or more, the most recently created project is canonical and the rest are stale. Projects
 * with no creation time sort after dated ones; ties keep input order. Projects without a target id or without a
 * sub-identifier are never grouped.
 */
public class DuplicateEntryDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateEntryDetector.class);

    private static final Comparator<ScanProject> NEWEST_FIRST = Comparator.comparing(
        ScanProject::created, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final DuplicatePolicy policy;

    public DuplicateEntryDetector(DuplicatePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public DuplicateEntryDetector() {
        this(DuplicatePolicy.defaults());
    }

    /**
     * Detects duplicate groups in a project list.
     *
     * @param projects projects of one organization, or of one repository
     * @return duplicate groups in order of first appearance
     */
    public List<DuplicateGroup> detect(List<ScanProject> projects) {
        Map<GroupKey, List<ScanProject>> groups = new LinkedHashMap<>();
        for (ScanProject project : projects) {
            if (project.targetId() == null || project.targetId().isBlank()) {
                continue;
            }
            Optional<String> identifier = policy.identifierOf(project.name());
            if (identifier.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(new GroupKey(project.targetId(), identifier.get()), key -> new ArrayList<>())
                .add(project);
        }

        List<DuplicateGroup> duplicates = new ArrayList<>();
        groups.forEach((key, members) -> {
            if (members.size() < 2) {
                return;
            }
            List<ScanProject> sorted = members.stream().sorted(NEWEST_FIRST).collect(Collectors.toList());
            ScanProject canonical = sorted.get(0);
            List<StaleDuplicate> stale = sorted.subList(1, sorted.size()).stream()
                .map(project -> new StaleDuplicate(project, StaleDuplicate.NEWER_VERSION_EXISTS,
                    canonical.id(), canonical.name()))
                .collect(Collectors.toList());
            log.debug("Target {} has {} projects for '{}', keeping {}", key.targetId(), members.size(),
                key.identifier(), canonical.id());
            duplicates.add(new DuplicateGroup(key.targetId(), key.identifier(), canonical, stale));
        });
        return duplicates;
    }

    private record GroupKey(String targetId, String identifier) {
    }
}
