package com.scandrift.core.report.impl;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.FileFinding;
import com.scandrift.core.model.HostOnlyRepository;
import com.scandrift.core.model.HostRepository;
import com.scandrift.core.model.MatchedRepository;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.StaleDuplicate;
import com.scandrift.core.model.SupportedFile;
import com.scandrift.core.model.TargetOnlyRepository;
import com.scandrift.core.model.TrackedFile;
import com.scandrift.core.model.UnresolvableTarget;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.report.ReportGenerator;
import com.scandrift.core.report.ReportSettings;

/**
 * Generates the full structured result as a JSON document.
 *
 * <p>The document is built as an explicit tree so the wire shape does not follow accidental
 * accessor names on the model records. Nothing is truncated.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Report";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    @Override
    public GeneratedFile generate(ReconciliationResult result, ReportSettings settings) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        ObjectNode root = mapper.createObjectNode();
        root.put("generatedAt", settings.generatedAt().toString());
        root.set("summary", summary(result));

        ArrayNode matched = root.putArray("matched");
        result.matched().forEach(repo -> matched.add(matched(repo)));

        ArrayNode targetOnly = root.putArray("targetOnly");
        for (TargetOnlyRepository repo : result.targetOnly()) {
            ObjectNode node = targetOnly.addObject();
            node.put("key", repo.key().value());
            ArrayNode targets = node.putArray("targets");
            repo.targets().forEach(target -> targets.add(target(target)));
        }

        ArrayNode hostOnly = root.putArray("hostOnly");
        for (HostOnlyRepository repo : result.hostOnly()) {
            ObjectNode node = hostOnly.addObject();
            node.put("key", repo.key().value());
            node.set("repository", repository(repo.repository()));
        }

        ArrayNode unresolvable = root.putArray("unresolvable");
        for (UnresolvableTarget entry : result.unresolvable()) {
            ObjectNode node = target(entry.target());
            node.put("reason", entry.reason().name());
            unresolvable.add(node);
        }

        ArrayNode failures = root.putArray("organizationFailures");
        for (OrganizationFailure failure : result.organizationFailures()) {
            failures.addObject().put("orgId", failure.orgId()).put("reason", failure.reason());
        }

        ArrayNode duplicates = root.putArray("duplicateGroups");
        result.duplicateGroups().forEach(group -> duplicates.add(duplicateGroup(group)));

        try {
            String content = mapper.writeValueAsString(root);
            log.debug("Generated JSON report ({} characters)", content.length());
            return new GeneratedFile(fileName(), content, getContentType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON report: " + e.getOriginalMessage(), e);
        }
    }

    private ObjectNode summary(ReconciliationResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("matched", result.matched().size());
        node.put("targetOnly", result.targetOnly().size());
        node.put("hostOnly", result.hostOnly().size());
        node.put("unresolvable", result.unresolvable().size());
        node.put("organizationFailures", result.organizationFailures().size());
        node.put("staleFiles", result.staleFileCount());
        node.put("untrackedFiles", result.untrackedFileCount());
        node.put("staleDuplicates", result.staleDuplicateCount());
        return node;
    }

    private ObjectNode matched(MatchedRepository repo) {
        ObjectNode node = mapper.createObjectNode();
        node.put("key", repo.key().value());
        node.set("repository", repository(repo.repository()));
        node.put("platform", repo.identity().platform().name());
        node.put("branch", repo.identity().branch());
        node.put("projectCount", repo.projectCount());
        node.put("hasDrift", repo.hasDrift());

        ArrayNode targets = node.putArray("targets");
        repo.targets().forEach(target -> targets.add(target(target)));
        node.set("trackedFiles", trackedFiles(repo.trackedFiles()));
        node.set("staleFiles", trackedFiles(repo.staleFiles()));

        ArrayNode supported = node.putArray("supportedFiles");
        for (SupportedFile file : repo.supportedFiles()) {
            supported.addObject()
                .put("path", file.path())
                .put("type", file.type().label())
                .put("category", file.type().category().name())
                .put("pattern", file.pattern());
        }

        ArrayNode untracked = node.putArray("untrackedFiles");
        repo.untrackedFiles().forEach(untracked::add);
        node.set("trackedDetails", findings(repo.trackedDetails()));
        node.set("staleDetails", findings(repo.staleDetails()));

        ArrayNode duplicates = node.putArray("duplicates");
        repo.duplicates().forEach(group -> duplicates.add(duplicateGroup(group)));
        ArrayNode errors = node.putArray("errors");
        repo.errors().forEach(errors::add);
        return node;
    }

    private ArrayNode trackedFiles(List<TrackedFile> files) {
        ArrayNode array = mapper.createArrayNode();
        for (TrackedFile file : files) {
            array.addObject().put("path", file.path()).put("type", file.type().label());
        }
        return array;
    }

    private ArrayNode findings(List<FileFinding> findings) {
        ArrayNode array = mapper.createArrayNode();
        for (FileFinding finding : findings) {
            array.addObject()
                .put("filePath", finding.filePath())
                .put("declaredPath", finding.declaredPath())
                .put("root", finding.root())
                .put("projectId", finding.projectId())
                .put("projectName", finding.projectName())
                .put("orgId", finding.orgId())
                .put("orgName", finding.orgName())
                .put("projectUrl", finding.projectUrl())
                .put("exists", finding.exists());
        }
        return array;
    }

    private ObjectNode target(ScanTarget target) {
        ObjectNode node = mapper.createObjectNode();
        node.put("orgId", target.orgId());
        node.put("targetId", target.targetId());
        node.put("displayName", target.displayName());
        node.put("sourceUrl", target.sourceUrl());
        node.put("integrationType", target.integrationType());
        return node;
    }

    private ObjectNode repository(HostRepository repository) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", repository.id());
        node.put("fullPath", repository.fullPath());
        node.put("defaultBranch", repository.defaultBranch());
        node.put("webUrl", repository.webUrl());
        return node;
    }

    private ObjectNode duplicateGroup(DuplicateGroup group) {
        ObjectNode node = mapper.createObjectNode();
        node.put("targetId", group.targetId());
        node.put("identifier", group.identifier());
        node.set("canonical", project(group.canonical()));
        ArrayNode stale = node.putArray("stale");
        for (StaleDuplicate duplicate : group.stale()) {
            ObjectNode entry = project(duplicate.project());
            entry.put("reason", duplicate.reason());
            entry.put("duplicateOfId", duplicate.duplicateOfId());
            entry.put("duplicateOfName", duplicate.duplicateOfName());
            stale.add(entry);
        }
        return node;
    }

    private ObjectNode project(ScanProject project) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", project.id());
        node.put("name", project.name());
        node.put("type", project.type());
        node.put("created", project.created() == null ? null : project.created().toString());
        node.put("orgId", project.orgId());
        node.put("targetId", project.targetId());
        return node;
    }
}
