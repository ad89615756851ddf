package com.mainframe.analyzer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mainframe.analyzer.util.CobolNamingUtil;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structural model of one COBOL program unit.
 *
 * Built once by the scanner and read-only afterwards. All maps iterate in
 * source order and all names are uppercased.
 */
@Value
@Builder(toBuilder = true)
public class ProgramStructure {

    /**
     * Division name to its raw text, boundary line included.
     */
    @NonNull
    @Builder.Default
    Map<String, String> divisions = Map.of();

    /**
     * Section name to the paragraph names declared under it.
     */
    @NonNull
    @Builder.Default
    Map<String, List<String>> sections = Map.of();

    /**
     * Paragraph name to its raw text. Last occurrence wins for repeated names.
     */
    @NonNull
    @Builder.Default
    Map<String, String> paragraphs = Map.of();

    /**
     * COPY targets in discovery order, duplicates kept.
     */
    @NonNull
    @Builder.Default
    List<String> copyReferences = List.of();

    @NonNull
    @Builder.Default
    Map<String, List<DependencyEdge>> dependencies = Map.of();

    @NonNull
    @Builder.Default
    Map<String, List<ResourceOperation>> resourceOperations = Map.of();

    /**
     * Every body of every division name. Only filled when all occurrences are collected.
     */
    @NonNull
    @Builder.Default
    Map<String, List<String>> divisionOccurrences = Map.of();

    /**
     * Every body of every paragraph name. Only filled when all occurrences are collected.
     */
    @NonNull
    @Builder.Default
    Map<String, List<String>> paragraphOccurrences = Map.of();

    public static ProgramStructure empty() {
        return ProgramStructure.builder().build();
    }

    public boolean isEmpty() {
        return divisions.isEmpty() && sections.isEmpty() && paragraphs.isEmpty()
                && copyReferences.isEmpty() && dependencies.isEmpty() && resourceOperations.isEmpty();
    }

    public Optional<String> findParagraph(String name) {
        return Optional.ofNullable(paragraphs.get(CobolNamingUtil.normalizeName(name)));
    }

    public Optional<String> findDivision(String name) {
        return Optional.ofNullable(divisions.get(CobolNamingUtil.normalizeName(name)));
    }

    public List<DependencyEdge> dependenciesOf(String paragraph) {
        return dependencies.getOrDefault(CobolNamingUtil.normalizeName(paragraph), List.of());
    }

    public List<ResourceOperation> resourceOperationsOf(String paragraph) {
        return resourceOperations.getOrDefault(CobolNamingUtil.normalizeName(paragraph), List.of());
    }

    /**
     * The last section that declares the paragraph, if any.
     */
    public Optional<String> sectionOf(String paragraph) {
        String key = CobolNamingUtil.normalizeName(paragraph);
        String owner = null;
        for (Map.Entry<String, List<String>> section : sections.entrySet()) {
            if (section.getValue().contains(key)) {
                owner = section.getKey();
            }
        }
        return Optional.ofNullable(owner);
    }

    /**
     * Paragraphs holding at least one PERFORM of {@code target}, in model order.
     */
    public List<String> invokersOf(String target) {
        String key = CobolNamingUtil.normalizeName(target);
        List<String> invokers = new ArrayList<>();
        dependencies.forEach((paragraph, edges) -> {
            boolean performs = edges.stream()
                    .anyMatch(e -> e.getKind() == EdgeKind.INVOKE && e.getTarget().equals(key));
            if (performs) {
                invokers.add(paragraph);
            }
        });
        return invokers;
    }

    /**
     * Distinct CALL targets in discovery order.
     */
    public Set<String> externalCallTargets() {
        Set<String> targets = new LinkedHashSet<>();
        dependencies.values().forEach(edges -> edges.stream()
                .filter(e -> e.getKind() == EdgeKind.EXTERNAL_CALL)
                .map(DependencyEdge::getTarget)
                .forEach(targets::add));
        return targets;
    }
}
