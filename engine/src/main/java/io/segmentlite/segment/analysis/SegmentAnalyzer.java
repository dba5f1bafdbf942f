package io.segmentlite.segment.analysis;

import io.segmentlite.segment.model.Combinator;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Describes a segment without running it: structure counts, a complexity score and
 * markdown explanations for analysts.
 *
 * Complexity score:
 * <ul>
 *   <li>2 per container, at any level</li>
 *   <li>1 per condition</li>
 *   <li>3 per exclude container</li>
 *   <li>2 if containers of more than one scope are used</li>
 *   <li>3 per level of the deepest nesting</li>
 *   <li>2 per container combining with OR or THEN</li>
 * </ul>
 */
public final class SegmentAnalyzer {

    public SegmentStructure structure(SegmentDefinition definition) {
        List<Placed> placed = flatten(definition);
        Map<Scope, Integer> byScope = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            byScope.put(scope, 0);
        }
        int conditions = 0;
        int excludes = 0;
        int maxLevel = 0;
        for (Placed p : placed) {
            byScope.merge(p.container().effectiveScope(), 1, Integer::sum);
            conditions += p.container().conditions().size();
            if (!p.container().effectiveSign().isInclude()) {
                excludes++;
            }
            maxLevel = Math.max(maxLevel, p.level());
        }
        int roots = definition == null ? 0 : definition.containers().size();
        return new SegmentStructure(placed.size(), roots, maxLevel, conditions, excludes, byScope);
    }

    public SegmentComplexity complexity(SegmentDefinition definition) {
        if (definition == null) {
            return new SegmentComplexity(0, ComplexityLevel.NONE, List.of("No segment defined"));
        }
        List<Placed> placed = flatten(definition);
        SegmentStructure structure = structure(definition);
        List<String> details = new ArrayList<>();
        int score = 0;

        score += structure.totalContainers() * 2;
        details.add(structure.totalContainers() + " total container(s)");

        score += structure.totalConditions();
        details.add(structure.totalConditions() + " total condition(s)");

        if (structure.excludeContainers() > 0) {
            score += structure.excludeContainers() * 3;
            details.add(structure.excludeContainers() + " exclude container(s)");
        }

        Set<Scope> scopes = EnumSet.noneOf(Scope.class);
        placed.forEach(p -> scopes.add(p.container().effectiveScope()));
        if (scopes.size() > 1) {
            score += 2;
            details.add("Mixed container types");
        }

        if (structure.maxNestingLevel() > 0) {
            score += structure.maxNestingLevel() * 3;
            details.add("Maximum nesting level: " + structure.maxNestingLevel());
        }

        long nonConjunctive = placed.stream()
                .filter(p -> p.container().effectiveCombinator() != Combinator.AND)
                .count();
        if (nonConjunctive > 0) {
            score += (int) nonConjunctive * 2;
            details.add(nonConjunctive + " container(s) with OR/THEN logic");
        }

        return new SegmentComplexity(score, ComplexityLevel.forScore(score), details);
    }

    /**
     * Markdown outline of the containers per nesting level.
     */
    public String explain(SegmentDefinition definition) {
        if (definition == null || definition.containers().isEmpty()) {
            return "No segment containers defined.";
        }
        List<Placed> placed = flatten(definition);
        Map<Integer, List<Container>> levels = new TreeMap<>();
        for (Placed p : placed) {
            levels.computeIfAbsent(p.level(), k -> new ArrayList<>()).add(p.container());
        }

        List<String> lines = new ArrayList<>();
        lines.add("**Query Structure:**");
        lines.add("- Main container type: **" + title(definition.effectiveRootScope().id()) + "**");
        lines.add("- Total containers (including nested): **" + placed.size() + "**");
        lines.add("- Container hierarchy levels: **" + levels.size() + "**");
        levels.forEach((level, containers) -> {
            lines.add("  - " + (level == 0 ? "Root" : "Level " + level) + ": " + containers.size() + " container(s)");
            for (Container container : containers) {
                lines.add("    - **" + signLabel(container) + "** " + container.effectiveScope().id()
                        + " with " + container.conditions().size() + " condition(s) and "
                        + container.children().size() + " child(ren)");
            }
        });
        if (definition.containers().size() > 1) {
            lines.add("- Root containers combined with: **" + combinatorLabel(definition.effectiveCombinator()) + "**");
        }
        return String.join("\n", lines);
    }

    /**
     * Full markdown documentation of a segment.
     *
     * @param sql         Display SQL of the segment
     * @param generatedAt Timestamp printed in the export section
     */
    public String document(SegmentDefinition definition, String sql, Instant generatedAt) {
        if (definition == null) {
            return "No segment definition provided";
        }
        String name = definition.name() == null ? "Unnamed" : definition.name();
        String description = definition.description() == null || definition.description().isBlank()
                ? "No description" : definition.description();
        SegmentStructure structure = structure(definition);
        SegmentComplexity complexity = complexity(definition);

        List<String> doc = new ArrayList<>();
        doc.add("# Segment Documentation: " + name);
        doc.add("");
        doc.add("## Basic Information");
        doc.add("- **Name:** " + name);
        doc.add("- **Description:** " + description);
        doc.add("- **Container Type:** " + title(definition.effectiveRootScope().id()));
        doc.add("- **Logic:** " + combinatorLabel(definition.effectiveCombinator()));
        doc.add("");
        doc.add("## Statistics");
        doc.add("- **Total Containers:** " + structure.totalContainers());
        doc.add("- **Root Containers:** " + structure.rootContainers());
        doc.add("- **Maximum Nesting Level:** " + structure.maxNestingLevel());
        doc.add("- **Total Conditions:** " + structure.totalConditions());
        doc.add("- **Complexity Level:** " + title(complexity.level().label()));
        doc.add("- **Complexity Score:** " + complexity.score());
        doc.add("");
        doc.add("## Container Structure");
        List<Container> roots = definition.containers();
        for (int i = 0; i < roots.size(); i++) {
            if (i > 0) {
                doc.add("*" + combinatorLabel(definition.effectiveCombinator()) + "*");
                doc.add("");
            }
            documentContainer(doc, roots.get(i), 0);
        }
        doc.add("## Generated SQL Query");
        doc.add("```sql");
        doc.add(sql == null ? "" : sql);
        doc.add("```");
        doc.add("");
        doc.add("## Export Information");
        doc.add("- **Generated:** " + generatedAt);
        return String.join("\n", doc);
    }

    private static void documentContainer(List<String> doc, Container container, int level) {
        String indent = "  ".repeat(level);
        String logic = combinatorLabel(container.effectiveCombinator());
        doc.add(indent + "- **" + signLabel(container) + " " + title(container.effectiveScope().id())
                + " Container** (Logic: " + logic + ")");

        List<Condition> conditions = container.conditions();
        if (!conditions.isEmpty()) {
            doc.add(indent + "  - **Conditions:**");
            for (int i = 0; i < conditions.size(); i++) {
                if (i > 0) {
                    doc.add(indent + "    - *" + logic + "*");
                }
                doc.add(indent + "    - " + describe(conditions.get(i)));
            }
        }
        if (!container.children().isEmpty()) {
            doc.add(indent + "  - **Child Containers:**");
            for (Container child : container.children()) {
                documentContainer(doc, child, level + 2);
            }
        }
        doc.add("");
    }

    static String describe(Condition condition) {
        String name = condition.displayName() != null && !condition.displayName().isBlank()
                ? condition.displayName()
                : condition.field() == null ? "Unknown" : condition.field();
        String operator = condition.operator() == null ? "equals" : condition.operator().id();
        String text = name + " " + operator;
        if (condition.operator() != null && condition.operator().isExistence()) {
            return text;
        }
        String value = condition.value() == null ? "" : condition.value();
        if (condition.secondValue() != null && !condition.secondValue().isBlank()) {
            return text + " '" + value + "' and '" + condition.secondValue() + "'";
        }
        return text + " '" + value + "'";
    }

    private static List<Placed> flatten(SegmentDefinition definition) {
        List<Placed> placed = new ArrayList<>();
        if (definition != null) {
            for (Container container : definition.containers()) {
                collect(container, 0, placed);
            }
        }
        return placed;
    }

    private static void collect(Container container, int level, List<Placed> out) {
        out.add(new Placed(container, level));
        for (Container child : container.children()) {
            collect(child, level + 1, out);
        }
    }

    private static String signLabel(Container container) {
        return container.effectiveSign().isInclude() ? "Include" : "Exclude";
    }

    private static String combinatorLabel(Combinator combinator) {
        return combinator.id().toUpperCase(Locale.ROOT);
    }

    private static String title(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean start = true;
        for (char c : text.toCharArray()) {
            sb.append(start ? Character.toUpperCase(c) : c);
            start = c == ' ';
        }
        return sb.toString();
    }

    private record Placed(Container container, int level) {
    }
}
