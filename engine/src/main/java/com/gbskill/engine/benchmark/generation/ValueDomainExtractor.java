package com.gbskill.engine.benchmark.generation;

import com.gbskill.engine.dsl.AttributeSpec;
import com.gbskill.engine.dsl.LookupTable;
import com.gbskill.engine.dsl.SkillDsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.gbskill.engine.runtime.StandardAttributes.*;

/**
 * Reads the values a skill can legitimately produce out of its DSL, as raw
 * material for generated cases.
 *
 * Two sources, in order of preference:
 * <ol>
 *   <li>Table enumeration: each row of the dimension table, expanded into one
 *       combination per wall-thickness column, with the pressure parsed from
 *       that column's header.</li>
 *   <li>Value domains: the union of every table column and every attribute's
 *       allowed or default values, crossed and randomly sampled.</li>
 * </ol>
 *
 * Keys starting with {@code _} in a combination are metadata, not attributes.
 */
public class ValueDomainExtractor {

    public static final String SOURCE_KEY = "_source";

    private static final Pattern PRESSURE_IN_HEADER = Pattern.compile("PN?([\\d.]+)");
    private static final long MAX_PRODUCT = 1L << 40;
    private static final Pattern PARENTHESISED = Pattern.compile("\\([^)]*\\)");

    /** Header → attribute name, tried exact first, then by containment, in this order. */
    private static final Map<String, String> COLUMN_NAMES = new LinkedHashMap<>();
    static {
        COLUMN_NAMES.put("DN", NOMINAL_DIAMETER);
        COLUMN_NAMES.put("dn", NOMINAL_DIAMETER);
        COLUMN_NAMES.put("外径", OUTER_DIAMETER);
        COLUMN_NAMES.put("外径(mm)", OUTER_DIAMETER);
        COLUMN_NAMES.put("PN", NOMINAL_PRESSURE);
        COLUMN_NAMES.put("pn", NOMINAL_PRESSURE);
        COLUMN_NAMES.put("壁厚", WALL_THICKNESS);
        COLUMN_NAMES.put("长度", "长度");
        COLUMN_NAMES.put("规格", "规格");
    }

    private final SkillDsl dsl;

    public ValueDomainExtractor(SkillDsl dsl) {
        this.dsl = dsl;
    }

    // ------------------------------------------------------------------
    // Table enumeration
    // ------------------------------------------------------------------

    /**
     * Combinations from the dimension-like table: {@code dimension_table}, or
     * else the first table with a thickness column. Empty when neither exists.
     */
    public List<Map<String, Object>> tableCombinations(int limit) {
        String tableName = dimensionTableName();
        if (tableName == null) {
            return List.of();
        }
        LookupTable table = dsl.table(tableName);
        List<String> columns = table.columnsOrEmpty();

        List<Integer> thicknessCols = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (isThicknessColumn(columns.get(i))) thicknessCols.add(i);
        }

        List<Map<String, Object>> combos = new ArrayList<>();
        List<List<Object>> rows = table.rowsOrEmpty();
        for (int r = 0; r < rows.size() && combos.size() < limit; r++) {
            List<Object> row = rows.get(r);
            Map<String, Object> base = new LinkedHashMap<>();
            for (int c = 0; c < columns.size() && c < row.size(); c++) {
                if (thicknessCols.contains(c)) continue;
                String attr = normalizeAttributeName(columns.get(c));
                if (attr != null) base.put(attr, row.get(c));
            }

            if (thicknessCols.isEmpty()) {
                base.put(SOURCE_KEY, tableName + "#row" + r);
                combos.add(base);
                continue;
            }
            for (int c : thicknessCols) {
                Object thickness = c < row.size() ? row.get(c) : null;
                if (!present(thickness)) continue;
                Map<String, Object> combo = new LinkedHashMap<>(base);
                combo.put(WALL_THICKNESS, thickness);
                Matcher m = PRESSURE_IN_HEADER.matcher(columns.get(c));
                if (m.find()) {
                    try {
                        combo.put(NOMINAL_PRESSURE, Double.valueOf(m.group(1)));
                    } catch (NumberFormatException e) {
                        // a header like "PN." carries no pressure
                    }
                }
                combo.put(SOURCE_KEY, tableName + "#row" + r + ":col" + c);
                combos.add(combo);
            }
        }
        return combos.size() > limit ? new ArrayList<>(combos.subList(0, limit)) : combos;
    }

    String dimensionTableName() {
        Map<String, LookupTable> tables = dsl.tablesOrEmpty();
        if (tables.containsKey(DIMENSION_TABLE)) {
            return DIMENSION_TABLE;
        }
        for (Map.Entry<String, LookupTable> e : tables.entrySet()) {
            for (String col : e.getValue().columnsOrEmpty()) {
                if (isThicknessColumn(col)) return e.getKey();
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Value domains
    // ------------------------------------------------------------------

    /**
     * Attribute name → distinct candidate values, in first-seen order. Allowed
     * values replace whatever tables contributed; a default value only fills
     * an attribute no table covers.
     */
    public Map<String, List<Object>> valueDomains() {
        Map<String, Set<Object>> domains = new LinkedHashMap<>();
        for (LookupTable table : dsl.tablesOrEmpty().values()) {
            List<String> columns = table.columnsOrEmpty();
            for (int c = 0; c < columns.size(); c++) {
                String attr = normalizeAttributeName(columns.get(c));
                if (attr == null) continue;
                for (List<Object> row : table.rowsOrEmpty()) {
                    if (row != null && c < row.size() && row.get(c) != null) {
                        domains.computeIfAbsent(attr, k -> new LinkedHashSet<>()).add(row.get(c));
                    }
                }
            }
        }
        for (Map.Entry<String, AttributeSpec> e : dsl.attributesOrEmpty().entrySet()) {
            AttributeSpec spec = e.getValue();
            if (spec.allowedValues() != null && !spec.allowedValues().isEmpty()) {
                domains.put(e.getKey(), new LinkedHashSet<>(spec.allowedValues()));
            } else if (spec.hasDefault() && !domains.containsKey(e.getKey())) {
                domains.put(e.getKey(), new LinkedHashSet<>(List.of(spec.defaultValue())));
            }
        }
        Map<String, List<Object>> out = new LinkedHashMap<>();
        domains.forEach((k, v) -> out.put(k, new ArrayList<>(v)));
        return out;
    }

    /**
     * Cartesian product of the domains. When it has more than {@code limit}
     * members, {@code limit} distinct members are drawn at random.
     *
     * @throws IllegalArgumentException if a domain has no value list
     */
    public static List<Map<String, Object>> crossProduct(Map<String, List<Object>> domains, int limit, Random random) {
        if (domains.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> keys = new ArrayList<>(domains.keySet());
        long total = 1;
        for (String k : keys) {
            List<Object> domain = domains.get(k);
            if (domain == null) {
                throw new IllegalArgumentException("No values given for '" + k + "'");
            }
            int size = domain.size();
            if (size == 0) return List.of();
            total = total > MAX_PRODUCT / size ? MAX_PRODUCT : total * size;
        }

        List<Long> indices = new ArrayList<>();
        if (total <= limit) {
            for (long i = 0; i < total; i++) indices.add(i);
        } else {
            Set<Long> picked = new LinkedHashSet<>();
            while (picked.size() < limit) {
                picked.add(Math.floorMod(random.nextLong(), total));
            }
            indices.addAll(picked);
        }

        // Mixed-radix decode; the last key varies fastest.
        List<Map<String, Object>> combos = new ArrayList<>(indices.size());
        for (long index : indices) {
            Object[] picks = new Object[keys.size()];
            long rest = index;
            for (int i = keys.size() - 1; i >= 0; i--) {
                List<Object> values = domains.get(keys.get(i));
                picks[i] = values.get((int) (rest % values.size()));
                rest /= values.size();
            }
            Map<String, Object> combo = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) combo.put(keys.get(i), picks[i]);
            combos.add(combo);
        }
        return combos;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Maps a table header to an attribute name; null for blank headers. */
    public static String normalizeAttributeName(String column) {
        if (column == null || column.isBlank()) return null;
        String exact = COLUMN_NAMES.get(column);
        if (exact != null) return exact;
        for (Map.Entry<String, String> e : COLUMN_NAMES.entrySet()) {
            if (column.contains(e.getKey())) return e.getValue();
        }
        String stripped = PARENTHESISED.matcher(column).replaceAll("").strip();
        return stripped.isEmpty() ? null : stripped;
    }

    static boolean isThicknessColumn(String column) {
        return column != null && column.contains("厚");
    }

    private static boolean present(Object v) {
        if (v == null) return false;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        return !v.toString().isEmpty();
    }
}
