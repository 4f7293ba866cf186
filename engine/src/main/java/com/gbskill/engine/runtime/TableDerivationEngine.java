package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.LookupTable;
import com.gbskill.engine.dsl.SkillDsl;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gbskill.engine.runtime.StandardAttributes.*;

/**
 * Derives attributes the text does not state by chaining table lookups:
 *
 * <pre>
 *   公称直径 ──dn_outer_diameter_map──▶ 公称外径 ─┐
 *   公称压力 ──series_mapping─────────▶ 管系列  ─┴─dimension_table──▶ 最小壁厚
 *                                                        最小壁厚 ──wall_thickness_tolerance──▶ 壁厚偏差
 * </pre>
 *
 * A step whose input is missing, or whose table has no matching row, is
 * skipped along with everything that depends on it. Derived values carry
 * confidence 1.0 and a description citing the table they came from.
 */
@Component
public class TableDerivationEngine {

    static final double DEFAULT_DESIGN_COEFFICIENT = 2.0;

    /** Attributes after derivation, plus the values each step found. */
    public record Derivation(Map<String, ParsedAttribute> attributes, Map<String, Object> found) {}

    public Derivation derive(Map<String, ParsedAttribute> input, SkillDsl dsl) {
        Map<String, ParsedAttribute> attrs = new LinkedHashMap<>(input);
        Map<String, Object> found = new LinkedHashMap<>();

        Object dn = valueOf(attrs, NOMINAL_DIAMETER);
        Object pn = valueOf(attrs, NOMINAL_PRESSURE);

        // 1. DN → outer diameter
        LookupTable odTable = dsl.table(DN_OD_TABLE);
        if (dn != null && odTable != null) {
            List<Object> row = firstRowWithKey(odTable, 0, dn, 2);
            if (row != null && row.get(1) != null) {
                Object od = row.get(1);
                attrs.put(OUTER_DIAMETER, ParsedAttribute.of(od, AttributeSource.TABLE, "mm",
                        "公称外径Φ(mm)", "表2规定DN" + dn + "对应的公称外径d_n为" + od + "mm"));
                found.put(OUTER_DIAMETER, od);
            }
        }

        // 2. PN → pipe series
        Object series = null;
        LookupTable seriesTable = dsl.table(SERIES_TABLE);
        if (pn != null && seriesTable != null) {
            List<Object> row = firstRowWithKey(seriesTable, 0, pn, 2);
            if (row != null && row.get(1) != null) {
                series = row.get(1);
                Object coefficient = row.size() > 2 && row.get(2) != null ? row.get(2) : DEFAULT_DESIGN_COEFFICIENT;
                attrs.put(PIPE_SERIES, ParsedAttribute.of(series, AttributeSource.TABLE, "",
                        "管系列(S)", "附录B显示当设计系数C=" + coefficient + "时，PN" + pn + "对应" + series + "系列"));
                found.put(PIPE_SERIES, series);
            }
        }

        // 3. (outer diameter, series) → minimum wall thickness
        Object od = found.containsKey(OUTER_DIAMETER) ? found.get(OUTER_DIAMETER) : valueOf(attrs, OUTER_DIAMETER);
        LookupTable dimTable = dsl.table(DIMENSION_TABLE);
        if (od != null && series != null && dimTable != null) {
            int seriesCol = dimTable.columnContaining(Scalars.text(series));
            if (seriesCol >= 0) {
                List<Object> row = firstRowWithKey(dimTable, 0, od, seriesCol + 1);
                if (row != null && row.get(seriesCol) != null) {
                    Object wall = row.get(seriesCol);
                    attrs.put(MIN_WALL, ParsedAttribute.of(wall, AttributeSource.TABLE, "mm",
                            "最小壁厚(e_min)", "表1规定外径" + od + "mm且为" + series + "系列时，最小壁厚为" + wall + "mm"));
                    found.put(MIN_WALL, wall);

                    // 4. wall thickness → positive tolerance
                    Object tol = lookupTolerance(wall, dsl.table(TOLERANCE_TABLE));
                    if (tol != null) {
                        attrs.put(WALL_TOLERANCE, ParsedAttribute.of("+" + tol, AttributeSource.TABLE, "mm",
                                "壁厚偏差", "表1规定外径" + od + "mm且为" + series + "系列时，壁厚正偏差为" + tol + "mm"));
                        found.put(WALL_TOLERANCE, tol);
                    }
                }
            }
        }

        return new Derivation(attrs, found);
    }

    /**
     * Scans {@code "min-max"} range keys; the first range containing the wall
     * thickness wins. Rows whose key does not parse are skipped.
     */
    Object lookupTolerance(Object wallThickness, LookupTable table) {
        Double wall = Scalars.toDouble(wallThickness);
        if (wall == null || table == null) return null;
        for (List<Object> row : table.rowsOrEmpty()) {
            if (row == null || row.size() < 2 || row.get(0) == null) continue;
            String[] bounds = row.get(0).toString().split("-");
            if (bounds.length != 2) continue;
            Double min = Scalars.toDouble(bounds[0]);
            Double max = Scalars.toDouble(bounds[1]);
            if (min != null && max != null && min <= wall && wall <= max) {
                return row.get(1);
            }
        }
        return null;
    }

    private static List<Object> firstRowWithKey(LookupTable table, int keyCol, Object key, int minWidth) {
        for (List<Object> row : table.rowsOrEmpty()) {
            if (row != null && row.size() >= minWidth && Scalars.keyMatches(row.get(keyCol), key)) {
                return row;
            }
        }
        return null;
    }

    private static Object valueOf(Map<String, ParsedAttribute> attrs, String name) {
        ParsedAttribute a = attrs.get(name);
        return a == null ? null : a.value();
    }
}
