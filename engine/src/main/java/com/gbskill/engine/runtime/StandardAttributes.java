package com.gbskill.engine.runtime;

/**
 * Attribute names the engines give special meaning to. They are the names
 * used by the pipe standards the DSL compiler targets.
 */
public final class StandardAttributes {

    public static final String MATERIAL        = "材质";
    public static final String NOMINAL_DIAMETER = "公称直径";
    public static final String NOMINAL_PRESSURE = "公称压力";
    public static final String OUTER_DIAMETER  = "公称外径";
    public static final String PIPE_SERIES     = "管系列";
    public static final String MIN_WALL        = "最小壁厚";
    public static final String WALL_TOLERANCE  = "壁厚偏差";
    public static final String WALL_THICKNESS  = "壁厚";
    public static final String FITTING_MATERIAL = "管件材质";

    public static final String DN_OD_TABLE        = "dn_outer_diameter_map";
    public static final String SERIES_TABLE       = "series_mapping";
    public static final String DIMENSION_TABLE    = "dimension_table";
    public static final String TOLERANCE_TABLE    = "wall_thickness_tolerance";

    private StandardAttributes() {}
}
