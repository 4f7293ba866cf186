package com.gbskill.engine.benchmark;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/** Human-readable business keys for cases and runs. */
final class Codes {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter SECOND = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private Codes() {}

    /** {@code GEN_20250101_1A2B3C4D}, {@code TPL_…} or {@code CASE_…}. */
    static String caseCode(String prefix) {
        return prefix + "_" + LocalDateTime.now().format(DAY) + "_" + hex(8);
    }

    /** {@code RUN_20250101120000_1A2B3C}. */
    static String runCode() {
        return "RUN_" + LocalDateTime.now().format(SECOND) + "_" + hex(6);
    }

    private static String hex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
