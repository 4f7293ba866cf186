package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CategoryMapping;
import com.gbskill.engine.dsl.SkillDsl;
import org.springframework.stereotype.Component;

/**
 * Copies the skill's fixed category. Missing levels become empty strings and
 * a missing primary category becomes {@value CategoryMapping#UNCATEGORIZED}.
 */
@Component
public class CategoryMapper {

    public CategoryMapping map(SkillDsl dsl) {
        CategoryMapping c = dsl.categoryMapping();
        if (c == null) {
            return CategoryMapping.uncategorized();
        }
        return new CategoryMapping(
                c.primaryCategory() != null ? c.primaryCategory() : CategoryMapping.UNCATEGORIZED,
                orEmpty(c.secondaryCategory()),
                orEmpty(c.tertiaryCategory()),
                orEmpty(c.quaternaryCategory()),
                orEmpty(c.categoryId()),
                orEmpty(c.commonName()));
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
