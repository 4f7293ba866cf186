package com.gbskill.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A reusable input pattern such as {@code "{材质}管 DN{公称直径}"} with
 * alternative wordings.
 *
 * DB table: generation_templates
 */
@Entity
@Table(name = "generation_templates")
public class GenerationTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "template_code", nullable = false, unique = true)
    private String templateCode;

    @Column(name = "template_name", nullable = false)
    private String templateName;

    private String domain;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String pattern;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private List<String> variants = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "noise_rules", columnDefinition = "json")
    private Map<String, Object> noiseRules;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected GenerationTemplate() {}   // required by JPA

    public GenerationTemplate(String templateCode, String templateName, String pattern) {
        this.templateCode = templateCode;
        this.templateName = templateName;
        this.pattern      = pattern;
    }

    public UUID                getId()           { return id; }
    public String              getTemplateCode() { return templateCode; }
    public String              getTemplateName() { return templateName; }
    public String              getDomain()       { return domain; }
    public String              getPattern()      { return pattern; }
    public List<String>        getVariants()     { return variants; }
    public Map<String, Object> getNoiseRules()   { return noiseRules; }
    public String              getDescription()  { return description; }
    public boolean             isActive()        { return active; }
    public Instant             getCreatedAt()    { return createdAt; }

    public void setDomain(String v)                  { this.domain = v; }
    public void setVariants(List<String> v)          { this.variants = v; }
    public void setNoiseRules(Map<String, Object> v) { this.noiseRules = v; }
    public void setDescription(String v)             { this.description = v; }
    public void setActive(boolean v)                 { this.active = v; }
}
