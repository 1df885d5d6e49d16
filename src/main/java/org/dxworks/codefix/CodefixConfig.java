package org.dxworks.codefix;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codefix.rewriter.literal.LiteralType;
import org.dxworks.codefix.rewriter.literal.RewriteRule;
import org.dxworks.codefix.rewriter.literal.RuleParameter;
import org.dxworks.codefix.rewriter.substitution.TokenSubstitution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Run configuration. Read from {@code codefix-config.yml} in the working directory when present.
 * <p>
 * Out-of-range numbers fall back to their defaults; rule tables that cannot be interpreted
 * (unknown language, blank helper, duplicate parameter) are rejected.
 */
public class CodefixConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_PASSES = 8;
    private static final String DEFAULT_BACKUP_SUFFIX = ".bak";
    private static final String CONFIG_FILE_NAME = "codefix-config.yml";
    private static final List<String> DEFAULT_EXCLUDED_PATH_FRAGMENTS =
            List.of("/vendor/", "/node_modules/", "/.git/", "/static/", "/flatpickr/", "/docs/");

    private final int maxFileLines;
    private final int maxPasses;
    private final boolean dryRun;
    private final String backupSuffix;
    private final List<String> excludedPathFragments;
    private final List<LiteralType> literalTypes;
    private final List<TokenSubstitution> substitutions;

    private CodefixConfig(int maxFileLines, int maxPasses, boolean dryRun, String backupSuffix,
                          List<String> excludedPathFragments, List<LiteralType> literalTypes,
                          List<TokenSubstitution> substitutions) {
        this.maxFileLines = maxFileLines;
        this.maxPasses = maxPasses;
        this.dryRun = dryRun;
        this.backupSuffix = backupSuffix;
        this.excludedPathFragments = List.copyOf(excludedPathFragments);
        this.literalTypes = List.copyOf(literalTypes);
        this.substitutions = List.copyOf(substitutions);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getBackupSuffix() {
        return backupSuffix;
    }

    public List<String> getExcludedPathFragments() {
        return excludedPathFragments;
    }

    public List<LiteralType> getLiteralTypes() {
        return literalTypes;
    }

    public List<TokenSubstitution> getSubstitutions() {
        return substitutions;
    }

    public static CodefixConfig defaults() {
        return new CodefixConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_PASSES, false, DEFAULT_BACKUP_SUFFIX,
                DEFAULT_EXCLUDED_PATH_FRAGMENTS, List.of(), List.of());
    }

    public static CodefixConfig load() {
        Path configPath = Paths.get(CONFIG_FILE_NAME);
        if (!Files.exists(configPath)) {
            return defaults();
        }
        return load(configPath);
    }

    public static CodefixConfig load(Path configPath) {
        YamlConfig yamlConfig;
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration " + configPath + ": " + e.getMessage(), e);
        }
        if (yamlConfig == null) {
            return defaults();
        }

        int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                ? yamlConfig.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxPasses = (yamlConfig.maxPasses != null && yamlConfig.maxPasses > 0)
                ? yamlConfig.maxPasses
                : DEFAULT_MAX_PASSES;
        boolean effectiveDryRun = yamlConfig.dryRun != null && yamlConfig.dryRun;
        String effectiveBackupSuffix = (yamlConfig.backupSuffix != null && !yamlConfig.backupSuffix.isBlank())
                ? yamlConfig.backupSuffix
                : DEFAULT_BACKUP_SUFFIX;
        List<String> effectiveExcluded = yamlConfig.excludedPathFragments != null
                ? yamlConfig.excludedPathFragments
                : DEFAULT_EXCLUDED_PATH_FRAGMENTS;

        List<LiteralType> literalTypes = new ArrayList<>();
        if (yamlConfig.literals != null) {
            for (YamlLiteral literal : yamlConfig.literals) {
                literalTypes.add(toLiteralType(literal));
            }
        }

        List<TokenSubstitution> substitutions = new ArrayList<>();
        if (yamlConfig.substitutions != null) {
            for (YamlSubstitution substitution : yamlConfig.substitutions) {
                substitutions.add(new TokenSubstitution(substitution.pattern, substitution.replacement,
                        toLanguages(substitution.languages)));
            }
        }

        return new CodefixConfig(effectiveMaxFileLines, effectiveMaxPasses, effectiveDryRun, effectiveBackupSuffix,
                effectiveExcluded, literalTypes, substitutions);
    }

    public CodefixConfig withLiteralTypes(List<LiteralType> types) {
        return new CodefixConfig(maxFileLines, maxPasses, dryRun, backupSuffix, excludedPathFragments,
                types, substitutions);
    }

    public CodefixConfig withSubstitutions(List<TokenSubstitution> subs) {
        return new CodefixConfig(maxFileLines, maxPasses, dryRun, backupSuffix, excludedPathFragments,
                literalTypes, subs);
    }

    public CodefixConfig withDryRun(boolean dryRun) {
        return new CodefixConfig(maxFileLines, maxPasses, dryRun, backupSuffix, excludedPathFragments,
                literalTypes, substitutions);
    }

    private static LiteralType toLiteralType(YamlLiteral literal) {
        if (literal.marker == null || literal.marker.isBlank()) {
            throw new IllegalArgumentException("Literal entry without marker");
        }
        Language language = literal.language == null
                ? Language.GO
                : Language.fromName(literal.language)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + literal.language));

        List<RewriteRule> rules = new ArrayList<>();
        if (literal.rules != null) {
            for (YamlRule rule : literal.rules) {
                rules.add(toRule(rule));
            }
        }
        return new LiteralType(literal.marker, language, literal.receiver, rules, literal.helpers);
    }

    private static RewriteRule toRule(YamlRule rule) {
        List<RuleParameter> parameters = new ArrayList<>();
        if (rule.parameters != null) {
            for (YamlParameter p : rule.parameters) {
                parameters.add(new RuleParameter(p.field, p.defaultValue));
            }
        } else if (rule.requiredFields != null) {
            for (String field : rule.requiredFields) {
                parameters.add(RuleParameter.required(field));
            }
        }
        RewriteRule.Style style = rule.style == null
                ? RewriteRule.Style.HELPER_CALL
                : RewriteRule.Style.fromName(rule.style)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown rule style: " + rule.style));
        return new RewriteRule(style, rule.helper, parameters, rule.trailingArguments);
    }

    private static Set<Language> toLanguages(List<String> names) {
        Set<Language> languages = EnumSet.noneOf(Language.class);
        if (names == null) {
            return languages;
        }
        for (String name : names) {
            languages.add(Language.fromName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + name)));
        }
        return languages;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxPasses;
        public Boolean dryRun;
        public String backupSuffix;
        public List<String> excludedPathFragments;
        public List<YamlLiteral> literals;
        public List<YamlSubstitution> substitutions;
    }

    private static class YamlLiteral {
        public String marker;
        public String language;
        public String receiver;
        public List<YamlRule> rules;
        public LinkedHashMap<String, String> helpers;
    }

    private static class YamlRule {
        public String style;
        public String helper;
        public List<String> requiredFields;
        public List<YamlParameter> parameters;
        public List<String> trailingArguments;
    }

    private static class YamlParameter {
        public String field;
        @JsonProperty("default")
        public String defaultValue;
    }

    private static class YamlSubstitution {
        public String pattern;
        public String replacement;
        public List<String> languages;
    }
}
