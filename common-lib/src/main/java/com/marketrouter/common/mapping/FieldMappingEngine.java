package com.marketrouter.common.mapping;

import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves raw provider column names to canonical field names.
 *
 * <h3>Precedence per column</h3>
 * <ol>
 *   <li>Exact match in the built-in synonym table of the data type (confidence 1.0).</li>
 *   <li>Caller-registered custom rule, highest priority first (confidence 0.9).</li>
 *   <li>Fuzzy match against the table's known source names (confidence = similarity).</li>
 *   <li>Content inference from up to 100 non-null values; lands on the data type's
 *       default field for the inferred type, or keeps the name (confidence 0.6).</li>
 * </ol>
 *
 * <p>Targets are claimed in two passes: exact and custom resolutions first (columns that
 * already carry their canonical name before renamed ones), then fuzzy and inferred ones
 * in column order. A column whose target is already claimed keeps its own
 * name and is reported as {@link MatchMethod#UNMAPPED}.
 *
 * <p>Per-column resolutions are cached by {@code (data type, column name, sample size)}.
 * Registering a custom rule clears the cache. Thread-safe.
 */
public class FieldMappingEngine {

    private static final Logger log = LoggerFactory.getLogger(FieldMappingEngine.class);

    public static final double EXACT_CONFIDENCE    = 1.0;
    public static final double CUSTOM_CONFIDENCE   = 0.9;
    public static final double INFERRED_CONFIDENCE = 0.6;

    static final double MIN_NON_NULL_RATIO = 0.8;
    static final int MAX_CACHE_ENTRIES     = 10_000;

    private final Map<DataType, List<FieldMappingRule>> customRules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ColumnMapping> cache = new ConcurrentHashMap<>();

    private final AtomicLong totalMappings   = new AtomicLong();
    private final AtomicLong exactMatches    = new AtomicLong();
    private final AtomicLong customMatches   = new AtomicLong();
    private final AtomicLong fuzzyMatches    = new AtomicLong();
    private final AtomicLong inferredMatches = new AtomicLong();
    private final AtomicLong unmapped        = new AtomicLong();
    private final AtomicLong cacheHits       = new AtomicLong();

    // ── custom rules ──────────────────────────────────────────────────────────

    public void addCustomRule(DataType dataType, FieldMappingRule rule) {
        List<FieldMappingRule> rules = customRules.computeIfAbsent(dataType, k -> new CopyOnWriteArrayList<>());
        synchronized (rules) {
            rules.add(rule);
            List<FieldMappingRule> sorted = new ArrayList<>(rules);
            sorted.sort(Comparator.comparingInt(FieldMappingRule::priority).reversed());
            rules.clear();
            rules.addAll(sorted);
        }
        cache.clear();
        log.info("MAPPING_RULE_ADDED dataType={} target={} patterns={}",
                 dataType, rule.targetField(), rule.sourcePatterns().size());
    }

    /**
     * Registers literal-name rules in the {@code target → [source names]} form.
     * The target's type comes from the built-in table, or from its name.
     */
    public void addCustomMapping(DataType dataType, Map<String, List<String>> targetToSources) {
        targetToSources.forEach((target, sources) -> {
            FieldType type = BuiltInFieldMappings.fieldType(dataType, target)
                .orElseGet(() -> FieldTypeDetector.detectFromName(target).orElse(FieldType.STRING));
            addCustomRule(dataType, FieldMappingRule.ofNames(target, sources, type));
        });
    }

    public void clearCustomRules(DataType dataType) {
        customRules.remove(dataType);
        cache.clear();
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    public MappingResult map(DataTable raw, DataType dataType) {
        List<String> columns = raw.columns();
        Map<String, ColumnMapping> resolved = new LinkedHashMap<>();
        for (String column : columns) {
            resolved.put(column, resolve(column, raw.columnValues(column), dataType));
        }

        Set<String> claimed = new HashSet<>();
        Map<String, ColumnMapping> finalMappings = new LinkedHashMap<>();
        // pass 1: exact and custom, columns already carrying their target name first
        for (boolean identity : new boolean[] {true, false}) {
            for (String column : columns) {
                ColumnMapping m = resolved.get(column);
                boolean byName = m.method() == MatchMethod.EXACT || m.method() == MatchMethod.CUSTOM;
                if (byName && m.renames() != identity && !finalMappings.containsKey(column)) {
                    finalMappings.put(column, claim(m, claimed));
                }
            }
        }
        // pass 2: fuzzy and inferred
        for (String column : columns) {
            if (!finalMappings.containsKey(column)) {
                finalMappings.put(column, claim(resolved.get(column), claimed));
            }
        }

        List<ColumnMapping> ordered = new ArrayList<>(columns.size());
        Map<String, String> renames = new LinkedHashMap<>();
        for (String column : columns) {
            ColumnMapping m = finalMappings.get(column);
            ordered.add(m);
            renames.put(column, m.targetField());
            count(m.method());
        }
        log.debug("FIELDS_MAPPED dataType={} columns={} methods={}", dataType, columns.size(),
                  ordered.stream().map(ColumnMapping::method).toList());
        return new MappingResult(raw.renameColumns(renames), dataType, ordered, false);
    }

    /**
     * Exact-match-only mapping: built-in synonyms are applied, every other column keeps
     * its name. Used when the full mapping fails validation.
     */
    public MappingResult directRename(DataTable raw, DataType dataType) {
        Set<String> claimed = new HashSet<>();
        List<ColumnMapping> ordered = new ArrayList<>();
        Map<String, String> renames = new LinkedHashMap<>();
        for (String column : raw.columns()) {
            ColumnMapping m = exact(column, dataType)
                .map(c -> claim(c, claimed))
                .orElseGet(() -> ColumnMapping.unmapped(column,
                    FieldTypeDetector.detect(column, raw.columnValues(column))));
            claimed.add(m.targetField());
            ordered.add(m);
            renames.put(column, m.targetField());
        }
        return new MappingResult(raw.renameColumns(renames), dataType, ordered, true);
    }

    /** Resolution of a single column before any cross-column claim is applied. */
    public ColumnMapping resolve(String column, List<Object> values, DataType dataType) {
        List<Object> sample = FieldTypeDetector.sample(values);
        String key = dataType.name() + '|' + column + '|' + sample.size();
        ColumnMapping cached = cache.get(key);
        if (cached != null) {
            cacheHits.incrementAndGet();
            return cached;
        }
        ColumnMapping m = exact(column, dataType)
            .or(() -> custom(column, sample, dataType))
            .or(() -> fuzzy(column, dataType))
            .orElseGet(() -> inferred(column, sample, dataType));
        if (cache.size() >= MAX_CACHE_ENTRIES) {
            cache.clear();
        }
        cache.put(key, m);
        return m;
    }

    // ── validation ────────────────────────────────────────────────────────────

    /**
     * Checks that every required field is present and that each resolved column is at
     * least {@value #MIN_NON_NULL_RATIO} non-null, with at least one parseable value when
     * its type is numeric.
     */
    public MappingValidation validate(MappingResult result) {
        DataTable data = result.data();
        List<String> missing = new ArrayList<>();
        for (String required : BuiltInFieldMappings.requiredFields(result.dataType())) {
            if (!data.hasColumn(required)) {
                missing.add(required);
            }
        }
        missing.sort(Comparator.naturalOrder());

        List<String> inconsistent = new ArrayList<>();
        if (!data.isEmpty()) {
            for (ColumnMapping m : result.columns()) {
                if (m.method() == MatchMethod.UNMAPPED) {
                    continue;
                }
                List<Object> values = data.columnValues(m.targetField());
                long nonNull = values.stream().filter(v -> !ValueParsers.isNullLike(v)).count();
                double ratio = (double) nonNull / values.size();
                boolean numericOk = !m.fieldType().isNumeric()
                    || values.stream().anyMatch(v -> ValueParsers.parseNumber(v).isPresent());
                if (ratio < MIN_NON_NULL_RATIO || !numericOk) {
                    inconsistent.add(m.targetField());
                }
            }
        }
        boolean valid = missing.isEmpty() && inconsistent.isEmpty();
        if (!valid) {
            log.warn("MAPPING_VALIDATION_FAILED dataType={} missingRequired={} inconsistent={}",
                     result.dataType(), missing, inconsistent);
        }
        return new MappingValidation(valid, missing, inconsistent);
    }

    // ── statistics ────────────────────────────────────────────────────────────

    public MappingStatistics statistics() {
        return new MappingStatistics(totalMappings.get(), exactMatches.get(), customMatches.get(),
                                     fuzzyMatches.get(), inferredMatches.get(), unmapped.get(),
                                     cacheHits.get(), cache.size());
    }

    public void clearCache() {
        cache.clear();
    }

    // ── resolution steps ──────────────────────────────────────────────────────

    private Optional<ColumnMapping> exact(String column, DataType dataType) {
        return BuiltInFieldMappings.lookup(dataType, column)
            .map(target -> new ColumnMapping(column, target, EXACT_CONFIDENCE, MatchMethod.EXACT,
                                             typeOf(dataType, target, column)));
    }

    private Optional<ColumnMapping> custom(String column, List<Object> sample, DataType dataType) {
        for (FieldMappingRule rule : customRules.getOrDefault(dataType, List.of())) {
            if (rule.matches(column) && rule.accepts(sample)) {
                FieldType type = rule.fieldType() != null ? rule.fieldType() : typeOf(dataType, rule.targetField(), column);
                return Optional.of(new ColumnMapping(column, rule.targetField(), CUSTOM_CONFIDENCE,
                                                     MatchMethod.CUSTOM, type));
            }
        }
        return Optional.empty();
    }

    private Optional<ColumnMapping> fuzzy(String column, DataType dataType) {
        Map<String, String> synonyms = BuiltInFieldMappings.synonyms(dataType);
        return FuzzyMatcher.bestMatch(column, synonyms.keySet())
            .map(match -> {
                String target = synonyms.get(match.candidate());
                return new ColumnMapping(column, target, match.similarity(), MatchMethod.FUZZY,
                                         typeOf(dataType, target, column));
            });
    }

    private ColumnMapping inferred(String column, List<Object> sample, DataType dataType) {
        FieldType type = FieldTypeDetector.detect(column, sample);
        String target = BuiltInFieldMappings.defaultTarget(dataType, type).orElse(column);
        return new ColumnMapping(column, target, INFERRED_CONFIDENCE, MatchMethod.INFERRED, type);
    }

    private static FieldType typeOf(DataType dataType, String target, String column) {
        return BuiltInFieldMappings.fieldType(dataType, target)
            .or(() -> FieldTypeDetector.detectFromName(target))
            .or(() -> FieldTypeDetector.detectFromName(column))
            .orElse(FieldType.STRING);
    }

    private static ColumnMapping claim(ColumnMapping m, Set<String> claimed) {
        if (claimed.add(m.targetField())) {
            return m;
        }
        claimed.add(m.sourceField());
        return ColumnMapping.unmapped(m.sourceField(), m.fieldType());
    }

    private void count(MatchMethod method) {
        totalMappings.incrementAndGet();
        switch (method) {
            case EXACT -> exactMatches.incrementAndGet();
            case CUSTOM -> customMatches.incrementAndGet();
            case FUZZY -> fuzzyMatches.incrementAndGet();
            case INFERRED -> inferredMatches.incrementAndGet();
            case UNMAPPED -> unmapped.incrementAndGet();
        }
    }

    /** Counts per method across every mapping so far. */
    public Map<MatchMethod, Long> methodTotals() {
        Map<MatchMethod, Long> out = new EnumMap<>(MatchMethod.class);
        out.put(MatchMethod.EXACT, exactMatches.get());
        out.put(MatchMethod.CUSTOM, customMatches.get());
        out.put(MatchMethod.FUZZY, fuzzyMatches.get());
        out.put(MatchMethod.INFERRED, inferredMatches.get());
        out.put(MatchMethod.UNMAPPED, unmapped.get());
        return out;
    }
}
