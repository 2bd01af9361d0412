package com.releasegate.core.analysis;

import com.releasegate.core.language.FallbackExtractor;
import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.language.LanguageRegistry;
import com.releasegate.core.model.AnalysisMode;
import com.releasegate.core.model.CodeAnalysis;
import com.releasegate.core.model.ComplexitySummary;
import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileAnalysis;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.StructuralFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs language handlers over files and merges their facts into a {@link CodeAnalysis}.
 *
 * <p>Files whose language has no registered handler go through the {@link FallbackExtractor}.
 * A failing handler never aborts the batch: the file is logged and recorded with
 * {@link AnalysisMode#FAILED} and empty facts.
 *
 * <p>{@link #analyzeFile(FileRecord)} is thread-safe as long as the registry is not
 * modified concurrently; {@link #aggregate(List)} is a pure fold over its input.
 */
public class CodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CodeAnalyzer.class);

    public static final int MAX_COMPONENTS = 100;
    public static final int MAX_DEPENDENCIES = 50;

    private final LanguageRegistry registry;
    private final FallbackExtractor fallback;

    public CodeAnalyzer(LanguageRegistry registry) {
        this(registry, new FallbackExtractor());
    }

    public CodeAnalyzer(LanguageRegistry registry, FallbackExtractor fallback) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /**
     * Analyzes a batch of files sequentially.
     *
     * @param files files to analyze
     * @return aggregated analysis
     */
    public CodeAnalysis analyze(List<FileRecord> files) {
        log.info("Analyzing {} files", files.size());
        List<FileAnalysis> analyses = new ArrayList<>(files.size());
        for (FileRecord file : files) {
            analyses.add(analyzeFile(file));
        }
        return aggregate(analyses);
    }

    /**
     * Analyzes a single file with its language handler, or the fallback extractor.
     *
     * @param file file to analyze
     * @return per-file analysis; never throws for handler failures
     */
    public FileAnalysis analyzeFile(FileRecord file) {
        Optional<LanguageHandler> handler = registry.get(file.language());
        try {
            if (handler.isEmpty()) {
                log.debug("No handler for language {}, using fallback for {}", file.language(), file.path());
                return new FileAnalysis(file, fallback.extract(file), AnalysisMode.FALLBACK);
            }
            StructuralFacts facts = handler.get().analyze(file);
            AnalysisMode mode = facts.hasComplexitySample() ? AnalysisMode.ANALYZED : AnalysisMode.PARSE_FAILED;
            log.debug("Analyzed {} with {}: {} components, complexity {}",
                file.path(), handler.get().getId(), facts.components().size(), facts.complexity());
            return new FileAnalysis(file, facts, mode);
        } catch (RuntimeException e) {
            log.warn("Failed to analyze {}: {}", file.path(), e.getMessage(), e);
            return new FileAnalysis(file, StructuralFacts.unparsed(), AnalysisMode.FAILED);
        }
    }

    /**
     * Merges per-file analyses in input order.
     *
     * <p>Components are concatenated and the first {@value #MAX_COMPONENTS} exposed; dependencies
     * are unioned, sorted and the first {@value #MAX_DEPENDENCIES} exposed. Complexity average and
     * max only consider files with a non-zero sample.
     *
     * @param analyses per-file analyses
     * @return aggregated analysis
     */
    public CodeAnalysis aggregate(List<FileAnalysis> analyses) {
        List<ComponentRecord> components = new ArrayList<>();
        int totalComponents = 0;
        Set<String> dependencies = new TreeSet<>();
        double sum = 0;
        double max = 0;
        int samples = 0;

        for (FileAnalysis analysis : analyses) {
            StructuralFacts facts = analysis.facts();
            for (ComponentRecord component : facts.components()) {
                if (components.size() < MAX_COMPONENTS) {
                    components.add(component);
                }
                totalComponents++;
            }
            dependencies.addAll(facts.dependencies());
            if (facts.hasComplexitySample()) {
                sum += facts.complexity();
                max = Math.max(max, facts.complexity());
                samples++;
            }
        }

        ComplexitySummary complexity = samples == 0
            ? ComplexitySummary.empty()
            : new ComplexitySummary(round(sum / samples), max, samples);

        List<String> exposed = dependencies.stream().limit(MAX_DEPENDENCIES).toList();
        log.debug("Aggregated {} components, {} dependencies, {} complexity samples",
            totalComponents, dependencies.size(), samples);
        return new CodeAnalysis(analyses, components, totalComponents, exposed, dependencies.size(), complexity);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
