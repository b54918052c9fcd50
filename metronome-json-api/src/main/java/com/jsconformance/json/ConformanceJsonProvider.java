package com.jsconformance.json;

import com.jsconformance.ExecutorCodecs;
import com.jsconformance.classify.ExecutionResultDecoder;
import com.jsconformance.exec.RecordDecoder;
import com.jsconformance.metadata.FrontmatterParser;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for everything the runner reads or writes as JSON or YAML:
 * executor records, direct-mode results, test frontmatter and result documents.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ConformanceJsonProvider provider = ConformanceJsonProvider.getProvider();
 * ConformanceRunner runner = new ConformanceRunner(config, processes, provider.getCodecs(), listener);
 * String json = provider.getSerializer().serializeTree(runner.run(files));
 * }</pre>
 */
public interface ConformanceJsonProvider {

    /**
     * Returns the decoder for {@code RESULT} frame payloads.
     *
     * @return the record decoder
     */
    RecordDecoder getRecordDecoder();

    /**
     * Returns the decoder for the document a direct-mode executor run prints.
     *
     * @return the execution result decoder
     */
    ExecutionResultDecoder getExecutionResultDecoder();

    /**
     * Returns the parser for YAML frontmatter blocks.
     *
     * @return the frontmatter parser
     */
    FrontmatterParser getFrontmatterParser();

    ResultsSerializer getSerializer();

    ResultsDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    default ExecutorCodecs getCodecs() {
        return new ExecutorCodecs(getRecordDecoder(), getExecutionResultDecoder(), getFrontmatterParser());
    }

    /**
     * Gets the first available provider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static ConformanceJsonProvider getProvider() {
        ServiceLoader<ConformanceJsonProvider> loader = ServiceLoader.load(ConformanceJsonProvider.class);
        Iterator<ConformanceJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No ConformanceJsonProvider found on the classpath. " +
            "Add metronome-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets a provider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static ConformanceJsonProvider getProvider(String name) {
        ServiceLoader<ConformanceJsonProvider> loader = ServiceLoader.load(ConformanceJsonProvider.class);
        for (ConformanceJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No ConformanceJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<ConformanceJsonProvider> loader = ServiceLoader.load(ConformanceJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
