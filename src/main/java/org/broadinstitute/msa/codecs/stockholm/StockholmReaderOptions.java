package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.utils.Utils;
import org.broadinstitute.msa.utils.config.ConfigFactory;

/**
 * Options for {@link StockholmReader}. Immutable; use the {@code with...} methods to derive modified copies.
 */
public final class StockholmReaderOptions {

    private final GsAnnotationPolicy gsPolicy;

    private final String sourceName;

    /**
     * Options with the configured {@link GsAnnotationPolicy} and no source name.
     */
    public StockholmReaderOptions() {
        this(ConfigFactory.getInstance().getStockholmConfig().gsPolicy(), null);
    }

    private StockholmReaderOptions(final GsAnnotationPolicy gsPolicy, final String sourceName) {
        this.gsPolicy = Utils.nonNull(gsPolicy, "the GS policy cannot be null");
        this.sourceName = sourceName;
    }

    public StockholmReaderOptions withGsPolicy(final GsAnnotationPolicy gsPolicy) {
        return new StockholmReaderOptions(gsPolicy, sourceName);
    }

    /**
     * @param sourceName name used in error messages; {@code null} to use the line reader's own name.
     */
    public StockholmReaderOptions withSourceName(final String sourceName) {
        return new StockholmReaderOptions(gsPolicy, sourceName);
    }

    public GsAnnotationPolicy getGsPolicy() {
        return gsPolicy;
    }

    /**
     * @return {@code null} if no explicit name was given.
     */
    public String getSourceName() {
        return sourceName;
    }
}
