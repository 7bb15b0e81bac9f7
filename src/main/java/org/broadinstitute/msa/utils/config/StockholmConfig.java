package org.broadinstitute.msa.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;
import org.broadinstitute.msa.alignment.SequenceAlphabet;
import org.broadinstitute.msa.codecs.stockholm.GsAnnotationPolicy;

/**
 * Configuration for the Stockholm reader and tools.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any source, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + StockholmConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "system:properties",
 *        3)   "file:StockholmConfig.properties",
 *        4)   "classpath:org/broadinstitute/msa/utils/config/StockholmConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + StockholmConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "system:properties",
        "file:StockholmConfig.properties",
        "classpath:org/broadinstitute/msa/utils/config/StockholmConfig.properties"
})
public interface StockholmConfig extends Mutable, Accessible {

    /**
     * Name of the variable holding the path to a configuration file, used in the {@link Sources} annotation.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "StockholmConfig.pathToConfig";

    @Key("stockholm.gs_policy")
    @DefaultValue("FIRST_LINE_ONLY")
    GsAnnotationPolicy gsPolicy();

    @Key("stockholm.default_alphabet")
    @DefaultValue("PROTEIN")
    SequenceAlphabet defaultAlphabet();

    @Key("stockholm_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean stacktraceOnUserException();
}
