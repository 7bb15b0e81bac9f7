package org.broadinstitute.msa.utils.logging;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.msa.utils.Utils;

/**
 * A logger wrapper which only outputs the first warning provided to it.
 */
public final class OneShotLogger {
    @VisibleForTesting
    final Logger logger;

    private boolean hasWarned = false;

    public OneShotLogger(final Logger logger) {
        this.logger = Utils.nonNull(logger, "the logger cannot be null");
    }

    /**
     * Writes a warning only the first time it is called on this instance.
     *
     * @param message log4j message pattern, with {@code {}} placeholders for {@code params}.
     */
    public void warn(final String message, final Object... params) {
        if (!hasWarned) {
            logger.warn(message, params);
            hasWarned = true;
        }
    }

    public boolean hasWarned() {
        return hasWarned;
    }
}
