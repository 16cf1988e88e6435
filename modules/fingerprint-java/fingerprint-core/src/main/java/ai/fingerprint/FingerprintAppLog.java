/*
 * © Copyright Databand.ai, an IBM Company 2024
 */

package ai.fingerprint;

import org.slf4j.Logger;

public class FingerprintAppLog {

    public final static String LOG_PREFIX = "[[==FP==]] "; // make fingerprinting messages visible in host application logs

    private final Logger LOG;
    private final boolean verbose;

    public FingerprintAppLog(final Logger log, final boolean verbose) {
        this.LOG = log;
        this.verbose = verbose;
    }

    public FingerprintAppLog(final Logger log) {
        this(log, false);
    }

    public FingerprintAppLog withVerbose(final boolean verbose) {
        return new FingerprintAppLog(LOG, verbose);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void debug(final String msg, final Object... args) {
        LOG.debug(LOG_PREFIX + msg, args);
    }

    public void info(final String msg, final Object... args) {
        LOG.info(LOG_PREFIX + msg, args);
    }

    public void warn(final String msg, final Object... args) {
        LOG.warn(LOG_PREFIX + msg, args);
    }

    public void error(final String msg, final Object... args) {
        LOG.error(LOG_PREFIX + msg, args);
    }

    public void verbose(final String msg, final Object... args) {
        if (verbose) {
            LOG.info(LOG_PREFIX + "v " + msg, args);
        }
    }
}
