package work.lcod.distpack.api;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logging handle threaded through each pipeline stage. Every line is prefixed with the build cell
 * ({@code target/options}) so logs of cells running side by side stay attributable.
 */
public final class BuildLog {
    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger("work.lcod.distpack");
    private static final String QUIET_LOGGER = "work.lcod.distpack.quiet";

    private final Logger logger;
    private final String cell;

    public BuildLog(Logger logger, String cell) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.cell = cell == null ? "" : cell;
    }

    public static BuildLog forCell(String targetTriple, String buildOptions) {
        return new BuildLog(DEFAULT_LOGGER, targetTriple + "/" + buildOptions);
    }

    public static BuildLog quiet() {
        return new BuildLog(LoggerFactory.getLogger(QUIET_LOGGER), "");
    }

    /**
     * Returns a handle logging under the given stage name with the same cell prefix. Quiet handles
     * stay quiet.
     */
    public BuildLog stage(Class<?> stage) {
        if (QUIET_LOGGER.equals(logger.getName())) {
            return this;
        }
        return new BuildLog(LoggerFactory.getLogger(stage), cell);
    }

    public void debug(String format, Object... args) {
        if (logger.isDebugEnabled()) {
            logger.debug(prefix() + format, args);
        }
    }

    public void info(String format, Object... args) {
        logger.info(prefix() + format, args);
    }

    public void warn(String format, Object... args) {
        logger.warn(prefix() + format, args);
    }

    private String prefix() {
        return cell.isEmpty() ? "" : cell + "> ";
    }
}
