package replay.spi;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic failure hook used by test harnesses to exercise the retry and
 * classification paths without a misbehaving database.
 *
 * <p>Production code receives {@link #NONE}, which never injects anything.
 *
 * @see replay.fault.StatementFaultInjector
 */
@FunctionalInterface
public interface FaultInjector {

    /**
     * Injector that never fires.
     */
    FaultInjector NONE = (point, statements) -> Optional.empty();

    /**
     * Asks whether the attempt about to run at {@code point} must fail.
     *
     * @param point      name of the injection point
     * @param statements the statement batch of the attempt
     * @return the synthetic error to raise instead of running the batch, or empty
     */
    Optional<SQLException> inject(String point, List<String> statements);
}
