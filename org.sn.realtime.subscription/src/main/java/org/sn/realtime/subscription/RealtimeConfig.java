package org.sn.realtime.subscription;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;


/**
 * Timing constants of the subscription manager.
 *
 * @param probeInterval time between reachability probes
 * @param sweepInterval time between staleness sweeps
 * @param highPriorityStaleAfter a HIGH priority subscription with no activity for this long is stale
 * @param mediumPriorityStaleAfter a MEDIUM priority subscription with no activity for this long is stale
 * @param globalInactivityThreshold no user activity for this long triggers a reconnect of everything
 * @param foregroundGapThreshold coming back to the foreground after being away this long invalidates the whole cache
 * @param networkSettleDelay time to wait after the network comes back before reconnecting
 * @param channelErrorDelay time to wait after a channel error before reconnecting that channel, also the base of the backoff
 * @param maxReconnectDelay upper bound of the backoff between failed reconnects of one channel
 * @param reconnectJitter random fraction added to or removed from each backoff, between 0 and 1
 * @param probeFailureThreshold consecutive probe failures that mean the backend is unreachable
 * @param probeSuccessThreshold consecutive probe successes that mean the backend is reachable again
 * @param errorCountThreshold a subscription with more channel errors than this is stale
 */
public record RealtimeConfig(Duration probeInterval,
                             Duration sweepInterval,
                             Duration highPriorityStaleAfter,
                             Duration mediumPriorityStaleAfter,
                             Duration globalInactivityThreshold,
                             Duration foregroundGapThreshold,
                             Duration networkSettleDelay,
                             Duration channelErrorDelay,
                             Duration maxReconnectDelay,
                             double reconnectJitter,
                             int probeFailureThreshold,
                             int probeSuccessThreshold,
                             int errorCountThreshold) {
    public static final String PREFIX = "realtime.";

    private static final RealtimeConfig DEFAULTS = new RealtimeConfig(
            Duration.ofSeconds(60),
            Duration.ofSeconds(60),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10),
            Duration.ofMinutes(30),
            Duration.ofMinutes(2),
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            0.2,
            2,
            2,
            3);

    public RealtimeConfig {
        requirePositive(probeInterval, "probeInterval");
        requirePositive(sweepInterval, "sweepInterval");
        requirePositive(highPriorityStaleAfter, "highPriorityStaleAfter");
        requirePositive(mediumPriorityStaleAfter, "mediumPriorityStaleAfter");
        requirePositive(globalInactivityThreshold, "globalInactivityThreshold");
        requirePositive(foregroundGapThreshold, "foregroundGapThreshold");
        Objects.requireNonNull(networkSettleDelay, "networkSettleDelay");
        requirePositive(channelErrorDelay, "channelErrorDelay");
        if (maxReconnectDelay.compareTo(channelErrorDelay) < 0) {
            throw new IllegalArgumentException("maxReconnectDelay must not be less than channelErrorDelay: " + maxReconnectDelay);
        }
        if (reconnectJitter < 0 || reconnectJitter > 1) {
            throw new IllegalArgumentException("reconnectJitter must be between 0 and 1: " + reconnectJitter);
        }
        if (probeFailureThreshold < 1 || probeSuccessThreshold < 1 || errorCountThreshold < 0) {
            throw new IllegalArgumentException("invalid thresholds: probeFailureThreshold=" + probeFailureThreshold
                    + ", probeSuccessThreshold=" + probeSuccessThreshold + ", errorCountThreshold=" + errorCountThreshold);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    public static RealtimeConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Read the configuration from properties such as <code>realtime.probeInterval=PT30S</code>.
     * The property names are the names of the record components with the prefix "realtime.".
     * Durations are in ISO-8601 format. Missing properties take the default value.
     *
     * @throws IllegalArgumentException if a property cannot be parsed
     */
    public static RealtimeConfig fromProperties(Properties properties) {
        return new RealtimeConfig(
                duration(properties, "probeInterval", DEFAULTS.probeInterval),
                duration(properties, "sweepInterval", DEFAULTS.sweepInterval),
                duration(properties, "highPriorityStaleAfter", DEFAULTS.highPriorityStaleAfter),
                duration(properties, "mediumPriorityStaleAfter", DEFAULTS.mediumPriorityStaleAfter),
                duration(properties, "globalInactivityThreshold", DEFAULTS.globalInactivityThreshold),
                duration(properties, "foregroundGapThreshold", DEFAULTS.foregroundGapThreshold),
                duration(properties, "networkSettleDelay", DEFAULTS.networkSettleDelay),
                duration(properties, "channelErrorDelay", DEFAULTS.channelErrorDelay),
                duration(properties, "maxReconnectDelay", DEFAULTS.maxReconnectDelay),
                number(properties, "reconnectJitter", DEFAULTS.reconnectJitter),
                (int) number(properties, "probeFailureThreshold", DEFAULTS.probeFailureThreshold),
                (int) number(properties, "probeSuccessThreshold", DEFAULTS.probeSuccessThreshold),
                (int) number(properties, "errorCountThreshold", DEFAULTS.errorCountThreshold));
    }

    private static Duration duration(Properties properties, String name, Duration defaultValue) {
        String value = properties.getProperty(PREFIX + name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration for " + PREFIX + name + ": " + value, e);
        }
    }

    private static double number(Properties properties, String name, double defaultValue) {
        String value = properties.getProperty(PREFIX + name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for " + PREFIX + name + ": " + value, e);
        }
    }
}
