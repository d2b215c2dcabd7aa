package teranet.mapdev.preprocess.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * Configuration for the datetime formatter
 *
 * Maps directly to properties in application.properties:
 * - formatter.datetime.enabled
 * - formatter.datetime.zone-id
 */
@Configuration
@ConfigurationProperties(prefix = "formatter.datetime")
@Data
public class DatetimeFormatterConfig {

    /** When false the factory hands out a pass-through formatter instead */
    private boolean enabled = true;

    /**
     * Zone used to read and write datetimes that carry no offset
     * (formatter.datetime.zone-id). Any java.time.ZoneId id, e.g. "UTC" or "Europe/Paris".
     */
    private String zoneId = "UTC";

    /**
     * @return the configured zone
     * @throws java.time.DateTimeException if zone-id is not a valid zone
     */
    public ZoneId resolveZone() {
        return ZoneId.of(zoneId);
    }
}
