package teranet.mapdev.preprocess.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for embedding the formatters in a Spring application.
 *
 * Import this class to get the configuration properties bound and the
 * FormatterFactory / FormatterStateService beans registered.
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackages = "teranet.mapdev.preprocess")
public class FormatterConfig {
}
