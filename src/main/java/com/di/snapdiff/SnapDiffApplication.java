package com.di.snapdiff;

import com.di.snapdiff.exception.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Batch entry point: starts, runs one command, exits with its code.
 */
@Slf4j
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class SnapDiffApplication {

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = SpringApplication.exit(SpringApplication.run(SnapDiffApplication.class, args));
		} catch (RuntimeException e) {
			// startup failures, e.g. an invalid routing file
			ErrorCategory category = ErrorCategory.categorize(e);
			log.error("[CLI] startup failed [{}]: {}", category.getName(), rootMessage(e));
			exitCode = category.getExitCode();
		}
		System.exit(exitCode);
	}

	private static String rootMessage(Throwable t) {
		Throwable root = t;
		while (root.getCause() != null && root.getCause() != root) {
			root = root.getCause();
		}
		return root.getMessage();
	}
}
