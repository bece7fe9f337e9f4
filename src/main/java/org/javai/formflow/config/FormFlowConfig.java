package org.javai.formflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.formflow.record.StopOnErrorSuccessPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings shared by the record pipelines.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FormFlowConfig config = FormFlowConfig.defaults();
 *
 * FormFlowConfig config = FormFlowConfig.builder()
 *         .stopOnErrorSuccessPolicy(StopOnErrorSuccessPolicy.REQUESTED_FIELDS)
 *         .build();
 * }</pre>
 *
 * <p>The same keys can be supplied as YAML under a {@code formflow} root:</p>
 * <pre>
 * formflow:
 *   stopOnErrorSuccessPolicy: REQUESTED_FIELDS
 *   recordWorkflowHistory: false
 * </pre>
 *
 * @param stopOnErrorSuccessPolicy how an update's success is judged when the write stops on the first error
 * @param recordWorkflowHistory whether pipelines append to a workflow named in the request
 */
public record FormFlowConfig(
		StopOnErrorSuccessPolicy stopOnErrorSuccessPolicy,
		boolean recordWorkflowHistory
) {

	private static final Logger logger = LoggerFactory.getLogger(FormFlowConfig.class);

	public static final String DEFAULT_RESOURCE = "formflow.yml";
	static final String ROOT_KEY = "formflow";

	public FormFlowConfig {
		Objects.requireNonNull(stopOnErrorSuccessPolicy, "stopOnErrorSuccessPolicy must not be null");
	}

	public static FormFlowConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to {@link #defaults()}
	 * when it is absent.
	 */
	public static FormFlowConfig fromClasspath() {
		InputStream in = FormFlowConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.debug("No {} on classpath; using defaults", DEFAULT_RESOURCE);
			return defaults();
		}
		try (in) {
			return load(in);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Reads configuration from YAML. Missing keys keep their defaults.
	 *
	 * @throws ConfigurationException if the document is malformed or names an unknown policy
	 */
	public static FormFlowConfig load(InputStream inputStream) {
		Object document;
		try {
			document = new Yaml().load(inputStream);
		} catch (RuntimeException e) {
			throw new ConfigurationException("Failed to parse configuration", e);
		}
		Builder builder = builder();
		if (document == null) {
			return builder.build();
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw new ConfigurationException("Expected a mapping at the document root", null);
		}
		Object sectionNode = root.get(ROOT_KEY);
		if (sectionNode == null) {
			return builder.build();
		}
		if (!(sectionNode instanceof Map<?, ?> section)) {
			throw new ConfigurationException("Expected '" + ROOT_KEY + "' to be a mapping", null);
		}

		Object policy = section.get("stopOnErrorSuccessPolicy");
		if (policy != null) {
			try {
				builder.stopOnErrorSuccessPolicy(
						StopOnErrorSuccessPolicy.valueOf(policy.toString().trim().toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException e) {
				throw new ConfigurationException("Unknown stopOnErrorSuccessPolicy: " + policy, e);
			}
		}
		Object recordHistory = section.get("recordWorkflowHistory");
		if (recordHistory != null) {
			builder.recordWorkflowHistory(Boolean.parseBoolean(recordHistory.toString()));
		}
		return builder.build();
	}

	public static class Builder {
		private StopOnErrorSuccessPolicy stopOnErrorSuccessPolicy = StopOnErrorSuccessPolicy.ATTEMPTED_FIELDS;
		private boolean recordWorkflowHistory = true;

		private Builder() {}

		public Builder stopOnErrorSuccessPolicy(StopOnErrorSuccessPolicy policy) {
			this.stopOnErrorSuccessPolicy = policy;
			return this;
		}

		public Builder recordWorkflowHistory(boolean recordWorkflowHistory) {
			this.recordWorkflowHistory = recordWorkflowHistory;
			return this;
		}

		public FormFlowConfig build() {
			return new FormFlowConfig(stopOnErrorSuccessPolicy, recordWorkflowHistory);
		}
	}

	/**
	 * Raised when configuration cannot be read.
	 */
	public static class ConfigurationException extends RuntimeException {
		public ConfigurationException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
