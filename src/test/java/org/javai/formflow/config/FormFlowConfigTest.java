package org.javai.formflow.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.javai.formflow.record.StopOnErrorSuccessPolicy;
import org.junit.jupiter.api.Test;

class FormFlowConfigTest {

	private static InputStream yaml(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void defaultsJudgeByAttemptedFieldsAndRecordHistory() {
		FormFlowConfig config = FormFlowConfig.defaults();

		assertThat(config.stopOnErrorSuccessPolicy()).isEqualTo(StopOnErrorSuccessPolicy.ATTEMPTED_FIELDS);
		assertThat(config.recordWorkflowHistory()).isTrue();
	}

	@Test
	void loadsBothKeys() {
		FormFlowConfig config = FormFlowConfig.load(yaml("""
				formflow:
				  stopOnErrorSuccessPolicy: requested_fields
				  recordWorkflowHistory: false
				"""));

		assertThat(config.stopOnErrorSuccessPolicy()).isEqualTo(StopOnErrorSuccessPolicy.REQUESTED_FIELDS);
		assertThat(config.recordWorkflowHistory()).isFalse();
	}

	@Test
	void missingSectionOrEmptyDocumentMeansDefaults() {
		assertThat(FormFlowConfig.load(yaml("other: 1\n"))).isEqualTo(FormFlowConfig.defaults());
		assertThat(FormFlowConfig.load(yaml(""))).isEqualTo(FormFlowConfig.defaults());
	}

	@Test
	void unknownPolicyIsRejected() {
		assertThatThrownBy(() -> FormFlowConfig.load(yaml("formflow:\n  stopOnErrorSuccessPolicy: sometimes\n")))
				.isInstanceOf(FormFlowConfig.ConfigurationException.class)
				.hasMessageContaining("sometimes");
	}

	@Test
	void nonMappingSectionIsRejected() {
		assertThatThrownBy(() -> FormFlowConfig.load(yaml("formflow: yes\n")))
				.isInstanceOf(FormFlowConfig.ConfigurationException.class);
	}

	@Test
	void readsClasspathResource() {
		FormFlowConfig config = FormFlowConfig.fromClasspath();

		assertThat(config.stopOnErrorSuccessPolicy()).isEqualTo(StopOnErrorSuccessPolicy.REQUESTED_FIELDS);
		assertThat(config.recordWorkflowHistory()).isTrue();
	}
}
