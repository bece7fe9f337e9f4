package org.javai.formflow.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.formflow.core.ConnectionException;
import org.javai.formflow.core.OperationResult;
import org.javai.formflow.core.ProtocolException;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.page.ActionExecutor;
import org.javai.formflow.page.ActionName;
import org.javai.formflow.page.ActionRequest;
import org.javai.formflow.page.FieldFailure;
import org.javai.formflow.page.FieldValue;
import org.javai.formflow.page.FieldWriteRequest;
import org.javai.formflow.page.FieldWriteResult;
import org.javai.formflow.page.FieldWriter;
import org.javai.formflow.page.PageContextId;
import org.javai.formflow.page.PageResolver;
import org.javai.formflow.session.SessionRegistry;
import org.javai.formflow.workflow.WorkflowHistoryRecorder;
import org.javai.formflow.workflow.WorkflowRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class CreateRecordPipelineTest {

	private static final PageContextId PAGE = new PageContextId("s-1", "21", 1700000000000L);

	@Mock
	private PageResolver resolver;

	@Mock
	private ActionExecutor actions;

	@Mock
	private FieldWriter writer;

	private final SessionRegistry sessions = new SessionRegistry();
	private final CreateRecordPipeline pipeline;

	CreateRecordPipelineTest() {
		MockitoAnnotations.openMocks(this);
		WorkflowHistoryRecorder history = new WorkflowHistoryRecorder(new WorkflowRegistry(sessions), true);
		pipeline = new CreateRecordPipeline(resolver, actions, writer, sessions, history);
	}

	@Test
	void constructorRequiresCollaborators() {
		WorkflowHistoryRecorder history = new WorkflowHistoryRecorder(new WorkflowRegistry(sessions), true);
		assertThatThrownBy(() -> new CreateRecordPipeline(null, actions, writer, sessions, history))
				.isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> new CreateRecordPipeline(resolver, actions, null, sessions, history))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void createsRecordOnCustomerCard() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(true, PAGE, Map.of("Name", "Acme Corp"),
				true, List.of("Name"), List.of()));

		OperationResult<CreateRecordResult> result = pipeline.execute(
				CreateRecordRequest.of("21", Map.of("Name", "Acme Corp")));

		assertThat(result.isSuccess()).isTrue();
		CreateRecordResult created = result.value();
		assertThat(created.success()).isTrue();
		assertThat(created.pageId()).isEqualTo("21");
		assertThat(created.setFields()).containsExactly("Name");
		assertThat(created.pageContextId()).isEqualTo(PAGE);
		assertThat(created.record()).containsEntry("Name", "Acme Corp");
		assertThat(created.message()).isEqualTo("Successfully created new record on page 21 with 1 field(s)");
	}

	@Test
	void runsStepsInOrderWithSessionFromResolvedPage() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(true, PAGE, Map.of(), false, null, List.of()));

		pipeline.execute(CreateRecordRequest.of(21, Map.of("Name", "Acme Corp")));

		InOrder order = inOrder(resolver, actions, writer);
		order.verify(resolver).resolve("21");
		order.verify(actions).execute(new ActionRequest("21", "s-1", ActionName.NEW));
		ArgumentCaptor<FieldWriteRequest> written = ArgumentCaptor.forClass(FieldWriteRequest.class);
		order.verify(writer).write(written.capture());
		assertThat(written.getValue().pageId()).isEqualTo("21");
		assertThat(written.getValue().sessionId()).isEqualTo("s-1");
		assertThat(written.getValue().fields()).containsEntry("Name", FieldValue.of("Acme Corp"));
	}

	@Test
	void registersResolvedSessionAndPage() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(true, PAGE, Map.of(), false, null, List.of()));

		pipeline.execute(CreateRecordRequest.of("21", Map.of("Name", "Acme Corp")));

		assertThat(sessions.get("s-1")).hasValueSatisfying(s -> assertThat(s.openPages()).containsExactly(PAGE));
	}

	@Test
	void setFieldsFallsBackToRequestedNamesWhenWriterDoesNotReport() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(true, PAGE, Map.of(), false, null, List.of()));
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("Name", "Acme Corp");
		fields.put("City", "Berlin");

		CreateRecordResult created = pipeline.execute(CreateRecordRequest.of("21", fields)).value();

		assertThat(created.setFields()).containsExactly("Name", "City");
	}

	@Test
	void unreportedSetFieldsStopAtFirstFailure() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(false, PAGE, Map.of(), false, null,
				List.of(new FieldFailure("City", "unknown city"))));
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("Name", "Acme Corp");
		fields.put("City", "Atlantis");
		fields.put("Phone No.", "555-0100");

		CreateRecordResult created = pipeline.execute(CreateRecordRequest.of("21", fields)).value();

		assertThat(created.success()).isFalse();
		assertThat(created.setFields()).containsExactly("Name");
		assertThat(created.message()).isEqualTo("New record on page 21 incomplete: 1 field(s) set, 1 failed");
	}

	@Test
	void passesWriterFailuresThrough() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		FieldFailure failure = new FieldFailure("Credit Limit", "must be positive");
		when(writer.write(any())).thenReturn(new FieldWriteResult(false, PAGE, Map.of(), false,
				List.of("Name"), List.of(failure)));

		CreateRecordResult created = pipeline.execute(
				CreateRecordRequest.of("21", Map.of("Name", "Acme", "Credit Limit", -1))).value();

		assertThat(created.success()).isFalse();
		assertThat(created.failedFields()).containsExactly(failure);
	}

	@Test
	void coercesNumericPageIds() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenReturn(new FieldWriteResult(true, PAGE, Map.of(), false, null, List.of()));

		assertThat(pipeline.execute(CreateRecordRequest.of(21L, Map.of("Name", "x"))).value().pageId()).isEqualTo("21");
		assertThat(pipeline.execute(CreateRecordRequest.of(21.0, Map.of("Name", "x"))).value().pageId()).isEqualTo("21");
	}

	@Test
	void rejectsBadInputBeforeAnyRemoteCall() {
		OperationResult<CreateRecordResult> missingPage = pipeline.execute(CreateRecordRequest.of(null, Map.of("Name", "x")));
		OperationResult<CreateRecordResult> wrongType = pipeline.execute(CreateRecordRequest.of(List.of(21), Map.of("Name", "x")));
		OperationResult<CreateRecordResult> noFields = pipeline.execute(CreateRecordRequest.of("21", Map.of()));
		OperationResult<CreateRecordResult> nullFields = pipeline.execute(CreateRecordRequest.of("21", null));

		assertThat(List.of(missingPage, wrongType, noFields, nullFields)).allSatisfy(result -> {
			assertThat(result.isSuccess()).isFalse();
			assertThat(result.error()).isInstanceOf(ValidationException.class);
			assertThat(((OperationResult.Failure<CreateRecordResult>) result).step()).isEqualTo("validate");
		});
		assertThat(((ValidationException) noFields.error()).field()).isEqualTo("fields");
		verifyNoInteractions(resolver, actions, writer);
	}

	@Test
	void resolverFailureIsReturnedUnchanged() {
		ConnectionException down = new ConnectionException("socket closed");
		when(resolver.resolve("21")).thenThrow(down);

		OperationResult<CreateRecordResult> result = pipeline.execute(CreateRecordRequest.of("21", Map.of("Name", "x")));

		assertThat(result.error()).isSameAs(down);
		assertThat(((OperationResult.Failure<CreateRecordResult>) result).step()).isEqualTo("resolvePage");
		verifyNoInteractions(actions, writer);
	}

	@Test
	void newActionFailureAbortsBeforeWriting() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		ProtocolException refused = new ProtocolException("New is not allowed");
		when(actions.execute(any())).thenThrow(refused);

		OperationResult<CreateRecordResult> result = pipeline.execute(CreateRecordRequest.of("21", Map.of("Name", "x")));

		assertThat(result.error()).isSameAs(refused);
		assertThat(((OperationResult.Failure<CreateRecordResult>) result).step()).isEqualTo("newAction");
		verify(writer, never()).write(any());
	}

	@Test
	void unexpectedFaultIsNormalizedWithContext() {
		when(resolver.resolve("21")).thenReturn(PAGE);
		when(writer.write(any())).thenThrow(new IllegalStateException("form closed"));

		OperationResult<CreateRecordResult> result = pipeline.execute(CreateRecordRequest.of("21", Map.of("Name", "x")));

		assertThat(result.error())
				.isInstanceOf(ProtocolException.class)
				.hasMessage("Failed to create record: form closed")
				.hasCauseInstanceOf(IllegalStateException.class);
		assertThat(result.error().context())
				.containsEntry("pageId", "21")
				.containsEntry("fields", Map.of("Name", "x"))
				.containsEntry("error", "form closed");
		assertThat(((OperationResult.Failure<CreateRecordResult>) result).step()).isEqualTo("writeFields");
	}
}
