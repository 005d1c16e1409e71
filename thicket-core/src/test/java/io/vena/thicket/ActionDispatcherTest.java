package io.vena.thicket;

import io.vena.thicket.exceptions.ActionExecutionException;
import io.vena.thicket.exceptions.ActionNotFoundException;
import io.vena.thicket.exceptions.AuthorizationException;
import io.vena.thicket.exceptions.ValidationException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionDispatcherTest extends AbstractEntityTest {
	static final Caller ADMIN = Caller.of("alice", "admin");
	static final Caller SYSTEM = Caller.of("scheduler", "system");
	static final Caller GUEST = Caller.of("guest", "viewer");

	EntityRuntime runtime;
	EntityType userType;
	Entity user;
	ExecutorService executor;

	@BeforeEach
	void setup() {
		runtime = runtime();
		userType = userType(runtime);
		user = runtime.create(userType, values("username", "abc", "age", 30));
	}

	@AfterEach
	void shutdownExecutor() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}

	@Test
	void unknownAction_notFound() {
		ActionNotFoundException e = assertThrows(ActionNotFoundException.class, () -> user.executeAction(ADMIN, "fly", Map.of()));
		assertEquals("fly", e.action());
		assertEquals("User", e.entityType());
	}

	@Test
	void missingRole_unauthorized() {
		AuthorizationException e = assertThrows(AuthorizationException.class, () -> user.executeAction(GUEST, "activate", Map.of()));
		assertEquals("activate", e.action());
		assertEquals(Set.of("viewer"), e.callerRoles());
		assertEquals(Set.of("admin"), e.allowedRoles());
		assertEquals(false, user.get("active"));
	}

	@Test
	void anyRole_admitsAnonymous() {
		Object result = user.executeAction("summary", Map.of());
		assertEquals(Map.of("username", "abc", "age", 30), result);
	}

	@Test
	void anyOfSeveralRoles_isEnough() {
		Object result = user.executeAction(Caller.of("abc", "self"), "rename", values("username", "abcd"));
		assertEquals("abcd", result);
	}

	@Test
	void command_bumpsVersionAndRecordsCaller() {
		long before = user.version();
		user.executeAction(ADMIN, "activate", Map.of());
		assertEquals(true, user.get("active"));
		assertEquals(before + 2, user.version(), "One bump for the write, one for the command");

		List<CommandRecord> history = user.commandHistory();
		assertEquals(1, history.size());
		CommandRecord record = history.get(0);
		assertEquals("activate", record.action());
		assertEquals("alice", record.principal());
		assertEquals(Set.of("admin"), record.roles());
		assertEquals(user.version(), record.versionAfter());
		assertEquals(START, record.at());
	}

	@Test
	void command_checkedExceptionIsWrapped() {
		ActionExecutionException e = assertThrows(ActionExecutionException.class, () -> user.executeAction(ADMIN, "audit", Map.of()));
		assertThat(e.getCause(), instanceOf(IOException.class));
		assertFalse(e.partiallyApplied());
		assertTrue(user.commandHistory().isEmpty());
	}

	@Test
	void command_entityExceptionPropagatesUnchanged() {
		long before = user.version();
		ValidationException e = assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "setAge", values("age", 500)));
		assertEquals("age", e.fieldName());
		assertEquals(before, user.version());
	}

	@Test
	void query_isCachedUntilMutation() {
		user.executeAction("summary", Map.of());
		user.executeAction("summary", Map.of());
		assertEquals(1, userActions.queryInvocations.get());

		user.set("age", 31);
		Object result = user.executeAction("summary", Map.of());
		assertEquals(2, userActions.queryInvocations.get());
		assertEquals(Map.of("username", "abc", "age", 31), result);
	}

	@Test
	void query_cacheIsPerEntity() {
		Entity other = runtime.create(userType, values("username", "other"));
		user.executeAction("summary", Map.of());
		other.executeAction("summary", Map.of());
		other.set("age", 1);
		user.executeAction("summary", Map.of());
		assertEquals(2, userActions.queryInvocations.get(), "Mutating one entity doesn't invalidate another's results");
	}

	@Test
	void query_cacheKeyIncludesParams() {
		user.executeAction("summary", Map.of("x", 1));
		user.executeAction("summary", Map.of("x", 2));
		user.executeAction("summary", Map.of("x", 1));
		assertEquals(2, userActions.queryInvocations.get());
	}

	@Test
	void query_cachingCanBeDisabled() {
		EntityRuntime uncached = runtime(RuntimeSettings.builder().queryResultCaching(false).build());
		EntityType type = userType(uncached);
		Entity entity = uncached.create(type, values("username", "abc"));
		entity.executeAction("summary", Map.of());
		entity.executeAction("summary", Map.of());
		assertEquals(2, userActions.queryInvocations.get());
	}

	@Test
	void mutatingQuery_isNotCached() {
		user.executeAction("peekAndTouch", Map.of());
		user.executeAction("peekAndTouch", Map.of());
		assertEquals(2, userActions.queryInvocations.get());
		assertEquals(2, user.get("lastPeek"));
	}

	@Test
	void transition_invalidatesQueryResults() {
		user.executeAction("summary", Map.of());
		user.toValidated();
		user.executeAction("summary", Map.of());
		assertEquals(2, userActions.queryInvocations.get());
	}

	@Test
	void parameterValidation() {
		ValidationException e = assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "rename", values("username", "ab")));
		assertEquals("rename", e.actionName());
		assertEquals("username", e.fieldName());
		assertEquals("ab", e.rejectedValue());
		assertFalse(e.required());

		e = assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "rename", Map.of()));
		assertTrue(e.required());
		assertEquals("abc", user.get("username"));
	}

	@Test
	void endpoint_rejectsUndeclaredParameters() {
		ValidationException e = assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "change-role", values("role", "admin", "shoeSize", 9)));
		assertEquals("shoeSize", e.fieldName());
		assertEquals("user", user.get("role"));
	}

	@Test
	void endpoint_checksDeclaredParameters() {
		assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "change-role", values("role", "root")));
		assertThrows(ValidationException.class, () -> user.executeAction(ADMIN, "change-role", values("reason", "promotion")));
		assertEquals("admin", user.executeAction(ADMIN, "change-role", values("role", "admin", "reason", "promotion")));
		assertEquals("admin", user.get("role"));
	}

	@Test
	void nonEndpoint_ignoresUndeclaredParameters() {
		assertEquals("abcd", user.executeAction(ADMIN, "rename", values("username", "abcd", "extra", true)));
	}

	@Test
	void workflow_reportsPartialApplication() {
		long before = user.version();
		ActionExecutionException e = assertThrows(ActionExecutionException.class, () -> user.executeAction(ADMIN, "onboard", values("fail", true)));
		assertTrue(e.partiallyApplied());
		assertEquals(before, e.versionBefore());
		assertEquals(user.version(), e.versionAfter());
		assertEquals(ActionProfile.WORKFLOW, e.profile());
		assertEquals(true, e.details().get("partiallyApplied"));
		assertEquals(true, user.get("active"), "No rollback");
		assertEquals("abc", user.get("profile.displayName"));
	}

	@Test
	void workflow_failureBeforeAnyChange() {
		ActionExecutionException e = assertThrows(ActionExecutionException.class, () -> user.executeAction(ADMIN, "onboard", values("failEarly", true)));
		assertFalse(e.partiallyApplied());
		assertEquals(false, user.get("active"));
	}

	@Test
	void workflow_success() {
		assertEquals("onboarded", user.executeAction(ADMIN, "onboard", Map.of()));
	}

	@Test
	void task_withoutExecutorRunsInline() {
		assertEquals("Welcome sent to abc", user.executeAction(SYSTEM, "sendWelcome", Map.of()));
	}

	@Test
	void task_withExecutorReturnsFuture() throws Exception {
		executor = Executors.newSingleThreadExecutor();
		EntityRuntime async = runtime(RuntimeSettings.builder().taskExecutor(executor).build());
		Entity entity = async.create(userType(async), values("username", "abc"));
		Object result = entity.executeAction(SYSTEM, "sendWelcome", Map.of());
		assertThat(result, instanceOf(CompletableFuture.class));
		assertEquals("Welcome sent to abc", ((CompletableFuture<?>) result).get(10, TimeUnit.SECONDS));
	}

	@Test
	void task_deferredFailureCompletesExceptionally() {
		executor = Executors.newSingleThreadExecutor();
		EntityRuntime async = runtime(RuntimeSettings.builder().taskExecutor(executor).build());
		Entity entity = async.create(userType(async), values("username", "abc"));
		CompletableFuture<?> future = (CompletableFuture<?>) entity.executeAction(SYSTEM, "export", Map.of());
		ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
		assertThat(e.getCause(), instanceOf(ActionExecutionException.class));
		assertThat(e.getCause().getCause(), instanceOf(IOException.class));
		assertEquals(1, entity.version());
	}

	@Test
	void builderActions_dispatchLikeAnnotatedOnes() {
		EntityType counter = runtime.typeBuilder("Counter")
			.field("count", Constraints.builder().type(ValueType.INTEGER).build(), 0)
			.action(ActionSpec.builder()
				.name("increment")
				.body((entity, params) -> {
					int next = (Integer) entity.get("count") + 1;
					entity.set("count", next);
					return next;
				})
				.build())
			.build();
		Entity entity = runtime.create(counter);
		assertEquals(1, entity.executeAction("increment", Map.of()));
		assertEquals(2, entity.executeAction("increment", Map.of()));
		assertEquals(5, entity.version());
		assertEquals(2, entity.commandHistory().size());
		assertSame(Caller.anonymous().principal(), entity.commandHistory().get(0).principal());
	}

	@Test
	void voidBody_returnsNull() {
		assertNull(user.executeAction(ADMIN, "activate", Map.of()));
	}

	@Test
	@SuppressWarnings("unchecked")
	void query_cachedResultIsUnaffectedByCallerChanges() {
		Map<String, Object> first = (Map<String, Object>) user.executeAction("summary", Map.of());
		first.put("username", "mallory");
		Map<String, Object> second = (Map<String, Object>) user.executeAction("summary", Map.of());
		assertEquals(Map.of("username", "abc", "age", 30), second);
		assertEquals(1, userActions.queryInvocations.get());

		second.put("age", 99);
		assertEquals(Map.of("username", "abc", "age", 30), user.executeAction("summary", Map.of()));
		assertEquals("abc", user.get("username"));
	}

	@Test
	void restoringAnId_discardsItsQueryResults() {
		EntitySnapshot earlier = user.toSnapshot();
		user.set("username", "bobby");
		assertEquals(Map.of("username", "bobby", "age", 30), user.executeAction("summary", Map.of()));

		Entity restored = runtime.fromSnapshot(userType, earlier);
		assertEquals(Map.of("username", "abc", "age", 30), restored.executeAction("summary", Map.of()));
		assertEquals(2, userActions.queryInvocations.get());
	}

	@Test
	void importingAnId_discardsItsQueryResults() {
		CollectionBundle earlier = runtime.exportBundle(userType, List.of(user));
		user.set("username", "bobby");
		user.executeAction("summary", Map.of());

		Entity imported = runtime.importBundle(userType, earlier).get(0);
		assertEquals(user.id(), imported.id());
		assertEquals(Map.of("username", "abc", "age", 30), imported.executeAction("summary", Map.of()));
	}

	@Test
	void task_deferredErrorCompletesExceptionally() {
		executor = Executors.newSingleThreadExecutor();
		EntityRuntime async = runtime(RuntimeSettings.builder().taskExecutor(executor).build());
		EntityType jobType = async.typeBuilder("Job")
			.action(ActionSpec.builder()
				.name("explode")
				.profile(ActionProfile.TASK)
				.body((entity, params) -> {
					throw new Error("unrecoverable");
				})
				.build())
			.build();
		Entity job = async.create(jobType);
		CompletableFuture<?> future = (CompletableFuture<?>) job.executeAction("explode", Map.of());
		ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
		assertEquals(Error.class, e.getCause().getClass());
		assertEquals("unrecoverable", e.getCause().getMessage());
	}
}
