package io.vena.thicket;

import io.vena.thicket.exceptions.ActionExecutionException;
import io.vena.thicket.exceptions.ActionNotFoundException;
import io.vena.thicket.exceptions.AuthorizationException;
import io.vena.thicket.exceptions.ValidationException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.thicket.util.PlainValues.deepCopy;

/**
 * Looks up, authorizes, validates and invokes actions,
 * then applies the contract of the action's {@link ActionProfile}.
 *
 * <p>
 * Exceptions from the action body propagate unchanged if they are unchecked,
 * including every {@link io.vena.thicket.exceptions.EntityException};
 * checked exceptions are wrapped in {@link ActionExecutionException}.
 * {@link ActionProfile#WORKFLOW} actions wrap every failure, so the caller
 * can tell whether the entity was partially modified.
 */
public final class ActionDispatcher {
	private final SchemaEvaluator evaluator;
	private final LruCache<QueryKey, Object> queryCache;
	private final boolean queryResultCaching;
	private final @Nullable Executor taskExecutor;

	ActionDispatcher(SchemaEvaluator evaluator, LruCache<QueryKey, Object> queryCache, boolean queryResultCaching, @Nullable Executor taskExecutor) {
		this.evaluator = evaluator;
		this.queryCache = queryCache;
		this.queryResultCaching = queryResultCaching;
		this.taskExecutor = taskExecutor;
	}

	/**
	 * @return the body's result; for a {@link ActionProfile#TASK} with an executor configured,
	 * a {@link CompletableFuture} of the body's result
	 * @throws ActionNotFoundException if the entity's type has no such action
	 * @throws AuthorizationException if the caller has none of the action's roles
	 * @throws ValidationException if a parameter is rejected or a required one is missing
	 */
	public @Nullable Object execute(Entity entity, String actionName, Caller caller, Map<String, Object> params) {
		ActionSpec action = entity.type().actions().get(actionName);
		if (action == null) {
			throw new ActionNotFoundException(actionName, entity.entityType());
		}
		if (!action.admits(caller)) {
			throw new AuthorizationException(actionName, caller.roles(), action.allowedRoles());
		}
		validateInputs(action, params);
		LOGGER.debug("Dispatching {} \"{}\" on {} for {}", action.profile(), actionName, entity, caller.principal());
		switch (action.profile()) {
			case QUERY: return executeQuery(entity, action, params);
			case COMMAND: return executeCommand(entity, action, caller, params);
			case TASK: return executeTask(entity, action, params);
			case WORKFLOW: return executeWorkflow(entity, action, params);
			default: return invokeBody(entity, action, params);
		}
	}

	private void validateInputs(ActionSpec action, Map<String, Object> params) {
		Map<String, Constraints> declared = action.inputConstraints();
		for (Map.Entry<String, Object> param: params.entrySet()) {
			Constraints constraints = declared.get(param.getKey());
			if (constraints == null) {
				if (action.profile() == ActionProfile.ENDPOINT) {
					throw ValidationException.forParameter(action.name(), param.getKey(), param.getValue(), null, "undeclared parameter");
				}
				continue;
			}
			Object value = param.getValue();
			if (value == null) {
				if (constraints.isRequired()) {
					throw ValidationException.requiredParameter(action.name(), param.getKey(), constraints);
				}
				continue;
			}
			Evaluation evaluation;
			try {
				evaluation = evaluator.evaluate(value, constraints);
			} catch (RuntimeException e) {
				ValidationException failure = ValidationException.forParameter(action.name(), param.getKey(), value, constraints, "evaluator failed: " + e.getMessage());
				failure.initCause(e);
				throw failure;
			}
			if (!evaluation.ok()) {
				throw ValidationException.forParameter(action.name(), param.getKey(), value, constraints, evaluation.detail());
			}
		}
		declared.forEach((name, constraints) -> {
			if (constraints.isRequired() && params.get(name) == null) {
				throw ValidationException.requiredParameter(action.name(), name, constraints);
			}
		});
	}

	private @Nullable Object executeQuery(Entity entity, ActionSpec action, Map<String, Object> params) {
		if (!queryResultCaching) {
			return invokeBody(entity, action, params);
		}
		QueryKey key = QueryKey.of(entity.id(), action.name(), params);
		Object cached = queryCache.get(key);
		if (cached != null) {
			LOGGER.debug("Query \"{}\" on {} served from cache", action.name(), entity);
			return deepCopy(cached);
		}
		long versionBefore = entity.version();
		Object result = invokeBody(entity, action, params);
		boolean stored = entity.locked(() -> {
			if (entity.version() == versionBefore) {
				queryCache.put(key, deepCopy(result));
				return true;
			} else {
				return false;
			}
		});
		if (!stored) {
			LOGGER.warn("Query \"{}\" changed {} from version {} to {}; result not cached", action.name(), entity, versionBefore, entity.version());
		}
		return result;
	}

	private @Nullable Object executeCommand(Entity entity, ActionSpec action, Caller caller, Map<String, Object> params) {
		Object result = invokeBody(entity, action, params);
		CommandRecord record = entity.recordCommand(action.name(), caller);
		LOGGER.info("Command \"{}\" on {} by {} {} (version {})", action.name(), entity, caller.principal(), caller.roles(), record.versionAfter());
		return result;
	}

	private Object executeTask(Entity entity, ActionSpec action, Map<String, Object> params) {
		if (taskExecutor == null) {
			return invokeBody(entity, action, params);
		}
		return CompletableFuture
			.supplyAsync(() -> invokeBody(entity, action, params), taskExecutor)
			.whenComplete((result, failure) -> {
				if (failure != null) {
					LOGGER.error("Deferred task \"{}\" on {} failed", action.name(), entity, failure);
				}
			});
	}

	private @Nullable Object executeWorkflow(Entity entity, ActionSpec action, Map<String, Object> params) {
		long versionBefore = entity.version();
		try {
			return action.body().invoke(entity, params);
		} catch (Exception e) {
			long versionAfter = entity.version();
			if (versionAfter != versionBefore) {
				LOGGER.warn("Workflow \"{}\" on {} failed after partially applying changes (version {} -> {})", action.name(), entity, versionBefore, versionAfter);
			}
			throw new ActionExecutionException(action.name(), action.profile(), versionBefore, versionAfter, e);
		}
	}

	private @Nullable Object invokeBody(Entity entity, ActionSpec action, Map<String, Object> params) {
		long versionBefore = entity.version();
		try {
			return action.body().invoke(entity, params);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new ActionExecutionException(action.name(), action.profile(), versionBefore, entity.version(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ActionDispatcher.class);
}
