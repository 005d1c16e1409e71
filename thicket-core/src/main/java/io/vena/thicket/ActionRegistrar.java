package io.vena.thicket;

import io.vena.thicket.annotations.ActionInput;
import io.vena.thicket.annotations.EntityAction;
import io.vena.thicket.exceptions.DefinitionException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;

/**
 * Builds {@link ActionSpec}s from the {@link EntityAction} methods of a receiver object.
 *
 * <p>
 * Reflection happens once, here; dispatch goes through a {@link MethodHandle}.
 */
final class ActionRegistrar {
	static List<ActionSpec> actionsFrom(String entityType, Object receiverObject) {
		Class<?> receiverClass = receiverObject.getClass();
		List<ActionSpec> result = new ArrayList<>();
		Method[] methods = receiverClass.getDeclaredMethods();
		// getDeclaredMethods has no defined order
		Arrays.sort(methods, Comparator.comparing(Method::getName));
		for (Method method: methods) {
			EntityAction annotation = method.getAnnotation(EntityAction.class);
			if (annotation == null) {
				continue;
			}
			String actionName = annotation.name().isEmpty() ? method.getName() : annotation.name();
			if (isStatic(method.getModifiers())) {
				throw new DefinitionException(entityType, actionName, "action method cannot be static: " + method);
			} else if (isPrivate(method.getModifiers())) {
				throw new DefinitionException(entityType, actionName, "action method cannot be private: " + method);
			}
			Class<?>[] parameterTypes = method.getParameterTypes();
			if (parameterTypes.length != 2
				|| !parameterTypes[0].isAssignableFrom(Entity.class)
				|| !parameterTypes[1].isAssignableFrom(Map.class)) {
				throw new DefinitionException(entityType, actionName, "action method must take (Entity, Map<String, Object>): " + method);
			}
			method.setAccessible(true);
			MethodHandle handle;
			try {
				handle = MethodHandles.lookup().unreflect(method).bindTo(receiverObject);
			} catch (IllegalAccessException e) {
				throw new DefinitionException(entityType, actionName, "action method is not accessible", e);
			}
			result.add(ActionSpec.builder()
				.name(actionName)
				.allowedRoles(new LinkedHashSet<>(Arrays.asList(annotation.roles())))
				.inputConstraints(inputConstraints(method))
				.profile(annotation.profile())
				.description(annotation.description())
				.body(bodyFor(actionName, handle))
				.build());
		}
		if (result.isEmpty()) {
			LOGGER.warn("Found no action methods in {}; may be misconfigured", receiverClass.getSimpleName());
		} else {
			LOGGER.info("Registered {} action{} from {}", result.size(), (result.size() >= 2)? "s":"", receiverClass.getSimpleName());
		}
		return result;
	}

	private static ActionBody bodyFor(String actionName, MethodHandle handle) {
		return (entity, params) -> {
			try {
				return handle.invoke(entity, params);
			} catch (Exception | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unable to call action \"" + actionName + "\"", e);
			}
		};
	}

	private static Map<String, Constraints> inputConstraints(Method method) {
		Map<String, Constraints> result = new LinkedHashMap<>();
		for (ActionInput input: method.getAnnotationsByType(ActionInput.class)) {
			result.put(input.name(), constraintsFor(input));
		}
		return result;
	}

	static Constraints constraintsFor(ActionInput input) {
		Constraints.ConstraintsBuilder builder = Constraints.builder()
			.type(input.type())
			.required(input.required());
		if (input.minLength() >= 0) {
			builder.minLength(input.minLength());
		}
		if (input.maxLength() >= 0) {
			builder.maxLength(input.maxLength());
		}
		if (!Double.isNaN(input.minimum())) {
			builder.minimum(input.minimum());
		}
		if (!Double.isNaN(input.maximum())) {
			builder.maximum(input.maximum());
		}
		if (!input.pattern().isEmpty()) {
			builder.pattern(input.pattern());
		}
		if (input.enumValues().length != 0) {
			Set<Object> values = new LinkedHashSet<>(Arrays.asList(input.enumValues()));
			builder.enumValues(new ArrayList<>(values));
		}
		if (!input.description().isEmpty()) {
			builder.description(input.description());
		}
		return builder.build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ActionRegistrar.class);
}
